package io.vidsort4j.config;

import io.vidsort4j.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the pipeline's poller with the Spring container and drains it on shutdown.
 *
 * <p>With {@code vidsort.auto-start=false} the pipeline stays idle and the application drives it through
 * {@link Pipeline#processDueJobs()}.
 */
public class PipelineLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(PipelineLifecycle.class);

    private final Pipeline pipeline;
    private final boolean autoStartup;
    private volatile boolean running = false;

    public PipelineLifecycle(Pipeline pipeline, boolean autoStartup) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.autoStartup = autoStartup;
    }

    @Override
    public void start() {
        pipeline.start();
        running = true;
    }

    @Override
    public void stop() {
        pipeline.stop();
        running = false;
    }

    /**
     * Draining waits for in-flight jobs, so it runs off the shutdown thread.
     */
    @Override
    public void stop(Runnable callback) {
        Thread t = new Thread(() -> {
            try {
                stop();
            } catch (RuntimeException e) {
                log.error("vidsort pipeline stop failed msg={}", e.getMessage(), e);
            } finally {
                callback.run();
            }
        }, "vidsort.shutdown");
        t.setDaemon(true);
        t.start();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStartup;
    }
}
