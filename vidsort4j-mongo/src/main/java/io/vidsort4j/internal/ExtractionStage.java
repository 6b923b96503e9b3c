package io.vidsort4j.internal;

import io.vidsort4j.core.EvidenceFragment;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.ExtractionException;
import io.vidsort4j.extract.SignalExtractor;
import io.vidsort4j.extract.VisionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the extractors of one job.
 *
 * <p>Text extractors (transcript, on-screen text) run concurrently; the visual description runs after
 * them when the {@link VisionPolicy} allows it, since the policy looks at the text evidence. A failing
 * extractor never aborts the others.
 */
public class ExtractionStage implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExtractionStage.class);

    private final List<SignalExtractor> textExtractors;
    private final SignalExtractor visionExtractor;
    private final VisionPolicy visionPolicy;
    private final Duration timeout;
    private final ExecutorService executor;

    /**
     * @param visionExtractor nullable; without one the policy is ignored
     * @param timeout         wall-clock limit per extractor group
     */
    public ExtractionStage(List<SignalExtractor> textExtractors, SignalExtractor visionExtractor,
                           VisionPolicy visionPolicy, Duration timeout) {
        this.textExtractors = List.copyOf(Objects.requireNonNull(textExtractors, "textExtractors must not be null"));
        this.visionExtractor = visionExtractor;
        this.visionPolicy = Objects.requireNonNull(visionPolicy, "visionPolicy must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName("vidsort.extractor");
            t.setDaemon(true);
            return t;
        });
    }

    ExtractionOutcome run(Job job, MediaAsset media) throws InterruptedException {
        List<EvidenceFragment> fragments = new ArrayList<>();
        Set<EvidenceSource> expected = EnumSet.noneOf(EvidenceSource.class);
        Set<EvidenceSource> required = EnumSet.noneOf(EvidenceSource.class);
        Map<EvidenceSource, ExtractionException> failures = new EnumMap<>(EvidenceSource.class);

        runGroup(textExtractors, media, fragments, expected, required, failures);

        if (visionExtractor != null && visionPolicy.shouldDescribe(job, fragments)) {
            runGroup(List.of(visionExtractor), media, fragments, expected, required, failures);
        }

        boolean allTransient = !expected.isEmpty()
                && failures.size() == expected.size()
                && failures.values().stream().allMatch(ExtractionException::isTransient);

        log.debug("vidsort extraction finished url={} fragments={} expected={} failed={}",
                job.url(), fragments.size(), expected, failures.keySet());
        return new ExtractionOutcome(fragments, expected, required, failures, allTransient);
    }

    private void runGroup(List<SignalExtractor> extractors, MediaAsset media, List<EvidenceFragment> fragments,
                          Set<EvidenceSource> expected, Set<EvidenceSource> required,
                          Map<EvidenceSource, ExtractionException> failures) throws InterruptedException {
        Map<SignalExtractor, Future<List<EvidenceFragment>>> futures = new LinkedHashMap<>();
        for (SignalExtractor e : extractors) {
            expected.add(e.source());
            if (e.required()) {
                required.add(e.source());
            }
            futures.put(e, executor.submit(() -> e.extract(media)));
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (Map.Entry<SignalExtractor, Future<List<EvidenceFragment>>> entry : futures.entrySet()) {
                EvidenceSource source = entry.getKey().source();
                Future<List<EvidenceFragment>> future = entry.getValue();
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    List<EvidenceFragment> produced = future.get(remaining, TimeUnit.NANOSECONDS);
                    if (produced != null) {
                        fragments.addAll(produced);
                    }
                } catch (ExecutionException ex) {
                    ExtractionException failure = asExtractionFailure(source, ex.getCause());
                    failures.put(source, failure);
                    log.warn("vidsort extractor failed source={} media={} transient={} msg={}",
                            source, media.path(), failure.isTransient(), failure.getMessage());
                } catch (TimeoutException ex) {
                    future.cancel(true);
                    failures.put(source, ExtractionException.transientFailure(
                            source + " extractor timed out after " + timeout, ex));
                    log.warn("vidsort extractor timed out source={} media={} timeout={}", source, media.path(), timeout);
                }
            }
        } catch (InterruptedException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw e;
        }
    }

    private static ExtractionException asExtractionFailure(EvidenceSource source, Throwable cause) {
        if (cause instanceof ExtractionException ee) {
            return ee;
        }
        log.error("vidsort extractor crashed source={} msg={}", source, cause == null ? null : cause.getMessage(), cause);
        return ExtractionException.transientFailure(source + " extractor crashed: "
                + (cause == null ? "unknown" : cause.getMessage()), cause);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
