package io.vidsort4j.internal;

import io.vidsort4j.Pipeline;
import io.vidsort4j.config.PipelineProperties;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.IngestReport;
import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.Priority;
import io.vidsort4j.store.JobStore;
import io.vidsort4j.utils.PlatformDetector;
import io.vidsort4j.utils.UrlListParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded-concurrency pipeline over a {@link JobStore}.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Idempotent URL ingestion (one job per URL, re-ingest never reprocesses)</li>
 *   <li>A poller that claims due jobs while worker permits are free</li>
 *   <li>Crash recovery: an in-flight job whose lease expired is claimed again and resumes from what was persisted</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * pipeline.start();
 * pipeline.ingest("https://x.com/someone/status/123", Priority.URGENT);
 * pipeline.ingestAll(Files.newBufferedReader(Path.of("urls.txt")));
 * pipeline.awaitIdle(Duration.ofHours(1));
 * pipeline.export();
 * pipeline.stop();
 * }</pre>
 */
public class DefaultPipeline implements Pipeline {
    private static final Logger log = LoggerFactory.getLogger(DefaultPipeline.class);

    private final PipelineProperties props;
    private final JobStore jobStore;
    private final JobRunner runner;
    private final Clock clock;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore globalSem;
    private final Semaphore refillSignal = new Semaphore(0);

    private ExecutorService workerPool;
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public DefaultPipeline(PipelineProperties props, JobStore jobStore, JobRunner runner, Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("vidsort.maxConcurrency must be a positive number");
        }
        this.globalSem = new Semaphore(props.getMaxConcurrency());
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start polling and executing due jobs. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration interval = Objects.requireNonNull(props.getProcessEvery(), "vidsort.processEvery must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("vidsort.processEvery must be a positive duration");
        }
        Duration claimLifetime = Objects.requireNonNull(props.getClaimLifetime(), "vidsort.claimLifetime must not be null");
        if (claimLifetime.isZero() || claimLifetime.isNegative()) {
            throw new IllegalArgumentException("vidsort.claimLifetime must be a positive duration");
        }

        log.info("vidsort pipeline starting with processEvery={}, claimLifetime={}, workerId={}, maxConcurrency={}, batchSize={}",
                props.getProcessEvery(),
                props.getClaimLifetime(),
                workerId,
                props.getMaxConcurrency(),
                props.getBatchSize());

        List<Job> resumable = jobStore.findResumable(now());
        if (!resumable.isEmpty()) {
            log.info("vidsort pipeline resuming jobs count={}", resumable.size());
        }

        if (workerPool == null) {
            workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                Thread t = new Thread(r);
                t.setName("vidsort.worker");
                t.setDaemon(true);
                return t;
            });
        }

        if (pollerThread == null) {
            pollerThread = new Thread(this::pollerLoop);
            pollerThread.setName("vidsort.poller");
            pollerThread.setDaemon(true);
            pollerThread.start();
        }
        log.info("vidsort pipeline started successfully.");
    }

    /**
     * Stop polling and executing. Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("vidsort pipeline stopping...");

        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }

        if (workerPool != null) {
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(props.getClaimLifetime().toSeconds(), TimeUnit.SECONDS)) {
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerPool.shutdownNow();
            } finally {
                workerPool = null;
            }
        }

        refillSignal.drainPermits();
        log.info("vidsort pipeline stopped successfully.");
    }

    @Override
    public IngestResult ingest(String url) {
        return ingest(url, Priority.NORMAL);
    }

    @Override
    public IngestResult ingest(String url, Priority priority) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        Objects.requireNonNull(priority, "priority must not be null");
        String normalized = url.trim();
        Platform platform = PlatformDetector.detect(normalized);

        IngestResult result = jobStore.ingest(normalized, platform, priority, now());
        if (result.created()) {
            log.debug("vidsort job ingested url={} platform={} priority={}", normalized, platform, priority);
            refillSignal.release();
        } else {
            log.debug("vidsort job already known url={} status={}", normalized, result.status());
        }
        return result;
    }

    @Override
    public IngestReport ingestAll(Reader lines) throws IOException {
        Objects.requireNonNull(lines, "lines must not be null");
        UrlListParser.Result parsed = UrlListParser.parse(lines);
        int created = 0;
        int existing = 0;
        for (UrlListParser.UrlEntry entry : parsed.entries()) {
            if (ingest(entry.url(), entry.priority()).created()) {
                created++;
            } else {
                existing++;
            }
        }
        for (String rejected : parsed.rejected()) {
            log.warn("vidsort url list entry rejected {}", rejected);
        }
        log.info("vidsort url list ingested created={} existing={} rejected={}", created, existing, parsed.rejected().size());
        return new IngestReport(created, existing, parsed.rejected());
    }

    @Override
    public boolean cancel(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        boolean accepted = jobStore.requestCancel(url.trim(), now());
        log.info("vidsort cancel requested url={} accepted={}", url, accepted);
        return accepted;
    }

    @Override
    public Optional<Job> job(String url) {
        return url == null ? Optional.empty() : jobStore.find(url.trim());
    }

    @Override
    public Optional<Classification> result(String url) {
        return job(url).map(Job::result);
    }

    @Override
    public Map<JobStatus, Long> summary() {
        return jobStore.countByStatus();
    }

    @Override
    public List<Job> export() {
        List<Job> out = new ArrayList<>();
        for (JobStatus s : JobStatus.terminal()) {
            out.addAll(jobStore.findByStatus(s));
        }
        return out;
    }

    @Override
    public int processDueJobs() {
        int processed = 0;
        int batchSize = Math.max(1, props.getBatchSize());
        while (true) {
            List<Job> jobs = jobStore.claimDue(now(), batchSize, props.getClaimLifetime(), workerId, maxAttempts());
            if (jobs.isEmpty()) {
                return processed;
            }
            for (Job job : jobs) {
                runSafely(job);
                processed++;
            }
        }
    }

    @Override
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pause = Math.max(50L, Math.min(1000L, props.getProcessEvery().toMillis()));
        while (jobStore.countIncomplete() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(pause);
        }
        return true;
    }

    public String workerId() {
        return workerId;
    }

    protected Instant now() {
        return clock.instant();
    }

    // expired leases count against the same cap as failed attempts
    private int maxAttempts() {
        return props.getRetry().getMaxAttempts();
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "vidsort4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (java.io.IOException e) {
            log.debug("vidsort host name unavailable msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    private void pollerLoop() {
        while (started.get()) {
            boolean backlog;
            try {
                backlog = pollOnce();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("vidsort pollOnce failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= 30) {
                    log.error("vidsort pipeline stopped due to repeated system failures...");
                    Thread stopper = new Thread(this::stop, "vidsort.stopper");
                    stopper.setDaemon(true);
                    stopper.start();
                    break;
                }

                try {
                    Duration sleep = (systemErrorCount >= 10)
                            ? Duration.ofSeconds(60)
                            : backoff(systemErrorCount);

                    Thread.sleep(sleep.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (backlog) {
                    refillSignal.tryAcquire(200, TimeUnit.MILLISECONDS);
                } else {
                    // woken early by ingest() or a finished worker
                    refillSignal.tryAcquire(props.getProcessEvery().toMillis(), TimeUnit.MILLISECONDS);
                }
                refillSignal.drainPermits();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    /**
     * Claims as many due jobs as there are free worker permits.
     *
     * @return true when every permit got a job, i.e. more work is probably waiting
     */
    private boolean pollOnce() {
        int free = globalSem.availablePermits();
        if (free == 0) {
            return true;
        }
        int take = Math.min(Math.max(1, props.getBatchSize()), free);

        List<Job> jobs = jobStore.claimDue(now(), take, props.getClaimLifetime(), workerId, maxAttempts());
        log.debug("vidsort polled jobs count={} take={} free={}", jobs.size(), take, free);

        for (Job job : jobs) {
            submitToWorker(job);
        }
        return jobs.size() == take;
    }

    private void submitToWorker(Job job) {
        globalSem.acquireUninterruptibly();
        try {
            workerPool.submit(() -> {
                try {
                    runSafely(job);
                } finally {
                    globalSem.release();
                    refillSignal.release();
                }
            });
        } catch (RuntimeException e) {
            globalSem.release();
            throw e;
        }
    }

    private void runSafely(Job job) {
        try {
            runner.run(job, workerId);
        } catch (Exception e) {
            // the claim expires and the job is picked up again
            log.error("vidsort job attempt aborted url={} msg={}", job.url(), e.getMessage(), e);
        }
    }
}
