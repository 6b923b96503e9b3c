package io.vidsort4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.vidsort4j.core.Category;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.ErrorKind;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobError;
import io.vidsort4j.core.JobPatch;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.Priority;
import io.vidsort4j.core.ScoredTag;
import io.vidsort4j.core.SourceMetadata;
import io.vidsort4j.core.Tag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoJobStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    // Mongo keeps millisecond precision
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00.123Z");
    private static final Duration LEASE = Duration.ofMinutes(5);

    private MongoTemplate mongoTemplate;
    private MongoJobStore jobStore;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "vidsort4j_test");
        mongoTemplate.dropCollection(JobDocument.class);
        jobStore = new MongoJobStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(JobDocument.class);
    }

    @Test
    void ingestShouldCreateOnceAndNeverResetAnExistingJob() {
        IngestResult first = jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");

        IngestResult second = jobStore.ingest(url(1), Platform.TWITTER, Priority.URGENT, NOW.plusSeconds(60));

        assertTrue(first.created());
        assertFalse(second.created());
        assertEquals(JobStatus.FETCHING, second.status());
        Job job = jobStore.find(url(1)).orElseThrow();
        assertEquals(Priority.NORMAL, job.priority());
        assertEquals(NOW, job.createdAt());
        assertEquals(1, job.attempts());
    }

    @Test
    void claimShouldPreferUrgentThenEarliestDue() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW.minusSeconds(30));
        jobStore.ingest(url(2), Platform.TWITTER, Priority.NORMAL, NOW.minusSeconds(60));
        jobStore.ingest(url(3), Platform.YOUTUBE, Priority.URGENT, NOW.minusSeconds(10));
        jobStore.ingest(url(4), Platform.YOUTUBE, Priority.URGENT, NOW.plusSeconds(10));

        List<Job> claimed = jobStore.claimDue(NOW, 10, LEASE, "worker-A");

        assertEquals(List.of(url(3), url(2), url(1)), claimed.stream().map(Job::url).toList());
        Job first = claimed.get(0);
        assertEquals(JobStatus.FETCHING, first.status());
        assertEquals("worker-A", first.lockedBy());
        assertEquals(NOW.plus(LEASE), first.lockUntil());
        assertEquals(NOW, first.lastAttemptAt());
        assertTrue(jobStore.claimDue(NOW, 10, LEASE, "worker-B").isEmpty());
    }

    @Test
    void concurrentWorkersShouldNeverClaimTheSameJob() throws Exception {
        for (int i = 0; i < 30; i++) {
            jobStore.ingest(url(i), Platform.TWITTER, Priority.NORMAL, NOW);
        }
        ExecutorService pool = Executors.newFixedThreadPool(4);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int w = 0; w < 4; w++) {
                String worker = "worker-" + w;
                results.add(pool.submit(() -> {
                    go.await();
                    int n = 0;
                    List<Job> batch;
                    while (!(batch = jobStore.claimDue(NOW, 3, LEASE, worker)).isEmpty()) {
                        for (Job j : batch) {
                            assertTrue(seen.add(j.url()), "claimed twice: " + j.url());
                            n++;
                        }
                    }
                    return n;
                }));
            }
            go.countDown();
            int total = 0;
            for (Future<Integer> f : results) {
                total += f.get(30, TimeUnit.SECONDS);
            }
            assertEquals(30, total);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void expiredClaimShouldBeReclaimedAndStaleWriteRejected() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");
        MediaAsset media = new MediaAsset("/media/1.mp4", 12.0, 640, 360, true, null);
        assertTrue(jobStore.advance(url(1), "worker-A", JobStatus.FETCHING, JobStatus.DEDUP_CHECKING,
                JobPatch.media(media), NOW));
        assertTrue(jobStore.claimDue(NOW.plusSeconds(60), 1, LEASE, "worker-B").isEmpty());

        Instant later = NOW.plus(LEASE).plusSeconds(1);
        List<Job> reclaimed = jobStore.claimDue(later, 1, LEASE, "worker-B");

        assertEquals(1, reclaimed.size());
        assertEquals(2, reclaimed.get(0).attempts());
        assertEquals("/media/1.mp4", reclaimed.get(0).mediaPath());
        assertFalse(jobStore.advance(url(1), "worker-A", JobStatus.DEDUP_CHECKING, JobStatus.EXTRACTING,
                JobPatch.none(), later));
        assertTrue(jobStore.advance(url(1), "worker-B", JobStatus.FETCHING, JobStatus.DEDUP_CHECKING,
                JobPatch.none(), later));
    }

    @Test
    void repeatedlyExpiredLeaseShouldFailOnceAttemptsAreExhausted() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        Instant at = NOW;
        for (int attempt = 1; attempt <= 2; attempt++) {
            List<Job> claimed = jobStore.claimDue(at, 1, LEASE, "worker-" + attempt, 2);
            assertEquals(url(1), claimed.get(0).url());
            assertEquals(attempt, claimed.get(0).attempts());
            at = at.plus(LEASE).plusSeconds(1);
        }
        jobStore.ingest(url(2), Platform.TWITTER, Priority.NORMAL, at);

        List<Job> next = jobStore.claimDue(at, 5, LEASE, "worker-3", 2);

        assertEquals(1, next.size());
        assertEquals(url(2), next.get(0).url());
        Job failed = jobStore.find(url(1)).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(ErrorKind.INTERNAL, failed.lastError().kind());
        assertTrue(failed.lastError().message().contains("attempts exhausted"));
        assertNull(failed.lockedBy());
        assertNull(failed.lockUntil());
    }

    @Test
    void fetchedSourceMetadataShouldSurviveLaterTransitions() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");
        MediaAsset media = new MediaAsset("/media/1.mp4", 12.0, 640, 360, true, null);
        SourceMetadata source = new SourceMetadata("Night shelling", url(1), "someone",
                Instant.parse("2026-02-28T00:00:00Z"));

        assertTrue(jobStore.advance(url(1), "worker-A", JobStatus.FETCHING, JobStatus.DEDUP_CHECKING,
                JobPatch.fetched(media, source), NOW));
        assertTrue(jobStore.advance(url(1), "worker-A", JobStatus.DEDUP_CHECKING, JobStatus.EXTRACTING,
                JobPatch.media(media.withPerceptualHash("00ff00ff00ff00ff")), NOW));

        Job job = jobStore.find(url(1)).orElseThrow();
        assertEquals(source, job.source());
        assertEquals("00ff00ff00ff00ff", job.contentHash());
    }

    @Test
    void completedJobShouldKeepItsClassification() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");
        MediaAsset media = new MediaAsset("/media/1.mp4", 12.0, 640, 360, true, "00ff00ff00ff00ff");
        jobStore.advance(url(1), "worker-A", JobStatus.FETCHING, JobStatus.DEDUP_CHECKING, JobPatch.media(media), NOW);
        jobStore.advance(url(1), "worker-A", JobStatus.DEDUP_CHECKING, JobStatus.EXTRACTING, JobPatch.none(), NOW);
        jobStore.advance(url(1), "worker-A", JobStatus.EXTRACTING, JobStatus.FUSING, JobPatch.none(), NOW);
        Classification result = new Classification(
                Category.WILLFUL_KILLING,
                Map.of(Category.WILLFUL_KILLING, 0.84, Category.DISPLACEMENT, 0.2),
                List.of(new ScoredTag(Tag.CHILDREN, 0.6, Set.of(EvidenceSource.AUDIO, EvidenceSource.OCR),
                        List.of("a child was killed"), List.of(2, 4), null)),
                0.84, false, null, List.of());

        assertTrue(jobStore.advance(url(1), "worker-A", JobStatus.FUSING, JobStatus.COMPLETED,
                JobPatch.result(result), NOW));

        Job job = jobStore.find(url(1)).orElseThrow();
        assertEquals(JobStatus.COMPLETED, job.status());
        assertNull(job.lockedBy());
        assertNull(job.lockUntil());
        assertEquals("00ff00ff00ff00ff", job.contentHash());
        assertEquals(result, job.result());
        assertEquals(List.of(url(1)), jobStore.findByStatus(JobStatus.COMPLETED).stream().map(Job::url).toList());
        assertEquals(0L, jobStore.countIncomplete());
    }

    @Test
    void retryShouldReleaseTheClaimAndDelayTheNextAttempt() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");
        JobError error = JobError.of(ErrorKind.RATE_LIMITED, "HTTP Error 429", NOW);

        assertTrue(jobStore.advance(url(1), "worker-A", JobStatus.FETCHING, JobStatus.PENDING,
                JobPatch.retryAt(error, NOW.plusSeconds(20)), NOW));

        Job job = jobStore.find(url(1)).orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(error, job.lastError());
        assertNull(job.lockedBy());
        assertTrue(jobStore.claimDue(NOW.plusSeconds(19), 1, LEASE, "worker-A").isEmpty());
        assertEquals(1, jobStore.claimDue(NOW.plusSeconds(20), 1, LEASE, "worker-A").size());
    }

    @Test
    void cancelShouldFailPendingJobsAndFlagClaimedOnes() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.ingest(url(2), Platform.TWITTER, Priority.NORMAL, NOW.plusSeconds(1));
        jobStore.claimDue(NOW.plusSeconds(1), 1, LEASE, "worker-A");

        assertTrue(jobStore.requestCancel(url(2), NOW.plusSeconds(2)));
        assertTrue(jobStore.requestCancel(url(1), NOW.plusSeconds(2)));
        assertFalse(jobStore.requestCancel(url(2), NOW.plusSeconds(3)));
        assertFalse(jobStore.requestCancel(url(9), NOW.plusSeconds(3)));

        Job pending = jobStore.find(url(2)).orElseThrow();
        assertEquals(JobStatus.FAILED, pending.status());
        assertEquals(ErrorKind.CANCELLED, pending.lastError().kind());

        Job claimed = jobStore.find(url(1)).orElseThrow();
        assertEquals(JobStatus.FETCHING, claimed.status());
        assertTrue(jobStore.isCancelRequested(url(1)));
    }

    @Test
    void summaryAndResumableShouldReflectStoredState() {
        jobStore.ingest(url(1), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.ingest(url(2), Platform.TWITTER, Priority.NORMAL, NOW);
        jobStore.ingest(url(3), Platform.TWITTER, Priority.NORMAL, NOW.plusSeconds(600));
        jobStore.claimDue(NOW, 1, LEASE, "worker-A");

        Map<JobStatus, Long> counts = jobStore.countByStatus();
        assertEquals(2L, counts.get(JobStatus.PENDING));
        assertEquals(1L, counts.get(JobStatus.FETCHING));
        assertEquals(0L, counts.get(JobStatus.COMPLETED));
        assertEquals(3L, jobStore.countIncomplete());

        assertEquals(1, jobStore.findResumable(NOW).size());
        List<Job> afterLease = jobStore.findResumable(NOW.plus(LEASE));
        assertEquals(2, afterLease.size());
        assertNotNull(afterLease.get(0).url());
    }

    private static String url(int n) {
        return "https://x.com/someone/status/" + n;
    }
}
