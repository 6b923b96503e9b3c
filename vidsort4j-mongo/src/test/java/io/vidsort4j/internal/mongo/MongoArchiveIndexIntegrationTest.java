package io.vidsort4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.vidsort4j.core.EvidenceSource;
import io.vidsort4j.store.DedupSettings;
import io.vidsort4j.store.ProposedTag;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoArchiveIndexIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoArchiveIndex archive;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "vidsort4j_test");
        dropAll();
        archive = new MongoArchiveIndex(mongoTemplate, DedupSettings.DEFAULTS, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void reencodedCopyShouldMatchTheOriginal() {
        assertTrue(archive.checkAndInsert("https://x.com/a/status/1", "f0f0f0f0f0f0f0f0", 30.0, 1280, 720).isEmpty());

        // 3 bits flipped, re-encoded at a lower resolution
        Optional<String> match = archive.checkAndInsert("https://x.com/b/status/2", "f0f0f0f0f0f0f0f7", 30.4, 640, 360);

        assertEquals(Optional.of("https://x.com/a/status/1"), match);
        assertEquals(1L, archive.size());
    }

    @Test
    void differentDurationOrDistantHashShouldNotMatch() {
        archive.insert("https://x.com/a/status/1", "f0f0f0f0f0f0f0f0", 30.0, 1280, 720);

        assertTrue(archive.lookup("f0f0f0f0f0f0f0f0", 31.0, 1280, 720).isEmpty());
        assertTrue(archive.lookup("0f0f0f0f0f0f0f0f", 30.0, 1280, 720).isEmpty());
        assertEquals(Optional.of("https://x.com/a/status/1"), archive.lookup("f0f0f0f0f0f0f0f0", 30.9, 1280, 720));
    }

    @Test
    void nearestEntryShouldWin() {
        archive.insert("far", "00000000000000ff", 10.0, 0, 0);
        archive.insert("near", "0000000000000001", 10.0, 0, 0);

        assertEquals(Optional.of("near"), archive.lookup("0000000000000000", 10.0, 0, 0));
    }

    @Test
    void recheckingTheSameJobShouldNotMatchItself() {
        archive.checkAndInsert("job-1", "1234123412341234", 20.0, 0, 0);

        assertTrue(archive.checkAndInsert("job-1", "1234123412341234", 20.0, 0, 0).isEmpty());
        assertEquals(1L, archive.size());
    }

    @Test
    void concurrentIndexesShouldAcceptExactlyOneCopy() throws Exception {
        // two instances stand in for two processes sharing the database
        MongoArchiveIndex other = new MongoArchiveIndex(mongoTemplate, DedupSettings.DEFAULTS,
                Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofSeconds(10));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<String>>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                MongoArchiveIndex index = i % 2 == 0 ? archive : other;
                String jobId = "job-" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    return index.checkAndInsert(jobId, "abcdabcdabcdabcd", 45.0, 720, 1280);
                }));
            }
            go.countDown();

            int accepted = 0;
            for (Future<Optional<String>> f : results) {
                if (f.get(60, TimeUnit.SECONDS).isEmpty()) {
                    accepted++;
                }
            }
            assertEquals(1, accepted);
            assertEquals(1L, archive.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void proposedTagsShouldBeListedInArrivalOrder() {
        MongoProposedTagLog log = new MongoProposedTagLog(mongoTemplate);
        log.append(new ProposedTag("Drone Strike", EvidenceSource.AUDIO, 0.7, "https://x.com/a/status/1", NOW.plusSeconds(5)));
        log.append(new ProposedTag("Flooding", EvidenceSource.OCR, 0.45, "https://x.com/a/status/2", NOW));

        List<ProposedTag> entries = log.entries();

        assertEquals(List.of("Flooding", "Drone Strike"), entries.stream().map(ProposedTag::label).toList());
        assertEquals(EvidenceSource.AUDIO, entries.get(1).source());
    }

    private void dropAll() {
        mongoTemplate.dropCollection(FingerprintDocument.class);
        mongoTemplate.dropCollection(ProposedTagDocument.class);
        mongoTemplate.dropCollection(MongoArchiveIndex.LOCK_COLLECTION);
    }
}
