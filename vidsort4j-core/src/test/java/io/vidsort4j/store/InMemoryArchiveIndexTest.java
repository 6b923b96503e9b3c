package io.vidsort4j.store;

import io.vidsort4j.fingerprint.PerceptualHashes;
import org.junit.jupiter.api.Test;

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

class InMemoryArchiveIndexTest {

    private static final long BASE = 0x0F0F0F0F0F0F0F0FL;

    private final InMemoryArchiveIndex index = new InMemoryArchiveIndex(DedupSettings.DEFAULTS);

    @Test
    void reencodedCopyShouldMatchTheOriginal() {
        assertTrue(index.checkAndInsert("job-a", hex(BASE), 30.0, 1280, 720).isEmpty());

        Optional<String> match = index.checkAndInsert("job-b", hex(BASE ^ 0b111L), 30.5, 640, 360);

        assertEquals(Optional.of("job-a"), match);
        assertEquals(1, index.size());
    }

    @Test
    void durationOutsideToleranceShouldNotMatch() {
        index.insert("job-a", hex(BASE), 30.0, 1280, 720);

        assertTrue(index.lookup(hex(BASE), 31.0, 1280, 720).isEmpty());
        assertTrue(index.lookup(hex(BASE), 29.2, 1280, 720).isPresent());
    }

    @Test
    void distantHashShouldNotMatch() {
        index.insert("job-a", hex(BASE), 30.0, 1280, 720);

        // 11 differing bits, one over the default threshold
        long far = BASE ^ 0x7FFL;
        assertTrue(index.lookup(hex(far), 30.0, 1280, 720).isEmpty());
        assertTrue(index.lookup(hex(BASE ^ 0x3FFL), 30.0, 1280, 720).isPresent());
    }

    @Test
    void nearestEntryShouldWinThenEarliest() {
        index.insert("job-a", hex(BASE), 10.0, 0, 0);
        index.insert("job-b", hex(BASE ^ 0b11L), 10.0, 0, 0);

        assertEquals(Optional.of("job-b"), index.lookup(hex(BASE ^ 0b11L), 10.0, 0, 0));
        assertEquals(Optional.of("job-a"), index.lookup(hex(BASE ^ 0b1L), 10.0, 0, 0));
    }

    @Test
    void jobShouldNeverMatchItself() {
        assertTrue(index.checkAndInsert("job-a", hex(BASE), 12.0, 0, 0).isEmpty());
        assertTrue(index.checkAndInsert("job-a", hex(BASE), 12.0, 0, 0).isEmpty());

        assertEquals(1, index.size());
    }

    @Test
    void concurrentNearDuplicatesShouldAcceptExactlyOne() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<String>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String jobId = "job-" + i;
                long hash = BASE ^ (1L << i);
                results.add(pool.submit(() -> {
                    start.await();
                    return index.checkAndInsert(jobId, hex(hash), 45.0, 1920, 1080);
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Optional<String>> f : results) {
                if (f.get(10, TimeUnit.SECONDS).isEmpty()) {
                    accepted++;
                }
            }
            assertEquals(1, accepted);
            assertEquals(1, index.size());
        } finally {
            pool.shutdownNow();
        }
    }

    private static String hex(long hash) {
        return PerceptualHashes.toHex(hash);
    }
}
