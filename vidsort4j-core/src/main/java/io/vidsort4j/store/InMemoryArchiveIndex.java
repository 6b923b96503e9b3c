package io.vidsort4j.store;

import io.vidsort4j.fingerprint.PerceptualHashes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local {@link ArchiveIndex} backed by band buckets. Concurrent check-and-insert calls whose
 * hashes share a band serialize on the same lock stripes, so of two near-identical concurrent inserts
 * exactly one is accepted.
 */
public class InMemoryArchiveIndex implements ArchiveIndex {

    private final DedupSettings settings;
    private final HashBands bands;
    private final StripedLocks locks = new StripedLocks(256);
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, Entry> byJob = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> buckets = new ConcurrentHashMap<>();

    public InMemoryArchiveIndex(DedupSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.bands = new HashBands(settings.maxHammingDistance());
    }

    @Override
    public Optional<String> lookup(String perceptualHash, double durationSeconds, int width, int height) {
        long hash = PerceptualHashes.fromHex(perceptualHash);
        return bestMatch(null, hash, durationSeconds, bands.keys(hash));
    }

    @Override
    public void insert(String jobId, String perceptualHash, double durationSeconds, int width, int height) {
        long hash = PerceptualHashes.fromHex(perceptualHash);
        List<String> keys = bands.keys(hash);
        try (StripedLocks.Held ignored = locks.lockAll(keys)) {
            put(jobId, hash, durationSeconds, width, height, keys);
        }
    }

    @Override
    public Optional<String> checkAndInsert(String jobId, String perceptualHash, double durationSeconds,
                                           int width, int height) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        long hash = PerceptualHashes.fromHex(perceptualHash);
        List<String> keys = bands.keys(hash);
        try (StripedLocks.Held ignored = locks.lockAll(keys)) {
            Optional<String> match = bestMatch(jobId, hash, durationSeconds, keys);
            if (match.isEmpty()) {
                put(jobId, hash, durationSeconds, width, height, keys);
            }
            return match;
        }
    }

    @Override
    public long size() {
        return byJob.size();
    }

    private Optional<String> bestMatch(String self, long hash, double duration, List<String> keys) {
        List<Entry> matches = new ArrayList<>();
        for (String key : keys) {
            Set<String> ids = buckets.get(key);
            if (ids == null) {
                continue;
            }
            for (String id : ids) {
                if (id.equals(self)) {
                    continue;
                }
                Entry e = byJob.get(id);
                if (e != null && matches(e, hash, duration) && !matches.contains(e)) {
                    matches.add(e);
                }
            }
        }
        return matches.stream()
                .min(Comparator.comparingInt((Entry e) -> PerceptualHashes.hammingDistance(e.hash, hash))
                        .thenComparingLong(e -> e.seq))
                .map(e -> e.jobId);
    }

    private boolean matches(Entry e, long hash, double duration) {
        return PerceptualHashes.hammingDistance(e.hash, hash) <= settings.maxHammingDistance()
                && Math.abs(e.duration - duration) < settings.durationTolerance();
    }

    private void put(String jobId, long hash, double duration, int width, int height, List<String> keys) {
        if (byJob.containsKey(jobId)) {
            return;
        }
        byJob.put(jobId, new Entry(jobId, hash, duration, width, height, sequence.incrementAndGet()));
        for (String key : keys) {
            buckets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(jobId);
        }
    }

    private record Entry(String jobId, long hash, double duration, int width, int height, long seq) {
    }
}
