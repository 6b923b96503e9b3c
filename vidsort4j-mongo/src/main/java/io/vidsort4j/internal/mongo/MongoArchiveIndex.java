package io.vidsort4j.internal.mongo;

import io.vidsort4j.fingerprint.PerceptualHashes;
import io.vidsort4j.store.ArchiveIndex;
import io.vidsort4j.store.DedupSettings;
import io.vidsort4j.store.HashBands;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * MongoDB-backed {@link ArchiveIndex}.
 *
 * <p>Candidates are found through the {@code bands} array (one indexed key per hash band) and filtered
 * by exact Hamming distance and duration in memory.
 *
 * <p>{@link #checkAndInsert} must be atomic across every process sharing the collection, so it runs under
 * a lease document in {@value #LOCK_COLLECTION}. The lease expires after {@code leaseLifetime}, so a
 * process that dies while holding it blocks the others for at most that long.
 */
public class MongoArchiveIndex implements ArchiveIndex {
    private static final Logger log = LoggerFactory.getLogger(MongoArchiveIndex.class);

    static final String LOCK_COLLECTION = "archive_locks";
    static final String LOCK_ID = "archive";

    private static final Comparator<FingerprintDocument> INSERTION_ORDER = Comparator
            .comparing(FingerprintDocument::getInsertedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FingerprintDocument::getId);

    private final MongoTemplate mongoTemplate;
    private final DedupSettings settings;
    private final HashBands bands;
    private final Clock clock;
    private final Duration leaseLifetime;
    private final ReentrantLock localLock = new ReentrantLock();

    public MongoArchiveIndex(MongoTemplate mongoTemplate, DedupSettings settings, Clock clock) {
        this(mongoTemplate, settings, clock, Duration.ofSeconds(30));
    }

    public MongoArchiveIndex(MongoTemplate mongoTemplate, DedupSettings settings, Clock clock, Duration leaseLifetime) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.leaseLifetime = Objects.requireNonNull(leaseLifetime, "leaseLifetime must not be null");
        if (leaseLifetime.isZero() || leaseLifetime.isNegative()) {
            throw new IllegalArgumentException("leaseLifetime must be a positive duration");
        }
        this.bands = new HashBands(settings.maxHammingDistance());
    }

    @Override
    public Optional<String> lookup(String perceptualHash, double durationSeconds, int width, int height) {
        long hash = PerceptualHashes.fromHex(perceptualHash);
        return bestMatch(null, hash, durationSeconds, bands.keys(hash));
    }

    @Override
    public void insert(String jobId, String perceptualHash, double durationSeconds, int width, int height) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        long hash = PerceptualHashes.fromHex(perceptualHash);
        try {
            mongoTemplate.insert(toDocument(jobId, hash, durationSeconds, width, height));
        } catch (DuplicateKeyException e) {
            log.debug("vidsort archive entry already present jobId={}", jobId);
        }
    }

    @Override
    public Optional<String> checkAndInsert(String jobId, String perceptualHash, double durationSeconds,
                                           int width, int height) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        long hash = PerceptualHashes.fromHex(perceptualHash);
        List<String> keys = bands.keys(hash);

        localLock.lock();
        try {
            String token = acquireLease();
            try {
                Optional<String> match = bestMatch(jobId, hash, durationSeconds, keys);
                if (match.isEmpty()
                        && !mongoTemplate.exists(new Query(Criteria.where("_id").is(jobId)), FingerprintDocument.class)) {
                    mongoTemplate.insert(toDocument(jobId, hash, durationSeconds, width, height));
                }
                return match;
            } finally {
                releaseLease(token);
            }
        } finally {
            localLock.unlock();
        }
    }

    @Override
    public long size() {
        return mongoTemplate.count(new Query(), FingerprintDocument.class);
    }

    private Optional<String> bestMatch(String self, long hash, double duration, List<String> keys) {
        Criteria c = Criteria.where("bands").in(keys);
        if (self != null) {
            c = c.and("_id").ne(self);
        }
        List<FingerprintDocument> candidates = mongoTemplate.find(new Query(c), FingerprintDocument.class);

        return candidates.stream()
                .filter(d -> matches(d, hash, duration))
                .min(Comparator.comparingInt((FingerprintDocument d) -> distance(d, hash))
                        .thenComparing(INSERTION_ORDER))
                .map(FingerprintDocument::getId);
    }

    private boolean matches(FingerprintDocument d, long hash, double duration) {
        return distance(d, hash) <= settings.maxHammingDistance()
                && Math.abs(d.getDurationSeconds() - duration) < settings.durationTolerance();
    }

    private static int distance(FingerprintDocument d, long hash) {
        return PerceptualHashes.hammingDistance(PerceptualHashes.fromHex(d.getHash()), hash);
    }

    private FingerprintDocument toDocument(String jobId, long hash, double duration, int width, int height) {
        FingerprintDocument doc = new FingerprintDocument();
        doc.setId(jobId);
        doc.setHash(PerceptualHashes.toHex(hash));
        doc.setDurationSeconds(duration);
        doc.setWidth(width);
        doc.setHeight(height);
        doc.setBands(bands.keys(hash));
        doc.setInsertedAt(clock.instant());
        return doc;
    }

    /**
     * Take the cross-process lease, waiting at most one lease lifetime.
     */
    private String acquireLease() {
        String token = UUID.randomUUID().toString();
        long deadline = System.nanoTime() + leaseLifetime.toNanos();
        long pauseMs = 5;

        while (true) {
            Instant now = clock.instant();
            Query q = new Query(Criteria.where("_id").is(LOCK_ID)
                    .orOperator(
                            Criteria.where("lockUntil").is(null),
                            Criteria.where("lockUntil").lte(now)
                    ));
            Update u = new Update()
                    .set("lockedBy", token)
                    .set("lockUntil", now.plus(leaseLifetime));
            try {
                Document held = mongoTemplate.findAndModify(q, u,
                        FindAndModifyOptions.options().upsert(true).returnNew(true),
                        Document.class, LOCK_COLLECTION);
                if (held != null && token.equals(held.getString("lockedBy"))) {
                    return token;
                }
            } catch (DuplicateKeyException e) {
                // held by someone else: the upsert collided with the existing lease document
                log.trace("vidsort archive lease busy");
            }

            if (System.nanoTime() >= deadline) {
                throw new IllegalStateException("timed out waiting for archive lease after " + leaseLifetime);
            }
            try {
                Thread.sleep(pauseMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while waiting for archive lease", e);
            }
            pauseMs = Math.min(pauseMs * 2, 200);
        }
    }

    private void releaseLease(String token) {
        Query q = new Query(Criteria.where("_id").is(LOCK_ID).and("lockedBy").is(token));
        Update u = new Update().unset("lockedBy").unset("lockUntil");
        mongoTemplate.updateFirst(q, u, LOCK_COLLECTION);
    }
}
