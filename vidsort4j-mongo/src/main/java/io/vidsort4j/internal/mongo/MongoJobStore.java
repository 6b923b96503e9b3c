package io.vidsort4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.vidsort4j.core.Classification;
import io.vidsort4j.core.IngestResult;
import io.vidsort4j.core.Job;
import io.vidsort4j.core.JobError;
import io.vidsort4j.core.JobPatch;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.Priority;
import io.vidsort4j.core.SourceMetadata;
import io.vidsort4j.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for video jobs.
 *
 * <p>Every write is a single-document atomic operation keyed by URL ({@code _id}). Worker writes carry the
 * expected status and {@code lockedBy} in the filter, so they are compare-and-set across processes.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Upsert with {@code $setOnInsert} only, so an existing job is never touched.
     */
    @Override
    public IngestResult ingest(String url, Platform platform, Priority priority, Instant now) {
        requireUrl(url);
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(now, "now must not be null");

        Query q = new Query(Criteria.where("_id").is(url));
        Update u = new Update()
                .setOnInsert("platform", platform)
                .setOnInsert("priority", priority.value())
                .setOnInsert("status", JobStatus.PENDING)
                .setOnInsert("attempts", 0)
                .setOnInsert("createdAt", now)
                .setOnInsert("nextAttemptAt", now)
                .setOnInsert("cancelRequested", false);

        UpdateResult result;
        try {
            result = mongoTemplate.upsert(q, u, JobDocument.class);
        } catch (DuplicateKeyException e) {
            // lost a concurrent upsert race; the other insert won
            return existing(url);
        }
        return result.getUpsertedId() != null ? IngestResult.createdResult(url) : existing(url);
    }

    private IngestResult existing(String url) {
        JobStatus status = find(url).map(Job::status).orElse(JobStatus.PENDING);
        return IngestResult.existing(url, status);
    }

    @Override
    public Optional<Job> find(String url) {
        if (url == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(url, JobDocument.class)).map(this::toJob);
    }

    /**
     * Atomically claims at most {@code batchSize} jobs, one {@code findAndModify} per job, so two
     * processes polling the same collection never claim the same job. Expired leases that used up
     * {@code maxAttempts} are failed with one {@code updateMulti} first.
     */
    @Override
    public List<Job> claimDue(Instant now, int batchSize, Duration claimLifetime, String workerId, int maxAttempts) {
        Objects.requireNonNull(now, "now must not be null");
        Objects.requireNonNull(claimLifetime, "claimLifetime must not be null");
        if (batchSize <= 0) {
            return List.of();
        }
        if (claimLifetime.isZero() || claimLifetime.isNegative()) {
            throw new IllegalArgumentException("claimLifetime must be a positive duration");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Criteria expiredLease = Criteria.where("status").in(JobStatus.inFlight())
                .orOperator(
                        Criteria.where("lockUntil").is(null),
                        Criteria.where("lockUntil").lte(now)
                );
        if (maxAttempts > 0) {
            failExhaustedLeases(now, maxAttempts);
            expiredLease = expiredLease.and("attempts").lt(maxAttempts);
        }

        Query baseQuery = new Query(new Criteria().orOperator(
                Criteria.where("status").is(JobStatus.PENDING)
                        .and("cancelRequested").ne(true)
                        .and("nextAttemptAt").lte(now),
                expiredLease
        ));
        baseQuery.with(Sort.by(
                Sort.Order.desc("priority"),
                Sort.Order.asc("nextAttemptAt"),
                Sort.Order.asc("createdAt")));

        Update claimUpdate = new Update()
                .set("status", JobStatus.FETCHING)
                .inc("attempts", 1)
                .set("lastAttemptAt", now)
                .set("lockedBy", workerId)
                .set("lockUntil", now.plus(claimLifetime));

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<Job> claimed = new ArrayList<>(Math.min(batchSize, 64));
        for (int i = 0; i < batchSize; i++) {
            JobDocument doc = mongoTemplate.findAndModify(baseQuery, claimUpdate, options, JobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toJob(doc));
        }
        return claimed;
    }

    private void failExhaustedLeases(Instant now, int maxAttempts) {
        Query exhausted = new Query(
                Criteria.where("status").in(JobStatus.inFlight())
                        .and("attempts").gte(maxAttempts)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        Update fail = new Update()
                .set("status", JobStatus.FAILED)
                .set("lastError", toErrorDocument(JobError.leaseExhausted(maxAttempts, now)))
                .unset("lockedBy")
                .unset("lockUntil");
        long failed = mongoTemplate.updateMulti(exhausted, fail, JobDocument.class).getModifiedCount();
        if (failed > 0) {
            log.warn("vidsort failed jobs with exhausted leases count={} maxAttempts={}", failed, maxAttempts);
        }
    }

    @Override
    public boolean advance(String url, String workerId, JobStatus from, JobStatus to, JobPatch patch, Instant now) {
        requireUrl(url);
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!from.canTransitionTo(to)) {
            return false;
        }

        Query q = new Query(
                Criteria.where("_id").is(url)
                        .and("status").is(from)
                        // Prevent stale write-back if another worker already re-claimed this job.
                        .and("lockedBy").is(workerId)
        );

        Update u = new Update().set("status", to);
        applyPatch(u, patch == null ? JobPatch.none() : patch);
        if (to == JobStatus.PENDING || to.isTerminal()) {
            u.unset("lockedBy").unset("lockUntil");
        }

        return mongoTemplate.updateFirst(q, u, JobDocument.class).getMatchedCount() == 1;
    }

    @Override
    public boolean requestCancel(String url, Instant now) {
        requireUrl(url);
        Objects.requireNonNull(now, "now must not be null");

        Query unclaimedPending = new Query(
                Criteria.where("_id").is(url)
                        .and("status").is(JobStatus.PENDING)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        );
        Update failNow = new Update()
                .set("status", JobStatus.FAILED)
                .set("cancelRequested", true)
                .set("lastError", toErrorDocument(JobError.cancelled(now)))
                .unset("lockedBy")
                .unset("lockUntil");
        if (mongoTemplate.updateFirst(unclaimedPending, failNow, JobDocument.class).getMatchedCount() == 1) {
            return true;
        }

        // claimed: the worker fails it at its next stage boundary
        Query active = new Query(
                Criteria.where("_id").is(url)
                        .and("status").nin(JobStatus.terminal())
        );
        Update flag = new Update().set("cancelRequested", true);
        return mongoTemplate.updateFirst(active, flag, JobDocument.class).getMatchedCount() == 1;
    }

    @Override
    public boolean isCancelRequested(String url) {
        Query q = new Query(Criteria.where("_id").is(url).and("cancelRequested").is(true));
        return mongoTemplate.exists(q, JobDocument.class);
    }

    @Override
    public List<Job> findResumable(Instant now) {
        Query q = new Query(new Criteria().orOperator(
                Criteria.where("status").is(JobStatus.PENDING)
                        .and("nextAttemptAt").lte(now),
                Criteria.where("status").in(JobStatus.FETCHING, JobStatus.EXTRACTING)
                        .orOperator(
                                Criteria.where("lockUntil").is(null),
                                Criteria.where("lockUntil").lte(now)
                        )
        ));
        q.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("nextAttemptAt")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(this::toJob).toList();
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Query q = new Query(Criteria.where("status").is(status));
        q.with(Sort.by(Sort.Order.asc("createdAt")));
        return mongoTemplate.find(q, JobDocument.class).stream().map(this::toJob).toList();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, mongoTemplate.count(new Query(Criteria.where("status").is(s)), JobDocument.class));
        }
        return counts;
    }

    @Override
    public long countIncomplete() {
        Query q = new Query(Criteria.where("status").nin(JobStatus.terminal()));
        return mongoTemplate.count(q, JobDocument.class);
    }

    private void applyPatch(Update u, JobPatch patch) {
        if (patch.media() != null) {
            u.set("media", toMediaDocument(patch.media()));
        }
        if (patch.source() != null) {
            u.set("source", toSourceDocument(patch.source()));
        }
        if (patch.duplicateOf() != null) {
            u.set("duplicateOf", patch.duplicateOf());
        }
        if (patch.result() != null) {
            u.set("result", objectMapper.convertValue(patch.result(), new TypeReference<Map<String, Object>>() {
            }));
        }
        if (patch.lastError() != null) {
            u.set("lastError", toErrorDocument(patch.lastError()));
        }
        if (patch.nextAttemptAt() != null) {
            u.set("nextAttemptAt", patch.nextAttemptAt());
        }
    }

    /**
     * Converts a persisted {@link JobDocument} back into a {@link Job} snapshot.
     */
    Job toJob(JobDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");

        Classification result = null;
        if (doc.getResult() != null) {
            result = objectMapper.convertValue(doc.getResult(), Classification.class);
        }

        return new Job(
                doc.getId(),
                doc.getPlatform() != null ? doc.getPlatform() : Platform.UNKNOWN,
                Priority.fromValue(doc.getPriority()),
                doc.getStatus(),
                doc.getAttempts(),
                doc.getCreatedAt(),
                doc.getLastAttemptAt(),
                doc.getNextAttemptAt(),
                fromErrorDocument(doc.getLastError()),
                doc.isCancelRequested(),
                doc.getLockedBy(),
                doc.getLockUntil(),
                fromMediaDocument(doc.getMedia()),
                fromSourceDocument(doc.getSource()),
                doc.getDuplicateOf(),
                result
        );
    }

    private static JobDocument.ErrorDocument toErrorDocument(JobError error) {
        JobDocument.ErrorDocument d = new JobDocument.ErrorDocument();
        d.setKind(error.kind());
        d.setMessage(error.message());
        d.setAt(error.at());
        return d;
    }

    private static JobError fromErrorDocument(JobDocument.ErrorDocument d) {
        if (d == null || d.getKind() == null || d.getAt() == null) {
            return null;
        }
        return new JobError(d.getKind(), d.getMessage(), d.getAt());
    }

    private static JobDocument.MediaDocument toMediaDocument(MediaAsset media) {
        JobDocument.MediaDocument d = new JobDocument.MediaDocument();
        d.setPath(media.path());
        d.setDurationSeconds(media.durationSeconds());
        d.setWidth(media.width());
        d.setHeight(media.height());
        d.setHasAudio(media.hasAudio());
        d.setPerceptualHash(media.perceptualHash());
        return d;
    }

    private static MediaAsset fromMediaDocument(JobDocument.MediaDocument d) {
        if (d == null || d.getPath() == null) {
            return null;
        }
        return new MediaAsset(d.getPath(), d.getDurationSeconds(), d.getWidth(), d.getHeight(), d.isHasAudio(),
                d.getPerceptualHash());
    }

    private static JobDocument.SourceDocument toSourceDocument(SourceMetadata source) {
        JobDocument.SourceDocument d = new JobDocument.SourceDocument();
        d.setTitle(source.title());
        d.setSourceUrl(source.sourceUrl());
        d.setUploader(source.uploader());
        d.setPublishedAt(source.publishedAt());
        return d;
    }

    private static SourceMetadata fromSourceDocument(JobDocument.SourceDocument d) {
        if (d == null) {
            return null;
        }
        SourceMetadata source = new SourceMetadata(d.getTitle(), d.getSourceUrl(), d.getUploader(), d.getPublishedAt());
        return source.isEmpty() ? null : source;
    }

    private static void requireUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
    }
}
