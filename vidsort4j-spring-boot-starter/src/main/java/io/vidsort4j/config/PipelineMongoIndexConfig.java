package io.vidsort4j.config;

import io.vidsort4j.internal.mongo.FingerprintDocument;
import io.vidsort4j.internal.mongo.JobDocument;
import io.vidsort4j.internal.mongo.ProposedTagDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the pipeline.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created automatically at application startup unless
 * {@code vidsort.ensure-indexes-on-startup=true}. In production they are usually managed by ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_due_claim</b> on {@code video_jobs}: { status: 1, priority: -1, nextAttemptAt: 1 }
 *       <br/>Used when claiming due PENDING jobs in priority order.</li>
 *   <li><b>idx_lease</b> on {@code video_jobs}: { status: 1, lockUntil: 1 }
 *       <br/>Used when reclaiming in-flight jobs whose lease expired.</li>
 *   <li><b>idx_bands</b> on {@code archive_fingerprints}: { bands: 1 } (multikey)
 *       <br/>Candidate lookup for near-duplicate detection.</li>
 *   <li><b>idx_label_at</b> on {@code proposed_tags}: { label: 1, at: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.video_jobs.createIndex({ status: 1, priority: -1, nextAttemptAt: 1 }, { name: "idx_due_claim" });
 * db.video_jobs.createIndex({ status: 1, lockUntil: 1 }, { name: "idx_lease" });
 * db.archive_fingerprints.createIndex({ bands: 1 }, { name: "idx_bands" });
 * db.proposed_tags.createIndex({ label: 1, at: 1 }, { name: "idx_label_at" });
 * </pre>
 */
public class PipelineMongoIndexConfig {

    public static final String IDX_DUE_CLAIM = "idx_due_claim";
    public static final String IDX_LEASE = "idx_lease";
    public static final String IDX_BANDS = "idx_bands";
    public static final String IDX_LABEL_AT = "idx_label_at";

    private final MongoTemplate mongoTemplate;

    public PipelineMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Manually ensure the indexes above exist.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(dueClaimIndex());
        mongoTemplate.indexOps(JobDocument.class).ensureIndex(leaseIndex());
        mongoTemplate.indexOps(FingerprintDocument.class).ensureIndex(bandsIndex());
        mongoTemplate.indexOps(ProposedTagDocument.class).ensureIndex(labelAtIndex());
    }

    public static Index dueClaimIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("nextAttemptAt", Sort.Direction.ASC)
                .named(IDX_DUE_CLAIM);
    }

    public static Index leaseIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("lockUntil", Sort.Direction.ASC)
                .named(IDX_LEASE);
    }

    public static Index bandsIndex() {
        return new Index()
                .on("bands", Sort.Direction.ASC)
                .named(IDX_BANDS);
    }

    public static Index labelAtIndex() {
        return new Index()
                .on("label", Sort.Direction.ASC)
                .on("at", Sort.Direction.ASC)
                .named(IDX_LABEL_AT);
    }
}
