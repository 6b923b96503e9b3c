package io.vidsort4j.core;

import java.time.Instant;

/**
 * Fields written together with a status transition. Null components are left untouched.
 */
public record JobPatch(
        MediaAsset media,
        SourceMetadata source,
        String duplicateOf,
        Classification result,
        JobError lastError,
        Instant nextAttemptAt
) {
    private static final JobPatch NONE = new JobPatch(null, null, null, null, null, null);

    public static JobPatch none() {
        return NONE;
    }

    public static JobPatch media(MediaAsset media) {
        return new JobPatch(media, null, null, null, null, null);
    }

    public static JobPatch fetched(MediaAsset media, SourceMetadata source) {
        return new JobPatch(media, source, null, null, null, null);
    }

    public static JobPatch duplicate(MediaAsset media, String duplicateOf) {
        return new JobPatch(media, null, duplicateOf, null, null, null);
    }

    public static JobPatch result(Classification result) {
        return new JobPatch(null, null, null, result, null, null);
    }

    public static JobPatch error(JobError error) {
        return new JobPatch(null, null, null, null, error, null);
    }

    public static JobPatch retryAt(JobError error, Instant nextAttemptAt) {
        return new JobPatch(null, null, null, null, error, nextAttemptAt);
    }

    /**
     * Applies this patch onto a builder.
     */
    public Job.Builder applyTo(Job.Builder b) {
        if (media != null) {
            b.media(media);
        }
        if (source != null) {
            b.source(source);
        }
        if (duplicateOf != null) {
            b.duplicateOf(duplicateOf);
        }
        if (result != null) {
            b.result(result);
        }
        if (lastError != null) {
            b.lastError(lastError);
        }
        if (nextAttemptAt != null) {
            b.nextAttemptAt(nextAttemptAt);
        }
        return b;
    }
}
