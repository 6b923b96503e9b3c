package io.vidsort4j.internal.mongo;

import io.vidsort4j.core.ErrorKind;
import io.vidsort4j.core.JobStatus;
import io.vidsort4j.core.Platform;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for a per-URL video job. The URL is the document id.
 */
@Document(collection = "video_jobs")
public class JobDocument {

    @Id
    private String id;

    private Platform platform;
    private int priority;
    private JobStatus status;
    private int attempts;

    private Instant createdAt;
    private Instant lastAttemptAt;
    private Instant nextAttemptAt;
    private ErrorDocument lastError;
    private boolean cancelRequested;

    private String lockedBy;
    private Instant lockUntil;

    private MediaDocument media;
    private SourceDocument source;
    private String duplicateOf;
    private Map<String, Object> result;

    public JobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Platform getPlatform() {
        return platform;
    }

    public void setPlatform(Platform platform) {
        this.platform = platform;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public void setLastAttemptAt(Instant lastAttemptAt) {
        this.lastAttemptAt = lastAttemptAt;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public ErrorDocument getLastError() {
        return lastError;
    }

    public void setLastError(ErrorDocument lastError) {
        this.lastError = lastError;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public void setLockedBy(String lockedBy) {
        this.lockedBy = lockedBy;
    }

    public Instant getLockUntil() {
        return lockUntil;
    }

    public void setLockUntil(Instant lockUntil) {
        this.lockUntil = lockUntil;
    }

    public MediaDocument getMedia() {
        return media;
    }

    public void setMedia(MediaDocument media) {
        this.media = media;
    }

    public SourceDocument getSource() {
        return source;
    }

    public void setSource(SourceDocument source) {
        this.source = source;
    }

    public String getDuplicateOf() {
        return duplicateOf;
    }

    public void setDuplicateOf(String duplicateOf) {
        this.duplicateOf = duplicateOf;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public void setResult(Map<String, Object> result) {
        this.result = result;
    }

    public static class ErrorDocument {
        private ErrorKind kind;
        private String message;
        private Instant at;

        public ErrorDocument() {
        }

        public ErrorKind getKind() {
            return kind;
        }

        public void setKind(ErrorKind kind) {
            this.kind = kind;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }

        public Instant getAt() {
            return at;
        }

        public void setAt(Instant at) {
            this.at = at;
        }
    }

    public static class MediaDocument {
        private String path;
        private double durationSeconds;
        private int width;
        private int height;
        private boolean hasAudio;
        private String perceptualHash;

        public MediaDocument() {
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public double getDurationSeconds() {
            return durationSeconds;
        }

        public void setDurationSeconds(double durationSeconds) {
            this.durationSeconds = durationSeconds;
        }

        public int getWidth() {
            return width;
        }

        public void setWidth(int width) {
            this.width = width;
        }

        public int getHeight() {
            return height;
        }

        public void setHeight(int height) {
            this.height = height;
        }

        public boolean isHasAudio() {
            return hasAudio;
        }

        public void setHasAudio(boolean hasAudio) {
            this.hasAudio = hasAudio;
        }

        public String getPerceptualHash() {
            return perceptualHash;
        }

        public void setPerceptualHash(String perceptualHash) {
            this.perceptualHash = perceptualHash;
        }
    }

    public static class SourceDocument {
        private String title;
        private String sourceUrl;
        private String uploader;
        private Instant publishedAt;

        public SourceDocument() {
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getSourceUrl() {
            return sourceUrl;
        }

        public void setSourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
        }

        public String getUploader() {
            return uploader;
        }

        public void setUploader(String uploader) {
            this.uploader = uploader;
        }

        public Instant getPublishedAt() {
            return publishedAt;
        }

        public void setPublishedAt(Instant publishedAt) {
            this.publishedAt = publishedAt;
        }
    }
}
