package io.vidsort4j.core;

public record IngestResult(
        String url,
        boolean created,
        JobStatus status
) {
    public static IngestResult createdResult(String url) {
        return new IngestResult(url, true, JobStatus.PENDING);
    }

    public static IngestResult existing(String url, JobStatus status) {
        return new IngestResult(url, false, status);
    }
}
