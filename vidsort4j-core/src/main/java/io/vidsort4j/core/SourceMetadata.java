package io.vidsort4j.core;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * The part of a platform's metadata kept on the job: what the post was called, where it lives and when it
 * was published.
 *
 * @param title       post title, or null
 * @param sourceUrl   canonical page URL reported by the platform, or null
 * @param uploader    account that posted the video, or null
 * @param publishedAt publication time, or null when the platform does not report one
 */
public record SourceMetadata(
        String title,
        String sourceUrl,
        String uploader,
        Instant publishedAt
) {
    private static final DateTimeFormatter UPLOAD_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    public SourceMetadata {
        title = blankToNull(title);
        sourceUrl = blankToNull(sourceUrl);
        uploader = blankToNull(uploader);
    }

    /**
     * Picks the kept fields out of a yt-dlp info JSON. Returns null when none of them is present.
     *
     * <p>{@code timestamp} (epoch seconds) wins over {@code upload_date} ({@code yyyyMMdd}, read as UTC
     * midnight).
     */
    public static SourceMetadata fromInfoJson(Map<String, Object> info) {
        if (info == null || info.isEmpty()) {
            return null;
        }
        String title = text(info.get("title"));
        String url = text(info.get("webpage_url"));
        if (url == null) {
            url = text(info.get("original_url"));
        }
        String uploader = text(info.get("uploader"));
        if (uploader == null) {
            uploader = text(info.get("channel"));
        }
        SourceMetadata m = new SourceMetadata(title, url, uploader, publishedAt(info));
        return m.isEmpty() ? null : m;
    }

    public boolean isEmpty() {
        return title == null && sourceUrl == null && uploader == null && publishedAt == null;
    }

    private static Instant publishedAt(Map<String, Object> info) {
        Object ts = info.get("timestamp");
        if (ts instanceof Number) {
            return Instant.ofEpochSecond(((Number) ts).longValue());
        }
        String date = text(info.get("upload_date"));
        if (date == null) {
            return null;
        }
        try {
            return LocalDate.parse(date, UPLOAD_DATE).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(Object value) {
        return value instanceof String ? blankToNull((String) value) : null;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
