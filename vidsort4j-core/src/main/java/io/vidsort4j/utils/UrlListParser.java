package io.vidsort4j.utils;

import io.vidsort4j.core.Priority;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a URL list.
 * <p>
 * Format:
 * <ul>
 *   <li>one URL per line, optionally followed by whitespace and a priority token: "urgent" or "normal"</li>
 *   <li>blank lines and lines starting with {@code #} are ignored</li>
 *   <li>a URL repeated within the list is kept once, with the highest priority seen</li>
 * </ul>
 */
public final class UrlListParser {
    private UrlListParser() {
    }

    public record UrlEntry(String url, Priority priority, int lineNumber) {
    }

    /**
     * @param entries  accepted URLs in first-seen order
     * @param rejected malformed lines, as "line N: reason"
     */
    public record Result(List<UrlEntry> entries, List<String> rejected) {
        public Result {
            entries = List.copyOf(entries);
            rejected = List.copyOf(rejected);
        }
    }

    public static Result parse(Reader reader) throws IOException {
        Map<String, UrlEntry> entries = new LinkedHashMap<>();
        List<String> rejected = new ArrayList<>();

        BufferedReader in = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String trimmed = line.strip();
            if (lineNumber == 1 && trimmed.startsWith("\uFEFF")) {
                trimmed = trimmed.substring(1).strip();
            }
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            String[] parts = trimmed.split("\\s+");
            if (parts.length > 2) {
                rejected.add("line " + lineNumber + ": too many tokens");
                continue;
            }
            String url = parts[0];
            if (!PlatformDetector.isWebUrl(url)) {
                rejected.add("line " + lineNumber + ": not an http(s) URL: " + url);
                continue;
            }
            Priority priority;
            try {
                priority = Priority.parse(parts.length == 2 ? parts[1] : null);
            } catch (IllegalArgumentException e) {
                rejected.add("line " + lineNumber + ": " + e.getMessage());
                continue;
            }

            UrlEntry previous = entries.get(url);
            if (previous == null) {
                entries.put(url, new UrlEntry(url, priority, lineNumber));
            } else if (priority.value() > previous.priority().value()) {
                entries.put(url, new UrlEntry(url, priority, previous.lineNumber()));
            }
        }
        return new Result(new ArrayList<>(entries.values()), rejected);
    }
}
