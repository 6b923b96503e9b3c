package io.vidsort4j.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.PlatformGateway;
import io.vidsort4j.core.FetchedMedia;
import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.Platform;
import io.vidsort4j.core.error.PlatformErrorKind;
import io.vidsort4j.core.error.PlatformException;
import io.vidsort4j.media.MediaProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Downloads through yt-dlp and maps its diagnostics onto {@link PlatformErrorKind}.
 *
 * <p>The info JSON written next to the media ({@code --write-info-json}) becomes the raw metadata.
 */
public class YtDlpPlatformGateway implements PlatformGateway {
    private static final Logger log = LoggerFactory.getLogger(YtDlpPlatformGateway.class);

    public static final Set<Platform> DEFAULT_PLATFORMS =
            EnumSet.of(Platform.TWITTER, Platform.INSTAGRAM, Platform.FACEBOOK, Platform.YOUTUBE);

    private final ProcessRunner runner;
    private final ObjectMapper objectMapper;
    private final MediaProbe probe;
    private final String executable;
    private final Duration timeout;
    private final Set<Platform> platforms;

    public YtDlpPlatformGateway(ProcessRunner runner, ObjectMapper objectMapper, MediaProbe probe,
                                String executable, Duration timeout) {
        this(runner, objectMapper, probe, executable, timeout, DEFAULT_PLATFORMS);
    }

    public YtDlpPlatformGateway(ProcessRunner runner, ObjectMapper objectMapper, MediaProbe probe,
                                String executable, Duration timeout, Set<Platform> platforms) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.probe = Objects.requireNonNull(probe, "probe must not be null");
        this.executable = Objects.requireNonNull(executable, "executable must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.platforms = Set.copyOf(Objects.requireNonNull(platforms, "platforms must not be null"));
    }

    @Override
    public Set<Platform> platforms() {
        return platforms;
    }

    @Override
    public FetchedMedia fetch(String url, Path targetDir) throws PlatformException {
        ProcessRunner.Result r;
        try {
            Files.createDirectories(targetDir);
            r = runner.run(List.of(
                    executable,
                    "--no-playlist",
                    "--no-progress",
                    "--write-info-json",
                    "--format", "best",
                    "-o", targetDir.resolve("%(id)s.%(ext)s").toString(),
                    "--print", "after_move:filepath",
                    "--no-simulate",
                    url
            ), timeout);
        } catch (IOException e) {
            throw new PlatformException(PlatformErrorKind.UNKNOWN, "yt-dlp did not run: " + e.getMessage(), e);
        }

        if (!r.isSuccess()) {
            String detail = ProcessRunner.tail(r.stderr());
            PlatformErrorKind kind = classify(detail);
            log.debug("yt-dlp failed url={} exitCode={} kind={}", url, r.exitCode(), kind);
            throw new PlatformException(kind, detail.isEmpty() ? "yt-dlp exit " + r.exitCode() : detail);
        }

        Path media = lastLine(r.stdout());
        if (media == null || !Files.isRegularFile(media)) {
            throw new PlatformException(PlatformErrorKind.UNKNOWN, "yt-dlp reported no downloaded file for " + url);
        }

        MediaProbe.MediaInfo info;
        try {
            info = probe.probe(media);
        } catch (IOException e) {
            throw new PlatformException(PlatformErrorKind.UNKNOWN, "downloaded file is not playable media: " + e.getMessage(), e);
        }
        MediaAsset asset = new MediaAsset(media.toString(), info.durationSeconds(), info.width(), info.height(),
                info.hasAudio(), null);
        return new FetchedMedia(asset, readInfoJson(media));
    }

    /**
     * Maps yt-dlp stderr to an error kind. Throttling is checked first since it is often reported together
     * with a generic "unable to download" line.
     */
    public static PlatformErrorKind classify(String stderr) {
        String s = stderr == null ? "" : stderr.toLowerCase(Locale.ROOT);
        if (containsAny(s, "http error 429", "too many requests", "rate limit", "rate-limit")) {
            return PlatformErrorKind.RATE_LIMITED;
        }
        if (containsAny(s, "login required", "log in", "sign in", "authentication", "use --cookies",
                "private video", "this video is private", "account is private", "age-restricted")) {
            return PlatformErrorKind.AUTH_REQUIRED;
        }
        if (containsAny(s, "removed", "suspended", "deleted", "no longer available", "unavailable",
                "copyright", "terminated")) {
            return PlatformErrorKind.REMOVED;
        }
        if (containsAny(s, "http error 404", "not found", "does not exist", "no video could be found",
                "unsupported url")) {
            return PlatformErrorKind.NOT_FOUND;
        }
        return PlatformErrorKind.UNKNOWN;
    }

    private Map<String, Object> readInfoJson(Path media) {
        String name = media.getFileName().toString();
        int dot = name.lastIndexOf('.');
        Path info = media.resolveSibling((dot > 0 ? name.substring(0, dot) : name) + ".info.json");
        if (!Files.isRegularFile(info)) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(info.toFile(), new TypeReference<>() {
            });
        } catch (IOException e) {
            log.warn("unreadable info json path={} msg={}", info, e.getMessage());
            return Map.of();
        }
    }

    private static Path lastLine(String stdout) {
        if (stdout == null) {
            return null;
        }
        String[] lines = stdout.strip().split("\\R");
        String last = lines[lines.length - 1].strip();
        return last.isEmpty() ? null : Path.of(last);
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String n : needles) {
            if (haystack.contains(n)) {
                return true;
            }
        }
        return false;
    }
}
