package io.vidsort4j.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.media.AudioTrackExtractor;
import io.vidsort4j.media.FrameGrabber;
import io.vidsort4j.media.MediaProbe;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * ffprobe/ffmpeg adapter for probing, frame grabbing and audio demuxing.
 */
public class FfmpegMediaTools implements MediaProbe, FrameGrabber, AudioTrackExtractor {

    private final ProcessRunner runner;
    private final ObjectMapper objectMapper;
    private final String ffmpeg;
    private final String ffprobe;
    private final Duration timeout;

    public FfmpegMediaTools(ProcessRunner runner, ObjectMapper objectMapper, String ffmpeg, String ffprobe,
                            Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.ffmpeg = Objects.requireNonNull(ffmpeg, "ffmpeg must not be null");
        this.ffprobe = Objects.requireNonNull(ffprobe, "ffprobe must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public MediaInfo probe(Path media) throws IOException {
        ProcessRunner.Result r = runner.runChecked(List.of(
                ffprobe,
                "-v", "quiet",
                "-print_format", "json",
                "-show_format",
                "-show_streams",
                media.toString()
        ), timeout);
        return parseProbe(objectMapper.readTree(r.stdout()));
    }

    /**
     * Reads duration, first video stream size and audio presence from {@code ffprobe -print_format json}.
     */
    static MediaInfo parseProbe(JsonNode root) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IOException("empty ffprobe output");
        }
        double duration = root.path("format").path("duration").asDouble(0.0);
        int width = 0;
        int height = 0;
        boolean hasAudio = false;
        boolean videoSeen = false;
        for (JsonNode stream : root.path("streams")) {
            String type = stream.path("codec_type").asText("");
            if ("video".equals(type) && !videoSeen) {
                videoSeen = true;
                width = stream.path("width").asInt(0);
                height = stream.path("height").asInt(0);
                if (duration <= 0.0) {
                    duration = stream.path("duration").asDouble(0.0);
                }
            } else if ("audio".equals(type)) {
                hasAudio = true;
            }
        }
        if (!videoSeen) {
            throw new IOException("no video stream");
        }
        return new MediaInfo(duration, width, height, hasAudio);
    }

    @Override
    public void grab(Path media, double offsetSeconds, Path target) throws IOException {
        runner.runChecked(List.of(
                ffmpeg,
                "-v", "error",
                "-ss", String.format(Locale.ROOT, "%.3f", Math.max(0.0, offsetSeconds)),
                "-i", media.toString(),
                "-frames:v", "1",
                "-q:v", "2",
                "-y",
                target.toString()
        ), timeout);
    }

    @Override
    public void extractAudio(Path media, Path targetWav) throws IOException {
        runner.runChecked(List.of(
                ffmpeg,
                "-v", "error",
                "-i", media.toString(),
                "-vn",
                "-ac", "1",
                "-ar", "16000",
                "-c:a", "pcm_s16le",
                "-y",
                targetWav.toString()
        ), timeout);
    }
}
