package io.vidsort4j.extract;

import io.vidsort4j.media.FrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Frames grabbed into a private temporary directory; closing deletes them.
 */
final class SampledFrames implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SampledFrames.class);

    record Frame(int index, double offsetSeconds, Path path) {
    }

    private final Path dir;
    private final List<Frame> frames;
    private final int requested;

    private SampledFrames(Path dir, List<Frame> frames, int requested) {
        this.dir = dir;
        this.frames = frames;
        this.requested = requested;
    }

    static SampledFrames grab(FrameGrabber grabber, Path media, List<Double> offsets, Path workDir, String prefix)
            throws IOException {
        Files.createDirectories(workDir);
        Path dir = Files.createTempDirectory(workDir, prefix);
        List<Frame> frames = new ArrayList<>(offsets.size());
        for (int i = 0; i < offsets.size(); i++) {
            double offset = offsets.get(i);
            Path target = dir.resolve(String.format("frame-%02d.png", i));
            try {
                grabber.grab(media, offset, target);
                if (Files.isRegularFile(target) && Files.size(target) > 0) {
                    frames.add(new Frame(i, offset, target));
                } else {
                    log.debug("no frame produced media={} offset={}", media, offset);
                }
            } catch (IOException e) {
                log.debug("frame grab failed media={} offset={} msg={}", media, offset, e.getMessage());
            }
        }
        return new SampledFrames(dir, frames, offsets.size());
    }

    List<Frame> frames() {
        return frames;
    }

    List<Path> paths() {
        return frames.stream().map(Frame::path).toList();
    }

    List<Integer> indices() {
        return frames.stream().map(Frame::index).toList();
    }

    boolean isEmpty() {
        return frames.isEmpty();
    }

    int requested() {
        return requested;
    }

    @Override
    public void close() {
        try (var paths = Files.list(dir)) {
            for (Path p : (Iterable<Path>) paths::iterator) {
                Files.deleteIfExists(p);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.warn("could not clean frame directory path={} msg={}", dir, e.getMessage());
        }
    }
}
