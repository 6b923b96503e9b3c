package io.vidsort4j.fingerprint;

import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.FingerprintException;
import io.vidsort4j.media.FrameGrabber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 64-bit difference hash (dHash) of one frame.
 *
 * <p>The frame at {@code min(1s, duration / 2)} is reduced to a 9x8 grayscale grid by area averaging;
 * each bit records whether a cell is brighter than its right neighbour. Re-encodes and rescales of the
 * same video land within a few bits of each other.
 */
public class DifferenceHashFingerprinter implements ContentFingerprinter {
    private static final Logger log = LoggerFactory.getLogger(DifferenceHashFingerprinter.class);

    static final int GRID_WIDTH = 9;
    static final int GRID_HEIGHT = 8;
    static final double SAMPLE_OFFSET_SECONDS = 1.0;

    private final FrameGrabber frameGrabber;
    private final Path workDir;

    public DifferenceHashFingerprinter(FrameGrabber frameGrabber, Path workDir) {
        this.frameGrabber = Objects.requireNonNull(frameGrabber, "frameGrabber must not be null");
        this.workDir = Objects.requireNonNull(workDir, "workDir must not be null");
    }

    @Override
    public String fingerprint(MediaAsset asset) throws FingerprintException {
        Objects.requireNonNull(asset, "asset must not be null");
        Path media = Path.of(asset.path());
        if (!Files.isRegularFile(media)) {
            throw new FingerprintException("media file missing: " + media);
        }

        double offset = sampleOffset(asset.durationSeconds());
        Path frame = null;
        try {
            Files.createDirectories(workDir);
            frame = Files.createTempFile(workDir, "fingerprint-", ".png");
            frameGrabber.grab(media, offset, frame);

            BufferedImage image = Files.size(frame) == 0 ? null : ImageIO.read(frame.toFile());
            if (image == null) {
                throw new FingerprintException("unreadable frame at " + offset + "s in " + media);
            }
            String hash = PerceptualHashes.toHex(hash(image));
            log.debug("fingerprinted media={} offset={} hash={}", media, offset, hash);
            return hash;
        } catch (IOException e) {
            throw new FingerprintException("frame grab failed at " + offset + "s in " + media + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(frame);
        }
    }

    static double sampleOffset(double durationSeconds) {
        return Math.min(SAMPLE_OFFSET_SECONDS, Math.max(0.0, durationSeconds / 2.0));
    }

    /**
     * dHash of an image, row-major, most significant bit first.
     */
    public static long hash(BufferedImage image) {
        double[][] grid = grayscaleGrid(image, GRID_WIDTH, GRID_HEIGHT);
        long bits = 0L;
        for (int y = 0; y < GRID_HEIGHT; y++) {
            for (int x = 0; x < GRID_WIDTH - 1; x++) {
                bits <<= 1;
                if (grid[y][x] > grid[y][x + 1]) {
                    bits |= 1L;
                }
            }
        }
        return bits;
    }

    static double[][] grayscaleGrid(BufferedImage image, int cols, int rows) {
        int w = image.getWidth();
        int h = image.getHeight();
        double[][] sums = new double[rows][cols];
        int[][] counts = new int[rows][cols];
        for (int y = 0; y < h; y++) {
            int row = Math.min(rows - 1, (int) ((long) y * rows / h));
            for (int x = 0; x < w; x++) {
                int col = Math.min(cols - 1, (int) ((long) x * cols / w));
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                // ITU-R BT.601 luma
                sums[row][col] += 0.299 * r + 0.587 * g + 0.114 * b;
                counts[row][col]++;
            }
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                sums[r][c] = counts[r][c] == 0 ? 0.0 : sums[r][c] / counts[r][c];
            }
        }
        return sums;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("could not delete temp frame path={} msg={}", file, e.getMessage());
        }
    }
}
