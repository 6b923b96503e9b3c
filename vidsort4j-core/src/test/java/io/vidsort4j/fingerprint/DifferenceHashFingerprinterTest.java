package io.vidsort4j.fingerprint;

import io.vidsort4j.core.MediaAsset;
import io.vidsort4j.core.error.FingerprintException;
import io.vidsort4j.media.FrameGrabber;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DifferenceHashFingerprinterTest {

    @TempDir
    Path tmp;

    @Test
    void hashShouldEncodeHorizontalGradients() {
        assertEquals(-1L, DifferenceHashFingerprinter.hash(gradient(90, 80, true, 1.0)));
        assertEquals(0L, DifferenceHashFingerprinter.hash(gradient(90, 80, false, 1.0)));
    }

    @Test
    void hashShouldSurviveRescalingAndDimming() {
        long original = DifferenceHashFingerprinter.hash(gradient(1280, 720, true, 1.0));
        long reencoded = DifferenceHashFingerprinter.hash(gradient(640, 360, true, 0.6));

        assertEquals(0, PerceptualHashes.hammingDistance(original, reencoded));
    }

    @Test
    void fingerprintShouldHashTheGrabbedFrame() throws Exception {
        Path frame = tmp.resolve("source.png");
        ImageIO.write(gradient(320, 180, true, 1.0), "png", frame.toFile());
        Path media = Files.writeString(tmp.resolve("clip.mp4"), "not really a video");

        FrameGrabber grabber = (m, offset, target) -> Files.copy(frame, target, StandardCopyOption.REPLACE_EXISTING);
        DifferenceHashFingerprinter fingerprinter = new DifferenceHashFingerprinter(grabber, tmp.resolve("work"));

        String hash = fingerprinter.fingerprint(new MediaAsset(media.toString(), 12.0, 320, 180, true, null));

        assertEquals("ffffffffffffffff", hash);
    }

    @Test
    void emptyFrameShouldFail() throws IOException {
        Path media = Files.writeString(tmp.resolve("clip.mp4"), "x");
        FrameGrabber grabber = (m, offset, target) -> {
        };
        DifferenceHashFingerprinter fingerprinter = new DifferenceHashFingerprinter(grabber, tmp.resolve("work"));

        assertThrows(FingerprintException.class,
                () -> fingerprinter.fingerprint(new MediaAsset(media.toString(), 5.0, 0, 0, false, null)));
    }

    @Test
    void grabberErrorShouldFail() throws IOException {
        Path media = Files.writeString(tmp.resolve("clip.mp4"), "x");
        FrameGrabber grabber = (m, offset, target) -> {
            throw new IOException("ffmpeg exited with 1");
        };
        DifferenceHashFingerprinter fingerprinter = new DifferenceHashFingerprinter(grabber, tmp.resolve("work"));

        FingerprintException e = assertThrows(FingerprintException.class,
                () -> fingerprinter.fingerprint(new MediaAsset(media.toString(), 5.0, 0, 0, false, null)));
        assertEquals(IOException.class, e.getCause().getClass());
    }

    @Test
    void missingMediaShouldFail() {
        DifferenceHashFingerprinter fingerprinter = new DifferenceHashFingerprinter((m, o, t) -> {
        }, tmp);

        assertThrows(FingerprintException.class,
                () -> fingerprinter.fingerprint(new MediaAsset(tmp.resolve("gone.mp4").toString(), 5.0, 0, 0, false, null)));
    }

    @Test
    void sampleOffsetShouldStayInsideShortClips() {
        assertEquals(1.0, DifferenceHashFingerprinter.sampleOffset(30.0));
        assertEquals(0.25, DifferenceHashFingerprinter.sampleOffset(0.5));
        assertEquals(0.0, DifferenceHashFingerprinter.sampleOffset(0.0));
    }

    private static BufferedImage gradient(int width, int height, boolean brightLeft, double scale) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            double t = (double) x / (width - 1);
            int v = (int) Math.round((brightLeft ? 1.0 - t : t) * 255 * scale);
            int rgb = (v << 16) | (v << 8) | v;
            for (int y = 0; y < height; y++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }
}
