package io.vidsort4j.extract;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks still-frame offsets for OCR and vision.
 *
 * <p>Overlay text (captions, channel names, headlines) concentrates at the start and end of short clips,
 * so offsets cluster in the first quarter and the last quarter of the media instead of being spread
 * evenly. At least {@value #MIN_SAMPLES} offsets are always produced.
 */
public class FrameSampler {

    public static final int MIN_SAMPLES = 5;

    private final int samples;

    public FrameSampler(int samples) {
        this.samples = Math.max(MIN_SAMPLES, samples);
    }

    public int samples() {
        return samples;
    }

    /**
     * @return ascending offsets in seconds within {@code [0, duration]}
     */
    public List<Double> offsets(double durationSeconds) {
        double d = Math.max(0.0, durationSeconds);
        int head = (samples + 1) / 2;
        int tail = samples - head;

        double headStart = Math.min(1.0, d * 0.05);
        double headEnd = Math.max(headStart, d * 0.25);
        double tailStart = d * 0.75;
        double tailEnd = Math.max(tailStart, d - Math.min(0.5, d * 0.05));

        List<Double> out = new ArrayList<>(samples);
        spread(out, headStart, headEnd, head);
        spread(out, tailStart, tailEnd, tail);
        return out;
    }

    private static void spread(List<Double> out, double from, double to, int count) {
        if (count <= 0) {
            return;
        }
        if (count == 1) {
            out.add(round((from + to) / 2.0));
            return;
        }
        double step = (to - from) / (count - 1);
        for (int i = 0; i < count; i++) {
            out.add(round(from + step * i));
        }
    }

    private static double round(double seconds) {
        return Math.round(seconds * 1000.0) / 1000.0;
    }
}
