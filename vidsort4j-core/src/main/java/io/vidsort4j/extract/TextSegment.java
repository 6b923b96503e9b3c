package io.vidsort4j.extract;

import java.util.List;
import java.util.Objects;

/**
 * A piece of extracted text and the sampled frames it came from.
 */
public record TextSegment(String text, List<Integer> frameRefs) {
    public TextSegment {
        Objects.requireNonNull(text, "text must not be null");
        frameRefs = frameRefs == null ? List.of() : List.copyOf(frameRefs);
    }
}
