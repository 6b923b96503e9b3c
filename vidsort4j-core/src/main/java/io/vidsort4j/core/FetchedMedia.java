package io.vidsort4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a successful platform fetch: the probed media and the platform's raw metadata.
 */
public record FetchedMedia(
        MediaAsset asset,
        Map<String, Object> rawMetadata
) {
    public FetchedMedia {
        // platform metadata routinely carries null values, which Map.copyOf rejects
        rawMetadata = rawMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawMetadata));
    }
}
