package io.vidsort4j.core;

public enum EvidenceSource {
    AUDIO,
    OCR,
    VISION
}
