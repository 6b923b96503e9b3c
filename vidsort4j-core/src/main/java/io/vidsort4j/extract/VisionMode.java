package io.vidsort4j.extract;

public enum VisionMode {
    /** Never describe frames. */
    OFF,
    /** Urgent jobs, and jobs whose text evidence leaves the category ambiguous. */
    AUTO,
    ALWAYS
}
