package io.vidsort4j.core;

import java.util.Optional;

/**
 * Closed core tag vocabulary. Labels outside it go to the proposed-tag log.
 */
public enum Tag {
    BIRTH_PREVENTION("Birth Prevention"),
    CEASEFIRE_VIOLATION("Ceasefire Violation"),
    CHILDREN("Children"),
    FOOD("Food"),
    JOURNALISTS("Journalists"),
    HEALTHCARE_WORKERS("Healthcare workers"),
    HOSPITALS("Hospitals"),
    HOSTAGES("Hostages"),
    MOSQUES("Mosques"),
    PRISONERS("Prisoners"),
    SCHOOLS("Schools"),
    WATER("Water"),
    REPRESSION("Repression"),
    TORTURE("Torture"),
    TESTIMONIALS("Testimonials"),
    WOMEN("Women"),
    IDF("IDF"),
    SETTLERS("Settlers"),
    OTHER("Other");

    private final String label;

    Tag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Tag> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = label.trim();
        for (Tag t : values()) {
            if (t.label.equalsIgnoreCase(wanted) || t.name().equalsIgnoreCase(wanted)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
