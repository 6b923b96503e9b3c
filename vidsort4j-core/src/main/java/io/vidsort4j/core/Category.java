package io.vidsort4j.core;

import java.util.Optional;

/**
 * Closed category vocabulary. Declaration order doubles as the final tie-break in fusion:
 * deaths first, then starvation, destruction and displacement.
 */
public enum Category {
    WILLFUL_KILLING("Willful Killing"),
    STARVATION_OF_CIVILIAN("Starvation of Civilian"),
    DESTRUCTION_OF_PROPERTY("Destruction of Property"),
    DISPLACEMENT("Displacement"),
    INHUMANE_ACTS("Inhumane Acts"),
    IMPRISONMENT("Imprisonment"),
    IDF("IDF"),
    TESTIMONIALS("Testimonials"),
    RESILIENCE("Resilience"),
    JEWISH_DISSENT("Jewish Dissent"),
    UNKNOWN("Unknown");

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<Category> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String wanted = label.trim();
        for (Category c : values()) {
            if (c.label.equalsIgnoreCase(wanted) || c.name().equalsIgnoreCase(wanted)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
