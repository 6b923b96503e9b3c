package io.vidsort4j.core;

public enum Priority {

    URGENT(10),
    NORMAL(0);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static Priority fromValue(int value) {
        return value >= URGENT.value ? URGENT : NORMAL;
    }

    /**
     * Parses a priority token from a URL list line ("urgent", "normal"); case-insensitive.
     */
    public static Priority parse(String token) {
        if (token == null || token.isBlank()) {
            return NORMAL;
        }
        for (Priority p : values()) {
            if (p.name().equalsIgnoreCase(token.trim())) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + token);
    }
}
