package com.example.datalake.sentiment.model;

import java.util.Locale;

/**
 * Topic domains used to bias scoring. {@link #GENERAL} is the baseline and never modifies
 * scores.
 */
public enum Domain {
    GENERAL,
    FINANCE,
    HEALTH,
    TECHNOLOGY,
    POLITICS,
    SPORTS,
    ENTERTAINMENT,
    TRAVEL,
    FOOD,
    EDUCATION;

    public static final int COUNT = values().length;

    public int id() {
        return ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static boolean isValidId(int id) {
        return id >= 0 && id < COUNT;
    }

    public static Domain fromId(int id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Unknown domain id: " + id);
        }
        return values()[id];
    }
}
