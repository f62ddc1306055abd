package com.example.datalake.sentiment.model;

import java.util.Locale;

/** The seven ordered sentiment classes; the ordinal is the wire id. */
public enum SentimentClass {
    VERY_NEGATIVE,
    NEGATIVE,
    SLIGHTLY_NEGATIVE,
    NEUTRAL,
    SLIGHTLY_POSITIVE,
    POSITIVE,
    VERY_POSITIVE;

    public static final int COUNT = values().length;

    public int id() {
        return ordinal();
    }

    public boolean isAboveNeutral() {
        return ordinal() > NEUTRAL.ordinal();
    }

    public boolean isBelowNeutral() {
        return ordinal() < NEUTRAL.ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    public static SentimentClass fromId(int id) {
        if (id < 0 || id >= COUNT) {
            throw new IllegalArgumentException("Unknown sentiment class id: " + id);
        }
        return values()[id];
    }
}
