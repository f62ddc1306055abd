package com.example.datalake.sentiment.model;

/** Lexical category of a vocabulary entry. Tokens carry a primary and a secondary one. */
public enum Category {
    GENERAL,
    EMOTION,
    OPINION,
    EVALUATION,
    INTENSIFIER,
    NEGATION,
    ACTION,
    OBJECT,
    DESCRIPTOR;

    public static final int COUNT = values().length;

    public static boolean isValidId(int id) {
        return id >= 0 && id < COUNT;
    }

    public static Category fromId(int id) {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Unknown category id: " + id);
        }
        return values()[id];
    }
}
