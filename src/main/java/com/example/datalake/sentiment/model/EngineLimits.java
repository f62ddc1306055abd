package com.example.datalake.sentiment.model;

/** Fixed sizes and caps shared by every part of the engine. */
public final class EngineLimits {

    public static final int MAX_VOCABULARY = 1024;
    public static final int SEMANTIC_DIM = 24;
    public static final int CONTEXT_DIM = 8;
    public static final int MAX_INPUT_TOKENS = 16;
    public static final int TOPIC_SLOTS = 3;

    /** Fixed-point scale: an embedding value of 1000 stands for 1.0. */
    public static final int SCALE = 1000;

    public static final int MIN_WEIGHT = 1;
    public static final int MAX_WEIGHT = 10;

    public static final int COOCCURRENCE_MAX = 65535;
    public static final int CLASS_HISTORY_MAX = 255;
    public static final int INTERACTIONS_MAX = 65535;
    public static final long COUNTER_MAX = Long.MAX_VALUE;

    // overwrite bounds; every score product stays within long range
    public static final int MAX_EMBEDDING_MAGNITUDE = 1_000_000;
    public static final int MAX_DOMAIN_BIAS = 1000;
    public static final int MAX_DOMAIN_INTENSITY = 100;

    private EngineLimits() {
    }

    /** Adds one to {@code value} unless it already sits at {@code max}. */
    public static int saturatingIncrement(int value, int max) {
        return value >= max ? max : value + 1;
    }

    public static long saturatingIncrement(long value, long max) {
        return value >= max ? max : value + 1;
    }
}
