package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.EngineLimits;

/**
 * Scaled-integer vector math. Every product is divided by {@link EngineLimits#SCALE} before it is
 * summed, and Java's truncating division is the rounding rule.
 */
public final class FixedPoint {

    private FixedPoint() {
    }

    public static long dot(int[] a, int[] b) {
        long sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (long) a[i] * b[i] / EngineLimits.SCALE;
        }
        return sum;
    }

    public static long dot(long[] a, int[] b) {
        long sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i] / EngineLimits.SCALE;
        }
        return sum;
    }
}
