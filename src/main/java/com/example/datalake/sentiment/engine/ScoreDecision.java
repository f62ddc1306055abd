package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.EngineLimits;

/**
 * Winner selection and confidence over a final score vector.
 *
 * <p>Confidence shifts every score by {@code 1000 - max} so the winner lands on exactly 1000, then
 * returns {@code 1000 * 1000 / sum} of the shifted scores, or 0 when that sum is not positive.
 * Shifted losers can be negative, so the result is not bounded to {@code [0, 1000]}.
 */
public final class ScoreDecision {

    private ScoreDecision() {
    }

    /** Index of the highest score; the lower index wins ties. */
    public static int winner(long[] scores) {
        int best = 0;
        for (int c = 1; c < scores.length; c++) {
            if (scores[c] > scores[best]) {
                best = c;
            }
        }
        return best;
    }

    public static long confidence(long[] scores, int winner) {
        long shift = EngineLimits.SCALE - scores[winner];
        long sum = 0;
        for (long score : scores) {
            sum += score + shift;
        }
        if (sum <= 0) {
            return 0;
        }
        return (scores[winner] + shift) * EngineLimits.SCALE / sum;
    }
}
