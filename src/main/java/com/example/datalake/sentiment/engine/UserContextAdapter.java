package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.UserContext;
import org.springframework.stereotype.Component;

/** Folds a caller's sentiment bias and class history into the class scores. */
@Component
public class UserContextAdapter {

    static final int BIAS_FACTOR = 20;
    static final int HISTORY_FACTOR = 5;

    public void apply(UserContext context, long[] scores) {
        int bias = context.getSentimentBias();
        if (bias != 0) {
            long shift = (long) bias * BIAS_FACTOR;
            for (SentimentClass c : SentimentClass.values()) {
                if (c.isAboveNeutral()) {
                    scores[c.id()] += shift;
                } else if (c.isBelowNeutral()) {
                    scores[c.id()] -= shift;
                }
            }
        }

        if (context.getTotalInteractions() > 0) {
            int[] history = context.getClassHistory();
            for (int c = 0; c < scores.length; c++) {
                scores[c] += (long) HISTORY_FACTOR * history[c];
            }
        }
    }
}
