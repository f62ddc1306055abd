package com.example.datalake.sentiment.store;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.DomainModifier;
import com.example.datalake.sentiment.model.SentimentClass;
import java.util.Arrays;

/** Class bias and intensity per domain. Every domain starts neutral. */
public class DomainModel {

    private final DomainModifier[] modifiers = new DomainModifier[Domain.COUNT];

    public DomainModel() {
        for (int d = 0; d < modifiers.length; d++) {
            modifiers[d] = DomainModifier.neutral();
        }
    }

    public DomainModifier modifier(Domain domain) {
        return modifiers[domain.id()];
    }

    public void setModifier(Domain domain, int[] bias, int intensity) {
        modifiers[domain.id()] = new DomainModifier(Arrays.copyOf(bias, SentimentClass.COUNT), intensity);
    }

    /**
     * Adds {@code bias[c] * intensity * 10} to each class score. GENERAL and zero-intensity domains
     * leave the scores untouched.
     */
    public void apply(Domain domain, long[] scores) {
        DomainModifier modifier = modifiers[domain.id()];
        if (domain == Domain.GENERAL || modifier.getIntensity() == 0) {
            return;
        }
        for (int c = 0; c < scores.length; c++) {
            scores[c] += (long) modifier.getBias()[c] * modifier.getIntensity() * 10;
        }
    }

    public DomainModel copy() {
        DomainModel copy = new DomainModel();
        for (int d = 0; d < modifiers.length; d++) {
            copy.modifiers[d] = modifiers[d].copy();
        }
        return copy;
    }
}
