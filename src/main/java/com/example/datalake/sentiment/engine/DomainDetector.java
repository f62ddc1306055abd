package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.store.VocabularyStore;
import org.springframework.stereotype.Component;

/** Picks the topic domain of an input from its tokens' domain strengths. */
@Component
public class DomainDetector {

    /**
     * Sums each token's domain strength into the domain it is tagged with and returns the domain
     * with the strictly highest total. GENERAL holds the lead on ties.
     */
    public Domain detect(VocabularyStore vocabulary, int[] tokenIds) {
        long[] scores = new long[Domain.COUNT];
        for (int id : tokenIds) {
            TokenMetadata meta = vocabulary.metadata(id);
            if (meta.getDomainStrength() != 0) {
                scores[meta.getDomainRelevance().id()] += meta.getDomainStrength();
            }
        }

        int best = Domain.GENERAL.id();
        for (int d = 1; d < scores.length; d++) {
            if (scores[d] > scores[best]) {
                best = d;
            }
        }
        return Domain.fromId(best);
    }
}
