package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.store.EngineState;
import com.example.datalake.sentiment.store.VocabularyStore;
import org.springframework.stereotype.Component;

/**
 * Pairwise token similarity. Read-only over the state it is handed.
 *
 * <p>The score is the fixed-point dot product of the semantic embeddings, optionally plus half
 * the context dot product, then a set of flat bonuses:
 *
 * <ul>
 *   <li>+150 for the same primary category, else +75 when one token's secondary category is the
 *       other's primary
 *   <li>+100 when both carry the same non-general domain
 *   <li>+5 per recorded co-occurrence of the pair
 *   <li>+50 for same-sign sentiments, -30 for opposite signs, nothing if either is zero
 * </ul>
 */
@Component
public class SimilarityEngine {

    static final int PRIMARY_CATEGORY_BONUS = 150;
    static final int SECONDARY_CATEGORY_BONUS = 75;
    static final int DOMAIN_BONUS = 100;
    static final int COOCCURRENCE_BONUS = 5;
    static final int SAME_POLARITY_BONUS = 50;
    static final int OPPOSITE_POLARITY_PENALTY = 30;

    public long similarity(EngineState state, int tokenA, int tokenB, boolean includeContext) {
        VocabularyStore vocabulary = state.vocabulary();
        if (!vocabulary.contains(tokenA) || !vocabulary.contains(tokenB)) {
            return 0;
        }

        long score = FixedPoint.dot(vocabulary.semantic(tokenA), vocabulary.semantic(tokenB));
        if (includeContext) {
            score += FixedPoint.dot(vocabulary.context(tokenA), vocabulary.context(tokenB)) / 2;
        }

        TokenMetadata a = vocabulary.metadata(tokenA);
        TokenMetadata b = vocabulary.metadata(tokenB);

        if (a.getCategory() == b.getCategory()) {
            score += PRIMARY_CATEGORY_BONUS;
        } else if (a.getSecondaryCategory() == b.getCategory() || b.getSecondaryCategory() == a.getCategory()) {
            score += SECONDARY_CATEGORY_BONUS;
        }

        if (a.getDomainRelevance() != Domain.GENERAL && a.getDomainRelevance() == b.getDomainRelevance()) {
            score += DOMAIN_BONUS;
        }

        score += (long) COOCCURRENCE_BONUS * state.cooccurrence().count(tokenA, tokenB);

        if (a.getSentiment() != 0 && b.getSentiment() != 0) {
            boolean samePolarity = (a.getSentiment() > 0) == (b.getSentiment() > 0);
            score += samePolarity ? SAME_POLARITY_BONUS : -OPPOSITE_POLARITY_PENALTY;
        }
        return score;
    }
}
