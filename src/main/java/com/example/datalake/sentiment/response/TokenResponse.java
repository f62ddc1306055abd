package com.example.datalake.sentiment.response;

import com.example.datalake.sentiment.model.TokenFlag;
import com.example.datalake.sentiment.model.TokenMetadata;
import java.util.Set;

public record TokenResponse(
        int id,
        String word,
        int sentiment,
        Set<TokenFlag> flags,
        String category,
        String secondaryCategory,
        int weight,
        String domainRelevance,
        int domainStrength,
        int contextInfluence,
        long usageCount,
        long cooccurrenceCount
) {

    public static TokenResponse of(int id, TokenMetadata meta) {
        return new TokenResponse(
                id,
                meta.getWord(),
                meta.getSentiment(),
                TokenFlag.unpack(meta.getFlags()),
                meta.getCategory().name(),
                meta.getSecondaryCategory().name(),
                meta.getWeight(),
                meta.getDomainRelevance().name(),
                meta.getDomainStrength(),
                meta.getContextInfluence(),
                meta.getUsageCount(),
                meta.getCooccurrenceCount());
    }
}
