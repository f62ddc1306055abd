package com.example.datalake.sentiment.response;

import com.example.datalake.sentiment.model.UserContext;
import java.util.Arrays;
import java.util.List;

public record UserContextResponse(
        String callerId,
        long lastInteraction,
        int lastInputToken,
        List<Integer> topics,
        List<Integer> classHistory,
        int totalInteractions,
        int sentimentBias,
        String primaryDomain
) {

    public static UserContextResponse of(String callerId, UserContext ctx) {
        return new UserContextResponse(
                callerId,
                ctx.getLastInteraction(),
                ctx.getLastInputToken(),
                Arrays.stream(ctx.getTopics()).boxed().toList(),
                Arrays.stream(ctx.getClassHistory()).boxed().toList(),
                ctx.getTotalInteractions(),
                ctx.getSentimentBias(),
                ctx.getPrimaryDomain().name());
    }
}
