package com.example.datalake.sentiment.engine;

import com.example.datalake.sentiment.config.EngineProperties;
import com.example.datalake.sentiment.model.ClassificationResult;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.UserContext;
import com.example.datalake.sentiment.store.EngineState;
import com.example.datalake.sentiment.store.VocabularyStore;
import com.example.datalake.sentiment.validation.ValidationContext;
import com.example.datalake.sentiment.validation.ValidationService;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs one classification against an {@link EngineState}: validate, record usage and
 * co-occurrence, detect the domain, aggregate embeddings, score the classes, modulate, decide and
 * commit the caller's context and the global statistics.
 *
 * <p>Only validation can fail, and it runs before the first write. The caller is responsible for
 * serialising calls on the same state.
 */
@Slf4j
@Component
public class SentimentClassifier {

    static final int SENTIMENT_FACTOR = 15;
    static final int RECENT_INPUT_DIVISOR = 10;
    static final int TOPIC_DIVISOR = 20;

    private final ValidationService validationService;
    private final SimilarityEngine similarityEngine;
    private final DomainDetector domainDetector;
    private final UserContextAdapter userContextAdapter;
    private final EngineProperties properties;
    private final Clock clock;

    public SentimentClassifier(ValidationService validationService,
                               SimilarityEngine similarityEngine,
                               DomainDetector domainDetector,
                               UserContextAdapter userContextAdapter,
                               EngineProperties properties,
                               Clock clock) {
        this.validationService = validationService;
        this.similarityEngine = similarityEngine;
        this.domainDetector = domainDetector;
        this.userContextAdapter = userContextAdapter;
        this.properties = properties;
        this.clock = clock;
    }

    public ClassificationOutcome classify(EngineState state, String caller, List<Integer> tokenIds) {
        ValidationContext validated = validationService.validate(tokenIds, state.vocabulary().size());
        int[] tokens = validated.tokenArray();
        VocabularyStore vocabulary = state.vocabulary();
        long now = clock.instant().getEpochSecond();

        for (int id : tokens) {
            vocabulary.recordUsage(id);
        }
        state.cooccurrence().recordInput(tokens, vocabulary);
        String inputText = vocabulary.render(tokens);

        Domain domain = domainDetector.detect(vocabulary, tokens);
        Aggregate aggregate = aggregate(vocabulary, tokens);

        UserContext context = state.userContexts().getOrCreate(caller);
        long[] scores = score(state, context, tokens, aggregate, now);
        state.domains().apply(domain, scores);
        userContextAdapter.apply(context, scores);

        int winnerId = ScoreDecision.winner(scores);
        long confidence = ScoreDecision.confidence(scores, winnerId);
        SentimentClass winner = SentimentClass.fromId(winnerId);

        commit(state, context, tokens, domain, winner, now);

        log.debug("[classifier] caller={} tokens={} domain={} scores={} winner={} confidence={}",
                caller, Arrays.toString(tokens), domain, Arrays.toString(scores), winner, confidence);
        return new ClassificationOutcome(
                caller,
                new ClassificationResult(winner, confidence, domain),
                inputText,
                scores,
                aggregate.sentiment());
    }

    /**
     * Weighted mean of the input embeddings and sentiments. Each token weighs
     * {@link TokenMetadata#effectiveWeight()}; with zero total weight every aggregate stays 0.
     */
    Aggregate aggregate(VocabularyStore vocabulary, int[] tokens) {
        long[] semantic = new long[EngineLimits.SEMANTIC_DIM];
        long[] context = new long[EngineLimits.CONTEXT_DIM];
        long sentiment = 0;
        long totalWeight = 0;

        for (int id : tokens) {
            TokenMetadata meta = vocabulary.metadata(id);
            long weight = meta.effectiveWeight();
            int[] tokenSemantic = vocabulary.semantic(id);
            int[] tokenContext = vocabulary.context(id);
            for (int d = 0; d < semantic.length; d++) {
                semantic[d] += weight * tokenSemantic[d];
            }
            for (int d = 0; d < context.length; d++) {
                context[d] += weight * tokenContext[d];
            }
            sentiment += weight * meta.getSentiment();
            totalWeight += weight;
        }

        if (totalWeight != 0) {
            for (int d = 0; d < semantic.length; d++) {
                semantic[d] /= totalWeight;
            }
            for (int d = 0; d < context.length; d++) {
                context[d] /= totalWeight;
            }
            sentiment /= totalWeight;
        }
        return new Aggregate(semantic, context, sentiment);
    }

    private long[] score(EngineState state, UserContext context, int[] tokens, Aggregate aggregate, long now) {
        VocabularyStore vocabulary = state.vocabulary();

        // shared by every class: the recent-input and topic terms do not depend on the class
        long sharedBonus = 0;
        if (isRecent(context, now)) {
            sharedBonus += similarityEngine.similarity(state, tokens[0], context.getLastInputToken(), true)
                    / RECENT_INPUT_DIVISOR;
        }
        for (int token : tokens) {
            for (int topic : context.getTopics()) {
                if (topic != 0) {
                    sharedBonus += similarityEngine.similarity(state, token, topic, false) / TOPIC_DIVISOR;
                }
            }
        }

        long[] scores = new long[SentimentClass.COUNT];
        for (int c = 0; c < scores.length; c++) {
            scores[c] = FixedPoint.dot(aggregate.semantic(), vocabulary.classSemantic(c))
                    + FixedPoint.dot(aggregate.context(), vocabulary.classContext(c))
                    + aggregate.sentiment() * SENTIMENT_FACTOR
                    + sharedBonus;
        }
        return scores;
    }

    private boolean isRecent(UserContext context, long now) {
        return context.hasInteracted()
                && now - context.getLastInteraction() < properties.getRecencyWindow().getSeconds();
    }

    private static void commit(EngineState state, UserContext context, int[] tokens, Domain domain,
                               SentimentClass winner, long now) {
        context.setLastInteraction(now);
        context.setLastInputToken(tokens[0]);
        if (domain != Domain.GENERAL) {
            context.setPrimaryDomain(domain);
        }
        context.pushTopic(tokens[0]);
        context.recordClass(winner);
        state.statistics().record(winner);
    }

    record Aggregate(long[] semantic, long[] context, long sentiment) {
    }
}
