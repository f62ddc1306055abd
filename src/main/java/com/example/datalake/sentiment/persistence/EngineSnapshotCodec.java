package com.example.datalake.sentiment.persistence;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.DomainModifier;
import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.UserContext;
import com.example.datalake.sentiment.store.EngineState;
import com.example.datalake.sentiment.store.VocabularyStore;
import com.example.datalake.sentiment.validation.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts between {@link EngineState} and {@link EngineSnapshot}, and between snapshots and
 * JSON. A restored state is a fresh object; the live state is only replaced by the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineSnapshotCodec {

    private final ObjectMapper objectMapper;

    public EngineSnapshot capture(EngineState state) {
        VocabularyStore vocabulary = state.vocabulary();
        EngineSnapshot snapshot = new EngineSnapshot();
        snapshot.setVocabularySize(vocabulary.size());

        for (int id = 0; id < vocabulary.size(); id++) {
            snapshot.getTokens().add(new EngineSnapshot.TokenEntry(id, vocabulary.metadata(id).copy()));
        }
        for (int id = 0; id < EngineLimits.MAX_VOCABULARY; id++) {
            if (isNonZero(vocabulary.semantic(id)) || isNonZero(vocabulary.context(id))) {
                snapshot.getEmbeddings().add(new EngineSnapshot.VectorEntry(
                        id, vocabulary.semantic(id).clone(), vocabulary.context(id).clone()));
            }
        }
        for (int c = 0; c < SentimentClass.COUNT; c++) {
            snapshot.getClassWeights().add(new EngineSnapshot.VectorEntry(
                    c, vocabulary.classSemantic(c).clone(), vocabulary.classContext(c).clone()));
        }

        state.cooccurrence().entries().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> snapshot.getCooccurrence().add(new EngineSnapshot.CooccurrenceEntry(
                        e.getKey() / EngineLimits.MAX_VOCABULARY,
                        e.getKey() % EngineLimits.MAX_VOCABULARY,
                        e.getValue())));

        for (Domain domain : Domain.values()) {
            snapshot.getDomainModifiers().add(state.domains().modifier(domain).copy());
        }
        state.userContexts().entries().forEach((caller, ctx) -> snapshot.getUserContexts().put(caller, ctx.copy()));

        snapshot.setTotalClassifications(state.statistics().totalClassifications());
        snapshot.setCorrectPredictions(state.statistics().correctPredictions());
        snapshot.setClassDistribution(state.statistics().distribution());
        return snapshot;
    }

    /** Builds a new state from {@code snapshot}; rejects structurally broken snapshots whole. */
    public EngineState restore(EngineSnapshot snapshot) {
        validate(snapshot);
        EngineState state = new EngineState();
        VocabularyStore vocabulary = state.vocabulary();

        nullSafe(snapshot.getTokens()).stream()
                .sorted(Comparator.comparingInt(EngineSnapshot.TokenEntry::id))
                .forEach(entry -> vocabulary.restoreToken(entry.id(), entry.metadata()));
        for (EngineSnapshot.VectorEntry entry : nullSafe(snapshot.getEmbeddings())) {
            vocabulary.setEmbedding(entry.id(), entry.semantic(), entry.context());
        }
        for (EngineSnapshot.VectorEntry entry : nullSafe(snapshot.getClassWeights())) {
            vocabulary.setClassWeights(entry.id(), entry.semantic(), entry.context());
        }
        for (EngineSnapshot.CooccurrenceEntry entry : nullSafe(snapshot.getCooccurrence())) {
            state.cooccurrence().restore(entry.a(), entry.b(), entry.count());
        }
        List<DomainModifier> modifiers = nullSafe(snapshot.getDomainModifiers());
        for (int d = 0; d < modifiers.size(); d++) {
            DomainModifier modifier = modifiers.get(d);
            state.domains().setModifier(Domain.fromId(d), modifier.getBias(), modifier.getIntensity());
        }
        nullSafe(snapshot.getUserContexts()).forEach((caller, ctx) -> state.userContexts().restore(caller, ctx));
        state.statistics().restore(
                snapshot.getTotalClassifications(),
                snapshot.getCorrectPredictions(),
                snapshot.getClassDistribution() == null ? new long[SentimentClass.COUNT] : snapshot.getClassDistribution());

        log.info("[snapshot] restored vocabulary={} contexts={} classifications={}",
                vocabulary.size(), state.userContexts().size(), snapshot.getTotalClassifications());
        return state;
    }

    public String write(EngineState state) {
        try {
            return objectMapper.writeValueAsString(capture(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise engine snapshot", e);
        }
    }

    public EngineState read(String json) {
        EngineSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, EngineSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Snapshot is not valid JSON: " + e.getOriginalMessage());
        }
        return restore(snapshot);
    }

    private void validate(EngineSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("Snapshot is required.");
        }
        List<String> reasons = new ArrayList<>();
        if (snapshot.getFormatVersion() != EngineSnapshot.FORMAT_VERSION) {
            reasons.add("Unsupported snapshot format version " + snapshot.getFormatVersion() + ".");
        }
        int size = snapshot.getVocabularySize();
        if (size < 0 || size > EngineLimits.MAX_VOCABULARY) {
            reasons.add("vocabularySize " + size + " is outside [0, " + EngineLimits.MAX_VOCABULARY + "].");
        }
        for (EngineSnapshot.TokenEntry entry : nullSafe(snapshot.getTokens())) {
            if (entry.id() < 0 || entry.id() >= size || entry.metadata() == null) {
                reasons.add("Token entry " + entry.id() + " is outside the vocabulary or has no metadata.");
            } else {
                checkToken(reasons, entry.id(), entry.metadata());
            }
        }
        for (EngineSnapshot.VectorEntry entry : nullSafe(snapshot.getEmbeddings())) {
            checkVectors(reasons, "embedding", entry, EngineLimits.MAX_VOCABULARY);
        }
        for (EngineSnapshot.VectorEntry entry : nullSafe(snapshot.getClassWeights())) {
            checkVectors(reasons, "class weights", entry, SentimentClass.COUNT);
        }
        for (EngineSnapshot.CooccurrenceEntry entry : nullSafe(snapshot.getCooccurrence())) {
            if (!isTokenId(entry.a()) || !isTokenId(entry.b())) {
                reasons.add("Co-occurrence entry (" + entry.a() + ", " + entry.b() + ") is out of range.");
            }
            if (entry.count() < 0 || entry.count() > EngineLimits.COOCCURRENCE_MAX) {
                reasons.add("Co-occurrence count " + entry.count() + " for (" + entry.a() + ", " + entry.b()
                        + ") is outside [0, " + EngineLimits.COOCCURRENCE_MAX + "].");
            }
        }
        List<DomainModifier> modifiers = nullSafe(snapshot.getDomainModifiers());
        if (modifiers.size() > Domain.COUNT) {
            reasons.add("Snapshot carries " + modifiers.size() + " domain modifiers, at most " + Domain.COUNT + " allowed.");
        }
        for (int d = 0; d < modifiers.size(); d++) {
            checkModifier(reasons, d, modifiers.get(d));
        }
        nullSafe(snapshot.getUserContexts()).forEach((caller, ctx) -> checkUserContext(reasons, caller, ctx));
        if (snapshot.getTotalClassifications() < 0 || snapshot.getCorrectPredictions() < 0) {
            reasons.add("Classification totals must not be negative.");
        }
        long[] distribution = snapshot.getClassDistribution();
        if (distribution != null && distribution.length != SentimentClass.COUNT) {
            reasons.add("classDistribution must have exactly " + SentimentClass.COUNT + " entries.");
        } else if (distribution != null && Arrays.stream(distribution).anyMatch(v -> v < 0)) {
            reasons.add("classDistribution must not hold negative counts.");
        }
        ValidationException.throwIfAny(reasons);
    }

    /**
     * A slot below the vocabulary size that was never written reads as blank metadata with zero
     * weight; every other token must satisfy the same bounds as a vocabulary upsert.
     */
    private static void checkToken(List<String> reasons, int id, TokenMetadata meta) {
        String where = "Token " + id + ": ";
        if (meta.getWord() == null) {
            reasons.add(where + "word is missing.");
        }
        if (meta.getCategory() == null || meta.getSecondaryCategory() == null || meta.getDomainRelevance() == null) {
            reasons.add(where + "category, secondaryCategory and domainRelevance are required.");
        }
        if (!isBlankSlot(meta)) {
            checkRange(reasons, where + "weight", meta.getWeight(), EngineLimits.MIN_WEIGHT, EngineLimits.MAX_WEIGHT);
            checkRange(reasons, where + "contextInfluence", meta.getContextInfluence(),
                    EngineLimits.MIN_WEIGHT, EngineLimits.MAX_WEIGHT);
        }
        if (meta.getDomainStrength() < 0) {
            reasons.add(where + "domainStrength " + meta.getDomainStrength() + " is negative.");
        }
        if (meta.getUsageCount() < 0 || meta.getCooccurrenceCount() < 0) {
            reasons.add(where + "usage and co-occurrence counters must not be negative.");
        }
    }

    private static boolean isBlankSlot(TokenMetadata meta) {
        return meta.getWeight() == 0
                && meta.getContextInfluence() == 0
                && meta.getSentiment() == 0
                && meta.getFlags() == 0
                && meta.getDomainStrength() == 0
                && (meta.getWord() == null || meta.getWord().isEmpty());
    }

    private static void checkModifier(List<String> reasons, int domainId, DomainModifier modifier) {
        if (modifier == null || modifier.getBias() == null || modifier.getBias().length != SentimentClass.COUNT) {
            reasons.add("Domain modifier " + domainId + " must carry exactly " + SentimentClass.COUNT + " biases.");
            return;
        }
        checkRange(reasons, "Domain modifier " + domainId + " intensity", modifier.getIntensity(),
                0, EngineLimits.MAX_DOMAIN_INTENSITY);
        for (int c = 0; c < modifier.getBias().length; c++) {
            checkRange(reasons, "Domain modifier " + domainId + " bias[" + c + "]", modifier.getBias()[c],
                    -EngineLimits.MAX_DOMAIN_BIAS, EngineLimits.MAX_DOMAIN_BIAS);
        }
    }

    private static void checkUserContext(List<String> reasons, String caller, UserContext ctx) {
        String where = "User context '" + caller + "': ";
        if (ctx == null || ctx.getTopics() == null || ctx.getTopics().length != EngineLimits.TOPIC_SLOTS
                || ctx.getClassHistory() == null || ctx.getClassHistory().length != SentimentClass.COUNT) {
            reasons.add(where + "topics or class history are malformed.");
            return;
        }
        if (ctx.getPrimaryDomain() == null) {
            reasons.add(where + "primaryDomain is required.");
        }
        if (ctx.getLastInteraction() < 0) {
            reasons.add(where + "lastInteraction " + ctx.getLastInteraction() + " is negative.");
        }
        if (!isTokenId(ctx.getLastInputToken())) {
            reasons.add(where + "lastInputToken " + ctx.getLastInputToken() + " is out of range.");
        }
        for (int topic : ctx.getTopics()) {
            if (!isTokenId(topic)) {
                reasons.add(where + "topic " + topic + " is out of range.");
            }
        }
        for (int c = 0; c < ctx.getClassHistory().length; c++) {
            checkRange(reasons, where + "classHistory[" + c + "]", ctx.getClassHistory()[c],
                    0, EngineLimits.CLASS_HISTORY_MAX);
        }
        checkRange(reasons, where + "totalInteractions", ctx.getTotalInteractions(),
                0, EngineLimits.INTERACTIONS_MAX);
    }

    private static void checkVectors(List<String> reasons, String what, EngineSnapshot.VectorEntry entry, int idBound) {
        if (entry.id() < 0 || entry.id() >= idBound) {
            reasons.add(what + " id " + entry.id() + " is out of range.");
        }
        if (entry.semantic() == null || entry.semantic().length != EngineLimits.SEMANTIC_DIM
                || entry.context() == null || entry.context().length != EngineLimits.CONTEXT_DIM) {
            reasons.add(what + " " + entry.id() + " has wrong vector dimensions.");
        } else if (exceedsMagnitude(entry.semantic()) || exceedsMagnitude(entry.context())) {
            reasons.add(what + " " + entry.id() + " has a component beyond "
                    + EngineLimits.MAX_EMBEDDING_MAGNITUDE + " in magnitude.");
        }
    }

    private static void checkRange(List<String> reasons, String field, int value, int min, int max) {
        if (value < min || value > max) {
            reasons.add(field + "=" + value + " is outside [" + min + ", " + max + "].");
        }
    }

    private static boolean exceedsMagnitude(int[] values) {
        return Arrays.stream(values).anyMatch(v -> Math.abs((long) v) > EngineLimits.MAX_EMBEDDING_MAGNITUDE);
    }

    private static boolean isTokenId(int id) {
        return id >= 0 && id < EngineLimits.MAX_VOCABULARY;
    }

    private static <T> List<T> nullSafe(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> values) {
        return values == null ? Map.of() : values;
    }

    private static boolean isNonZero(int[] values) {
        return Arrays.stream(values).anyMatch(v -> v != 0);
    }
}
