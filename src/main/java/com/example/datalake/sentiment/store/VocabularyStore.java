package com.example.datalake.sentiment.store;

import com.example.datalake.sentiment.model.Category;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.VocabularyBatch;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token metadata and embeddings addressed by token id, plus the per-class weight templates.
 *
 * <p>Slots are pre-allocated for the whole id range, so a token that sits below the current
 * vocabulary size but was never written reads as zeroed metadata with zero embeddings. Callers
 * validate before mutating; nothing here rejects input.
 */
public class VocabularyStore {

    private final TokenMetadata[] tokens = new TokenMetadata[EngineLimits.MAX_VOCABULARY];
    private final int[][] semantic = new int[EngineLimits.MAX_VOCABULARY][EngineLimits.SEMANTIC_DIM];
    private final int[][] context = new int[EngineLimits.MAX_VOCABULARY][EngineLimits.CONTEXT_DIM];
    private final int[][] classSemantic;
    private final int[][] classContext;
    private final Map<String, Integer> idsByWord = new HashMap<>();
    private int size;

    public VocabularyStore() {
        for (int i = 0; i < tokens.length; i++) {
            tokens[i] = new TokenMetadata();
        }
        this.classSemantic = new int[SentimentClass.COUNT][EngineLimits.SEMANTIC_DIM];
        this.classContext = new int[SentimentClass.COUNT][EngineLimits.CONTEXT_DIM];
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean contains(int tokenId) {
        return tokenId >= 0 && tokenId < size;
    }

    /**
     * Replaces the metadata of every token in the batch and grows the vocabulary to cover the
     * highest id written. Usage and co-occurrence counters and embeddings are kept.
     */
    public void applyBatch(VocabularyBatch batch) {
        int highest = -1;
        for (int i = 0; i < batch.size(); i++) {
            int id = batch.getTokenIds().get(i);
            TokenMetadata previous = tokens[id];
            String word = normalizeWord(batch.getWords().get(i));
            highest = Math.max(highest, id);

            tokens[id] = TokenMetadata.builder()
                    .word(word)
                    .sentiment(batch.getSentiments().get(i))
                    .flags(batch.getFlags().get(i))
                    .category(Category.fromId(batch.getCategories().get(i)))
                    .secondaryCategory(Category.fromId(batch.getSecondaryCategories().get(i)))
                    .weight(batch.getWeights().get(i))
                    .domainRelevance(Domain.fromId(batch.getDomainRelevance().get(i)))
                    .domainStrength(batch.getDomainStrengths() == null ? 0 : batch.getDomainStrengths().get(i))
                    .contextInfluence(batch.getContextInfluence().get(i))
                    .usageCount(previous.getUsageCount())
                    .cooccurrenceCount(previous.getCooccurrenceCount())
                    .build();

            if (!word.isEmpty()) {
                idsByWord.put(word, id);
            }
            if (!previous.getWord().isEmpty() && !previous.getWord().equals(word)) {
                releaseWord(previous.getWord(), id, Math.max(size, highest + 1));
            }
        }
        size = Math.max(size, highest + 1);
    }

    /**
     * {@code id} no longer holds {@code word}. If the index pointed at it, re-point the entry to the
     * lowest id below {@code bound} that still holds the word, or drop it.
     */
    private void releaseWord(String word, int id, int bound) {
        if (!Integer.valueOf(id).equals(idsByWord.get(word))) {
            return;
        }
        for (int other = 0; other < bound; other++) {
            if (other != id && tokens[other].getWord().equals(word)) {
                idsByWord.put(word, other);
                return;
            }
        }
        idsByWord.remove(word);
    }

    /** Metadata for {@code tokenId}; the returned object is live state, do not mutate it. */
    public TokenMetadata metadata(int tokenId) {
        return tokens[tokenId];
    }

    public int[] semantic(int tokenId) {
        return semantic[tokenId];
    }

    public int[] context(int tokenId) {
        return context[tokenId];
    }

    public void setEmbedding(int tokenId, int[] semanticValues, int[] contextValues) {
        semantic[tokenId] = Arrays.copyOf(semanticValues, EngineLimits.SEMANTIC_DIM);
        context[tokenId] = Arrays.copyOf(contextValues, EngineLimits.CONTEXT_DIM);
    }

    public int[] classSemantic(int classId) {
        return classSemantic[classId];
    }

    public int[] classContext(int classId) {
        return classContext[classId];
    }

    public void setClassWeights(int classId, int[] semanticValues, int[] contextValues) {
        classSemantic[classId] = Arrays.copyOf(semanticValues, EngineLimits.SEMANTIC_DIM);
        classContext[classId] = Arrays.copyOf(contextValues, EngineLimits.CONTEXT_DIM);
    }

    public void recordUsage(int tokenId) {
        TokenMetadata meta = tokens[tokenId];
        meta.setUsageCount(EngineLimits.saturatingIncrement(meta.getUsageCount(), EngineLimits.COUNTER_MAX));
    }

    public void recordCooccurrence(int tokenId) {
        TokenMetadata meta = tokens[tokenId];
        meta.setCooccurrenceCount(
                EngineLimits.saturatingIncrement(meta.getCooccurrenceCount(), EngineLimits.COUNTER_MAX));
    }

    public Optional<String> wordOf(int tokenId) {
        if (!contains(tokenId)) {
            return Optional.empty();
        }
        String word = tokens[tokenId].getWord();
        return word.isEmpty() ? Optional.empty() : Optional.of(word);
    }

    public Optional<Integer> idOf(String word) {
        if (word == null || word.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(idsByWord.get(normalizeWord(word)));
    }

    /** Number of vocabulary entries whose word spans more than one term. */
    public int phraseCount() {
        int phrases = 0;
        for (int i = 0; i < size; i++) {
            if (tokens[i].getWord().indexOf(' ') >= 0) {
                phrases++;
            }
        }
        return phrases;
    }

    /** Builds the human-readable text of an input, one word per token, unknown words as #id. */
    public String render(int[] tokenIds) {
        StringBuilder text = new StringBuilder();
        for (int id : tokenIds) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(wordOf(id).orElse("#" + id));
        }
        return text.toString();
    }

    /** Puts back a token exactly as recorded, counters included. Used by snapshot restore. */
    public void restoreToken(int tokenId, TokenMetadata meta) {
        tokens[tokenId] = meta.copy();
        if (!meta.getWord().isEmpty()) {
            idsByWord.put(meta.getWord(), tokenId);
        }
        size = Math.max(size, tokenId + 1);
    }

    public VocabularyStore copy() {
        VocabularyStore copy = new VocabularyStore();
        for (int i = 0; i < tokens.length; i++) {
            copy.tokens[i] = tokens[i].copy();
            copy.semantic[i] = Arrays.copyOf(semantic[i], semantic[i].length);
            copy.context[i] = Arrays.copyOf(context[i], context[i].length);
        }
        for (int c = 0; c < classSemantic.length; c++) {
            copy.classSemantic[c] = Arrays.copyOf(classSemantic[c], classSemantic[c].length);
            copy.classContext[c] = Arrays.copyOf(classContext[c], classContext[c].length);
        }
        copy.idsByWord.putAll(idsByWord);
        copy.size = size;
        return copy;
    }

    private static String normalizeWord(String word) {
        return word == null ? "" : word.trim();
    }
}
