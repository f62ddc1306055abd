package com.example.datalake.sentiment.service;

import com.example.datalake.sentiment.access.AccessPolicy;
import com.example.datalake.sentiment.access.EngineSuspendedException;
import com.example.datalake.sentiment.access.PermissionDeniedException;
import com.example.datalake.sentiment.engine.ClassificationOutcome;
import com.example.datalake.sentiment.engine.SentimentClassifier;
import com.example.datalake.sentiment.engine.SimilarityEngine;
import com.example.datalake.sentiment.event.SentimentClassifiedEvent;
import com.example.datalake.sentiment.event.VocabularyUpdatedEvent;
import com.example.datalake.sentiment.model.ClassificationResult;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.DomainModifier;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.UserContext;
import com.example.datalake.sentiment.model.VocabularyBatch;
import com.example.datalake.sentiment.persistence.EngineSnapshot;
import com.example.datalake.sentiment.persistence.EngineSnapshotCodec;
import com.example.datalake.sentiment.store.EngineState;
import com.example.datalake.sentiment.validation.OverwriteValidator;
import com.example.datalake.sentiment.validation.ValidationException;
import com.example.datalake.sentiment.validation.VocabularyBatchValidator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry points of the engine. Every mutating call holds the write lock from validation to commit,
 * so calls are applied one at a time and readers, holding the read lock, never see a partial
 * commit. Role and pause checks happen here and nowhere deeper.
 */
@Slf4j
@Service
public class SentimentEngineService {

    static final String TRAINER_ROLE = "trainer";
    static final String ADMIN_ROLE = "admin";

    private final SentimentClassifier classifier;
    private final SimilarityEngine similarityEngine;
    private final VocabularyBatchValidator batchValidator;
    private final OverwriteValidator overwriteValidator;
    private final AccessPolicy accessPolicy;
    private final ApplicationEventPublisher events;
    private final EngineSnapshotCodec snapshotCodec;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private EngineState state;

    public SentimentEngineService(EngineState state,
                                  SentimentClassifier classifier,
                                  SimilarityEngine similarityEngine,
                                  VocabularyBatchValidator batchValidator,
                                  OverwriteValidator overwriteValidator,
                                  AccessPolicy accessPolicy,
                                  ApplicationEventPublisher events,
                                  EngineSnapshotCodec snapshotCodec) {
        this.state = state;
        this.classifier = classifier;
        this.similarityEngine = similarityEngine;
        this.batchValidator = batchValidator;
        this.overwriteValidator = overwriteValidator;
        this.accessPolicy = accessPolicy;
        this.events = events;
        this.snapshotCodec = snapshotCodec;
    }

    // ---------------------------------------------------------------- classification

    public ClassificationResult classifySentiment(String caller, List<Integer> tokenIds) {
        requireActive();
        if (caller == null || caller.isBlank()) {
            throw new ValidationException("Caller identity is required.");
        }
        ClassificationOutcome outcome = write(() -> classifier.classify(state, caller, tokenIds));
        ClassificationResult result = outcome.result();
        events.publishEvent(new SentimentClassifiedEvent(
                caller, result.sentimentClass(), result.confidence(), outcome.inputText(), result.domain()));
        return result;
    }

    public long similarity(int tokenA, int tokenB, boolean includeContext) {
        return read(() -> similarityEngine.similarity(state, tokenA, tokenB, includeContext));
    }

    public int cooccurrence(int tokenA, int tokenB) {
        return read(() -> state.cooccurrence().count(tokenA, tokenB));
    }

    public Optional<UserContext> userContext(String caller) {
        return read(() -> state.userContexts().find(caller).map(UserContext::copy));
    }

    // ---------------------------------------------------------------- training

    public void setVocabulary(String trainer, VocabularyBatch batch) {
        requireActive();
        requireRole(trainer, TRAINER_ROLE, accessPolicy.isTrainer(trainer));
        batchValidator.validate(batch);
        write(() -> {
            state.vocabulary().applyBatch(batch);
            return null;
        });
        events.publishEvent(new VocabularyUpdatedEvent(batch.size(), trainer));
    }

    public void setTokenEmbedding(String trainer, int tokenId, List<Integer> semantic, List<Integer> context) {
        requireActive();
        requireRole(trainer, TRAINER_ROLE, accessPolicy.isTrainer(trainer));
        overwriteValidator.validateTokenEmbedding(tokenId, semantic, context);
        write(() -> {
            state.vocabulary().setEmbedding(tokenId, toArray(semantic), toArray(context));
            return null;
        });
        log.info("[training] {} overwrote embedding of token {}", trainer, tokenId);
    }

    public void setClassWeights(String trainer, int classId, List<Integer> semantic, List<Integer> context) {
        requireActive();
        requireRole(trainer, TRAINER_ROLE, accessPolicy.isTrainer(trainer));
        overwriteValidator.validateClassWeights(classId, semantic, context);
        write(() -> {
            state.vocabulary().setClassWeights(classId, toArray(semantic), toArray(context));
            return null;
        });
        log.info("[training] {} overwrote weights of class {}", trainer, SentimentClass.fromId(classId));
    }

    public void setDomainModifier(String trainer, int domainId, List<Integer> bias, Integer intensity) {
        requireActive();
        requireRole(trainer, TRAINER_ROLE, accessPolicy.isTrainer(trainer));
        overwriteValidator.validateDomainModifier(domainId, bias, intensity);
        write(() -> {
            state.domains().setModifier(Domain.fromId(domainId), toArray(bias), intensity);
            return null;
        });
        log.info("[training] {} set modifier of domain {} (intensity={})", trainer, Domain.fromId(domainId), intensity);
    }

    // ---------------------------------------------------------------- read accessors

    public Optional<String> wordOf(int tokenId) {
        return read(() -> state.vocabulary().wordOf(tokenId));
    }

    public Optional<Integer> tokenIdOf(String word) {
        return read(() -> state.vocabulary().idOf(word));
    }

    public Optional<TokenMetadata> tokenMetadata(int tokenId) {
        return read(() -> state.vocabulary().contains(tokenId)
                ? Optional.of(state.vocabulary().metadata(tokenId).copy())
                : Optional.<TokenMetadata>empty());
    }

    public int vocabularySize() {
        return read(() -> state.vocabulary().size());
    }

    public int phraseCount() {
        return read(() -> state.vocabulary().phraseCount());
    }

    public long totalClassifications() {
        return read(() -> state.statistics().totalClassifications());
    }

    public long correctPredictions() {
        return read(() -> state.statistics().correctPredictions());
    }

    public long classDistribution(SentimentClass sentimentClass) {
        return read(() -> state.statistics().distribution(sentimentClass));
    }

    public long[] classDistribution() {
        return read(() -> state.statistics().distribution());
    }

    public DomainModifier domainModifier(Domain domain) {
        return read(() -> state.domains().modifier(domain).copy());
    }

    // ---------------------------------------------------------------- administration

    public void pause(String caller) {
        requireRole(caller, ADMIN_ROLE, accessPolicy.isAdmin(caller));
        accessPolicy.setPaused(true);
        log.warn("[admin] engine paused by {}", caller);
    }

    public void resume(String caller) {
        requireRole(caller, ADMIN_ROLE, accessPolicy.isAdmin(caller));
        accessPolicy.setPaused(false);
        log.warn("[admin] engine resumed by {}", caller);
    }

    public boolean isPaused() {
        return accessPolicy.isPaused();
    }

    public EngineSnapshot exportSnapshot(String caller) {
        requireRole(caller, ADMIN_ROLE, accessPolicy.isAdmin(caller));
        return read(() -> snapshotCodec.capture(state));
    }

    /** Swaps in a state rebuilt from {@code snapshot}. A rejected snapshot leaves the engine as it was. */
    public void restoreSnapshot(String caller, EngineSnapshot snapshot) {
        requireRole(caller, ADMIN_ROLE, accessPolicy.isAdmin(caller));
        EngineState restored = snapshotCodec.restore(snapshot);
        write(() -> {
            state = restored;
            return null;
        });
        log.warn("[admin] engine state restored by {} (vocabulary={})", caller, restored.vocabulary().size());
    }

    // ---------------------------------------------------------------- helpers

    private void requireActive() {
        if (accessPolicy.isPaused()) {
            throw new EngineSuspendedException();
        }
    }

    private static void requireRole(String caller, String role, boolean granted) {
        if (!granted) {
            throw new PermissionDeniedException(caller, role);
        }
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static int[] toArray(List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).toArray();
    }
}
