package com.example.datalake.sentiment.store;

/**
 * The single owned store behind the engine: vocabulary, co-occurrence, domain model, caller
 * contexts and statistics. Not thread-safe; {@code SentimentEngineService} serialises access.
 */
public class EngineState {

    private final VocabularyStore vocabulary;
    private final CooccurrenceTracker cooccurrence;
    private final DomainModel domains;
    private final UserContextStore userContexts;
    private final ClassificationStatistics statistics;

    public EngineState() {
        this(new VocabularyStore(), new CooccurrenceTracker(), new DomainModel(),
                new UserContextStore(), new ClassificationStatistics());
    }

    public EngineState(VocabularyStore vocabulary, CooccurrenceTracker cooccurrence, DomainModel domains,
                       UserContextStore userContexts, ClassificationStatistics statistics) {
        this.vocabulary = vocabulary;
        this.cooccurrence = cooccurrence;
        this.domains = domains;
        this.userContexts = userContexts;
        this.statistics = statistics;
    }

    public VocabularyStore vocabulary() {
        return vocabulary;
    }

    public CooccurrenceTracker cooccurrence() {
        return cooccurrence;
    }

    public DomainModel domains() {
        return domains;
    }

    public UserContextStore userContexts() {
        return userContexts;
    }

    public ClassificationStatistics statistics() {
        return statistics;
    }

    /** Deep copy; mutating the copy never touches this state. */
    public EngineState copy() {
        return new EngineState(vocabulary.copy(), cooccurrence.copy(), domains.copy(),
                userContexts.copy(), statistics.copy());
    }
}
