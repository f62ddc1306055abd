package com.example.datalake.sentiment.access;

/**
 * Capability predicates consulted at the engine's entry points. The engine never looks at caller
 * identity beyond asking these questions.
 */
public interface AccessPolicy {

    boolean isTrainer(String caller);

    boolean isAdmin(String caller);

    boolean isPaused();

    void setPaused(boolean paused);
}
