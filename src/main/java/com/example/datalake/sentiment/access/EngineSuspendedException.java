package com.example.datalake.sentiment.access;

/** Raised by gated operations while the engine is paused. */
public class EngineSuspendedException extends RuntimeException {

    public EngineSuspendedException() {
        super("Sentiment engine is paused.");
    }
}
