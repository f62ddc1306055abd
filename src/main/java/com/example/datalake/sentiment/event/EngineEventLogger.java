package com.example.datalake.sentiment.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Writes engine notifications to the application log for external monitoring. */
@Slf4j
@Component
public class EngineEventLogger {

    @EventListener
    public void onClassified(SentimentClassifiedEvent event) {
        log.info("[sentiment] caller={} class={} confidence={} domain={} text='{}'",
                event.caller(), event.sentimentClass(), event.confidence(), event.domain(), event.inputText());
    }

    @EventListener
    public void onVocabularyUpdated(VocabularyUpdatedEvent event) {
        log.info("[vocabulary] {} tokens written by {}", event.count(), event.trainer());
    }
}
