package com.example.datalake.sentiment.event;

public record VocabularyUpdatedEvent(int count, String trainer) {
}
