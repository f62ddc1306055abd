package com.example.datalake.sentiment.event;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.SentimentClass;

public record SentimentClassifiedEvent(
        String caller,
        SentimentClass sentimentClass,
        long confidence,
        String inputText,
        Domain domain) {
}
