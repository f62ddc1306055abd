package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.response.StatisticsResponse;
import com.example.datalake.sentiment.service.SentimentEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/stats")
@RequiredArgsConstructor
@Tag(name = "Statistics", description = "Global classification counters")
public class StatisticsController {

    private final SentimentEngineService engine;

    @Operation(summary = "Classification totals and per-class distribution")
    @GetMapping
    public StatisticsResponse stats() {
        long[] distribution = engine.classDistribution();
        Map<String, Long> perClass = new LinkedHashMap<>();
        for (SentimentClass c : SentimentClass.values()) {
            perClass.put(c.name(), distribution[c.id()]);
        }
        return new StatisticsResponse(
                engine.totalClassifications(),
                engine.correctPredictions(),
                perClass,
                engine.vocabularySize(),
                engine.phraseCount());
    }
}
