package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.model.VocabularyBatch;
import com.example.datalake.sentiment.request.VectorPairRequest;
import com.example.datalake.sentiment.response.TokenResponse;
import com.example.datalake.sentiment.service.SentimentEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/vocabulary")
@RequiredArgsConstructor
@Tag(name = "Vocabulary", description = "Bulk upsert and lookup of tokens and their embeddings")
public class VocabularyController {

    static final String CALLER_HEADER = "X-Caller-Id";

    private final SentimentEngineService engine;

    @Operation(summary = "Bulk upsert vocabulary entries (trainer only)")
    @PostMapping
    public ResponseEntity<Map<String, Integer>> upsert(@RequestHeader(CALLER_HEADER) String trainer,
                                                       @RequestBody VocabularyBatch batch) {
        engine.setVocabulary(trainer, batch);
        return ResponseEntity.ok(Map.of(
                "written", batch.size(),
                "vocabularySize", engine.vocabularySize()));
    }

    @Operation(summary = "Get a token's metadata by id")
    @GetMapping("/{id}")
    public ResponseEntity<TokenResponse> findOne(@PathVariable int id) {
        return engine.tokenMetadata(id)
                .map(meta -> ResponseEntity.ok(TokenResponse.of(id, meta)))
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Resolve a word to its token id")
    @GetMapping("/lookup")
    public ResponseEntity<Map<String, Object>> lookup(@RequestParam String word) {
        return engine.tokenIdOf(word)
                .map(id -> ResponseEntity.ok(Map.<String, Object>of("word", word, "tokenId", id)))
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Current vocabulary size and phrase count")
    @GetMapping("/size")
    public Map<String, Integer> size() {
        return Map.of(
                "vocabularySize", engine.vocabularySize(),
                "phraseCount", engine.phraseCount());
    }

    @Operation(summary = "Overwrite a token's semantic and context embeddings (trainer only)")
    @PutMapping("/{id}/embedding")
    public ResponseEntity<Void> setEmbedding(@RequestHeader(CALLER_HEADER) String trainer,
                                             @PathVariable int id,
                                             @RequestBody VectorPairRequest request) {
        engine.setTokenEmbedding(trainer, id, request.semantic(), request.context());
        return ResponseEntity.noContent().build();
    }
}
