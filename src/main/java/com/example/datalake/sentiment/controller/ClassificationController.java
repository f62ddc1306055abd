package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.access.EngineSuspendedException;
import com.example.datalake.sentiment.model.ClassificationResult;
import com.example.datalake.sentiment.request.ClassifyRequest;
import com.example.datalake.sentiment.response.ClassifyResponse;
import com.example.datalake.sentiment.response.SimilarityResponse;
import com.example.datalake.sentiment.response.UserContextResponse;
import com.example.datalake.sentiment.service.SentimentEngineService;
import com.example.datalake.sentiment.validation.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/v1/sentiment")
@Tag(name = "Sentiment", description = "Classify token sequences and inspect caller adaptation")
@RequiredArgsConstructor
public class ClassificationController {

    private final SentimentEngineService engine;

    @PostMapping("/classify")
    @Operation(
            summary = "Classify a token sequence",
            description = "Returns the winning sentiment class, its confidence and the detected domain, "
                    + "and updates the caller's adaptive context."
    )
    public Mono<ResponseEntity<ClassifyResponse>> classify(@Valid @RequestBody ClassifyRequest req) {
        return Mono.fromCallable(() -> engine.classifySentiment(req.getCallerId(), req.getTokens()))
                .map(result -> ResponseEntity.ok(toResponse(req.getCallerId(), result)))
                .onErrorResume(ValidationException.class, ex ->
                        Mono.just(ResponseEntity.badRequest().body(toErrorResponse(req, ex.getReasons()))))
                .onErrorResume(EngineSuspendedException.class, ex ->
                        Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                                .body(toErrorResponse(req, List.of(ex.getMessage())))))
                .onErrorResume(ex -> {
                    log.error("Unexpected failure while classifying for caller {}", req.getCallerId(), ex);
                    return Mono.just(ResponseEntity.internalServerError()
                            .body(toErrorResponse(req, List.of(unexpectedMessage(ex)))));
                });
    }

    @GetMapping("/similarity")
    @Operation(summary = "Similarity between two tokens")
    public SimilarityResponse similarity(@RequestParam("a") int tokenA,
                                         @RequestParam("b") int tokenB,
                                         @RequestParam(value = "includeContext", defaultValue = "false")
                                         boolean includeContext) {
        return new SimilarityResponse(
                tokenA,
                tokenB,
                includeContext,
                engine.similarity(tokenA, tokenB, includeContext),
                engine.cooccurrence(tokenA, tokenB));
    }

    @GetMapping("/context/{callerId}")
    @Operation(summary = "Adaptive context of a caller")
    public ResponseEntity<UserContextResponse> context(@PathVariable String callerId) {
        return engine.userContext(callerId)
                .map(ctx -> ResponseEntity.ok(UserContextResponse.of(callerId, ctx)))
                .orElse(ResponseEntity.notFound().build());
    }

    private ClassifyResponse toResponse(String callerId, ClassificationResult result) {
        return ClassifyResponse.builder()
                .callerId(callerId)
                .sentimentClass(result.sentimentClass().id())
                .sentimentLabel(result.sentimentClass().label())
                .confidence(result.confidence())
                .domain(result.domain().id())
                .domainLabel(result.domain().label())
                .errors(List.of())
                .build();
    }

    private ClassifyResponse toErrorResponse(ClassifyRequest req, List<String> errors) {
        return ClassifyResponse.builder()
                .callerId(req.getCallerId())
                .errors(List.copyOf(errors))
                .build();
    }

    private static String unexpectedMessage(Throwable ex) {
        String detail = ex.getMessage();
        return (detail == null || detail.isBlank())
                ? "Unexpected error occurred."
                : "Unexpected error: " + detail;
    }
}
