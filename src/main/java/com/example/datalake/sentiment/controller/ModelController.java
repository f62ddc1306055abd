package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.DomainModifier;
import com.example.datalake.sentiment.request.DomainModifierRequest;
import com.example.datalake.sentiment.request.VectorPairRequest;
import com.example.datalake.sentiment.service.SentimentEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Tag(name = "Model", description = "Class weight templates and domain modifiers")
public class ModelController {

    private final SentimentEngineService engine;

    @Operation(summary = "Overwrite a class's weight vectors (trainer only)")
    @PutMapping("/classes/{classId}/weights")
    public ResponseEntity<Void> setClassWeights(@RequestHeader(VocabularyController.CALLER_HEADER) String trainer,
                                                @PathVariable int classId,
                                                @RequestBody VectorPairRequest request) {
        engine.setClassWeights(trainer, classId, request.semantic(), request.context());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Set a domain's class bias and intensity (trainer only)")
    @PutMapping("/domains/{domainId}/modifier")
    public ResponseEntity<Void> setDomainModifier(@RequestHeader(VocabularyController.CALLER_HEADER) String trainer,
                                                  @PathVariable int domainId,
                                                  @RequestBody DomainModifierRequest request) {
        engine.setDomainModifier(trainer, domainId, request.bias(), request.intensity());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Get a domain's modifier")
    @GetMapping("/domains/{domainId}/modifier")
    public ResponseEntity<DomainModifier> domainModifier(@PathVariable int domainId) {
        if (!Domain.isValidId(domainId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(engine.domainModifier(Domain.fromId(domainId)));
    }
}
