package com.example.datalake.sentiment.controller;

import com.example.datalake.sentiment.persistence.EngineSnapshot;
import com.example.datalake.sentiment.service.SentimentEngineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Pause switch and state snapshots (admin only)")
public class AdminController {

    private final SentimentEngineService engine;

    @Operation(summary = "Pause classification and training")
    @PostMapping("/pause")
    public Map<String, Boolean> pause(@RequestHeader(VocabularyController.CALLER_HEADER) String caller) {
        engine.pause(caller);
        return Map.of("paused", engine.isPaused());
    }

    @Operation(summary = "Resume classification and training")
    @PostMapping("/resume")
    public Map<String, Boolean> resume(@RequestHeader(VocabularyController.CALLER_HEADER) String caller) {
        engine.resume(caller);
        return Map.of("paused", engine.isPaused());
    }

    @Operation(summary = "Export the full engine state")
    @GetMapping("/snapshot")
    public EngineSnapshot exportSnapshot(@RequestHeader(VocabularyController.CALLER_HEADER) String caller) {
        return engine.exportSnapshot(caller);
    }

    @Operation(summary = "Replace the engine state with a snapshot")
    @PutMapping("/snapshot")
    public ResponseEntity<Void> restoreSnapshot(@RequestHeader(VocabularyController.CALLER_HEADER) String caller,
                                                @RequestBody EngineSnapshot snapshot) {
        engine.restoreSnapshot(caller, snapshot);
        return ResponseEntity.noContent().build();
    }
}
