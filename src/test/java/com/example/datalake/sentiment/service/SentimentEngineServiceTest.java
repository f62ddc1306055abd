package com.example.datalake.sentiment.service;

import static com.example.datalake.sentiment.support.EngineTestSupport.NOW;
import static com.example.datalake.sentiment.support.EngineTestSupport.batch;
import static com.example.datalake.sentiment.support.EngineTestSupport.list;
import static com.example.datalake.sentiment.support.EngineTestSupport.token;
import static com.example.datalake.sentiment.support.EngineTestSupport.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.example.datalake.sentiment.access.EngineSuspendedException;
import com.example.datalake.sentiment.access.PermissionDeniedException;
import com.example.datalake.sentiment.access.PropertiesAccessPolicy;
import com.example.datalake.sentiment.config.EngineProperties;
import com.example.datalake.sentiment.engine.SimilarityEngine;
import com.example.datalake.sentiment.event.SentimentClassifiedEvent;
import com.example.datalake.sentiment.event.VocabularyUpdatedEvent;
import com.example.datalake.sentiment.model.ClassificationResult;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.SentimentClass;
import com.example.datalake.sentiment.model.VocabularyBatch;
import com.example.datalake.sentiment.persistence.EngineSnapshot;
import com.example.datalake.sentiment.persistence.EngineSnapshotCodec;
import com.example.datalake.sentiment.store.EngineState;
import com.example.datalake.sentiment.support.EngineTestSupport;
import com.example.datalake.sentiment.support.EngineTestSupport.MutableClock;
import com.example.datalake.sentiment.validation.OverwriteValidator;
import com.example.datalake.sentiment.validation.ValidationException;
import com.example.datalake.sentiment.validation.VocabularyBatchValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class SentimentEngineServiceTest {

  @Mock
  private ApplicationEventPublisher events;

  private PropertiesAccessPolicy accessPolicy;
  private SentimentEngineService service;

  @BeforeEach
  void setUp() {
    accessPolicy = new PropertiesAccessPolicy(new EngineProperties());
    service = new SentimentEngineService(
        new EngineState(),
        EngineTestSupport.classifier(new MutableClock(NOW)),
        new SimilarityEngine(),
        new VocabularyBatchValidator(),
        new OverwriteValidator(),
        accessPolicy,
        events,
        new EngineSnapshotCodec(new ObjectMapper()));
  }

  private void loadPositiveVocabulary() {
    service.setVocabulary("trainer", batch(token(1, "great").sentiment(4).weight(8), token(2, "fine")));
    service.setTokenEmbedding("trainer", 1, list(unit(24, 0, 1000)), list(new int[8]));
    service.setClassWeights("trainer", SentimentClass.POSITIVE.id(), list(unit(24, 0, 1000)), list(new int[8]));
  }

  @Test
  void classificationPublishesNotification() {
    loadPositiveVocabulary();
    clearInvocations(events);

    ClassificationResult result = service.classifySentiment("alice", List.of(1, 2));

    ArgumentCaptor<SentimentClassifiedEvent> captor = ArgumentCaptor.forClass(SentimentClassifiedEvent.class);
    verify(events).publishEvent(captor.capture());
    SentimentClassifiedEvent event = captor.getValue();
    assertThat(event.caller()).isEqualTo("alice");
    assertThat(event.sentimentClass()).isEqualTo(result.sentimentClass());
    assertThat(event.confidence()).isEqualTo(result.confidence());
    assertThat(event.inputText()).isEqualTo("great fine");
    assertThat(event.domain()).isEqualTo(Domain.GENERAL);
    assertThat(service.totalClassifications()).isEqualTo(1);
    assertThat(service.classDistribution(result.sentimentClass())).isEqualTo(1);
    assertThat(service.cooccurrence(1, 2)).isEqualTo(1);
  }

  @Test
  void vocabularyUpsertPublishesCountAndTrainer() {
    service.setVocabulary("admin", batch(token(0, "a"), token(5, "b c")));

    verify(events).publishEvent(new VocabularyUpdatedEvent(2, "admin"));
    assertThat(service.vocabularySize()).isEqualTo(6);
    assertThat(service.phraseCount()).isEqualTo(1);
    assertThat(service.tokenIdOf("b c")).contains(5);
    assertThat(service.wordOf(0)).contains("a");
  }

  @Test
  void emptyUpsertChangesNothing() {
    service.setVocabulary("trainer", batch());

    assertThat(service.vocabularySize()).isZero();
  }

  @Test
  void rejectsCallersWithoutTrainerRole() {
    assertThatThrownBy(() -> service.setVocabulary("mallory", batch(token(0, "a"))))
        .isInstanceOf(PermissionDeniedException.class)
        .hasMessage("Caller 'mallory' does not hold the trainer role.");
    assertThatThrownBy(() -> service.setDomainModifier("alice", 1, List.of(0, 0, 0, 0, 0, 0, 0), 1))
        .isInstanceOf(PermissionDeniedException.class);

    assertThat(service.vocabularySize()).isZero();
    verify(events, never()).publishEvent(any(Object.class));
  }

  @Test
  void mismatchedBatchLeavesVocabularyUntouched() {
    service.setVocabulary("trainer", batch(token(1, "good").sentiment(3)));
    VocabularyBatch broken = batch(token(1, "bad").sentiment(-3), token(7, "worse"));
    broken.getWeights().remove(1);

    assertThatThrownBy(() -> service.setVocabulary("trainer", broken))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Array length mismatch");

    assertThat(service.vocabularySize()).isEqualTo(2);
    assertThat(service.tokenMetadata(1)).hasValueSatisfying(meta -> {
      assertThat(meta.getWord()).isEqualTo("good");
      assertThat(meta.getSentiment()).isEqualTo(3);
    });
  }

  @Test
  void pausedEngineRejectsWorkUntilResumed() {
    loadPositiveVocabulary();
    service.pause("admin");

    assertThat(service.isPaused()).isTrue();
    assertThatThrownBy(() -> service.classifySentiment("alice", List.of(1)))
        .isInstanceOf(EngineSuspendedException.class);
    assertThatThrownBy(() -> service.setVocabulary("trainer", batch(token(3, "x"))))
        .isInstanceOf(EngineSuspendedException.class);
    assertThat(service.totalClassifications()).isZero();
    assertThat(service.vocabularySize()).isEqualTo(3);

    service.resume("admin");
    assertThat(service.classifySentiment("alice", List.of(1)).sentimentClass())
        .isEqualTo(SentimentClass.POSITIVE);
  }

  @Test
  void onlyAdminsPauseAndResume() {
    assertThatThrownBy(() -> service.pause("trainer")).isInstanceOf(PermissionDeniedException.class);
    assertThatThrownBy(() -> service.resume("alice")).isInstanceOf(PermissionDeniedException.class);
    assertThat(service.isPaused()).isFalse();
  }

  @Test
  void rejectsBlankCaller() {
    loadPositiveVocabulary();

    assertThatThrownBy(() -> service.classifySentiment(" ", List.of(1)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Caller identity is required.");
  }

  @Test
  void readAccessorsReturnCopies() {
    loadPositiveVocabulary();
    service.classifySentiment("alice", List.of(1));

    service.userContext("alice").orElseThrow().getTopics()[0] = 99;
    service.tokenMetadata(1).orElseThrow().setWeight(1);
    service.domainModifier(Domain.FINANCE).setIntensity(50);

    assertThat(service.userContext("alice").orElseThrow().getTopics()[0]).isEqualTo(1);
    assertThat(service.tokenMetadata(1).orElseThrow().getWeight()).isEqualTo(8);
    assertThat(service.domainModifier(Domain.FINANCE).getIntensity()).isEqualTo(1);
    assertThat(service.tokenMetadata(900)).isEmpty();
    assertThat(service.userContext("nobody")).isEmpty();
  }

  @Test
  void snapshotRestoreReplacesWholeState() {
    loadPositiveVocabulary();
    service.classifySentiment("alice", List.of(1));
    EngineSnapshot snapshot = service.exportSnapshot("admin");

    service.classifySentiment("alice", List.of(1));
    service.setVocabulary("trainer", batch(token(9, "late")));
    service.restoreSnapshot("admin", snapshot);

    assertThat(service.totalClassifications()).isEqualTo(1);
    assertThat(service.vocabularySize()).isEqualTo(3);
    assertThat(service.userContext("alice").orElseThrow().getTotalInteractions()).isEqualTo(1);
  }

  @Test
  void snapshotsAreAdminOnly() {
    assertThatThrownBy(() -> service.exportSnapshot("trainer")).isInstanceOf(PermissionDeniedException.class);
    assertThatThrownBy(() -> service.restoreSnapshot("trainer", new EngineSnapshot()))
        .isInstanceOf(PermissionDeniedException.class);
  }

  @Test
  void concurrentCallersSeeConsistentCounters() throws Exception {
    loadPositiveVocabulary();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 200; i++) {
        String caller = "caller-" + (i % 5);
        futures.add(pool.submit(() -> service.classifySentiment(caller, List.of(1, 2))));
        futures.add(pool.submit(() -> service.similarity(1, 2, true)));
      }
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(service.totalClassifications()).isEqualTo(200);
    assertThat(service.cooccurrence(1, 2)).isEqualTo(200);
    assertThat(service.tokenMetadata(1).orElseThrow().getUsageCount()).isEqualTo(200);
    long perCaller = 0;
    for (int c = 0; c < 5; c++) {
      perCaller += service.userContext("caller-" + c).orElseThrow().getTotalInteractions();
    }
    assertThat(perCaller).isEqualTo(200);
  }
}
