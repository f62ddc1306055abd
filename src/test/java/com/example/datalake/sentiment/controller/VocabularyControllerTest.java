package com.example.datalake.sentiment.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.datalake.sentiment.model.Category;
import com.example.datalake.sentiment.model.TokenFlag;
import com.example.datalake.sentiment.model.TokenMetadata;
import com.example.datalake.sentiment.model.VocabularyBatch;
import com.example.datalake.sentiment.request.VectorPairRequest;
import com.example.datalake.sentiment.response.TokenResponse;
import com.example.datalake.sentiment.service.SentimentEngineService;
import com.example.datalake.sentiment.support.EngineTestSupport;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

class VocabularyControllerTest {

  private final SentimentEngineService engine = mock(SentimentEngineService.class);
  private final VocabularyController controller = new VocabularyController(engine);

  @Test
  void upsertReportsWrittenCountAndSize() {
    VocabularyBatch batch = EngineTestSupport.batch(EngineTestSupport.token(0, "a"), EngineTestSupport.token(4, "b"));
    when(engine.vocabularySize()).thenReturn(5);

    ResponseEntity<Map<String, Integer>> response = controller.upsert("trainer", batch);

    verify(engine).setVocabulary("trainer", batch);
    assertThat(response.getBody()).containsEntry("written", 2).containsEntry("vocabularySize", 5);
  }

  @Test
  void findOneMapsMetadata() {
    TokenMetadata meta = TokenMetadata.builder()
        .word("great")
        .sentiment(4)
        .weight(8)
        .flags(TokenFlag.POSITIVE.mask() | TokenFlag.INTENSE.mask())
        .category(Category.EMOTION)
        .usageCount(3)
        .build();
    when(engine.tokenMetadata(1)).thenReturn(Optional.of(meta));
    when(engine.tokenMetadata(2)).thenReturn(Optional.empty());

    ResponseEntity<TokenResponse> found = controller.findOne(1);

    assertThat(found.getStatusCode().value()).isEqualTo(200);
    assertThat(found.getBody()).isNotNull();
    assertThat(found.getBody().flags()).containsExactlyInAnyOrder(TokenFlag.POSITIVE, TokenFlag.INTENSE);
    assertThat(found.getBody().category()).isEqualTo("EMOTION");
    assertThat(controller.findOne(2).getStatusCode().value()).isEqualTo(404);
  }

  @Test
  void lookupResolvesWords() {
    when(engine.tokenIdOf("great")).thenReturn(Optional.of(1));
    when(engine.tokenIdOf("nope")).thenReturn(Optional.empty());

    assertThat(controller.lookup("great").getBody()).containsEntry("tokenId", 1);
    assertThat(controller.lookup("nope").getStatusCode().value()).isEqualTo(404);
  }

  @Test
  void embeddingOverwriteDelegatesToEngine() {
    List<Integer> semantic = EngineTestSupport.list(new int[24]);
    List<Integer> context = EngineTestSupport.list(new int[8]);

    ResponseEntity<Void> response = controller.setEmbedding("trainer", 3, new VectorPairRequest(semantic, context));

    verify(engine).setTokenEmbedding("trainer", 3, semantic, context);
    assertThat(response.getStatusCode().value()).isEqualTo(204);
  }
}
