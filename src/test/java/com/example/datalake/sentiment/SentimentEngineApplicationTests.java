package com.example.datalake.sentiment;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.datalake.sentiment.service.SentimentEngineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class SentimentEngineApplicationTests {

  @Autowired
  private SentimentEngineService engine;

  @Test
  void contextLoads() {
    assertThat(engine.isPaused()).isFalse();
    assertThat(engine.vocabularySize()).isZero();
  }
}
