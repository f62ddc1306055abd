package com.example.datalake.sentiment.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Swagger groups: public classification endpoints and the trainer/admin surface. */
@Configuration
public class OpenApiConfig {

  @Bean
  public OpenAPI sentimentOpenAPI() {
    return new OpenAPI()
        .info(new Info()
            .title("Sentiment Engine API")
            .version("v1")
            .description("Deterministic token classification, vocabulary training and engine administration."))
        .components(new Components()
            .addParameters("callerId", new HeaderParameter()
                .name("X-Caller-Id")
                .description("Identity checked against the configured trainer and admin lists")
                .schema(new StringSchema())));
  }

  @Bean
  public GroupedOpenApi classificationApi() {
    return GroupedOpenApi.builder()
        .group("sentiment")
        .pathsToMatch("/v1/sentiment/**", "/v1/stats/**", "/health")
        .build();
  }

  @Bean
  public GroupedOpenApi trainingApi() {
    return GroupedOpenApi.builder()
        .group("training")
        .pathsToMatch("/v1/vocabulary/**", "/v1/classes/**", "/v1/domains/**", "/v1/admin/**")
        .build();
  }
}
