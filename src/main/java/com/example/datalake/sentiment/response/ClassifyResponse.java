package com.example.datalake.sentiment.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Accessors(chain = true, fluent = false)
public class ClassifyResponse {
  private String callerId;

  private Integer sentimentClass;
  private String sentimentLabel;
  private Long confidence;
  private Integer domain;
  private String domainLabel;

  private List<String> errors;
}
