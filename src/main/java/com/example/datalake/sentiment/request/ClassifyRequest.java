package com.example.datalake.sentiment.request;

import jakarta.validation.constraints.NotBlank;
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
public class ClassifyRequest {
  @NotBlank private String callerId;

  // count and range are validated by the engine
  private List<Integer> tokens;
}
