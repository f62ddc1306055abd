package com.example.datalake.sentiment.model;

import java.util.Arrays;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-domain signed class bias plus an intensity multiplier. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DomainModifier {

  private int[] bias = new int[SentimentClass.COUNT];
  private int intensity;

  public static DomainModifier neutral() {
    return new DomainModifier(new int[SentimentClass.COUNT], 1);
  }

  public DomainModifier copy() {
    return new DomainModifier(Arrays.copyOf(bias, bias.length), intensity);
  }
}
