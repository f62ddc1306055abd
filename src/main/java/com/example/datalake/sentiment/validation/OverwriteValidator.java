package com.example.datalake.sentiment.validation;

import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.SentimentClass;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Checks direct overwrites of embeddings, class weight templates and domain modifiers. */
@Component
public class OverwriteValidator {

  public void validateTokenEmbedding(int tokenId, List<Integer> semantic, List<Integer> context) {
    List<String> reasons = new ArrayList<>();
    if (tokenId < 0 || tokenId >= EngineLimits.MAX_VOCABULARY) {
      reasons.add(String.format("Token id %d is outside [0, %d).", tokenId, EngineLimits.MAX_VOCABULARY));
    }
    checkVector(reasons, "semantic", semantic, EngineLimits.SEMANTIC_DIM);
    checkVector(reasons, "context", context, EngineLimits.CONTEXT_DIM);
    ValidationException.throwIfAny(reasons);
  }

  public void validateClassWeights(int classId, List<Integer> semantic, List<Integer> context) {
    List<String> reasons = new ArrayList<>();
    if (classId < 0 || classId >= SentimentClass.COUNT) {
      reasons.add(String.format("Class id %d is outside [0, %d).", classId, SentimentClass.COUNT));
    }
    checkVector(reasons, "semantic", semantic, EngineLimits.SEMANTIC_DIM);
    checkVector(reasons, "context", context, EngineLimits.CONTEXT_DIM);
    ValidationException.throwIfAny(reasons);
  }

  public void validateDomainModifier(int domainId, List<Integer> bias, Integer intensity) {
    List<String> reasons = new ArrayList<>();
    if (!Domain.isValidId(domainId)) {
      reasons.add(String.format("Domain id %d is outside [0, %d).", domainId, Domain.COUNT));
    }
    if (bias == null || bias.size() != SentimentClass.COUNT) {
      reasons.add(String.format("bias must have exactly %d entries.", SentimentClass.COUNT));
    } else {
      for (int i = 0; i < bias.size(); i++) {
        Integer b = bias.get(i);
        if (b == null || Math.abs(b) > EngineLimits.MAX_DOMAIN_BIAS) {
          reasons.add(String.format("bias[%d]=%s is outside [-%d, %d].",
              i, b, EngineLimits.MAX_DOMAIN_BIAS, EngineLimits.MAX_DOMAIN_BIAS));
        }
      }
    }
    if (intensity == null || intensity < 0 || intensity > EngineLimits.MAX_DOMAIN_INTENSITY) {
      reasons.add(String.format("intensity=%s is outside [0, %d].", intensity, EngineLimits.MAX_DOMAIN_INTENSITY));
    }
    ValidationException.throwIfAny(reasons);
  }

  private static void checkVector(List<String> reasons, String name, List<Integer> values, int dim) {
    if (values == null || values.size() != dim) {
      reasons.add(String.format("%s must have exactly %d entries.", name, dim));
      return;
    }
    for (int i = 0; i < values.size(); i++) {
      Integer v = values.get(i);
      if (v == null || Math.abs(v) > EngineLimits.MAX_EMBEDDING_MAGNITUDE) {
        reasons.add(String.format("%s[%d]=%s is outside [-%d, %d].",
            name, i, v, EngineLimits.MAX_EMBEDDING_MAGNITUDE, EngineLimits.MAX_EMBEDDING_MAGNITUDE));
      }
    }
  }
}
