package com.example.datalake.sentiment.validation;

import com.example.datalake.sentiment.model.Category;
import com.example.datalake.sentiment.model.Domain;
import com.example.datalake.sentiment.model.EngineLimits;
import com.example.datalake.sentiment.model.VocabularyBatch;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks a bulk vocabulary upsert before anything is written. Collects every broken constraint so
 * a rejected batch can be fixed in one round trip.
 */
@Component
public class VocabularyBatchValidator {

  public void validate(VocabularyBatch batch) {
    if (batch == null) {
      throw new ValidationException("Vocabulary batch is required.");
    }

    Map<String, List<?>> required = new LinkedHashMap<>();
    required.put("tokenIds", batch.getTokenIds());
    required.put("words", batch.getWords());
    required.put("sentiments", batch.getSentiments());
    required.put("flags", batch.getFlags());
    required.put("categories", batch.getCategories());
    required.put("weights", batch.getWeights());
    required.put("domainRelevance", batch.getDomainRelevance());
    required.put("secondaryCategories", batch.getSecondaryCategories());
    required.put("contextInfluence", batch.getContextInfluence());

    List<String> reasons = new ArrayList<>();
    required.forEach((name, values) -> {
      if (values == null) {
        reasons.add(name + " must be provided.");
      }
    });
    ValidationException.throwIfAny(reasons);

    int n = batch.getTokenIds().size();
    Map<String, List<?>> lengthChecked = new LinkedHashMap<>(required);
    if (batch.getDomainStrengths() != null) {
      lengthChecked.put("domainStrengths", batch.getDomainStrengths());
    }
    lengthChecked.forEach((name, values) -> {
      if (values.size() != n) {
        reasons.add(String.format(
            "Array length mismatch: %s has %d entries, tokenIds has %d.", name, values.size(), n));
      }
    });
    if (n > EngineLimits.MAX_VOCABULARY) {
      reasons.add(String.format(
          "Batch of %d tokens exceeds the vocabulary cap of %d.", n, EngineLimits.MAX_VOCABULARY));
    }
    ValidationException.throwIfAny(reasons);

    for (int i = 0; i < n; i++) {
      checkRange(reasons, "tokenIds", i, batch.getTokenIds().get(i), 0, EngineLimits.MAX_VOCABULARY - 1);
      checkPresent(reasons, "sentiments", i, batch.getSentiments().get(i));
      checkPresent(reasons, "flags", i, batch.getFlags().get(i));
      checkRange(reasons, "categories", i, batch.getCategories().get(i), 0, Category.COUNT - 1);
      checkRange(reasons, "secondaryCategories", i, batch.getSecondaryCategories().get(i), 0, Category.COUNT - 1);
      checkRange(reasons, "weights", i, batch.getWeights().get(i), EngineLimits.MIN_WEIGHT, EngineLimits.MAX_WEIGHT);
      checkRange(reasons, "contextInfluence", i, batch.getContextInfluence().get(i),
          EngineLimits.MIN_WEIGHT, EngineLimits.MAX_WEIGHT);
      checkRange(reasons, "domainRelevance", i, batch.getDomainRelevance().get(i), 0, Domain.COUNT - 1);
      if (batch.getDomainStrengths() != null) {
        checkRange(reasons, "domainStrengths", i, batch.getDomainStrengths().get(i), 0, Integer.MAX_VALUE);
      }
    }
    ValidationException.throwIfAny(reasons);
  }

  private static void checkPresent(List<String> reasons, String field, int index, Integer value) {
    if (value == null) {
      reasons.add(String.format("%s[%d] is missing.", field, index));
    }
  }

  private static void checkRange(List<String> reasons, String field, int index, Integer value, int min, int max) {
    if (value == null) {
      reasons.add(String.format("%s[%d] is missing.", field, index));
    } else if (value < min || value > max) {
      reasons.add(String.format("%s[%d]=%d is outside [%d, %d].", field, index, value, min, max));
    }
  }
}
