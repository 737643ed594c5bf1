package com.flamingo.ai.contextengine.service.prompt;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flamingo.ai.contextengine.domain.enums.PromptTestStatus;
import com.flamingo.ai.contextengine.domain.enums.PromptType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An A/B test over prompt variants.
 *
 * @param allocation percentage per variant id, in variant order, summing to 100
 * @param endDate set when the test is completed
 */
public record PromptTest(
    String id,
    String name,
    PromptType type,
    PromptTestStatus status,
    Instant startDate,
    Instant endDate,
    List<PromptVariant> variants,
    Map<String, Integer> allocation) {

  @JsonIgnore
  public boolean isActive() {
    return status == PromptTestStatus.ACTIVE;
  }

  public Optional<PromptVariant> variant(String variantId) {
    return variants.stream().filter(v -> v.id().equals(variantId)).findFirst();
  }

  PromptTest completed(Instant at) {
    return new PromptTest(
        id, name, type, PromptTestStatus.COMPLETED, startDate, at, variants, allocation);
  }
}
