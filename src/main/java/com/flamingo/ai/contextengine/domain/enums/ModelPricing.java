package com.flamingo.ai.contextengine.domain.enums;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Provider price table in USD per 1K tokens. */
@Getter
@RequiredArgsConstructor
public enum ModelPricing {
  GPT_4_TURBO("gpt-4-turbo-preview", 0.01, 0.03),
  GPT_4("gpt-4", 0.03, 0.06),
  GPT_35_TURBO("gpt-3.5-turbo", 0.0005, 0.0015),
  EMBEDDING_SMALL("text-embedding-3-small", 0.00002, 0.0),
  EMBEDDING_LARGE("text-embedding-3-large", 0.00013, 0.0);

  /** Cheapest completion tier, forced when the spend rate is over budget. */
  public static final ModelPricing CHEAPEST = GPT_35_TURBO;

  private final String modelId;
  private final double promptCostPer1k;
  private final double completionCostPer1k;

  public double cost(int promptTokens, int completionTokens) {
    return promptTokens / 1000.0 * promptCostPer1k
        + completionTokens / 1000.0 * completionCostPer1k;
  }

  public static Optional<ModelPricing> fromModelId(String modelId) {
    return Arrays.stream(values()).filter(m -> m.modelId.equals(modelId)).findFirst();
  }
}
