package com.flamingo.ai.contextengine.service.usage;

import com.flamingo.ai.contextengine.domain.enums.Complexity;
import com.flamingo.ai.contextengine.domain.enums.ModelPricing;
import com.flamingo.ai.contextengine.exception.BudgetExceededException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cost-aware model tier selection.
 *
 * <p>Starts from the cheapest tier and escalates for search-backed, complex or long conversations;
 * code and debugging questions go to the strongest tier. When the trailing-hour spend is over
 * budget the cheapest tier is forced.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelSelector {

  static final int TOKENS_PER_CONVERSATION_MESSAGE = 50;
  static final int SYSTEM_PROMPT_TOKENS = 200;
  static final int LONG_CONVERSATION = 20;

  private final UsageTracker usageTracker;
  private final MeterRegistry meterRegistry;

  public ModelSelection selectOptimalModel(String query, ModelSelectionCriteria criteria) {
    String text = query != null ? query : "";
    Complexity complexity =
        criteria.complexity() != null ? criteria.complexity() : Complexity.SIMPLE;

    int promptTokens =
        text.length() / 4
            + criteria.conversationLength() * TOKENS_PER_CONVERSATION_MESSAGE
            + SYSTEM_PROMPT_TOKENS;
    int completionTokens = complexity.getExpectedCompletionTokens();

    ModelPricing model = ModelPricing.GPT_35_TURBO;
    String reasoning = "Simple query, using the cost-efficient model";

    if (criteria.requiresSearch()
        || complexity == Complexity.COMPLEX
        || criteria.conversationLength() > LONG_CONVERSATION) {
      model = ModelPricing.GPT_4_TURBO;
      reasoning = "Complex query or long conversation, using the advanced model";
    }

    String folded = text.toLowerCase(Locale.ROOT);
    if (folded.contains("code") || folded.contains("debug")) {
      model = ModelPricing.GPT_4;
      reasoning = "Code-related query, using the most capable model";
    }

    try {
      usageTracker.checkHourlyBudget();
    } catch (BudgetExceededException e) {
      log.warn(
          "Hourly budget exceeded ({}), forcing {}",
          e.getMessage(),
          ModelPricing.CHEAPEST.getModelId());
      meterRegistry.counter("model.selection.budget_forced").increment();
      model = ModelPricing.CHEAPEST;
      reasoning = "Hourly budget exceeded, using the cheapest model";
    }

    double estimatedCost = model.cost(promptTokens, completionTokens);
    meterRegistry.counter("model.selection", "model", model.getModelId()).increment();
    return new ModelSelection(model.getModelId(), reasoning, estimatedCost);
  }
}
