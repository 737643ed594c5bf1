package com.flamingo.ai.contextengine.service.prompt;

import com.flamingo.ai.contextengine.domain.enums.Complexity;
import com.flamingo.ai.contextengine.domain.enums.PromptType;
import java.util.Map;

/** Placeholder substitution and context-based template choice. */
public final class PromptTemplates {

  static final int BALANCED_CONVERSATION_LENGTH = 20;
  static final int CONTEXTUAL_CONVERSATION_LENGTH = 10;

  private PromptTemplates() {}

  /**
   * Signals used to pick a template.
   *
   * @param factChecking the reply is expected to verify claims
   */
  public record Selection(int conversationLength, Complexity complexity, boolean factChecking) {}

  /** Replaces every {@code {name}} placeholder with its value; unknown placeholders stay. */
  public static String build(String template, Map<String, ?> variables) {
    String result = template;
    if (variables == null) {
      return result;
    }
    for (Map.Entry<String, ?> entry : variables.entrySet()) {
      result =
          result.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
    }
    return result;
  }

  public static String build(PromptTemplate template, Map<String, ?> variables) {
    return build(template.getText(), variables);
  }

  /** Picks the template for a prompt type given the conversation signals. */
  public static PromptTemplate choose(PromptType type, Selection selection) {
    switch (type) {
      case SYSTEM:
        if (selection.complexity() == Complexity.COMPLEX || selection.factChecking()) {
          return PromptTemplate.SYSTEM_DETAILED;
        }
        return selection.conversationLength() > BALANCED_CONVERSATION_LENGTH
            ? PromptTemplate.SYSTEM_BALANCED
            : PromptTemplate.SYSTEM_CONCISE;
      case RESPONSE:
        return selection.conversationLength() > CONTEXTUAL_CONVERSATION_LENGTH
            ? PromptTemplate.RESPONSE_CONTEXTUAL
            : PromptTemplate.RESPONSE_FOCUSED;
      default:
        return PromptTemplate.INTERJECTION_SELECTIVE;
    }
  }

  public static String buildOptimal(
      PromptType type, Selection selection, Map<String, ?> variables) {
    return build(choose(type, selection), variables);
  }
}
