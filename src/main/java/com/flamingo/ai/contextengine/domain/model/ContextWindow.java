package com.flamingo.ai.contextengine.domain.model;

import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * The bundled, budgeted set of messages, summaries and profiles handed to the generator.
 *
 * <p>{@code tokenEstimate} always fits the budget the window was built for and no message id
 * appears in both {@code recentMessages} and {@code relevantMessages}.
 */
@Getter
@Builder(toBuilder = true)
public class ContextWindow {

  @Builder.Default private final List<Message> recentMessages = List.of();

  @Builder.Default private final List<ScoredMessage> relevantMessages = List.of();

  /** Thread messages, or {@code null} when no thread was requested. */
  private final List<Message> threadMessages;

  /** Conversation summaries, or {@code null} when summaries were not requested. */
  private final List<ConversationSummary> summaries;

  /** Profiles keyed by user id, or {@code null} when profiles were not requested. */
  private final Map<String, UserProfile> profiles;

  private final int tokenEstimate;

  private final int messageCount;

  /** Quality estimate in [0, 1]. */
  private final double qualityScore;

  /** Formatted prompt text honouring the token budget. */
  @Builder.Default private final String formattedText = "";

  /** A minimal, valid window with no content. */
  public static ContextWindow empty() {
    return ContextWindow.builder().build();
  }

  public boolean hasThread() {
    return threadMessages != null && !threadMessages.isEmpty();
  }

  public boolean hasProfiles() {
    return profiles != null && !profiles.isEmpty();
  }

  public boolean hasSummaries() {
    return summaries != null && !summaries.isEmpty();
  }

  public boolean isEmpty() {
    return recentMessages.isEmpty()
        && relevantMessages.isEmpty()
        && !hasThread()
        && !hasSummaries()
        && !hasProfiles();
  }

  public List<String> recentTexts() {
    return recentMessages.stream().map(Message::safeText).toList();
  }

  public Map<String, UserProfile> profilesOrEmpty() {
    return profiles != null ? profiles : Map.of();
  }
}
