package com.flamingo.ai.contextengine.api.dto.response;

import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an assembled context window. Embeddings are not exposed. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {

  private List<MessageView> recentMessages;
  private List<MessageView> relevantMessages;
  private List<MessageView> threadMessages;
  private List<SummaryView> summaries;
  private List<ProfileView> profiles;
  private int tokenEstimate;
  private int messageCount;
  private double qualityScore;
  private String formattedText;

  /** Creates a ContextResponse from a ContextWindow. */
  public static ContextResponse fromWindow(ContextWindow window) {
    return ContextResponse.builder()
        .recentMessages(window.getRecentMessages().stream().map(MessageView::of).toList())
        .relevantMessages(window.getRelevantMessages().stream().map(MessageView::of).toList())
        .threadMessages(
            window.getThreadMessages() != null
                ? window.getThreadMessages().stream().map(MessageView::of).toList()
                : List.of())
        .summaries(
            window.getSummaries() != null
                ? window.getSummaries().stream().map(SummaryView::of).toList()
                : List.of())
        .profiles(window.profilesOrEmpty().values().stream().map(ProfileView::of).toList())
        .tokenEstimate(window.getTokenEstimate())
        .messageCount(window.getMessageCount())
        .qualityScore(window.getQualityScore())
        .formattedText(window.getFormattedText())
        .build();
  }

  /** A message without its embedding. Score is set for relevant messages only. */
  public record MessageView(
      String id, String senderId, String text, Instant timestamp, String threadId, Double score) {

    static MessageView of(Message message) {
      return new MessageView(
          message.id(),
          message.senderId(),
          message.text(),
          message.timestamp(),
          message.threadId(),
          null);
    }

    static MessageView of(ScoredMessage scored) {
      Message message = scored.message();
      return new MessageView(
          message.id(),
          message.senderId(),
          message.text(),
          message.timestamp(),
          message.threadId(),
          scored.combinedScore());
    }
  }

  /** A stored conversation summary. */
  public record SummaryView(
      String summary, List<String> keyTopics, Instant periodStart, Instant periodEnd) {

    static SummaryView of(ConversationSummary summary) {
      return new SummaryView(
          summary.getSummary(),
          summary.getKeyTopics(),
          summary.getPeriodStart(),
          summary.getPeriodEnd());
    }
  }

  /** A participant profile. */
  public record ProfileView(String userId, String displayName, String personalitySummary) {

    static ProfileView of(UserProfile profile) {
      return new ProfileView(
          profile.getUserId(), profile.displayNameOrId(), profile.getPersonalitySummary());
    }
  }
}
