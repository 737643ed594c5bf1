package com.flamingo.ai.contextengine.service.context;

import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders context sections into prompt text under a token budget.
 *
 * <p>Sections appear in a fixed order: conversation history, active users, thread, relevant,
 * recent. Recent messages are budgeted first so they are always present, dropping the oldest lines
 * when they alone exceed the budget. The remaining sections share what is left in display order.
 */
@Component
public class ContextFormatter {

  /** Tokens charged for a section header and its separator. */
  static final int SECTION_OVERHEAD_TOKENS = 4;

  static final int MAX_SUMMARIES = 2;
  static final int MAX_THREAD_MESSAGES = 10;

  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

  public static int estimateTokens(String text) {
    return text == null || text.isEmpty() ? 0 : (text.length() + 3) / 4;
  }

  /**
   * Formats the sections.
   *
   * @param recent recent messages, chronological
   * @param relevant relevant messages in any order
   * @param thread thread messages, chronological, or {@code null}
   * @param summaries summaries newest first, or {@code null}
   * @param profiles profiles keyed by user id, or {@code null}
   * @param maxTokens budget the returned estimate never exceeds
   */
  public FormattedContext format(
      List<Message> recent,
      List<ScoredMessage> relevant,
      List<Message> thread,
      List<ConversationSummary> summaries,
      Map<String, UserProfile> profiles,
      int maxTokens) {
    Map<String, UserProfile> names = profiles != null ? profiles : Map.of();
    Budget budget = new Budget(Math.max(0, maxTokens));

    // Recent: newest lines first so that truncation drops the oldest.
    List<String> recentLines = new ArrayList<>();
    List<Message> recentKept = new ArrayList<>();
    List<Message> recentSafe = recent != null ? recent : List.of();
    if (!recentSafe.isEmpty() && budget.openSection()) {
      for (int i = recentSafe.size() - 1; i >= 0; i--) {
        String line = messageLine(recentSafe.get(i), names);
        if (!budget.take(line)) {
          break;
        }
        recentLines.add(line);
        recentKept.add(recentSafe.get(i));
      }
      budget.closeSection(recentLines.isEmpty());
      Collections.reverse(recentLines);
      Collections.reverse(recentKept);
    }

    List<String> summaryLines = new ArrayList<>();
    List<ConversationSummary> summariesKept = new ArrayList<>();
    if (summaries != null && !summaries.isEmpty() && budget.openSection()) {
      int count = Math.min(MAX_SUMMARIES, summaries.size());
      for (ConversationSummary summary : summaries.subList(0, count)) {
        String line = "[" + summaryDate(summary) + "] " + summary.getSummary();
        if (!budget.take(line)) {
          break;
        }
        summaryLines.add(line);
        summariesKept.add(summary);
      }
      budget.closeSection(summaryLines.isEmpty());
    }

    List<String> userLines = new ArrayList<>();
    Map<String, UserProfile> profilesKept = new LinkedHashMap<>();
    List<UserProfile> described =
        names.values().stream().filter(UserProfile::hasPersonalitySummary).toList();
    if (!described.isEmpty() && budget.openSection()) {
      for (UserProfile profile : described) {
        String line = profile.displayNameOrId() + ": " + profile.getPersonalitySummary();
        if (!budget.take(line)) {
          break;
        }
        userLines.add(line);
        profilesKept.put(profile.getUserId(), profile);
      }
      budget.closeSection(userLines.isEmpty());
    }

    List<String> threadLines = new ArrayList<>();
    List<Message> threadKept = new ArrayList<>();
    if (thread != null && !thread.isEmpty() && budget.openSection()) {
      List<Message> tail =
          thread.subList(Math.max(0, thread.size() - MAX_THREAD_MESSAGES), thread.size());
      for (Message message : tail) {
        String line = messageLine(message, names);
        if (!budget.take(line)) {
          break;
        }
        threadLines.add(line);
        threadKept.add(message);
      }
      budget.closeSection(threadLines.isEmpty());
    }

    List<String> relevantLines = new ArrayList<>();
    List<ScoredMessage> relevantKept = new ArrayList<>();
    if (relevant != null && !relevant.isEmpty() && budget.openSection()) {
      List<ScoredMessage> ordered = new ArrayList<>(relevant);
      ordered.sort(Comparator.comparingDouble(ScoredMessage::combinedScore).reversed());
      for (ScoredMessage scored : ordered) {
        String line = messageLine(scored.message(), names);
        if (!budget.take(line)) {
          break;
        }
        relevantLines.add(line);
        relevantKept.add(scored);
      }
      budget.closeSection(relevantLines.isEmpty());
    }

    StringBuilder text = new StringBuilder();
    appendSection(text, "Conversation History", summaryLines);
    appendSection(text, "Active Users", userLines);
    appendSection(text, "Thread Context", threadLines);
    appendSection(text, "Relevant Context", relevantLines);
    appendSection(text, "Recent Conversation", recentLines);

    return new FormattedContext(
        text.toString().stripTrailing(),
        budget.used,
        recentKept,
        relevantKept,
        thread != null ? threadKept : null,
        summaries != null ? summariesKept : null,
        profiles != null ? profilesKept : null);
  }

  private static void appendSection(StringBuilder text, String title, List<String> lines) {
    if (lines.isEmpty()) {
      return;
    }
    text.append("=== ").append(title).append(" ===\n");
    lines.forEach(line -> text.append(line).append('\n'));
    text.append('\n');
  }

  private static String messageLine(Message message, Map<String, UserProfile> profiles) {
    UserProfile profile = profiles.get(message.senderId());
    String name =
        profile != null
            ? profile.displayNameOrId()
            : message.senderId() != null ? message.senderId() : "unknown";
    return "[" + name + "]: " + message.safeText();
  }

  private static String summaryDate(ConversationSummary summary) {
    Instant at = summary.getPeriodEnd() != null ? summary.getPeriodEnd() : summary.getCreatedAt();
    return at != null ? DATE.format(at) : "unknown";
  }

  /** Running token count; a section's header is charged when it is opened. */
  private static final class Budget {
    private final int max;
    private int used;

    private Budget(int max) {
      this.max = max;
    }

    boolean openSection() {
      if (used + SECTION_OVERHEAD_TOKENS > max) {
        return false;
      }
      used += SECTION_OVERHEAD_TOKENS;
      return true;
    }

    void closeSection(boolean empty) {
      if (empty) {
        used -= SECTION_OVERHEAD_TOKENS;
      }
    }

    boolean take(String line) {
      int cost = estimateTokens(line);
      if (used + cost > max) {
        return false;
      }
      used += cost;
      return true;
    }
  }
}
