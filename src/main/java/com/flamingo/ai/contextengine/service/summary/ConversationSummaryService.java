package com.flamingo.ai.contextengine.service.summary;

import com.flamingo.ai.contextengine.agent.ConversationSummaryAgent;
import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.repository.ConversationSummaryRepository;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically summarizes the last day of each configured channel.
 *
 * <p>A channel is summarized at most once per {@link #SUMMARY_PERIOD}. Summaries are read back by
 * the context assembler as compact conversation history.
 */
@Service
@Slf4j
public class ConversationSummaryService {

  static final Duration SUMMARY_PERIOD = Duration.ofHours(24);
  static final int TOPIC_MIN_OCCURRENCES = 3;

  private static final Map<String, Pattern> TOPIC_PATTERNS = topicPatterns();

  private final MessageStore messageStore;
  private final ConversationSummaryRepository summaryRepository;
  private final ConversationSummaryAgent summaryAgent;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public ConversationSummaryService(
      MessageStore messageStore,
      ConversationSummaryRepository summaryRepository,
      ConversationSummaryAgent summaryAgent,
      ContextEngineConfig config,
      MeterRegistry meterRegistry) {
    this(messageStore, summaryRepository, summaryAgent, config, meterRegistry, Clock.systemUTC());
  }

  ConversationSummaryService(
      MessageStore messageStore,
      ConversationSummaryRepository summaryRepository,
      ConversationSummaryAgent summaryAgent,
      ContextEngineConfig config,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.messageStore = messageStore;
    this.summaryRepository = summaryRepository;
    this.summaryAgent = summaryAgent;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** Summarizes every configured channel that is due. Disabled channels are skipped. */
  @Scheduled(
      fixedDelayString = "${context-engine.summarization.interval:PT1H}",
      initialDelayString = "PT1M")
  public void summarizeDueChannels() {
    ContextEngineConfig.Summarization settings = config.getSummarization();
    if (!settings.isEnabled() || settings.getChannels().isEmpty()) {
      return;
    }
    for (String channelId : settings.getChannels()) {
      try {
        summarizeIfDue(channelId);
      } catch (Exception e) {
        log.error("Failed to summarize channel {}: {}", channelId, e.getMessage(), e);
        meterRegistry.counter("summary.errors").increment();
      }
    }
  }

  /**
   * Summarizes a channel when its latest summary is older than a day.
   *
   * @return the stored summary, or empty when the channel was not due or too quiet
   */
  @Timed(value = "summary.generate", description = "Time to summarize a channel")
  public Optional<ConversationSummary> summarizeIfDue(String channelId) {
    Instant now = clock.instant();
    Optional<ConversationSummary> latest =
        summaryRepository.findFirstByChannelIdOrderByCreatedAtDesc(channelId);
    if (latest.isPresent()
        && latest.get().getCreatedAt() != null
        && latest.get().getCreatedAt().isAfter(now.minus(SUMMARY_PERIOD))) {
      log.debug(
          "Channel {} was summarized at {}, skipping", channelId, latest.get().getCreatedAt());
      return Optional.empty();
    }

    Instant from = now.minus(SUMMARY_PERIOD);
    List<Message> messages =
        messageStore.messagesBetween(
            channelId, from, now, config.getSummarization().getMaxMessages());
    if (messages.size() < config.getSummarization().getMinMessages()) {
      log.info(
          "Not enough messages to summarize channel {} ({} found)", channelId, messages.size());
      return Optional.empty();
    }

    String conversation =
        messages.stream()
            .map(m -> m.senderId() + ": " + m.safeText())
            .collect(Collectors.joining("\n"));
    String summaryText = summaryAgent.summarize(conversation);

    List<String> participants =
        new ArrayList<>(
            messages.stream()
                .map(Message::senderId)
                .filter(id -> id != null)
                .collect(Collectors.toCollection(LinkedHashSet::new)));

    ConversationSummary summary =
        ConversationSummary.builder()
            .channelId(channelId)
            .summary(summaryText)
            .keyTopics(extractTopics(conversation))
            .participantIds(participants)
            .messageCount(messages.size())
            .periodStart(from)
            .periodEnd(now)
            .createdAt(now)
            .build();
    ConversationSummary saved = summaryRepository.save(summary);

    meterRegistry.counter("summary.created").increment();
    log.info("Summarized {} messages for channel {}", messages.size(), channelId);
    return Optional.of(saved);
  }

  /** Topic labels whose keywords occur more than twice in the text. */
  static List<String> extractTopics(String text) {
    List<String> topics = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return topics;
    }
    for (Map.Entry<String, Pattern> topic : TOPIC_PATTERNS.entrySet()) {
      Matcher matcher = topic.getValue().matcher(text);
      int count = 0;
      while (matcher.find() && count < TOPIC_MIN_OCCURRENCES) {
        count++;
      }
      if (count >= TOPIC_MIN_OCCURRENCES) {
        topics.add(topic.getKey());
      }
    }
    return topics;
  }

  private static Map<String, Pattern> topicPatterns() {
    Map<String, Pattern> patterns = new LinkedHashMap<>();
    patterns.put("bug", keywords("bug", "error", "issue", "problem"));
    patterns.put("deploy", keywords("deploy", "deployment", "release", "ship"));
    patterns.put("meeting", keywords("meeting", "standup", "sync"));
    patterns.put("feature", keywords("feature", "implement", "build"));
    patterns.put("review", keywords("review", "pr", "pull request"));
    patterns.put("test", keywords("test", "testing", "qa"));
    patterns.put("database", keywords("database", "api", "server"));
    patterns.put("frontend", keywords("frontend", "backend", "fullstack"));
    return patterns;
  }

  private static Pattern keywords(String... words) {
    return Pattern.compile(
        "\\b(" + String.join("|", words) + ")\\b", Pattern.CASE_INSENSITIVE);
  }
}
