package com.flamingo.ai.contextengine.service.response;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.model.UsageRecord;
import com.flamingo.ai.contextengine.service.completion.CompletionOptions;
import com.flamingo.ai.contextengine.service.completion.CompletionProvider;
import com.flamingo.ai.contextengine.service.completion.CompletionResult;
import com.flamingo.ai.contextengine.service.prompt.PromptTemplate;
import com.flamingo.ai.contextengine.service.prompt.PromptTemplates;
import com.flamingo.ai.contextengine.service.usage.UsageTracker;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether the agent should join a conversation it was not addressed in.
 *
 * <p>At most one interjection per channel within the configured interval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InterjectionService {

  static final String INTERJECT_PREFIX = "INTERJECT:";
  static final double TEMPERATURE = 0.8;
  static final int MAX_TOKENS = 150;

  private final InterjectionStateStore stateStore;
  private final CompletionProvider completionProvider;
  private final UsageTracker usageTracker;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;

  public InterjectionDecision shouldInterject(String channelId, List<String> recentTexts) {
    try {
      Duration interval = config.getInterjection().getMinimumInterval();
      Optional<Instant> last = stateStore.lastInterjection(channelId);
      if (last.isPresent() && last.get().plus(interval).isAfter(Instant.now())) {
        return InterjectionDecision.pass();
      }

      String prompt =
          PromptTemplates.build(
              PromptTemplate.INTERJECTION_SELECTIVE,
              Map.of("conversation", String.join("\n", recentTexts)));
      CompletionResult result =
          completionProvider.complete(
              List.of(UserMessage.from(prompt)),
              new CompletionOptions(TEMPERATURE, MAX_TOKENS, null));
      usageTracker.trackUsage(
          UsageRecord.builder()
              .model(result.model())
              .promptTokens(result.promptTokens())
              .completionTokens(result.completionTokens())
              .operation("interjection")
              .channelId(channelId)
              .build());

      String reply = result.text() != null ? result.text().trim() : "";
      if (!reply.startsWith(INTERJECT_PREFIX)) {
        return InterjectionDecision.pass();
      }

      String message = reply.substring(INTERJECT_PREFIX.length()).trim();
      stateStore.recordInterjection(channelId, Instant.now());
      meterRegistry.counter("interjection.made").increment();
      log.info("Interjecting in channel {}", channelId);
      return new InterjectionDecision(true, message);
    } catch (RuntimeException e) {
      log.warn("Interjection check failed for channel {}: {}", channelId, e.getMessage());
      meterRegistry.counter("interjection.errors").increment();
      return InterjectionDecision.pass();
    }
  }
}
