package com.flamingo.ai.contextengine.service.response;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.enums.Complexity;
import com.flamingo.ai.contextengine.domain.enums.PromptType;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.domain.model.GenerationParameters;
import com.flamingo.ai.contextengine.domain.model.Mood;
import com.flamingo.ai.contextengine.domain.model.UsageRecord;
import com.flamingo.ai.contextengine.exception.ProviderRateLimitedException;
import com.flamingo.ai.contextengine.service.completion.CompletionOptions;
import com.flamingo.ai.contextengine.service.completion.CompletionProvider;
import com.flamingo.ai.contextengine.service.completion.CompletionResult;
import com.flamingo.ai.contextengine.service.context.ContextAssemblyService;
import com.flamingo.ai.contextengine.service.context.ContextOptions;
import com.flamingo.ai.contextengine.service.mood.MoodEngine;
import com.flamingo.ai.contextengine.service.profile.UserProfileService;
import com.flamingo.ai.contextengine.service.prompt.MetricsUpdate;
import com.flamingo.ai.contextengine.service.prompt.PromptTemplate;
import com.flamingo.ai.contextengine.service.prompt.PromptTemplates;
import com.flamingo.ai.contextengine.service.prompt.PromptTest;
import com.flamingo.ai.contextengine.service.prompt.PromptVariant;
import com.flamingo.ai.contextengine.service.prompt.PromptVariantSelector;
import com.flamingo.ai.contextengine.service.usage.ModelSelection;
import com.flamingo.ai.contextengine.service.usage.ModelSelectionCriteria;
import com.flamingo.ai.contextengine.service.usage.ModelSelector;
import com.flamingo.ai.contextengine.service.usage.UsageTracker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * End-to-end reply generation: context, mood, model tier, prompt choice, completion,
 * post-processing and bookkeeping.
 *
 * <p>Never throws; any failure produces the configured fallback reply.
 */
@Service
@Slf4j
public class ResponseOrchestrator {

  static final int RESPONSE_RECENT_LIMIT = 25;
  static final int RESPONSE_RELEVANT_LIMIT = 15;
  static final double RESPONSE_SEMANTIC_WEIGHT = 0.7;
  static final double RESPONSE_DIVERSITY_WEIGHT = 0.2;
  static final int CACHE_KEY_PREFIX_CHARS = 50;
  static final String OPERATION = "generateResponse";

  private final ContextAssemblyService contextAssemblyService;
  private final MoodEngine moodEngine;
  private final ModelSelector modelSelector;
  private final PromptVariantSelector promptVariantSelector;
  private final CompletionProvider completionProvider;
  private final UsageTracker usageTracker;
  private final UserProfileService userProfileService;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;
  private final Executor backgroundExecutor;
  private final Cache<String, ResponseResult> responseCache;

  public ResponseOrchestrator(
      ContextAssemblyService contextAssemblyService,
      MoodEngine moodEngine,
      ModelSelector modelSelector,
      PromptVariantSelector promptVariantSelector,
      CompletionProvider completionProvider,
      UsageTracker usageTracker,
      UserProfileService userProfileService,
      ContextEngineConfig config,
      MeterRegistry meterRegistry,
      @Qualifier("backgroundTaskExecutor") Executor backgroundExecutor) {
    this.contextAssemblyService = contextAssemblyService;
    this.moodEngine = moodEngine;
    this.modelSelector = modelSelector;
    this.promptVariantSelector = promptVariantSelector;
    this.completionProvider = completionProvider;
    this.usageTracker = usageTracker;
    this.userProfileService = userProfileService;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.backgroundExecutor = backgroundExecutor;
    this.responseCache =
        Caffeine.newBuilder()
            .maximumSize(1000)
            .expireAfterWrite(config.getResponse().getCacheTtl())
            .build();
  }

  /**
   * Generates a reply to a message.
   *
   * @param threadId thread the message belongs to, or {@code null}
   * @return the reply and its metadata, or the fallback reply on failure
   */
  @Timed(value = "response.generate", description = "Time to generate a reply")
  public ResponseResult generateResponse(
      String message, String channelId, String userId, String userName, String threadId) {
    long started = System.currentTimeMillis();
    String key = cacheKey(channelId, message, threadId);
    ResponseResult cached = responseCache.getIfPresent(key);
    if (cached != null) {
      meterRegistry.counter("response.cache.hits").increment();
      return new ResponseResult(
          cached.response(), cached.metadata().toBuilder().cached(true).build());
    }

    PromptTest systemTest = null;
    PromptVariant variant = null;
    try {
      ContextOptions options =
          contextAssemblyService.defaultOptions().toBuilder()
              .recentLimit(RESPONSE_RECENT_LIMIT)
              .relevantLimit(RESPONSE_RELEVANT_LIMIT)
              .semanticWeight(RESPONSE_SEMANTIC_WEIGHT)
              .diversityWeight(RESPONSE_DIVERSITY_WEIGHT)
              .threadId(threadId)
              .build();
      ContextWindow context = contextAssemblyService.buildContext(channelId, message, options);

      Mood mood = moodEngine.determineMood(context.recentTexts(), message);
      Complexity complexity = moodEngine.assessComplexity(message, context);
      int conversationLength = context.getRecentMessages().size();
      ModelSelection selection =
          modelSelector.selectOptimalModel(
              message, new ModelSelectionCriteria(false, conversationLength, complexity));

      Optional<PromptTest> activeTest = promptVariantSelector.getActiveTest(PromptType.SYSTEM);
      if (activeTest.isPresent()) {
        systemTest = activeTest.get();
        variant = promptVariantSelector.selectVariant(systemTest.id(), userId).orElse(null);
      }
      String systemPrompt =
          variant != null && variant.systemPrompt() != null
              ? variant.systemPrompt()
              : PromptTemplate.SYSTEM_BALANCED.getText();

      String formattedContext =
          contextAssemblyService
              .format(context, config.getResponse().getFormattedContextTokens())
              .text();
      String userPrompt =
          PromptTemplates.buildOptimal(
              PromptType.RESPONSE,
              new PromptTemplates.Selection(conversationLength, complexity, false),
              Map.of(
                  "context", formattedContext,
                  "message", message,
                  "userName", userName != null ? userName : userId));

      GenerationParameters parameters = moodEngine.generationParameters(mood);
      CompletionResult completion =
          completionProvider.complete(
              List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)),
              new CompletionOptions(
                  parameters.temperature(), parameters.maxTokens(), selection.model()));

      String reply = moodEngine.postProcess(completion.text(), mood);

      UsageRecord usage =
          usageTracker.trackUsage(
              UsageRecord.builder()
                  .model(completion.model())
                  .promptTokens(completion.promptTokens())
                  .completionTokens(completion.completionTokens())
                  .operation(OPERATION)
                  .userId(userId)
                  .channelId(channelId)
                  .build());

      long elapsed = System.currentTimeMillis() - started;
      if (variant != null) {
        promptVariantSelector.trackMetrics(
            systemTest.id(),
            variant.id(),
            MetricsUpdate.builder()
                .quality(context.getQualityScore())
                .responseTimeMs(elapsed)
                .tokens(usage.totalTokens())
                .build());
      }

      try {
        backgroundExecutor.execute(
            () -> userProfileService.recordInteraction(userId, userName, message, reply));
      } catch (RejectedExecutionException e) {
        log.warn("Interaction of user {} not recorded: {}", userId, e.getMessage());
      }

      ResponseResult result =
          new ResponseResult(
              reply,
              ResponseMetadata.builder()
                  .mood(mood.name())
                  .moodIntensity(mood.intensity())
                  .modelUsed(completion.model())
                  .modelReasoning(selection.reasoning())
                  .contextQuality(context.getQualityScore())
                  .contextTokens(context.getTokenEstimate())
                  .tokensUsed(usage.totalTokens())
                  .cost(usage.cost())
                  .responseTimeMs(elapsed)
                  .promptTestId(systemTest != null && variant != null ? systemTest.id() : null)
                  .promptVariantId(variant != null ? variant.id() : null)
                  .factChecked(false)
                  .build());
      responseCache.put(key, result);
      meterRegistry.counter("response.generated", "mood", mood.name()).increment();
      log.info(
          "Reply generated in channel {} (mood={}, model={}, tokens={}, {} ms)",
          channelId,
          mood.name(),
          completion.model(),
          usage.totalTokens(),
          elapsed);
      return result;
    } catch (ProviderRateLimitedException e) {
      log.warn("Provider rate limited, retry after {}: {}", e.getRetryAfter(), e.getMessage());
      return fallback(started, systemTest, variant);
    } catch (RuntimeException e) {
      log.error("Failed to generate reply in channel {}: {}", channelId, e.getMessage(), e);
      return fallback(started, systemTest, variant);
    }
  }

  /** Empties the reply cache and the context cache. */
  public void clearCache() {
    responseCache.invalidateAll();
    contextAssemblyService.clearCache();
  }

  private ResponseResult fallback(long started, PromptTest test, PromptVariant variant) {
    meterRegistry.counter("response.fallbacks").increment();
    if (test != null && variant != null) {
      try {
        promptVariantSelector.trackMetrics(
            test.id(), variant.id(), MetricsUpdate.builder().error(true).build());
      } catch (RuntimeException e) {
        log.warn("Could not record prompt error metric: {}", e.getMessage());
      }
    }
    Mood neutral = Mood.neutral();
    return new ResponseResult(
        config.getResponse().getFallbackReply(),
        ResponseMetadata.builder()
            .mood(neutral.name())
            .moodIntensity(neutral.intensity())
            .modelUsed("error")
            .responseTimeMs(System.currentTimeMillis() - started)
            .factChecked(false)
            .build());
  }

  static String cacheKey(String channelId, String message, String threadId) {
    String text = message != null ? message : "";
    String prefix =
        text.length() > CACHE_KEY_PREFIX_CHARS ? text.substring(0, CACHE_KEY_PREFIX_CHARS) : text;
    return channelId + ":" + prefix + ":" + (threadId != null ? threadId : "main");
  }
}
