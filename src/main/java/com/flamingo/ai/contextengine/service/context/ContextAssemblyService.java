package com.flamingo.ai.contextengine.service.context;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import com.flamingo.ai.contextengine.domain.repository.ConversationSummaryRepository;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import com.flamingo.ai.contextengine.service.profile.UserProfileService;
import com.flamingo.ai.contextengine.service.search.DiversityReranker;
import com.flamingo.ai.contextengine.service.search.HybridSearchService;
import com.flamingo.ai.contextengine.service.search.SearchOptions;
import com.flamingo.ai.contextengine.service.search.ThreadContext;
import com.flamingo.ai.contextengine.service.search.ThreadRetriever;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Assembles the per-turn context window for a channel.
 *
 * <p>Recent messages, relevant messages, thread context and summaries are fetched concurrently;
 * profiles of every sender seen are loaded once those complete. Each fetch is isolated: a failure
 * yields an empty section. Assembled windows are cached briefly per (channel, query, thread).
 */
@Service
@Slf4j
public class ContextAssemblyService {

  private static final String NO_QUERY = "recent";
  private static final String MAIN_THREAD = "main";
  private static final Comparator<Message> CHRONOLOGICAL =
      Comparator.comparing(
          Message::timestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

  private final MessageStore messageStore;
  private final HybridSearchService hybridSearchService;
  private final DiversityReranker diversityReranker;
  private final ThreadRetriever threadRetriever;
  private final ConversationSummaryRepository summaryRepository;
  private final UserProfileService userProfileService;
  private final ContextFormatter contextFormatter;
  private final ContextQualityScorer qualityScorer;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;
  private final Executor executor;
  private final Cache<String, ContextWindow> windowCache;

  public ContextAssemblyService(
      MessageStore messageStore,
      HybridSearchService hybridSearchService,
      DiversityReranker diversityReranker,
      ThreadRetriever threadRetriever,
      ConversationSummaryRepository summaryRepository,
      UserProfileService userProfileService,
      ContextFormatter contextFormatter,
      ContextQualityScorer qualityScorer,
      ContextEngineConfig config,
      MeterRegistry meterRegistry,
      @Qualifier("contextFetchExecutor") Executor executor) {
    this.messageStore = messageStore;
    this.hybridSearchService = hybridSearchService;
    this.diversityReranker = diversityReranker;
    this.threadRetriever = threadRetriever;
    this.summaryRepository = summaryRepository;
    this.userProfileService = userProfileService;
    this.contextFormatter = contextFormatter;
    this.qualityScorer = qualityScorer;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.executor = executor;
    this.windowCache =
        Caffeine.newBuilder()
            .maximumSize(config.getContext().getCacheMaxSize())
            .expireAfterWrite(config.getContext().getCacheTtl())
            .build();
  }

  /** Options populated from configuration. */
  public ContextOptions defaultOptions() {
    ContextEngineConfig.Context context = config.getContext();
    return ContextOptions.builder()
        .maxTokens(context.getMaxTokens())
        .recentLimit(context.getRecentLimit())
        .relevantLimit(context.getRelevantLimit())
        .hoursBack(context.getHoursBack())
        .semanticWeight(config.getSearch().getSemanticWeight())
        .diversityWeight(config.getSearch().getDiversityWeight())
        .includeThread(true)
        .includeSummaries(true)
        .includeProfiles(true)
        .useAdaptiveThreshold(config.getSearch().isUseAdaptiveThreshold())
        .build();
  }

  /**
   * Builds the context window for a channel. Never throws.
   *
   * @param channelId the channel
   * @param query the inbound message used for relevance search, or {@code null}
   * @param options assembly tunables
   * @return the assembled window, or an empty window if assembly failed
   */
  @Timed(value = "context.build", description = "Time to assemble a context window")
  public ContextWindow buildContext(String channelId, String query, ContextOptions options) {
    String key = cacheKey(channelId, query, options.threadId());
    try {
      ContextWindow cached = windowCache.getIfPresent(key);
      if (cached != null) {
        log.debug("Using cached context for {}", key);
        meterRegistry.counter("context.cache.hits").increment();
        return cached;
      }

      ContextWindow window = assemble(channelId, query, options);
      windowCache.put(key, window);
      meterRegistry.counter("context.build.success").increment();
      log.info(
          "Context built for channel {}: recent={}, relevant={}, thread={}, quality={}, tokens={}",
          channelId,
          window.getRecentMessages().size(),
          window.getRelevantMessages().size(),
          window.hasThread() ? window.getThreadMessages().size() : 0,
          String.format("%.2f", window.getQualityScore()),
          window.getTokenEstimate());
      return window;
    } catch (RuntimeException e) {
      log.error("Failed to build context for channel {}: {}", channelId, e.getMessage(), e);
      meterRegistry.counter("context.build.errors").increment();
      return ContextWindow.empty();
    }
  }

  /** Empties the assembled-window cache. */
  public void clearCache() {
    windowCache.invalidateAll();
  }

  /**
   * Renders an already assembled window with a different token budget, e.g. the smaller budget
   * used when the window is embedded in a response prompt.
   */
  public FormattedContext format(ContextWindow window, int maxTokens) {
    return contextFormatter.format(
        window.getRecentMessages(),
        window.getRelevantMessages(),
        window.getThreadMessages(),
        window.getSummaries(),
        window.getProfiles(),
        maxTokens);
  }

  private ContextWindow assemble(String channelId, String query, ContextOptions options) {
    boolean hasQuery = query != null && !query.isBlank();

    CompletableFuture<List<Message>> recentFuture =
        fetch(
            "recent",
            () ->
                messageStore.recentMessages(
                    channelId, options.hoursBack(), options.recentLimit()),
            List.of());

    CompletableFuture<List<ScoredMessage>> relevantFuture =
        hasQuery
            ? fetch("relevant", () -> searchRelevant(channelId, query, options), List.of())
            : CompletableFuture.completedFuture(List.of());

    CompletableFuture<ThreadContext> threadFuture =
        options.wantsThread()
            ? fetch(
                "thread",
                () -> threadRetriever.getThreadContext(channelId, options.threadId(), true),
                ThreadContext.empty())
            : CompletableFuture.completedFuture(null);

    CompletableFuture<List<ConversationSummary>> summariesFuture =
        options.includeSummaries()
            ? fetch(
                "summaries",
                () ->
                    summaryRepository.findByChannelIdOrderByCreatedAtDesc(
                        channelId, PageRequest.of(0, config.getContext().getSummaryLimit())),
                List.of())
            : CompletableFuture.completedFuture(null);

    CompletableFuture.allOf(recentFuture, relevantFuture, threadFuture, summariesFuture).join();

    // Store returns newest first; the window keeps chronological order.
    List<Message> recent = new ArrayList<>(recentFuture.join());
    recent.sort(CHRONOLOGICAL);

    Set<String> recentIds = recent.stream().map(Message::id).collect(Collectors.toSet());
    List<ScoredMessage> relevant =
        relevantFuture.join().stream().filter(s -> !recentIds.contains(s.id())).toList();
    if (options.diversityWeight() > 0) {
      relevant = diversityReranker.rerank(relevant, options.diversityWeight());
    }
    relevant = relevant.stream().limit(options.relevantLimit()).toList();

    List<Message> thread = mergeThread(threadFuture.join());
    List<ConversationSummary> summaries = summariesFuture.join();

    Map<String, UserProfile> profiles = null;
    if (options.includeProfiles()) {
      Set<String> senders =
          Stream.of(
                  recent.stream().map(Message::senderId),
                  relevant.stream().map(ScoredMessage::senderId),
                  thread != null ? thread.stream().map(Message::senderId) : Stream.<String>empty())
              .flatMap(s -> s)
              .filter(id -> id != null && !id.isBlank())
              .collect(Collectors.toCollection(LinkedHashSet::new));
      profiles =
          fetch(
                  "profiles",
                  () -> userProfileService.loadProfiles(senders),
                  Map.<String, UserProfile>of())
              .join();
    }

    FormattedContext formatted =
        contextFormatter.format(recent, relevant, thread, summaries, profiles, options.maxTokens());

    double quality =
        qualityScorer.score(
            formatted.recent(), formatted.relevant(), formatted.thread(), formatted.profiles());

    int messageCount =
        formatted.recent().size()
            + formatted.relevant().size()
            + (formatted.thread() != null ? formatted.thread().size() : 0);

    return ContextWindow.builder()
        .recentMessages(formatted.recent())
        .relevantMessages(formatted.relevant())
        .threadMessages(formatted.thread())
        .summaries(formatted.summaries())
        .profiles(
            profiles != null ? Collections.unmodifiableMap(new LinkedHashMap<>(profiles)) : null)
        .tokenEstimate(formatted.tokenEstimate())
        .messageCount(messageCount)
        .qualityScore(quality)
        .formattedText(formatted.text())
        .build();
  }

  private List<ScoredMessage> searchRelevant(
      String channelId, String query, ContextOptions options) {
    SearchOptions searchOptions =
        hybridSearchService.defaultOptions(channelId).toBuilder()
            .limit(options.relevantLimit() * 2)
            .semanticWeight(options.semanticWeight())
            .recentHours(options.hoursBack() * 2)
            .useAdaptiveThreshold(options.useAdaptiveThreshold())
            .build();
    return hybridSearchService.search(query, searchOptions);
  }

  /** Thread messages plus related hits, deduplicated by id and ordered chronologically. */
  private static List<Message> mergeThread(ThreadContext context) {
    if (context == null) {
      return null;
    }
    Map<String, Message> byId = new LinkedHashMap<>();
    context.thread().forEach(m -> byId.putIfAbsent(m.id(), m));
    context.related().forEach(s -> byId.putIfAbsent(s.id(), s.message()));
    List<Message> merged = new ArrayList<>(byId.values());
    merged.sort(CHRONOLOGICAL);
    return merged;
  }

  private <T> CompletableFuture<T> fetch(String section, Supplier<T> supplier, T fallback) {
    return CompletableFuture.supplyAsync(supplier, executor)
        .exceptionally(
            e -> {
              log.warn(
                  "Context fetch '{}' failed, using empty section: {}", section, e.getMessage());
              meterRegistry.counter("context.fetch.failures", "section", section).increment();
              return fallback;
            });
  }

  static String cacheKey(String channelId, String query, String threadId) {
    String q = query != null && !query.isBlank() ? query : NO_QUERY;
    String t = threadId != null && !threadId.isBlank() ? threadId : MAIN_THREAD;
    return channelId + ":" + q + ":" + t;
  }
}
