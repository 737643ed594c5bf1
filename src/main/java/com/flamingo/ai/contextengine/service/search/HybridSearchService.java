package com.flamingo.ai.contextengine.service.search;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.MessageHit;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import com.flamingo.ai.contextengine.service.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Hybrid search over chat history combining vector similarity and full-text relevance with a
 * temporal decay.
 *
 * <p>Scores are fused linearly: {@code semanticWeight * semantic + (1 - semanticWeight) * keyword},
 * then boosted by recency. When no query embedding can be obtained the search runs keyword-only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HybridSearchService {

  private static final double RECENCY_BOOST = 0.2;
  private static final double RECENT_WINDOW_BOOST = 1.1;

  private final MessageStore messageStore;
  private final EmbeddingService embeddingService;
  private final AdaptiveThresholdCalculator adaptiveThresholdCalculator;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;

  /** Options populated from configuration for the given channel. */
  public SearchOptions defaultOptions(String channelId) {
    ContextEngineConfig.Search search = config.getSearch();
    return SearchOptions.builder()
        .channelId(channelId)
        .limit(search.getLimit())
        .semanticWeight(search.getSemanticWeight())
        .recentHours(search.getRecentHours())
        .minScore(search.getMinScore())
        .temporalDecay(search.getTemporalDecay())
        .useAdaptiveThreshold(search.isUseAdaptiveThreshold())
        .build();
  }

  /**
   * Searches messages relevant to a query.
   *
   * @param query the query text
   * @param options search tunables
   * @return at most {@code options.limit()} messages scoring at least {@code options.minScore()},
   *     ordered by combined score descending
   */
  @Timed(value = "search.hybrid", description = "Time for hybrid message search")
  public List<ScoredMessage> search(String query, SearchOptions options) {
    if (query == null || query.isBlank() || options.limit() <= 0) {
      return List.of();
    }

    int candidates = options.limit() * 2;
    double semanticWeight = options.semanticWeight();

    List<Float> queryEmbedding = embeddingService.embed(query);
    List<MessageHit> semanticHits = List.of();
    if (queryEmbedding.isEmpty()) {
      log.warn("No query embedding available, falling back to keyword search only");
      meterRegistry.counter("search.keyword_only").increment();
      semanticWeight = 0.0;
    } else {
      double floor =
          options.useAdaptiveThreshold()
              ? adaptiveThresholdCalculator.calculate(
                  options.channelId(), queryEmbedding, options.limit())
              : options.minScore();
      semanticHits = semanticCandidates(queryEmbedding, options.channelId(), candidates, floor);
    }

    List<MessageHit> keywordHits = keywordCandidates(query, options.channelId(), candidates);
    List<ScoredMessage> results =
        fuse(semanticHits, keywordHits, semanticWeight, options, Instant.now()).stream()
            .filter(scored -> scored.combinedScore() >= options.minScore())
            .limit(options.limit())
            .toList();

    meterRegistry.counter("search.requests").increment();
    log.debug(
        "Hybrid search in channel {}: {} semantic, {} keyword, {} results",
        options.channelId(),
        semanticHits.size(),
        keywordHits.size(),
        results.size());
    return results;
  }

  List<ScoredMessage> fuse(
      List<MessageHit> semanticHits,
      List<MessageHit> keywordHits,
      double semanticWeight,
      SearchOptions options,
      Instant now) {
    double maxKeyword = keywordHits.stream().mapToDouble(MessageHit::score).max().orElse(0.0);

    Map<String, double[]> scores = new LinkedHashMap<>();
    Map<String, Message> messages = new LinkedHashMap<>();
    for (MessageHit hit : semanticHits) {
      scores.computeIfAbsent(hit.message().id(), id -> new double[2])[0] = hit.score();
      messages.putIfAbsent(hit.message().id(), hit.message());
    }
    for (MessageHit hit : keywordHits) {
      double normalized = maxKeyword > 0 ? hit.score() / maxKeyword : 0.0;
      scores.computeIfAbsent(hit.message().id(), id -> new double[2])[1] = normalized;
      messages.putIfAbsent(hit.message().id(), hit.message());
    }

    return scores.entrySet().stream()
        .map(
            entry -> {
              Message message = messages.get(entry.getKey());
              double semantic = entry.getValue()[0];
              double keyword = entry.getValue()[1];
              double ageHours = message.ageHours(now);
              double recencyWeight = Math.exp(-options.temporalDecay() * ageHours / 24.0);

              double combined = semanticWeight * semantic + (1 - semanticWeight) * keyword;
              combined *= 1 + RECENCY_BOOST * recencyWeight;
              if (ageHours <= options.recentHours()) {
                combined *= RECENT_WINDOW_BOOST;
              }
              return new ScoredMessage(message, semantic, keyword, recencyWeight, combined);
            })
        .sorted(Comparator.comparingDouble(ScoredMessage::combinedScore).reversed())
        .toList();
  }

  private List<MessageHit> semanticCandidates(
      List<Float> embedding, String channelId, int limit, double floor) {
    try {
      return messageStore.vectorSimilar(embedding, channelId, limit, floor, null);
    } catch (RuntimeException e) {
      log.warn("Vector similarity query failed, using keyword results: {}", e.getMessage());
      meterRegistry.counter("search.semantic.failures").increment();
      return List.of();
    }
  }

  private List<MessageHit> keywordCandidates(String query, String channelId, int limit) {
    try {
      return messageStore.keywordRelevant(query, channelId, limit, null);
    } catch (RuntimeException e) {
      log.warn("Keyword relevance query failed, using semantic results: {}", e.getMessage());
      meterRegistry.counter("search.keyword.failures").increment();
      return List.of();
    }
  }
}
