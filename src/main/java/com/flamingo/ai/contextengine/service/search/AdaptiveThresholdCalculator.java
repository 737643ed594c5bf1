package com.flamingo.ai.contextengine.service.search;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Derives a semantic similarity floor from how similar a query is to a random sample of a
 * channel's stored embeddings.
 *
 * <p>The floor is the similarity at rank {@code 2 * targetResults} of the sample, never lower than
 * the configured default.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdaptiveThresholdCalculator {

  private final MessageStore messageStore;
  private final ContextEngineConfig config;

  public double calculate(String channelId, List<Float> queryEmbedding, int targetResults) {
    ContextEngineConfig.Search search = config.getSearch();
    double fallback = search.getAdaptiveDefaultThreshold();
    if (queryEmbedding == null || queryEmbedding.isEmpty()) {
      return fallback;
    }

    List<List<Float>> sample;
    try {
      sample = messageStore.sampleEmbeddings(channelId, search.getAdaptiveSampleSize());
    } catch (RuntimeException e) {
      log.warn("Embedding sample unavailable for channel {}: {}", channelId, e.getMessage());
      return fallback;
    }

    List<Double> similarities = querySimilarities(queryEmbedding, sample);
    if (similarities.isEmpty() || similarities.size() < targetResults) {
      log.debug(
          "Adaptive threshold fallback for channel {}: {} samples < target {}",
          channelId,
          similarities.size(),
          targetResults);
      return fallback;
    }

    similarities.sort(Comparator.reverseOrder());
    int rank = Math.min(targetResults * 2, similarities.size() - 1);
    double threshold = Math.max(similarities.get(rank), fallback);
    log.debug("Adaptive threshold for channel {}: {}", channelId, threshold);
    return threshold;
  }

  static List<Double> querySimilarities(List<Float> query, List<List<Float>> sample) {
    List<Double> similarities = new ArrayList<>();
    if (sample == null) {
      return similarities;
    }
    for (List<Float> vector : sample) {
      if (vector != null && vector.size() == query.size()) {
        similarities.add(VectorMath.cosineSimilarity(query, vector));
      }
    }
    return similarities;
  }
}
