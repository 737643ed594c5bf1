package com.flamingo.ai.contextengine.service.context;

import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Scores how useful an assembled context is likely to be, in [0, 1].
 *
 * <p>Signals and weights: recency coverage 0.3, mean relevance 0.4, sender diversity 0.1, thread
 * presence 0.1, profile presence 0.1. Only signals that are present count, and the result is
 * divided by the sum of their weights.
 */
@Component
public class ContextQualityScorer {

  static final double RECENCY_WEIGHT = 0.3;
  static final double RELEVANCE_WEIGHT = 0.4;
  static final double DIVERSITY_WEIGHT = 0.1;
  static final double THREAD_WEIGHT = 0.1;
  static final double PROFILE_WEIGHT = 0.1;

  public double score(
      List<Message> recent,
      List<ScoredMessage> relevant,
      List<Message> thread,
      Map<String, UserProfile> profiles) {
    double score = 0.0;
    double weights = 0.0;

    if (recent != null && !recent.isEmpty()) {
      score += Math.min(recent.size() / 10.0, 1.0) * RECENCY_WEIGHT;
      weights += RECENCY_WEIGHT;
    }

    if (relevant != null && !relevant.isEmpty()) {
      double mean =
          relevant.stream().mapToDouble(ScoredMessage::combinedScore).average().orElse(0.0);
      score += clamp(mean) * RELEVANCE_WEIGHT;
      weights += RELEVANCE_WEIGHT;

      if (relevant.size() > 1) {
        long senders = relevant.stream().map(ScoredMessage::senderId).distinct().count();
        score += (double) senders / relevant.size() * DIVERSITY_WEIGHT;
        weights += DIVERSITY_WEIGHT;
      }
    }

    if (thread != null && !thread.isEmpty()) {
      score += THREAD_WEIGHT;
      weights += THREAD_WEIGHT;
    }

    if (profiles != null && !profiles.isEmpty()) {
      score += PROFILE_WEIGHT;
      weights += PROFILE_WEIGHT;
    }

    return weights > 0 ? clamp(score / weights) : 0.0;
  }

  private static double clamp(double value) {
    return Math.max(0.0, Math.min(1.0, value));
  }
}
