package com.flamingo.ai.contextengine.service.search;

import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Diversity-aware reranking of search results.
 *
 * <p>Keeps a single chatty sender or a burst of near-identical messages from dominating the
 * relevant set.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiversityReranker {

  static final double NEAR_DUPLICATE_SIMILARITY = 0.8;

  private final MeterRegistry meterRegistry;

  public List<ScoredMessage> rerank(List<ScoredMessage> candidates, double diversityWeight) {
    return rerank(candidates, diversityWeight, Map.of());
  }

  /**
   * Greedily selects results.
   *
   * <p>Algorithm:
   *
   * <ol>
   *   <li>The relevance term of each remaining candidate is {@code (1 - w) * combined}
   *   <li>Candidates whose text has Jaccard word similarity above 0.8 to a selected message have
   *       the relevance term scaled by {@code 1 - penalty}, accumulating {@code (1 - w) *
   *       similarity} per match
   *   <li>Per-user boosts multiply the relevance term
   *   <li>{@code w * senderShare} is subtracted, where {@code senderShare} is the fraction of
   *       already selected results from the candidate's sender
   *   <li>The best candidate is selected and the process repeats
   * </ol>
   *
   * @param candidates search results, typically ordered by combined score
   * @param diversityWeight weight {@code w} of the diversity terms in [0, 1]
   * @param userBoosts optional score multipliers keyed by sender id
   * @return all candidates in selection order, with the adjusted score as combined score
   */
  public List<ScoredMessage> rerank(
      List<ScoredMessage> candidates, double diversityWeight, Map<String, Double> userBoosts) {
    if (candidates == null || candidates.isEmpty()) {
      return List.of();
    }

    double w = Math.max(0.0, Math.min(1.0, diversityWeight));
    List<ScoredMessage> remaining = new ArrayList<>(candidates);
    List<ScoredMessage> selected = new ArrayList<>(candidates.size());
    List<Set<String>> selectedTokens = new ArrayList<>(candidates.size());
    Map<String, Integer> perSender = new HashMap<>();

    while (!remaining.isEmpty()) {
      int bestIndex = -1;
      double bestScore = Double.NEGATIVE_INFINITY;

      for (int i = 0; i < remaining.size(); i++) {
        ScoredMessage candidate = remaining.get(i);
        double senderShare =
            selected.isEmpty()
                ? 0.0
                : perSender.getOrDefault(candidate.senderId(), 0) / (double) selected.size();
        Set<String> tokens = tokens(candidate.message().safeText());
        double penalty = 0.0;
        for (Set<String> other : selectedTokens) {
          double similarity = jaccard(tokens, other);
          if (similarity > NEAR_DUPLICATE_SIMILARITY) {
            penalty += (1 - w) * similarity;
          }
        }

        double relevance = (1 - w) * candidate.combinedScore() * Math.max(0.0, 1 - penalty);
        if (userBoosts != null && candidate.senderId() != null) {
          relevance *= userBoosts.getOrDefault(candidate.senderId(), 1.0);
        }
        double adjusted = relevance - w * senderShare;

        if (adjusted > bestScore) {
          bestScore = adjusted;
          bestIndex = i;
        }
      }

      ScoredMessage chosen = remaining.remove(bestIndex);
      selected.add(chosen.withCombinedScore(bestScore));
      selectedTokens.add(tokens(chosen.message().safeText()));
      perSender.merge(chosen.senderId(), 1, Integer::sum);
    }

    meterRegistry.counter("search.rerank.requests").increment();
    log.debug(
        "Diversity rerank: {} results from {} senders",
        selected.size(),
        calculateSenderDiversity(selected) * selected.size());
    return selected;
  }

  /** Unique senders divided by result count; 0.0 for an empty list. */
  public double calculateSenderDiversity(List<ScoredMessage> messages) {
    if (messages == null || messages.isEmpty()) {
      return 0.0;
    }
    long uniqueSenders = messages.stream().map(ScoredMessage::senderId).distinct().count();
    return (double) uniqueSenders / messages.size();
  }

  static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 1.0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    return (double) intersection.size() / union.size();
  }

  static Set<String> tokens(String text) {
    return Arrays.stream(text.toLowerCase(Locale.ROOT).split("\\s+"))
        .filter(t -> !t.isEmpty())
        .collect(Collectors.toSet());
  }
}
