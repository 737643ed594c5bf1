package com.flamingo.ai.contextengine.domain.model;

/**
 * A message with the relevance breakdown produced by a single search call. Never persisted.
 *
 * @param message the underlying message
 * @param semanticScore cosine similarity between query and message embeddings, 0 if unknown
 * @param keywordScore normalized full-text relevance in [0, 1], 0 if not matched
 * @param recencyWeight temporal decay factor in (0, 1]
 * @param combinedScore fused score used for ordering
 */
public record ScoredMessage(
    Message message,
    double semanticScore,
    double keywordScore,
    double recencyWeight,
    double combinedScore) {

  public String id() {
    return message.id();
  }

  public String senderId() {
    return message.senderId();
  }

  public ScoredMessage withCombinedScore(double score) {
    return new ScoredMessage(message, semanticScore, keywordScore, recencyWeight, score);
  }
}
