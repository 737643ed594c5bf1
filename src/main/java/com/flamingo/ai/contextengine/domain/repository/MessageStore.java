package com.flamingo.ai.contextengine.domain.repository;

import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.MessageHit;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import java.time.Instant;
import java.util.List;

/**
 * Read/write contract of the already-indexed message store.
 *
 * <p>Implementations throw {@link StoreQueryFailedException} when a query cannot be answered.
 */
public interface MessageStore {

  /**
   * Returns the newest messages of a channel.
   *
   * @param channelId the channel
   * @param hoursWindow only messages newer than this many hours
   * @param limit maximum number of messages
   * @return messages, newest first
   */
  List<Message> recentMessages(String channelId, int hoursWindow, int limit);

  /**
   * Returns the messages of a thread, including its root message.
   *
   * @return messages in chronological order
   */
  List<Message> messagesByThread(String channelId, String threadId, int limit);

  long countByChannel(String channelId);

  /**
   * Nearest neighbours of an embedding.
   *
   * @param embedding the query vector
   * @param channelId channel filter, or {@code null} for all channels
   * @param limit maximum number of hits
   * @param threshold minimum cosine similarity
   * @param since only messages newer than this instant, or {@code null}
   * @return hits ordered by similarity, scores are cosine similarities
   */
  List<MessageHit> vectorSimilar(
      List<Float> embedding, String channelId, int limit, double threshold, Instant since);

  /**
   * Full-text relevance query.
   *
   * @return hits ordered by relevance, scores are unnormalized text-relevance scores
   */
  List<MessageHit> keywordRelevant(String query, String channelId, int limit, Instant since);

  /** Draws a random sample of stored embeddings. */
  List<List<Float>> sampleEmbeddings(String channelId, int size);

  /**
   * Messages in a time range.
   *
   * @return messages in chronological order
   */
  List<Message> messagesBetween(String channelId, Instant from, Instant to, int limit);

  /** Messages that have no embedding attached yet and are not marked skipped, oldest first. */
  List<Message> messagesMissingEmbedding(int limit);

  /** Excludes a message that can never be embedded from {@link #messagesMissingEmbedding}. */
  void markEmbeddingSkipped(String messageId);

  void attachEmbedding(String messageId, List<Float> embedding);

  void save(List<Message> messages);
}
