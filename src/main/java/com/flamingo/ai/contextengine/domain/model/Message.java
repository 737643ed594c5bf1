package com.flamingo.ai.contextengine.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * A chat message as read from the message store.
 *
 * <p>Messages are immutable once persisted. The embedding is attached asynchronously after the
 * message is created and may be {@code null}.
 */
@Builder(toBuilder = true)
public record Message(
    String id,
    String channelId,
    String senderId,
    String text,
    Instant timestamp,
    String threadId,
    List<Float> embedding) {

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }

  public boolean isInThread() {
    return threadId != null && !threadId.isBlank();
  }

  /** Age of the message in fractional hours relative to {@code now}; never negative. */
  public double ageHours(Instant now) {
    if (timestamp == null) {
      return 0.0;
    }
    long millis = Duration.between(timestamp, now).toMillis();
    return Math.max(0, millis) / 3_600_000.0;
  }

  public String safeText() {
    return text != null ? text : "";
  }
}
