package com.flamingo.ai.contextengine.config;

import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import com.flamingo.ai.contextengine.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Attaches embeddings to stored messages that do not have one yet.
 *
 * <p>Runs once on application startup and then on a fixed delay. Each run processes one batch:
 *
 * <ul>
 *   <li>fetches the oldest messages without an embedding
 *   <li>embeds them through the cache-then-provider path
 *   <li>writes each vector back to the message store
 * </ul>
 *
 * <p>Messages without text are marked skipped so they never hold up later batches. A message
 * that cannot be embedded or written is logged and picked up again by a later run.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingBackfillStartupBean implements CommandLineRunner {

  private final MessageStore messageStore;
  private final EmbeddingService embeddingService;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  public void run(String... args) {
    backfill();
  }

  @Scheduled(
      fixedDelayString = "${context-engine.backfill.interval:PT10M}",
      initialDelayString = "${context-engine.backfill.interval:PT10M}")
  public void scheduledBackfill() {
    backfill();
  }

  /**
   * Embeds one batch of messages.
   *
   * @return the number of messages that received an embedding
   */
  public int backfill() {
    if (!config.getBackfill().isEnabled()) {
      return 0;
    }
    try {
      List<Message> pending =
          messageStore.messagesMissingEmbedding(config.getBackfill().getBatchSize());
      if (pending.isEmpty()) {
        log.debug("No messages without embeddings, skipping backfill");
        return 0;
      }

      log.info("Found {} messages without embeddings, starting backfill", pending.size());
      List<Message> embeddable = new ArrayList<>(pending.size());
      for (Message message : pending) {
        if (message.safeText().isBlank()) {
          skip(message);
        } else {
          embeddable.add(message);
        }
      }
      if (embeddable.isEmpty()) {
        return 0;
      }

      List<List<Float>> vectors =
          embeddingService.embedAll(embeddable.stream().map(Message::safeText).toList());

      int attached = 0;
      for (int i = 0; i < embeddable.size(); i++) {
        Message message = embeddable.get(i);
        List<Float> vector = i < vectors.size() ? vectors.get(i) : null;
        if (vector == null || vector.isEmpty()) {
          log.warn("No embedding produced for message {}", message.id());
          meterRegistry.counter("backfill.skipped").increment();
          continue;
        }
        try {
          messageStore.attachEmbedding(message.id(), vector);
          attached++;
        } catch (RuntimeException e) {
          log.warn("Failed to attach embedding to message {}: {}", message.id(), e.getMessage());
          meterRegistry.counter("backfill.skipped").increment();
        }
      }

      meterRegistry.counter("backfill.embedded").increment(attached);
      log.info("Embedding backfill complete: {}/{} messages embedded", attached, pending.size());
      return attached;
    } catch (RuntimeException e) {
      log.error("Embedding backfill failed: {}", e.getMessage(), e);
      meterRegistry.counter("backfill.errors").increment();
      return 0;
    }
  }

  private void skip(Message message) {
    try {
      messageStore.markEmbeddingSkipped(message.id());
      meterRegistry.counter("backfill.blank").increment();
    } catch (RuntimeException e) {
      log.warn("Failed to mark message {} as skipped: {}", message.id(), e.getMessage());
      meterRegistry.counter("backfill.skipped").increment();
    }
  }
}
