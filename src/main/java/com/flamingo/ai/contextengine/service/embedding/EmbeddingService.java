package com.flamingo.ai.contextengine.service.embedding;

import com.flamingo.ai.contextengine.domain.model.UsageRecord;
import com.flamingo.ai.contextengine.service.cache.VectorCache;
import com.flamingo.ai.contextengine.service.usage.UsageTracker;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Text embeddings with a cache-then-provider lookup.
 *
 * <p>A failed provider call yields an empty vector so that callers can degrade (hybrid search
 * falls back to keyword-only).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private static final int KEY_HEX_LENGTH = 16;

  private final VectorCache vectorCache;
  private final EmbeddingProvider embeddingProvider;
  private final UsageTracker usageTracker;
  private final MeterRegistry meterRegistry;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }

    String key = cacheKey(text);
    List<Float> cached = vectorCache.get(key);
    if (cached != null) {
      return cached;
    }

    try {
      EmbeddingResult result = embeddingProvider.embed(text);
      vectorCache.set(key, result.vector());
      track(result.tokens(), "embed");
      return result.vector();
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.degraded").increment();
      log.warn("Embedding unavailable, continuing without vector: {}", e.getMessage());
      return List.of();
    }
  }

  /**
   * Embeds a batch. Cache hits are served locally; only the misses reach the provider, in one
   * call. Entries that could not be embedded come back as empty lists.
   */
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      return List.of();
    }

    List<String> keys = texts.stream().map(t -> t == null ? "" : cacheKey(t)).toList();
    List<List<Float>> cached = vectorCache.mget(keys);
    List<List<Float>> results = new ArrayList<>(Collections.nCopies(texts.size(), List.of()));

    List<Integer> missingIndexes = new ArrayList<>();
    List<String> missingTexts = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      List<Float> hit = i < cached.size() ? cached.get(i) : null;
      if (hit != null) {
        results.set(i, hit);
      } else if (texts.get(i) != null && !texts.get(i).isBlank()) {
        missingIndexes.add(i);
        missingTexts.add(texts.get(i));
      }
    }

    if (missingTexts.isEmpty()) {
      return results;
    }

    try {
      List<EmbeddingResult> embedded = embeddingProvider.embedAll(missingTexts);
      Map<String, List<Float>> toCache = new LinkedHashMap<>();
      int tokens = 0;
      for (int j = 0; j < embedded.size() && j < missingIndexes.size(); j++) {
        int index = missingIndexes.get(j);
        List<Float> vector = embedded.get(j).vector();
        results.set(index, vector);
        toCache.put(keys.get(index), vector);
        tokens += embedded.get(j).tokens();
      }
      vectorCache.mset(toCache);
      track(tokens, "embedAll");
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.degraded").increment();
      log.warn("Batch embedding unavailable for {} texts: {}", missingTexts.size(), e.getMessage());
    }
    return results;
  }

  /** Cache key: sha256 of the case-folded, whitespace-collapsed text, first 16 hex chars. */
  public static String cacheKey(String text) {
    String normalized = text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(normalized.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, KEY_HEX_LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private void track(int tokens, String operation) {
    usageTracker.trackUsage(
        UsageRecord.builder()
            .model(embeddingModelName)
            .promptTokens(tokens)
            .completionTokens(0)
            .operation(operation)
            .timestamp(Instant.now())
            .build());
  }
}
