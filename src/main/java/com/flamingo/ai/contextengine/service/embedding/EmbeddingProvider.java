package com.flamingo.ai.contextengine.service.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Thin adapter over the OpenAI embedding model.
 *
 * <p>Calls run inside the {@code openai-embedding} retry, circuit breaker and bulkhead. Failures
 * are translated before they leave the method so that client errors are not retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EmbeddingProvider {

  static final int MAX_INPUT_CHARS = 8000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai-embedding", fallbackMethod = "embedFallback")
  @Retry(name = "openai-embedding")
  @Bulkhead(name = "openai-embedding")
  public EmbeddingResult embed(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text));
      meterRegistry.counter("embedding.requests.success").increment();
      return new EmbeddingResult(toList(response.content().vector()), inputTokens(response));
    } catch (RuntimeException e) {
      throw ProviderErrorTranslator.translate("embedding", e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** Embeds several texts in one provider call; results keep the input order. */
  @CircuitBreaker(name = "openai-embedding", fallbackMethod = "embedAllFallback")
  @Retry(name = "openai-embedding")
  @Bulkhead(name = "openai-embedding")
  public List<EmbeddingResult> embedAll(List<String> texts) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = texts.stream().map(t -> TextSegment.from(truncate(t))).toList();
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<Embedding> embeddings = response.content();
      int totalTokens = inputTokens(response);

      List<EmbeddingResult> results = new ArrayList<>(embeddings.size());
      for (int i = 0; i < embeddings.size(); i++) {
        // Billing is per batch; spread it over the items so the rollup stays additive.
        int share = totalTokens / embeddings.size() + (i < totalTokens % embeddings.size() ? 1 : 0);
        results.add(new EmbeddingResult(toList(embeddings.get(i).vector()), share));
      }
      meterRegistry.counter("embedding.batch.requests.success").increment();
      return results;
    } catch (RuntimeException e) {
      throw ProviderErrorTranslator.translate("embedding batch", e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  @SuppressWarnings("unused")
  private EmbeddingResult embedFallback(String text, Throwable t) {
    meterRegistry.counter("embedding.requests.failure").increment();
    throw ProviderErrorTranslator.translate("embedding", t);
  }

  @SuppressWarnings("unused")
  private List<EmbeddingResult> embedAllFallback(List<String> texts, Throwable t) {
    meterRegistry.counter("embedding.batch.requests.failure").increment();
    throw ProviderErrorTranslator.translate("embedding batch", t);
  }

  private String truncate(String text) {
    String safe = text == null ? "" : text;
    if (safe.length() > MAX_INPUT_CHARS) {
      log.debug("Truncating embedding input from {} to {} chars", safe.length(), MAX_INPUT_CHARS);
      return safe.substring(0, MAX_INPUT_CHARS);
    }
    return safe;
  }

  private static int inputTokens(Response<?> response) {
    TokenUsage usage = response.tokenUsage();
    if (usage == null || usage.inputTokenCount() == null) {
      return 0;
    }
    return usage.inputTokenCount();
  }

  private static List<Float> toList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
