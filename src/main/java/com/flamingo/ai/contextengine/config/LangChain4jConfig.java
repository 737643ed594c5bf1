package com.flamingo.ai.contextengine.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LangChain4j models.
 *
 * <p>Client-side retries are disabled; retry, circuit breaking and concurrency limits are applied
 * by Resilience4j around the provider adapters. The embedding size must match the dense vector
 * mapping of the message index; a mismatch fails startup.
 */
@Configuration
public class LangChain4jConfig {

  /** Largest output size each embedding model accepts for {@code dimensions}. */
  static final Map<String, Integer> MAX_EMBEDDING_DIMENSIONS =
      Map.of("text-embedding-3-small", 1536, "text-embedding-3-large", 3072);

  /** Models with a fixed output size that reject the {@code dimensions} parameter. */
  static final Map<String, Integer> FIXED_EMBEDDING_DIMENSIONS =
      Map.of("text-embedding-ada-002", 1536);

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-3.5-turbo}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:400}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:60s}")
  private Duration chatTimeout;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Value("${langchain4j.openai.embedding-model.timeout:30s}")
  private Duration embeddingTimeout;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int indexDimensions;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(chatTimeout)
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();
    Integer dimensions =
        requestedDimensions(embeddingModelName, embeddingDimensions, indexDimensions);

    return OpenAiEmbeddingModel.builder()
        .baseUrl(baseUrl)
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(dimensions)
        .timeout(embeddingTimeout)
        .maxRetries(0)
        .build();
  }

  /**
   * Resolves the {@code dimensions} value to send for an embedding model.
   *
   * @return the size to request, or {@code null} for models with a fixed size
   * @throws IllegalStateException if the size is out of range for the model or differs from the
   *     index mapping
   */
  static Integer requestedDimensions(String modelName, int dimensions, int indexDimensions) {
    if (dimensions != indexDimensions) {
      throw new IllegalStateException(
          "Embedding dimensions "
              + dimensions
              + " do not match the message index vector size "
              + indexDimensions);
    }
    Integer fixed = FIXED_EMBEDDING_DIMENSIONS.get(modelName);
    if (fixed != null) {
      if (fixed != dimensions) {
        throw new IllegalStateException(
            modelName + " always returns " + fixed + " dimensions, configured " + dimensions);
      }
      return null;
    }
    Integer max = MAX_EMBEDDING_DIMENSIONS.get(modelName);
    if (dimensions <= 0 || (max != null && dimensions > max)) {
      throw new IllegalStateException(
          modelName + " cannot return " + dimensions + " dimensions (max " + max + ")");
    }
    return dimensions;
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
