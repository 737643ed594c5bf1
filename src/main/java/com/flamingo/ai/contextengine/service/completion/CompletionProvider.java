package com.flamingo.ai.contextengine.service.completion;

import com.flamingo.ai.contextengine.service.embedding.ProviderErrorTranslator;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Chat completion adapter guarded by the {@code openai-completion} resilience instances. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompletionProvider {

  private final ChatModel chatModel;
  private final MeterRegistry meterRegistry;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-3.5-turbo}")
  private String defaultModel;

  @CircuitBreaker(name = "openai-completion", fallbackMethod = "completeFallback")
  @Retry(name = "openai-completion")
  @Bulkhead(name = "openai-completion")
  public CompletionResult complete(List<ChatMessage> messages, CompletionOptions options) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      ChatRequest request =
          ChatRequest.builder()
              .messages(messages)
              .modelName(requestedModel(options))
              .temperature(options.temperature())
              .maxOutputTokens(options.maxTokens())
              .build();

      ChatResponse response = chatModel.chat(request);
      meterRegistry.counter("completion.requests.success").increment();

      TokenUsage usage = response.tokenUsage();
      int promptTokens =
          usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
      int completionTokens =
          usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
      // Price by the requested id; the provider may answer with a dated snapshot name.
      String model = requestedModel(options);
      log.debug(
          "Completion from {}: {} prompt / {} completion tokens",
          model,
          promptTokens,
          completionTokens);
      return new CompletionResult(
          response.aiMessage().text(), promptTokens, completionTokens, model);
    } catch (RuntimeException e) {
      throw ProviderErrorTranslator.translate("completion", e);
    } finally {
      sample.stop(meterRegistry.timer("completion.duration"));
    }
  }

  private String requestedModel(CompletionOptions options) {
    return options.model() != null && !options.model().isBlank() ? options.model() : defaultModel;
  }

  @SuppressWarnings("unused")
  private CompletionResult completeFallback(
      List<ChatMessage> messages, CompletionOptions options, Throwable t) {
    meterRegistry.counter("completion.requests.failure").increment();
    throw ProviderErrorTranslator.translate("completion", t);
  }
}
