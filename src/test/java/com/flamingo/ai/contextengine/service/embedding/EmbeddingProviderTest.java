package com.flamingo.ai.contextengine.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextengine.exception.ProviderClientException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingProviderTest {

  @Mock private EmbeddingModel embeddingModel;

  private SimpleMeterRegistry meterRegistry;
  private EmbeddingProvider embeddingProvider;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    embeddingProvider = new EmbeddingProvider(embeddingModel, meterRegistry);
  }

  @Test
  @DisplayName("should return the vector and billed tokens")
  void shouldReturnVectorAndTokens() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(
            Response.from(Embedding.from(new float[] {0.1f, 0.2f}), new TokenUsage(7, 0)));

    EmbeddingResult result = embeddingProvider.embed("hello");

    assertThat(result.vector()).containsExactly(0.1f, 0.2f);
    assertThat(result.tokens()).isEqualTo(7);
    assertThat(meterRegistry.counter("embedding.requests.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should truncate input to the provider limit")
  void shouldTruncateInput() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));

    embeddingProvider.embed("x".repeat(EmbeddingProvider.MAX_INPUT_CHARS + 500));

    ArgumentCaptor<String> captor = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(captor.capture());
    assertThat(captor.getValue()).hasSize(EmbeddingProvider.MAX_INPUT_CHARS);
  }

  @Test
  @DisplayName("should spread batch tokens over the items in input order")
  void shouldSpreadBatchTokens() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {1f}),
                    Embedding.from(new float[] {2f}),
                    Embedding.from(new float[] {3f})),
                new TokenUsage(10, 0)));

    List<EmbeddingResult> results = embeddingProvider.embedAll(List.of("a", "b", "c"));

    assertThat(results).extracting(r -> r.vector().get(0)).containsExactly(1f, 2f, 3f);
    assertThat(results).extracting(EmbeddingResult::tokens).containsExactly(4, 3, 3);
  }

  @Test
  @DisplayName("should translate client errors so they are not retried")
  void shouldTranslateClientErrors() {
    when(embeddingModel.embedAll(anyList()))
        .thenThrow(new InvalidRequestException("input too long"));

    assertThatThrownBy(() -> embeddingProvider.embedAll(List.of("a")))
        .isInstanceOf(ProviderClientException.class);
    verify(embeddingModel).embedAll(anyList());
  }
}
