package com.flamingo.ai.contextengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import com.flamingo.ai.contextengine.exception.ProviderUnavailableException;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import com.flamingo.ai.contextengine.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmbeddingBackfillStartupBeanTest {

  private static final List<Float> VECTOR = List.of(0.1f, 0.2f, 0.3f);

  @Mock private MessageStore messageStore;
  @Mock private EmbeddingService embeddingService;

  private ContextEngineConfig config;
  private SimpleMeterRegistry meterRegistry;
  private EmbeddingBackfillStartupBean backfillBean;

  @BeforeEach
  void setUp() {
    config = new ContextEngineConfig();
    meterRegistry = new SimpleMeterRegistry();
    backfillBean =
        new EmbeddingBackfillStartupBean(messageStore, embeddingService, config, meterRegistry);
  }

  private static Message message(String id, String text) {
    return Message.builder().id(id).channelId("C1").senderId("U1").text(text).build();
  }

  @Test
  @DisplayName("should attach embeddings to pending messages and skip the ones that fail")
  void shouldBackfillBatch() {
    when(messageStore.messagesMissingEmbedding(50))
        .thenReturn(List.of(message("m1", "one"), message("m2", null), message("m3", "three")));
    when(embeddingService.embedAll(List.of("one", "three"))).thenReturn(List.of(VECTOR, VECTOR));
    lenient()
        .doThrow(new StoreQueryFailedException("attachEmbedding", "version conflict"))
        .when(messageStore)
        .attachEmbedding("m3", VECTOR);

    int attached = backfillBean.backfill();

    assertThat(attached).isEqualTo(1);
    verify(messageStore).attachEmbedding("m1", VECTOR);
    verify(messageStore).markEmbeddingSkipped("m2");
    verify(messageStore, never()).attachEmbedding(eq("m2"), anyList());
    assertThat(meterRegistry.counter("backfill.embedded").count()).isEqualTo(1.0);
    assertThat(meterRegistry.counter("backfill.skipped").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should skip a message the provider returns no vector for")
  void shouldSkipMessageWithoutVector() {
    when(messageStore.messagesMissingEmbedding(50))
        .thenReturn(List.of(message("m1", "one"), message("m2", "two")));
    when(embeddingService.embedAll(List.of("one", "two"))).thenReturn(List.of(VECTOR, List.of()));

    assertThat(backfillBean.backfill()).isEqualTo(1);
    verify(messageStore, never()).attachEmbedding(eq("m2"), anyList());
    verify(messageStore, never()).markEmbeddingSkipped(anyString());
    assertThat(meterRegistry.counter("backfill.skipped").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should get past a full batch of blank messages on the next run")
  void shouldGetPastBlankBatch() {
    config.getBackfill().setBatchSize(2);
    when(messageStore.messagesMissingEmbedding(2))
        .thenReturn(List.of(message("b1", " "), message("b2", null)))
        .thenReturn(List.of(message("m1", "deploy done"), message("m2", "tests green")));
    when(embeddingService.embedAll(List.of("deploy done", "tests green")))
        .thenReturn(List.of(VECTOR, VECTOR));

    assertThat(backfillBean.backfill()).isZero();
    verify(messageStore).markEmbeddingSkipped("b1");
    verify(messageStore).markEmbeddingSkipped("b2");
    verify(embeddingService, never()).embedAll(anyList());

    assertThat(backfillBean.backfill()).isEqualTo(2);
    verify(messageStore).attachEmbedding("m1", VECTOR);
    verify(messageStore).attachEmbedding("m2", VECTOR);
    assertThat(meterRegistry.counter("backfill.blank").count()).isEqualTo(2.0);
  }

  @Test
  @DisplayName("should stop early when nothing is pending")
  void shouldStopWhenNothingPending() {
    when(messageStore.messagesMissingEmbedding(50)).thenReturn(List.of());

    assertThat(backfillBean.backfill()).isZero();
    verifyNoInteractions(embeddingService);
  }

  @Test
  @DisplayName("should do nothing when disabled")
  void shouldDoNothingWhenDisabled() {
    config.getBackfill().setEnabled(false);

    backfillBean.run();

    verifyNoInteractions(messageStore, embeddingService);
  }

  @Test
  @DisplayName("should count a failed batch without throwing")
  void shouldCountFailedBatch() {
    when(messageStore.messagesMissingEmbedding(50)).thenReturn(List.of(message("m1", "one")));
    when(embeddingService.embedAll(anyList()))
        .thenThrow(new ProviderUnavailableException("embedding failed", null));

    assertThat(backfillBean.backfill()).isZero();
    assertThat(meterRegistry.counter("backfill.errors").count()).isEqualTo(1.0);
    verify(messageStore, never()).attachEmbedding(anyString(), anyList());
  }
}
