package com.flamingo.ai.contextengine.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.MessageHit;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
@DisplayName("MessageIndexService Tests")
class MessageIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private SimpleMeterRegistry meterRegistry;
  private MessageIndexService messageIndexService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    messageIndexService = new MessageIndexService(elasticsearchClient, meterRegistry);
    ReflectionTestUtils.setField(messageIndexService, "indexName", "messages");
    ReflectionTestUtils.setField(messageIndexService, "vectorDimensions", 3);
  }

  @SuppressWarnings("unchecked")
  private SearchResponse<Map> responseWith(List<Hit<Map>> hits) {
    SearchResponse<Map> response = mock(SearchResponse.class);
    when(response.hits()).thenReturn(HitsMetadata.of(h -> h.hits(hits)));
    return response;
  }

  private Hit<Map> hit(String id, Map<String, Object> source, Double score) {
    return Hit.of(h -> h.index("messages").id(id).score(score).source(source));
  }

  @Nested
  @DisplayName("reads")
  class Reads {

    @Test
    @DisplayName("should map stored documents onto messages")
    void shouldMapDocuments() throws IOException {
      Map<String, Object> source =
          Map.of(
              "channelId", "C1",
              "senderId", "U1",
              "text", "deploy is done",
              "threadId", "T1",
              "timestamp", 1_700_000_000_000L,
              "embedding", List.of(0.1, 0.2, 0.3));
      SearchResponse<Map> response = responseWith(List.of(hit("m1", source, null)));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(response);

      List<Message> messages = messageIndexService.recentMessages("C1", 48, 20);

      assertThat(messages).hasSize(1);
      Message message = messages.get(0);
      assertThat(message.id()).isEqualTo("m1");
      assertThat(message.senderId()).isEqualTo("U1");
      assertThat(message.threadId()).isEqualTo("T1");
      assertThat(message.timestamp()).isEqualTo(Instant.ofEpochMilli(1_700_000_000_000L));
      assertThat(message.embedding()).containsExactly(0.1f, 0.2f, 0.3f);
      assertThat(meterRegistry.counter("message_store.recent").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should convert vector hit scores back to cosine similarity")
    void shouldConvertVectorScores() throws IOException {
      Map<String, Object> source = Map.of("channelId", "C1", "senderId", "U1", "text", "hi");
      SearchResponse<Map> response = responseWith(List.of(hit("m1", source, 0.9)));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(response);

      List<MessageHit> hits =
          messageIndexService.vectorSimilar(List.of(0.1f, 0.2f, 0.3f), "C1", 10, 0.3, null);

      assertThat(hits).hasSize(1);
      assertThat(hits.get(0).score()).isCloseTo(0.8, within(1e-9));
      assertThat(hits.get(0).message().embedding()).isNull();
    }

    @Test
    @DisplayName("should raise a store failure naming the operation")
    void shouldRaiseStoreFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      assertThatThrownBy(() -> messageIndexService.recentMessages("C1", 48, 20))
          .isInstanceOf(StoreQueryFailedException.class)
          .satisfies(
              e ->
                  assertThat(((StoreQueryFailedException) e).getOperation())
                      .isEqualTo("recentMessages"));
    }

    @Test
    @DisplayName("should leave messages marked skipped out of the missing-embedding batch")
    void shouldExcludeSkippedFromMissingEmbeddings() throws IOException {
      SearchResponse<Map> response = responseWith(List.of());
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(response);

      messageIndexService.messagesMissingEmbedding(25);

      ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient).search(captor.capture(), eq(Map.class));
      SearchRequest request = captor.getValue();
      assertThat(request.size()).isEqualTo(25);
      List<Query> excluded = request.query().bool().mustNot();
      assertThat(excluded).hasSize(2);
      assertThat(excluded.get(0).exists().field()).isEqualTo("embedding");
      assertThat(excluded.get(1).term().field()).isEqualTo("embeddingSkipped");
      assertThat(excluded.get(1).term().value().booleanValue()).isTrue();
    }

    @Test
    @DisplayName("should map Elasticsearch cosine scores onto [-1, 1]")
    void shouldMapCosineScores() {
      assertThat(MessageIndexService.toCosine(1.0)).isEqualTo(1.0);
      assertThat(MessageIndexService.toCosine(0.5)).isEqualTo(0.0);
      assertThat(MessageIndexService.toCosine(null)).isEqualTo(0.0);
    }
  }

  @Nested
  @DisplayName("writes")
  class Writes {

    @Test
    @DisplayName("should skip indexing an empty batch")
    void shouldSkipEmptyBatch() {
      messageIndexService.save(List.of());

      verifyNoInteractions(elasticsearchClient);
    }

    @Test
    @DisplayName("should flag a message as skipped with a partial update")
    @SuppressWarnings("unchecked")
    void shouldMarkEmbeddingSkipped() throws IOException {
      messageIndexService.markEmbeddingSkipped("m1");

      ArgumentCaptor<UpdateRequest> captor = ArgumentCaptor.forClass(UpdateRequest.class);
      verify(elasticsearchClient).update(captor.capture(), eq(Map.class));
      UpdateRequest<Map, Map<String, Object>> request = captor.getValue();
      assertThat(request.id()).isEqualTo("m1");
      assertThat(request.index()).isEqualTo("messages");
      assertThat(request.doc()).containsEntry("embeddingSkipped", true);
      assertThat(meterRegistry.counter("message_store.embedding_skipped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should raise a store failure when the skip flag cannot be written")
    void shouldRaiseWhenSkipFlagFails() throws IOException {
      when(elasticsearchClient.update(any(UpdateRequest.class), eq(Map.class)))
          .thenThrow(new IOException("down"));

      assertThatThrownBy(() -> messageIndexService.markEmbeddingSkipped("m1"))
          .isInstanceOf(StoreQueryFailedException.class)
          .hasMessage("Marking embedding as skipped failed");
    }

    @Test
    @DisplayName("should raise a store failure when bulk indexing fails")
    void shouldRaiseOnBulkFailure() throws IOException {
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenThrow(new IOException("down"));
      Message message =
          Message.builder()
              .id("m1")
              .channelId("C1")
              .senderId("U1")
              .text("hi")
              .timestamp(Instant.EPOCH)
              .build();

      assertThatThrownBy(() -> messageIndexService.save(List.of(message)))
          .isInstanceOf(StoreQueryFailedException.class)
          .hasMessage("Failed to index messages");
      verify(elasticsearchClient).bulk(any(BulkRequest.class));
    }
  }

  @Test
  @DisplayName("should skip index initialization without an indices client")
  void shouldSkipInitWithoutIndicesClient() {
    messageIndexService.initIndex();

    verify(elasticsearchClient).indices();
  }
}
