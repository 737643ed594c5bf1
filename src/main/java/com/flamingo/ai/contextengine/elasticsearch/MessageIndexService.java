package com.flamingo.ai.contextengine.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.UpdateRequest;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.MessageHit;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed message store.
 *
 * <p>Messages live in a single index with a keyword channel/sender/thread filter, a full-text
 * {@code text} field and a cosine {@code dense_vector} embedding. Search methods degrade to empty
 * results through the circuit breaker fallbacks; listing methods raise {@link
 * StoreQueryFailedException} so callers can isolate the failing section.
 */
@Service
@Slf4j
public class MessageIndexService implements MessageStore {

  private static final String EMBEDDING_FIELD = "embedding";
  private static final String EMBEDDING_SKIPPED_FIELD = "embeddingSkipped";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;

  @Value("${app.elasticsearch.message-index-name:context-engine-messages}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  public MessageIndexService(ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @PostConstruct
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn("Elasticsearch client not available, skipping message index initialization");
        return;
      }
      boolean exists = indices.exists(e -> e.index(indexName)).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch message index: {}", indexName);
      }
    } catch (Exception e) {
      log.warn("Could not check/create Elasticsearch message index: {}", e.getMessage());
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = new HashMap<>();
    properties.put("channelId", Property.of(p -> p.keyword(k -> k)));
    properties.put("senderId", Property.of(p -> p.keyword(k -> k)));
    properties.put("threadId", Property.of(p -> p.keyword(k -> k)));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("timestamp", Property.of(p -> p.long_(l -> l)));
    properties.put(EMBEDDING_SKIPPED_FIELD, Property.of(p -> p.boolean_(b -> b)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));

    CreateIndexRequest createIndexRequest =
        CreateIndexRequest.of(c -> c.index(indexName).mappings(m -> m.properties(properties)));

    elasticsearchClient.indices().create(createIndexRequest);
  }

  @Override
  @Timed(value = "message_store.recent", description = "Time to fetch recent messages")
  @CircuitBreaker(name = "elasticsearch")
  public List<Message> recentMessages(String channelId, int hoursWindow, int limit) {
    Instant since = Instant.now().minus(hoursWindow, ChronoUnit.HOURS);
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(q -> q.bool(b -> channelAndWindow(b, channelId, since)))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Desc))));
      List<Message> results = toMessages(elasticsearchClient.search(request, Map.class));
      meterRegistry.counter("message_store.recent").increment();
      return results;
    } catch (Exception e) {
      log.error("Recent message query failed for channel {}: {}", channelId, e.getMessage());
      throw new StoreQueryFailedException("recentMessages", "Recent message query failed", e);
    }
  }

  @Override
  @Timed(value = "message_store.thread", description = "Time to fetch thread messages")
  @CircuitBreaker(name = "elasticsearch")
  public List<Message> messagesByThread(String channelId, String threadId, int limit) {
    try {
      // The root message carries its own id as thread reference or none at all
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.filter(f -> f.term(t -> t.field("channelId").value(channelId)))
                                          .should(
                                              sh -> sh.term(t -> t.field("threadId").value(threadId)))
                                          .should(sh -> sh.ids(i -> i.values(threadId)))
                                          .minimumShouldMatch("1")))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Asc))));
      List<Message> results = toMessages(elasticsearchClient.search(request, Map.class));
      meterRegistry.counter("message_store.thread").increment();
      return results;
    } catch (Exception e) {
      log.error("Thread query failed for {}/{}: {}", channelId, threadId, e.getMessage());
      throw new StoreQueryFailedException("messagesByThread", "Thread query failed", e);
    }
  }

  @Override
  public long countByChannel(String channelId) {
    try {
      return elasticsearchClient
          .count(c -> c.index(indexName).query(q -> q.term(t -> t.field("channelId").value(channelId))))
          .count();
    } catch (Exception e) {
      log.error("Count failed for channel {}: {}", channelId, e.getMessage());
      throw new StoreQueryFailedException("countByChannel", "Message count failed", e);
    }
  }

  @Override
  @Timed(value = "message_store.vector_search", description = "Time to vector search messages")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSimilarFallback")
  public List<MessageHit> vectorSimilar(
      List<Float> embedding, String channelId, int limit, double threshold, Instant since) {
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .knn(
                          k ->
                              k.field(EMBEDDING_FIELD)
                                  .queryVector(embedding)
                                  .k(limit)
                                  .numCandidates(Math.max(limit * 2, 50))
                                  .similarity((float) threshold)
                                  .filter(f -> f.bool(b -> channelAndWindow(b, channelId, since))))
                      .size(limit));

      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<MessageHit> hits = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Message message = toMessage(hit);
        if (message != null) {
          hits.add(new MessageHit(message, toCosine(hit.score())));
        }
      }
      meterRegistry.counter("message_store.vector_search").increment();
      return hits;
    } catch (Exception e) {
      log.error("Vector search failed for messages: {}", e.getMessage(), e);
      throw new StoreQueryFailedException("vectorSimilar", "Vector search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<MessageHit> vectorSimilarFallback(
      List<Float> embedding,
      String channelId,
      int limit,
      double threshold,
      Instant since,
      Throwable t) {
    log.warn("Message vector search fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_store.vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "message_store.keyword_search", description = "Time to keyword search messages")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordRelevantFallback")
  public List<MessageHit> keywordRelevant(
      String query, String channelId, int limit, Instant since) {
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      channelAndWindow(b, channelId, since)
                                          .must(m -> m.match(mt -> mt.field("text").query(query))))));

      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<MessageHit> hits = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        Message message = toMessage(hit);
        if (message != null) {
          hits.add(new MessageHit(message, hit.score() != null ? hit.score() : 0.0));
        }
      }
      meterRegistry.counter("message_store.keyword_search").increment();
      return hits;
    } catch (Exception e) {
      log.error("Keyword search failed for messages: {}", e.getMessage(), e);
      throw new StoreQueryFailedException("keywordRelevant", "Keyword search failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<MessageHit> keywordRelevantFallback(
      String query, String channelId, int limit, Instant since, Throwable t) {
    log.warn("Message keyword search fallback triggered: {}", t.getMessage());
    meterRegistry.counter("message_store.keyword_search.fallback").increment();
    return List.of();
  }

  @Override
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "sampleEmbeddingsFallback")
  public List<List<Float>> sampleEmbeddings(String channelId, int size) {
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(size)
                      .source(src -> src.filter(f -> f.includes(EMBEDDING_FIELD)))
                      .query(
                          q ->
                              q.functionScore(
                                  fs ->
                                      fs.query(
                                              inner ->
                                                  inner.bool(
                                                      b ->
                                                          channelAndWindow(b, channelId, null)
                                                              .filter(
                                                                  f ->
                                                                      f.exists(
                                                                          ex ->
                                                                              ex.field(
                                                                                  EMBEDDING_FIELD)))))
                                          .functions(fn -> fn.randomScore(rs -> rs)))));

      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<List<Float>> vectors = new ArrayList<>();
      for (Hit<Map> hit : response.hits().hits()) {
        List<Float> vector = readEmbedding(hit.source());
        if (vector != null) {
          vectors.add(vector);
        }
      }
      return vectors;
    } catch (Exception e) {
      log.error("Embedding sample failed: {}", e.getMessage());
      throw new StoreQueryFailedException("sampleEmbeddings", "Embedding sample failed", e);
    }
  }

  @SuppressWarnings("unused")
  private List<List<Float>> sampleEmbeddingsFallback(String channelId, int size, Throwable t) {
    log.warn("Embedding sample fallback triggered: {}", t.getMessage());
    return List.of();
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  public List<Message> messagesBetween(String channelId, Instant from, Instant to, int limit) {
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      channelAndWindow(b, channelId, from)
                                          .filter(
                                              f ->
                                                  f.range(
                                                      r ->
                                                          r.number(
                                                              n ->
                                                                  n.field("timestamp")
                                                                      .lte(
                                                                          (double)
                                                                              to.toEpochMilli()))))))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Asc))));
      return toMessages(elasticsearchClient.search(request, Map.class));
    } catch (Exception e) {
      log.error("Range query failed for channel {}: {}", channelId, e.getMessage());
      throw new StoreQueryFailedException("messagesBetween", "Range query failed", e);
    }
  }

  @Override
  public List<Message> messagesMissingEmbedding(int limit) {
    try {
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .size(limit)
                      .query(
                          q ->
                              q.bool(
                                  b ->
                                      b.mustNot(m -> m.exists(e -> e.field(EMBEDDING_FIELD)))
                                          .mustNot(
                                              m ->
                                                  m.term(
                                                      t ->
                                                          t.field(EMBEDDING_SKIPPED_FIELD)
                                                              .value(true)))))
                      .sort(so -> so.field(f -> f.field("timestamp").order(SortOrder.Asc))));
      return toMessages(elasticsearchClient.search(request, Map.class));
    } catch (Exception e) {
      log.error("Missing-embedding query failed: {}", e.getMessage());
      throw new StoreQueryFailedException(
          "messagesMissingEmbedding", "Missing-embedding query failed", e);
    }
  }

  @Override
  @Timed(value = "message_store.attach_embedding", description = "Time to attach an embedding")
  public void attachEmbedding(String messageId, List<Float> embedding) {
    try {
      Map<String, Object> partial = Map.of(EMBEDDING_FIELD, embedding);
      elasticsearchClient.update(u -> u.index(indexName).id(messageId).doc(partial), Map.class);
      meterRegistry.counter("message_store.embedding_attached").increment();
    } catch (Exception e) {
      log.error("Failed to attach embedding to message {}: {}", messageId, e.getMessage());
      throw new StoreQueryFailedException("attachEmbedding", "Attaching embedding failed", e);
    }
  }

  @Override
  public void markEmbeddingSkipped(String messageId) {
    try {
      UpdateRequest<Map, Map<String, Object>> request =
          UpdateRequest.of(
              u ->
                  u.index(indexName)
                      .id(messageId)
                      .doc(Map.<String, Object>of(EMBEDDING_SKIPPED_FIELD, true)));
      elasticsearchClient.update(request, Map.class);
      meterRegistry.counter("message_store.embedding_skipped").increment();
    } catch (Exception e) {
      log.error("Failed to mark message {} as skipped: {}", messageId, e.getMessage());
      throw new StoreQueryFailedException(
          "markEmbeddingSkipped", "Marking embedding as skipped failed", e);
    }
  }

  @Override
  @Timed(value = "message_store.index", description = "Time to index messages")
  public void save(List<Message> messages) {
    if (messages.isEmpty()) {
      return;
    }

    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (Message message : messages) {
        Map<String, Object> doc = toDocument(message);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(indexName).id(message.id()).document(doc)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        log.warn("Some messages failed to index: {}", response.items());
        meterRegistry.counter("message_store.index.errors").increment();
      }
      meterRegistry.counter("message_store.indexed").increment(messages.size());
      log.debug("Indexed {} messages", messages.size());
    } catch (Exception e) {
      log.error("Failed to index messages: {}", e.getMessage(), e);
      throw new StoreQueryFailedException("save", "Failed to index messages", e);
    }
  }

  private BoolQuery.Builder channelAndWindow(BoolQuery.Builder b, String channelId, Instant since) {
    if (channelId != null) {
      b.filter(f -> f.term(t -> t.field("channelId").value(channelId)));
    }
    if (since != null) {
      b.filter(
          f -> f.range(r -> r.number(n -> n.field("timestamp").gte((double) since.toEpochMilli()))));
    }
    if (channelId == null && since == null) {
      b.filter(Query.of(q -> q.matchAll(m -> m)));
    }
    return b;
  }

  /** Elasticsearch reports cosine hits as (1 + cos) / 2. */
  static double toCosine(Double esScore) {
    if (esScore == null) {
      return 0.0;
    }
    return 2.0 * esScore - 1.0;
  }

  private List<Message> toMessages(SearchResponse<Map> response) {
    List<Message> messages = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      Message message = toMessage(hit);
      if (message != null) {
        messages.add(message);
      }
    }
    return messages;
  }

  @SuppressWarnings("unchecked")
  private Message toMessage(Hit<Map> hit) {
    Map<String, Object> source = hit.source();
    if (source == null) {
      return null;
    }
    Object timestamp = source.get("timestamp");
    return Message.builder()
        .id(hit.id())
        .channelId((String) source.get("channelId"))
        .senderId((String) source.get("senderId"))
        .text((String) source.get("text"))
        .threadId((String) source.get("threadId"))
        .timestamp(
            timestamp instanceof Number n ? Instant.ofEpochMilli(n.longValue()) : Instant.EPOCH)
        .embedding(readEmbedding(source))
        .build();
  }

  private List<Float> readEmbedding(Map<String, Object> source) {
    if (source == null || !(source.get(EMBEDDING_FIELD) instanceof List<?> raw) || raw.isEmpty()) {
      return null;
    }
    List<Float> vector = new ArrayList<>(raw.size());
    for (Object value : raw) {
      vector.add(value instanceof Number n ? n.floatValue() : 0f);
    }
    return vector;
  }

  private Map<String, Object> toDocument(Message message) {
    Map<String, Object> doc = new HashMap<>();
    doc.put("channelId", message.channelId());
    doc.put("senderId", message.senderId());
    doc.put("text", message.text());
    if (message.threadId() != null) {
      doc.put("threadId", message.threadId());
    }
    if (message.timestamp() != null) {
      doc.put("timestamp", message.timestamp().toEpochMilli());
    }
    if (message.hasEmbedding()) {
      doc.put(EMBEDDING_FIELD, message.embedding());
    }
    return doc;
  }
}
