package com.flamingo.ai.contextengine.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

@ExtendWith(MockitoExtension.class)
class TwoTierVectorCacheTest {

  private static final List<Float> VECTOR = List.of(0.25f, -0.5f, 0.75f);

  @Mock private RedisTemplate<String, byte[]> redisTemplate;
  @Mock private ValueOperations<String, byte[]> valueOperations;

  private SimpleMeterRegistry meterRegistry;
  private TwoTierVectorCache cache;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    cache = new TwoTierVectorCache(redisTemplate, new ContextEngineConfig(), meterRegistry);
  }

  private static byte[] payload(List<Float> vector) {
    return new VectorCodec(1024).encode(vector).payload();
  }

  @Nested
  @DisplayName("get and set")
  class GetSetTests {

    @Test
    @DisplayName("should return null on a miss and the vector after set")
    void shouldReturnNullOnMissAndVectorAfterSet() {
      when(valueOperations.get("emb:k")).thenReturn(null);

      assertThat(cache.get("k")).isNull();

      cache.set("k", VECTOR);

      assertThat(cache.get("k")).isEqualTo(VECTOR);
      verify(valueOperations).set(eq("emb:k"), any(byte[].class), eq(Duration.ofDays(30)));
      assertThat(cache.stats().hits()).isEqualTo(1);
      assertThat(cache.stats().misses()).isEqualTo(1);
      assertThat(cache.stats().sets()).isEqualTo(1);
    }

    @Test
    @DisplayName("should promote a remote hit into the local tier")
    void shouldPromoteRemoteHit() {
      when(valueOperations.get("emb:k")).thenReturn(payload(VECTOR));

      assertThat(cache.get("k")).isEqualTo(VECTOR);
      assertThat(cache.get("k")).isEqualTo(VECTOR);

      verify(valueOperations, times(1)).get("emb:k");
      assertThat(meterRegistry.counter("vector_cache.hits", "tier", "redis").count())
          .isEqualTo(1.0);
      assertThat(meterRegistry.counter("vector_cache.hits", "tier", "local").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("should treat a Redis failure as a miss")
    void shouldTreatRedisFailureAsMiss() {
      when(valueOperations.get("emb:k"))
          .thenThrow(new RedisConnectionFailureException("connection refused"));

      assertThat(cache.get("k")).isNull();

      assertThat(cache.stats().errors()).isEqualTo(1);
      assertThat(cache.stats().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("should treat an undecodable entry as a miss")
    void shouldTreatUndecodableEntryAsMiss() {
      when(valueOperations.get("emb:k")).thenReturn(new byte[] {7, 1, 2});

      assertThat(cache.get("k")).isNull();
      assertThat(cache.stats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep the local copy when the Redis write fails")
    void shouldKeepLocalCopyWhenRedisWriteFails() {
      org.mockito.Mockito.doThrow(new RedisConnectionFailureException("down"))
          .when(valueOperations)
          .set(eq("emb:k"), any(byte[].class), any(Duration.class));

      cache.set("k", VECTOR);

      assertThat(cache.get("k")).isEqualTo(VECTOR);
      assertThat(cache.stats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should ignore blank keys and empty vectors")
    void shouldIgnoreBlankKeysAndEmptyVectors() {
      cache.set(" ", VECTOR);
      cache.set("k", List.of());

      assertThat(cache.get(" ")).isNull();
      verify(valueOperations, never()).set(any(), any(), any(Duration.class));
    }

    @Test
    @DisplayName("should serve from Redis again after the local tier is cleared")
    void shouldServeFromRedisAfterClearLocal() {
      cache.set("k", VECTOR);
      cache.clearLocal();
      when(valueOperations.get("emb:k")).thenReturn(payload(VECTOR));

      assertThat(cache.get("k")).isEqualTo(VECTOR);
      verify(valueOperations).get("emb:k");
    }
  }

  @Nested
  @DisplayName("mget and mset")
  class BatchTests {

    @Test
    @DisplayName("should only ask Redis for keys missing locally and keep positions")
    void shouldOnlyAskRedisForLocalMisses() {
      List<Float> other = List.of(1.0f, 2.0f);
      cache.set("a", VECTOR);
      when(valueOperations.multiGet(List.of("emb:b", "emb:c")))
          .thenReturn(Arrays.asList(payload(other), null));

      List<List<Float>> results = cache.mget(List.of("a", "b", "c"));

      assertThat(results).hasSize(3);
      assertThat(results.get(0)).isEqualTo(VECTOR);
      assertThat(results.get(1)).isEqualTo(other);
      assertThat(results.get(2)).isNull();
    }

    @Test
    @DisplayName("should return local hits when Redis multi-get fails")
    void shouldReturnLocalHitsWhenMultiGetFails() {
      cache.set("a", VECTOR);
      when(valueOperations.multiGet(anyList()))
          .thenThrow(new RedisConnectionFailureException("down"));

      List<List<Float>> results = cache.mget(List.of("a", "b"));

      assertThat(results.get(0)).isEqualTo(VECTOR);
      assertThat(results.get(1)).isNull();
      assertThat(cache.stats().errors()).isEqualTo(1);
    }

    @Test
    @DisplayName("should write all entries locally and pipeline them to Redis")
    @SuppressWarnings("unchecked")
    void shouldWriteEntriesLocallyAndPipeline() {
      Map<String, List<Float>> entries = new LinkedHashMap<>();
      entries.put("a", VECTOR);
      entries.put("b", List.of(3.0f));

      cache.mset(entries);

      verify(redisTemplate).executePipelined(any(RedisCallback.class));
      assertThat(cache.get("a")).isEqualTo(VECTOR);
      assertThat(cache.get("b")).containsExactly(3.0f);
      assertThat(cache.stats().sets()).isEqualTo(2);
    }
  }

  @Test
  @DisplayName("should reset counters")
  void shouldResetCounters() {
    cache.set("k", VECTOR);
    cache.get("k");

    cache.resetStats();

    CacheStats stats = cache.stats();
    assertThat(stats.hits()).isZero();
    assertThat(stats.sets()).isZero();
    assertThat(stats.compressionRatio()).isEqualTo(1.0);
    assertThat(stats.localSize()).isEqualTo(1);
  }
}
