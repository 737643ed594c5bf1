package com.flamingo.ai.contextengine.service.cache;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.exception.CacheUnavailableException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.types.Expiration;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import org.springframework.stereotype.Service;

/**
 * Two-tier vector cache: a bounded in-process Caffeine tier (size + TTL) in front of Redis.
 *
 * <p>Reads check the local tier first, then Redis, and promote remote hits into the local tier.
 * Writes go to both tiers; the last writer wins. Any Redis or decoding failure is logged, counted
 * and treated as a miss.
 */
@Service
@Slf4j
public class TwoTierVectorCache implements VectorCache {

  private static final String LOCAL_TIER = "local";
  private static final String REMOTE_TIER = "redis";

  private final RedisTemplate<String, byte[]> redisTemplate;
  private final MeterRegistry meterRegistry;
  private final VectorCodec codec;
  private final Cache<String, List<Float>> localCache;
  private final String keyPrefix;
  private final Duration remoteTtl;

  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();
  private final LongAdder sets = new LongAdder();
  private final LongAdder errors = new LongAdder();
  private volatile double compressionRatio = 1.0;

  public TwoTierVectorCache(
      RedisTemplate<String, byte[]> vectorRedisTemplate,
      ContextEngineConfig config,
      MeterRegistry meterRegistry) {
    ContextEngineConfig.Cache cacheConfig = config.getCache();
    this.redisTemplate = vectorRedisTemplate;
    this.meterRegistry = meterRegistry;
    this.codec = new VectorCodec(cacheConfig.getCompressionThresholdBytes());
    this.keyPrefix = cacheConfig.getKeyPrefix();
    this.remoteTtl = cacheConfig.getRemoteTtl();
    this.localCache =
        Caffeine.newBuilder()
            .maximumSize(Math.max(1, cacheConfig.getLocalMaxSize()))
            .expireAfterWrite(cacheConfig.getLocalTtl())
            .build();
  }

  @Override
  public List<Float> get(String key) {
    if (key == null || key.isBlank()) {
      return null;
    }

    List<Float> local = localCache.getIfPresent(key);
    if (local != null) {
      recordHit(LOCAL_TIER);
      return local;
    }

    try {
      byte[] payload = readRemote(key);
      if (payload == null) {
        recordMiss();
        return null;
      }
      List<Float> vector = decode(key, payload);
      localCache.put(key, vector);
      recordHit(REMOTE_TIER);
      return vector;
    } catch (CacheUnavailableException e) {
      degrade("get", e);
      recordMiss();
      return null;
    }
  }

  @Override
  public void set(String key, List<Float> vector) {
    if (key == null || key.isBlank() || vector == null || vector.isEmpty()) {
      return;
    }

    List<Float> copy = List.copyOf(vector);
    localCache.put(key, copy);
    sets.increment();

    try {
      VectorCodec.Encoded encoded = encode(copy);
      redisTemplate.opsForValue().set(remoteKey(key), encoded.payload(), remoteTtl);
    } catch (RuntimeException e) {
      degrade("set", new CacheUnavailableException(REMOTE_TIER, "Redis write failed", e));
    }
  }

  @Override
  public List<List<Float>> mget(List<String> keys) {
    if (keys == null || keys.isEmpty()) {
      return List.of();
    }

    List<List<Float>> results = new ArrayList<>(Collections.nCopies(keys.size(), null));
    List<Integer> missingIndexes = new ArrayList<>();
    List<String> missingKeys = new ArrayList<>();

    for (int i = 0; i < keys.size(); i++) {
      String key = keys.get(i);
      List<Float> local = key != null ? localCache.getIfPresent(key) : null;
      if (local != null) {
        results.set(i, local);
        recordHit(LOCAL_TIER);
      } else if (key != null && !key.isBlank()) {
        missingIndexes.add(i);
        missingKeys.add(key);
      } else {
        recordMiss();
      }
    }

    if (missingKeys.isEmpty()) {
      return results;
    }

    List<byte[]> payloads;
    try {
      List<String> remoteKeys = missingKeys.stream().map(this::remoteKey).toList();
      payloads = redisTemplate.opsForValue().multiGet(remoteKeys);
    } catch (RuntimeException e) {
      degrade("mget", new CacheUnavailableException(REMOTE_TIER, "Redis multi-get failed", e));
      missingKeys.forEach(k -> recordMiss());
      return results;
    }

    for (int j = 0; j < missingKeys.size(); j++) {
      byte[] payload = payloads != null && j < payloads.size() ? payloads.get(j) : null;
      if (payload == null) {
        recordMiss();
        continue;
      }
      String key = missingKeys.get(j);
      try {
        List<Float> vector = decode(key, payload);
        localCache.put(key, vector);
        results.set(missingIndexes.get(j), vector);
        recordHit(REMOTE_TIER);
      } catch (CacheUnavailableException e) {
        degrade("mget", e);
        recordMiss();
      }
    }
    return results;
  }

  @Override
  public void mset(Map<String, List<Float>> entries) {
    if (entries == null || entries.isEmpty()) {
      return;
    }

    List<String> keys = new ArrayList<>();
    List<byte[]> payloads = new ArrayList<>();
    for (Map.Entry<String, List<Float>> entry : entries.entrySet()) {
      if (entry.getKey() == null || entry.getValue() == null || entry.getValue().isEmpty()) {
        continue;
      }
      List<Float> copy = List.copyOf(entry.getValue());
      localCache.put(entry.getKey(), copy);
      sets.increment();
      keys.add(remoteKey(entry.getKey()));
      payloads.add(encode(copy).payload());
    }

    if (keys.isEmpty()) {
      return;
    }

    try {
      Expiration expiration = Expiration.from(remoteTtl);
      redisTemplate.executePipelined(
          (RedisCallback<Object>)
              connection -> {
                for (int i = 0; i < keys.size(); i++) {
                  connection
                      .stringCommands()
                      .set(
                          StringRedisSerializer.UTF_8.serialize(keys.get(i)),
                          payloads.get(i),
                          expiration,
                          SetOption.upsert());
                }
                return null;
              });
    } catch (RuntimeException e) {
      degrade("mset", new CacheUnavailableException(REMOTE_TIER, "Redis pipeline failed", e));
    }
  }

  @Override
  public CacheStats stats() {
    return new CacheStats(
        hits.sum(),
        misses.sum(),
        sets.sum(),
        errors.sum(),
        compressionRatio,
        localCache.estimatedSize());
  }

  @Override
  public void resetStats() {
    hits.reset();
    misses.reset();
    sets.reset();
    errors.reset();
    compressionRatio = 1.0;
  }

  @Override
  public void clearLocal() {
    localCache.invalidateAll();
  }

  private byte[] readRemote(String key) {
    try {
      return redisTemplate.opsForValue().get(remoteKey(key));
    } catch (RuntimeException e) {
      throw new CacheUnavailableException(REMOTE_TIER, "Redis read failed", e);
    }
  }

  private List<Float> decode(String key, byte[] payload) {
    try {
      return codec.decode(payload);
    } catch (IllegalArgumentException e) {
      throw new CacheUnavailableException(REMOTE_TIER, "Undecodable entry for key " + key, e);
    }
  }

  private VectorCodec.Encoded encode(List<Float> vector) {
    VectorCodec.Encoded encoded = codec.encode(vector);
    if (encoded.compressed()) {
      compressionRatio = compressionRatio * 0.9 + encoded.ratio() * 0.1;
    }
    return encoded;
  }

  private String remoteKey(String key) {
    return keyPrefix + key;
  }

  private void recordHit(String tier) {
    hits.increment();
    meterRegistry.counter("vector_cache.hits", "tier", tier).increment();
  }

  private void recordMiss() {
    misses.increment();
    meterRegistry.counter("vector_cache.misses").increment();
  }

  private void degrade(String operation, CacheUnavailableException e) {
    errors.increment();
    meterRegistry.counter("vector_cache.errors", "operation", operation).increment();
    log.warn(
        "Vector cache {} degraded to miss ({} tier): {}",
        operation,
        e.getTier(),
        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
  }
}
