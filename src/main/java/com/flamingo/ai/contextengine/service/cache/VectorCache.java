package com.flamingo.ai.contextengine.service.cache;

import java.util.List;
import java.util.Map;

/**
 * Cache of embedding vectors keyed by an opaque string.
 *
 * <p>Implementations never propagate backend failures: an unavailable tier behaves like a miss.
 */
public interface VectorCache {

  /**
   * Looks up a vector.
   *
   * @param key cache key
   * @return the cached vector or {@code null} on miss
   */
  List<Float> get(String key);

  void set(String key, List<Float> vector);

  /**
   * Batched lookup.
   *
   * @param keys cache keys
   * @return one entry per key in the same order, {@code null} for misses
   */
  List<List<Float>> mget(List<String> keys);

  void mset(Map<String, List<Float>> entries);

  CacheStats stats();

  void resetStats();

  /** Drops the in-process tier only. */
  void clearLocal();
}
