package com.flamingo.ai.contextengine.service.cache;

/**
 * Snapshot of vector cache counters.
 *
 * @param compressionRatio moving average of compressed size over raw size, 1.0 when nothing was
 *     compressed yet
 */
public record CacheStats(
    long hits, long misses, long sets, long errors, double compressionRatio, long localSize) {

  public double hitRate() {
    long lookups = hits + misses;
    return lookups == 0 ? 0.0 : (double) hits / lookups;
  }
}
