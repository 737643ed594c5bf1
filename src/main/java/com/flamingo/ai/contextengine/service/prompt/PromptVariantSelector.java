package com.flamingo.ai.contextengine.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.enums.PromptTestStatus;
import com.flamingo.ai.contextengine.domain.enums.PromptType;
import com.flamingo.ai.contextengine.exception.InvalidPromptTestException;
import com.flamingo.ai.contextengine.exception.PromptTestNotFoundException;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * A/B testing of prompt variants, kept in Redis so that every replica assigns and counts alike.
 *
 * <p>Users are bucketed deterministically: the first 8 hex digits of {@code md5("testId:userId")}
 * modulo 100, compared against the cumulative allocation in variant order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromptVariantSelector {

  static final String TEST_KEY_PREFIX = "prompt:test:";
  static final String TEST_INDEX_KEY = "prompt:tests";
  static final String SEQUENCE_KEY = "prompt:test-seq";
  static final String METRICS_KEY_PREFIX = "prompt:metrics:";

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;

  /**
   * Creates and activates a test.
   *
   * @throws InvalidPromptTestException if a variant lacks an allocation, the allocation names an
   *     unknown variant or the percentages do not sum to 100
   */
  public PromptTest createTest(
      String name, PromptType type, List<PromptVariant> variants, Map<String, Integer> allocation) {
    validate(variants, allocation);

    Map<String, Integer> ordered = new LinkedHashMap<>();
    variants.forEach(v -> ordered.put(v.id(), allocation.get(v.id())));

    PromptTest test =
        new PromptTest(
            UUID.randomUUID().toString(),
            name,
            type,
            PromptTestStatus.ACTIVE,
            Instant.now(),
            null,
            List.copyOf(variants),
            ordered);

    try {
      save(test);
      Long sequence = redisTemplate.opsForValue().increment(SEQUENCE_KEY);
      double order = sequence != null ? sequence : test.startDate().toEpochMilli();
      redisTemplate.opsForZSet().add(TEST_INDEX_KEY, test.id(), order);
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("createPromptTest", "Failed to store prompt test", e);
    }

    log.info("Created prompt test {} ({}) with {} variants", test.id(), name, variants.size());
    return test;
  }

  /**
   * Assigns a user to a variant of an active test and counts an impression.
   *
   * @return the variant, or empty if the test is unknown, not active or the store is unavailable
   */
  public Optional<PromptVariant> selectVariant(String testId, String userId) {
    PromptTest test;
    try {
      test = load(testId).orElse(null);
    } catch (StoreQueryFailedException e) {
      log.warn("Prompt test {} unavailable, using the default prompt: {}", testId, e.getMessage());
      meterRegistry.counter("prompt.store.failures").increment();
      return Optional.empty();
    }
    if (test == null || !test.isActive()) {
      return Optional.empty();
    }

    int bucket = bucket(testId, userId);
    int cumulative = 0;
    for (PromptVariant variant : test.variants()) {
      cumulative += test.allocation().get(variant.id());
      if (bucket < cumulative) {
        increment(testId, variant.id(), "impressions");
        meterRegistry.counter("prompt.impressions", "variant", variant.id()).increment();
        return Optional.of(variant);
      }
    }
    return Optional.empty();
  }

  /**
   * The most recently created active test of a type.
   *
   * @return the test, or empty if none is active or the store is unavailable
   */
  public Optional<PromptTest> getActiveTest(PromptType type) {
    List<PromptTest> all;
    try {
      all = listTests();
    } catch (StoreQueryFailedException e) {
      log.warn("Prompt tests unavailable, using the default prompt: {}", e.getMessage());
      meterRegistry.counter("prompt.store.failures").increment();
      return Optional.empty();
    }
    PromptTest newest = null;
    for (PromptTest test : all) {
      if (test.isActive()
          && test.type() == type
          && (newest == null || !test.startDate().isBefore(newest.startDate()))) {
        newest = test;
      }
    }
    return Optional.ofNullable(newest);
  }

  public PromptTest getTest(String testId) {
    return load(testId).orElseThrow(() -> new PromptTestNotFoundException(testId));
  }

  /** All tests in creation order. */
  public List<PromptTest> listTests() {
    try {
      Set<String> ids = redisTemplate.opsForZSet().range(TEST_INDEX_KEY, 0, -1);
      if (ids == null || ids.isEmpty()) {
        return List.of();
      }
      List<String> keys = ids.stream().map(id -> TEST_KEY_PREFIX + id).toList();
      List<String> documents = redisTemplate.opsForValue().multiGet(keys);
      List<PromptTest> tests = new ArrayList<>();
      if (documents != null) {
        documents.stream().filter(Objects::nonNull).map(this::read).forEach(tests::add);
      }
      return tests;
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("listPromptTests", "Failed to list prompt tests", e);
    }
  }

  /** Accumulates outcome signals for a variant. */
  public void trackMetrics(String testId, String variantId, MetricsUpdate update) {
    PromptTest test = getTest(testId);
    if (test.variant(variantId).isEmpty()) {
      throw new InvalidPromptTestException(
          "Variant " + variantId + " is not part of test " + testId);
    }
    try {
      HashOperations<String, Object, Object> hash = redisTemplate.opsForHash();
      String key = metricsKey(testId, variantId);
      if (update.engagement()) {
        hash.increment(key, "engagement", 1L);
      }
      if (update.quality() != null) {
        hash.increment(key, "qualitySum", update.quality());
        hash.increment(key, "qualityCount", 1L);
      }
      if (update.responseTimeMs() != null) {
        hash.increment(key, "responseTimeSum", update.responseTimeMs());
        hash.increment(key, "responseTimeCount", 1L);
      }
      if (update.tokens() != null) {
        hash.increment(key, "tokensSum", (long) update.tokens());
        hash.increment(key, "tokensCount", 1L);
      }
      if (update.error()) {
        hash.increment(key, "errors", 1L);
      }
      if (update.conversion()) {
        hash.increment(key, "conversions", 1L);
      }
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("trackPromptMetrics", "Failed to record metrics", e);
    }
  }

  /**
   * Per-variant results. A winner is declared only once every variant has reached the minimum
   * sample size.
   */
  public TestResults getTestResults(String testId) {
    PromptTest test = getTest(testId);
    List<VariantResult> results =
        test.variants().stream().map(v -> snapshot(testId, v.id())).toList();

    int minSample = config.getPrompt().getMinSampleSize();
    boolean sampled = results.stream().allMatch(r -> r.impressions() >= minSample);
    if (!sampled) {
      return new TestResults(test, results, null, 0.0);
    }

    List<VariantResult> ranked = new ArrayList<>(results);
    ranked.sort(Comparator.comparingDouble(VariantResult::score).reversed());
    PromptVariant winner = test.variant(ranked.get(0).variantId()).orElse(null);
    double confidence = ranked.size() >= 2 ? confidence(ranked.get(0), ranked.get(1)) : 0.0;
    return new TestResults(test, results, winner, confidence);
  }

  /** Marks a test completed; it no longer assigns variants. */
  public PromptTest endTest(String testId) {
    PromptTest ended = getTest(testId).completed(Instant.now());
    try {
      save(ended);
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("endPromptTest", "Failed to store prompt test", e);
    }
    log.info("Ended prompt test {} ({})", testId, ended.name());
    return ended;
  }

  static int bucket(String testId, String userId) {
    try {
      byte[] digest =
          MessageDigest.getInstance("MD5")
              .digest((testId + ":" + userId).getBytes(StandardCharsets.UTF_8));
      long value = 0;
      for (int i = 0; i < 4; i++) {
        value = (value << 8) | (digest[i] & 0xFF);
      }
      return (int) (value % 100);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }

  /** Two-proportion z-test on engagement rates mapped to {@code min(0.99, 1 - exp(-z^2 / 2))}. */
  static double confidence(VariantResult a, VariantResult b) {
    if (a.impressions() == 0 || b.impressions() == 0) {
      return 0.0;
    }
    double pooled =
        (double) (a.engagement() + b.engagement()) / (a.impressions() + b.impressions());
    double standardError =
        Math.sqrt(pooled * (1 - pooled) * (1.0 / a.impressions() + 1.0 / b.impressions()));
    if (standardError == 0.0) {
      return 0.0;
    }
    double z = Math.abs(a.engagementRate() - b.engagementRate()) / standardError;
    return Math.min(0.99, 1 - Math.exp(-z * z / 2));
  }

  private void save(PromptTest test) {
    try {
      String document = objectMapper.writeValueAsString(test);
      redisTemplate.opsForValue().set(TEST_KEY_PREFIX + test.id(), document);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Prompt test " + test.id() + " is not serializable", e);
    }
  }

  private Optional<PromptTest> load(String testId) {
    String document;
    try {
      document = redisTemplate.opsForValue().get(TEST_KEY_PREFIX + testId);
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("getPromptTest", "Failed to load prompt test", e);
    }
    return Optional.ofNullable(document).map(this::read);
  }

  private PromptTest read(String document) {
    try {
      return objectMapper.readValue(document, PromptTest.class);
    } catch (JsonProcessingException e) {
      throw new StoreQueryFailedException(
          "getPromptTest", "Unreadable prompt test: " + e.getOriginalMessage(), e);
    }
  }

  private void increment(String testId, String variantId, String field) {
    try {
      redisTemplate.opsForHash().increment(metricsKey(testId, variantId), field, 1L);
    } catch (DataAccessException e) {
      log.warn("Impression of variant {} in test {} lost: {}", variantId, testId, e.getMessage());
      meterRegistry.counter("prompt.store.failures").increment();
    }
  }

  private VariantResult snapshot(String testId, String variantId) {
    Map<Object, Object> fields;
    try {
      fields = redisTemplate.opsForHash().entries(metricsKey(testId, variantId));
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("getPromptResults", "Failed to load metrics", e);
    }
    return new VariantResult(
        variantId,
        longField(fields, "impressions"),
        longField(fields, "engagement"),
        average(fields, "qualitySum", "qualityCount"),
        average(fields, "responseTimeSum", "responseTimeCount"),
        average(fields, "tokensSum", "tokensCount"),
        longField(fields, "errors"),
        longField(fields, "conversions"));
  }

  private static String metricsKey(String testId, String variantId) {
    return METRICS_KEY_PREFIX + testId + ":" + variantId;
  }

  private static long longField(Map<Object, Object> fields, String name) {
    Object value = fields.get(name);
    return value != null ? Long.parseLong(value.toString()) : 0L;
  }

  private static double average(Map<Object, Object> fields, String sum, String count) {
    long n = longField(fields, count);
    Object total = fields.get(sum);
    return n > 0 && total != null ? Double.parseDouble(total.toString()) / n : 0.0;
  }

  private static void validate(List<PromptVariant> variants, Map<String, Integer> allocation) {
    if (variants == null || variants.isEmpty()) {
      throw new InvalidPromptTestException("A prompt test needs at least one variant");
    }
    if (allocation == null) {
      throw new InvalidPromptTestException("Allocation is required");
    }
    Set<String> ids = new HashSet<>();
    int total = 0;
    for (PromptVariant variant : variants) {
      if (variant.id() == null || !ids.add(variant.id())) {
        throw new InvalidPromptTestException("Variant ids must be present and unique");
      }
      Integer share = allocation.get(variant.id());
      if (share == null) {
        throw new InvalidPromptTestException("Missing allocation for variant " + variant.id());
      }
      if (share < 0) {
        throw new InvalidPromptTestException("Negative allocation for variant " + variant.id());
      }
      total += share;
    }
    for (String key : allocation.keySet()) {
      if (!ids.contains(key)) {
        throw new InvalidPromptTestException("Allocation names unknown variant " + key);
      }
    }
    if (total != 100) {
      throw new InvalidPromptTestException("Allocation must sum to 100, got " + total);
    }
  }
}
