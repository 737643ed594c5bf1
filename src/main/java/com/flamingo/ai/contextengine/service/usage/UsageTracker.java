package com.flamingo.ai.contextengine.service.usage;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.enums.ModelPricing;
import com.flamingo.ai.contextengine.domain.model.UsageRecord;
import com.flamingo.ai.contextengine.exception.BudgetExceededException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Usage and cost tracking on Redis hashes.
 *
 * <p>Every call is added to an hourly, a daily, a per-model and a per-operation rollup. Keys
 * expire after the retention period (90 days by default), so all replicas share one budget.
 */
@Service
@Slf4j
public class UsageTracker {

  static final double WARNING_RATIO = 0.8;
  static final double EXCEEDED_RATIO = 1.0;

  static final String KEY_PREFIX = "ai:cost:";
  static final String REQUESTS = "requests";
  static final String PROMPT_TOKENS = "promptTokens";
  static final String COMPLETION_TOKENS = "completionTokens";
  static final String COST = "cost";
  private static final char NAME_SEPARATOR = '|';
  private static final DateTimeFormatter HOUR_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH").withZone(ZoneOffset.UTC);
  private static final int HOURLY_REPORT_DAYS = 7;

  private final StringRedisTemplate redisTemplate;
  private final ContextEngineConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public UsageTracker(
      StringRedisTemplate redisTemplate, ContextEngineConfig config, MeterRegistry meterRegistry) {
    this(redisTemplate, config, meterRegistry, Clock.systemUTC());
  }

  UsageTracker(
      StringRedisTemplate redisTemplate,
      ContextEngineConfig config,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.config = config;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Records one provider call. The cost is derived from the price table when absent and the
   * timestamp defaults to now. A Redis failure is logged and counted, never propagated.
   *
   * @return the record as tracked
   */
  public UsageRecord trackUsage(UsageRecord record) {
    UsageRecord stored = complete(record);
    LocalDate day = day(stored.timestamp());

    try {
      add(hourlyKey(stored.timestamp()), "", stored);
      add(dailyKey(day), "", stored);
      add(KEY_PREFIX + "model:" + day, stored.model() + NAME_SEPARATOR, stored);
      add(KEY_PREFIX + "operation:" + day, stored.operation() + NAME_SEPARATOR, stored);
      checkDailyBudget(day);
    } catch (DataAccessException e) {
      log.warn("Failed to record usage for {}: {}", stored.operation(), e.getMessage());
      meterRegistry.counter("usage.store.failures").increment();
    }

    meterRegistry.counter("usage.tokens", "model", stored.model()).increment(stored.totalTokens());
    meterRegistry.counter("usage.requests", "operation", stored.operation()).increment();
    return stored;
  }

  /**
   * Cost of the last hour, read from the hourly rollups: the current hour in full plus the share of
   * the previous hour that still falls inside the window.
   */
  public double trailingHourSpend() {
    Instant now = clock.instant();
    Instant currentHour = now.truncatedTo(ChronoUnit.HOURS);
    double elapsed =
        Duration.between(currentHour, now).toMillis() / (double) Duration.ofHours(1).toMillis();

    double current = cost(hashOps().entries(hourlyKey(currentHour)));
    double previous = cost(hashOps().entries(hourlyKey(currentHour.minus(Duration.ofHours(1)))));
    return current + previous * (1 - elapsed);
  }

  /** Cost of all calls recorded today (UTC). */
  public double todaySpend() {
    return cost(hashOps().entries(dailyKey(day(clock.instant()))));
  }

  /**
   * Signals when the trailing-hour spend exceeds the hourly budget. When the rollups cannot be
   * read the check passes.
   *
   * @throws BudgetExceededException if the spend is over budget
   */
  public void checkHourlyBudget() {
    double spent;
    try {
      spent = trailingHourSpend();
    } catch (DataAccessException e) {
      log.warn("Hourly spend unavailable, skipping budget check: {}", e.getMessage());
      meterRegistry.counter("usage.store.failures").increment();
      return;
    }
    double budget = config.getCost().getHourlyBudget();
    if (spent > budget) {
      throw new BudgetExceededException("hourly", spent, budget);
    }
  }

  /** Builds a cost report over the trailing {@code days} days, today included. */
  public UsageReport generateReport(int days) {
    int period = Math.max(1, days);
    LocalDate today = day(clock.instant());
    LocalDate firstDay = today.minusDays(period - 1L);

    Map<String, Rollup> byModel = new TreeMap<>();
    Map<String, Rollup> byOperation = new TreeMap<>();
    SortedMap<LocalDate, Double> dailyCost = new TreeMap<>();
    double totalCost = 0.0;
    long totalTokens = 0;

    for (LocalDate day = firstDay; !day.isAfter(today); day = day.plusDays(1)) {
      Map<Object, Object> daily = hashOps().entries(dailyKey(day));
      if (!daily.isEmpty()) {
        Rollup rollup = Rollup.of(daily);
        dailyCost.put(day, rollup.cost);
        totalCost += rollup.cost;
        totalTokens += rollup.promptTokens + rollup.completionTokens;
      }
      mergeNamed(hashOps().entries(KEY_PREFIX + "model:" + day), byModel);
      mergeNamed(hashOps().entries(KEY_PREFIX + "operation:" + day), byOperation);
    }

    LocalDate hourlyFrom =
        firstDay.isAfter(today.minusDays(HOURLY_REPORT_DAYS - 1L))
            ? firstDay
            : today.minusDays(HOURLY_REPORT_DAYS - 1L);
    SortedMap<Instant, Double> hourlyCost = new TreeMap<>();
    Instant end = clock.instant().truncatedTo(ChronoUnit.HOURS);
    for (Instant hour = hourlyFrom.atStartOfDay(ZoneOffset.UTC).toInstant();
        !hour.isAfter(end);
        hour = hour.plus(Duration.ofHours(1))) {
      Map<Object, Object> hourly = hashOps().entries(hourlyKey(hour));
      if (!hourly.isEmpty()) {
        hourlyCost.put(hour, cost(hourly));
      }
    }

    double dailyAverage = totalCost / period;
    return new UsageReport(
        period,
        totalCost,
        totalTokens,
        snapshot(byModel),
        snapshot(byOperation),
        dailyCost,
        hourlyCost,
        new UsageReport.Projections(dailyAverage, dailyAverage * 30, dailyAverage * 365));
  }

  private UsageRecord complete(UsageRecord record) {
    UsageRecord.UsageRecordBuilder builder = record.toBuilder();
    if (record.timestamp() == null) {
      builder.timestamp(clock.instant());
    }
    if (record.model() == null) {
      builder.model("unknown");
    }
    if (record.operation() == null) {
      builder.operation("unknown");
    }
    if (record.cost() == null) {
      double cost =
          ModelPricing.fromModelId(record.model())
              .map(p -> p.cost(record.promptTokens(), record.completionTokens()))
              .orElse(0.0);
      builder.cost(cost);
    }
    return builder.build();
  }

  private void add(String key, String fieldPrefix, UsageRecord record) {
    HashOperations<String, Object, Object> hash = hashOps();
    hash.increment(key, fieldPrefix + REQUESTS, 1L);
    hash.increment(key, fieldPrefix + PROMPT_TOKENS, (long) record.promptTokens());
    hash.increment(key, fieldPrefix + COMPLETION_TOKENS, (long) record.completionTokens());
    hash.increment(key, fieldPrefix + COST, record.cost());
    redisTemplate.expire(key, Duration.ofDays(config.getCost().getRetentionDays()));
  }

  private void checkDailyBudget(LocalDate day) {
    double budget = config.getCost().getDailyBudget();
    if (budget <= 0) {
      return;
    }
    double spent = cost(hashOps().entries(dailyKey(day)));
    String alertsKey = KEY_PREFIX + "alerts:" + day;

    if (spent >= budget * EXCEEDED_RATIO && raiseOnce(alertsKey, "exceeded")) {
      log.error("Daily AI budget exceeded: ${} of ${}", String.format("%.4f", spent), budget);
      meterRegistry.counter("usage.budget.alerts", "level", "exceeded").increment();
    } else if (spent >= budget * WARNING_RATIO
        && spent < budget * EXCEEDED_RATIO
        && raiseOnce(alertsKey, "warning")) {
      log.warn(
          "Daily AI spend at 80% of budget: ${} of ${}", String.format("%.4f", spent), budget);
      meterRegistry.counter("usage.budget.alerts", "level", "warning").increment();
    }
  }

  private boolean raiseOnce(String alertsKey, String level) {
    Boolean raised = hashOps().putIfAbsent(alertsKey, level, clock.instant().toString());
    redisTemplate.expire(alertsKey, Duration.ofDays(config.getCost().getRetentionDays()));
    return Boolean.TRUE.equals(raised);
  }

  private HashOperations<String, Object, Object> hashOps() {
    return redisTemplate.opsForHash();
  }

  private static void mergeNamed(Map<Object, Object> fields, Map<String, Rollup> into) {
    Map<String, Map<Object, Object>> byName = new HashMap<>();
    fields.forEach(
        (field, value) -> {
          String key = field.toString();
          int separator = key.lastIndexOf(NAME_SEPARATOR);
          if (separator > 0) {
            byName
                .computeIfAbsent(key.substring(0, separator), n -> new HashMap<>())
                .put(key.substring(separator + 1), value);
          }
        });
    byName.forEach(
        (name, metrics) -> into.computeIfAbsent(name, n -> new Rollup()).add(Rollup.of(metrics)));
  }

  private static Map<String, UsageBreakdown> snapshot(Map<String, Rollup> rollups) {
    Map<String, UsageBreakdown> result = new TreeMap<>();
    rollups.forEach(
        (name, rollup) ->
            result.put(
                name,
                new UsageBreakdown(
                    rollup.requests, rollup.promptTokens, rollup.completionTokens, rollup.cost)));
    return result;
  }

  private static double cost(Map<Object, Object> fields) {
    return Rollup.of(fields).cost;
  }

  private static String hourlyKey(Instant at) {
    return KEY_PREFIX + "hourly:" + HOUR_FORMAT.format(at);
  }

  private static String dailyKey(LocalDate day) {
    return KEY_PREFIX + "daily:" + day;
  }

  private static LocalDate day(Instant instant) {
    return instant.atZone(ZoneOffset.UTC).toLocalDate();
  }

  private static final class Rollup {
    private long requests;
    private long promptTokens;
    private long completionTokens;
    private double cost;

    static Rollup of(Map<Object, Object> fields) {
      Rollup rollup = new Rollup();
      rollup.requests = parseLong(fields.get(REQUESTS));
      rollup.promptTokens = parseLong(fields.get(PROMPT_TOKENS));
      rollup.completionTokens = parseLong(fields.get(COMPLETION_TOKENS));
      rollup.cost = parseDouble(fields.get(COST));
      return rollup;
    }

    void add(Rollup other) {
      requests += other.requests;
      promptTokens += other.promptTokens;
      completionTokens += other.completionTokens;
      cost += other.cost;
    }

    private static long parseLong(Object value) {
      return value != null ? Long.parseLong(value.toString()) : 0L;
    }

    private static double parseDouble(Object value) {
      return value != null ? Double.parseDouble(value.toString()) : 0.0;
    }
  }
}
