package com.flamingo.ai.contextengine.service.usage;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.SortedMap;

/**
 * Cost report over a trailing number of days.
 *
 * @param dailyCost cost per UTC day
 * @param hourlyCost cost per hour, limited to the last 7 days of the period
 */
public record UsageReport(
    int days,
    double totalCost,
    long totalTokens,
    Map<String, UsageBreakdown> byModel,
    Map<String, UsageBreakdown> byOperation,
    SortedMap<LocalDate, Double> dailyCost,
    SortedMap<Instant, Double> hourlyCost,
    Projections projections) {

  /** Spend extrapolated from the period's daily average. */
  public record Projections(double dailyAverage, double monthly, double yearly) {}
}
