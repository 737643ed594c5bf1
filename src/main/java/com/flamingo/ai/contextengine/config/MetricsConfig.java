package com.flamingo.ai.contextengine.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /** Timers on the reply path that get latency percentiles. */
  static final List<String> LATENCY_TIMERS =
      List.of("context.build", "search.hybrid", "response.generate", "summary.generate");

  static final double[] PERCENTILES = {0.5, 0.95, 0.99};

  /**
   * Enables the @Timed annotation on engine entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Tags every meter with the application name and publishes percentiles for the reply path.
   *
   * @param application value of {@code spring.application.name}
   * @return the registry customizer
   */
  @Bean
  public MeterRegistryCustomizer<MeterRegistry> contextEngineMeters(
      @Value("${spring.application.name:chat-context-engine}") String application) {
    return registry ->
        registry.config().commonTags("application", application).meterFilter(latencyPercentiles());
  }

  static MeterFilter latencyPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getType() != Meter.Type.TIMER || !LATENCY_TIMERS.contains(id.getName())) {
          return config;
        }
        return DistributionStatisticConfig.builder()
            .percentiles(PERCENTILES)
            .build()
            .merge(config);
      }
    };
  }
}
