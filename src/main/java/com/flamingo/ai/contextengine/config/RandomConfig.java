package com.flamingo.ai.contextengine.config;

import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Provides the randomness source used for stylistic touches and sampled profile updates. */
@Configuration
@Slf4j
public class RandomConfig {

  @Bean(name = "engineRandom")
  public Random engineRandom(ContextEngineConfig config) {
    Long seed = config.getMood().getRandomSeed();
    if (seed != null) {
      log.info("Using seeded engine random (seed={})", seed);
      return new Random(seed);
    }
    return new Random();
  }
}
