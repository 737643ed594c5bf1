package com.flamingo.ai.contextengine.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the context engine. */
@Configuration
@ConfigurationProperties(prefix = "context-engine")
@Getter
@Setter
public class ContextEngineConfig {

  private Cache cache = new Cache();
  private Search search = new Search();
  private Context context = new Context();
  private Mood mood = new Mood();
  private Cost cost = new Cost();
  private Prompt prompt = new Prompt();
  private Response response = new Response();
  private Interjection interjection = new Interjection();
  private Backfill backfill = new Backfill();
  private Summarization summarization = new Summarization();

  @Getter
  @Setter
  public static class Cache {
    private long localMaxSize = 500;
    private Duration localTtl = Duration.ofHours(1);
    private Duration remoteTtl = Duration.ofDays(30);
    private String keyPrefix = "emb:";

    /** Serialized payloads larger than this are LZ4-compressed before hitting Redis. */
    private int compressionThresholdBytes = 1024;
  }

  @Getter
  @Setter
  public static class Search {
    private int limit = 20;
    private double semanticWeight = 0.7;
    private double temporalDecay = 0.1;
    private double minScore = 0.3;
    private int recentHours = 168;
    private double diversityWeight = 0.2;

    private boolean useAdaptiveThreshold = true;

    /** Number of stored vectors compared against the query for the adaptive threshold. */
    private int adaptiveSampleSize = 1000;

    private double adaptiveDefaultThreshold = 0.5;
    private int threadLimit = 100;
    private int relatedLimit = 10;
  }

  @Getter
  @Setter
  public static class Context {
    private int maxTokens = 4000;
    private int recentLimit = 20;
    private int relevantLimit = 15;
    private int hoursBack = 48;
    private int summaryLimit = 3;
    private Duration cacheTtl = Duration.ofMinutes(5);
    private long cacheMaxSize = 1000;
  }

  @Getter
  @Setter
  public static class Mood {
    /** Fixed seed for stylistic randomness; unset means a time-seeded generator. */
    private Long randomSeed;
  }

  @Getter
  @Setter
  public static class Cost {
    private double dailyBudget = 10.0;
    private double hourlyBudget = 1.0;
    private int retentionDays = 90;
  }

  @Getter
  @Setter
  public static class Prompt {
    private int minSampleSize = 100;
  }

  @Getter
  @Setter
  public static class Response {
    private Duration cacheTtl = Duration.ofSeconds(60);
    private double profileUpdateProbability = 0.05;
    private int minInteractionsForProfile = 10;
    private int formattedContextTokens = 3000;
    private String fallbackReply = "My circuits are a bit scrambled. Try again?";
  }

  @Getter
  @Setter
  public static class Interjection {
    private Duration minimumInterval = Duration.ofMinutes(30);
  }

  @Getter
  @Setter
  public static class Backfill {
    private boolean enabled = true;
    private int batchSize = 50;
    private Duration interval = Duration.ofMinutes(10);
  }

  @Getter
  @Setter
  public static class Summarization {
    private boolean enabled = false;
    private List<String> channels = new ArrayList<>();
    private Duration interval = Duration.ofHours(1);
    private int minMessages = 10;
    private int maxMessages = 500;
  }
}
