package com.flamingo.ai.contextengine.service.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextengine.agent.UserProfileAgent;
import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.repository.UserProfileRepository;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * User profiles for context enrichment and sampled personality learning.
 *
 * <p>Each response records the exchange in a per-user Redis sorted set. Occasionally (5% of
 * interactions by default) the profile's personality summary is regenerated from the latest
 * messages once enough of them exist.
 */
@Service
@Slf4j
public class UserProfileService {

  static final String INTERACTION_KEY_PREFIX = "user:interaction:";
  static final int MAX_INTERACTIONS = 50;
  static final int MESSAGES_FOR_PROFILE = 30;
  static final int SNIPPET_CHARS = 200;
  private static final Duration INTERACTION_TTL = Duration.ofDays(30);

  private final UserProfileRepository userProfileRepository;
  private final UserProfileAgent userProfileAgent;
  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final ContextEngineConfig config;
  private final Random random;
  private final MeterRegistry meterRegistry;

  public UserProfileService(
      UserProfileRepository userProfileRepository,
      UserProfileAgent userProfileAgent,
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      ContextEngineConfig config,
      @Qualifier("engineRandom") Random random,
      MeterRegistry meterRegistry) {
    this.userProfileRepository = userProfileRepository;
    this.userProfileAgent = userProfileAgent;
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.config = config;
    this.random = random;
    this.meterRegistry = meterRegistry;
  }

  /** One recorded exchange between a user and the agent. */
  record Interaction(long timestamp, String message, String response) {}

  /**
   * Loads the profiles of the given users.
   *
   * @return profiles keyed by user id; users without a profile are absent
   * @throws StoreQueryFailedException if the profile store cannot be queried
   */
  public Map<String, UserProfile> loadProfiles(Collection<String> userIds) {
    Set<String> ids =
        userIds.stream().filter(Objects::nonNull).collect(Collectors.toSet());
    if (ids.isEmpty()) {
      return Map.of();
    }
    try {
      return userProfileRepository.findByUserIdIn(ids).stream()
          .collect(Collectors.toMap(UserProfile::getUserId, Function.identity(), (a, b) -> a));
    } catch (DataAccessException e) {
      throw new StoreQueryFailedException("loadProfiles", "Failed to load user profiles", e);
    }
  }

  /**
   * Records an exchange and, with the configured probability, refreshes the user's personality
   * summary. Failures are logged and never propagate.
   */
  public void recordInteraction(String userId, String userName, String message, String response) {
    if (userId == null || userId.isBlank()) {
      return;
    }
    String key = INTERACTION_KEY_PREFIX + userId;
    try {
      long now = System.currentTimeMillis();
      String entry =
          objectMapper.writeValueAsString(
              new Interaction(now, snippet(message), snippet(response)));
      redisTemplate.opsForZSet().add(key, entry, now);
      redisTemplate.opsForZSet().removeRange(key, 0, -(MAX_INTERACTIONS + 1));
      redisTemplate.expire(key, INTERACTION_TTL);
    } catch (JsonProcessingException | RuntimeException e) {
      log.error("Failed to record interaction for user {}: {}", userId, e.getMessage());
      meterRegistry.counter("profile.interaction.errors").increment();
      return;
    }

    if (random.nextDouble() < config.getResponse().getProfileUpdateProbability()) {
      updatePersonality(userId, userName);
    }
  }

  /**
   * Regenerates the personality summary from the latest recorded messages. Does nothing until the
   * user has the configured minimum number of interactions.
   *
   * @return {@code true} if the profile was updated
   */
  public boolean updatePersonality(String userId, String userName) {
    try {
      String key = INTERACTION_KEY_PREFIX + userId;
      Set<String> raw = redisTemplate.opsForZSet().range(key, -MAX_INTERACTIONS, -1);
      List<String> messages = parseMessages(raw);
      if (messages.size() < config.getResponse().getMinInteractionsForProfile()) {
        log.debug("Not enough interactions to profile user {} ({})", userId, messages.size());
        return false;
      }

      List<String> latest =
          messages.subList(Math.max(0, messages.size() - MESSAGES_FOR_PROFILE), messages.size());
      String summary =
          userProfileAgent.describe(nameOrId(userName, userId), String.join("\n", latest));

      UserProfile profile =
          userProfileRepository
              .findById(userId)
              .orElseGet(() -> UserProfile.builder().userId(userId).build());
      if (userName != null && !userName.isBlank()) {
        profile.setDisplayName(userName);
      }
      profile.setPersonalitySummary(summary != null ? summary.trim() : null);
      profile.setLastInteraction(Instant.now());
      userProfileRepository.save(profile);

      meterRegistry.counter("profile.updates").increment();
      log.info("Updated personality profile for user {}", userId);
      return true;
    } catch (RuntimeException e) {
      log.error("Failed to update personality for user {}: {}", userId, e.getMessage(), e);
      meterRegistry.counter("profile.update.errors").increment();
      return false;
    }
  }

  private List<String> parseMessages(Set<String> raw) {
    List<String> messages = new ArrayList<>();
    if (raw == null) {
      return messages;
    }
    for (String entry : raw) {
      try {
        Interaction interaction = objectMapper.readValue(entry, Interaction.class);
        if (interaction.message() != null && !interaction.message().isBlank()) {
          messages.add(interaction.message());
        }
      } catch (JsonProcessingException e) {
        log.debug("Skipping unreadable interaction entry: {}", e.getOriginalMessage());
      }
    }
    return messages;
  }

  private static String snippet(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > SNIPPET_CHARS ? text.substring(0, SNIPPET_CHARS) : text;
  }

  private static String nameOrId(String userName, String userId) {
    return userName != null && !userName.isBlank() ? userName : userId;
  }
}
