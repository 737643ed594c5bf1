package com.flamingo.ai.contextengine.service.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contextengine.agent.UserProfileAgent;
import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.repository.UserProfileRepository;
import com.flamingo.ai.contextengine.exception.StoreQueryFailedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

@ExtendWith(MockitoExtension.class)
class UserProfileServiceTest {

  private static final String KEY = "user:interaction:U1";

  @Mock private UserProfileRepository userProfileRepository;
  @Mock private UserProfileAgent userProfileAgent;
  @Mock private StringRedisTemplate redisTemplate;
  @Mock private ZSetOperations<String, String> zSetOperations;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private double draw;
  private UserProfileService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    draw = 0.99;
    Random random =
        new Random() {
          @Override
          public double nextDouble() {
            return draw;
          }
        };
    lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
    service =
        new UserProfileService(
            userProfileRepository,
            userProfileAgent,
            redisTemplate,
            objectMapper,
            new ContextEngineConfig(),
            random,
            meterRegistry);
  }

  private Set<String> interactions(String... messages) throws JsonProcessingException {
    Set<String> entries = new LinkedHashSet<>();
    long timestamp = 1_700_000_000_000L;
    for (String message : messages) {
      entries.add(
          objectMapper.writeValueAsString(
              new UserProfileService.Interaction(timestamp++, message, "ok")));
    }
    return entries;
  }

  private static String[] numbered(int count) {
    String[] messages = new String[count];
    Arrays.setAll(messages, i -> "message " + i);
    return messages;
  }

  @Nested
  @DisplayName("loadProfiles")
  class LoadProfiles {

    @Test
    @DisplayName("should key loaded profiles by user id")
    void shouldKeyByUserId() {
      UserProfile alice = UserProfile.builder().userId("U1").displayName("Alice").build();
      when(userProfileRepository.findByUserIdIn(Set.of("U1", "U2"))).thenReturn(List.of(alice));

      Map<String, UserProfile> profiles = service.loadProfiles(Arrays.asList("U1", "U2", null));

      assertThat(profiles).containsOnlyKeys("U1");
    }

    @Test
    @DisplayName("should skip the query when there are no ids")
    void shouldSkipEmptyQuery() {
      assertThat(service.loadProfiles(List.of())).isEmpty();
      verifyNoInteractions(userProfileRepository);
    }

    @Test
    @DisplayName("should translate store failures")
    void shouldTranslateStoreFailures() {
      when(userProfileRepository.findByUserIdIn(any()))
          .thenThrow(new DataAccessResourceFailureException("connection refused"));

      assertThatThrownBy(() -> service.loadProfiles(List.of("U1")))
          .isInstanceOf(StoreQueryFailedException.class);
    }
  }

  @Nested
  @DisplayName("recordInteraction")
  class RecordInteraction {

    @Test
    @DisplayName("should append a trimmed snapshot and cap the history")
    void shouldAppendInteraction() throws JsonProcessingException {
      service.recordInteraction("U1", "Ana", "x".repeat(500), "fine");

      ArgumentCaptor<String> entry = ArgumentCaptor.forClass(String.class);
      verify(zSetOperations).add(eq(KEY), entry.capture(), anyDouble());
      UserProfileService.Interaction stored =
          objectMapper.readValue(entry.getValue(), UserProfileService.Interaction.class);
      assertThat(stored.message()).hasSize(UserProfileService.SNIPPET_CHARS);
      assertThat(stored.response()).isEqualTo("fine");
      verify(zSetOperations).removeRange(KEY, 0, -51);
      verify(redisTemplate).expire(KEY, Duration.ofDays(30));
      verifyNoInteractions(userProfileAgent);
    }

    @Test
    @DisplayName("should count Redis failures without propagating them")
    void shouldNotPropagateRedisFailures() {
      when(zSetOperations.add(anyString(), anyString(), anyDouble()))
          .thenThrow(new RedisConnectionFailureException("down"));

      service.recordInteraction("U1", "Ana", "hello", "hi");

      assertThat(meterRegistry.counter("profile.interaction.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should refresh the profile when the sampling draw hits")
    void shouldRefreshWhenSampled() throws JsonProcessingException {
      draw = 0.01;
      when(zSetOperations.range(KEY, -50, -1)).thenReturn(interactions("only one"));

      service.recordInteraction("U1", "Ana", "hello", "hi");

      verify(zSetOperations).range(KEY, -50, -1);
    }

    @Test
    @DisplayName("should ignore anonymous users")
    void shouldIgnoreAnonymousUsers() {
      service.recordInteraction(null, null, "hello", "hi");

      verifyNoInteractions(zSetOperations);
    }
  }

  @Nested
  @DisplayName("updatePersonality")
  class UpdatePersonality {

    @Test
    @DisplayName("should store the generated summary once enough messages exist")
    void shouldStoreSummary() throws JsonProcessingException {
      when(zSetOperations.range(KEY, -50, -1)).thenReturn(interactions(numbered(12)));
      when(userProfileAgent.describe(eq("Ana"), anyString())).thenReturn("  Dry wit, loves Go.  ");
      when(userProfileRepository.findById("U1")).thenReturn(Optional.empty());

      boolean updated = service.updatePersonality("U1", "Ana");

      assertThat(updated).isTrue();
      ArgumentCaptor<UserProfile> saved = ArgumentCaptor.forClass(UserProfile.class);
      verify(userProfileRepository).save(saved.capture());
      assertThat(saved.getValue().getUserId()).isEqualTo("U1");
      assertThat(saved.getValue().getDisplayName()).isEqualTo("Ana");
      assertThat(saved.getValue().getPersonalitySummary()).isEqualTo("Dry wit, loves Go.");
      assertThat(saved.getValue().getLastInteraction()).isNotNull();

      ArgumentCaptor<String> messages = ArgumentCaptor.forClass(String.class);
      verify(userProfileAgent).describe(eq("Ana"), messages.capture());
      assertThat(messages.getValue()).startsWith("message 0").endsWith("message 11");
    }

    @Test
    @DisplayName("should wait for the minimum number of interactions")
    void shouldWaitForEnoughInteractions() throws JsonProcessingException {
      when(zSetOperations.range(KEY, -50, -1)).thenReturn(interactions(numbered(3)));

      assertThat(service.updatePersonality("U1", "Ana")).isFalse();
      verifyNoInteractions(userProfileAgent);
      verify(userProfileRepository, never()).save(any());
    }

    @Test
    @DisplayName("should skip unreadable entries")
    void shouldSkipUnreadableEntries() throws JsonProcessingException {
      Set<String> entries = interactions(numbered(10));
      entries.add("not json");
      when(zSetOperations.range(KEY, -50, -1)).thenReturn(entries);
      when(userProfileAgent.describe(eq("U1"), anyString())).thenReturn("Quiet.");
      when(userProfileRepository.findById("U1")).thenReturn(Optional.empty());

      assertThat(service.updatePersonality("U1", null)).isTrue();
    }

    @Test
    @DisplayName("should report failure when the agent fails")
    void shouldReportAgentFailure() throws JsonProcessingException {
      when(zSetOperations.range(KEY, -50, -1)).thenReturn(interactions(numbered(10)));
      when(userProfileAgent.describe(anyString(), anyString()))
          .thenThrow(new IllegalStateException("model down"));

      assertThat(service.updatePersonality("U1", "Ana")).isFalse();
      assertThat(meterRegistry.counter("profile.update.errors").count()).isEqualTo(1.0);
    }
  }
}
