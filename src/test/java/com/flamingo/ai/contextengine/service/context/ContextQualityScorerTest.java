package com.flamingo.ai.contextengine.service.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextQualityScorerTest {

  private final ContextQualityScorer scorer = new ContextQualityScorer();

  private static Message message(String id, String senderId) {
    return Message.builder().id(id).senderId(senderId).text("t").timestamp(Instant.now()).build();
  }

  private static List<Message> messages(int count) {
    return IntStream.range(0, count).mapToObj(i -> message("m" + i, "U1")).toList();
  }

  private static ScoredMessage scored(String id, String senderId, double score) {
    return new ScoredMessage(message(id, senderId), score, 0.0, 1.0, score);
  }

  @Test
  @DisplayName("should score an empty context as zero")
  void shouldScoreEmptyAsZero() {
    assertThat(scorer.score(List.of(), List.of(), null, null)).isZero();
  }

  @Test
  @DisplayName("should normalise by the weights of the signals present")
  void shouldNormaliseByPresentSignals() {
    assertThat(scorer.score(messages(5), List.of(), null, null)).isCloseTo(0.5, within(1e-9));
    assertThat(scorer.score(List.of(), List.of(scored("x", "U1", 0.5)), null, null))
        .isCloseTo(0.5, within(1e-9));
  }

  @Test
  @DisplayName("should combine every signal when all sections are present")
  void shouldCombineAllSignals() {
    double score =
        scorer.score(
            messages(12),
            List.of(scored("x1", "U1", 0.8), scored("x2", "U2", 0.6)),
            messages(2),
            Map.of("U1", UserProfile.builder().userId("U1").build()));

    // 0.3 + 0.7 * 0.4 + 1.0 * 0.1 + 0.1 + 0.1
    assertThat(score).isCloseTo(0.88, within(1e-9));
  }

  @Test
  @DisplayName("should penalise relevant messages from a single sender")
  void shouldPenaliseSingleSender() {
    List<ScoredMessage> sameSender = List.of(scored("x1", "U1", 1.0), scored("x2", "U1", 1.0));
    List<ScoredMessage> mixed = List.of(scored("x1", "U1", 1.0), scored("x2", "U2", 1.0));

    assertThat(scorer.score(List.of(), sameSender, null, null))
        .isLessThan(scorer.score(List.of(), mixed, null, null));
  }

  @Test
  @DisplayName("should clamp relevance above one")
  void shouldClampRelevance() {
    double score = scorer.score(List.of(), List.of(scored("x", "U1", 1.32)), null, null);

    assertThat(score).isEqualTo(1.0);
  }
}
