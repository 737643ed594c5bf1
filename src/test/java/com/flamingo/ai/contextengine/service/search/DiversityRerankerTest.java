package com.flamingo.ai.contextengine.service.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DiversityRerankerTest {

  private final DiversityReranker reranker = new DiversityReranker(new SimpleMeterRegistry());

  private static ScoredMessage scored(String id, String sender, String text, double score) {
    Message message =
        Message.builder()
            .id(id)
            .channelId("C1")
            .senderId(sender)
            .text(text)
            .timestamp(Instant.now())
            .build();
    return new ScoredMessage(message, score, 0.0, 1.0, score);
  }

  @Nested
  @DisplayName("rerank")
  class RerankTests {

    @Test
    @DisplayName("should keep score order when the diversity weight is zero")
    void shouldKeepScoreOrderWithZeroWeight() {
      List<ScoredMessage> results =
          reranker.rerank(
              List.of(
                  scored("a1", "alice", "first topic", 0.9),
                  scored("a2", "alice", "second topic", 0.8),
                  scored("b1", "bob", "third topic", 0.7)),
              0.0);

      assertThat(results).extracting(ScoredMessage::id).containsExactly("a1", "a2", "b1");
      assertThat(results.get(0).combinedScore()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("should promote other senders over a dominant one")
    void shouldPromoteOtherSenders() {
      List<ScoredMessage> results =
          reranker.rerank(
              List.of(
                  scored("a1", "alice", "the build is red again", 0.9),
                  scored("a2", "alice", "still looking at the pipeline", 0.85),
                  scored("b1", "bob", "rollback finished", 0.8)),
              0.5);

      assertThat(results).extracting(ScoredMessage::id).containsExactly("a1", "b1", "a2");
      assertThat(results.get(0).combinedScore()).isCloseTo(0.45, within(1e-9));
    }

    @Test
    @DisplayName("should push near-duplicate texts down")
    void shouldPushNearDuplicatesDown() {
      List<ScoredMessage> results =
          reranker.rerank(
              List.of(
                  scored("c1", "alice", "deploy failed on prod server", 0.9),
                  scored("c2", "bob", "deploy failed on prod server", 0.88),
                  scored("d1", "carol", "database migration finished", 0.5)),
              0.2);

      assertThat(results).extracting(ScoredMessage::id).containsExactly("c1", "d1", "c2");
    }

    @Test
    @DisplayName("should rank a near-duplicate below a distinct message once the sender term wins")
    void shouldRankDuplicateBelowDistinctWhenScoreTurnsNegative() {
      List<ScoredMessage> results =
          reranker.rerank(
              List.of(
                  scored("a", "sam", "fix the build now", 0.9),
                  scored("b", "sam", "fix the build now", 0.05),
                  scored("c", "sam", "totally different words", 0.05)),
              0.2);

      assertThat(results).extracting(ScoredMessage::id).containsExactly("a", "c", "b");
      assertThat(results.get(1).combinedScore()).isCloseTo(0.04 - 0.2, within(1e-9));
      assertThat(results.get(2).combinedScore()).isLessThan(results.get(1).combinedScore());
    }

    @Test
    @DisplayName("should apply per-user boosts")
    void shouldApplyUserBoosts() {
      List<ScoredMessage> results =
          reranker.rerank(
              List.of(scored("a1", "alice", "one", 0.6), scored("b1", "bob", "two", 0.5)),
              0.0,
              Map.of("bob", 2.0));

      assertThat(results).extracting(ScoredMessage::id).containsExactly("b1", "a1");
    }

    @Test
    @DisplayName("should return an empty list for no candidates")
    void shouldHandleNoCandidates() {
      assertThat(reranker.rerank(List.of(), 0.5)).isEmpty();
      assertThat(reranker.rerank(null, 0.5)).isEmpty();
    }
  }

  @Test
  @DisplayName("should measure sender diversity as unique senders over results")
  void shouldMeasureSenderDiversity() {
    assertThat(
            reranker.calculateSenderDiversity(
                List.of(
                    scored("a1", "alice", "x", 1),
                    scored("a2", "alice", "y", 1),
                    scored("b1", "bob", "z", 1),
                    scored("c1", "carol", "w", 1))))
        .isEqualTo(0.75);
    assertThat(reranker.calculateSenderDiversity(List.of())).isZero();
  }

  @Test
  @DisplayName("should compute Jaccard similarity over case-folded words")
  void shouldComputeJaccard() {
    double similarity =
        DiversityReranker.jaccard(
            DiversityReranker.tokens("Deploy the API"), DiversityReranker.tokens("deploy the UI"));

    assertThat(similarity).isEqualTo(0.5);
  }
}
