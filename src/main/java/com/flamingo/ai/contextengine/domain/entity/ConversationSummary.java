package com.flamingo.ai.contextengine.domain.entity;

import com.flamingo.ai.contextengine.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Represents a summary of a channel's conversation over a period. */
@Entity
@Table(
    name = "conversation_summaries",
    indexes = @Index(name = "idx_summary_channel_created", columnList = "channelId, createdAt"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConversationSummary {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String channelId;

  /** The summarized content of the period. */
  @Column(columnDefinition = "TEXT", nullable = false)
  private String summary;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> keyTopics = new ArrayList<>();

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> participantIds = new ArrayList<>();

  /** Number of messages that were summarized. */
  private Integer messageCount;

  @Column(nullable = false)
  private Instant periodStart;

  @Column(nullable = false)
  private Instant periodEnd;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
