package com.flamingo.ai.contextengine.domain.entity;

import com.flamingo.ai.contextengine.domain.converter.StringListConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Personality summary and interests of a chat participant, keyed by the platform user id. */
@Entity
@Table(name = "user_profiles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

  @Id
  @Column(name = "user_id", nullable = false, updatable = false)
  private String userId;

  private String displayName;

  /** Free-text personality summary, refreshed by the sampled profile update. */
  @Column(columnDefinition = "TEXT")
  private String personalitySummary;

  @Convert(converter = StringListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<String> interests = new ArrayList<>();

  private Instant lastInteraction;

  private Instant updatedAt;

  @PrePersist
  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  /** Name used when rendering the profile into a prompt. */
  public String displayNameOrId() {
    return displayName != null && !displayName.isBlank() ? displayName : userId;
  }

  public boolean hasPersonalitySummary() {
    return personalitySummary != null && !personalitySummary.isBlank();
  }
}
