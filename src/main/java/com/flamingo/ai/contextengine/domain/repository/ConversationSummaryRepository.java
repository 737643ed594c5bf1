package com.flamingo.ai.contextengine.domain.repository;

import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ConversationSummary entities. */
@Repository
public interface ConversationSummaryRepository extends JpaRepository<ConversationSummary, UUID> {

  /** Finds the most recent summaries of a channel. */
  List<ConversationSummary> findByChannelIdOrderByCreatedAtDesc(String channelId, Pageable page);

  /** Finds the latest summary of a channel. */
  Optional<ConversationSummary> findFirstByChannelIdOrderByCreatedAtDesc(String channelId);

  /** Counts summaries by channel. */
  long countByChannelId(String channelId);
}
