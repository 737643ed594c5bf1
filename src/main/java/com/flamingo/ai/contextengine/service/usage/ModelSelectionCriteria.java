package com.flamingo.ai.contextengine.service.usage;

import com.flamingo.ai.contextengine.domain.enums.Complexity;

/**
 * Signals considered when picking a model tier.
 *
 * @param requiresSearch the reply depends on fetched external content
 * @param conversationLength number of messages in the conversation so far
 */
public record ModelSelectionCriteria(
    boolean requiresSearch, int conversationLength, Complexity complexity) {}
