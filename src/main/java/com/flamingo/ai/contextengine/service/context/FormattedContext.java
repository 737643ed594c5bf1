package com.flamingo.ai.contextengine.service.context;

import com.flamingo.ai.contextengine.domain.entity.ConversationSummary;
import com.flamingo.ai.contextengine.domain.entity.UserProfile;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.util.List;
import java.util.Map;

/**
 * Prompt text produced under a token budget, together with the items that made it in.
 *
 * @param recent included recent messages, chronological
 * @param relevant included relevant messages, most relevant first
 */
public record FormattedContext(
    String text,
    int tokenEstimate,
    List<Message> recent,
    List<ScoredMessage> relevant,
    List<Message> thread,
    List<ConversationSummary> summaries,
    Map<String, UserProfile> profiles) {}
