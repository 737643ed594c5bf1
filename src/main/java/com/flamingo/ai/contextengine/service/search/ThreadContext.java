package com.flamingo.ai.contextengine.service.search;

import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import java.util.List;

/**
 * A thread and, optionally, messages related to its root.
 *
 * @param thread thread messages in chronological order
 * @param related search hits seeded by the root message, excluding thread members
 */
public record ThreadContext(List<Message> thread, List<ScoredMessage> related) {

  public static ThreadContext empty() {
    return new ThreadContext(List.of(), List.of());
  }

  public boolean isEmpty() {
    return thread.isEmpty() && related.isEmpty();
  }
}
