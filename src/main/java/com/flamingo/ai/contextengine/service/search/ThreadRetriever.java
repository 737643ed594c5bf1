package com.flamingo.ai.contextengine.service.search;

import com.flamingo.ai.contextengine.config.ContextEngineConfig;
import com.flamingo.ai.contextengine.domain.model.Message;
import com.flamingo.ai.contextengine.domain.model.ScoredMessage;
import com.flamingo.ai.contextengine.domain.repository.MessageStore;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Thread-aware retrieval: a whole thread plus conversations related to its root message. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ThreadRetriever {

  static final int ROOT_SEED_CHARS = 200;
  static final double RELATED_SEMANTIC_WEIGHT = 0.8;

  private final MessageStore messageStore;
  private final HybridSearchService hybridSearchService;
  private final ContextEngineConfig config;

  public ThreadContext getThreadContext(String channelId, String threadId, boolean includeRelated) {
    if (threadId == null || threadId.isBlank()) {
      return ThreadContext.empty();
    }

    List<Message> thread =
        messageStore.messagesByThread(channelId, threadId, config.getSearch().getThreadLimit());
    if (!includeRelated || thread.isEmpty()) {
      return new ThreadContext(thread, List.of());
    }

    Message root =
        thread.stream().filter(m -> threadId.equals(m.id())).findFirst().orElse(thread.get(0));
    String seed = root.safeText();
    if (seed.length() > ROOT_SEED_CHARS) {
      seed = seed.substring(0, ROOT_SEED_CHARS);
    }

    SearchOptions options =
        hybridSearchService.defaultOptions(channelId).toBuilder()
            .limit(config.getSearch().getRelatedLimit())
            .semanticWeight(RELATED_SEMANTIC_WEIGHT)
            .build();

    Set<String> threadIds =
        thread.stream().map(Message::id).filter(Objects::nonNull).collect(Collectors.toSet());
    List<ScoredMessage> related =
        hybridSearchService.search(seed, options).stream()
            .filter(s -> !threadIds.contains(s.id()))
            .toList();

    log.debug(
        "Thread {} in channel {}: {} messages, {} related",
        threadId,
        channelId,
        thread.size(),
        related.size());
    return new ThreadContext(thread, related);
  }
}
