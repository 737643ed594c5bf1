package com.flamingo.ai.contextengine.service.response;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/** Process-local interjection state. */
@Component
public class InMemoryInterjectionStateStore implements InterjectionStateStore {

  private final Map<String, Instant> lastByChannel = new ConcurrentHashMap<>();

  @Override
  public Optional<Instant> lastInterjection(String channelId) {
    return Optional.ofNullable(lastByChannel.get(channelId));
  }

  @Override
  public void recordInterjection(String channelId, Instant at) {
    lastByChannel.merge(channelId, at, (old, now) -> now.isAfter(old) ? now : old);
  }
}
