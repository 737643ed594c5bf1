package com.flamingo.ai.contextengine.service.response;

import java.time.Instant;
import java.util.Optional;

/** Per-channel record of when the agent last spoke up unprompted. */
public interface InterjectionStateStore {

  Optional<Instant> lastInterjection(String channelId);

  void recordInterjection(String channelId, Instant at);
}
