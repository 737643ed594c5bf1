package com.flamingo.ai.contextengine.api.rest;

import com.flamingo.ai.contextengine.api.dto.request.BuildContextRequest;
import com.flamingo.ai.contextengine.api.dto.response.ContextResponse;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.service.context.ContextAssemblyService;
import com.flamingo.ai.contextengine.service.context.ContextOptions;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for inspecting assembled context windows. */
@RestController
@RequestMapping("/api/context")
@RequiredArgsConstructor
public class ContextController {

  private final ContextAssemblyService contextAssemblyService;

  /** Builds the context window the generator would see for a query. */
  @PostMapping
  public ResponseEntity<ContextResponse> build(@Valid @RequestBody BuildContextRequest request) {
    ContextOptions.ContextOptionsBuilder options =
        contextAssemblyService.defaultOptions().toBuilder().threadId(request.getThreadId());
    if (request.getMaxTokens() != null) {
      options.maxTokens(request.getMaxTokens());
    }
    if (request.getRecentLimit() != null) {
      options.recentLimit(request.getRecentLimit());
    }
    if (request.getRelevantLimit() != null) {
      options.relevantLimit(request.getRelevantLimit());
    }
    ContextWindow window =
        contextAssemblyService.buildContext(
            request.getChannelId(), request.getQuery(), options.build());
    return ResponseEntity.ok(ContextResponse.fromWindow(window));
  }

  /** Drops all cached context windows. */
  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    contextAssemblyService.clearCache();
    return ResponseEntity.noContent().build();
  }
}
