package com.flamingo.ai.contextengine.api.rest;

import com.flamingo.ai.contextengine.api.dto.request.GenerateResponseRequest;
import com.flamingo.ai.contextengine.service.response.ResponseOrchestrator;
import com.flamingo.ai.contextengine.service.response.ResponseResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for generating replies. */
@RestController
@RequestMapping("/api/responses")
@RequiredArgsConstructor
@Slf4j
public class ResponseController {

  private final ResponseOrchestrator responseOrchestrator;

  /**
   * Generates a reply to a chat message. Always answers 200; failures produce the fallback reply.
   *
   * @param request the message and where it was posted
   * @return the reply with its metadata
   */
  @PostMapping
  public ResponseEntity<ResponseResult> generate(
      @Valid @RequestBody GenerateResponseRequest request) {
    log.debug(
        "Reply requested in channel {} by user {}", request.getChannelId(), request.getUserId());
    ResponseResult result =
        responseOrchestrator.generateResponse(
            request.getMessage(),
            request.getChannelId(),
            request.getUserId(),
            request.getUserName(),
            request.getThreadId());
    return ResponseEntity.ok(result);
  }
}
