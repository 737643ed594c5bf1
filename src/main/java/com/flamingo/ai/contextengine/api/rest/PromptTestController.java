package com.flamingo.ai.contextengine.api.rest;

import com.flamingo.ai.contextengine.api.dto.request.CreatePromptTestRequest;
import com.flamingo.ai.contextengine.api.dto.request.TrackMetricsRequest;
import com.flamingo.ai.contextengine.service.prompt.PromptTest;
import com.flamingo.ai.contextengine.service.prompt.PromptVariantSelector;
import com.flamingo.ai.contextengine.service.prompt.TestResults;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for prompt A/B tests. */
@RestController
@RequestMapping("/api/prompt-tests")
@RequiredArgsConstructor
@Slf4j
public class PromptTestController {

  private final PromptVariantSelector promptVariantSelector;

  /**
   * Creates and activates a prompt test.
   *
   * @param request the test definition
   * @return the created test
   */
  @PostMapping
  public ResponseEntity<PromptTest> create(@Valid @RequestBody CreatePromptTestRequest request) {
    log.info("Creating prompt test {} of type {}", request.getName(), request.getType());
    PromptTest test =
        promptVariantSelector.createTest(
            request.getName(), request.getType(), request.toVariants(), request.getAllocation());
    return ResponseEntity.status(HttpStatus.CREATED).body(test);
  }

  @GetMapping
  public ResponseEntity<List<PromptTest>> list() {
    return ResponseEntity.ok(promptVariantSelector.listTests());
  }

  @GetMapping("/{testId}")
  public ResponseEntity<PromptTest> get(@PathVariable String testId) {
    return ResponseEntity.ok(promptVariantSelector.getTest(testId));
  }

  /** Per-variant aggregates, winner and confidence. */
  @GetMapping("/{testId}/results")
  public ResponseEntity<TestResults> results(@PathVariable String testId) {
    return ResponseEntity.ok(promptVariantSelector.getTestResults(testId));
  }

  /** Records outcome signals observed outside the engine, such as user reactions. */
  @PostMapping("/{testId}/variants/{variantId}/metrics")
  public ResponseEntity<Void> trackMetrics(
      @PathVariable String testId,
      @PathVariable String variantId,
      @Valid @RequestBody TrackMetricsRequest request) {
    promptVariantSelector.trackMetrics(testId, variantId, request.toUpdate());
    return ResponseEntity.accepted().build();
  }

  /** Completes a test; its variants are no longer served. */
  @PostMapping("/{testId}/end")
  public ResponseEntity<PromptTest> end(@PathVariable String testId) {
    return ResponseEntity.ok(promptVariantSelector.endTest(testId));
  }
}
