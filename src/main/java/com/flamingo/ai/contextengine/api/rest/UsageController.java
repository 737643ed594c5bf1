package com.flamingo.ai.contextengine.api.rest;

import com.flamingo.ai.contextengine.domain.enums.Complexity;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.service.mood.MoodEngine;
import com.flamingo.ai.contextengine.service.usage.ModelSelection;
import com.flamingo.ai.contextengine.service.usage.ModelSelectionCriteria;
import com.flamingo.ai.contextengine.service.usage.ModelSelector;
import com.flamingo.ai.contextengine.service.usage.UsageReport;
import com.flamingo.ai.contextengine.service.usage.UsageTracker;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for spend reporting and model tier previews. */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

  private final UsageTracker usageTracker;
  private final ModelSelector modelSelector;
  private final MoodEngine moodEngine;

  /**
   * Returns the spend report over the trailing days.
   *
   * @param days number of days including today
   */
  @GetMapping("/report")
  public ResponseEntity<UsageReport> report(
      @RequestParam(defaultValue = "7") @Min(1) @Max(90) int days) {
    return ResponseEntity.ok(usageTracker.generateReport(days));
  }

  /** Shows which model tier a query would be routed to right now. */
  @GetMapping("/model-selection")
  public ResponseEntity<ModelSelection> modelSelection(
      @RequestParam @NotBlank String query,
      @RequestParam(defaultValue = "0") @Min(0) int conversationLength,
      @RequestParam(defaultValue = "false") boolean requiresSearch) {
    Complexity complexity = moodEngine.assessComplexity(query, ContextWindow.empty());
    return ResponseEntity.ok(
        modelSelector.selectOptimalModel(
            query, new ModelSelectionCriteria(requiresSearch, conversationLength, complexity)));
  }
}
