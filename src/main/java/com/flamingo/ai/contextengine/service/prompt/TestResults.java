package com.flamingo.ai.contextengine.service.prompt;

import java.util.List;

/**
 * Results of a prompt test.
 *
 * @param winner best variant, or {@code null} until every variant has the minimum sample size
 * @param confidence confidence in [0, 0.99] that the top two variants differ in engagement
 */
public record TestResults(
    PromptTest test, List<VariantResult> results, PromptVariant winner, double confidence) {}
