package com.flamingo.ai.contextengine.service.usage;

/**
 * The chosen model tier.
 *
 * @param model provider model id
 * @param reasoning human-readable explanation of the choice
 * @param estimatedCost projected cost of the call in USD
 */
public record ModelSelection(String model, String reasoning, double estimatedCost) {}
