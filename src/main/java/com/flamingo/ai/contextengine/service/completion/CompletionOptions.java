package com.flamingo.ai.contextengine.service.completion;

/** Per-call decoding parameters; {@code model} overrides the configured default model. */
public record CompletionOptions(double temperature, int maxTokens, String model) {}
