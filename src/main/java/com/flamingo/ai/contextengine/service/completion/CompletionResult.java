package com.flamingo.ai.contextengine.service.completion;

/** Generated text with the token counts reported by the provider. */
public record CompletionResult(String text, int promptTokens, int completionTokens, String model) {}
