package com.flamingo.ai.contextengine.domain.model;

/** Decoding parameters derived from a mood. */
public record GenerationParameters(double temperature, int maxTokens) {}
