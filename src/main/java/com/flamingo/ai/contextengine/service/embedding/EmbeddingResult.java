package com.flamingo.ai.contextengine.service.embedding;

import java.util.List;

/** A single embedding vector plus the prompt tokens the provider billed for it. */
public record EmbeddingResult(List<Float> vector, int tokens) {}
