package com.flamingo.ai.contextengine.domain.model;

/**
 * Generation modifiers carried by a mood.
 *
 * @param temperature target decoding temperature; the applied shift from the 0.7 baseline is
 *     scaled by the mood's intensity
 * @param lengthBias -1 (shorter) to 1 (longer)
 * @param humorLevel 0 to 1
 * @param formalityLevel 0 to 1
 */
public record ResponseModifiers(
    double temperature, double lengthBias, double humorLevel, double formalityLevel) {}
