package com.flamingo.ai.contextengine.domain.enums;

import com.flamingo.ai.contextengine.domain.model.ResponseModifiers;
import java.util.List;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** The closed set of moods. Declaration order breaks scoring ties. */
@Getter
@RequiredArgsConstructor
public enum MoodType {
  EXCITED(
      "excited",
      0.8,
      List.of("ship", "deploy", "launch", "release", "merge", "production", "🚀"),
      new ResponseModifiers(0.9, 0.2, 0.9, 0.2)),
  SARCASTIC(
      "sarcastic",
      0.7,
      List.of("bug", "broken", "not working", "error", "failed", "oops", "🤦"),
      new ResponseModifiers(0.8, 0.0, 1.0, 0.1)),
  ANALYTICAL(
      "analytical",
      0.6,
      List.of("analyze", "data", "metrics", "performance", "why", "how does"),
      new ResponseModifiers(0.6, 0.5, 0.3, 0.7)),
  HELPFUL(
      "helpful",
      0.5,
      List.of("help", "how do i", "what is", "can someone", "stuck", "question"),
      new ResponseModifiers(0.7, 0.3, 0.4, 0.5)),
  NOSTALGIC(
      "nostalgic",
      0.6,
      List.of("remember when", "last time", "used to", "back in", "old days"),
      new ResponseModifiers(0.7, 0.2, 0.6, 0.3)),
  NEUTRAL("neutral", 0.5, List.of(), new ResponseModifiers(0.7, 0.0, 0.5, 0.4));

  private final String label;
  private final double baseIntensity;

  /** Lower-case trigger phrases matched against case-folded text. */
  private final List<String> triggers;

  private final ResponseModifiers modifiers;
}
