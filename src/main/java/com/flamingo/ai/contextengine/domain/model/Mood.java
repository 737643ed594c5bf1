package com.flamingo.ai.contextengine.domain.model;

import com.flamingo.ai.contextengine.domain.enums.MoodType;
import java.util.List;

/**
 * A mood selected for one request.
 *
 * @param type the mood from the closed set
 * @param intensity attenuated intensity in [0, 1]
 */
public record Mood(MoodType type, double intensity) {

  public Mood {
    intensity = Math.max(0.0, Math.min(1.0, intensity));
  }

  public static Mood neutral() {
    return new Mood(MoodType.NEUTRAL, MoodType.NEUTRAL.getBaseIntensity());
  }

  public String name() {
    return type.getLabel();
  }

  public List<String> triggerKeywords() {
    return type.getTriggers();
  }

  public ResponseModifiers responseModifiers() {
    return type.getModifiers();
  }
}
