package com.flamingo.ai.contextengine.service.mood;

import com.flamingo.ai.contextengine.domain.enums.Complexity;
import com.flamingo.ai.contextengine.domain.enums.MoodType;
import com.flamingo.ai.contextengine.domain.model.ContextWindow;
import com.flamingo.ai.contextengine.domain.model.GenerationParameters;
import com.flamingo.ai.contextengine.domain.model.Mood;
import com.flamingo.ai.contextengine.domain.model.ResponseModifiers;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Keyword-triggered mood selection and the generation tweaks that follow from it.
 *
 * <p>Mood selection is a pure function of the conversation text. Only {@link #postProcess} uses
 * randomness, drawn from the injected generator.
 */
@Service
@Slf4j
public class MoodEngine {

  static final double BASE_TEMPERATURE = 0.7;
  static final int BASE_MAX_TOKENS = 200;
  static final int MIN_MAX_TOKENS = 100;
  static final int MAX_MAX_TOKENS = 400;
  static final int RECENT_HISTORY = 3;

  private static final List<String> QUESTION_WORDS =
      List.of("why", "how", "what", "when", "where", "analyze", "explain");
  private static final List<String> TECHNICAL_TERMS =
      List.of("api", "database", "algorithm", "function", "error", "debug");
  private static final Pattern I_AM = Pattern.compile("\\bI am\\b");
  private static final Pattern YOU_ARE = Pattern.compile("\\bYou are\\b");
  private static final Pattern IT_IS = Pattern.compile("\\bIt is\\b");

  private final Random random;
  private final MeterRegistry meterRegistry;

  public MoodEngine(@Qualifier("engineRandom") Random random, MeterRegistry meterRegistry) {
    this.random = random;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Picks the mood of the conversation.
   *
   * @param history earlier message texts, oldest first
   * @param current the inbound message
   * @return the highest scoring mood, or neutral when no trigger matches
   */
  public Mood determineMood(List<String> history, String current) {
    List<String> window = new ArrayList<>(history != null ? history : List.of());
    window.add(current != null ? current : "");
    String text = fold(String.join(" ", window));

    MoodType best = null;
    double bestScore = 0.0;
    for (MoodType type : MoodType.values()) {
      int count = 0;
      for (String trigger : type.getTriggers()) {
        count += countOccurrences(text, trigger);
      }
      double score = count * type.getBaseIntensity();
      if (score > bestScore) {
        bestScore = score;
        best = type;
      }
    }

    if (best == null) {
      meterRegistry.counter("mood.selected", "mood", MoodType.NEUTRAL.getLabel()).increment();
      return Mood.neutral();
    }

    List<String> recent = new ArrayList<>();
    int historySize = window.size() - 1;
    recent.addAll(window.subList(Math.max(0, historySize - RECENT_HISTORY), historySize));
    recent.add(window.get(historySize));

    Set<String> inWindow = triggersFound(best, text);
    Set<String> inRecent = triggersFound(best, fold(String.join(" ", recent)));
    double confidence = inWindow.isEmpty() ? 0.0 : (double) inRecent.size() / inWindow.size();
    double intensity = best.getBaseIntensity() * (0.5 + 0.5 * confidence);

    Mood mood = new Mood(best, intensity);
    meterRegistry.counter("mood.selected", "mood", best.getLabel()).increment();
    log.debug("Mood {} (score {}, confidence {})", mood.name(), bestScore, confidence);
    return mood;
  }

  /** Decoding parameters for a mood: a temperature shift scaled by intensity, and a length. */
  public GenerationParameters generationParameters(Mood mood) {
    ResponseModifiers modifiers = mood.responseModifiers();
    double temperature =
        BASE_TEMPERATURE + (modifiers.temperature() - BASE_TEMPERATURE) * mood.intensity();
    int maxTokens =
        (int) Math.round(BASE_MAX_TOKENS * (1 + modifiers.lengthBias()));
    maxTokens = Math.max(MIN_MAX_TOKENS, Math.min(MAX_MAX_TOKENS, maxTokens));
    return new GenerationParameters(temperature, maxTokens);
  }

  /** Applies light stylistic touches to a generated reply. */
  public String postProcess(String text, Mood mood) {
    if (text == null || text.isEmpty()) {
      return text;
    }
    String result = text;

    if (mood.type() == MoodType.EXCITED && mood.intensity() > 0.7) {
      if (!result.contains("!") && random.nextDouble() < mood.intensity() && result.endsWith(".")) {
        result = result.substring(0, result.length() - 1) + "!";
      }
      if (random.nextDouble() < mood.intensity() * 0.5) {
        result = result + " 🚀";
      }
    }

    if (mood.type() == MoodType.SARCASTIC
        && mood.intensity() > 0.6
        && random.nextDouble() < mood.intensity() * 0.3) {
      result = "*" + result + "*";
    }

    if (mood.responseModifiers().formalityLevel() < 0.3) {
      result = I_AM.matcher(result).replaceAll("I'm");
      result = YOU_ARE.matcher(result).replaceAll("You're");
      result = IT_IS.matcher(result).replaceAll("It's");
    }
    return result;
  }

  /**
   * Rates how demanding a message is from its length, question words, technical terms and the
   * amount of context around it.
   */
  public Complexity assessComplexity(String message, ContextWindow context) {
    String text = fold(message != null ? message : "");
    int score = 0;

    if (text.length() > 100) {
      score++;
    }
    long questionWords = QUESTION_WORDS.stream().filter(text::contains).count();
    if (questionWords > 1) {
      score++;
    }
    if (TECHNICAL_TERMS.stream().anyMatch(text::contains)) {
      score++;
    }
    if (context != null
        && context.getRecentMessages().size() + context.getRelevantMessages().size() > 30) {
      score++;
    }

    if (score >= 3) {
      return Complexity.COMPLEX;
    }
    return score >= 1 ? Complexity.MODERATE : Complexity.SIMPLE;
  }

  static int countOccurrences(String text, String needle) {
    if (needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int from = 0;
    int index;
    while ((index = text.indexOf(needle, from)) >= 0) {
      count++;
      from = index + needle.length();
    }
    return count;
  }

  private static Set<String> triggersFound(MoodType type, String text) {
    Set<String> found = new HashSet<>();
    for (String trigger : type.getTriggers()) {
      if (text.contains(trigger)) {
        found.add(trigger);
      }
    }
    return found;
  }

  private static String fold(String text) {
    return text.toLowerCase(Locale.ROOT);
  }
}
