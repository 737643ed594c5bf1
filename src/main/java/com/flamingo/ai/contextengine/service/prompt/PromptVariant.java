package com.flamingo.ai.contextengine.service.prompt;

/**
 * One arm of a prompt test.
 *
 * @param systemPrompt system prompt used when the variant is selected, may be {@code null}
 * @param template optional response template with {@code {var}} placeholders
 */
public record PromptVariant(String id, String name, String systemPrompt, String template) {}
