package com.flamingo.ai.contextengine.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for summarizing a channel's recent conversation.
 *
 * <p>Summaries are stored and later fed back to the model as compact conversation history.
 */
public interface ConversationSummaryAgent {

  @SystemMessage(
      """
        You summarize team chat conversations. Write a short paragraph that captures
        the main topics, decisions, open questions and who drove them.

        Guidelines:
        - Keep names and concrete details (dates, numbers, project names)
        - Skip greetings and small talk
        - At most 5 sentences
        """)
  @UserMessage(
      """
        Summarize this conversation:

        {{conversation}}
        """)
  String summarize(@V("conversation") String conversation);
}
