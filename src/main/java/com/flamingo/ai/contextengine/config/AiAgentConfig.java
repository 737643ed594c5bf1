package com.flamingo.ai.contextengine.config;

import com.flamingo.ai.contextengine.agent.ConversationSummaryAgent;
import com.flamingo.ai.contextengine.agent.UserProfileAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents handle the background text tasks; per-turn replies go through the completion provider
 * so that model, temperature and length can change per request.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public UserProfileAgent userProfileAgent(ChatModel chatModel) {
    return AiServices.builder(UserProfileAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public ConversationSummaryAgent conversationSummaryAgent(ChatModel chatModel) {
    return AiServices.builder(ConversationSummaryAgent.class).chatModel(chatModel).build();
  }
}
