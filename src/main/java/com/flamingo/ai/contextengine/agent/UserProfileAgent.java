package com.flamingo.ai.contextengine.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that condenses a user's recent messages into a short personality profile. */
public interface UserProfileAgent {

  @SystemMessage("You are an expert at reading people and describing them cleverly.")
  @UserMessage(
      """
        Analyze these messages from {{userName}} and create a personality profile
        (2-3 sentences, witty):

        Messages:
        {{messages}}

        Profile:
        """)
  String describe(@V("userName") String userName, @V("messages") String messages);
}
