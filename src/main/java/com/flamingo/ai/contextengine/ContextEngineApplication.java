package com.flamingo.ai.contextengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point of the chat context engine service. */
@SpringBootApplication
@EnableScheduling
public class ContextEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContextEngineApplication.class, args);
  }
}
