package com.flamingo.ai.flowbridge.config;

import com.flamingo.ai.flowbridge.agent.SectionGenerationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
@ConditionalOnProperty(name = "flowbridge.generation.strategy", havingValue = "llm")
public class AiAgentConfig {

  /** Section generation agent. Uses the JSON-format ChatModel for a document-shaped reply. */
  @Bean
  public SectionGenerationAgent sectionGenerationAgent(ChatModel chatModel) {
    return AiServices.builder(SectionGenerationAgent.class).chatModel(chatModel).build();
  }
}
