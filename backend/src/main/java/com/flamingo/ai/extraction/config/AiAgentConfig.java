package com.flamingo.ai.extraction.config;

import com.flamingo.ai.extraction.agent.FieldDiscoveryAgent;
import com.flamingo.ai.extraction.agent.FieldExtractionAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the discovery and extraction agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Field discovery agent. Stateless, so one instance serves every pass of every document. */
  @Bean
  public FieldDiscoveryAgent fieldDiscoveryAgent(ChatModel chatModel) {
    return AiServices.builder(FieldDiscoveryAgent.class).chatModel(chatModel).build();
  }

  /** Field extraction agent. Called concurrently by the agent pool, one call per page range. */
  @Bean
  public FieldExtractionAgent fieldExtractionAgent(ChatModel chatModel) {
    return AiServices.builder(FieldExtractionAgent.class).chatModel(chatModel).build();
  }
}
