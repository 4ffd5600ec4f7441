package com.flamingo.ai.chainsearch.config;

import com.flamingo.ai.chainsearch.agent.ChainContextAgent;
import com.flamingo.ai.chainsearch.agent.WorkspaceAssistantAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are interfaces annotated with @SystemMessage/@UserMessage; AiServices.builder() creates
 * the implementation. They are held by the services that call them, never looked up globally.
 */
@Configuration
public class AiAgentConfig {

  /** Chain context agent. Uses the low-temperature, short-output chat model. */
  @Bean
  public ChainContextAgent chainContextAgent(ChatModel chatModel) {
    return AiServices.builder(ChainContextAgent.class).chatModel(chatModel).build();
  }

  /** Workspace assistant agent, streaming token by token. */
  @Bean
  public WorkspaceAssistantAgent workspaceAssistantAgent(StreamingChatModel streamingChatModel) {
    return AiServices.builder(WorkspaceAssistantAgent.class)
        .streamingChatModel(streamingChatModel)
        .build();
  }
}
