package com.flamingo.ai.chainsearch.agent;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.service.TokenStream;
import java.util.List;

/**
 * AI agent for the workspace assistant.
 *
 * <p>The message list is assembled by the service (date, persona, retrieved chat context and the
 * user's turns), so the interface carries no prompt annotations.
 */
public interface WorkspaceAssistantAgent {

  TokenStream chat(List<ChatMessage> messages);
}
