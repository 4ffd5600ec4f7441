package com.flamingo.ai.chainsearch.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that situates a message chain within its conversation.
 *
 * <p>Short chat messages ("same", "see attached") embed poorly on their own. The agent reads the
 * whole channel or conversation transcript and returns a 1-2 sentence context that is prepended to
 * the chain text before embedding.
 */
public interface ChainContextAgent {

  @SystemMessage(
      """
        You are a chat context analyzer. Please respond with an extremely concise context
        summary only.
        """)
  @UserMessage(
      """
        <conversation>
        {{conversation}}
        </conversation>

        <chunk>
        {{chunk}}
        </chunk>

        Please provide a brief (1-2 sentences) context summarizing the chunk's relevance in the
        conversation. Return only the context, no extraneous text.
        """)
  String situate(@V("conversation") String conversation, @V("chunk") String chunk);
}
