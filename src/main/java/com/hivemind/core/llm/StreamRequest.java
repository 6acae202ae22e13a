package com.hivemind.core.llm;

import com.hivemind.core.tools.ToolDeclaration;

import java.util.List;

/**
 * Everything needed to open one streaming exchange.
 *
 * @param model        provider model name
 * @param systemPrompt system prompt (may be blank)
 * @param messages     ordered conversation: prior context, pending batch, then in-run tool turns
 * @param tools        tools the model may request
 * @param sessionId    current session identifier, null before the first committed exchange
 */
public record StreamRequest(
    String model,
    String systemPrompt,
    List<ConversationTurn> messages,
    List<ToolDeclaration> tools,
    String sessionId
) {

    public StreamRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
