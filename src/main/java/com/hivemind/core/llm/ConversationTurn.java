package com.hivemind.core.llm;

import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;

import java.util.List;

/**
 * Provider-neutral conversation entry sent with a {@link StreamRequest}.
 *
 * @param role       author
 * @param content    text content
 * @param toolCalls  tool calls requested by an assistant turn (empty otherwise)
 * @param toolCallId call id a tool result answers (tool results only)
 * @param toolName   tool a result belongs to (tool results only)
 * @param error      whether a tool result reports a failure
 */
public record ConversationTurn(
    MessageRole role,
    String content,
    List<StreamEvent.ToolCall> toolCalls,
    String toolCallId,
    String toolName,
    boolean error
) {

    public ConversationTurn {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        content = content == null ? "" : content;
    }

    public static ConversationTurn of(Message message) {
        return new ConversationTurn(message.role(), message.content(), List.of(), null, null, false);
    }

    public static ConversationTurn user(String content) {
        return new ConversationTurn(MessageRole.USER, content, List.of(), null, null, false);
    }

    public static ConversationTurn assistant(String content, List<StreamEvent.ToolCall> toolCalls) {
        return new ConversationTurn(MessageRole.ASSISTANT, content, toolCalls, null, null, false);
    }

    public static ConversationTurn toolResult(StreamEvent.ToolCall call, String content, boolean error) {
        return new ConversationTurn(MessageRole.TOOL_RESULT, content, List.of(), call.callId(), call.name(), error);
    }
}
