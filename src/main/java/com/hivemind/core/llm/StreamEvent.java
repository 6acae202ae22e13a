package com.hivemind.core.llm;

/**
 * One event of a streaming model exchange.
 */
public sealed interface StreamEvent
        permits StreamEvent.TextDelta, StreamEvent.ToolCall, StreamEvent.Stop, StreamEvent.Failure {

    /** Stop reason of a completed turn. */
    String END_TURN = "end_turn";
    /** Stop reason of a turn that requested tools and awaits their results. */
    String TOOL_USE = "tool_use";

    record TextDelta(String text) implements StreamEvent {}

    /**
     * @param callId provider id correlating the request with its result
     * @param name   requested tool
     * @param input  JSON input payload
     */
    record ToolCall(String callId, String name, String input) implements StreamEvent {}

    /**
     * @param reason    provider stop reason, normalised to {@link #END_TURN} or {@link #TOOL_USE} where known
     * @param sessionId session identifier for the conversation (nullable when the provider has none)
     */
    record Stop(String reason, String sessionId) implements StreamEvent {

        public boolean awaitsToolResults() {
            return TOOL_USE.equals(reason);
        }
    }

    record Failure(ModelErrorKind kind, String detail) implements StreamEvent {}
}
