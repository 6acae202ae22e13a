package com.hivemind.core.tools;

/**
 * Outcome of one tool call: either an output payload or a {@link ToolError}.
 */
public record ToolResult(String output, ToolError error, long elapsedMs) {

    public static ToolResult success(String output, long elapsedMs) {
        return new ToolResult(output == null ? "" : output, null, elapsedMs);
    }

    public static ToolResult failure(ToolError.Kind kind, String detail, long elapsedMs) {
        return new ToolResult(null, new ToolError(kind, detail), elapsedMs);
    }

    public boolean isError() {
        return error != null;
    }

    /** Content of the tool-result message sent back to the model. */
    public String render() {
        if (!isError()) return output;
        return "ERROR [" + error.kind() + "]: " + error.detail();
    }
}
