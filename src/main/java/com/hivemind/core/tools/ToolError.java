package com.hivemind.core.tools;

/**
 * Why a tool call produced no output.
 *
 * @param kind   failure class
 * @param detail human-readable detail
 */
public record ToolError(Kind kind, String detail) {

    public enum Kind {
        /** No tool is registered under the requested name. */
        NOT_FOUND,
        /** The handler threw. */
        EXECUTION_FAILED,
        /** The handler exceeded its deadline. */
        TIMEOUT
    }
}
