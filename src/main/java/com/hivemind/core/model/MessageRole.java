package com.hivemind.core.model;

/**
 * Author of a history entry.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL_RESULT
}
