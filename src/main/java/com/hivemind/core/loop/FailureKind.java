package com.hivemind.core.loop;

import com.hivemind.core.llm.ModelErrorKind;

/**
 * Classification of a failed run attempt.
 */
public enum FailureKind {
    RATE_LIMITED(true),
    OVERLOADED(true),
    NETWORK_FAILURE(true),
    STORE_FAILURE(true),
    INVALID_REQUEST(false),
    AUTH_FAILURE(false),
    TOOL_LOOP_EXCEEDED(false),
    INTERNAL(false);

    private final boolean retryable;

    FailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static FailureKind from(ModelErrorKind kind) {
        if (kind == null) return NETWORK_FAILURE;
        return switch (kind) {
            case RATE_LIMITED -> RATE_LIMITED;
            case OVERLOADED -> OVERLOADED;
            case NETWORK_FAILURE -> NETWORK_FAILURE;
            case INVALID_REQUEST -> INVALID_REQUEST;
            case AUTH_FAILURE -> AUTH_FAILURE;
        };
    }
}
