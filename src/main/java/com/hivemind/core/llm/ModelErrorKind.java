package com.hivemind.core.llm;

/**
 * Error classes reported by a model provider.
 */
public enum ModelErrorKind {
    RATE_LIMITED(true),
    OVERLOADED(true),
    NETWORK_FAILURE(true),
    INVALID_REQUEST(false),
    AUTH_FAILURE(false);

    private final boolean retryable;

    ModelErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
