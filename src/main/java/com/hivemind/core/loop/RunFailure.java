package com.hivemind.core.loop;

import java.io.Serializable;

/**
 * Structured failure of a run: enough for a caller to decide on further retry.
 *
 * @param kind   failure class
 * @param detail human-readable detail
 */
public record RunFailure(FailureKind kind, String detail) implements Serializable {

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /** One-line summary used in caveats and CLI output. */
    public String summary() {
        return kind + ": " + detail;
    }
}
