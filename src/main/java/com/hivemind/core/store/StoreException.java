package com.hivemind.core.store;

/**
 * Thrown when the agent store cannot complete an operation, or when a commit
 * would violate cursor monotonicity.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
