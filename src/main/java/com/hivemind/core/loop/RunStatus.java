package com.hivemind.core.loop;

/**
 * Terminal outcome of one execution loop run.
 */
public enum RunStatus {
    /** Exchange completed and the cursor was committed. */
    SUCCEEDED,
    /** Retry budget exhausted or a non-retryable error; cursor unchanged. */
    FAILED,
    /** Stopped cooperatively at a suspension point; cursor unchanged. */
    CANCELLED,
    /** Nothing past the cursor, no model call was made. */
    IDLE
}
