package com.hivemind.core.loop;

/**
 * Raised inside a run when its {@link CancellationToken} fires. Never escapes
 * {@link ExecutionLoop#runAgent}.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String reason) {
        super(reason);
    }
}
