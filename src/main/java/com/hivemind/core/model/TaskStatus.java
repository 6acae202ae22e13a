package com.hivemind.core.model;

/**
 * Status of a task in an orchestration tree.
 * <p>
 * Forward-only: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED}; any
 * non-terminal status may move to {@code CANCELLED}.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == null || isTerminal()) return false;
        return switch (next) {
            case PENDING -> false;
            case RUNNING -> this == PENDING;
            case SUCCEEDED, FAILED -> this == RUNNING;
            case CANCELLED -> true;
        };
    }
}
