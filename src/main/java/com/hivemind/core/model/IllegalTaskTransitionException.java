package com.hivemind.core.model;

/**
 * Thrown when a task status update would move the task backwards, out of a
 * terminal state, or mark a parent succeeded while children are still active.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(String taskId, TaskStatus from, TaskStatus to, String reason) {
        super("Task " + taskId + " cannot move " + from + " -> " + to + ": " + reason);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() { return taskId; }
    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo() { return to; }
}
