package com.hivemind.core.orchestrator;

import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

/**
 * Terminal state of one child task, as seen by synthesis.
 */
public record ChildOutcome(
    String taskId,
    String agentId,
    String objective,
    TaskStatus status,
    String result,
    String error
) {

    public static ChildOutcome from(Task task) {
        return new ChildOutcome(task.id(), task.agentId(), task.objective(),
                task.status(), task.result(), task.error());
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    /**
     * Caveat line naming this subtask and why it produced no result, or null
     * if it succeeded.
     */
    public String caveat() {
        if (isSucceeded()) return null;
        String reason = error != null && !error.isBlank() ? error : "no detail";
        String verb = status == TaskStatus.CANCELLED ? "was cancelled" : "failed";
        return "Subtask " + taskId + " (" + agentId + ": " + objective + ") " + verb + ": " + reason;
    }
}
