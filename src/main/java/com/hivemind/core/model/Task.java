package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collection;

/**
 * A node in an orchestration tree: one unit of delegated work bound to an agent.
 *
 * @param id          unique identifier (e.g. "TASK-3f2a91c0")
 * @param parentId    parent task id, null for a root
 * @param agentId     agent the task is assigned to
 * @param objective   what the assigned agent is asked to accomplish
 * @param status      current status
 * @param result      result payload once succeeded (nullable)
 * @param error       error detail once failed or cancelled (nullable)
 * @param createdAt   creation time
 * @param completedAt time the task reached a terminal status (nullable)
 */
public record Task(
    String id,
    String parentId,
    String agentId,
    String objective,
    TaskStatus status,
    String result,
    String error,
    Instant createdAt,
    Instant completedAt
) implements Serializable {

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * Returns a copy moved to {@code next}, or throws if the move is not allowed.
     *
     * @param children current children of this task, consulted for {@link TaskStatus#SUCCEEDED}
     */
    public Task transition(TaskStatus next, String result, String error, Collection<Task> children, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(id, status, next, "not a forward transition");
        }
        if (next == TaskStatus.SUCCEEDED && children != null) {
            for (Task child : children) {
                if (!child.status().isTerminal()) {
                    throw new IllegalTaskTransitionException(id, status, next,
                            "child " + child.id() + " is still " + child.status());
                }
            }
        }
        return new Task(id, parentId, agentId, objective, next,
                result != null ? result : this.result,
                error != null ? error : this.error,
                createdAt,
                next.isTerminal() ? now : completedAt);
    }
}
