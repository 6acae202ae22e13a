package com.hivemind.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by agent runs and orchestration, consumed by presentation
 * (CLI watch mode) and diagnostics.
 *
 * @param eventType event type (e.g. "run.started", "agent.text", "task.succeeded")
 * @param agentId   the agent this event relates to (nullable for tree-level events)
 * @param taskId    the task this event relates to (nullable for plain agent runs)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record HivemindEvent(
    String eventType,
    String agentId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static HivemindEvent of(String eventType, String agentId, String taskId, Map<String, Object> payload) {
        return new HivemindEvent(eventType, agentId, taskId, payload, Instant.now());
    }
}
