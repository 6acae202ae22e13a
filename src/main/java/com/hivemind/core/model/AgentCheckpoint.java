package com.hivemind.core.model;

import java.io.Serializable;

/**
 * Durable progress marker of one agent: the last inbound position incorporated
 * into a committed exchange, and the provider session that exchange produced.
 *
 * @param agentId   the agent
 * @param cursor    last committed position (0 when nothing has been committed yet)
 * @param sessionId opaque provider session token (nullable before the first commit)
 */
public record AgentCheckpoint(
    String agentId,
    long cursor,
    String sessionId
) implements Serializable {

    public static AgentCheckpoint initial(String agentId) {
        return new AgentCheckpoint(agentId, 0L, null);
    }
}
