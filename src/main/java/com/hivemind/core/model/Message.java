package com.hivemind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An immutable entry in an agent's inbound history.
 *
 * @param agentId   the agent this message was delivered to
 * @param position  sequence position, strictly increasing per agent and starting at 1
 * @param role      author of the content
 * @param content   message text
 * @param taskId    orchestration task this message belongs to (nullable)
 * @param createdAt when the message was appended
 */
public record Message(
    String agentId,
    long position,
    MessageRole role,
    String content,
    String taskId,
    Instant createdAt
) implements Serializable {

    public boolean belongsToTask() {
        return taskId != null && !taskId.isBlank();
    }
}
