package com.hivemind.core.store;

import com.hivemind.core.model.AgentCheckpoint;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for agent history, per-agent progress checkpoints and
 * orchestration task trees.
 * <p>
 * Implementations must give read-your-writes consistency per agent: a committed
 * cursor is visible to the next {@link #getCheckpoint} for the same agent.
 * No cross-agent transactions are required.
 */
public interface AgentStore {

    /**
     * Appends a message at the next sequence position of {@code agentId}.
     *
     * @param taskId orchestration task the message belongs to, or null
     * @return the stored message with its assigned position
     */
    Message appendMessage(String agentId, MessageRole role, String content, String taskId);

    /**
     * Returns all messages of {@code agentId} with position strictly greater than
     * {@code cursor}, ordered by position.
     */
    List<Message> readMessagesSince(String agentId, long cursor);

    /**
     * Returns up to {@code limit} of the most recent history entries at or before
     * {@code throughPosition}: inbound messages plus committed assistant replies.
     * A reply is reported as an {@link MessageRole#ASSISTANT} message whose
     * position is the cursor it answered, ordered after the inbound message at
     * that position.
     */
    List<Message> readContext(String agentId, long throughPosition, int limit);

    /** Current cursor and session of the agent; a zero cursor if nothing was committed. */
    AgentCheckpoint getCheckpoint(String agentId);

    /**
     * Atomically advances the cursor and replaces the session identifier.
     *
     * @throws StoreException if {@code cursor} is lower than the committed cursor
     *                        or higher than the highest appended position
     */
    default void commitCursor(String agentId, long cursor, String sessionId) {
        commitExchange(agentId, cursor, sessionId, null);
    }

    /**
     * Like {@link #commitCursor} but also records the assistant's final reply for
     * the exchange, in the same atomic step.
     *
     * @param reply final assistant text, or null to record none
     */
    void commitExchange(String agentId, long cursor, String sessionId, String reply);

    /**
     * Creates a task in {@link TaskStatus#PENDING}.
     *
     * @param parentId parent task id, or null for a root
     */
    Task createTask(String parentId, String agentId, String objective);

    /**
     * Moves a task forward.
     *
     * @param result result payload to record (nullable, keeps the previous one)
     * @param error  error detail to record (nullable, keeps the previous one)
     * @return the updated task
     * @throws com.hivemind.core.model.IllegalTaskTransitionException if the move is not allowed
     * @throws StoreException if the task does not exist
     */
    Task updateTaskStatus(String taskId, TaskStatus status, String result, String error);

    Optional<Task> getTask(String taskId);

    /**
     * Returns the task {@code rootId} followed by all its descendants,
     * breadth-first, siblings in creation order. Empty if the task does not exist.
     */
    List<Task> getTaskTree(String rootId);
}
