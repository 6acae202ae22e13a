package com.hivemind.core.loop;

import com.hivemind.core.model.Message;
import com.hivemind.core.model.ToolInvocationRecord;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of {@link ExecutionLoop#runAgent}.
 *
 * @param agentId         the agent that ran
 * @param status          terminal status of the run
 * @param cursor          committed cursor after the run (unchanged unless {@code SUCCEEDED})
 * @param sessionId       session identifier after the run
 * @param reply           final assistant text ({@code SUCCEEDED} only, nullable)
 * @param messages        inbound messages the last attempt read past the cursor
 * @param toolInvocations tool calls issued by the last attempt
 * @param failure         failure detail ({@code FAILED} only)
 * @param attempts        number of attempts made
 */
public record RunResult(
    String agentId,
    RunStatus status,
    long cursor,
    String sessionId,
    String reply,
    List<Message> messages,
    List<ToolInvocationRecord> toolInvocations,
    RunFailure failure,
    int attempts
) {

    public RunResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
        toolInvocations = toolInvocations == null ? List.of() : List.copyOf(toolInvocations);
    }

    public static RunResult idle(String agentId, long cursor, String sessionId, int attempts) {
        return new RunResult(agentId, RunStatus.IDLE, cursor, sessionId, null, List.of(), List.of(), null, attempts);
    }

    public static RunResult succeeded(String agentId, long cursor, String sessionId, String reply,
                                      List<Message> messages, List<ToolInvocationRecord> toolInvocations,
                                      int attempts) {
        return new RunResult(agentId, RunStatus.SUCCEEDED, cursor, sessionId, reply,
                messages, toolInvocations, null, attempts);
    }

    public static RunResult failed(String agentId, long cursor, String sessionId, List<Message> messages,
                                   List<ToolInvocationRecord> toolInvocations, RunFailure failure, int attempts) {
        return new RunResult(agentId, RunStatus.FAILED, cursor, sessionId, null,
                messages, toolInvocations, failure, attempts);
    }

    public static RunResult cancelled(String agentId, long cursor, String sessionId, List<Message> messages,
                                      List<ToolInvocationRecord> toolInvocations, int attempts) {
        return new RunResult(agentId, RunStatus.CANCELLED, cursor, sessionId, null,
                messages, toolInvocations, null, attempts);
    }

    public boolean isSucceeded() {
        return status == RunStatus.SUCCEEDED;
    }

    /** Distinct orchestration task ids of {@link #messages}, in position order. */
    public Set<String> taskIds() {
        var ids = new LinkedHashSet<String>();
        for (Message message : messages) {
            if (message.belongsToTask()) {
                ids.add(message.taskId());
            }
        }
        return ids;
    }
}
