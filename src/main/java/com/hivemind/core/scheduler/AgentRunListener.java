package com.hivemind.core.scheduler;

import com.hivemind.core.loop.RunResult;

/**
 * Completion signal of an execution loop run.
 * <p>
 * Called on the agent's worker thread before the scheduler starts a follow-up
 * run or returns the agent to idle, so implementations must not block.
 */
@FunctionalInterface
public interface AgentRunListener {

    void onRunCompleted(RunResult result);
}
