package com.hivemind.core.scheduler;

/**
 * Scheduling state of one agent.
 */
public enum AgentState {
    IDLE,
    RUNNING
}
