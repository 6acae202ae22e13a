package com.hivemind.core.agent;

/**
 * Thrown when an agent id or role does not match any configured agent.
 */
public class UnknownAgentException extends RuntimeException {

    public UnknownAgentException(String agentOrRole) {
        super("No configured agent matches '" + agentOrRole + "'");
    }
}
