package com.hivemind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Static configuration of an agent. Session and cursor live in the store,
 * see {@link AgentCheckpoint}.
 *
 * @param id           unique agent id (e.g. "researcher-1")
 * @param role         role name used for routing subtasks (e.g. "RESEARCHER")
 * @param model        provider model name
 * @param systemPrompt system prompt sent with every exchange
 * @param tools        names of the tools this agent may invoke
 */
public record AgentDefinition(
    String id,
    String role,
    String model,
    String systemPrompt,
    List<String> tools
) implements Serializable {

    public AgentDefinition {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
