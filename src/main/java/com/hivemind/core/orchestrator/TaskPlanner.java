package com.hivemind.core.orchestrator;

import com.hivemind.core.model.AgentDefinition;

import java.util.List;

/**
 * Decomposes a root objective into subtasks for the available agents.
 */
public interface TaskPlanner {

    /**
     * @param objective the root objective
     * @param agents    agents subtasks may be assigned to
     * @return subtasks in dispatch order, possibly empty
     */
    List<SubtaskSpec> plan(String objective, List<AgentDefinition> agents);
}
