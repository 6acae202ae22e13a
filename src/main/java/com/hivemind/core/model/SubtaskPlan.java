package com.hivemind.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured output from the LLM decomposing an objective into subtasks.
 *
 * @param summary  one-line restatement of the objective
 * @param subtasks ordered subtasks; creation order is dispatch order
 */
public record SubtaskPlan(
    String summary,
    List<PlannedSubtask> subtasks
) implements Serializable {

    /**
     * @param agent     agent role or explicit agent id
     * @param objective sub-objective sent to that agent as its first message
     */
    public record PlannedSubtask(
        String agent,
        String objective
    ) implements Serializable {}
}
