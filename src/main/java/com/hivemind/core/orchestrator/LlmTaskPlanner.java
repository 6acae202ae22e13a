package com.hivemind.core.orchestrator;

import com.hivemind.core.llm.LlmProperties;
import com.hivemind.core.llm.LlmService;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.SubtaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Asks the model for a {@link SubtaskPlan} over the configured agents.
 */
@Component
public class LlmTaskPlanner implements TaskPlanner {

    private static final Logger log = LoggerFactory.getLogger(LlmTaskPlanner.class);

    static final String DEFAULT_SYSTEM_PROMPT = """
            You are the orchestrator of a team of AI agents. Break the user's objective
            into independent subtasks that can run in parallel, and assign each one to
            exactly one of the listed agents, by role or by id.

            Rules:
            - Only use the agents listed. Never invent roles.
            - Each subtask objective must be self-contained: the agent sees nothing else.
            - Prefer few, substantial subtasks over many trivial ones.
            - If the objective is simple enough to answer without delegation, return no subtasks.
            """;

    private final LlmService llmService;
    private final LlmProperties properties;

    public LlmTaskPlanner(LlmService llmService, LlmProperties properties) {
        this.llmService = llmService;
        this.properties = properties;
    }

    @Override
    public List<SubtaskSpec> plan(String objective, List<AgentDefinition> agents) {
        String systemPrompt = properties.hasPlannerSystemPrompt()
                ? properties.getPlannerSystemPrompt()
                : DEFAULT_SYSTEM_PROMPT;
        SubtaskPlan plan = llmService.structuredCall(systemPrompt, buildUserPrompt(objective, agents),
                SubtaskPlan.class);

        var specs = new ArrayList<SubtaskSpec>();
        if (plan.subtasks() != null) {
            for (SubtaskPlan.PlannedSubtask subtask : plan.subtasks()) {
                if (subtask == null || isBlank(subtask.agent()) || isBlank(subtask.objective())) {
                    log.warn("Dropping incomplete planned subtask {}", subtask);
                    continue;
                }
                specs.add(new SubtaskSpec(subtask.agent().trim(), subtask.objective().trim()));
            }
        }
        log.info("Planned {} subtask(s): {}", specs.size(), plan.summary());
        return specs;
    }

    String buildUserPrompt(String objective, List<AgentDefinition> agents) {
        var sb = new StringBuilder();
        sb.append("Objective: ").append(objective).append("\n\nAvailable agents:\n");
        for (AgentDefinition agent : agents) {
            sb.append("- id: ").append(agent.id())
              .append(", role: ").append(agent.role());
            if (!agent.tools().isEmpty()) {
                sb.append(", tools: ").append(String.join(", ", agent.tools()));
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
