package com.hivemind.core.orchestrator;

import com.hivemind.core.llm.LlmProperties;
import com.hivemind.core.llm.LlmService;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.SubtaskPlan;
import com.hivemind.core.model.SubtaskPlan.PlannedSubtask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmTaskPlannerTest {

    private static final List<AgentDefinition> AGENTS = List.of(
            new AgentDefinition("researcher-1", "RESEARCHER", "m", "", List.of("lookup")),
            new AgentDefinition("writer-1", "WRITER", "m", "", List.of()));

    private LlmService llmService;
    private LlmProperties properties;
    private LlmTaskPlanner planner;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new LlmProperties();
        planner = new LlmTaskPlanner(llmService, properties);
    }

    @Test
    @DisplayName("maps planned subtasks to specs in order")
    void mapsPlan() {
        when(llmService.structuredCall(anyString(), anyString(), eq(SubtaskPlan.class)))
                .thenReturn(new SubtaskPlan("Two parts", List.of(
                        new PlannedSubtask("RESEARCHER", " Find sources "),
                        new PlannedSubtask("writer-1", "Draft"))));

        List<SubtaskSpec> specs = planner.plan("Write a report", AGENTS);

        assertEquals(List.of(new SubtaskSpec("RESEARCHER", "Find sources"), new SubtaskSpec("writer-1", "Draft")),
                specs);
    }

    @Test
    @DisplayName("drops incomplete subtasks and tolerates a null list")
    void dropsIncomplete() {
        when(llmService.structuredCall(anyString(), anyString(), eq(SubtaskPlan.class)))
                .thenReturn(new SubtaskPlan("Mixed", Arrays.asList(
                        new PlannedSubtask("", "No agent"),
                        null,
                        new PlannedSubtask("WRITER", " "),
                        new PlannedSubtask("WRITER", "Keep me"))))
                .thenReturn(new SubtaskPlan("Nothing", null));

        assertEquals(List.of(new SubtaskSpec("WRITER", "Keep me")), planner.plan("x", AGENTS));
        assertTrue(planner.plan("y", AGENTS).isEmpty());
    }

    @Test
    @DisplayName("uses the configured system prompt when present")
    void configuredPrompt() {
        properties.setPlannerSystemPrompt("Custom planner");
        when(llmService.structuredCall(anyString(), anyString(), eq(SubtaskPlan.class)))
                .thenReturn(new SubtaskPlan("s", List.of()));

        planner.plan("x", AGENTS);

        verify(llmService).structuredCall(eq("Custom planner"), anyString(), eq(SubtaskPlan.class));
    }

    @Test
    @DisplayName("user prompt lists every agent with role and tools")
    void userPrompt() {
        String prompt = planner.buildUserPrompt("Write a report", AGENTS);

        assertTrue(prompt.startsWith("Objective: Write a report"));
        assertTrue(prompt.contains("- id: researcher-1, role: RESEARCHER, tools: lookup"));
        assertTrue(prompt.contains("- id: writer-1, role: WRITER\n"));
    }
}
