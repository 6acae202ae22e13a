package com.hivemind.core.orchestrator;

/**
 * A subtask to create under a root task.
 *
 * @param agent     agent role or explicit agent id
 * @param objective first message sent to the chosen agent
 */
public record SubtaskSpec(String agent, String objective) {

    /**
     * Parses {@code role=objective}, as accepted on the command line.
     *
     * @throws IllegalArgumentException if there is no {@code =} or either side is blank
     */
    public static SubtaskSpec parse(String text) {
        int eq = text == null ? -1 : text.indexOf('=');
        if (eq <= 0 || eq == text.length() - 1) {
            throw new IllegalArgumentException("Expected agent=objective but got '" + text + "'");
        }
        String agent = text.substring(0, eq).trim();
        String objective = text.substring(eq + 1).trim();
        if (agent.isEmpty() || objective.isEmpty()) {
            throw new IllegalArgumentException("Expected agent=objective but got '" + text + "'");
        }
        return new SubtaskSpec(agent, objective);
    }
}
