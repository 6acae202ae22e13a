package com.hivemind.core.orchestrator;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Concatenates succeeded results under per-subtask headings and appends a
 * caveat section for every subtask that failed or was cancelled.
 */
@Component
public class DefaultResultSynthesizer implements ResultSynthesizer {

    @Override
    public String synthesize(String objective, List<ChildOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return "No subtasks were required for: " + objective;
        }
        var sb = new StringBuilder();
        long succeeded = outcomes.stream().filter(ChildOutcome::isSucceeded).count();
        if (succeeded == 0) {
            sb.append("All ").append(outcomes.size()).append(" subtask(s) failed for: ").append(objective).append("\n");
        } else {
            sb.append("Result for: ").append(objective).append("\n");
            for (ChildOutcome outcome : outcomes) {
                if (!outcome.isSucceeded()) continue;
                sb.append("\n## ").append(outcome.objective())
                  .append(" [").append(outcome.agentId()).append("]\n");
                String result = outcome.result();
                sb.append(result == null || result.isBlank() ? "(no output)" : result.strip()).append("\n");
            }
        }

        List<String> caveats = outcomes.stream()
                .map(ChildOutcome::caveat)
                .filter(c -> c != null)
                .toList();
        if (!caveats.isEmpty()) {
            sb.append("\nCaveats (").append(caveats.size()).append(" of ").append(outcomes.size())
              .append(" subtask(s) incomplete):\n");
            for (String caveat : caveats) {
                sb.append("- ").append(caveat).append("\n");
            }
        }
        return sb.toString().strip();
    }
}
