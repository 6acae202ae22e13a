package com.hivemind.core.orchestrator;

import com.hivemind.core.model.TaskStatus;

import java.util.List;

/**
 * Final state of an orchestrated task tree.
 *
 * @param rootTaskId root task id
 * @param objective  root objective
 * @param status     terminal status of the root
 * @param result     synthesized answer (for a failed root, the failure summary)
 * @param caveats    one line per child that did not succeed
 * @param children   child outcomes in creation order
 */
public record OrchestrationResult(
    String rootTaskId,
    String objective,
    TaskStatus status,
    String result,
    List<String> caveats,
    List<ChildOutcome> children
) {

    public OrchestrationResult {
        caveats = caveats == null ? List.of() : List.copyOf(caveats);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public boolean isSucceeded() {
        return status == TaskStatus.SUCCEEDED;
    }

    public boolean hasCaveats() {
        return !caveats.isEmpty();
    }
}
