package com.hivemind.core.orchestrator;

import java.util.List;

/**
 * Composes the final answer of a root task from its children's outcomes.
 */
public interface ResultSynthesizer {

    /**
     * @param objective root objective
     * @param outcomes  terminal outcomes of every child, in creation order
     * @return the answer text, naming every child that did not succeed
     */
    String synthesize(String objective, List<ChildOutcome> outcomes);
}
