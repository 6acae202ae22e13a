package com.hivemind.core.tools;

/**
 * A named capability the model may invoke during an exchange. Host automation
 * (running scripts, reading UI state, synthetic input, screen capture) attaches
 * to agents only through this interface.
 * <p>
 * Handlers own their side effects and idempotency: a retried run re-issues
 * the calls it made.
 */
public interface Tool {

    ToolDeclaration declaration();

    /**
     * Executes the tool.
     *
     * @param input JSON input payload from the model
     * @return output payload sent back to the model
     * @throws Exception any failure; reported to the model as an error-flagged result
     */
    String execute(String input) throws Exception;
}
