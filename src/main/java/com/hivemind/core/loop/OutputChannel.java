package com.hivemind.core.loop;

/**
 * Best-effort sink for streamed assistant text. Losing a delta is a display
 * defect only; implementations must not throw.
 */
@FunctionalInterface
public interface OutputChannel {

    void emit(String agentId, String textDelta);
}
