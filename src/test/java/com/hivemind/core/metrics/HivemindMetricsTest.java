package com.hivemind.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HivemindMetricsTest {

    private SimpleMeterRegistry registry;
    private HivemindMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new HivemindMetrics(registry);
    }

    @Test
    @DisplayName("recordRun counts and times by status")
    void recordRun() {
        metrics.recordRun("SUCCEEDED", 120);
        metrics.recordRun("SUCCEEDED", 80);
        metrics.recordRun("FAILED", 10);

        assertEquals(2.0, registry.find("hivemind.runs.total").tag("status", "SUCCEEDED").counter().count());
        assertEquals(1.0, registry.find("hivemind.runs.total").tag("status", "FAILED").counter().count());
        var timer = registry.find("hivemind.run.duration").tag("status", "SUCCEEDED").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordRetry increments by failure kind")
    void recordRetry() {
        metrics.recordRetry("OVERLOADED");
        metrics.recordRetry("OVERLOADED");
        metrics.recordRetry("RATE_LIMITED");

        assertEquals(2.0, registry.find("hivemind.run.retries").tag("kind", "OVERLOADED").counter().count());
        assertEquals(1.0, registry.find("hivemind.run.retries").tag("kind", "RATE_LIMITED").counter().count());
    }

    @Test
    @DisplayName("recordToolCall records outcome counter and per-tool timer")
    void recordToolCall() {
        metrics.recordToolCall("lookup", "success", 5);
        metrics.recordToolCall("lookup", "TIMEOUT", 30_000);

        assertEquals(1.0, registry.find("hivemind.tool.calls")
                .tag("tool", "lookup").tag("outcome", "TIMEOUT").counter().count());
        assertEquals(2, registry.find("hivemind.tool.duration").tag("tool", "lookup").timer().count());
    }

    @Test
    @DisplayName("scheduler and orchestrator meters")
    void schedulerAndOrchestrator() {
        metrics.recordCoalescedEnqueue();
        metrics.recordTaskResult("CANCELLED");
        metrics.recordDispatchWait(15);

        assertEquals(1.0, registry.find("hivemind.scheduler.coalesced").counter().count());
        assertEquals(1.0, registry.find("hivemind.tasks.total").tag("status", "CANCELLED").counter().count());
        assertEquals(1, registry.find("hivemind.orchestrator.dispatch_wait").timer().count());
    }
}
