package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for agent runs, tool calls and orchestration.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String status, long ms) {
        Counter.builder("hivemind.runs.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("hivemind.run.duration")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a retry of a whole run after a transient failure.
     *
     * @param kind failure kind that triggered the retry
     */
    public void recordRetry(String kind) {
        Counter.builder("hivemind.run.retries")
                .description("Execution loop attempts retried after a transient failure")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordToolCall(String tool, String outcome, long ms) {
        Counter.builder("hivemind.tool.calls")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("hivemind.tool.duration")
                .tag("tool", tool)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a coalesced enqueue: the agent was busy and the request became a follow-up run.
     */
    public void recordCoalescedEnqueue() {
        Counter.builder("hivemind.scheduler.coalesced")
                .description("Enqueue calls absorbed into a pending follow-up run")
                .register(registry)
                .increment();
    }

    public void recordTaskResult(String status) {
        Counter.builder("hivemind.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records how long a subtask waited for a concurrency slot before dispatch.
     */
    public void recordDispatchWait(long ms) {
        Timer.builder("hivemind.orchestrator.dispatch_wait")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
