package com.hivemind.core.scheduler;

import com.hivemind.core.loop.CancellationToken;
import com.hivemind.core.loop.ExecutionLoop;
import com.hivemind.core.loop.FailureKind;
import com.hivemind.core.loop.RunFailure;
import com.hivemind.core.loop.RunResult;
import com.hivemind.core.metrics.HivemindMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-agent debounced re-run scheduler ("AgentQueue").
 * <p>
 * At most one {@link ExecutionLoop} run is active per agent; distinct agents
 * run in parallel on their own worker threads. Each agent's
 * {@code state}/{@code pendingWork} pair is guarded by that agent's own
 * monitor, never by a global lock.
 * <p>
 * An {@link #enqueue} while the agent is running only sets {@code pendingWork};
 * any number of such calls coalesce into a single follow-up run, which reads
 * everything past the cursor and therefore picks up every message appended
 * before it started.
 */
@Service
public class AgentQueue {

    private static final Logger log = LoggerFactory.getLogger(AgentQueue.class);

    private final ExecutionLoop loop;
    private final HivemindMetrics metrics;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, Slot> slots = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<AgentRunListener> listeners = new CopyOnWriteArrayList<>();

    @Autowired
    public AgentQueue(ExecutionLoop loop, @Autowired(required = false) HivemindMetrics metrics) {
        this(loop, metrics, newWorkerPool());
    }

    public AgentQueue(ExecutionLoop loop) {
        this(loop, null, newWorkerPool());
    }

    AgentQueue(ExecutionLoop loop, HivemindMetrics metrics, ExecutorService executor) {
        this.loop = loop;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Requests a run for {@code agentId}. Starts one if the agent is idle,
     * otherwise marks pending work for a follow-up run. Never blocks on the run.
     */
    public void enqueue(String agentId) {
        Slot slot = slotFor(agentId);
        synchronized (slot) {
            if (slot.state == AgentState.RUNNING) {
                if (!slot.pendingWork) {
                    log.debug("Agent {} is running, scheduling a follow-up run", agentId);
                }
                slot.pendingWork = true;
                if (metrics != null) {
                    metrics.recordCoalescedEnqueue();
                }
                return;
            }
            slot.state = AgentState.RUNNING;
            start(agentId, slot);
        }
    }

    /**
     * Asks the active run of {@code agentId} to stop at its next suspension point.
     *
     * @param drainRemaining whether to schedule a follow-up run for messages
     *                       the cancelled run leaves unconsumed
     * @return false if the agent had no active run
     */
    public boolean cancel(String agentId, boolean drainRemaining) {
        Slot slot = slots.get(agentId);
        if (slot == null) return false;
        synchronized (slot) {
            if (slot.state != AgentState.RUNNING || slot.token == null) {
                return false;
            }
            log.info("Cancelling active run of agent {} (drain remaining: {})", agentId, drainRemaining);
            slot.token.cancel("Run of " + agentId + " cancelled");
            if (drainRemaining) {
                slot.pendingWork = true;
            }
            return true;
        }
    }

    public AgentState state(String agentId) {
        Slot slot = slots.get(agentId);
        if (slot == null) return AgentState.IDLE;
        synchronized (slot) {
            return slot.state;
        }
    }

    public boolean hasPendingWork(String agentId) {
        Slot slot = slots.get(agentId);
        if (slot == null) return false;
        synchronized (slot) {
            return slot.pendingWork;
        }
    }

    /**
     * Blocks until {@code agentId} is idle, including any follow-up runs.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(String agentId, Duration timeout) throws InterruptedException {
        Slot slot = slotFor(agentId);
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (slot) {
            while (slot.state == AgentState.RUNNING) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) return false;
                TimeUnit.NANOSECONDS.timedWait(slot, remaining);
            }
            return true;
        }
    }

    public void addListener(AgentRunListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AgentRunListener listener) {
        listeners.remove(listener);
    }

    /** Must be called while holding the slot's monitor. */
    private void start(String agentId, Slot slot) {
        var token = CancellationToken.create();
        slot.token = token;
        try {
            executor.execute(() -> execute(agentId, slot, token));
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler is shut down, not starting a run for agent {}", agentId);
            slot.token = null;
            slot.pendingWork = false;
            slot.state = AgentState.IDLE;
            slot.notifyAll();
        }
    }

    private void execute(String agentId, Slot slot, CancellationToken token) {
        RunResult result;
        try {
            result = loop.runAgent(agentId, token);
        } catch (RuntimeException e) {
            log.error("Execution loop for agent {} threw unexpectedly", agentId, e);
            result = RunResult.failed(agentId, 0, null, List.of(), List.of(),
                    new RunFailure(FailureKind.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage()), 0);
        }
        notifyListeners(result);
        complete(agentId, slot);
    }

    private void complete(String agentId, Slot slot) {
        synchronized (slot) {
            slot.token = null;
            if (slot.pendingWork) {
                slot.pendingWork = false;
                log.debug("Draining pending work of agent {}", agentId);
                start(agentId, slot);
            } else {
                slot.state = AgentState.IDLE;
                slot.notifyAll();
            }
        }
    }

    private void notifyListeners(RunResult result) {
        for (AgentRunListener listener : listeners) {
            try {
                listener.onRunCompleted(result);
            } catch (RuntimeException e) {
                log.warn("Run listener threw processing result of agent {}: {}",
                        result.agentId(), e.getMessage(), e);
            }
        }
    }

    private Slot slotFor(String agentId) {
        return slots.computeIfAbsent(agentId, k -> new Slot());
    }

    private static ExecutorService newWorkerPool() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "agent-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        for (Slot slot : slots.values()) {
            synchronized (slot) {
                slot.pendingWork = false;
                if (slot.token != null) {
                    slot.token.cancel("Scheduler shutting down");
                }
            }
        }
        executor.shutdownNow();
    }

    /** Exclusive-ownership unit of one agent. */
    private static final class Slot {
        AgentState state = AgentState.IDLE;
        boolean pendingWork;
        CancellationToken token;
    }
}
