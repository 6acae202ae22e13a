package com.hivemind.core.orchestrator;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.agent.AgentDirectory;
import com.hivemind.core.agent.UnknownAgentException;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.loop.RunResult;
import com.hivemind.core.loop.RunStatus;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.IllegalTaskTransitionException;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.scheduler.AgentQueue;
import com.hivemind.core.store.AgentStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds and drives orchestration task trees.
 * <p>
 * A root task is decomposed into child tasks, each bound to an agent. Every
 * child's objective is delivered as a message to its agent through the
 * {@link AgentQueue}, with at most {@code maxConcurrent} children of one tree
 * in flight; waiting children are admitted in creation order. Child outcomes
 * arrive as run completion signals and are mapped back to tasks through the
 * task id carried by each message.
 * <p>
 * Synthesis never hides a failed child: the root succeeds with caveats as long
 * as one child succeeded, and fails only when none did.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final AgentStore store;
    private final AgentQueue queue;
    private final AgentDirectory directory;
    private final TaskPlanner planner;
    private final ResultSynthesizer synthesizer;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final int maxConcurrent;
    private final String orchestratorAgentId;

    /** Children awaiting a terminal outcome, keyed by task id. */
    private final ConcurrentHashMap<String, ChildRun> pending = new ConcurrentHashMap<>();
    /** Trees being dispatched, keyed by root task id. */
    private final ConcurrentHashMap<String, TreeRun> trees = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    @Autowired
    public Orchestrator(AgentStore store, AgentQueue queue, AgentDirectory directory, TaskPlanner planner,
                        ResultSynthesizer synthesizer, EventBus eventBus, HivemindProperties properties,
                        @Autowired(required = false) HivemindMetrics metrics) {
        this(store, queue, directory, planner, synthesizer, eventBus, metrics,
                properties.getOrchestrator().getMaxConcurrent(), properties.getOrchestrator().getAgentId());
    }

    public Orchestrator(AgentStore store, AgentQueue queue, AgentDirectory directory, TaskPlanner planner,
                        ResultSynthesizer synthesizer, EventBus eventBus, HivemindMetrics metrics,
                        int maxConcurrent, String orchestratorAgentId) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.store = store;
        this.queue = queue;
        this.directory = directory;
        this.planner = planner;
        this.synthesizer = synthesizer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxConcurrent = maxConcurrent;
        this.orchestratorAgentId = orchestratorAgentId;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "orchestration-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        queue.addListener(this::onRunCompleted);
    }

    /**
     * Plans {@code objective} with the {@link TaskPlanner} and runs the tree to
     * completion on the calling thread.
     */
    public OrchestrationResult orchestrate(String objective) {
        return submit(objective, null).join();
    }

    /**
     * Runs a tree with explicit subtasks to completion on the calling thread.
     */
    public OrchestrationResult orchestrate(String objective, List<SubtaskSpec> subtasks) {
        return submit(objective, subtasks).join();
    }

    /**
     * Creates the root task synchronously and runs the rest of the tree in the
     * background.
     *
     * @param subtasks explicit subtasks, or null to ask the planner
     */
    public Submission submit(String objective, List<SubtaskSpec> subtasks) {
        Task root = store.createTask(null, orchestratorAgentId, objective);
        publish("task.created", root, Map.of("objective", objective));
        log.info("Created root task {} for: {}", root.id(), objective);
        var tree = new TreeRun(root.id(), objective, maxConcurrent);
        trees.put(root.id(), tree);
        CompletableFuture<OrchestrationResult> result = CompletableFuture.supplyAsync(() -> {
            MdcContext.setRoot(root.id());
            try {
                return run(tree, subtasks);
            } finally {
                trees.remove(root.id());
                MdcContext.clear();
            }
        }, executor);
        return new Submission(root.id(), result);
    }

    /**
     * Cancels {@code taskId} and all its descendants. Active runs backing a
     * cancelled task are interrupted; their agents then drain whatever other
     * work is queued for them.
     *
     * @return number of tasks moved to {@link TaskStatus#CANCELLED}
     */
    public int cancel(String taskId) {
        List<Task> subtree = store.getTaskTree(taskId);
        if (subtree.isEmpty()) {
            log.warn("Cannot cancel unknown task {}", taskId);
            return 0;
        }
        TreeRun tree = trees.get(taskId);
        if (tree != null) {
            tree.cancelled = true;
        }
        int cancelled = 0;
        for (Task task : subtree) {
            if (task.status().isTerminal()) continue;
            Task updated;
            try {
                updated = store.updateTaskStatus(task.id(), TaskStatus.CANCELLED, null, "Cancelled by request");
            } catch (IllegalTaskTransitionException e) {
                log.debug("Task {} reached a terminal state before cancellation", task.id());
                continue;
            }
            cancelled++;
            log.info("Cancelled task {} [{}]", task.id(), task.agentId());
            publish("task.cancelled", updated, Map.of("previousStatus", task.status().name()));
            if (metrics != null) {
                metrics.recordTaskResult(TaskStatus.CANCELLED.name());
            }
            ChildRun child = pending.get(task.id());
            if (child != null) {
                child.complete(ChildOutcome.from(updated));
            }
            // the snapshot may predate dispatch; the flag is set before the RUNNING transition
            boolean dispatched = task.status() == TaskStatus.RUNNING || (child != null && child.dispatched);
            if (dispatched && !task.isRoot()) {
                queue.cancel(task.agentId(), true);
            }
        }
        return cancelled;
    }

    /** Completion signal from the scheduler. */
    void onRunCompleted(RunResult result) {
        if (result.status() == RunStatus.FAILED && result.messages().isEmpty()) {
            failDispatchedChildren(result);
            return;
        }
        for (String taskId : result.taskIds()) {
            ChildRun child = pending.get(taskId);
            if (child == null || child.outcome.isDone()) continue;
            switch (result.status()) {
                case SUCCEEDED -> finishChild(child, TaskStatus.SUCCEEDED, result.reply(), null);
                case FAILED -> finishChild(child, TaskStatus.FAILED, null, result.failure().summary());
                // a run cancelled for a sibling's sake leaves this task to the follow-up run
                case CANCELLED, IDLE -> log.debug("Run of {} ended {} with task {} still open",
                        result.agentId(), result.status(), taskId);
            }
        }
    }

    /**
     * A run that failed before reading its messages cannot name the tasks it
     * was meant to serve, so every dispatched child of that agent fails with it.
     */
    private void failDispatchedChildren(RunResult result) {
        for (ChildRun child : pending.values()) {
            if (!child.dispatched || child.outcome.isDone()) continue;
            if (!child.task.agentId().equals(result.agentId())) continue;
            boolean running = store.getTask(child.task.id())
                    .map(t -> t.status() == TaskStatus.RUNNING)
                    .orElse(false);
            if (running) {
                log.warn("Run of {} failed before reading task {}", result.agentId(), child.task.id());
                finishChild(child, TaskStatus.FAILED, null, result.failure().summary());
            }
        }
    }

    private OrchestrationResult run(TreeRun tree, List<SubtaskSpec> subtasks) {
        Task root;
        try {
            root = store.updateTaskStatus(tree.rootId, TaskStatus.RUNNING, null, null);
        } catch (IllegalTaskTransitionException e) {
            log.info("Root task {} was cancelled before it started", tree.rootId);
            return resultOf(tree, List.of());
        }
        publish("task.started", root, Map.of());

        List<ChildRun> children;
        try {
            children = createChildren(tree, subtasks);
        } catch (RuntimeException e) {
            log.error("Could not decompose root task {}: {}", tree.rootId, e.getMessage(), e);
            return failRoot(tree, "Decomposition failed: " + e.getMessage());
        }

        for (ChildRun child : children) {
            pending.put(child.task.id(), child);
        }
        try {
            dispatchAll(tree, children);
            var outcomes = new ArrayList<ChildOutcome>();
            for (ChildRun child : children) {
                outcomes.add(child.outcome.get());
            }
            return synthesize(tree, outcomes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Orchestration of {} interrupted, cancelling the tree", tree.rootId);
            cancel(tree.rootId);
            return resultOf(tree, outcomesFromStore(children));
        } catch (ExecutionException e) {
            log.error("Waiting on children of {} failed", tree.rootId, e);
            cancel(tree.rootId);
            return resultOf(tree, outcomesFromStore(children));
        } finally {
            for (ChildRun child : children) {
                pending.remove(child.task.id());
            }
        }
    }

    private List<ChildRun> createChildren(TreeRun tree, List<SubtaskSpec> subtasks) {
        List<SubtaskSpec> specs = subtasks != null ? subtasks : planner.plan(tree.objective, directory.all());

        // resolve every agent before creating any child
        var agents = new ArrayList<AgentDefinition>();
        for (SubtaskSpec spec : specs) {
            try {
                agents.add(directory.resolve(spec.agent()));
            } catch (UnknownAgentException e) {
                throw new IllegalArgumentException(e.getMessage(), e);
            }
        }

        var children = new ArrayList<ChildRun>();
        for (int i = 0; i < specs.size(); i++) {
            Task child = store.createTask(tree.rootId, agents.get(i).id(), specs.get(i).objective());
            publish("task.created", child, Map.of("objective", child.objective()));
            children.add(new ChildRun(child));
        }
        log.info("Root task {} decomposed into {} subtask(s), at most {} concurrent",
                tree.rootId, children.size(), maxConcurrent);
        return children;
    }

    /**
     * Admits children in creation order as slots free up. A child cancelled
     * before its turn is skipped without taking a slot.
     */
    private void dispatchAll(TreeRun tree, List<ChildRun> children) throws InterruptedException {
        for (ChildRun child : children) {
            long waitStart = System.currentTimeMillis();
            tree.slots.acquire();
            if (metrics != null) {
                metrics.recordDispatchWait(System.currentTimeMillis() - waitStart);
            }
            if (child.outcome.isDone()) {
                tree.slots.release();
                continue;
            }
            if (tree.cancelled) {
                tree.slots.release();
                cancelUndispatched(child);
                continue;
            }
            dispatch(tree, child);
        }
    }

    private void dispatch(TreeRun tree, ChildRun child) {
        child.outcome.whenComplete((outcome, error) -> tree.slots.release());
        child.dispatched = true;
        Task running;
        try {
            running = store.updateTaskStatus(child.task.id(), TaskStatus.RUNNING, null, null);
        } catch (IllegalTaskTransitionException e) {
            log.debug("Child {} closed before dispatch", child.task.id());
            child.complete(ChildOutcome.from(store.getTask(child.task.id()).orElse(child.task)));
            return;
        }
        MdcContext.setTask(tree.rootId, running.id());
        try {
            log.info("Dispatching task {} [{}]: {}", running.id(), running.agentId(), running.objective());
            publish("task.started", running, Map.of("agent", running.agentId()));
            store.appendMessage(running.agentId(), MessageRole.USER, running.objective(), running.id());
            queue.enqueue(running.agentId());
        } catch (RuntimeException e) {
            log.error("Dispatch of task {} failed: {}", running.id(), e.getMessage(), e);
            finishChild(child, TaskStatus.FAILED, null, "Dispatch failed: " + e.getMessage());
        } finally {
            MdcContext.clearTask();
        }
    }

    /** Closes a child created after its tree was cancelled. */
    private void cancelUndispatched(ChildRun child) {
        Task updated;
        try {
            updated = store.updateTaskStatus(child.task.id(), TaskStatus.CANCELLED, null, "Cancelled by request");
            publish("task.cancelled", updated, Map.of("previousStatus", TaskStatus.PENDING.name()));
        } catch (IllegalTaskTransitionException e) {
            updated = store.getTask(child.task.id()).orElse(child.task);
        }
        child.complete(ChildOutcome.from(updated));
    }

    private void finishChild(ChildRun child, TaskStatus status, String result, String error) {
        Task updated;
        try {
            updated = store.updateTaskStatus(child.task.id(), status, result, error);
            log.info("Task {} {}", updated.id(), status);
            publish(status == TaskStatus.SUCCEEDED ? "task.succeeded" : "task.failed", updated,
                    error != null ? Map.of("error", error) : Map.of());
            if (metrics != null) {
                metrics.recordTaskResult(status.name());
            }
        } catch (IllegalTaskTransitionException e) {
            log.info("Ignoring {} outcome for task {}: {}", status, child.task.id(), e.getMessage());
            updated = store.getTask(child.task.id()).orElse(child.task);
        }
        child.complete(ChildOutcome.from(updated));
    }

    private OrchestrationResult synthesize(TreeRun tree, List<ChildOutcome> outcomes) {
        boolean anySucceeded = outcomes.isEmpty() || outcomes.stream().anyMatch(ChildOutcome::isSucceeded);
        String text = synthesizer.synthesize(tree.objective, outcomes);
        TaskStatus status = anySucceeded ? TaskStatus.SUCCEEDED : TaskStatus.FAILED;
        try {
            Task root = store.updateTaskStatus(tree.rootId, status,
                    anySucceeded ? text : null,
                    anySucceeded ? null : text);
            publish(status == TaskStatus.SUCCEEDED ? "task.succeeded" : "task.failed", root, Map.of());
            if (metrics != null) {
                metrics.recordTaskResult(status.name());
            }
        } catch (IllegalTaskTransitionException e) {
            log.info("Root task {} closed before synthesis: {}", tree.rootId, e.getMessage());
        }
        return resultOf(tree, outcomes, text);
    }

    private OrchestrationResult failRoot(TreeRun tree, String error) {
        try {
            Task root = store.updateTaskStatus(tree.rootId, TaskStatus.FAILED, null, error);
            publish("task.failed", root, Map.of("error", error));
            if (metrics != null) {
                metrics.recordTaskResult(TaskStatus.FAILED.name());
            }
        } catch (IllegalTaskTransitionException e) {
            log.info("Root task {} closed before it could fail: {}", tree.rootId, e.getMessage());
        }
        return resultOf(tree, List.of());
    }

    private OrchestrationResult resultOf(TreeRun tree, List<ChildOutcome> outcomes) {
        return resultOf(tree, outcomes, null);
    }

    private OrchestrationResult resultOf(TreeRun tree, List<ChildOutcome> outcomes, String synthesized) {
        Task root = store.getTask(tree.rootId)
                .orElseThrow(() -> new IllegalStateException("Root task " + tree.rootId + " vanished"));
        String text = synthesized;
        if (text == null) {
            text = root.result() != null ? root.result() : root.error();
        }
        List<String> caveats = outcomes.stream()
                .map(ChildOutcome::caveat)
                .filter(c -> c != null)
                .toList();
        var result = new OrchestrationResult(root.id(), tree.objective, root.status(), text, caveats, outcomes);

        var payload = new HashMap<String, Object>();
        payload.put("status", root.status().name());
        payload.put("children", outcomes.size());
        payload.put("caveats", caveats.size());
        eventBus.publish(HivemindEvent.of("orchestration.completed", root.agentId(), root.id(), payload));
        log.info("Orchestration {} finished {} ({} subtask(s), {} caveat(s))",
                root.id(), root.status(), outcomes.size(), caveats.size());
        return result;
    }

    private List<ChildOutcome> outcomesFromStore(List<ChildRun> children) {
        var outcomes = new ArrayList<ChildOutcome>();
        for (ChildRun child : children) {
            outcomes.add(ChildOutcome.from(store.getTask(child.task.id()).orElse(child.task)));
        }
        return outcomes;
    }

    private void publish(String type, Task task, Map<String, Object> extra) {
        var payload = new HashMap<String, Object>(extra);
        payload.put("status", task.status().name());
        if (task.parentId() != null) {
            payload.put("parentId", task.parentId());
        }
        eventBus.publish(HivemindEvent.of(type, task.agentId(), task.id(), payload));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Handle of a tree running in the background.
     *
     * @param rootTaskId root task id, usable with {@link #cancel} right away
     * @param result     completes with the synthesized result
     */
    public record Submission(String rootTaskId, CompletableFuture<OrchestrationResult> result) {

        public OrchestrationResult join() {
            return result.join();
        }
    }

    /** Per-tree dispatch state; the slot count is scoped to one tree. */
    private static final class TreeRun {
        final String rootId;
        final String objective;
        final Semaphore slots;
        volatile boolean cancelled;

        TreeRun(String rootId, String objective, int maxConcurrent) {
            this.rootId = rootId;
            this.objective = objective;
            this.slots = new Semaphore(maxConcurrent, true);
        }
    }

    private static final class ChildRun {
        final Task task;
        final CompletableFuture<ChildOutcome> outcome = new CompletableFuture<>();
        volatile boolean dispatched;

        ChildRun(Task task) {
            this.task = task;
        }

        void complete(ChildOutcome result) {
            outcome.complete(result);
        }
    }
}
