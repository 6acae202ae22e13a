package com.hivemind.core.loop;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.agent.AgentDirectory;
import com.hivemind.core.agent.UnknownAgentException;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.llm.ConversationTurn;
import com.hivemind.core.llm.ModelStream;
import com.hivemind.core.llm.ModelStreamClient;
import com.hivemind.core.llm.ModelStreamException;
import com.hivemind.core.llm.StreamEvent;
import com.hivemind.core.llm.StreamRequest;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentCheckpoint;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.model.ToolInvocationRecord;
import com.hivemind.core.store.AgentStore;
import com.hivemind.core.store.StoreException;
import com.hivemind.core.tools.ToolDeclaration;
import com.hivemind.core.tools.ToolRegistry;
import com.hivemind.core.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The unit of work for one agent ("runAgent").
 * <p>
 * A run reads every message past the committed cursor, drives one multi-turn
 * model/tool exchange to completion and then commits the new cursor, session
 * and final reply in one atomic store call. Nothing before that commit is
 * durable, so any attempt can be repeated from the unchanged cursor.
 * <p>
 * Callers must guarantee that no other run for the same agent is active;
 * {@link com.hivemind.core.scheduler.AgentQueue} does.
 */
@Service
public class ExecutionLoop {

    private static final Logger log = LoggerFactory.getLogger(ExecutionLoop.class);

    private final AgentStore store;
    private final ModelStreamClient client;
    private final ToolRegistry tools;
    private final AgentDirectory directory;
    private final OutputChannel output;
    private final EventBus eventBus;
    private final HivemindMetrics metrics;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final int maxToolRounds;
    private final int contextMessages;
    private final Duration pollInterval;

    @Autowired
    public ExecutionLoop(AgentStore store, ModelStreamClient client, ToolRegistry tools,
                         AgentDirectory directory, OutputChannel output, EventBus eventBus,
                         HivemindProperties properties,
                         @Autowired(required = false) HivemindMetrics metrics) {
        this(store, client, tools, directory, output, eventBus, metrics, properties.getLoop(), Sleeper.SYSTEM);
    }

    public ExecutionLoop(AgentStore store, ModelStreamClient client, ToolRegistry tools,
                         AgentDirectory directory, OutputChannel output, EventBus eventBus,
                         HivemindMetrics metrics, HivemindProperties.Loop settings, Sleeper sleeper) {
        this.store = store;
        this.client = client;
        this.tools = tools;
        this.directory = directory;
        this.output = output;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.retryPolicy = RetryPolicy.from(settings);
        this.sleeper = sleeper;
        this.maxToolRounds = settings.getMaxToolRounds();
        this.contextMessages = settings.getContextMessages();
        this.pollInterval = settings.getPollInterval();
    }

    /**
     * Advances {@code agentId} from its committed cursor. Never throws: every
     * outcome, including cancellation, is reported in the returned result.
     */
    public RunResult runAgent(String agentId, CancellationToken token) {
        MdcContext.setAgent(agentId);
        token.bind(Thread.currentThread());
        long start = System.currentTimeMillis();
        var run = new RunState(agentId);
        try {
            AgentDefinition agent;
            try {
                agent = directory.get(agentId);
            } catch (UnknownAgentException e) {
                return finish(run, fail(run, new RunFailure(FailureKind.INVALID_REQUEST, e.getMessage())), start);
            }
            return finish(run, runWithRetries(agent, run, token), start);
        } finally {
            token.unbind();
            MdcContext.clear();
        }
    }

    private RunResult runWithRetries(AgentDefinition agent, RunState run, CancellationToken token) {
        try {
            while (true) {
                run.attempt++;
                MdcContext.setAttempt(run.attempt);
                try {
                    RunResult result = attempt(agent, run, token);
                    if (result.status() == RunStatus.IDLE) {
                        log.debug("No messages past cursor {}, nothing to do", result.cursor());
                    }
                    return result;
                } catch (AttemptFailedException e) {
                    RunFailure failure = e.failure;
                    if (!retryPolicy.shouldRetry(run.attempt, failure)) {
                        return fail(run, failure);
                    }
                    Duration delay = retryPolicy.backoff(run.attempt);
                    log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                            run.attempt, retryPolicy.maxAttempts(), failure.summary(), delay.toMillis());
                    if (metrics != null) {
                        metrics.recordRetry(failure.kind().name());
                    }
                    eventBus.publish(HivemindEvent.of("run.retrying", run.agentId, null,
                            Map.of("attempt", run.attempt,
                                   "kind", failure.kind().name(),
                                   "delayMs", delay.toMillis())));
                    token.throwIfCancelled();
                    sleeper.sleep(delay);
                }
            }
        } catch (RunCancelledException e) {
            log.info("Run cancelled: {}", e.getMessage());
            return cancelled(run);
        } catch (InterruptedException e) {
            log.info("Run interrupted, treating as cancelled");
            return cancelled(run);
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                log.info("Run cancelled while failing: {}", e.getMessage());
                return cancelled(run);
            }
            log.error("Unexpected error in run attempt {}", run.attempt, e);
            return fail(run, new RunFailure(FailureKind.INTERNAL,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    /**
     * One attempt: read past the cursor, exchange, commit. Throws {@link AttemptFailedException}
     * for anything that leaves the cursor where it was.
     */
    private RunResult attempt(AgentDefinition agent, RunState run, CancellationToken token)
            throws InterruptedException {
        run.resetAttempt();
        token.throwIfCancelled();

        AgentCheckpoint checkpoint;
        List<Message> pending;
        try {
            checkpoint = store.getCheckpoint(run.agentId);
            pending = store.readMessagesSince(run.agentId, checkpoint.cursor());
        } catch (StoreException e) {
            throw new AttemptFailedException(FailureKind.STORE_FAILURE, e.getMessage());
        }
        run.cursor = checkpoint.cursor();
        run.sessionId = checkpoint.sessionId();
        if (pending.isEmpty()) {
            return RunResult.idle(run.agentId, checkpoint.cursor(), checkpoint.sessionId(), run.attempt);
        }
        run.messages = pending;
        long target = pending.get(pending.size() - 1).position();

        if (run.attempt == 1) {
            log.info("Run started: {} message(s) past cursor {}", pending.size(), checkpoint.cursor());
            eventBus.publish(HivemindEvent.of("run.started", run.agentId, null,
                    Map.of("cursor", checkpoint.cursor(), "pending", pending.size())));
        }

        List<Message> batch = withoutClosedTasks(pending);
        if (batch.isEmpty()) {
            log.info("All {} pending message(s) belong to closed tasks, skipping to cursor {}",
                    pending.size(), target);
            commit(run, target, checkpoint.sessionId(), null);
            return RunResult.succeeded(run.agentId, target, checkpoint.sessionId(), null,
                    pending, List.of(), run.attempt);
        }

        var transcript = new ArrayList<ConversationTurn>();
        try {
            for (Message prior : store.readContext(run.agentId, checkpoint.cursor(), contextMessages)) {
                transcript.add(ConversationTurn.of(prior));
            }
        } catch (StoreException e) {
            throw new AttemptFailedException(FailureKind.STORE_FAILURE, e.getMessage());
        }
        for (Message message : batch) {
            transcript.add(ConversationTurn.of(message));
        }
        List<ToolDeclaration> declarations = tools.declarations(agent.tools());

        String sessionId = checkpoint.sessionId();
        int toolRounds = 0;
        Exchange exchange;
        while (true) {
            var request = new StreamRequest(agent.model(), agent.systemPrompt(), transcript, declarations, sessionId);
            exchange = exchange(request, run, token);
            if (exchange.sessionId != null) {
                sessionId = exchange.sessionId;
            }
            if (exchange.toolCalls.isEmpty()) {
                break;
            }
            toolRounds++;
            if (toolRounds > maxToolRounds) {
                throw new AttemptFailedException(FailureKind.TOOL_LOOP_EXCEEDED,
                        "Exceeded " + maxToolRounds + " tool round-trips in one run");
            }
            if (withoutClosedTasks(batch).isEmpty()) {
                log.info("Every task in this batch closed mid-run, skipping to cursor {}", target);
                commit(run, target, sessionId, null);
                return RunResult.succeeded(run.agentId, target, sessionId, null,
                        pending, run.toolInvocations, run.attempt);
            }
            transcript.add(ConversationTurn.assistant(exchange.text.toString(), exchange.toolCalls));
            transcript.addAll(exchange.toolResults);
        }

        token.throwIfCancelled();
        String reply = exchange.text.toString();
        commit(run, target, sessionId, reply);
        return RunResult.succeeded(run.agentId, target, sessionId, reply, pending, run.toolInvocations, run.attempt);
    }

    /**
     * Consumes one streaming exchange. Tool calls are executed as they arrive;
     * their results are collected for the next request of the same run.
     */
    private Exchange exchange(StreamRequest request, RunState run, CancellationToken token)
            throws InterruptedException {
        var exchange = new Exchange();
        ModelStream stream;
        try {
            stream = client.streamMessage(request);
        } catch (ModelStreamException e) {
            throw new AttemptFailedException(FailureKind.from(e.getKind()), e.getMessage());
        }
        try (stream) {
            while (true) {
                token.throwIfCancelled();
                StreamEvent event = stream.poll(pollInterval);
                if (event == null) {
                    if (!stream.isExhausted()) continue;
                    if (!exchange.toolCalls.isEmpty()) return exchange;
                    throw new AttemptFailedException(FailureKind.NETWORK_FAILURE,
                            "Model stream ended without a stop event");
                }
                if (event instanceof StreamEvent.TextDelta delta) {
                    exchange.text.append(delta.text());
                    emit(run.agentId, delta.text());
                } else if (event instanceof StreamEvent.ToolCall call) {
                    invokeTool(call, exchange, run, token);
                } else if (event instanceof StreamEvent.Stop stop) {
                    exchange.sessionId = stop.sessionId();
                    log.debug("Exchange stopped: {} ({} tool call(s))", stop.reason(), exchange.toolCalls.size());
                    return exchange;
                } else if (event instanceof StreamEvent.Failure failure) {
                    throw new AttemptFailedException(FailureKind.from(failure.kind()), failure.detail());
                }
            }
        }
    }

    private void invokeTool(StreamEvent.ToolCall call, Exchange exchange, RunState run, CancellationToken token)
            throws InterruptedException {
        token.throwIfCancelled();
        log.debug("Invoking tool {} (call {})", call.name(), call.callId());
        ToolResult result = tools.execute(call.name(), call.input());
        if (result.isError()) {
            log.warn("Tool {} returned {}: {}", call.name(), result.error().kind(), result.error().detail());
        }
        String content = result.render();
        exchange.toolCalls.add(call);
        exchange.toolResults.add(ConversationTurn.toolResult(call, content, result.isError()));
        run.toolInvocations.add(new ToolInvocationRecord(call.callId(), call.name(), call.input(), content,
                result.isError(), result.isError() ? result.error().kind().name() : null, result.elapsedMs()));

        var payload = new HashMap<String, Object>();
        payload.put("tool", call.name());
        payload.put("error", result.isError());
        payload.put("elapsedMs", result.elapsedMs());
        eventBus.publish(HivemindEvent.of("tool.invoked", run.agentId, null, payload));
    }

    private List<Message> withoutClosedTasks(List<Message> pending) {
        var statuses = new HashMap<String, Boolean>();
        var batch = new ArrayList<Message>();
        for (Message message : pending) {
            if (message.belongsToTask()) {
                boolean closed = statuses.computeIfAbsent(message.taskId(), id -> {
                    try {
                        return store.getTask(id).map(t -> isClosed(t.status())).orElse(false);
                    } catch (StoreException e) {
                        throw new AttemptFailedException(FailureKind.STORE_FAILURE, e.getMessage());
                    }
                });
                if (closed) {
                    log.debug("Skipping message {} of closed task {}", message.position(), message.taskId());
                    continue;
                }
            }
            batch.add(message);
        }
        return batch;
    }

    /** A cancelled or failed task gets no further model or tool calls. */
    private static boolean isClosed(TaskStatus status) {
        return status == TaskStatus.CANCELLED || status == TaskStatus.FAILED;
    }

    private void commit(RunState run, long cursor, String sessionId, String reply) {
        try {
            store.commitExchange(run.agentId, cursor, sessionId, reply);
        } catch (StoreException e) {
            throw new AttemptFailedException(FailureKind.STORE_FAILURE, e.getMessage());
        }
        run.cursor = cursor;
        run.sessionId = sessionId;
        log.debug("Committed cursor {} with session {}", cursor, sessionId);
    }

    private void emit(String agentId, String text) {
        try {
            output.emit(agentId, text);
        } catch (RuntimeException e) {
            log.debug("Output channel dropped a delta: {}", e.getMessage());
        }
    }

    private RunResult fail(RunState run, RunFailure failure) {
        return RunResult.failed(run.agentId, run.cursor, run.sessionId, run.messages,
                run.toolInvocations, failure, run.attempt);
    }

    private RunResult cancelled(RunState run) {
        return RunResult.cancelled(run.agentId, run.cursor, run.sessionId, run.messages,
                run.toolInvocations, run.attempt);
    }

    private RunResult finish(RunState run, RunResult result, long start) {
        long elapsed = System.currentTimeMillis() - start;
        if (result.status() == RunStatus.IDLE) {
            return result;
        }
        if (metrics != null) {
            metrics.recordRun(result.status().name(), elapsed);
        }
        switch (result.status()) {
            case SUCCEEDED -> {
                log.info("Run completed in {}ms: cursor {} after {} attempt(s), {} tool call(s)",
                        elapsed, result.cursor(), result.attempts(), result.toolInvocations().size());
                eventBus.publish(HivemindEvent.of("run.completed", run.agentId, null,
                        Map.of("cursor", result.cursor(), "attempts", result.attempts(), "elapsedMs", elapsed)));
            }
            case FAILED -> {
                log.error("Run failed after {} attempt(s): {}", result.attempts(), result.failure().summary());
                eventBus.publish(HivemindEvent.of("run.failed", run.agentId, null,
                        Map.of("kind", result.failure().kind().name(),
                               "detail", String.valueOf(result.failure().detail()),
                               "attempts", result.attempts())));
            }
            case CANCELLED -> eventBus.publish(HivemindEvent.of("run.cancelled", run.agentId, null,
                    Map.of("cursor", result.cursor())));
            default -> { }
        }
        return result;
    }

    /** Mutable bookkeeping of one run across its attempts. */
    private static final class RunState {
        final String agentId;
        int attempt;
        long cursor;
        String sessionId;
        List<Message> messages = List.of();
        List<ToolInvocationRecord> toolInvocations = new ArrayList<>();

        RunState(String agentId) {
            this.agentId = agentId;
        }

        void resetAttempt() {
            messages = List.of();
            toolInvocations = new ArrayList<>();
        }
    }

    /** Collected output of one streaming exchange. */
    private static final class Exchange {
        final StringBuilder text = new StringBuilder();
        final List<StreamEvent.ToolCall> toolCalls = new ArrayList<>();
        final List<ConversationTurn> toolResults = new ArrayList<>();
        String sessionId;
    }

    private static final class AttemptFailedException extends RuntimeException {
        final RunFailure failure;

        AttemptFailedException(FailureKind kind, String detail) {
            super(detail);
            this.failure = new RunFailure(kind, detail);
        }
    }
}
