package com.hivemind.core.tools;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.metrics.HivemindMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maps tool names to handlers and executes calls with a per-call deadline.
 * <p>
 * Every {@link Tool} bean is registered at startup; further registrations are
 * allowed at runtime. Lookups never block on registrations. Dispatch is
 * stateless: executing a call has no effect on the registry.
 */
@Service
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final ConcurrentHashMap<String, Tool> tools = new ConcurrentHashMap<>();
    private final ExecutorService executor;
    private final Duration timeout;
    private final HivemindMetrics metrics;

    @Autowired
    public ToolRegistry(ObjectProvider<Tool> tools, HivemindProperties properties,
                        @Autowired(required = false) HivemindMetrics metrics) {
        this(properties.getTools().getTimeout(), metrics);
        tools.orderedStream().forEach(tool -> register(tool.declaration().name(), tool));
        log.info("Tool registry initialised with {} tool(s): {}", this.tools.size(), this.tools.keySet());
    }

    public ToolRegistry(Duration timeout) {
        this(timeout, null);
    }

    ToolRegistry(Duration timeout, HivemindMetrics metrics) {
        this.timeout = timeout;
        this.metrics = metrics;
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tool-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Binds {@code name} to {@code tool}.
     *
     * @throws DuplicateToolException if the name is already bound
     */
    public void register(String name, Tool tool) {
        if (tools.putIfAbsent(name, tool) != null) {
            throw new DuplicateToolException(name);
        }
        log.debug("Registered tool {}", name);
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Set<String> names() {
        return Set.copyOf(tools.keySet());
    }

    /**
     * Declarations for the given tool names, in the given order. Names with no
     * registered tool are left out: the model cannot be offered what does not exist.
     */
    public List<ToolDeclaration> declarations(Collection<String> names) {
        var result = new ArrayList<ToolDeclaration>();
        for (String name : names) {
            Tool tool = tools.get(name);
            if (tool == null) {
                log.debug("Enabled tool {} is not registered, not declaring it", name);
                continue;
            }
            ToolDeclaration declared = tool.declaration();
            result.add(new ToolDeclaration(name, declared.description(), declared.inputSchema()));
        }
        return result;
    }

    /**
     * Executes one call. Never throws for tool failures: unknown names,
     * handler exceptions and deadline overruns come back as a {@link ToolError}.
     *
     * @throws InterruptedException if the calling thread is interrupted while
     *                              waiting; the handler is interrupted too
     */
    public ToolResult execute(String name, String input) throws InterruptedException {
        Tool tool = tools.get(name);
        if (tool == null) {
            log.warn("Tool call for unknown tool '{}'", name);
            record(name, ToolError.Kind.NOT_FOUND.name(), 0);
            return ToolResult.failure(ToolError.Kind.NOT_FOUND, "Unknown tool '" + name + "'", 0);
        }

        long start = System.currentTimeMillis();
        Future<String> future = executor.submit(() -> tool.execute(input));
        try {
            String output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            record(name, "success", elapsed);
            return ToolResult.success(output, elapsed);
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsed = System.currentTimeMillis() - start;
            log.warn("Tool '{}' exceeded its {}ms deadline", name, timeout.toMillis());
            record(name, ToolError.Kind.TIMEOUT.name(), elapsed);
            return ToolResult.failure(ToolError.Kind.TIMEOUT,
                    "Tool '" + name + "' timed out after " + timeout.toMillis() + "ms", elapsed);
        } catch (ExecutionException e) {
            long elapsed = System.currentTimeMillis() - start;
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Tool '{}' failed: {}", name, cause.getMessage());
            record(name, ToolError.Kind.EXECUTION_FAILED.name(), elapsed);
            return ToolResult.failure(ToolError.Kind.EXECUTION_FAILED,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsed);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void record(String name, String outcome, long elapsedMs) {
        if (metrics != null) {
            metrics.recordToolCall(name, outcome, elapsedMs);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
