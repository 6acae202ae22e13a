package com.hivemind.dispatch.cli;

import com.hivemind.core.agent.AgentDirectory;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.HivemindEvent;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.orchestrator.ChildOutcome;
import com.hivemind.core.orchestrator.OrchestrationResult;
import com.hivemind.core.orchestrator.Orchestrator;
import com.hivemind.core.orchestrator.SubtaskSpec;
import com.hivemind.core.scheduler.AgentQueue;
import com.hivemind.core.store.InMemoryAgentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the Hivemind CLI command structure.
 * These tests exercise picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private Orchestrator orchestrator;
    private EventBus eventBus;
    private InMemoryAgentStore store;
    private AgentQueue queue;
    private AgentDirectory directory;

    @BeforeEach
    void setUp() {
        orchestrator = mock(Orchestrator.class);
        eventBus = new EventBus();
        store = new InMemoryAgentStore();
        queue = mock(AgentQueue.class);
        directory = new AgentDirectory(List.of(
                new AgentDefinition("writer-1", "WRITER", "m", "", List.of())));
    }

    /**
     * Custom picocli IFactory that provides test dependencies for commands.
     */
    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == OrchestrateCommand.class) {
                    return (K) new OrchestrateCommand(orchestrator, eventBus);
                }
                if (cls == SendCommand.class) {
                    return (K) new SendCommand(directory, store, queue, eventBus);
                }
                if (cls == TreeCommand.class) {
                    return (K) new TreeCommand(store);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new HivemindCommand(), factory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    // =====================================================================

    @Nested
    @DisplayName("top-level command")
    class TopLevelTests {

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArgs() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("HIVEMIND v0.1.0"));
            assertTrue(result.output().contains("orchestrate"));
            assertTrue(result.output().contains("send"));
            assertTrue(result.output().contains("tree"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Hivemind 0.1.0"));
        }

        @Test
        @DisplayName("an unknown subcommand is a usage error")
        void unknownSubcommand() {
            assertNotEquals(0, execute("launch").exitCode());
        }
    }

    @Nested
    @DisplayName("orchestrate")
    class OrchestrateTests {

        private OrchestrationResult result(TaskStatus status, List<String> caveats) {
            return new OrchestrationResult("TASK-root", "Write a report", status, "Result for: Write a report",
                    caveats, List.of(new ChildOutcome("TASK-1", "writer-1", "Draft", TaskStatus.SUCCEEDED, "ok", null)));
        }

        @Test
        @DisplayName("plans when no subtasks are given and prints the result")
        void planned() {
            when(orchestrator.orchestrate(eq("Write a report"), isNull()))
                    .thenReturn(result(TaskStatus.SUCCEEDED, List.of()));

            CliResult cli = execute("orchestrate", "Write a report");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("Planning subtasks..."));
            assertTrue(cli.output().contains("TASK TASK-root"));
            assertTrue(cli.output().contains("Result for: Write a report"));
            assertTrue(cli.output().contains("Completed."));
        }

        @Test
        @DisplayName("passes explicit subtasks in order and prints caveats")
        @SuppressWarnings("unchecked")
        void explicitSubtasks() {
            when(orchestrator.orchestrate(eq("Write a report"), any()))
                    .thenReturn(result(TaskStatus.SUCCEEDED, List.of("Subtask TASK-2 (researcher-1: Find) failed: boom")));

            CliResult cli = execute("orchestrate", "Write a report", "-s", "RESEARCHER=Find", "--subtask", "writer-1=Draft");

            ArgumentCaptor<List<SubtaskSpec>> specs = ArgumentCaptor.forClass(List.class);
            verify(orchestrator).orchestrate(eq("Write a report"), specs.capture());
            assertEquals(List.of(new SubtaskSpec("RESEARCHER", "Find"), new SubtaskSpec("writer-1", "Draft")),
                    specs.getValue());
            assertTrue(cli.output().contains("Caveats (1):"));
            assertTrue(cli.output().contains("failed: boom"));
            assertTrue(cli.output().contains("Completed with caveats."));
        }

        @Test
        @DisplayName("a malformed subtask is reported without orchestrating")
        void malformedSubtask() {
            CliResult cli = execute("orchestrate", "Write", "-s", "no-separator");

            assertTrue(cli.output().contains("Expected agent=objective"));
            verify(orchestrator, never()).orchestrate(any(), any());
        }

        @Test
        @DisplayName("a failed root prints Failed.")
        void failedRoot() {
            when(orchestrator.orchestrate(eq("Write a report"), isNull()))
                    .thenReturn(result(TaskStatus.FAILED, List.of("x")));

            assertTrue(execute("orchestrate", "Write a report").output().contains("Failed."));
        }

        @Test
        @DisplayName("an exception prints its root cause")
        void exception() {
            when(orchestrator.orchestrate(eq("Write"), isNull()))
                    .thenThrow(new IllegalStateException("wrapper", new RuntimeException("model unreachable")));

            CliResult cli = execute("orchestrate", "Write");

            assertTrue(cli.output().contains("Orchestration failed: model unreachable"));
        }

        @Test
        @DisplayName("--watch prints events while running")
        void watch() {
            when(orchestrator.orchestrate(eq("Write"), isNull())).thenAnswer(inv -> {
                eventBus.publish(HivemindEvent.of("task.started", "writer-1", "TASK-1", Map.of("status", "RUNNING")));
                return result(TaskStatus.SUCCEEDED, List.of());
            });

            CliResult cli = execute("orchestrate", "Write", "--watch");

            assertTrue(cli.output().contains("[TASK] TASK-1"));
        }
    }

    @Nested
    @DisplayName("send")
    class SendTests {

        @Test
        @DisplayName("appends a user message and enqueues the agent")
        void queues() {
            CliResult cli = execute("send", "writer-1", "Draft an intro");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("Queued message 1 for writer-1"));
            assertEquals(MessageRole.USER, store.readMessagesSince("writer-1", 0).get(0).role());
            verify(queue).enqueue("writer-1");
        }

        @Test
        @DisplayName("an unknown agent is rejected")
        void unknownAgent() {
            CliResult cli = execute("send", "ghost", "hello");

            assertTrue(cli.output().contains("Unknown agent: ghost"));
            verify(queue, never()).enqueue(any());
        }

        @Test
        @DisplayName("--wait streams text and reports the committed cursor")
        void waits() throws Exception {
            when(queue.awaitIdle(eq("writer-1"), any(Duration.class))).thenAnswer(inv -> {
                eventBus.publish(HivemindEvent.of("agent.text", "writer-1", null, Map.of("text", "Once upon")));
                store.commitExchange("writer-1", 1, "sess", "Once upon");
                return true;
            });

            CliResult cli = execute("send", "writer-1", "Tell a story", "--wait");

            assertTrue(cli.output().contains("Once upon"));
            assertTrue(cli.output().contains("Committed through message 1"));
        }

        @Test
        @DisplayName("--wait reports an uncommitted message when the run failed")
        void waitsForFailedRun() throws Exception {
            when(queue.awaitIdle(eq("writer-1"), any(Duration.class))).thenReturn(true);

            CliResult cli = execute("send", "writer-1", "Tell a story", "--wait");

            assertTrue(cli.output().contains("Message 1 was not committed (cursor 0)"));
        }

        @Test
        @DisplayName("--wait reports a timeout")
        void timeout() throws Exception {
            when(queue.awaitIdle(eq("writer-1"), any(Duration.class))).thenReturn(false);

            CliResult cli = execute("send", "writer-1", "Tell a story", "--wait", "--timeout", "1");

            assertTrue(cli.output().contains("Timed out after 1s"));
        }
    }

    @Nested
    @DisplayName("tree")
    class TreeTests {

        @Test
        @DisplayName("prints the root and its children with status")
        void printsTree() {
            Task root = store.createTask(null, "orchestrator", "Write a report");
            Task child = store.createTask(root.id(), "writer-1", "Draft");
            store.updateTaskStatus(root.id(), TaskStatus.RUNNING, null, null);
            store.updateTaskStatus(child.id(), TaskStatus.RUNNING, null, null);
            store.updateTaskStatus(child.id(), TaskStatus.FAILED, null, "AUTH_FAILURE: 401");

            CliResult cli = execute("tree", root.id());

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("RUNNING " + root.id()));
            assertTrue(cli.output().contains("  FAILED " + child.id() + " [writer-1] Draft"));
            assertTrue(cli.output().contains("AUTH_FAILURE: 401"));
        }

        @Test
        @DisplayName("an unknown task is reported")
        void unknownTask() {
            assertTrue(execute("tree", "TASK-nope").output().contains("Task not found: TASK-nope"));
        }
    }
}
