package com.hivemind.core.scheduler;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.agent.AgentDirectory;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.llm.ConversationTurn;
import com.hivemind.core.llm.ModelStream;
import com.hivemind.core.llm.QueueModelStream;
import com.hivemind.core.llm.StreamEvent;
import com.hivemind.core.llm.StreamRequest;
import com.hivemind.core.loop.CancellationToken;
import com.hivemind.core.loop.ExecutionLoop;
import com.hivemind.core.loop.FailureKind;
import com.hivemind.core.loop.RunResult;
import com.hivemind.core.loop.RunStatus;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.model.AgentDefinition;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.store.InMemoryAgentStore;
import com.hivemind.core.tools.ToolRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentQueueTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ExecutionLoop loop;
    private SimpleMeterRegistry meterRegistry;
    private AgentQueue queue;

    @BeforeEach
    void setUp() {
        loop = mock(ExecutionLoop.class);
        meterRegistry = new SimpleMeterRegistry();
        queue = new AgentQueue(loop, new HivemindMetrics(meterRegistry), Executors.newCachedThreadPool());
    }

    @AfterEach
    void tearDown() {
        queue.shutdown();
    }

    private static RunResult succeeded(String agentId) {
        return RunResult.succeeded(agentId, 1, "s", "ok", List.of(), List.of(), 1);
    }

    @Nested
    @DisplayName("enqueue")
    class EnqueueTests {

        @Test
        @DisplayName("an idle agent starts a run immediately")
        void startsRun() throws Exception {
            var ran = new CountDownLatch(1);
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> {
                ran.countDown();
                return succeeded(inv.getArgument(0));
            });

            queue.enqueue("A");

            assertTrue(ran.await(5, TimeUnit.SECONDS));
            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(AgentState.IDLE, queue.state("A"));
        }

        @Test
        @DisplayName("enqueues during a run coalesce into exactly one follow-up run")
        void coalesces() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var runs = new AtomicInteger();
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> {
                if (runs.incrementAndGet() == 1) {
                    started.countDown();
                    release.await();
                }
                return succeeded(inv.getArgument(0));
            });

            queue.enqueue("A");
            assertTrue(started.await(5, TimeUnit.SECONDS));
            for (int i = 0; i < 5; i++) {
                queue.enqueue("A");
            }
            assertEquals(AgentState.RUNNING, queue.state("A"));
            assertTrue(queue.hasPendingWork("A"));
            release.countDown();

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(2, runs.get());
            assertFalse(queue.hasPendingWork("A"));
            assertEquals(5.0, meterRegistry.find("hivemind.scheduler.coalesced").counter().count());
        }

        @Test
        @DisplayName("never runs the same agent twice at once under concurrent enqueues")
        void serializesPerAgent() throws Exception {
            var active = new AtomicInteger();
            var maxActive = new AtomicInteger();
            var runs = new AtomicInteger();
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> {
                int now = active.incrementAndGet();
                maxActive.accumulateAndGet(now, Math::max);
                runs.incrementAndGet();
                Thread.sleep(5);
                active.decrementAndGet();
                return succeeded(inv.getArgument(0));
            });

            ExecutorService callers = Executors.newFixedThreadPool(8);
            var go = new CountDownLatch(1);
            for (int i = 0; i < 8; i++) {
                callers.execute(() -> {
                    try {
                        go.await();
                        for (int j = 0; j < 50; j++) {
                            queue.enqueue("A");
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            go.countDown();
            callers.shutdown();
            assertTrue(callers.awaitTermination(5, TimeUnit.SECONDS));

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(1, maxActive.get());
            assertTrue(runs.get() < 400, "enqueues should coalesce, got " + runs.get() + " runs");
        }

        @Test
        @DisplayName("distinct agents run in parallel")
        void parallelAcrossAgents() throws Exception {
            var bothRunning = new CountDownLatch(2);
            var release = new CountDownLatch(1);
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> {
                bothRunning.countDown();
                release.await();
                return succeeded(inv.getArgument(0));
            });

            queue.enqueue("A");
            queue.enqueue("B");

            assertTrue(bothRunning.await(5, TimeUnit.SECONDS), "B should not wait for A");
            release.countDown();
            assertTrue(queue.awaitIdle("A", WAIT));
            assertTrue(queue.awaitIdle("B", WAIT));
        }

        @Test
        @DisplayName("a throwing loop is reported as an INTERNAL failure and the agent goes idle")
        void loopThrows() throws Exception {
            when(loop.runAgent(anyString(), any())).thenThrow(new IllegalStateException("bug"));
            var results = new CopyOnWriteArrayList<RunResult>();
            queue.addListener(results::add);

            queue.enqueue("A");

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(1, results.size());
            assertEquals(RunStatus.FAILED, results.get(0).status());
            assertEquals(FailureKind.INTERNAL, results.get(0).failure().kind());
        }
    }

    @Nested
    @DisplayName("cancel")
    class CancelTests {

        private CountDownLatch started;
        private AtomicInteger runs;

        @BeforeEach
        void blockUntilCancelled() {
            started = new CountDownLatch(1);
            runs = new AtomicInteger();
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> {
                String agentId = inv.getArgument(0);
                CancellationToken token = inv.getArgument(1);
                if (runs.incrementAndGet() == 1) {
                    started.countDown();
                    while (!token.isCancelled()) {
                        Thread.sleep(5);
                    }
                    return RunResult.cancelled(agentId, 0, null, List.of(), List.of(), 1);
                }
                return succeeded(agentId);
            });
        }

        @Test
        @DisplayName("cancelling with drain schedules a follow-up run")
        void drains() throws Exception {
            queue.enqueue("A");
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(queue.cancel("A", true));

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(2, runs.get());
        }

        @Test
        @DisplayName("cancelling without drain leaves the agent idle")
        void noDrain() throws Exception {
            queue.enqueue("A");
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertTrue(queue.cancel("A", false));

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(1, runs.get());
        }

        @Test
        @DisplayName("cancelling an idle or unknown agent is a no-op")
        void idleAgent() {
            assertFalse(queue.cancel("nobody", true));
            assertEquals(AgentState.IDLE, queue.state("nobody"));
        }

        @Test
        @DisplayName("awaitIdle times out while a run is active")
        void awaitTimeout() throws Exception {
            queue.enqueue("A");
            assertTrue(started.await(5, TimeUnit.SECONDS));

            assertFalse(queue.awaitIdle("A", Duration.ofMillis(50)));

            queue.cancel("A", false);
            assertTrue(queue.awaitIdle("A", WAIT));
        }
    }

    @Nested
    @DisplayName("listeners")
    class ListenerTests {

        @Test
        @DisplayName("a throwing listener does not stop the others or the scheduler")
        void isolatesListeners() throws Exception {
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> succeeded(inv.getArgument(0)));
            var received = new CopyOnWriteArrayList<String>();
            queue.addListener(result -> { throw new IllegalStateException("listener bug"); });
            queue.addListener(result -> received.add(result.agentId()));

            queue.enqueue("A");
            assertTrue(queue.awaitIdle("A", WAIT));
            queue.enqueue("A");
            assertTrue(queue.awaitIdle("A", WAIT));

            assertEquals(List.of("A", "A"), received);
        }

        @Test
        @DisplayName("a removed listener is not notified")
        void removeListener() throws Exception {
            when(loop.runAgent(anyString(), any())).thenAnswer(inv -> succeeded(inv.getArgument(0)));
            var received = new AtomicInteger();
            AgentRunListener listener = result -> received.incrementAndGet();
            queue.addListener(listener);
            queue.removeListener(listener);

            queue.enqueue("A");

            assertTrue(queue.awaitIdle("A", WAIT));
            assertEquals(0, received.get());
        }
    }

    @Nested
    @DisplayName("with a real execution loop")
    class CoalescingWithLoopTests {

        private InMemoryAgentStore store;
        private ToolRegistry tools;
        private AgentQueue realQueue;
        private final List<StreamRequest> requests = Collections.synchronizedList(new ArrayList<>());
        private final CountDownLatch firstRequest = new CountDownLatch(1);
        private final CountDownLatch releaseFirst = new CountDownLatch(1);

        @BeforeEach
        void setUpLoop() {
            store = new InMemoryAgentStore();
            tools = new ToolRegistry(Duration.ofSeconds(1));
            var settings = new HivemindProperties.Loop();
            settings.setPollInterval(Duration.ofMillis(10));
            settings.setContextMessages(0);
            var directory = new AgentDirectory(List.of(new AgentDefinition("A", "WRITER", "m", "", List.of())));
            var realLoop = new ExecutionLoop(store, this::respond, tools, directory, (agent, text) -> { },
                    new EventBus(), null, settings, duration -> { });
            realQueue = new AgentQueue(realLoop);
        }

        @AfterEach
        void tearDownLoop() {
            realQueue.shutdown();
            tools.shutdown();
        }

        private ModelStream respond(StreamRequest request) {
            requests.add(request);
            if (requests.size() == 1) {
                firstRequest.countDown();
                try {
                    releaseFirst.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return QueueModelStream.of(new StreamEvent.TextDelta("reply " + requests.size()),
                    new StreamEvent.Stop(StreamEvent.END_TURN, "sess"));
        }

        @Test
        @DisplayName("messages 11 and 12 arriving during a run are consumed by one follow-up run")
        void followUpReadsEverything() throws Exception {
            for (int i = 1; i <= 10; i++) {
                store.appendMessage("A", MessageRole.USER, "m" + i, null);
            }
            store.commitCursor("A", 9, "sess");

            realQueue.enqueue("A");
            assertTrue(firstRequest.await(5, TimeUnit.SECONDS));
            store.appendMessage("A", MessageRole.USER, "m11", null);
            realQueue.enqueue("A");
            store.appendMessage("A", MessageRole.USER, "m12", null);
            realQueue.enqueue("A");
            releaseFirst.countDown();

            assertTrue(realQueue.awaitIdle("A", WAIT));
            assertEquals(2, requests.size());
            assertEquals(List.of("m10"), contents(requests.get(0)));
            assertEquals(List.of("m11", "m12"), contents(requests.get(1)));
            assertEquals(12, store.getCheckpoint("A").cursor());
        }

        private List<String> contents(StreamRequest request) {
            return request.messages().stream().map(ConversationTurn::content).toList();
        }
    }
}
