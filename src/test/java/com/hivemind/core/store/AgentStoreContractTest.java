package com.hivemind.core.store;

import com.hivemind.core.model.AgentCheckpoint;
import com.hivemind.core.model.IllegalTaskTransitionException;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link AgentStore} must share. Subclasses supply the store.
 */
abstract class AgentStoreContractTest {

    protected AgentStore store;

    protected abstract AgentStore createStore() throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        store = createStore();
    }

    @Nested
    @DisplayName("messages")
    class MessageTests {

        @Test
        @DisplayName("positions start at 1 and increase per agent")
        void positionsPerAgent() {
            Message a1 = store.appendMessage("A", MessageRole.USER, "hello", null);
            Message a2 = store.appendMessage("A", MessageRole.USER, "again", "TASK-1");
            Message b1 = store.appendMessage("B", MessageRole.USER, "hi", null);

            assertEquals(1, a1.position());
            assertEquals(2, a2.position());
            assertEquals(1, b1.position());
            assertEquals("TASK-1", a2.taskId());
        }

        @Test
        @DisplayName("readMessagesSince returns only positions past the cursor, in order")
        void readSince() {
            for (int i = 1; i <= 5; i++) {
                store.appendMessage("A", MessageRole.USER, "m" + i, null);
            }

            List<Message> since = store.readMessagesSince("A", 3);

            assertEquals(List.of(4L, 5L), since.stream().map(Message::position).toList());
            assertEquals("m4", since.get(0).content());
            assertTrue(store.readMessagesSince("A", 5).isEmpty());
            assertTrue(store.readMessagesSince("nobody", 0).isEmpty());
        }
    }

    @Nested
    @DisplayName("checkpoints")
    class CheckpointTests {

        @Test
        @DisplayName("an unknown agent starts at cursor zero without a session")
        void initialCheckpoint() {
            AgentCheckpoint checkpoint = store.getCheckpoint("fresh");

            assertEquals(0, checkpoint.cursor());
            assertNull(checkpoint.sessionId());
        }

        @Test
        @DisplayName("a committed cursor is visible to the next read")
        void readYourWrites() {
            store.appendMessage("A", MessageRole.USER, "one", null);
            store.appendMessage("A", MessageRole.USER, "two", null);

            store.commitCursor("A", 2, "sess-1");

            assertEquals(new AgentCheckpoint("A", 2, "sess-1"), store.getCheckpoint("A"));
            assertTrue(store.readMessagesSince("A", store.getCheckpoint("A").cursor()).isEmpty());
        }

        @Test
        @DisplayName("rejects a cursor regression")
        void rejectsRegression() {
            store.appendMessage("A", MessageRole.USER, "one", null);
            store.appendMessage("A", MessageRole.USER, "two", null);
            store.commitCursor("A", 2, "s");

            assertThrows(StoreException.class, () -> store.commitCursor("A", 1, "s"));
            assertEquals(2, store.getCheckpoint("A").cursor());
        }

        @Test
        @DisplayName("rejects a cursor beyond the highest position")
        void rejectsBeyondHighest() {
            store.appendMessage("A", MessageRole.USER, "one", null);

            assertThrows(StoreException.class, () -> store.commitCursor("A", 2, "s"));
            assertEquals(0, store.getCheckpoint("A").cursor());
        }

        @Test
        @DisplayName("context interleaves committed replies after the message they answered")
        void contextWithReplies() {
            store.appendMessage("A", MessageRole.USER, "q1", null);
            store.commitExchange("A", 1, "s1", "a1");
            store.appendMessage("A", MessageRole.USER, "q2", null);
            store.appendMessage("A", MessageRole.USER, "q3", null);
            store.commitExchange("A", 3, "s2", "a3");

            List<Message> context = store.readContext("A", 3, 10);

            assertEquals(List.of("q1", "a1", "q2", "q3", "a3"), context.stream().map(Message::content).toList());
            assertEquals(MessageRole.ASSISTANT, context.get(1).role());
            assertEquals(1, context.get(1).position());
        }

        @Test
        @DisplayName("context keeps only the most recent entries")
        void contextLimit() {
            store.appendMessage("A", MessageRole.USER, "q1", null);
            store.commitExchange("A", 1, "s1", "a1");
            store.appendMessage("A", MessageRole.USER, "q2", null);
            store.commitExchange("A", 2, "s2", "a2");

            List<Message> context = store.readContext("A", 2, 2);

            assertEquals(List.of("q2", "a2"), context.stream().map(Message::content).toList());
            assertTrue(store.readContext("A", 0, 10).isEmpty());
        }
    }

    @Nested
    @DisplayName("tasks")
    class TaskTests {

        @Test
        @DisplayName("creates pending tasks and returns the tree breadth-first")
        void taskTree() {
            Task root = store.createTask(null, "orchestrator", "Root");
            Task c1 = store.createTask(root.id(), "researcher-1", "Child 1");
            Task c2 = store.createTask(root.id(), "writer-1", "Child 2");
            Task g1 = store.createTask(c1.id(), "analyst-1", "Grandchild");

            List<Task> tree = store.getTaskTree(root.id());

            assertEquals(List.of(root.id(), c1.id(), c2.id(), g1.id()), tree.stream().map(Task::id).toList());
            assertTrue(tree.stream().allMatch(t -> t.status() == TaskStatus.PENDING));
            assertTrue(root.isRoot());
            assertEquals(root.id(), c1.parentId());
        }

        @Test
        @DisplayName("getTaskTree of an unknown id is empty")
        void unknownTree() {
            assertTrue(store.getTaskTree("TASK-nope").isEmpty());
            assertTrue(store.getTask("TASK-nope").isEmpty());
        }

        @Test
        @DisplayName("updates status forward and persists result")
        void updateForward() {
            Task root = store.createTask(null, "orchestrator", "Root");
            store.updateTaskStatus(root.id(), TaskStatus.RUNNING, null, null);
            Task done = store.updateTaskStatus(root.id(), TaskStatus.SUCCEEDED, "answer", null);

            assertEquals(TaskStatus.SUCCEEDED, done.status());
            Task loaded = store.getTask(root.id()).orElseThrow();
            assertEquals(TaskStatus.SUCCEEDED, loaded.status());
            assertEquals("answer", loaded.result());
            assertNotNull(loaded.completedAt());
        }

        @Test
        @DisplayName("rejects an invalid transition and leaves the task unchanged")
        void rejectsInvalid() {
            Task root = store.createTask(null, "orchestrator", "Root");

            assertThrows(IllegalTaskTransitionException.class,
                    () -> store.updateTaskStatus(root.id(), TaskStatus.SUCCEEDED, "x", null));
            assertEquals(TaskStatus.PENDING, store.getTask(root.id()).orElseThrow().status());
        }

        @Test
        @DisplayName("parent cannot succeed while a child is pending")
        void parentBlockedByChild() {
            Task root = store.createTask(null, "orchestrator", "Root");
            store.createTask(root.id(), "researcher-1", "Child");
            store.updateTaskStatus(root.id(), TaskStatus.RUNNING, null, null);

            assertThrows(IllegalTaskTransitionException.class,
                    () -> store.updateTaskStatus(root.id(), TaskStatus.SUCCEEDED, "x", null));
        }

        @Test
        @DisplayName("updating an unknown task is a store error")
        void unknownTask() {
            assertThrows(StoreException.class,
                    () -> store.updateTaskStatus("TASK-nope", TaskStatus.RUNNING, null, null));
        }

        @Test
        @DisplayName("creating under an unknown parent is a store error")
        void unknownParent() {
            assertThrows(StoreException.class, () -> store.createTask("TASK-nope", "a", "o"));
        }
    }
}
