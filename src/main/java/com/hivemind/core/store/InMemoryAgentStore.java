package com.hivemind.core.store;

import com.hivemind.core.model.AgentCheckpoint;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Heap-backed {@link AgentStore}. Each agent's log is guarded by its own
 * monitor, so appends and commits of different agents never contend.
 * State is lost on restart.
 */
public class InMemoryAgentStore implements AgentStore {

    private final ConcurrentHashMap<String, AgentLog> logs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<String>> children = new ConcurrentHashMap<>();
    private final Object taskLock = new Object();
    private final Clock clock;

    public InMemoryAgentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAgentStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Message appendMessage(String agentId, MessageRole role, String content, String taskId) {
        AgentLog log = logFor(agentId);
        synchronized (log) {
            var message = new Message(agentId, log.messages.size() + 1L, role, content, taskId, clock.instant());
            log.messages.add(message);
            return message;
        }
    }

    @Override
    public List<Message> readMessagesSince(String agentId, long cursor) {
        AgentLog log = logFor(agentId);
        synchronized (log) {
            int from = (int) Math.max(0, Math.min(cursor, log.messages.size()));
            return List.copyOf(log.messages.subList(from, log.messages.size()));
        }
    }

    @Override
    public List<Message> readContext(String agentId, long throughPosition, int limit) {
        if (limit <= 0) return List.of();
        AgentLog log = logFor(agentId);
        synchronized (log) {
            var merged = new ArrayList<Message>();
            int through = (int) Math.max(0, Math.min(throughPosition, log.messages.size()));
            for (int i = 0; i < through; i++) {
                Message inbound = log.messages.get(i);
                merged.add(inbound);
                Message reply = log.replies.get(inbound.position());
                if (reply != null) merged.add(reply);
            }
            int from = Math.max(0, merged.size() - limit);
            return List.copyOf(merged.subList(from, merged.size()));
        }
    }

    @Override
    public AgentCheckpoint getCheckpoint(String agentId) {
        AgentLog log = logFor(agentId);
        synchronized (log) {
            return log.checkpoint;
        }
    }

    @Override
    public void commitExchange(String agentId, long cursor, String sessionId, String reply) {
        AgentLog log = logFor(agentId);
        synchronized (log) {
            if (cursor < log.checkpoint.cursor()) {
                throw new StoreException("Cursor regression for agent " + agentId + ": "
                        + log.checkpoint.cursor() + " -> " + cursor);
            }
            if (cursor > log.messages.size()) {
                throw new StoreException("Cursor " + cursor + " beyond highest position "
                        + log.messages.size() + " for agent " + agentId);
            }
            log.checkpoint = new AgentCheckpoint(agentId, cursor, sessionId);
            if (reply != null) {
                log.replies.put(cursor, new Message(agentId, cursor, MessageRole.ASSISTANT, reply, null, clock.instant()));
            }
        }
    }

    @Override
    public Task createTask(String parentId, String agentId, String objective) {
        synchronized (taskLock) {
            if (parentId != null && !tasks.containsKey(parentId)) {
                throw new StoreException("Parent task not found: " + parentId);
            }
            var task = new Task(newTaskId(), parentId, agentId, objective, TaskStatus.PENDING,
                    null, null, clock.instant(), null);
            tasks.put(task.id(), task);
            if (parentId != null) {
                children.computeIfAbsent(parentId, k -> new CopyOnWriteArrayList<>()).add(task.id());
            }
            return task;
        }
    }

    @Override
    public Task updateTaskStatus(String taskId, TaskStatus status, String result, String error) {
        synchronized (taskLock) {
            Task current = tasks.get(taskId);
            if (current == null) {
                throw new StoreException("Task not found: " + taskId);
            }
            Task updated = current.transition(status, result, error, childrenOf(taskId), clock.instant());
            tasks.put(taskId, updated);
            return updated;
        }
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<Task> getTaskTree(String rootId) {
        Task root = tasks.get(rootId);
        if (root == null) return List.of();
        var tree = new ArrayList<Task>();
        Deque<Task> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Task next = queue.poll();
            tree.add(next);
            queue.addAll(childrenOf(next.id()));
        }
        return tree;
    }

    private List<Task> childrenOf(String taskId) {
        var ids = children.get(taskId);
        if (ids == null) return List.of();
        return ids.stream().map(tasks::get).toList();
    }

    private AgentLog logFor(String agentId) {
        return logs.computeIfAbsent(agentId, AgentLog::new);
    }

    static String newTaskId() {
        return "TASK-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static final class AgentLog {
        private final List<Message> messages = new ArrayList<>();
        private final Map<Long, Message> replies = new TreeMap<>(Comparator.naturalOrder());
        private AgentCheckpoint checkpoint;

        private AgentLog(String agentId) {
            this.checkpoint = AgentCheckpoint.initial(agentId);
        }
    }
}
