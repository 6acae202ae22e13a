package com.hivemind.core.store;

import com.hivemind.core.model.AgentCheckpoint;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link AgentStore} for PostgreSQL (and H2 in PostgreSQL mode).
 * <p>
 * Messages form an append-only log keyed by {@code (agent_id, seq_no)}; the
 * cursor and session live in a separate single row per agent in
 * {@code hm_checkpoints}. Appends and commits lock that row
 * ({@code SELECT ... FOR UPDATE}), which serializes writers of one agent
 * without touching other agents. The tables are created by {@link #createTables()}.
 */
public class JdbcAgentStore implements AgentStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcAgentStore.class);

    private static final String[] CREATE_TABLES_SQL = {
            """
            CREATE TABLE IF NOT EXISTS hm_messages (
                agent_id    VARCHAR(255) NOT NULL,
                seq_no      BIGINT NOT NULL,
                msg_role    VARCHAR(32) NOT NULL,
                content     TEXT NOT NULL,
                task_id     VARCHAR(64),
                created_at  TIMESTAMP NOT NULL,
                PRIMARY KEY (agent_id, seq_no)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_checkpoints (
                agent_id    VARCHAR(255) NOT NULL PRIMARY KEY,
                cursor_pos  BIGINT NOT NULL,
                session_id  VARCHAR(512),
                updated_at  TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_replies (
                agent_id    VARCHAR(255) NOT NULL,
                cursor_pos  BIGINT NOT NULL,
                content     TEXT NOT NULL,
                created_at  TIMESTAMP NOT NULL,
                PRIMARY KEY (agent_id, cursor_pos)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS hm_tasks (
                ordinal      BIGINT GENERATED BY DEFAULT AS IDENTITY,
                id           VARCHAR(64) NOT NULL PRIMARY KEY,
                parent_id    VARCHAR(64),
                agent_id     VARCHAR(255) NOT NULL,
                objective    TEXT NOT NULL,
                status       VARCHAR(16) NOT NULL,
                result_text  TEXT,
                error_text   TEXT,
                created_at   TIMESTAMP NOT NULL,
                completed_at TIMESTAMP
            )
            """
    };

    private static final String ENSURE_CHECKPOINT_SQL = """
            INSERT INTO hm_checkpoints (agent_id, cursor_pos)
            SELECT CAST(? AS VARCHAR(255)), 0
            WHERE NOT EXISTS (SELECT 1 FROM hm_checkpoints WHERE agent_id = ?)
            """;

    private static final String LOCK_CHECKPOINT_SQL = """
            SELECT cursor_pos, session_id FROM hm_checkpoints WHERE agent_id = ? FOR UPDATE
            """;

    private static final String SELECT_CHECKPOINT_SQL = """
            SELECT cursor_pos, session_id FROM hm_checkpoints WHERE agent_id = ?
            """;

    private static final String MAX_SEQ_SQL = """
            SELECT COALESCE(MAX(seq_no), 0) FROM hm_messages WHERE agent_id = ?
            """;

    private static final String INSERT_MESSAGE_SQL = """
            INSERT INTO hm_messages (agent_id, seq_no, msg_role, content, task_id, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_SINCE_SQL = """
            SELECT agent_id, seq_no, msg_role, content, task_id, created_at
            FROM hm_messages
            WHERE agent_id = ? AND seq_no > ?
            ORDER BY seq_no ASC
            """;

    private static final String SELECT_THROUGH_SQL = """
            SELECT agent_id, seq_no, msg_role, content, task_id, created_at
            FROM hm_messages
            WHERE agent_id = ? AND seq_no <= ?
            ORDER BY seq_no DESC
            LIMIT ?
            """;

    private static final String SELECT_REPLIES_SQL = """
            SELECT cursor_pos, content, created_at
            FROM hm_replies
            WHERE agent_id = ? AND cursor_pos >= ? AND cursor_pos <= ?
            """;

    private static final String UPDATE_CHECKPOINT_SQL = """
            UPDATE hm_checkpoints SET cursor_pos = ?, session_id = ?, updated_at = ? WHERE agent_id = ?
            """;

    private static final String DELETE_REPLY_SQL = """
            DELETE FROM hm_replies WHERE agent_id = ? AND cursor_pos = ?
            """;

    private static final String INSERT_REPLY_SQL = """
            INSERT INTO hm_replies (agent_id, cursor_pos, content, created_at) VALUES (?, ?, ?, ?)
            """;

    private static final String TASK_COLUMNS =
            "id, parent_id, agent_id, objective, status, result_text, error_text, created_at, completed_at";

    private static final String INSERT_TASK_SQL =
            "INSERT INTO hm_tasks (" + TASK_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT_TASK_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE id = ?";

    private static final String LOCK_TASK_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE id = ? FOR UPDATE";

    private static final String SELECT_CHILDREN_SQL =
            "SELECT " + TASK_COLUMNS + " FROM hm_tasks WHERE parent_id = ? ORDER BY ordinal ASC";

    private static final String UPDATE_TASK_SQL = """
            UPDATE hm_tasks SET status = ?, result_text = ?, error_text = ?, completed_at = ? WHERE id = ?
            """;

    private final DataSource dataSource;
    private final Clock clock;

    public JdbcAgentStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public JdbcAgentStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the store tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Agent store tables ensured");
        }
    }

    @Override
    public Message appendMessage(String agentId, MessageRole role, String content, String taskId) {
        ensureCheckpointRow(agentId);
        return inTransaction("append message for agent " + agentId, conn -> {
            lockCheckpoint(conn, agentId);
            long next = maxSeq(conn, agentId) + 1;
            Instant now = clock.instant();
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_MESSAGE_SQL)) {
                stmt.setString(1, agentId);
                stmt.setLong(2, next);
                stmt.setString(3, role.name());
                stmt.setString(4, content);
                stmt.setString(5, taskId);
                stmt.setTimestamp(6, Timestamp.from(now));
                stmt.executeUpdate();
            }
            return new Message(agentId, next, role, content, taskId, now);
        });
    }

    @Override
    public List<Message> readMessagesSince(String agentId, long cursor) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SINCE_SQL)) {
            stmt.setString(1, agentId);
            stmt.setLong(2, cursor);
            var messages = new ArrayList<Message>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    messages.add(messageFrom(rs));
                }
            }
            return messages;
        } catch (SQLException e) {
            throw new StoreException("Failed to read messages for agent " + agentId, e);
        }
    }

    @Override
    public List<Message> readContext(String agentId, long throughPosition, int limit) {
        if (limit <= 0 || throughPosition <= 0) return List.of();
        try (Connection conn = dataSource.getConnection()) {
            var inbound = new ArrayList<Message>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_THROUGH_SQL)) {
                stmt.setString(1, agentId);
                stmt.setLong(2, throughPosition);
                stmt.setInt(3, limit);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        inbound.add(0, messageFrom(rs));
                    }
                }
            }
            if (inbound.isEmpty()) return List.of();

            var replies = new HashMap<Long, Message>();
            try (PreparedStatement stmt = conn.prepareStatement(SELECT_REPLIES_SQL)) {
                stmt.setString(1, agentId);
                stmt.setLong(2, inbound.get(0).position());
                stmt.setLong(3, throughPosition);
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        long pos = rs.getLong("cursor_pos");
                        replies.put(pos, new Message(agentId, pos, MessageRole.ASSISTANT,
                                rs.getString("content"), null, rs.getTimestamp("created_at").toInstant()));
                    }
                }
            }

            var merged = new ArrayList<Message>();
            for (Message m : inbound) {
                merged.add(m);
                Message reply = replies.get(m.position());
                if (reply != null) merged.add(reply);
            }
            int from = Math.max(0, merged.size() - limit);
            return List.copyOf(merged.subList(from, merged.size()));
        } catch (SQLException e) {
            throw new StoreException("Failed to read context for agent " + agentId, e);
        }
    }

    @Override
    public AgentCheckpoint getCheckpoint(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHECKPOINT_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new AgentCheckpoint(agentId, rs.getLong("cursor_pos"), rs.getString("session_id"));
                }
            }
            return AgentCheckpoint.initial(agentId);
        } catch (SQLException e) {
            throw new StoreException("Failed to read checkpoint for agent " + agentId, e);
        }
    }

    @Override
    public void commitExchange(String agentId, long cursor, String sessionId, String reply) {
        ensureCheckpointRow(agentId);
        inTransaction("commit cursor for agent " + agentId, conn -> {
            long current = lockCheckpoint(conn, agentId);
            if (cursor < current) {
                throw new StoreException("Cursor regression for agent " + agentId + ": " + current + " -> " + cursor);
            }
            long highest = maxSeq(conn, agentId);
            if (cursor > highest) {
                throw new StoreException("Cursor " + cursor + " beyond highest position "
                        + highest + " for agent " + agentId);
            }
            Instant now = clock.instant();
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_CHECKPOINT_SQL)) {
                stmt.setLong(1, cursor);
                stmt.setString(2, sessionId);
                stmt.setTimestamp(3, Timestamp.from(now));
                stmt.setString(4, agentId);
                stmt.executeUpdate();
            }
            if (reply != null) {
                try (PreparedStatement stmt = conn.prepareStatement(DELETE_REPLY_SQL)) {
                    stmt.setString(1, agentId);
                    stmt.setLong(2, cursor);
                    stmt.executeUpdate();
                }
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_REPLY_SQL)) {
                    stmt.setString(1, agentId);
                    stmt.setLong(2, cursor);
                    stmt.setString(3, reply);
                    stmt.setTimestamp(4, Timestamp.from(now));
                    stmt.executeUpdate();
                }
            }
            return null;
        });
        log.debug("Committed cursor {} for agent {}", cursor, agentId);
    }

    @Override
    public Task createTask(String parentId, String agentId, String objective) {
        return inTransaction("create task", conn -> {
            if (parentId != null && loadTask(conn, SELECT_TASK_SQL, parentId).isEmpty()) {
                throw new StoreException("Parent task not found: " + parentId);
            }
            var task = new Task(InMemoryAgentStore.newTaskId(), parentId, agentId, objective,
                    TaskStatus.PENDING, null, null, clock.instant(), null);
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                stmt.setString(1, task.id());
                stmt.setString(2, parentId);
                stmt.setString(3, agentId);
                stmt.setString(4, objective);
                stmt.setString(5, task.status().name());
                stmt.setString(6, null);
                stmt.setString(7, null);
                stmt.setTimestamp(8, Timestamp.from(task.createdAt()));
                stmt.setTimestamp(9, null);
                stmt.executeUpdate();
            }
            return task;
        });
    }

    @Override
    public Task updateTaskStatus(String taskId, TaskStatus status, String result, String error) {
        return inTransaction("update task " + taskId, conn -> {
            Task current = loadTask(conn, LOCK_TASK_SQL, taskId)
                    .orElseThrow(() -> new StoreException("Task not found: " + taskId));
            Task updated = current.transition(status, result, error, loadChildren(conn, taskId), clock.instant());
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_TASK_SQL)) {
                stmt.setString(1, updated.status().name());
                stmt.setString(2, updated.result());
                stmt.setString(3, updated.error());
                stmt.setTimestamp(4, updated.completedAt() != null ? Timestamp.from(updated.completedAt()) : null);
                stmt.setString(5, taskId);
                stmt.executeUpdate();
            }
            return updated;
        });
    }

    @Override
    public Optional<Task> getTask(String taskId) {
        try (Connection conn = dataSource.getConnection()) {
            return loadTask(conn, SELECT_TASK_SQL, taskId);
        } catch (SQLException e) {
            throw new StoreException("Failed to read task " + taskId, e);
        }
    }

    @Override
    public List<Task> getTaskTree(String rootId) {
        try (Connection conn = dataSource.getConnection()) {
            Optional<Task> root = loadTask(conn, SELECT_TASK_SQL, rootId);
            if (root.isEmpty()) return List.of();
            var tree = new ArrayList<Task>();
            Deque<Task> queue = new ArrayDeque<>();
            queue.add(root.get());
            while (!queue.isEmpty()) {
                Task next = queue.poll();
                tree.add(next);
                queue.addAll(loadChildren(conn, next.id()));
            }
            return tree;
        } catch (SQLException e) {
            throw new StoreException("Failed to read task tree " + rootId, e);
        }
    }

    // -- helpers --------------------------------------------------------------

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws SQLException;
    }

    private <T> T inTransaction(String description, SqlWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to " + description, e);
        }
    }

    private void ensureCheckpointRow(String agentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(ENSURE_CHECKPOINT_SQL)) {
            stmt.setString(1, agentId);
            stmt.setString(2, agentId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            // A concurrent writer inserted the row first; integrity violations are SQLState class 23.
            if (e.getSQLState() == null || !e.getSQLState().startsWith("23")) {
                throw new StoreException("Failed to initialise checkpoint for agent " + agentId, e);
            }
            log.debug("Checkpoint row for agent {} created concurrently", agentId);
        }
    }

    private long lockCheckpoint(Connection conn, String agentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LOCK_CHECKPOINT_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new StoreException("Checkpoint row missing for agent " + agentId);
                }
                return rs.getLong("cursor_pos");
            }
        }
    }

    private long maxSeq(Connection conn, String agentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(MAX_SEQ_SQL)) {
            stmt.setString(1, agentId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private Optional<Task> loadTask(Connection conn, String sql, String taskId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(taskFrom(rs)) : Optional.empty();
            }
        }
    }

    private List<Task> loadChildren(Connection conn, String parentId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_CHILDREN_SQL)) {
            stmt.setString(1, parentId);
            var result = new ArrayList<Task>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(taskFrom(rs));
                }
            }
            return result;
        }
    }

    private static Message messageFrom(ResultSet rs) throws SQLException {
        return new Message(
                rs.getString("agent_id"),
                rs.getLong("seq_no"),
                MessageRole.valueOf(rs.getString("msg_role")),
                rs.getString("content"),
                rs.getString("task_id"),
                rs.getTimestamp("created_at").toInstant());
    }

    private static Task taskFrom(ResultSet rs) throws SQLException {
        Timestamp completed = rs.getTimestamp("completed_at");
        return new Task(
                rs.getString("id"),
                rs.getString("parent_id"),
                rs.getString("agent_id"),
                rs.getString("objective"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getString("result_text"),
                rs.getString("error_text"),
                rs.getTimestamp("created_at").toInstant(),
                completed != null ? completed.toInstant() : null);
    }
}
