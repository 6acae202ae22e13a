package com.hivemind.core.store;

import com.hivemind.core.model.MessageRole;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against H2 in PostgreSQL mode.
 */
class JdbcAgentStoreTest extends AgentStoreContractTest {

    private JdbcDataSource dataSource;

    @Override
    protected AgentStore createStore() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:hm-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        var jdbcStore = new JdbcAgentStore(dataSource);
        jdbcStore.createTables();
        return jdbcStore;
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() throws Exception {
        ((JdbcAgentStore) store).createTables();

        store.appendMessage("A", MessageRole.USER, "still works", null);
        assertEquals(1, store.readMessagesSince("A", 0).size());
    }

    @Test
    @DisplayName("state survives a new store instance on the same database")
    void durableAcrossInstances() {
        store.appendMessage("A", MessageRole.USER, "one", null);
        store.commitExchange("A", 1, "sess-9", "reply");
        Task root = store.createTask(null, "orchestrator", "Root");
        store.updateTaskStatus(root.id(), TaskStatus.RUNNING, null, null);

        var reopened = new JdbcAgentStore(dataSource);

        assertEquals(1, reopened.getCheckpoint("A").cursor());
        assertEquals("sess-9", reopened.getCheckpoint("A").sessionId());
        assertEquals(TaskStatus.RUNNING, reopened.getTask(root.id()).orElseThrow().status());
        assertEquals("reply", reopened.readContext("A", 1, 5).get(1).content());
    }

    @Test
    @DisplayName("SQL failures surface as StoreException")
    void sqlFailure() {
        var broken = new JdbcAgentStore(brokenDataSource());

        assertThrows(StoreException.class, () -> broken.readMessagesSince("A", 0));
        assertThrows(StoreException.class, () -> broken.getCheckpoint("A"));
    }

    private JdbcDataSource brokenDataSource() {
        var ds = new JdbcDataSource();
        // tables were never created in this database
        ds.setURL("jdbc:h2:mem:hm-empty-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        return ds;
    }
}
