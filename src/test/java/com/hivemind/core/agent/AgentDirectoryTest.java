package com.hivemind.core.agent;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.model.AgentDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentDirectoryTest {

    private static AgentDefinition agent(String id, String role) {
        return new AgentDefinition(id, role, "m", "", List.of());
    }

    private final AgentDirectory directory = new AgentDirectory(List.of(
            agent("researcher-1", "RESEARCHER"),
            agent("writer-1", "Writer"),
            agent("researcher-2", "researcher")));

    @Nested
    @DisplayName("lookup")
    class LookupTests {

        @Test
        @DisplayName("get and find by exact id")
        void byId() {
            assertEquals("writer-1", directory.get("writer-1").id());
            assertTrue(directory.find("writer-1").isPresent());
            assertTrue(directory.find("nobody").isEmpty());
        }

        @Test
        @DisplayName("get of an unknown id throws UnknownAgentException")
        void unknownId() {
            var ex = assertThrows(UnknownAgentException.class, () -> directory.get("nobody"));
            assertTrue(ex.getMessage().contains("nobody"));
        }

        @Test
        @DisplayName("all keeps declaration order and roles are upper-cased")
        void ordering() {
            assertEquals(List.of("researcher-1", "writer-1", "researcher-2"),
                    directory.all().stream().map(AgentDefinition::id).toList());
            assertEquals(List.of("RESEARCHER", "WRITER"), directory.roles());
        }
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("an explicit id wins over role matching")
        void explicitId() {
            assertEquals("researcher-2", directory.resolve("researcher-2").id());
        }

        @Test
        @DisplayName("a role rotates through its agents, case-insensitively")
        void roleRoundRobin() {
            assertEquals("researcher-1", directory.resolve("researcher").id());
            assertEquals("researcher-2", directory.resolve("RESEARCHER").id());
            assertEquals("researcher-1", directory.resolve(" Researcher ").id());
        }

        @Test
        @DisplayName("an unknown role throws UnknownAgentException")
        void unknownRole() {
            assertThrows(UnknownAgentException.class, () -> directory.resolve("PILOT"));
        }
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("rejects duplicate ids")
        void duplicateIds() {
            assertThrows(IllegalArgumentException.class,
                    () -> new AgentDirectory(List.of(agent("a", "X"), agent("a", "Y"))));
        }

        @Test
        @DisplayName("rejects a blank id")
        void blankId() {
            assertThrows(IllegalArgumentException.class, () -> new AgentDirectory(List.of(agent(" ", "X"))));
        }

        @Test
        @DisplayName("loads agents from properties")
        void fromProperties() {
            var properties = new HivemindProperties();
            var configured = new HivemindProperties.Agent();
            configured.setId("analyst-1");
            configured.setRole("ANALYST");
            configured.setTools(List.of("lookup"));
            properties.setAgents(List.of(configured));

            var loaded = new AgentDirectory(properties);

            assertEquals(List.of("lookup"), loaded.get("analyst-1").tools());
            assertEquals("analyst-1", loaded.resolve("analyst").id());
        }
    }
}
