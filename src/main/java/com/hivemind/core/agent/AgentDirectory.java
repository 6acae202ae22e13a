package com.hivemind.core.agent;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.model.AgentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Immutable lookup of configured agents by id and by role.
 * <p>
 * Role lookups rotate through the agents sharing that role so that sibling
 * subtasks addressed to one role spread across its agents.
 */
@Service
public class AgentDirectory {

    private static final Logger log = LoggerFactory.getLogger(AgentDirectory.class);

    private final Map<String, AgentDefinition> byId;
    private final Map<String, List<AgentDefinition>> byRole;
    private final ConcurrentHashMap<String, AtomicInteger> roleCursors = new ConcurrentHashMap<>();

    @Autowired
    public AgentDirectory(HivemindProperties properties) {
        this(properties.agentDefinitions());
    }

    public AgentDirectory(Collection<AgentDefinition> agents) {
        var ids = new LinkedHashMap<String, AgentDefinition>();
        var roles = new LinkedHashMap<String, List<AgentDefinition>>();
        for (AgentDefinition agent : agents) {
            if (agent.id() == null || agent.id().isBlank()) {
                throw new IllegalArgumentException("Agent definition without an id: " + agent);
            }
            if (ids.putIfAbsent(agent.id(), agent) != null) {
                throw new IllegalArgumentException("Duplicate agent id '" + agent.id() + "'");
            }
            if (agent.role() != null && !agent.role().isBlank()) {
                roles.computeIfAbsent(normalize(agent.role()), k -> new ArrayList<>()).add(agent);
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        var frozen = new LinkedHashMap<String, List<AgentDefinition>>();
        roles.forEach((role, members) -> frozen.put(role, List.copyOf(members)));
        this.byRole = Collections.unmodifiableMap(frozen);
        log.info("Agent directory loaded {} agent(s) across roles {}", ids.size(), roles.keySet());
    }

    public Optional<AgentDefinition> find(String agentId) {
        return Optional.ofNullable(byId.get(agentId));
    }

    /**
     * @throws UnknownAgentException if no agent has this id
     */
    public AgentDefinition get(String agentId) {
        AgentDefinition agent = byId.get(agentId);
        if (agent == null) {
            throw new UnknownAgentException(agentId);
        }
        return agent;
    }

    /**
     * Resolves an explicit agent id, or else a role name (case-insensitive).
     *
     * @throws UnknownAgentException if neither matches
     */
    public AgentDefinition resolve(String agentOrRole) {
        AgentDefinition exact = byId.get(agentOrRole);
        if (exact != null) return exact;

        String role = normalize(agentOrRole);
        List<AgentDefinition> members = byRole.get(role);
        if (members == null || members.isEmpty()) {
            throw new UnknownAgentException(agentOrRole);
        }
        int next = roleCursors.computeIfAbsent(role, k -> new AtomicInteger()).getAndIncrement();
        return members.get(Math.floorMod(next, members.size()));
    }

    /** All agents in declaration order. */
    public List<AgentDefinition> all() {
        return List.copyOf(byId.values());
    }

    /** Configured role names, upper-case, in declaration order. */
    public List<String> roles() {
        return List.copyOf(byRole.keySet());
    }

    private static String normalize(String role) {
        return role == null ? "" : role.trim().toUpperCase(Locale.ROOT);
    }
}
