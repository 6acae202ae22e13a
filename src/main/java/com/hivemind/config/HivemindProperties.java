package com.hivemind.config;

import com.hivemind.core.model.AgentDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "hivemind")
public class HivemindProperties {

    private Loop loop = new Loop();
    private Tools tools = new Tools();
    private Orchestrator orchestrator = new Orchestrator();
    private Store store = new Store();
    private List<Agent> agents = new ArrayList<>();

    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Tools getTools() { return tools; }
    public void setTools(Tools tools) { this.tools = tools; }
    public Orchestrator getOrchestrator() { return orchestrator; }
    public void setOrchestrator(Orchestrator orchestrator) { this.orchestrator = orchestrator; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public List<Agent> getAgents() { return agents; }
    public void setAgents(List<Agent> agents) { this.agents = agents; }

    /** Configured agents as immutable definitions. */
    public List<AgentDefinition> agentDefinitions() {
        return agents.stream()
                .map(a -> new AgentDefinition(a.id, a.role, a.model, a.systemPrompt, a.tools))
                .toList();
    }

    public static class Loop {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double jitterRatio = 0.25;
        private int maxToolRounds = 25;
        private int contextMessages = 20;
        private Duration pollInterval = Duration.ofMillis(200);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }
        public int getMaxToolRounds() { return maxToolRounds; }
        public void setMaxToolRounds(int maxToolRounds) { this.maxToolRounds = maxToolRounds; }
        public int getContextMessages() { return contextMessages; }
        public void setContextMessages(int contextMessages) { this.contextMessages = contextMessages; }
        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    }

    public static class Tools {
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Orchestrator {
        private int maxConcurrent = 5;
        private String agentId = "orchestrator";

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public String getAgentId() { return agentId; }
        public void setAgentId(String agentId) { this.agentId = agentId; }
    }

    public static class Store {
        /** "memory" or "jdbc". */
        private String type = "memory";
        private String url = "";
        private String username = "";
        private String password = "";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public boolean isJdbc() {
            return "jdbc".equalsIgnoreCase(type) && url != null && !url.isBlank();
        }
    }

    public static class Agent {
        private String id = "";
        private String role = "";
        private String model = "";
        private String systemPrompt = "";
        private List<String> tools = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getSystemPrompt() { return systemPrompt; }
        public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }
        public List<String> getTools() { return tools; }
        public void setTools(List<String> tools) { this.tools = tools; }
    }
}
