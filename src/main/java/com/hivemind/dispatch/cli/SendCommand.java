package com.hivemind.dispatch.cli;

import com.hivemind.core.agent.AgentDirectory;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.model.Message;
import com.hivemind.core.model.MessageRole;
import com.hivemind.core.scheduler.AgentQueue;
import com.hivemind.core.store.AgentStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;

/**
 * CLI command: hivemind send &lt;agent-id&gt; "&lt;text&gt;"
 * <p>
 * Appends a user message to the agent's history and enqueues the agent. With
 * {@code --wait}, streams the reply and returns once the agent is idle again.
 */
@Command(name = "send", mixinStandardHelpOptions = true, description = "Send a message to an agent")
@Component
public class SendCommand implements Runnable {

    @Parameters(index = "0", description = "Agent ID")
    private String agentId;

    @Parameters(index = "1", description = "Message text")
    private String text;

    @Option(names = {"--wait"}, description = "Stream the reply and wait until the agent is idle")
    private boolean waitForReply;

    @Option(names = {"--timeout"}, description = "Seconds to wait with --wait", defaultValue = "300")
    private long timeoutSeconds;

    private final AgentDirectory directory;
    private final AgentStore store;
    private final AgentQueue queue;
    private final EventBus eventBus;

    public SendCommand(AgentDirectory directory, AgentStore store, AgentQueue queue, EventBus eventBus) {
        this.directory = directory;
        this.store = store;
        this.queue = queue;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        if (directory.find(agentId).isEmpty()) {
            ConsoleOutput.error("Unknown agent: " + agentId);
            return;
        }

        EventBus.Subscription subscription = waitForReply
                ? eventBus.subscribe(agentId, event -> {
                    switch (event.eventType()) {
                        case "agent.text" -> ConsoleOutput.agentText(String.valueOf(event.payload().get("text")));
                        case "run.retrying", "run.failed", "tool.invoked" -> {
                            System.out.println();
                            ConsoleOutput.watchEvent(event.eventType(), String.valueOf(event.payload()));
                        }
                        default -> { }
                    }
                })
                : null;

        try {
            Message message = store.appendMessage(agentId, MessageRole.USER, text, null);
            queue.enqueue(agentId);
            ConsoleOutput.info("Queued message " + message.position() + " for " + agentId);

            if (!waitForReply) return;

            boolean idle = queue.awaitIdle(agentId, Duration.ofSeconds(timeoutSeconds));
            System.out.println();
            if (!idle) {
                ConsoleOutput.error("Timed out after " + timeoutSeconds + "s; the agent is still running");
                return;
            }
            long cursor = store.getCheckpoint(agentId).cursor();
            if (cursor >= message.position()) {
                ConsoleOutput.success("Committed through message " + cursor);
            } else {
                ConsoleOutput.error("Message " + message.position() + " was not committed (cursor " + cursor + ")");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for " + agentId);
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
