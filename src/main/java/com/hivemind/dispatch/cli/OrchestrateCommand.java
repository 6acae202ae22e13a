package com.hivemind.dispatch.cli;

import com.hivemind.core.events.EventBus;
import com.hivemind.core.orchestrator.OrchestrationResult;
import com.hivemind.core.orchestrator.Orchestrator;
import com.hivemind.core.orchestrator.SubtaskSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: hivemind orchestrate "&lt;objective&gt;"
 * <p>
 * Decomposes the objective into subtasks (planned by the model unless given
 * with {@code --subtask}), fans them out to agents and prints the synthesized
 * result with its caveats.
 */
@Command(name = "orchestrate", mixinStandardHelpOptions = true,
        description = "Decompose an objective and fan it out to agents")
@Component
public class OrchestrateCommand implements Runnable {

    @Parameters(index = "0", description = "Objective for the root task")
    private String objective;

    @Option(names = {"--subtask", "-s"},
            description = "Explicit subtask as agent=objective (agent is a role or an agent id); repeatable")
    private List<String> subtasks = new ArrayList<>();

    @Option(names = {"--watch", "-w"}, description = "Print task and run events while the tree runs")
    private boolean watch;

    private final Orchestrator orchestrator;
    private final EventBus eventBus;

    public OrchestrateCommand(Orchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<SubtaskSpec> specs = null;
        if (subtasks != null && !subtasks.isEmpty()) {
            specs = new ArrayList<>();
            for (String s : subtasks) {
                try {
                    specs.add(SubtaskSpec.parse(s));
                } catch (IllegalArgumentException e) {
                    ConsoleOutput.error(e.getMessage());
                    return;
                }
            }
        } else {
            ConsoleOutput.info("Planning subtasks...");
        }

        EventBus.Subscription subscription = watch
                ? eventBus.subscribeAll(event -> {
                    if (!"agent.text".equals(event.eventType())) {
                        ConsoleOutput.watchEvent(event.eventType(),
                                (event.taskId() != null ? event.taskId() + " " : "") + event.payload());
                    }
                })
                : null;

        OrchestrationResult result;
        try {
            result = orchestrator.orchestrate(objective, specs);
        } catch (Exception e) {
            ConsoleOutput.error("Orchestration failed: " + rootCauseMessage(e));
            return;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        System.out.println();
        System.out.println("TASK " + result.rootTaskId());
        System.out.println("Objective: " + result.objective());
        System.out.println("──────────────────────────────────");
        if (result.result() != null) {
            System.out.println(result.result());
        }

        if (result.hasCaveats()) {
            System.out.println();
            ConsoleOutput.info("Caveats (" + result.caveats().size() + "):");
            for (String caveat : result.caveats()) {
                ConsoleOutput.caveat(caveat);
            }
        }

        System.out.println();
        switch (result.status()) {
            case SUCCEEDED -> ConsoleOutput.success(result.hasCaveats()
                    ? "Completed with caveats." : "Completed.");
            case CANCELLED -> ConsoleOutput.info("Cancelled.");
            default -> ConsoleOutput.error("Failed.");
        }
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
