package com.hivemind.dispatch.cli;

import com.hivemind.core.model.Task;
import com.hivemind.core.store.AgentStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: hivemind tree &lt;task-id&gt;
 * <p>
 * Prints a task and its descendants with their status.
 */
@Command(name = "tree", mixinStandardHelpOptions = true, description = "Show a task tree")
@Component
public class TreeCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final AgentStore store;

    public TreeCommand(AgentStore store) {
        this.store = store;
    }

    @Override
    public void run() {
        List<Task> tree = store.getTaskTree(taskId);
        if (tree.isEmpty()) {
            ConsoleOutput.error("Task not found: " + taskId);
            return;
        }

        // tree is breadth-first, so every parent precedes its children
        Map<String, Integer> depth = new HashMap<>();
        for (Task task : tree) {
            int d = task.id().equals(taskId) ? 0 : depth.getOrDefault(task.parentId(), 0) + 1;
            depth.put(task.id(), d);
        }

        System.out.println();
        printSubtree(taskId, tree, depth);

        Task root = tree.get(0);
        String summary = root.status().isTerminal()
                ? (root.result() != null ? root.result() : root.error())
                : null;
        if (summary != null) {
            System.out.println();
            System.out.println(summary);
        }
    }

    private void printSubtree(String id, List<Task> tree, Map<String, Integer> depth) {
        for (Task task : tree) {
            if (task.id().equals(id)) {
                ConsoleOutput.task(task, depth.get(id));
            }
        }
        for (Task task : tree) {
            if (id.equals(task.parentId())) {
                printSubtree(task.id(), tree, depth);
            }
        }
    }
}
