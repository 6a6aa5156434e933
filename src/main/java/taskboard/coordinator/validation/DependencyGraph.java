package taskboard.coordinator.validation;

import taskboard.coordinator.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed task dependency graph (edge: task -> dependency) with DFS cycle
 * detection.
 */
public final class DependencyGraph {

    private final Map<String, List<String>> edges = new HashMap<>();

    public static DependencyGraph of(Collection<Task> tasks) {
        DependencyGraph graph = new DependencyGraph();
        for (Task task : tasks) {
            graph.put(task.id(), task.dependencies());
        }
        return graph;
    }

    /** Add or replace the outgoing edges of a node */
    public DependencyGraph put(String taskId, List<String> dependencies) {
        edges.put(taskId, List.copyOf(dependencies));
        return this;
    }

    public boolean contains(String taskId) {
        return edges.containsKey(taskId);
    }

    /**
     * Find a cycle reachable from the given task.
     *
     * @return the cycle as a path starting and ending with the same id
     */
    public Optional<List<String>> findCycleFrom(String start) {
        Map<String, Color> colors = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        return visit(start, colors, path);
    }

    private Optional<List<String>> visit(String node, Map<String, Color> colors, Deque<String> path) {
        colors.put(node, Color.GREY);
        path.addLast(node);
        for (String next : edges.getOrDefault(node, List.of())) {
            Color color = colors.getOrDefault(next, Color.WHITE);
            if (color == Color.GREY) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String id : path) {
                    if (id.equals(next))
                        inCycle = true;
                    if (inCycle)
                        cycle.add(id);
                }
                cycle.add(next);
                return Optional.of(cycle);
            }
            if (color == Color.WHITE) {
                Optional<List<String>> found = visit(next, colors, path);
                if (found.isPresent())
                    return found;
            }
        }
        path.removeLast();
        colors.put(node, Color.BLACK);
        return Optional.empty();
    }

    private enum Color {
        WHITE, GREY, BLACK
    }
}
