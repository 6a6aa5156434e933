package taskboard.coordinator.validation;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void acyclicGraphHasNoCycle() {
        DependencyGraph graph = new DependencyGraph()
                .put("c", List.of("a", "b"))
                .put("b", List.of("a"))
                .put("a", List.of());

        assertTrue(graph.findCycleFrom("c").isEmpty());
    }

    @Test
    void findsCyclePath() {
        DependencyGraph graph = new DependencyGraph()
                .put("a", List.of("b"))
                .put("b", List.of("c"))
                .put("c", List.of("a"));

        Optional<List<String>> cycle = graph.findCycleFrom("a");

        assertEquals(List.of("a", "b", "c", "a"), cycle.orElseThrow());
    }

    @Test
    void cycleNotContainingStartIsTrimmed() {
        DependencyGraph graph = new DependencyGraph()
                .put("start", List.of("x"))
                .put("x", List.of("y"))
                .put("y", List.of("x"));

        assertEquals(List.of("x", "y", "x"), graph.findCycleFrom("start").orElseThrow());
    }

    @Test
    void diamondIsNotACycle() {
        DependencyGraph graph = new DependencyGraph()
                .put("top", List.of("left", "right"))
                .put("left", List.of("bottom"))
                .put("right", List.of("bottom"));

        assertTrue(graph.findCycleFrom("top").isEmpty());
    }

    @Test
    void unknownNodesAreLeaves() {
        DependencyGraph graph = new DependencyGraph().put("a", List.of("missing"));

        assertTrue(graph.findCycleFrom("a").isEmpty());
        assertFalse(graph.contains("missing"));
    }
}
