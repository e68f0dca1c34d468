package org.bpmn2drawio.layout;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayeredGraphTest {

    @Test
    void shouldBreakCycleAtEdgeBackToRoot() {
        LayeredGraph graph = new LayeredGraph(List.of("a", "b", "c"));
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");

        graph.detectBackEdges(List.of(0));
        graph.assignRanks();

        assertEquals(1, graph.backEdgeCount());
        assertTrue(graph.isBackEdge(2, 0));
        assertEquals(0, graph.rank(0));
        assertEquals(1, graph.rank(1));
        assertEquals(2, graph.rank(2));
    }

    @Test
    void shouldIgnoreSelfLoopsAndDuplicates() {
        LayeredGraph graph = new LayeredGraph(List.of("a", "b"));

        assertTrue(graph.addEdge("a", "b"));
        assertFalse(graph.addEdge("a", "b"));
        assertFalse(graph.addEdge("a", "a"));
        assertFalse(graph.addEdge("a", "unknown"));
        assertEquals(List.of(1), graph.successors(0));
        assertEquals(List.of(0), graph.predecessors(1));
    }

    @Test
    void shouldRankByLongestPath() {
        LayeredGraph graph = new LayeredGraph(List.of("a", "b", "c", "d"));
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("a", "c");
        graph.addEdge("a", "d");

        graph.detectBackEdges(List.of(0));
        graph.assignRanks();

        assertEquals(0, graph.backEdgeCount());
        assertEquals(2, graph.rank(2));
        assertEquals(1, graph.rank(3));
        assertEquals(2, graph.maxRank());
    }

    @Test
    void shouldHandleLongChainWithoutRecursion() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            ids.add("n" + i);
        }
        LayeredGraph graph = new LayeredGraph(ids);
        for (int i = 1; i < ids.size(); i++) {
            graph.addEdge(ids.get(i - 1), ids.get(i));
        }

        assertDoesNotThrow(() -> graph.detectBackEdges(List.of(0)));
        graph.assignRanks();

        assertEquals(9_999, graph.rank(9_999));
    }

    @Test
    void shouldStartSearchFromPreferredRoot() {
        LayeredGraph graph = new LayeredGraph(List.of("loop", "start"));
        graph.addEdge("start", "loop");
        graph.addEdge("loop", "start");

        graph.detectBackEdges(List.of(1));
        graph.assignRanks();

        assertTrue(graph.isBackEdge(0, 1));
        assertEquals(0, graph.rank(1));
        assertEquals(1, graph.rank(0));
    }
}
