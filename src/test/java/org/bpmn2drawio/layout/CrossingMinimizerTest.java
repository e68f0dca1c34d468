package org.bpmn2drawio.layout;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CrossingMinimizerTest {

    @Test
    void shouldUncrossEdges() {
        LayeredGraph graph = crossedGraph();
        List<List<Integer>> layers = layers();

        new CrossingMinimizer(graph, new int[]{0, 0, 0, 0}).minimize(layers);

        assertEquals(List.of(0, 1), layers.get(0));
        assertEquals(List.of(3, 2), layers.get(1));
    }

    @Test
    void shouldKeepNodesInBandOrder() {
        LayeredGraph graph = crossedGraph();
        List<List<Integer>> layers = layers();

        new CrossingMinimizer(graph, new int[]{0, 0, 0, 1}).minimize(layers);

        assertEquals(List.of(2, 3), layers.get(1));
    }

    @Test
    void shouldKeepDeclarationOrderOnTies() {
        LayeredGraph graph = new LayeredGraph(List.of("a", "b", "c"));
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.detectBackEdges(List.of(0));
        graph.assignRanks();
        List<List<Integer>> layers = new ArrayList<>();
        layers.add(new ArrayList<>(List.of(0)));
        layers.add(new ArrayList<>(List.of(2, 1)));

        new CrossingMinimizer(graph, new int[]{0, 0, 0}).minimize(layers);

        assertEquals(List.of(1, 2), layers.get(1));
    }

    // a -> d and b -> c cross when layers keep declaration order
    private static LayeredGraph crossedGraph() {
        LayeredGraph graph = new LayeredGraph(List.of("a", "b", "c", "d"));
        graph.addEdge("a", "d");
        graph.addEdge("b", "c");
        graph.detectBackEdges(List.of(0, 1));
        graph.assignRanks();
        return graph;
    }

    private static List<List<Integer>> layers() {
        List<List<Integer>> layers = new ArrayList<>();
        layers.add(new ArrayList<>(List.of(0, 1)));
        layers.add(new ArrayList<>(List.of(2, 3)));
        return layers;
    }
}
