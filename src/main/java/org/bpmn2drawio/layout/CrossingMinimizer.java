package org.bpmn2drawio.layout;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders the nodes of each rank with the barycenter heuristic: one sweep
 * downwards using predecessors, one sweep upwards using successors.
 * Nodes never leave their band (lane), so the heuristic only reorders within
 * one band. Equal barycenters keep their current order.
 */
class CrossingMinimizer {

    private final LayeredGraph graph;
    private final int[] bands;
    private final int[] position;

    /**
     * @param graph ranked graph
     * @param bands band index per node, nodes are never ordered across bands
     */
    CrossingMinimizer(LayeredGraph graph, int[] bands) {
        this.graph = graph;
        this.bands = bands;
        this.position = new int[graph.size()];
    }

    /**
     * Sorts every layer in place.
     *
     * @param layers node indices per rank
     */
    void minimize(List<List<Integer>> layers) {
        for (List<Integer> layer : layers) {
            layer.sort(Comparator.<Integer>comparingInt(n -> bands[n]).thenComparingInt(n -> n));
            updatePositions(layer);
        }

        for (int r = 1; r < layers.size(); r++) {
            reorder(layers.get(r), true);
        }
        for (int r = layers.size() - 2; r >= 0; r--) {
            reorder(layers.get(r), false);
        }
    }

    private void reorder(List<Integer> layer, boolean usePredecessors) {
        List<double[]> keyed = new ArrayList<>(); // {node, band, barycenter, current position}
        for (int node : layer) {
            List<Integer> neighbours = usePredecessors ? graph.predecessors(node) : graph.successors(node);
            double sum = 0;
            int count = 0;
            for (int neighbour : neighbours) {
                if (graph.isBackEdge(usePredecessors ? neighbour : node, usePredecessors ? node : neighbour)) {
                    continue;
                }
                sum += position[neighbour];
                count++;
            }
            double barycenter = count == 0 ? position[node] : sum / count;
            keyed.add(new double[]{node, bands[node], barycenter, position[node]});
        }
        keyed.sort(Comparator.<double[]>comparingDouble(k -> k[1])
                .thenComparingDouble(k -> k[2])
                .thenComparingDouble(k -> k[3]));

        layer.clear();
        for (double[] k : keyed) {
            layer.add((int) k[0]);
        }
        updatePositions(layer);
    }

    private void updatePositions(List<Integer> layer) {
        for (int i = 0; i < layer.size(); i++) {
            position[layer.get(i)] = i;
        }
    }
}
