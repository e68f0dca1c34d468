package org.bpmn2drawio.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over element ids stored as index arrays. Node index is the
 * declaration order of the element, which every traversal follows.
 */
class LayeredGraph {
    private final List<String> ids;
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<List<Integer>> successors = new ArrayList<>();
    private final List<List<Integer>> predecessors = new ArrayList<>();
    private final Set<Long> backEdges = new LinkedHashSet<>();
    private int[] ranks;

    LayeredGraph(List<String> ids) {
        this.ids = List.copyOf(ids);
        for (int i = 0; i < ids.size(); i++) {
            indexById.put(ids.get(i), i);
            successors.add(new ArrayList<>());
            predecessors.add(new ArrayList<>());
        }
    }

    int size() {
        return ids.size();
    }

    String id(int index) {
        return ids.get(index);
    }

    /**
     * Adds an edge between two known ids. Self-loops and duplicates are ignored.
     *
     * @return true if the edge was added
     */
    boolean addEdge(String sourceId, String targetId) {
        Integer source = indexById.get(sourceId);
        Integer target = indexById.get(targetId);
        if (source == null || target == null || source.equals(target)
                || successors.get(source).contains(target)) {
            return false;
        }
        successors.get(source).add(target);
        predecessors.get(target).add(source);
        return true;
    }

    List<Integer> successors(int node) {
        return Collections.unmodifiableList(successors.get(node));
    }

    List<Integer> predecessors(int node) {
        return Collections.unmodifiableList(predecessors.get(node));
    }

    boolean isBackEdge(int source, int target) {
        return backEdges.contains(key(source, target));
    }

    int backEdgeCount() {
        return backEdges.size();
    }

    /**
     * Marks the edges closing a cycle. Depth-first search runs on an explicit
     * stack, visiting roots in the given order and then any node not reached.
     *
     * @param rootOrder preferred start nodes, most important first
     */
    void detectBackEdges(List<Integer> rootOrder) {
        backEdges.clear();
        int[] state = new int[size()]; // 0 new, 1 on stack, 2 done
        List<Integer> roots = new ArrayList<>(rootOrder);
        for (int i = 0; i < size(); i++) {
            roots.add(i);
        }

        Deque<int[]> stack = new ArrayDeque<>(); // {node, next successor position}
        for (int root : roots) {
            if (state[root] != 0) {
                continue;
            }
            state[root] = 1;
            stack.push(new int[]{root, 0});
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<Integer> next = successors.get(frame[0]);
                if (frame[1] < next.size()) {
                    int target = next.get(frame[1]++);
                    if (state[target] == 1) {
                        backEdges.add(key(frame[0], target));
                    } else if (state[target] == 0) {
                        state[target] = 1;
                        stack.push(new int[]{target, 0});
                    }
                } else {
                    state[frame[0]] = 2;
                    stack.pop();
                }
            }
        }
    }

    /**
     * Longest-path layering over the forward edges (Kahn's algorithm). Must
     * run after {@link #detectBackEdges(List)}.
     */
    int[] assignRanks() {
        int[] inDegree = new int[size()];
        for (int source = 0; source < size(); source++) {
            for (int target : successors.get(source)) {
                if (!isBackEdge(source, target)) {
                    inDegree[target]++;
                }
            }
        }

        ranks = new int[size()];
        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < size(); i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        while (!ready.isEmpty()) {
            int node = ready.poll();
            for (int target : successors.get(node)) {
                if (isBackEdge(node, target)) {
                    continue;
                }
                ranks[target] = Math.max(ranks[target], ranks[node] + 1);
                if (--inDegree[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return ranks;
    }

    int rank(int node) {
        return ranks[node];
    }

    int maxRank() {
        return ranks == null || ranks.length == 0 ? 0 : Arrays.stream(ranks).max().orElse(0);
    }

    private long key(int source, int target) {
        return ((long) source << 32) | (target & 0xffffffffL);
    }
}
