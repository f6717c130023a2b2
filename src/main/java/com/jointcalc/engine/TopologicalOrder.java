package com.jointcalc.engine;

import com.jointcalc.api.Node;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable evaluation order of a joint calculation graph.
 *
 * Stages are sorted so that every node comes after all of its inputs: input
 * fields first, then stress area, resiliences, load factor, preload terms,
 * working forces and finally the stress and safety checks.
 *
 * Data layout (compressed sparse row):
 * - topoOrder: nodes in execution order.
 * - childrenList: one flat int array with the topological indices of all
 * children of all nodes.
 * - childrenOffset: the children of node i live in
 * childrenList[childrenOffset[i]] .. childrenList[childrenOffset[i+1]] (exclusive).
 */
@Log4j2
public final class TopologicalOrder {
    private final Node<?>[] topoOrder;
    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> nameToIndex;

    private final boolean[] inputField;

    private TopologicalOrder(Node<?>[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex, boolean[] inputField) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
        this.inputField = inputField;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node at the given topological index. */
    public Node<?> node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public boolean isSource(int ti) {
        return inputField[ti];
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int childrenStart(int ti) {
        return childrenOffset[ti];
    }

    public int childrenEnd(int ti) {
        return childrenOffset[ti + 1];
    }

    public int childAt(int flatIndex) {
        return childrenList[flatIndex];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects nodes and dependency edges, then sorts them with Kahn's
     * algorithm. A dependency cycle between stages is rejected at build time.
     */
    public static final class Builder {
        private final List<Node<?>> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, List<Integer>> forwardEdges = new HashMap<>();
        private final Set<Integer> sourceIndices = new HashSet<>();

        public Builder addNode(Node<?> node) {
            if (nameToIdx.containsKey(node.name()))
                throw new IllegalArgumentException("Duplicate node name: " + node.name());
            int idx = nodes.size();
            nodes.add(node);
            nameToIdx.put(node.name(), idx);
            forwardEdges.put(idx, new ArrayList<>());
            return this;
        }

        public Builder addEdge(String from, String to) {
            int fromIdx = requireIndex(from);
            int toIdx = requireIndex(to);
            List<Integer> children = forwardEdges.get(fromIdx);
            // a stage reading the same input twice still has one edge
            if (!children.contains(toIdx))
                children.add(toIdx);
            return this;
        }

        public Builder markSource(String name) {
            sourceIndices.add(requireIndex(name));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            for (List<Integer> children : forwardEdges.values())
                for (int child : children)
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n)
                throw new IllegalStateException("Dependency cycle between stages " + unsorted(inDegree)
                        + " (sorted " + topoIdx + " of " + n + ")");

            Node<?>[] orderedNodes = new Node<?>[n];
            boolean[] inputs = new boolean[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> orderedIndex = new HashMap<>(n * 2);

            for (int ti = 0; ti < n; ti++) {
                int origIdx = reverseMap[ti];
                orderedNodes[ti] = nodes.get(origIdx);
                inputs[ti] = sourceIndices.contains(origIdx);
                orderedIndex.put(orderedNodes[ti].name(), ti);
            }

            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            log.debug("Sorted {} nodes with {} dependency edges", n, offsets[n]);
            return new TopologicalOrder(orderedNodes, offsets, flatChildren, parentCounts, orderedIndex, inputs);
        }

        // nodes whose inputs never all resolved: the cycle and everything behind it
        private List<String> unsorted(int[] remainingInDegree) {
            List<String> names = new ArrayList<>();
            for (int i = 0; i < remainingInDegree.length; i++)
                if (remainingInDegree[i] > 0)
                    names.add(nodes.get(i).name());
            return names;
        }
    }
}
