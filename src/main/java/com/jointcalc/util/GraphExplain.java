package com.jointcalc.util;

import com.jointcalc.api.Node;
import com.jointcalc.engine.StabilizationEngine;
import com.jointcalc.engine.TopologicalOrder;
import com.jointcalc.node.BooleanNode;
import com.jointcalc.node.ScalarNode;
import com.jointcalc.node.ScalarSourceNode;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Diagnostic views of a joint calculation graph: single-node state, the whole
 * topology as text, and a Mermaid diagram of the stage dependencies.
 *
 * <p>
 * Allocates strings. Meant for debugging and error reports, not for sweeps.
 */
public final class GraphExplain {
    private final StabilizationEngine engine;
    private final TopologicalOrder topology;
    private final Map<String, String> logicalTypes;

    public GraphExplain(StabilizationEngine engine) {
        this(engine, Collections.emptyMap());
    }

    /**
     * @param logicalTypes optional node name to label map (e.g. the calculation
     *                     stage of each node) shown in the Mermaid output.
     */
    public GraphExplain(StabilizationEngine engine, Map<String, String> logicalTypes) {
        this.engine = engine;
        this.topology = engine.topology();
        this.logicalTypes = logicalTypes;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String nodeName) {
        int idx = topology.topoIndex(nodeName);
        Node<?> node = topology.node(idx);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(nodeName).append('\n')
                .append("  Topo index: ").append(idx).append('\n')
                .append("  Type: ").append(node.getClass().getSimpleName()).append('\n')
                .append("  Is input: ").append(topology.isSource(idx)).append('\n')
                .append("  Current value: ").append(node.value()).append('\n');
        if (node instanceof ScalarNode sn)
            sb.append("  Previous: ").append(sn.previousDoubleValue()).append('\n');
        int cc = topology.childCount(idx);
        sb.append("  Dependents (").append(cc).append("): ");
        for (int i = 0; i < cc; i++) {
            sb.append(topology.node(topology.child(idx, i)).name());
            if (i < cc - 1)
                sb.append(", ");
        }
        return sb.append('\n').toString();
    }

    public String explainLastStabilization() {
        return "Epoch: " + engine.epoch() + ", Recomputed: " + engine.lastStabilizedCount() + "/" + engine.nodeCount();
    }

    /**
     * Dumps the topology, one node per line with its dependents.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(topology.nodeCount()).append(" nodes):\n");
        for (int i = 0; i < topology.nodeCount(); i++) {
            sb.append("  [").append(i).append("] ").append(topology.node(i).name());
            if (topology.isSource(i))
                sb.append(" (IN)");
            int cc = topology.childCount(i);
            if (cc > 0) {
                sb.append(" -> ");
                for (int j = 0; j < cc; j++) {
                    sb.append(topology.node(topology.child(i, j)).name());
                    if (j < cc - 1)
                        sb.append(", ");
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid flowchart with the current value of every node.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (int i = 0; i < topology.nodeCount(); i++) {
            Node<?> node = topology.node(i);
            String label = logicalTypes.getOrDefault(node.name(), topology.isSource(i) ? "INPUT" : "CALC");
            sb.append("  ").append(sanitize(node.name()))
                    .append("[\"").append(node.name()).append("<br/>").append(label)
                    .append("<br/>").append(formatValue(node)).append("\"];\n");
        }

        for (int i = 0; i < topology.nodeCount(); i++) {
            String from = sanitize(topology.node(i).name());
            int cc = topology.childCount(i);
            for (int j = 0; j < cc; j++) {
                sb.append("  ").append(from).append(" --> ")
                        .append(sanitize(topology.node(topology.child(i, j)).name())).append(";\n");
            }
        }
        return sb.toString();
    }

    private static String formatValue(Node<?> node) {
        if (node instanceof BooleanNode bn)
            return Boolean.toString(bn.booleanValue());
        if (node instanceof ScalarNode sn)
            return String.format(Locale.ROOT, "%.6g", sn.doubleValue());
        if (node instanceof ScalarSourceNode ssn)
            return String.format(Locale.ROOT, "%.6g", ssn.doubleValue());
        return String.valueOf(node.value());
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
