package com.jointcalc.engine;

import com.jointcalc.api.Node;

import java.util.Map;

/**
 * A built graph: the engine that drives it plus name-based node lookup.
 *
 * Returned by GraphBuilder.buildWithContext(). JointGraph keeps one of these
 * per joint and resolves input fields and derived quantities through it.
 *
 * The context itself is immutable. The nodes it returns are mutable state
 * owned by the engine and must only be read between stabilization passes.
 */
public final class GraphContext {
    private final String name;
    private final StabilizationEngine engine;
    private final Map<String, Node<?>> nodesByName;

    public GraphContext(String name, StabilizationEngine engine, Map<String, Node<?>> nodesByName) {
        this.name = name;
        this.engine = engine;
        this.nodesByName = Map.copyOf(nodesByName);
    }

    public String name() {
        return name;
    }

    public StabilizationEngine engine() {
        return engine;
    }

    public Map<String, Node<?>> nodesByName() {
        return nodesByName;
    }

    /**
     * Type-safe lookup of a node by name.
     *
     * @return The node, or null if not found.
     */
    @SuppressWarnings("unchecked")
    public <T extends Node<?>> T node(String name) {
        return (T) nodesByName.get(name);
    }

    /**
     * Resolves a node name to its topological index.
     *
     * @throws IllegalArgumentException if the name is unknown.
     */
    public int getNodeId(String name) {
        return engine.topology().topoIndex(name);
    }
}
