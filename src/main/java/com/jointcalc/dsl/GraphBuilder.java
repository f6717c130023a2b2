package com.jointcalc.dsl;

import com.jointcalc.api.Node;
import com.jointcalc.api.ScalarCutoff;
import com.jointcalc.api.ScalarValue;
import com.jointcalc.engine.GraphContext;
import com.jointcalc.engine.StabilizationEngine;
import com.jointcalc.engine.TopologicalOrder;
import com.jointcalc.fn.DoublePredicate;
import com.jointcalc.fn.Fn1;
import com.jointcalc.fn.Fn2;
import com.jointcalc.fn.Fn3;
import com.jointcalc.fn.FnN;
import com.jointcalc.node.BooleanNode;
import com.jointcalc.node.ScalarCalcNode;
import com.jointcalc.node.ScalarSourceNode;
import com.jointcalc.util.ScalarCutoffs;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fluent API for wiring a calculation graph.
 *
 * Usage Pattern:
 * 1. Create a builder: GraphBuilder g = GraphBuilder.create("M10 flange");
 * 2. Define inputs: var lK = g.scalarSource("stack.lK", 40.0);
 * 3. Define stages: var dS = g.compute("deltaBolt", Resilience::boltResilience, lK, as, eB);
 * 4. Build: GraphContext ctx = g.buildWithContext();
 *
 * Every compute call records one edge per input, so the dependency structure
 * of the stages is exactly the set of arguments passed here.
 *
 * The builder is stateful and not thread-safe. Once built it rejects further
 * nodes.
 */
public final class GraphBuilder {
    private final String graphName;

    private final List<Node<?>> nodes = new ArrayList<>();
    private final Map<String, Node<?>> nodesByName = new HashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final List<String> sourceNames = new ArrayList<>();

    private boolean built;

    private GraphBuilder(String graphName) {
        this.graphName = graphName;
    }

    public static GraphBuilder create(String graphName) {
        return new GraphBuilder(graphName);
    }

    public String graphName() {
        return graphName;
    }

    // ── Sources ──────────────────────────────────────────────────

    /**
     * Creates an input field with EXACT cutoff.
     *
     * @param name         Unique name of the node.
     * @param initialValue Starting value.
     * @return The created ScalarSourceNode.
     */
    public ScalarSourceNode scalarSource(String name, double initialValue) {
        return scalarSource(name, initialValue, ScalarCutoffs.EXACT);
    }

    public ScalarSourceNode scalarSource(String name, double initialValue, ScalarCutoff cutoff) {
        checkNotBuilt();
        var node = new ScalarSourceNode(name, initialValue, cutoff);
        register(node);
        sourceNames.add(name);
        return node;
    }

    // ── Computed scalars (1, 2, 3, N inputs) ────────────────────

    public ScalarCalcNode compute(String name, Fn1 fn, ScalarValue in) {
        return compute(name, ScalarCutoffs.EXACT, fn, in);
    }

    public ScalarCalcNode compute(String name, ScalarCutoff cutoff, Fn1 fn, ScalarValue in) {
        checkNotBuilt();
        var node = new ScalarCalcNode(name, cutoff, () -> fn.apply(in.doubleValue()));
        register(node);
        addEdge(in.name(), name);
        return node;
    }

    public ScalarCalcNode compute(String name, Fn2 fn, ScalarValue in1, ScalarValue in2) {
        return compute(name, ScalarCutoffs.EXACT, fn, in1, in2);
    }

    public ScalarCalcNode compute(String name, ScalarCutoff cutoff, Fn2 fn,
            ScalarValue in1, ScalarValue in2) {
        checkNotBuilt();
        var node = new ScalarCalcNode(name, cutoff,
                () -> fn.apply(in1.doubleValue(), in2.doubleValue()));
        register(node);
        addEdge(in1.name(), name);
        addEdge(in2.name(), name);
        return node;
    }

    public ScalarCalcNode compute(String name, Fn3 fn,
            ScalarValue in1, ScalarValue in2, ScalarValue in3) {
        return compute(name, ScalarCutoffs.EXACT, fn, in1, in2, in3);
    }

    public ScalarCalcNode compute(String name, ScalarCutoff cutoff, Fn3 fn,
            ScalarValue in1, ScalarValue in2, ScalarValue in3) {
        checkNotBuilt();
        var node = new ScalarCalcNode(name, cutoff,
                () -> fn.apply(in1.doubleValue(), in2.doubleValue(), in3.doubleValue()));
        register(node);
        addEdge(in1.name(), name);
        addEdge(in2.name(), name);
        addEdge(in3.name(), name);
        return node;
    }

    /**
     * Defines a stage with N inputs. Values are gathered into a scratch buffer
     * allocated once here, in the order of {@code inputs}.
     */
    public ScalarCalcNode computeN(String name, ScalarValue[] inputs, FnN fn) {
        return computeN(name, ScalarCutoffs.EXACT, inputs, fn);
    }

    public ScalarCalcNode computeN(String name, ScalarCutoff cutoff,
            ScalarValue[] inputs, FnN fn) {
        checkNotBuilt();
        final double[] scratch = new double[inputs.length];
        var node = new ScalarCalcNode(name, cutoff, () -> {
            for (int i = 0; i < inputs.length; i++)
                scratch[i] = inputs[i].doubleValue();
            return fn.apply(scratch);
        });
        register(node);
        for (ScalarValue input : inputs)
            addEdge(input.name(), name);
        return node;
    }

    // ── Conditions ───────────────────────────────────────────────

    /**
     * Creates a boolean condition node over one scalar.
     */
    public BooleanNode condition(String name, ScalarValue input, DoublePredicate pred) {
        checkNotBuilt();
        var node = new BooleanNode(name, () -> pred.test(input.doubleValue()));
        register(node);
        addEdge(input.name(), name);
        return node;
    }

    /**
     * Creates a boolean node that is true when any of the given conditions is.
     */
    public BooleanNode anyOf(String name, BooleanNode... conditions) {
        checkNotBuilt();
        final BooleanNode[] inputs = conditions.clone();
        var node = new BooleanNode(name, () -> {
            for (BooleanNode c : inputs)
                if (c.booleanValue())
                    return true;
            return false;
        });
        register(node);
        for (BooleanNode c : inputs)
            addEdge(c.name(), name);
        return node;
    }

    /**
     * Selects between two inputs based on a boolean condition.
     */
    public ScalarCalcNode select(String name, BooleanNode cond,
            ScalarValue ifTrue, ScalarValue ifFalse) {
        checkNotBuilt();
        var node = new ScalarCalcNode(name, ScalarCutoffs.EXACT,
                () -> cond.booleanValue() ? ifTrue.doubleValue() : ifFalse.doubleValue());
        register(node);
        addEdge(cond.name(), name);
        addEdge(ifTrue.name(), name);
        addEdge(ifFalse.name(), name);
        return node;
    }

    // ── Build ────────────────────────────────────────────────────

    /**
     * Sorts the nodes, rejects cycles and compiles the edge lists.
     *
     * @return The executable engine.
     */
    public StabilizationEngine build() {
        checkNotBuilt();
        built = true;

        var topo = TopologicalOrder.builder();
        for (Node<?> node : nodes)
            topo.addNode(node);
        for (String src : sourceNames)
            topo.markSource(src);
        for (Edge edge : edges)
            topo.addEdge(edge.from, edge.to);

        return new StabilizationEngine(topo.build());
    }

    /**
     * Builds and returns the engine together with the name lookup map.
     */
    public GraphContext buildWithContext() {
        StabilizationEngine engine = build();
        return new GraphContext(graphName, engine, nodesByName);
    }

    @SuppressWarnings("unchecked")
    public <T extends Node<?>> T getNode(String name) {
        return (T) nodesByName.get(name);
    }

    private void register(Node<?> node) {
        if (nodesByName.containsKey(node.name()))
            throw new IllegalArgumentException("Duplicate node name: " + node.name());
        nodes.add(node);
        nodesByName.put(node.name(), node);
    }

    private void addEdge(String from, String to) {
        edges.add(new Edge(from, to));
    }

    private void checkNotBuilt() {
        if (built)
            throw new IllegalStateException("Graph already built");
    }

    public record Edge(String from, String to) {
    }
}
