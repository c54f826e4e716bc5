package org.Meridian.routing.ch;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Meridian.routing.graph.GraphStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Immutable contraction hierarchy over one {@link GraphStore}.
 * <p>
 * Owns the node order, the arc arena (graph edges followed by shortcuts), the flat shortcut
 * table and CSR forward/backward adjacency over all arcs. Arc ids below {@link #edgeCount()}
 * are edge ids of the underlying graph. Instances are safe to share between threads.
 */
public final class ContractionHierarchies {
    /** Relative slack allowed between a shortcut cost and the sum of its constituents. */
    private static final double COST_TOLERANCE = 1e-9d;

    @Getter
    @Accessors(fluent = true)
    private final NodeOrder nodeOrder;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    @Getter
    @Accessors(fluent = true)
    private final long graphSignature;

    private final int[] arcSource;
    private final int[] arcTarget;
    private final double[] arcCost;

    private final int[] shortcutVia;
    private final int[] shortcutLowerArc;
    private final int[] shortcutUpperArc;

    // CSR over arcs by source (forward) and by target (backward), ascending arc id per bucket
    private final int[] forwardOffsets;
    private final int[] forwardArcs;
    private final int[] backwardOffsets;
    private final int[] backwardArcs;

    private ContractionHierarchies(
            NodeOrder nodeOrder,
            int nodeCount,
            int edgeCount,
            long graphSignature,
            int[] arcSource,
            int[] arcTarget,
            double[] arcCost,
            int[] shortcutVia,
            int[] shortcutLowerArc,
            int[] shortcutUpperArc
    ) {
        this.nodeOrder = nodeOrder;
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
        this.graphSignature = graphSignature;
        this.arcSource = arcSource;
        this.arcTarget = arcTarget;
        this.arcCost = arcCost;
        this.shortcutVia = shortcutVia;
        this.shortcutLowerArc = shortcutLowerArc;
        this.shortcutUpperArc = shortcutUpperArc;
        this.forwardOffsets = new int[nodeCount + 1];
        this.forwardArcs = new int[arcSource.length];
        this.backwardOffsets = new int[nodeCount + 1];
        this.backwardArcs = new int[arcSource.length];
        bucketArcs(arcSource, forwardOffsets, forwardArcs);
        bucketArcs(arcTarget, backwardOffsets, backwardArcs);
    }

    /**
     * Validates {@code graph}, orders it with {@link DegreeNodeOrderer} and contracts it with
     * default witness bounds.
     */
    public static ContractionHierarchies preprocess(GraphStore graph) {
        return preprocess(graph, new DegreeNodeOrderer(), ContractionConfig.defaults());
    }

    /**
     * Validates {@code graph}, orders it and contracts every node.
     *
     * @param graph graph to contract.
     * @param orderer contraction order strategy.
     * @param config witness bounds.
     * @return immutable hierarchy.
     * @throws org.Meridian.routing.core.RoutingException when the graph fails validation.
     */
    public static ContractionHierarchies preprocess(GraphStore graph, NodeOrderer orderer, ContractionConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(orderer, "orderer");
        Objects.requireNonNull(config, "config");
        graph.validate();
        NodeOrder order = Objects.requireNonNull(orderer.order(graph), "orderer returned null");
        return new Contractor(graph, order, config).contract();
    }

    /**
     * Runs {@link #preprocess(GraphStore, NodeOrderer, ContractionConfig)} on {@code executor}.
     * The hierarchy becomes visible only once the returned future completes.
     */
    public static CompletableFuture<ContractionHierarchies> preprocessAsync(
            GraphStore graph,
            NodeOrderer orderer,
            ContractionConfig config,
            Executor executor
    ) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> preprocess(graph, orderer, config), executor);
    }

    /**
     * Builds a hierarchy from graph edges plus a shortcut table, as produced by contraction or
     * read back from an artifact.
     */
    static ContractionHierarchies assemble(
            GraphStore graph,
            NodeOrder order,
            int[] shortcutSource,
            int[] shortcutTarget,
            double[] shortcutCost,
            int[] shortcutVia,
            int[] shortcutLowerArc,
            int[] shortcutUpperArc,
            long graphSignature
    ) {
        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();
        int shortcutCount = shortcutSource.length;
        if (shortcutTarget.length != shortcutCount
                || shortcutCost.length != shortcutCount
                || shortcutVia.length != shortcutCount
                || shortcutLowerArc.length != shortcutCount
                || shortcutUpperArc.length != shortcutCount) {
            throw new IllegalArgumentException("shortcut vector length mismatch");
        }
        if (order.size() != nodeCount) {
            throw new IllegalArgumentException(
                    "node order size " + order.size() + " does not match node count " + nodeCount);
        }

        int arcCount = edgeCount + shortcutCount;
        int[] arcSource = new int[arcCount];
        int[] arcTarget = new int[arcCount];
        double[] arcCost = new double[arcCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            arcSource[edgeId] = graph.edgeSource(edgeId);
            arcTarget[edgeId] = graph.edgeTarget(edgeId);
            arcCost[edgeId] = graph.edgeWeight(edgeId);
        }
        for (int i = 0; i < shortcutCount; i++) {
            int arc = edgeCount + i;
            int source = shortcutSource[i];
            int target = shortcutTarget[i];
            int via = shortcutVia[i];
            int lower = shortcutLowerArc[i];
            int upper = shortcutUpperArc[i];
            requireNode(source, nodeCount, "source", i);
            requireNode(target, nodeCount, "target", i);
            requireNode(via, nodeCount, "via", i);
            // Constituents always precede the shortcut built from them.
            if (lower < 0 || lower >= arc || upper < 0 || upper >= arc) {
                throw new IllegalArgumentException("shortcut " + i + " references arc outside [0, " + arc + ")");
            }
            if (arcSource[lower] != source || arcTarget[lower] != via
                    || arcSource[upper] != via || arcTarget[upper] != target) {
                throw new IllegalArgumentException("shortcut " + i + " constituents do not form " + source
                        + " -> " + via + " -> " + target);
            }
            double expected = arcCost[lower] + arcCost[upper];
            if (Math.abs(shortcutCost[i] - expected) > COST_TOLERANCE * Math.max(1.0d, Math.abs(expected))) {
                throw new IllegalArgumentException("shortcut " + i + " cost " + shortcutCost[i]
                        + " differs from its constituents' sum " + expected);
            }
            arcSource[arc] = source;
            arcTarget[arc] = target;
            arcCost[arc] = shortcutCost[i];
        }

        return new ContractionHierarchies(
                order,
                nodeCount,
                edgeCount,
                graphSignature,
                arcSource,
                arcTarget,
                arcCost,
                Arrays.copyOf(shortcutVia, shortcutCount),
                Arrays.copyOf(shortcutLowerArc, shortcutCount),
                Arrays.copyOf(shortcutUpperArc, shortcutCount)
        );
    }

    private static void requireNode(int node, int nodeCount, String role, int shortcutId) {
        if (node < 0 || node >= nodeCount) {
            throw new IllegalArgumentException("shortcut " + shortcutId + " " + role + " node " + node
                    + " out of bounds [0, " + nodeCount + ")");
        }
    }

    private void bucketArcs(int[] keys, int[] offsets, int[] arcs) {
        for (int key : keys) {
            offsets[key + 1]++;
        }
        for (int n = 0; n < nodeCount; n++) {
            offsets[n + 1] += offsets[n];
        }
        int[] cursor = Arrays.copyOf(offsets, nodeCount);
        for (int arc = 0; arc < keys.length; arc++) {
            arcs[cursor[keys[arc]]++] = arc;
        }
    }

    public int shortcutCount() {
        return shortcutVia.length;
    }

    public int arcCount() {
        return arcSource.length;
    }

    public boolean isShortcut(int arc) {
        return arc >= edgeCount && arc < arcSource.length;
    }

    public int rank(int node) {
        return nodeOrder.rank(node);
    }

    /**
     * Returns a shortcut by id in {@code [0, shortcutCount())}.
     */
    public Shortcut shortcut(int shortcutId) {
        if (shortcutId < 0 || shortcutId >= shortcutVia.length) {
            throw new IllegalArgumentException("shortcutId " + shortcutId + " out of bounds [0, " + shortcutVia.length + ")");
        }
        int arc = edgeCount + shortcutId;
        return new Shortcut(
                arcSource[arc],
                arcTarget[arc],
                arcCost[arc],
                shortcutVia[shortcutId],
                shortcutLowerArc[shortcutId],
                shortcutUpperArc[shortcutId]);
    }

    public int arcSource(int arc) {
        return arcSource[arc];
    }

    public int arcTarget(int arc) {
        return arcTarget[arc];
    }

    public double arcCost(int arc) {
        return arcCost[arc];
    }

    int lowerArc(int arc) {
        return shortcutLowerArc[arc - edgeCount];
    }

    int upperArc(int arc) {
        return shortcutUpperArc[arc - edgeCount];
    }

    int[] rankVector() {
        return nodeOrder.rankVector();
    }

    int forwardStart(int node) {
        return forwardOffsets[node];
    }

    int forwardEnd(int node) {
        return forwardOffsets[node + 1];
    }

    int forwardArc(int index) {
        return forwardArcs[index];
    }

    int backwardStart(int node) {
        return backwardOffsets[node];
    }

    int backwardEnd(int node) {
        return backwardOffsets[node + 1];
    }

    int backwardArc(int index) {
        return backwardArcs[index];
    }

    /**
     * Returns whether this hierarchy was built from a graph with the same structure and weights.
     */
    public boolean isCompatibleWith(GraphStore graph) {
        return graph.signature() == graphSignature
                && graph.nodeCount() == nodeCount
                && graph.edgeCount() == edgeCount;
    }

    /**
     * Persists ranks and shortcuts; the graph itself is saved separately.
     */
    public void save(Path path) throws IOException {
        HierarchySerializer.save(this, path);
    }

    /**
     * Loads a hierarchy saved by {@link #save(Path)} for {@code graph}.
     *
     * @throws org.Meridian.routing.core.RoutingException with {@code HIERARCHY_MISMATCH} when the
     *                                                    artifact was built for another graph.
     */
    public static ContractionHierarchies load(Path path, GraphStore graph) throws IOException {
        return HierarchySerializer.load(path, graph);
    }

    @Override
    public String toString() {
        return "ContractionHierarchies{nodes=" + nodeCount + ", edges=" + edgeCount
                + ", shortcuts=" + shortcutCount() + "}";
    }
}
