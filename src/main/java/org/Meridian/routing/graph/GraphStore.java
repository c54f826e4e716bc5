package org.Meridian.routing.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Meridian.routing.core.RoutingException;
import org.Meridian.routing.spatial.GeoDistance;
import org.Meridian.routing.spatial.GeoPoint;
import org.Meridian.routing.spatial.GridSpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Canonical node/edge storage of the road network.
 * <p>
 * ARCHITECTURAL NOTE:
 * This class is the physical layer every routing component reads from. It is immutable
 * after construction and safe for concurrent reads.
 * <p>
 * Features:
 * - SoA (Structure of Arrays) layout for nodes and edges.
 * - CSR (Compressed Sparse Row) forward and backward adjacency for O(1) neighbour access.
 * - Grid spatial index for nearest-node snapping.
 * - Open-addressing turn restriction lookup.
 * <p>
 * Instances come from {@link GraphBuilder} or {@link #load(Path)}. Either way {@link #validate()}
 * must pass before the graph is handed to preprocessing.
 */
public final class GraphStore {
    private static final Logger log = LoggerFactory.getLogger(GraphStore.class);

    public static final double SLIGHT_TURN_PENALTY = 2.0d;
    public static final double MEDIUM_TURN_PENALTY = 5.0d;
    public static final double SHARP_TURN_PENALTY = 10.0d;
    public static final double U_TURN_PENALTY = 15.0d;

    // ========================================================================
    // DATA BUFFERS (SoA Layout)
    // ========================================================================

    private final double[] nodeLon;
    private final double[] nodeLat;
    private final double[] nodeElevation;

    private final int[] edgeSource;
    private final int[] edgeTarget;
    private final double[] edgeWeight;
    private final double[] edgeDistance;
    private final double[] edgeBearing;

    // CSR Index: outOffsets[node] -> start index in outEdges
    private final int[] outOffsets;
    private final int[] outEdges;
    private final int[] inOffsets;
    private final int[] inEdges;

    private final TurnRestrictionIndex turnRestrictions;
    private final GridSpatialIndex spatialIndex;

    @Getter
    @Accessors(fluent = true)
    private final GraphMetadata metadata;
    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;
    @Getter
    @Accessors(fluent = true)
    private final long signature;

    GraphStore(double[] nodeLon, double[] nodeLat, double[] nodeElevation,
               int[] edgeSource, int[] edgeTarget,
               double[] edgeWeight, double[] edgeDistance, double[] edgeBearing,
               int[] outOffsets, int[] outEdges,
               TurnRestrictionIndex turnRestrictions,
               GraphMetadata metadata,
               double cellSizeDegrees) {
        this.nodeCount = nodeLon.length;
        this.edgeCount = edgeSource.length;
        validateVectorLength("node_lat", nodeLat.length, nodeCount);
        validateVectorLength("node_elevation", nodeElevation.length, nodeCount);
        validateVectorLength("edge_target", edgeTarget.length, edgeCount);
        validateVectorLength("edge_weight", edgeWeight.length, edgeCount);
        validateVectorLength("edge_distance", edgeDistance.length, edgeCount);
        validateVectorLength("edge_bearing", edgeBearing.length, edgeCount);
        validateVectorLength("out_offsets", outOffsets.length, nodeCount + 1);
        validateCsrStructure(outOffsets, nodeCount, outEdges.length);

        this.nodeLon = nodeLon;
        this.nodeLat = nodeLat;
        this.nodeElevation = nodeElevation;
        this.edgeSource = edgeSource;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;
        this.edgeDistance = edgeDistance;
        this.edgeBearing = edgeBearing;
        this.outOffsets = outOffsets;
        this.outEdges = outEdges;
        this.turnRestrictions = Objects.requireNonNull(turnRestrictions, "turnRestrictions");
        this.metadata = metadata == null ? GraphMetadata.empty() : metadata;

        this.inOffsets = new int[nodeCount + 1];
        this.inEdges = buildReverseAdjacency();
        this.spatialIndex = GridSpatialIndex.build(nodeLon, nodeLat, cellSizeDegrees);
        this.signature = GraphSignature.compute(nodeCount, edgeSource, edgeTarget, edgeWeight);
    }

    /**
     * Derives backward adjacency from the forward buckets, ascending edge id within each bucket.
     * Entries that reference missing edges or out-of-range targets are skipped here and
     * reported by {@link #validate()}.
     */
    private int[] buildReverseAdjacency() {
        boolean[] indexed = new boolean[edgeCount];
        for (int edgeId : outEdges) {
            if (isIndexedEdge(edgeId)) {
                indexed[edgeId] = true;
            }
        }
        int[] counts = new int[nodeCount];
        int valid = 0;
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            if (indexed[edgeId]) {
                counts[edgeTarget[edgeId]]++;
                valid++;
            }
        }
        for (int n = 0; n < nodeCount; n++) {
            inOffsets[n + 1] = inOffsets[n] + counts[n];
        }
        int[] cursor = new int[nodeCount];
        System.arraycopy(inOffsets, 0, cursor, 0, nodeCount);
        int[] reverse = new int[valid];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            if (indexed[edgeId]) {
                reverse[cursor[edgeTarget[edgeId]]++] = edgeId;
            }
        }
        return reverse;
    }

    private boolean isIndexedEdge(int edgeId) {
        return edgeId >= 0 && edgeId < edgeCount
                && edgeTarget[edgeId] >= 0 && edgeTarget[edgeId] < nodeCount;
    }

    // ========================================================================
    // CHECKED LOOKUPS
    // ========================================================================

    /**
     * Returns the node with the given id, or empty when the id is out of range.
     */
    public Optional<Node> node(int nodeId) {
        if (!containsNode(nodeId)) {
            return Optional.empty();
        }
        return Optional.of(new Node(nodeId, nodeLon[nodeId], nodeLat[nodeId], nodeElevation[nodeId]));
    }

    /**
     * Returns the edge with the given id, or empty when the id is out of range.
     */
    public Optional<Edge> edge(int edgeId) {
        if (!containsEdge(edgeId)) {
            return Optional.empty();
        }
        return Optional.of(new Edge(edgeId, edgeSource[edgeId], edgeTarget[edgeId],
                new EdgeCost(edgeWeight[edgeId], edgeDistance[edgeId], edgeBearing[edgeId])));
    }

    public boolean containsNode(int nodeId) {
        return nodeId >= 0 && nodeId < nodeCount;
    }

    public boolean containsEdge(int edgeId) {
        return edgeId >= 0 && edgeId < edgeCount;
    }

    /**
     * Outgoing edge ids of a node; empty for an isolated or unknown node.
     */
    public IntList outgoingEdges(int nodeId) {
        if (!containsNode(nodeId)) {
            return IntLists.EMPTY_LIST;
        }
        return IntLists.unmodifiable(IntArrayList.wrap(outEdges).subList(outOffsets[nodeId], outOffsets[nodeId + 1]));
    }

    /**
     * Incoming edge ids of a node; empty for an isolated or unknown node.
     */
    public IntList incomingEdges(int nodeId) {
        if (!containsNode(nodeId)) {
            return IntLists.EMPTY_LIST;
        }
        return IntLists.unmodifiable(IntArrayList.wrap(inEdges).subList(inOffsets[nodeId], inOffsets[nodeId + 1]));
    }

    public int outDegree(int nodeId) {
        return containsNode(nodeId) ? outOffsets[nodeId + 1] - outOffsets[nodeId] : 0;
    }

    public int inDegree(int nodeId) {
        return containsNode(nodeId) ? inOffsets[nodeId + 1] - inOffsets[nodeId] : 0;
    }

    // ========================================================================
    // UNCHECKED ACCESSORS (hot paths, caller must ensure ids are valid)
    // ========================================================================

    public int edgeSource(int edgeId) {
        assert containsEdge(edgeId) : "Edge " + edgeId + " out of bounds";
        return edgeSource[edgeId];
    }

    public int edgeTarget(int edgeId) {
        assert containsEdge(edgeId) : "Edge " + edgeId + " out of bounds";
        return edgeTarget[edgeId];
    }

    public double edgeWeight(int edgeId) {
        assert containsEdge(edgeId);
        return edgeWeight[edgeId];
    }

    public double edgeDistance(int edgeId) {
        assert containsEdge(edgeId);
        return edgeDistance[edgeId];
    }

    public double edgeBearing(int edgeId) {
        assert containsEdge(edgeId);
        return edgeBearing[edgeId];
    }

    public double nodeLon(int nodeId) {
        assert containsNode(nodeId);
        return nodeLon[nodeId];
    }

    public double nodeLat(int nodeId) {
        assert containsNode(nodeId);
        return nodeLat[nodeId];
    }

    public double nodeElevation(int nodeId) {
        assert containsNode(nodeId);
        return nodeElevation[nodeId];
    }

    public GeoPoint nodeLocation(int nodeId) {
        return new GeoPoint(nodeLon(nodeId), nodeLat(nodeId));
    }

    /**
     * Returns a zero-allocation adjacency iterator.
     */
    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    /**
     * Reusable cursor over one adjacency bucket. Not thread-safe; one per search.
     */
    public static final class EdgeIterator {
        private final GraphStore graph;
        private int[] bucket;
        private int current;
        private int end;

        EdgeIterator(GraphStore graph) {
            this.graph = graph;
            this.bucket = graph.outEdges;
        }

        /**
         * Resets iterator to traverse edges leaving {@code nodeId}.
         */
        public EdgeIterator resetOutgoing(int nodeId) {
            this.bucket = graph.outEdges;
            this.current = graph.outOffsets[nodeId];
            this.end = graph.outOffsets[nodeId + 1];
            return this;
        }

        /**
         * Resets iterator to traverse edges arriving at {@code nodeId}.
         */
        public EdgeIterator resetIncoming(int nodeId) {
            this.bucket = graph.inEdges;
            this.current = graph.inOffsets[nodeId];
            this.end = graph.inOffsets[nodeId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        /**
         * @return next edge id in the bucket.
         */
        public int next() {
            if (current >= end) throw new NoSuchElementException();
            return bucket[current++];
        }
    }

    // ========================================================================
    // SPATIAL & TURN LOOKUPS
    // ========================================================================

    /**
     * Snaps a coordinate to the closest node in its 3x3 grid-cell neighbourhood.
     *
     * @return node id, or empty when the graph is empty or no node lies in the neighbourhood.
     */
    public OptionalInt nearestNode(GeoPoint point) {
        Objects.requireNonNull(point, "point");
        int nodeId = spatialIndex.nearest(point.lon(), point.lat());
        return nodeId == GridSpatialIndex.NO_NODE ? OptionalInt.empty() : OptionalInt.of(nodeId);
    }

    /**
     * Returns all nodes within {@code radiusMeters} of the point, in ascending id order.
     */
    public int[] nodesWithinRadius(GeoPoint point, double radiusMeters) {
        Objects.requireNonNull(point, "point");
        return spatialIndex.withinRadius(point.lon(), point.lat(), radiusMeters);
    }

    public double cellSizeDegrees() {
        return spatialIndex.cellSizeDegrees();
    }

    public boolean isTurnRestricted(int fromEdge, int viaNode, int toEdge) {
        return turnRestrictions.isRestricted(fromEdge, viaNode, toEdge);
    }

    public boolean hasTurnRestrictions() {
        return turnRestrictions.size() > 0;
    }

    public List<TurnRestriction> turnRestrictions() {
        return turnRestrictions.toList();
    }

    TurnRestrictionIndex turnRestrictionIndex() {
        return turnRestrictions;
    }

    /**
     * Bearing-based penalty for turning from one edge onto another.
     * <p>
     * The absolute bearing difference (folded into [0, 180]) is bucketed: up to 30 degrees is
     * a slight turn, up to 90 medium, up to 150 sharp, beyond that a U-turn. The penalty is a
     * query-layer cost and is never folded into static edge weights.
     *
     * @return penalty in seconds, or empty when either edge id is unknown.
     */
    public OptionalDouble turnPenalty(int fromEdge, int toEdge) {
        if (!containsEdge(fromEdge) || !containsEdge(toEdge)) {
            return OptionalDouble.empty();
        }
        double angle = GeoDistance.bearingDifferenceDegrees(edgeBearing[fromEdge], edgeBearing[toEdge]);
        if (angle <= 30.0d) {
            return OptionalDouble.of(SLIGHT_TURN_PENALTY);
        }
        if (angle <= 90.0d) {
            return OptionalDouble.of(MEDIUM_TURN_PENALTY);
        }
        if (angle <= 150.0d) {
            return OptionalDouble.of(SHARP_TURN_PENALTY);
        }
        return OptionalDouble.of(U_TURN_PENALTY);
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    /**
     * Checks adjacency/edge consistency.
     * <p>
     * Fails with {@link RoutingException#REASON_EDGE_NOT_FOUND} when an adjacency entry names a
     * missing edge, and with {@link RoutingException#REASON_GRAPH_CONSTRUCTION} for every other
     * structural defect: an edge filed under a bucket other than its source, an edge missing from
     * or repeated in adjacency, out-of-range endpoints, invalid weights or coordinates, and turn
     * restrictions that do not chain through their via node.
     *
     * @throws RoutingException on the first defect found.
     */
    public void validate() {
        boolean[] filed = new boolean[edgeCount];
        for (int n = 0; n < nodeCount; n++) {
            for (int pos = outOffsets[n]; pos < outOffsets[n + 1]; pos++) {
                int edgeId = outEdges[pos];
                if (!containsEdge(edgeId)) {
                    throw new RoutingException(RoutingException.REASON_EDGE_NOT_FOUND,
                            "adjacency of node " + n + " references missing edge " + edgeId);
                }
                if (edgeSource[edgeId] != n) {
                    throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                            "edge " + edgeId + " has wrong source: filed under node " + n
                                    + " but records source " + edgeSource[edgeId]);
                }
                if (filed[edgeId]) {
                    throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                            "edge " + edgeId + " is listed more than once in adjacency");
                }
                filed[edgeId] = true;
            }
        }

        for (int e = 0; e < edgeCount; e++) {
            if (!containsNode(edgeSource[e]) || !containsNode(edgeTarget[e])) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "edge " + e + " has out-of-range endpoint: " + edgeSource[e] + " -> " + edgeTarget[e]);
            }
            if (!filed[e]) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "edge " + e + " is missing from adjacency of node " + edgeSource[e]);
            }
            if (!Double.isFinite(edgeWeight[e]) || edgeWeight[e] < 0.0d) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "edge " + e + " weight must be finite and >= 0, got " + edgeWeight[e]);
            }
        }

        for (int n = 0; n < nodeCount; n++) {
            for (int pos = inOffsets[n]; pos < inOffsets[n + 1]; pos++) {
                if (edgeTarget[inEdges[pos]] != n) {
                    throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                            "edge " + inEdges[pos] + " is filed as incoming to node " + n
                                    + " but targets " + edgeTarget[inEdges[pos]]);
                }
            }
            if (!Double.isFinite(nodeLon[n]) || !Double.isFinite(nodeLat[n])) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "node " + n + " has non-finite coordinates (" + nodeLon[n] + ", " + nodeLat[n] + ")");
            }
        }

        for (int i = 0; i < turnRestrictions.entryCount(); i++) {
            int from = turnRestrictions.fromEdge(i);
            int via = turnRestrictions.viaNode(i);
            int to = turnRestrictions.toEdge(i);
            if (!containsEdge(from) || !containsEdge(to)) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "turn restriction " + i + " references missing edge: " + from + " -> " + to);
            }
            if (edgeTarget[from] != via || edgeSource[to] != via) {
                throw new RoutingException(RoutingException.REASON_GRAPH_CONSTRUCTION,
                        "turn restriction " + i + " does not pass through via node " + via);
            }
        }
    }

    /**
     * Warns once about degree-0 nodes; called where a graph is built or loaded, not from
     * {@link #validate()}, which may run again before preprocessing.
     */
    void warnIsolatedNodes() {
        int isolated = isolatedNodeCount();
        if (isolated > 0) {
            log.warn("Graph contains {} isolated nodes (degree 0)", isolated);
        }
    }

    /**
     * Number of nodes with neither incoming nor outgoing edges.
     */
    public int isolatedNodeCount() {
        int isolated = 0;
        for (int n = 0; n < nodeCount; n++) {
            if (outDegree(n) == 0 && inDegree(n) == 0) {
                isolated++;
            }
        }
        return isolated;
    }

    private static void validateVectorLength(String fieldName, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalArgumentException(
                    fieldName + " length mismatch: expected " + expected + ", got " + actual);
        }
    }

    private static void validateCsrStructure(int[] offsets, int nodeCount, int entryCount) {
        if (offsets[0] != 0) {
            throw new IllegalArgumentException("Malformed out_offsets: out_offsets[0] must be 0, got " + offsets[0]);
        }
        for (int i = 1; i <= nodeCount; i++) {
            if (offsets[i] < offsets[i - 1] || offsets[i] > entryCount) {
                throw new IllegalArgumentException(
                        "Malformed out_offsets: non-monotonic or out of range at index " + i
                                + " (" + offsets[i - 1] + " -> " + offsets[i] + ")");
            }
        }
        if (offsets[nodeCount] != entryCount) {
            throw new IllegalArgumentException(
                    "Malformed out_offsets: out_offsets[node_count] must equal " + entryCount
                            + ", got " + offsets[nodeCount]);
        }
    }

    // ========================================================================
    // PERSISTENCE
    // ========================================================================

    /**
     * Writes this graph as a gzip-compressed FlatBuffers artifact.
     */
    public void save(Path path) throws IOException {
        GraphSerializer.save(this, path);
    }

    /**
     * Reads a graph written by {@link #save(Path)} and validates it.
     *
     * @throws RoutingException when the loaded content is structurally inconsistent.
     */
    public static GraphStore load(Path path) throws IOException {
        return GraphSerializer.load(path);
    }

    // Raw vectors for the serializer; never exposed outside the package.
    double[] nodeLonVector() { return nodeLon; }
    double[] nodeLatVector() { return nodeLat; }
    double[] nodeElevationVector() { return nodeElevation; }
    int[] edgeSourceVector() { return edgeSource; }
    int[] edgeTargetVector() { return edgeTarget; }
    double[] edgeWeightVector() { return edgeWeight; }
    double[] edgeDistanceVector() { return edgeDistance; }
    double[] edgeBearingVector() { return edgeBearing; }
    int[] outOffsetsVector() { return outOffsets; }
    int[] outEdgesVector() { return outEdges; }

    @Override
    public String toString() {
        return String.format("GraphStore[nodes=%d, edges=%d, avgDegree=%.2f, turnRestrictions=%d]",
                nodeCount, edgeCount, nodeCount > 0 ? (double) edgeCount / nodeCount : 0.0d,
                turnRestrictions.size());
    }
}
