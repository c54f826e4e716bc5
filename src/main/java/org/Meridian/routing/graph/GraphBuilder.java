package org.Meridian.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Meridian.routing.spatial.GeoDistance;
import org.Meridian.routing.spatial.GridSpatialIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * Incremental builder that turns a raw node/edge list into a validated {@link GraphStore}.
 * <p>
 * Node ids are assigned densely in insertion order, edge ids likewise. Edge distance and
 * bearing are derived from node coordinates unless an explicit {@link EdgeCost} is given.
 * A builder is single-use and not thread-safe.
 */
public final class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final DoubleArrayList nodeLon = new DoubleArrayList();
    private final DoubleArrayList nodeLat = new DoubleArrayList();
    private final DoubleArrayList nodeElevation = new DoubleArrayList();

    private final IntArrayList edgeSource = new IntArrayList();
    private final IntArrayList edgeTarget = new IntArrayList();
    private final DoubleArrayList edgeWeight = new DoubleArrayList();
    private final DoubleArrayList edgeDistance = new DoubleArrayList();
    private final DoubleArrayList edgeBearing = new DoubleArrayList();

    private final IntArrayList restrictionFrom = new IntArrayList();
    private final IntArrayList restrictionVia = new IntArrayList();
    private final IntArrayList restrictionTo = new IntArrayList();

    private double cellSizeDegrees = GridSpatialIndex.DEFAULT_CELL_SIZE_DEGREES;
    private String source;
    private Instant createdAt;
    private boolean built;

    /**
     * Adds a node without elevation.
     *
     * @return the new node id.
     */
    public int addNode(double lon, double lat) {
        return addNode(lon, lat, Double.NaN);
    }

    /**
     * Adds a node.
     *
     * @param elevation elevation in meters, {@link Double#NaN} when unknown.
     * @return the new node id.
     */
    public int addNode(double lon, double lat, double elevation) {
        ensureNotBuilt();
        if (!Double.isFinite(lon) || !Double.isFinite(lat)) {
            throw new IllegalArgumentException("node coordinates must be finite, got (" + lon + ", " + lat + ")");
        }
        nodeLon.add(lon);
        nodeLat.add(lat);
        nodeElevation.add(elevation);
        return nodeLon.size() - 1;
    }

    /**
     * Adds a directed edge whose distance and bearing are derived from node coordinates.
     *
     * @return the new edge id.
     */
    public int addEdge(int source, int target, double weight) {
        requireNode(source, "source");
        requireNode(target, "target");
        double lat1 = nodeLat.getDouble(source);
        double lon1 = nodeLon.getDouble(source);
        double lat2 = nodeLat.getDouble(target);
        double lon2 = nodeLon.getDouble(target);
        return addEdge(source, target, new EdgeCost(
                weight,
                GeoDistance.haversineMeters(lat1, lon1, lat2, lon2),
                GeoDistance.initialBearingDegrees(lat1, lon1, lat2, lon2)));
    }

    /**
     * Adds a directed edge with an explicit cost record.
     *
     * @return the new edge id.
     */
    public int addEdge(int source, int target, EdgeCost cost) {
        ensureNotBuilt();
        Objects.requireNonNull(cost, "cost");
        requireNode(source, "source");
        requireNode(target, "target");
        if (!Double.isFinite(cost.weight()) || cost.weight() < 0.0d) {
            throw new IllegalArgumentException("edge weight must be finite and >= 0, got " + cost.weight());
        }
        edgeSource.add(source);
        edgeTarget.add(target);
        edgeWeight.add(cost.weight());
        edgeDistance.add(cost.distanceMeters());
        edgeBearing.add(cost.bearingDegrees());
        return edgeSource.size() - 1;
    }

    /**
     * Adds the two directed edges of a two-way street.
     *
     * @return {@code {idOf(a->b), idOf(b->a)}}.
     */
    public int[] addBidirectionalEdge(int a, int b, double weight) {
        int forward = addEdge(a, b, weight);
        int backward = addEdge(b, a, weight);
        return new int[]{forward, backward};
    }

    /**
     * Forbids the transition {@code fromEdge -> viaNode -> toEdge}. Consistency is checked on build.
     */
    public GraphBuilder addTurnRestriction(int fromEdge, int viaNode, int toEdge) {
        ensureNotBuilt();
        restrictionFrom.add(fromEdge);
        restrictionVia.add(viaNode);
        restrictionTo.add(toEdge);
        return this;
    }

    public GraphBuilder cellSizeDegrees(double cellSizeDegrees) {
        if (!Double.isFinite(cellSizeDegrees) || cellSizeDegrees <= 0.0d) {
            throw new IllegalArgumentException("cellSizeDegrees must be finite and > 0, got " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        return this;
    }

    public GraphBuilder source(String source) {
        this.source = source;
        return this;
    }

    public GraphBuilder createdAt(Instant createdAt) {
        this.createdAt = createdAt;
        return this;
    }

    public int nodeCount() {
        return nodeLon.size();
    }

    public int edgeCount() {
        return edgeSource.size();
    }

    /**
     * Lays out CSR adjacency, builds the spatial and turn indexes and validates the result.
     *
     * @throws org.Meridian.routing.core.RoutingException when the graph is inconsistent.
     */
    public GraphStore build() {
        ensureNotBuilt();
        built = true;

        int nodeCount = nodeLon.size();
        int[] sources = edgeSource.toIntArray();

        // Counting sort by source keeps insertion order inside each bucket.
        int[] outOffsets = new int[nodeCount + 1];
        for (int source : sources) {
            outOffsets[source + 1]++;
        }
        for (int n = 0; n < nodeCount; n++) {
            outOffsets[n + 1] += outOffsets[n];
        }
        int[] cursor = new int[nodeCount];
        System.arraycopy(outOffsets, 0, cursor, 0, nodeCount);
        int[] outEdges = new int[sources.length];
        for (int edgeId = 0; edgeId < sources.length; edgeId++) {
            outEdges[cursor[sources[edgeId]]++] = edgeId;
        }

        double[] lon = nodeLon.toDoubleArray();
        double[] lat = nodeLat.toDoubleArray();
        GraphMetadata metadata = GraphMetadata.builder()
                .createdAt(createdAt == null ? Instant.now() : createdAt)
                .source(source)
                .bounds(GeoBounds.of(lon, lat))
                .build();

        GraphStore graph = new GraphStore(
                lon,
                lat,
                nodeElevation.toDoubleArray(),
                sources,
                edgeTarget.toIntArray(),
                edgeWeight.toDoubleArray(),
                edgeDistance.toDoubleArray(),
                edgeBearing.toDoubleArray(),
                outOffsets,
                outEdges,
                TurnRestrictionIndex.of(
                        restrictionFrom.toIntArray(),
                        restrictionVia.toIntArray(),
                        restrictionTo.toIntArray()),
                metadata,
                cellSizeDegrees
        );
        graph.validate();
        graph.warnIsolatedNodes();
        log.info("Built graph with {} nodes, {} edges, {} turn restrictions",
                graph.nodeCount(), graph.edgeCount(), restrictionFrom.size());
        return graph;
    }

    private void requireNode(int nodeId, String name) {
        if (nodeId < 0 || nodeId >= nodeLon.size()) {
            throw new IllegalArgumentException(name + " node " + nodeId + " out of bounds [0, " + nodeLon.size() + ")");
        }
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("GraphBuilder has already been built");
        }
    }
}
