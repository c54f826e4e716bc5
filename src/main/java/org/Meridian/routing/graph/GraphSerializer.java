package org.Meridian.routing.graph;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;
import org.Meridian.routing.core.RoutingException;
import org.Meridian.routing.io.ArtifactFiles;
import org.Meridian.routing.io.ArtifactTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * FlatBuffers codec for {@link GraphStore}.
 * <p>
 * One root table holds the SoA node and edge vectors, the forward CSR adjacency, turn
 * restriction triples and metadata; the whole buffer is gzip-compressed on disk. Backward
 * adjacency, spatial index and bounds are derived again on load.
 */
@UtilityClass
final class GraphSerializer {
    private static final Logger log = LoggerFactory.getLogger(GraphSerializer.class);

    static final String FILE_IDENTIFIER = "MRDG";
    static final int FORMAT_VERSION = 1;
    private static final long NO_TIMESTAMP = Long.MIN_VALUE;

    // Field slots in the root table
    private static final int FIELD_FORMAT_VERSION = 0;
    private static final int FIELD_NODE_LON = 1;
    private static final int FIELD_NODE_LAT = 2;
    private static final int FIELD_NODE_ELEVATION = 3;
    private static final int FIELD_EDGE_SOURCE = 4;
    private static final int FIELD_EDGE_TARGET = 5;
    private static final int FIELD_EDGE_WEIGHT = 6;
    private static final int FIELD_EDGE_DISTANCE = 7;
    private static final int FIELD_EDGE_BEARING = 8;
    private static final int FIELD_OUT_OFFSETS = 9;
    private static final int FIELD_OUT_EDGES = 10;
    private static final int FIELD_RESTRICTION_FROM = 11;
    private static final int FIELD_RESTRICTION_VIA = 12;
    private static final int FIELD_RESTRICTION_TO = 13;
    private static final int FIELD_CELL_SIZE = 14;
    private static final int FIELD_CREATED_AT_MILLIS = 15;
    private static final int FIELD_SOURCE = 16;
    private static final int FIELD_COUNT = 17;

    static void save(GraphStore graph, Path path) throws IOException {
        Objects.requireNonNull(graph, "graph");
        byte[] payload = toBytes(graph);
        ArtifactFiles.writeCompressed(path, payload);
        log.info("Saved graph ({} nodes, {} edges) to {} [{} bytes uncompressed]",
                graph.nodeCount(), graph.edgeCount(), path, payload.length);
    }

    static GraphStore load(Path path) throws IOException {
        GraphStore graph = fromBuffer(ArtifactFiles.readCompressed(path));
        graph.validate();
        graph.warnIsolatedNodes();
        log.info("Loaded graph ({} nodes, {} edges) from {}", graph.nodeCount(), graph.edgeCount(), path);
        return graph;
    }

    static byte[] toBytes(GraphStore graph) {
        FlatBufferBuilder builder = new FlatBufferBuilder(1024 + graph.edgeCount() * 48 + graph.nodeCount() * 28);
        builder.forceDefaults(true);

        TurnRestrictionIndex restrictions = graph.turnRestrictionIndex();
        int entries = restrictions.entryCount();
        int[] from = new int[entries];
        int[] via = new int[entries];
        int[] to = new int[entries];
        for (int i = 0; i < entries; i++) {
            from[i] = restrictions.fromEdge(i);
            via[i] = restrictions.viaNode(i);
            to[i] = restrictions.toEdge(i);
        }

        int nodeLonVec = ArtifactFiles.createDoubleVector(builder, graph.nodeLonVector());
        int nodeLatVec = ArtifactFiles.createDoubleVector(builder, graph.nodeLatVector());
        int nodeElevationVec = ArtifactFiles.createDoubleVector(builder, graph.nodeElevationVector());
        int edgeSourceVec = ArtifactFiles.createIntVector(builder, graph.edgeSourceVector());
        int edgeTargetVec = ArtifactFiles.createIntVector(builder, graph.edgeTargetVector());
        int edgeWeightVec = ArtifactFiles.createDoubleVector(builder, graph.edgeWeightVector());
        int edgeDistanceVec = ArtifactFiles.createDoubleVector(builder, graph.edgeDistanceVector());
        int edgeBearingVec = ArtifactFiles.createDoubleVector(builder, graph.edgeBearingVector());
        int outOffsetsVec = ArtifactFiles.createIntVector(builder, graph.outOffsetsVector());
        int outEdgesVec = ArtifactFiles.createIntVector(builder, graph.outEdgesVector());
        int fromVec = ArtifactFiles.createIntVector(builder, from);
        int viaVec = ArtifactFiles.createIntVector(builder, via);
        int toVec = ArtifactFiles.createIntVector(builder, to);

        GraphMetadata metadata = graph.metadata();
        int sourceOffset = metadata.getSource() == null ? 0 : builder.createString(metadata.getSource());
        long createdAtMillis = metadata.getCreatedAt() == null ? NO_TIMESTAMP : metadata.getCreatedAt().toEpochMilli();

        builder.startTable(FIELD_COUNT);
        builder.addInt(FIELD_FORMAT_VERSION, FORMAT_VERSION, 0);
        builder.addOffset(FIELD_NODE_LON, nodeLonVec, 0);
        builder.addOffset(FIELD_NODE_LAT, nodeLatVec, 0);
        builder.addOffset(FIELD_NODE_ELEVATION, nodeElevationVec, 0);
        builder.addOffset(FIELD_EDGE_SOURCE, edgeSourceVec, 0);
        builder.addOffset(FIELD_EDGE_TARGET, edgeTargetVec, 0);
        builder.addOffset(FIELD_EDGE_WEIGHT, edgeWeightVec, 0);
        builder.addOffset(FIELD_EDGE_DISTANCE, edgeDistanceVec, 0);
        builder.addOffset(FIELD_EDGE_BEARING, edgeBearingVec, 0);
        builder.addOffset(FIELD_OUT_OFFSETS, outOffsetsVec, 0);
        builder.addOffset(FIELD_OUT_EDGES, outEdgesVec, 0);
        builder.addOffset(FIELD_RESTRICTION_FROM, fromVec, 0);
        builder.addOffset(FIELD_RESTRICTION_VIA, viaVec, 0);
        builder.addOffset(FIELD_RESTRICTION_TO, toVec, 0);
        builder.addDouble(FIELD_CELL_SIZE, graph.cellSizeDegrees(), 0.0d);
        builder.addLong(FIELD_CREATED_AT_MILLIS, createdAtMillis, 0L);
        if (sourceOffset != 0) {
            builder.addOffset(FIELD_SOURCE, sourceOffset, 0);
        }
        int root = builder.endTable();
        builder.finish(root, FILE_IDENTIFIER);
        return builder.sizedByteArray();
    }

    /**
     * Decodes a graph without running {@link GraphStore#validate()}; {@link #load(Path)} does
     * that afterwards.
     *
     * @throws IllegalArgumentException when the buffer is not a readable graph artifact.
     * @throws RoutingException with {@code GRAPH_CONSTRUCTION} when vector lengths or CSR
     *                          offsets are inconsistent.
     */
    static GraphStore fromBuffer(ByteBuffer buffer) {
        ArtifactTable root = ArtifactTable.root(buffer, FILE_IDENTIFIER, "graph artifact");

        int version = root.getInt(FIELD_FORMAT_VERSION, -1);
        if (version != FORMAT_VERSION) {
            throw new IllegalArgumentException(
                    "Unsupported graph format version: expected " + FORMAT_VERSION + ", got " + version);
        }

        double[] nodeLon = requireDoubles(root, FIELD_NODE_LON, "node_lon");
        double[] nodeLat = requireDoubles(root, FIELD_NODE_LAT, "node_lat");
        double[] nodeElevation = requireDoubles(root, FIELD_NODE_ELEVATION, "node_elevation");
        int[] edgeSource = requireInts(root, FIELD_EDGE_SOURCE, "edge_source");
        int[] edgeTarget = requireInts(root, FIELD_EDGE_TARGET, "edge_target");
        double[] edgeWeight = requireDoubles(root, FIELD_EDGE_WEIGHT, "edge_weight");
        double[] edgeDistance = requireDoubles(root, FIELD_EDGE_DISTANCE, "edge_distance");
        double[] edgeBearing = requireDoubles(root, FIELD_EDGE_BEARING, "edge_bearing");
        int[] outOffsets = requireInts(root, FIELD_OUT_OFFSETS, "out_offsets");
        int[] outEdges = requireInts(root, FIELD_OUT_EDGES, "out_edges");
        TurnRestrictionIndex restrictions = TurnRestrictionIndex.of(
                requireInts(root, FIELD_RESTRICTION_FROM, "restriction_from"),
                requireInts(root, FIELD_RESTRICTION_VIA, "restriction_via"),
                requireInts(root, FIELD_RESTRICTION_TO, "restriction_to"));

        long createdAtMillis = root.getLong(FIELD_CREATED_AT_MILLIS, NO_TIMESTAMP);
        GraphMetadata metadata = GraphMetadata.builder()
                .createdAt(createdAtMillis == NO_TIMESTAMP ? null : Instant.ofEpochMilli(createdAtMillis))
                .source(root.getString(FIELD_SOURCE))
                .bounds(GeoBounds.of(nodeLon, nodeLat))
                .build();

        try {
            return new GraphStore(
                    nodeLon,
                    nodeLat,
                    nodeElevation,
                    edgeSource,
                    edgeTarget,
                    edgeWeight,
                    edgeDistance,
                    edgeBearing,
                    outOffsets,
                    outEdges,
                    restrictions,
                    metadata,
                    root.getDouble(FIELD_CELL_SIZE, 0.0d)
            );
        } catch (IllegalArgumentException e) {
            throw new RoutingException(
                    RoutingException.REASON_GRAPH_CONSTRUCTION,
                    "graph artifact is structurally invalid: " + e.getMessage(), e);
        }
    }

    private static int[] requireInts(ArtifactTable table, int slot, String fieldName) {
        int[] values = table.getIntVector(slot);
        if (values == null) {
            throw new IllegalArgumentException("Missing required graph vector " + fieldName);
        }
        return values;
    }

    private static double[] requireDoubles(ArtifactTable table, int slot, String fieldName) {
        double[] values = table.getDoubleVector(slot);
        if (values == null) {
            throw new IllegalArgumentException("Missing required graph vector " + fieldName);
        }
        return values;
    }
}
