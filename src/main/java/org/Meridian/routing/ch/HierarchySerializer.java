package org.Meridian.routing.ch;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;
import org.Meridian.routing.core.RoutingException;
import org.Meridian.routing.graph.GraphStore;
import org.Meridian.routing.io.ArtifactFiles;
import org.Meridian.routing.io.ArtifactTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Objects;

/**
 * FlatBuffers codec for {@link ContractionHierarchies}.
 * <p>
 * Stores node ranks, the shortcut table and the signature of the graph the hierarchy was
 * built from. Graph edges are not duplicated: loading requires the matching graph.
 */
@UtilityClass
final class HierarchySerializer {
    private static final Logger log = LoggerFactory.getLogger(HierarchySerializer.class);

    static final String FILE_IDENTIFIER = "MRCH";
    static final int FORMAT_VERSION = 1;

    private static final int FIELD_FORMAT_VERSION = 0;
    private static final int FIELD_NODE_COUNT = 1;
    private static final int FIELD_EDGE_COUNT = 2;
    private static final int FIELD_GRAPH_SIGNATURE = 3;
    private static final int FIELD_RANKS = 4;
    private static final int FIELD_SHORTCUT_SOURCE = 5;
    private static final int FIELD_SHORTCUT_TARGET = 6;
    private static final int FIELD_SHORTCUT_COST = 7;
    private static final int FIELD_SHORTCUT_VIA = 8;
    private static final int FIELD_SHORTCUT_LOWER = 9;
    private static final int FIELD_SHORTCUT_UPPER = 10;
    private static final int FIELD_COUNT = 11;

    static void save(ContractionHierarchies hierarchies, Path path) throws IOException {
        Objects.requireNonNull(hierarchies, "hierarchies");
        byte[] payload = toBytes(hierarchies);
        ArtifactFiles.writeCompressed(path, payload);
        log.info("Saved hierarchy ({} nodes, {} shortcuts) to {}", hierarchies.nodeCount(), hierarchies.shortcutCount(), path);
    }

    static ContractionHierarchies load(Path path, GraphStore graph) throws IOException {
        Objects.requireNonNull(graph, "graph");
        ContractionHierarchies hierarchies = fromBuffer(ArtifactFiles.readCompressed(path), graph);
        log.info("Loaded hierarchy ({} nodes, {} shortcuts) from {}", hierarchies.nodeCount(), hierarchies.shortcutCount(), path);
        return hierarchies;
    }

    static byte[] toBytes(ContractionHierarchies hierarchies) {
        int shortcutCount = hierarchies.shortcutCount();
        int[] source = new int[shortcutCount];
        int[] target = new int[shortcutCount];
        double[] cost = new double[shortcutCount];
        int[] via = new int[shortcutCount];
        int[] lower = new int[shortcutCount];
        int[] upper = new int[shortcutCount];
        for (int i = 0; i < shortcutCount; i++) {
            Shortcut shortcut = hierarchies.shortcut(i);
            source[i] = shortcut.source();
            target[i] = shortcut.target();
            cost[i] = shortcut.cost();
            via[i] = shortcut.via();
            lower[i] = shortcut.lowerArc();
            upper[i] = shortcut.upperArc();
        }

        FlatBufferBuilder builder = new FlatBufferBuilder(1024 + hierarchies.nodeCount() * 4 + shortcutCount * 32);
        builder.forceDefaults(true);
        int ranksVec = ArtifactFiles.createIntVector(builder, hierarchies.nodeOrder().ranksCopy());
        int sourceVec = ArtifactFiles.createIntVector(builder, source);
        int targetVec = ArtifactFiles.createIntVector(builder, target);
        int costVec = ArtifactFiles.createDoubleVector(builder, cost);
        int viaVec = ArtifactFiles.createIntVector(builder, via);
        int lowerVec = ArtifactFiles.createIntVector(builder, lower);
        int upperVec = ArtifactFiles.createIntVector(builder, upper);

        builder.startTable(FIELD_COUNT);
        builder.addInt(FIELD_FORMAT_VERSION, FORMAT_VERSION, 0);
        builder.addInt(FIELD_NODE_COUNT, hierarchies.nodeCount(), 0);
        builder.addInt(FIELD_EDGE_COUNT, hierarchies.edgeCount(), 0);
        builder.addLong(FIELD_GRAPH_SIGNATURE, hierarchies.graphSignature(), 0L);
        builder.addOffset(FIELD_RANKS, ranksVec, 0);
        builder.addOffset(FIELD_SHORTCUT_SOURCE, sourceVec, 0);
        builder.addOffset(FIELD_SHORTCUT_TARGET, targetVec, 0);
        builder.addOffset(FIELD_SHORTCUT_COST, costVec, 0);
        builder.addOffset(FIELD_SHORTCUT_VIA, viaVec, 0);
        builder.addOffset(FIELD_SHORTCUT_LOWER, lowerVec, 0);
        builder.addOffset(FIELD_SHORTCUT_UPPER, upperVec, 0);
        int root = builder.endTable();
        builder.finish(root, FILE_IDENTIFIER);
        return builder.sizedByteArray();
    }

    static ContractionHierarchies fromBuffer(ByteBuffer buffer, GraphStore graph) {
        ArtifactTable root = ArtifactTable.root(buffer, FILE_IDENTIFIER, "hierarchy artifact");

        int version = root.getInt(FIELD_FORMAT_VERSION, -1);
        if (version != FORMAT_VERSION) {
            throw new IllegalArgumentException(
                    "Unsupported hierarchy format version: expected " + FORMAT_VERSION + ", got " + version);
        }

        int nodeCount = root.getInt(FIELD_NODE_COUNT, -1);
        int edgeCount = root.getInt(FIELD_EDGE_COUNT, -1);
        long signature = root.getLong(FIELD_GRAPH_SIGNATURE, 0L);
        if (signature != graph.signature() || nodeCount != graph.nodeCount() || edgeCount != graph.edgeCount()) {
            throw new RoutingException(
                    RoutingException.REASON_HIERARCHY_MISMATCH,
                    String.format("hierarchy built for graph %016x (%d nodes, %d edges), got graph %016x (%d nodes, %d edges)",
                            signature, nodeCount, edgeCount,
                            graph.signature(), graph.nodeCount(), graph.edgeCount()));
        }

        NodeOrder order = NodeOrder.fromRanks(requireInts(root, FIELD_RANKS, "ranks"));
        double[] cost = root.getDoubleVector(FIELD_SHORTCUT_COST);
        if (cost == null) {
            throw new IllegalArgumentException("Missing required hierarchy vector shortcut_cost");
        }
        return ContractionHierarchies.assemble(
                graph,
                order,
                requireInts(root, FIELD_SHORTCUT_SOURCE, "shortcut_source"),
                requireInts(root, FIELD_SHORTCUT_TARGET, "shortcut_target"),
                cost,
                requireInts(root, FIELD_SHORTCUT_VIA, "shortcut_via"),
                requireInts(root, FIELD_SHORTCUT_LOWER, "shortcut_lower"),
                requireInts(root, FIELD_SHORTCUT_UPPER, "shortcut_upper"),
                signature
        );
    }

    private static int[] requireInts(ArtifactTable table, int slot, String fieldName) {
        int[] values = table.getIntVector(slot);
        if (values == null) {
            throw new IllegalArgumentException("Missing required hierarchy vector " + fieldName);
        }
        return values;
    }
}
