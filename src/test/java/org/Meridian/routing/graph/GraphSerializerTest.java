package org.Meridian.routing.graph;

import org.Meridian.routing.core.RoutingException;
import org.Meridian.routing.io.ArtifactFiles;
import org.Meridian.routing.spatial.GeoPoint;
import org.Meridian.routing.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Graph persistence Tests")
class GraphSerializerTest {

    @TempDir
    Path tempDir;

    private static GraphStore restrictedGraph() {
        GraphBuilder builder = new GraphBuilder()
                .source("fixture-extract")
                .createdAt(Instant.ofEpochMilli(1_234_567L))
                .cellSizeDegrees(0.005);
        builder.addNode(0.000, 0.000, 5.0);
        builder.addNode(0.010, 0.000);
        builder.addNode(0.010, 0.010);
        int a = builder.addEdge(0, 1, 2.5);
        int b = builder.addEdge(1, 2, 1.5);
        builder.addEdge(2, 0, 4.0);
        builder.addTurnRestriction(a, 1, b);
        return builder.build();
    }

    @Test
    @DisplayName("load(save(g)) preserves nodes, edges, adjacency, restrictions and metadata")
    void testRoundTrip() throws IOException {
        GraphStore original = restrictedGraph();
        Path path = tempDir.resolve("nested/graph.mrdg.gz");
        original.save(path);
        assertTrue(Files.exists(path));

        GraphStore loaded = GraphStore.load(path);
        assertEquals(original.nodeCount(), loaded.nodeCount());
        assertEquals(original.edgeCount(), loaded.edgeCount());
        assertEquals(original.signature(), loaded.signature());
        for (int n = 0; n < original.nodeCount(); n++) {
            assertEquals(original.node(n), loaded.node(n));
            assertEquals(original.outgoingEdges(n), loaded.outgoingEdges(n));
            assertEquals(original.incomingEdges(n), loaded.incomingEdges(n));
        }
        for (int e = 0; e < original.edgeCount(); e++) {
            assertEquals(original.edge(e), loaded.edge(e));
        }
        assertEquals(original.turnRestrictions(), loaded.turnRestrictions());
        assertTrue(loaded.isTurnRestricted(0, 1, 1));
        assertEquals(original.metadata(), loaded.metadata());
        assertEquals(0.005, loaded.cellSizeDegrees(), 0.0);
        assertEquals(original.nearestNode(new GeoPoint(0.0099, 0.0098)), loaded.nearestNode(new GeoPoint(0.0099, 0.0098)));
    }

    @Test
    @DisplayName("Missing metadata fields stay absent after a round trip")
    void testRoundTripWithoutSourceLabel() {
        GraphBuilder builder = new GraphBuilder();
        builder.addNode(1.0, 1.0);
        GraphStore original = builder.build();
        GraphStore decoded = GraphSerializer.fromBuffer(
                ByteBuffer.wrap(GraphSerializer.toBytes(original)).order(ByteOrder.LITTLE_ENDIAN));
        assertNull(decoded.metadata().getSource());
        assertEquals(original.metadata().getCreatedAt().toEpochMilli(), decoded.metadata().getCreatedAt().toEpochMilli());
        assertEquals(1, decoded.nodeCount());
        assertEquals(0, decoded.edgeCount());
    }

    @Test
    @DisplayName("Random graph round trip keeps the signature")
    void testRandomRoundTrip() {
        GraphStore original = GraphFixtures.randomGraph(new Random(7L), 40, 120);
        GraphStore decoded = GraphSerializer.fromBuffer(
                ByteBuffer.wrap(GraphSerializer.toBytes(original)).order(ByteOrder.LITTLE_ENDIAN));
        assertDoesNotThrow(decoded::validate);
        assertEquals(original.signature(), decoded.signature());
        assertEquals(original.metadata().getBounds(), decoded.metadata().getBounds());
    }

    @Test
    @DisplayName("Wrong file identifier is rejected")
    void testWrongIdentifier() {
        byte[] bytes = GraphSerializer.toBytes(restrictedGraph());
        bytes[4] = 'X';
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> GraphSerializer.fromBuffer(buffer));
        assertTrue(ex.getMessage().contains("MRDG"));
    }

    @Test
    @DisplayName("Non-gzip file surfaces as IOException")
    void testCorruptFile() throws IOException {
        Path path = tempDir.resolve("garbage.gz");
        Files.write(path, new byte[]{1, 2, 3, 4, 5});
        assertThrows(IOException.class, () -> GraphStore.load(path));
    }

    @Test
    @DisplayName("Non-monotonic CSR offsets on load are GRAPH_CONSTRUCTION")
    void testMalformedOffsetsOnLoad() throws IOException {
        GraphStore graph = GraphFixtures.grid(1, 3, 0.01, 1.0);
        byte[] bytes = GraphSerializer.toBytes(graph);

        // out_offsets of a 1x3 grid: length 4, then {0, 1, 3, 4}
        int at = indexOfInts(bytes, 4, 0, 1, 3, 4);
        assertTrue(at >= 0, "out_offsets vector not found");
        ByteBuffer patch = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        patch.putInt(at + 8, 3);
        patch.putInt(at + 12, 1);

        Path path = tempDir.resolve("bad-offsets.graph.gz");
        ArtifactFiles.writeCompressed(path, bytes);
        RoutingException ex = assertThrows(RoutingException.class, () -> GraphStore.load(path));
        assertEquals(RoutingException.REASON_GRAPH_CONSTRUCTION, ex.getReasonCode());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    private static int indexOfInts(byte[] bytes, int... values) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        outer:
        for (int start = 0; start + values.length * 4 <= bytes.length; start += 4) {
            for (int i = 0; i < values.length; i++) {
                if (buffer.getInt(start + i * 4) != values[i]) {
                    continue outer;
                }
            }
            return start;
        }
        return -1;
    }
}
