package org.Meridian.routing.ch;

import org.Meridian.routing.graph.GraphBuilder;
import org.Meridian.routing.graph.GraphStore;
import org.Meridian.routing.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Contractor Tests")
class ContractorTest {

    /**
     * u(0) -> v(1) -> w(2), each cost 1, optionally with a direct u -> w edge.
     */
    private static GraphStore triangle(Double directCost) {
        GraphBuilder builder = new GraphBuilder();
        builder.addNode(0.00, 0.00);
        builder.addNode(0.01, 0.00);
        builder.addNode(0.02, 0.00);
        builder.addEdge(0, 1, 1.0);
        builder.addEdge(1, 2, 1.0);
        if (directCost != null) {
            builder.addEdge(0, 2, directCost);
        }
        return builder.build();
    }

    private static ContractionHierarchies contract(GraphStore graph, int[] sequence, ContractionConfig config) {
        return ContractionHierarchies.preprocess(graph, g -> NodeOrder.fromContractionSequence(sequence), config);
    }

    private static boolean hasShortcutVia(ContractionHierarchies ch, int via) {
        for (int i = 0; i < ch.shortcutCount(); i++) {
            if (ch.shortcut(i).via() == via) {
                return true;
            }
        }
        return false;
    }

    @Nested
    @DisplayName("Shortcut creation")
    class ShortcutCreation {

        @Test
        @DisplayName("Contracting the middle of a path adds one exact shortcut")
        void testShortcutAdded() {
            GraphStore graph = triangle(null);
            ContractionHierarchies ch = contract(graph, new int[]{1, 0, 2}, ContractionConfig.defaults());

            assertEquals(1, ch.shortcutCount());
            Shortcut shortcut = ch.shortcut(0);
            assertEquals(new Shortcut(0, 2, 2.0, 1, 0, 1), shortcut);
            int arc = ch.edgeCount();
            assertTrue(ch.isShortcut(arc));
            assertFalse(ch.isShortcut(0));
            assertEquals(0, ch.arcSource(arc));
            assertEquals(2, ch.arcTarget(arc));
            assertEquals(2.0, ch.arcCost(arc), 0.0);
        }

        @Test
        @DisplayName("A cheaper or equal witness suppresses the shortcut")
        void testWitnessSuppressesShortcut() {
            assertEquals(0, contract(triangle(1.5), new int[]{1, 0, 2}, ContractionConfig.defaults()).shortcutCount());
            assertEquals(0, contract(triangle(2.0), new int[]{1, 0, 2}, ContractionConfig.defaults()).shortcutCount());
        }

        @Test
        @DisplayName("A more expensive alternative is not a witness")
        void testExpensiveAlternative() {
            ContractionHierarchies ch = contract(triangle(2.5), new int[]{1, 0, 2}, ContractionConfig.defaults());
            assertEquals(1, ch.shortcutCount());
            assertEquals(2.0, ch.shortcut(0).cost(), 0.0);
        }

        @Test
        @DisplayName("Contracting an endpoint adds nothing")
        void testNoShortcutForEndpoint() {
            assertEquals(0, contract(triangle(null), new int[]{0, 2, 1}, ContractionConfig.defaults()).shortcutCount());
        }

        @Test
        @DisplayName("Two-way street through v never yields a u -> u loop")
        void testNoLoopShortcut() {
            GraphBuilder builder = new GraphBuilder();
            builder.addNode(0.0, 0.0);
            builder.addNode(0.01, 0.0);
            builder.addBidirectionalEdge(0, 1, 1.0);
            ContractionHierarchies ch = contract(builder.build(), new int[]{1, 0}, ContractionConfig.defaults());
            assertEquals(0, ch.shortcutCount());
        }

        @Test
        @DisplayName("Parallel edges contribute only their cheapest arc")
        void testParallelEdges() {
            GraphBuilder builder = new GraphBuilder();
            builder.addNode(0.00, 0.0);
            builder.addNode(0.01, 0.0);
            builder.addNode(0.02, 0.0);
            builder.addEdge(0, 1, 3.0);
            int cheap = builder.addEdge(0, 1, 1.0);
            int out = builder.addEdge(1, 2, 1.0);
            ContractionHierarchies ch = contract(builder.build(), new int[]{1, 0, 2}, ContractionConfig.defaults());
            assertEquals(1, ch.shortcutCount());
            assertEquals(new Shortcut(0, 2, 2.0, 1, cheap, out), ch.shortcut(0));
        }
    }

    @Nested
    @DisplayName("Witness bounds")
    class WitnessBounds {

        /**
         * u(0) -> v(1) -> w(2) costs 1 + 1, and a 4-hop detour u -> a -> b -> c -> w of total cost 0.4.
         */
        private GraphStore detourGraph() {
            GraphBuilder builder = new GraphBuilder();
            for (int i = 0; i < 6; i++) {
                builder.addNode(i * 0.01, (i % 2) * 0.01);
            }
            builder.addEdge(0, 1, 1.0);
            builder.addEdge(1, 2, 1.0);
            builder.addEdge(0, 3, 0.1);
            builder.addEdge(3, 4, 0.1);
            builder.addEdge(4, 5, 0.1);
            builder.addEdge(5, 2, 0.1);
            return builder.build();
        }

        @Test
        @DisplayName("Witness within the hop bound avoids the shortcut")
        void testWitnessWithinHops() {
            ContractionHierarchies ch = contract(detourGraph(), new int[]{1, 0, 3, 4, 5, 2}, ContractionConfig.defaults());
            assertFalse(hasShortcutVia(ch, 1));
        }

        @Test
        @DisplayName("Hop bound below the witness length falls back to a shortcut")
        void testHopBoundFallback() {
            ContractionConfig config = ContractionConfig.builder().maxWitnessHops(2).build();
            ContractionHierarchies ch = contract(detourGraph(), new int[]{1, 0, 3, 4, 5, 2}, config);
            assertTrue(hasShortcutVia(ch, 1));
            assertEquals(0.4, new HierarchyQueryEngine(ch).distance(0, 2), 1e-12);
        }

        @Test
        @DisplayName("Settle budget exhaustion falls back to a shortcut")
        void testSettleBudgetFallback() {
            ContractionConfig config = ContractionConfig.builder().maxWitnessSettledNodes(1).build();
            ContractionHierarchies ch = contract(detourGraph(), new int[]{1, 0, 3, 4, 5, 2}, config);
            assertTrue(hasShortcutVia(ch, 1));
            assertEquals(0.4, new HierarchyQueryEngine(ch).distance(0, 2), 1e-12);
        }

        @Test
        @DisplayName("Configuration rejects non-positive bounds")
        void testConfigValidation() {
            GraphStore graph = detourGraph();
            assertThrows(IllegalArgumentException.class, () -> ContractionHierarchies.preprocess(
                    graph, new DegreeNodeOrderer(), ContractionConfig.builder().maxWitnessHops(0).build()));
            assertThrows(IllegalArgumentException.class, () -> ContractionHierarchies.preprocess(
                    graph, new DegreeNodeOrderer(), ContractionConfig.builder().maxWitnessSettledNodes(-3).build()));
            assertThrows(IllegalArgumentException.class, () -> ContractionHierarchies.preprocess(
                    graph, new DegreeNodeOrderer(), ContractionConfig.builder().progressLogInterval(0).build()));
        }

        @Test
        @DisplayName("Defaults match the documented values")
        void testDefaults() {
            ContractionConfig config = ContractionConfig.defaults();
            assertEquals(5, config.getMaxWitnessHops());
            assertEquals(Integer.MAX_VALUE, config.getMaxWitnessSettledNodes());
            assertEquals(10_000, config.getProgressLogInterval());
        }
    }

    @Nested
    @DisplayName("Hierarchy structure")
    class Structure {

        @Test
        @DisplayName("Every shortcut equals the sum of its constituents and bridges a lower node")
        void testShortcutExactness() {
            Random random = new Random(11L);
            for (int round = 0; round < 20; round++) {
                GraphStore graph = GraphFixtures.randomGraph(random, 30, 90);
                ContractionHierarchies ch = ContractionHierarchies.preprocess(graph);
                for (int i = 0; i < ch.shortcutCount(); i++) {
                    Shortcut s = ch.shortcut(i);
                    assertEquals(ch.arcCost(s.lowerArc()) + ch.arcCost(s.upperArc()), s.cost(), 0.0);
                    assertEquals(s.source(), ch.arcSource(s.lowerArc()));
                    assertEquals(s.via(), ch.arcTarget(s.lowerArc()));
                    assertEquals(s.via(), ch.arcSource(s.upperArc()));
                    assertEquals(s.target(), ch.arcTarget(s.upperArc()));
                    assertTrue(ch.rank(s.via()) < ch.rank(s.source()));
                    assertTrue(ch.rank(s.via()) < ch.rank(s.target()));
                    assertTrue(s.lowerArc() < ch.edgeCount() + i);
                    assertTrue(s.upperArc() < ch.edgeCount() + i);
                }
            }
        }

        @Test
        @DisplayName("Same graph and order produce identical shortcuts")
        void testDeterminism() {
            GraphStore graph = GraphFixtures.randomGraph(new Random(5L), 45, 160);
            ContractionHierarchies a = ContractionHierarchies.preprocess(graph);
            ContractionHierarchies b = ContractionHierarchies.preprocess(graph);
            assertEquals(a.nodeOrder(), b.nodeOrder());
            assertEquals(a.shortcutCount(), b.shortcutCount());
            for (int i = 0; i < a.shortcutCount(); i++) {
                assertEquals(a.shortcut(i), b.shortcut(i));
            }
        }

        @Test
        @DisplayName("Grid hierarchy covers every node with a distinct rank")
        void testGridRanks() {
            GraphStore graph = GraphFixtures.grid(5, 5, 0.01, 0.01);
            ContractionHierarchies ch = ContractionHierarchies.preprocess(graph);
            assertEquals(25, ch.nodeCount());
            assertEquals(25, ch.nodeOrder().size());
            assertEquals(graph.edgeCount() + ch.shortcutCount(), ch.arcCount());
            assertTrue(ch.isCompatibleWith(graph));
            assertThrows(IllegalArgumentException.class, () -> ch.shortcut(ch.shortcutCount()));
        }

        @Test
        @DisplayName("Order of the wrong size is rejected")
        void testWrongOrderSize() {
            GraphStore graph = triangle(null);
            assertThrows(IllegalArgumentException.class,
                    () -> contract(graph, new int[]{0, 1}, ContractionConfig.defaults()));
        }

        @Test
        @DisplayName("Contractor runs once")
        void testSingleUse() {
            GraphStore graph = triangle(null);
            Contractor contractor = new Contractor(graph, new DegreeNodeOrderer().order(graph), ContractionConfig.defaults());
            contractor.contract();
            assertThrows(IllegalStateException.class, contractor::contract);
        }

        @Test
        @DisplayName("Asynchronous preprocessing publishes the same hierarchy")
        void testPreprocessAsync() throws Exception {
            GraphStore graph = GraphFixtures.grid(6, 6, 0.01, 1.0);
            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                CompletableFuture<ContractionHierarchies> future = ContractionHierarchies.preprocessAsync(
                        graph, new DegreeNodeOrderer(), ContractionConfig.defaults(), executor);
                ContractionHierarchies async = future.get(30, TimeUnit.SECONDS);
                ContractionHierarchies sync = ContractionHierarchies.preprocess(graph);
                assertEquals(sync.shortcutCount(), async.shortcutCount());
                assertEquals(sync.nodeOrder(), async.nodeOrder());
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Orderer failures propagate through the future")
        void testPreprocessAsyncFailure() {
            GraphStore graph = triangle(null);
            CompletableFuture<ContractionHierarchies> future = ContractionHierarchies.preprocessAsync(
                    graph, g -> NodeOrder.fromRanks(new int[]{0, 0, 0}), ContractionConfig.defaults(), Runnable::run);
            assertTrue(future.isCompletedExceptionally());
        }
    }
}
