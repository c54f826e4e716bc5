package org.Meridian.routing.ch;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Meridian.routing.graph.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Contracts nodes in ascending rank and inserts the shortcuts that keep upward-downward
 * distances exact.
 * <p>
 * Arcs live in one arena: ids {@code [0, edgeCount)} are the graph's edges, later ids are
 * shortcuts in creation order. For every contracted node {@code v}, incoming and outgoing arcs
 * are grouped by their uncontracted outer endpoint, keeping the cheapest arc per endpoint. One
 * witness search runs per incoming neighbour {@code u}; a shortcut {@code u -> w} is added
 * whenever no path of cost {@code <= cost(u->v) + cost(v->w)} avoiding {@code v} was found.
 * <p>
 * Single-use and single-threaded.
 */
public final class Contractor {
    private static final Logger log = LoggerFactory.getLogger(Contractor.class);

    private final GraphStore graph;
    private final NodeOrder order;
    private final ContractionConfig config;

    private final IntArrayList arcSource = new IntArrayList();
    private final IntArrayList arcTarget = new IntArrayList();
    private final DoubleArrayList arcCost = new DoubleArrayList();

    private final IntArrayList shortcutVia = new IntArrayList();
    private final IntArrayList shortcutLowerArc = new IntArrayList();
    private final IntArrayList shortcutUpperArc = new IntArrayList();

    private final IntArrayList[] outArcs;
    private final IntArrayList[] inArcs;
    private final boolean[] contracted;

    private boolean done;

    /**
     * @param graph validated graph.
     * @param order contraction order covering every node of {@code graph}.
     * @param config witness bounds.
     */
    public Contractor(GraphStore graph, NodeOrder order, ContractionConfig config) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.order = Objects.requireNonNull(order, "order");
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        if (order.size() != graph.nodeCount()) {
            throw new IllegalArgumentException(
                    "node order size " + order.size() + " does not match node count " + graph.nodeCount());
        }

        int nodeCount = graph.nodeCount();
        this.outArcs = new IntArrayList[nodeCount];
        this.inArcs = new IntArrayList[nodeCount];
        this.contracted = new boolean[nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            outArcs[node] = new IntArrayList(graph.outDegree(node));
            inArcs[node] = new IntArrayList(graph.inDegree(node));
        }
        for (int edgeId = 0; edgeId < graph.edgeCount(); edgeId++) {
            int source = graph.edgeSource(edgeId);
            int target = graph.edgeTarget(edgeId);
            arcSource.add(source);
            arcTarget.add(target);
            arcCost.add(graph.edgeWeight(edgeId));
            outArcs[source].add(edgeId);
            inArcs[target].add(edgeId);
        }
    }

    /**
     * Contracts every node and freezes the result.
     *
     * @throws IllegalStateException when called twice.
     */
    public ContractionHierarchies contract() {
        if (done) {
            throw new IllegalStateException("Contractor has already run");
        }
        done = true;

        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();
        long startNanos = System.nanoTime();
        log.info("Contracting {} nodes / {} edges (maxWitnessHops={}, maxWitnessSettledNodes={})",
                nodeCount, edgeCount, config.getMaxWitnessHops(), config.getMaxWitnessSettledNodes());

        WitnessSearch witnessSearch = new WitnessSearch(outArcs, arcTarget, arcCost, contracted);
        for (int rank = 0; rank < nodeCount; rank++) {
            contractNode(order.nodeAt(rank), witnessSearch);
            if ((rank + 1) % config.getProgressLogInterval() == 0) {
                log.debug("Contracted {}/{} nodes, {} shortcuts so far", rank + 1, nodeCount, shortcutVia.size());
            }
        }

        ContractionHierarchies hierarchies = ContractionHierarchies.assemble(
                graph,
                order,
                tail(arcSource, edgeCount),
                tail(arcTarget, edgeCount),
                tail(arcCost, edgeCount),
                shortcutVia.toIntArray(),
                shortcutLowerArc.toIntArray(),
                shortcutUpperArc.toIntArray(),
                graph.signature()
        );
        log.info("Contraction finished in {} ms: {} shortcuts, {} witness nodes settled",
                (System.nanoTime() - startNanos) / 1_000_000L, shortcutVia.size(), witnessSearch.totalSettled());
        return hierarchies;
    }

    private void contractNode(int v, WitnessSearch witnessSearch) {
        // Cheapest arc per uncontracted neighbour, in first-seen order.
        Int2IntLinkedOpenHashMap bestIn = cheapestArcs(inArcs[v], arcSource, v);
        Int2IntLinkedOpenHashMap bestOut = cheapestArcs(outArcs[v], arcTarget, v);
        contracted[v] = true;
        if (bestIn.isEmpty() || bestOut.isEmpty()) {
            return;
        }

        int[] outNeighbours = bestOut.keySet().toIntArray();
        for (int u : bestIn.keySet().toIntArray()) {
            int inArc = bestIn.get(u);
            double inCost = arcCost.getDouble(inArc);

            double maxCost = Double.NEGATIVE_INFINITY;
            for (int w : outNeighbours) {
                if (w != u) {
                    maxCost = Math.max(maxCost, inCost + arcCost.getDouble(bestOut.get(w)));
                }
            }
            if (maxCost == Double.NEGATIVE_INFINITY) {
                continue;
            }

            witnessSearch.run(u, v, maxCost, config.getMaxWitnessHops(), config.getMaxWitnessSettledNodes());
            for (int w : outNeighbours) {
                if (w == u) {
                    continue;
                }
                int outArc = bestOut.get(w);
                double candidate = inCost + arcCost.getDouble(outArc);
                if (witnessSearch.distance(w) <= candidate) {
                    continue;
                }
                addShortcut(u, w, candidate, v, inArc, outArc);
            }
        }
    }

    /**
     * Groups {@code arcs} by the endpoint selected through {@code endpoints}, skipping loops and
     * contracted endpoints. Ties keep the earlier arc.
     */
    private Int2IntLinkedOpenHashMap cheapestArcs(IntArrayList arcs, IntArrayList endpoints, int v) {
        Int2IntLinkedOpenHashMap best = new Int2IntLinkedOpenHashMap(arcs.size());
        best.defaultReturnValue(-1);
        for (int i = 0, size = arcs.size(); i < size; i++) {
            int arc = arcs.getInt(i);
            int endpoint = endpoints.getInt(arc);
            if (endpoint == v || contracted[endpoint]) {
                continue;
            }
            int current = best.get(endpoint);
            if (current == -1 || arcCost.getDouble(arc) < arcCost.getDouble(current)) {
                best.put(endpoint, arc);
            }
        }
        return best;
    }

    private void addShortcut(int source, int target, double cost, int via, int lowerArc, int upperArc) {
        int arc = arcSource.size();
        arcSource.add(source);
        arcTarget.add(target);
        arcCost.add(cost);
        shortcutVia.add(via);
        shortcutLowerArc.add(lowerArc);
        shortcutUpperArc.add(upperArc);
        outArcs[source].add(arc);
        inArcs[target].add(arc);
    }

    private static int[] tail(IntArrayList values, int from) {
        return values.subList(from, values.size()).toIntArray();
    }

    private static double[] tail(DoubleArrayList values, int from) {
        return values.subList(from, values.size()).toDoubleArray();
    }
}
