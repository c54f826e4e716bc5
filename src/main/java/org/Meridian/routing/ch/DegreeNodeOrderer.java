package org.Meridian.routing.ch;

import it.unimi.dsi.fastutil.ints.IntArrays;
import org.Meridian.routing.graph.GraphStore;

import java.util.Objects;

/**
 * Orders nodes by ascending total degree (in + out), ties broken by node id.
 */
public final class DegreeNodeOrderer implements NodeOrderer {

    @Override
    public NodeOrder order(GraphStore graph) {
        Objects.requireNonNull(graph, "graph");
        int nodeCount = graph.nodeCount();
        int[] degree = new int[nodeCount];
        int[] sequence = new int[nodeCount];
        for (int node = 0; node < nodeCount; node++) {
            degree[node] = graph.inDegree(node) + graph.outDegree(node);
            sequence[node] = node;
        }
        IntArrays.quickSort(sequence, (a, b) -> {
            int cmp = Integer.compare(degree[a], degree[b]);
            return cmp != 0 ? cmp : Integer.compare(a, b);
        });
        return NodeOrder.fromContractionSequence(sequence);
    }
}
