package org.Meridian.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Meridian.routing.graph.GraphStore;

import java.util.Arrays;
import java.util.PriorityQueue;

/**
 * Edge-based Dijkstra that honours turn restrictions.
 *
 * <p>Search states are edges rather than nodes, so the predecessor edge is known at every
 * transition and {@link GraphStore#isTurnRestricted(int, int, int)} can be checked. Used when
 * a node-based hierarchy route crosses a forbidden transition.</p>
 */
final class TurnRestrictedDijkstra {
    private static final double INF = Double.POSITIVE_INFINITY;
    private static final int NO_EDGE = -1;

    /**
     * Result of one search.
     *
     * @param cost sum of edge weights.
     * @param edges edge ids from source to target.
     * @param settledStates edge states settled.
     */
    record Path(double cost, int[] edges, int settledStates) {
    }

    private final GraphStore graph;

    TurnRestrictedDijkstra(GraphStore graph) {
        this.graph = graph;
    }

    /**
     * Computes the cheapest restriction-respecting path between two distinct nodes.
     *
     * @throws RoutingException with {@code NO_ROUTE_FOUND} when no such path exists.
     */
    Path route(int sourceNodeId, int targetNodeId) {
        if (sourceNodeId == targetNodeId) {
            return new Path(0.0d, new int[0], 0);
        }

        double[] dist = new double[graph.edgeCount()];
        int[] predecessor = new int[graph.edgeCount()];
        Arrays.fill(dist, INF);
        Arrays.fill(predecessor, NO_EDGE);
        PriorityQueue<EdgeState> frontier = new PriorityQueue<>();
        GraphStore.EdgeIterator iterator = graph.iterator();

        iterator.resetOutgoing(sourceNodeId);
        while (iterator.hasNext()) {
            int edgeId = iterator.next();
            double cost = graph.edgeWeight(edgeId);
            if (cost < dist[edgeId]) {
                dist[edgeId] = cost;
                frontier.add(new EdgeState(edgeId, cost));
            }
        }

        int settledStates = 0;
        while (!frontier.isEmpty()) {
            EdgeState state = frontier.poll();
            int edgeId = state.edgeId;
            if (state.cost > dist[edgeId]) {
                continue;
            }
            settledStates++;

            int node = graph.edgeTarget(edgeId);
            if (node == targetNodeId) {
                return new Path(state.cost, buildEdgePath(predecessor, edgeId), settledStates);
            }

            iterator.resetOutgoing(node);
            while (iterator.hasNext()) {
                int nextEdgeId = iterator.next();
                if (graph.isTurnRestricted(edgeId, node, nextEdgeId)) {
                    continue;
                }
                double nextCost = state.cost + graph.edgeWeight(nextEdgeId);
                if (nextCost < dist[nextEdgeId]) {
                    dist[nextEdgeId] = nextCost;
                    predecessor[nextEdgeId] = edgeId;
                    frontier.add(new EdgeState(nextEdgeId, nextCost));
                }
            }
        }
        throw new RoutingException(
                RoutingException.REASON_NO_ROUTE_FOUND,
                "no turn-restriction compliant route from node " + sourceNodeId + " to node " + targetNodeId);
    }

    private static int[] buildEdgePath(int[] predecessor, int lastEdgeId) {
        IntArrayList reversed = new IntArrayList();
        for (int edgeId = lastEdgeId; edgeId != NO_EDGE; edgeId = predecessor[edgeId]) {
            reversed.add(edgeId);
        }
        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    private static final class EdgeState implements Comparable<EdgeState> {
        final int edgeId;
        final double cost;

        EdgeState(int edgeId, double cost) {
            this.edgeId = edgeId;
            this.cost = cost;
        }

        @Override
        public int compareTo(EdgeState other) {
            int cmp = Double.compare(cost, other.cost);
            return cmp != 0 ? cmp : Integer.compare(edgeId, other.edgeId);
        }
    }
}
