package org.Meridian.routing.ch;

import it.unimi.dsi.fastutil.ints.Int2DoubleOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Meridian.routing.core.RoutingException;

import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Bidirectional rank-pruned Dijkstra over a {@link ContractionHierarchies}.
 * <p>
 * The forward search follows arcs leading to higher-ranked heads, the backward search follows
 * arcs arriving from higher-ranked tails; the two alternate one settle step at a time. All
 * per-query state is local, so one engine serves any number of threads.
 */
public final class HierarchyQueryEngine {
    private static final int NO_ARC = -1;

    private final ContractionHierarchies hierarchies;
    private final int[] rank;

    public HierarchyQueryEngine(ContractionHierarchies hierarchies) {
        this.hierarchies = Objects.requireNonNull(hierarchies, "hierarchies");
        this.rank = hierarchies.rankVector();
    }

    /**
     * Computes the shortest path cost between two nodes.
     *
     * @param source source node id.
     * @param target target node id.
     * @return distance, meeting node and packed arc path.
     * @throws IllegalArgumentException when a node id is out of range.
     * @throws RoutingException with {@code NO_ROUTE_FOUND} when target is unreachable.
     */
    public ChQueryResult query(int source, int target) {
        requireNode(source, "source");
        requireNode(target, "target");
        if (source == target) {
            return new ChQueryResult(0.0d, source, new int[0], 0);
        }

        Direction forward = new Direction(true, source);
        Direction backward = new Direction(false, target);
        Meeting meeting = new Meeting();

        boolean forwardDone = false;
        boolean backwardDone = false;
        while (!forwardDone || !backwardDone) {
            if (!forwardDone) {
                forwardDone = !forward.step(backward, meeting);
            }
            if (!backwardDone) {
                backwardDone = !backward.step(forward, meeting);
            }
        }

        if (meeting.node == -1) {
            throw new RoutingException(
                    RoutingException.REASON_NO_ROUTE_FOUND,
                    "no route from node " + source + " to node " + target);
        }

        IntArrayList path = new IntArrayList();
        int node = meeting.node;
        while (node != source) {
            int arc = forward.predArc.get(node);
            path.add(arc);
            node = hierarchies.arcSource(arc);
        }
        int forwardArcs = path.size();
        for (int i = 0, j = forwardArcs - 1; i < j; i++, j--) {
            int tmp = path.getInt(i);
            path.set(i, path.getInt(j));
            path.set(j, tmp);
        }
        node = meeting.node;
        while (node != target) {
            int arc = backward.predArc.get(node);
            path.add(arc);
            node = hierarchies.arcTarget(arc);
        }
        return new ChQueryResult(meeting.distance, meeting.node, path.toIntArray(), forward.settled + backward.settled);
    }

    /**
     * Shortest-path cost only.
     */
    public double distance(int source, int target) {
        return query(source, target).distance();
    }

    private void requireNode(int node, String name) {
        if (node < 0 || node >= hierarchies.nodeCount()) {
            throw new IllegalArgumentException(
                    name + " node " + node + " out of bounds [0, " + hierarchies.nodeCount() + ")");
        }
    }

    private static final class Meeting {
        int node = -1;
        double distance = Double.POSITIVE_INFINITY;
    }

    private static final class NodeDistance implements Comparable<NodeDistance> {
        final int node;
        final double distance;

        NodeDistance(int node, double distance) {
            this.node = node;
            this.distance = distance;
        }

        @Override
        public int compareTo(NodeDistance other) {
            int cmp = Double.compare(distance, other.distance);
            return cmp != 0 ? cmp : Integer.compare(node, other.node);
        }
    }

    /**
     * One half of the bidirectional search.
     */
    private final class Direction {
        final boolean forward;
        final PriorityQueue<NodeDistance> queue = new PriorityQueue<>();
        final Int2DoubleOpenHashMap dist = new Int2DoubleOpenHashMap();
        final Int2IntOpenHashMap predArc = new Int2IntOpenHashMap();
        int settled;

        Direction(boolean forward, int origin) {
            this.forward = forward;
            dist.defaultReturnValue(Double.POSITIVE_INFINITY);
            predArc.defaultReturnValue(NO_ARC);
            dist.put(origin, 0.0d);
            queue.add(new NodeDistance(origin, 0.0d));
        }

        /**
         * Settles one node.
         *
         * @return false once this direction can no longer improve the meeting distance.
         */
        boolean step(Direction other, Meeting meeting) {
            NodeDistance top;
            while ((top = queue.peek()) != null && top.distance > dist.get(top.node)) {
                queue.poll();
            }
            if (top == null || top.distance >= meeting.distance) {
                return false;
            }
            queue.poll();
            settled++;

            int node = top.node;
            double d = top.distance;
            double otherDistance = other.dist.get(node);
            if (d + otherDistance < meeting.distance) {
                meeting.distance = d + otherDistance;
                meeting.node = node;
            }

            int nodeRank = rank[node];
            if (forward) {
                for (int i = hierarchies.forwardStart(node), end = hierarchies.forwardEnd(node); i < end; i++) {
                    int arc = hierarchies.forwardArc(i);
                    int next = hierarchies.arcTarget(arc);
                    if (rank[next] > nodeRank) {
                        relax(next, d + hierarchies.arcCost(arc), arc);
                    }
                }
            } else {
                for (int i = hierarchies.backwardStart(node), end = hierarchies.backwardEnd(node); i < end; i++) {
                    int arc = hierarchies.backwardArc(i);
                    int next = hierarchies.arcSource(arc);
                    if (rank[next] > nodeRank) {
                        relax(next, d + hierarchies.arcCost(arc), arc);
                    }
                }
            }
            return true;
        }

        private void relax(int node, double candidate, int arc) {
            if (candidate < dist.get(node)) {
                dist.put(node, candidate);
                predArc.put(node, arc);
                queue.add(new NodeDistance(node, candidate));
            }
        }
    }
}
