package org.Meridian.routing.ch;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Meridian.routing.search.MinNodeQueue;

import java.util.Arrays;

/**
 * Cost and hop bounded one-to-many Dijkstra over the remaining (uncontracted) graph.
 * <p>
 * Distance and hop arrays are sized once and reset through a touched list, so repeated
 * searches cost O(visited) rather than O(n). Owned by a single {@link Contractor}.
 */
final class WitnessSearch {
    private static final double INF = Double.POSITIVE_INFINITY;

    private final IntArrayList[] outArcs;
    private final IntArrayList arcTarget;
    private final DoubleArrayList arcCost;
    private final boolean[] contracted;

    private final double[] dist;
    private final int[] hops;
    private final IntArrayList touched = new IntArrayList();
    private final MinNodeQueue queue;

    @Getter
    @Accessors(fluent = true)
    private long totalSettled;

    WitnessSearch(IntArrayList[] outArcs, IntArrayList arcTarget, DoubleArrayList arcCost, boolean[] contracted) {
        this.outArcs = outArcs;
        this.arcTarget = arcTarget;
        this.arcCost = arcCost;
        this.contracted = contracted;
        int nodeCount = outArcs.length;
        this.dist = new double[nodeCount];
        this.hops = new int[nodeCount];
        Arrays.fill(dist, INF);
        this.queue = new MinNodeQueue(nodeCount);
    }

    /**
     * Runs a search from {@code source} that never enters {@code excluded} or a contracted node.
     * Results stay readable through {@link #distance(int)} until the next run.
     *
     * @param maxCost no node is settled beyond this cost.
     * @param maxHops arcs on a path are limited to this count.
     * @param maxSettled settle budget for this run.
     */
    void run(int source, int excluded, double maxCost, int maxHops, int maxSettled) {
        reset();
        touch(source, 0.0d, 0);
        queue.insertOrDecrease(source, 0.0d);

        int settled = 0;
        while (!queue.isEmpty()) {
            if (queue.peekKey() > maxCost || settled >= maxSettled) {
                break;
            }
            int node = queue.extractMin();
            settled++;
            int nodeHops = hops[node];
            if (nodeHops >= maxHops) {
                continue;
            }
            double base = dist[node];
            IntArrayList arcs = outArcs[node];
            for (int i = 0, size = arcs.size(); i < size; i++) {
                int arc = arcs.getInt(i);
                int next = arcTarget.getInt(arc);
                if (next == excluded || contracted[next]) {
                    continue;
                }
                double candidate = base + arcCost.getDouble(arc);
                if (candidate < dist[next]) {
                    touch(next, candidate, nodeHops + 1);
                    queue.insertOrDecrease(next, candidate);
                }
            }
        }
        totalSettled += settled;
    }

    /**
     * Best known cost from the last source, {@link Double#POSITIVE_INFINITY} when unreached.
     */
    double distance(int node) {
        return dist[node];
    }

    private void touch(int node, double distance, int hopCount) {
        if (dist[node] == INF) {
            touched.add(node);
        }
        dist[node] = distance;
        hops[node] = hopCount;
    }

    private void reset() {
        for (int i = 0, size = touched.size(); i < size; i++) {
            dist[touched.getInt(i)] = INF;
        }
        touched.clear();
        queue.clear();
    }
}
