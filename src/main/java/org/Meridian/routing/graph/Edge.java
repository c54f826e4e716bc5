package org.Meridian.routing.graph;

/**
 * Read-only view of one directed edge. Two-way streets are stored as two edges.
 */
public record Edge(int id, int source, int target, EdgeCost cost) {

    public double weight() {
        return cost.weight();
    }
}
