package org.Meridian.routing.graph;

/**
 * Static traversal cost of one directed edge.
 *
 * @param weight traversal time/weight minimized by routing, finite and {@code >= 0}.
 * @param distanceMeters physical length of the edge.
 * @param bearingDegrees initial bearing in {@code [0, 360)}, used for turn penalties.
 */
public record EdgeCost(double weight, double distanceMeters, double bearingDegrees) {
}
