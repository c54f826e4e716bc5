package org.Meridian.routing.graph;

/**
 * Forbidden transition {@code fromEdge -> viaNode -> toEdge}.
 * A consistent restriction has {@code fromEdge.target == viaNode == toEdge.source}.
 */
public record TurnRestriction(int fromEdge, int viaNode, int toEdge) {
}
