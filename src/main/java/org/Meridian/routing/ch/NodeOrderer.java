package org.Meridian.routing.ch;

import org.Meridian.routing.graph.GraphStore;

/**
 * Strategy that decides the contraction order of a graph.
 * <p>
 * Any strict total order yields correct distances; the choice only affects shortcut count
 * and query speed.
 */
@FunctionalInterface
public interface NodeOrderer {

    /**
     * Computes a rank for every node of {@code graph}.
     *
     * @param graph validated graph.
     * @return order covering exactly {@code graph.nodeCount()} nodes.
     */
    NodeOrder order(GraphStore graph);
}
