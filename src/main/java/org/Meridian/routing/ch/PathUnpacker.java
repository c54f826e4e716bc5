package org.Meridian.routing.ch;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.Objects;

/**
 * Expands packed arc paths into graph edge ids.
 * <p>
 * Shortcuts are replaced by their lower and upper arcs through an explicit work stack, so
 * nesting depth is not limited by the call stack.
 */
public final class PathUnpacker {
    private final ContractionHierarchies hierarchies;

    public PathUnpacker(ContractionHierarchies hierarchies) {
        this.hierarchies = Objects.requireNonNull(hierarchies, "hierarchies");
    }

    /**
     * @param arcPath arcs in travel order.
     * @return edge ids in travel order.
     */
    public int[] unpack(int[] arcPath) {
        Objects.requireNonNull(arcPath, "arcPath");
        IntArrayList edges = new IntArrayList(arcPath.length * 2);
        IntArrayList stack = new IntArrayList();
        for (int arc : arcPath) {
            expand(arc, stack, edges);
        }
        return edges.toIntArray();
    }

    public int[] unpack(ChQueryResult result) {
        return unpack(result.arcPath());
    }

    /**
     * Expands a single arc.
     */
    public int[] unpackArc(int arc) {
        IntArrayList edges = new IntArrayList();
        expand(arc, new IntArrayList(), edges);
        return edges.toIntArray();
    }

    private void expand(int arc, IntArrayList stack, IntArrayList edges) {
        if (arc < 0 || arc >= hierarchies.arcCount()) {
            throw new IllegalArgumentException("arc " + arc + " out of bounds [0, " + hierarchies.arcCount() + ")");
        }
        stack.add(arc);
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            if (hierarchies.isShortcut(current)) {
                // upper first so lower pops first
                stack.add(hierarchies.upperArc(current));
                stack.add(hierarchies.lowerArc(current));
            } else {
                edges.add(current);
            }
        }
    }
}
