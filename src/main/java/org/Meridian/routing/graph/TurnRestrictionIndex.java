package org.Meridian.routing.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Turn restriction lookup structure.
 * <p>
 * A read-only hash set of forbidden {@code (from_edge, via_node, to_edge)} transitions.
 * Keys pack {@code (from_edge, to_edge)} into one long; the via node is stored alongside and
 * must match for a hit. Open addressing over primitive arrays keeps lookups allocation free.
 * <p>
 * PERFORMANCE CHARACTERISTICS:
 * - Time Complexity: O(1) average case lookup.
 * - Thread Safety: Immutable after construction, safe for concurrent reads.
 */
public final class TurnRestrictionIndex {

    private static final long EMPTY_KEY = -1L;
    private static final int NO_VIA = -1;

    private static final TurnRestrictionIndex EMPTY = new TurnRestrictionIndex(
            0, 1, new long[]{EMPTY_KEY}, new int[]{NO_VIA}, new int[0], new int[0], new int[0]);

    // Keys: Packed long [(from_edge << 32) | to_edge]
    private final long[] keys;
    private final int[] vias;
    private final int mask;
    private final int size;

    // Insertion-ordered copy for iteration and persistence.
    private final int[] fromEdges;
    private final int[] viaNodes;
    private final int[] toEdges;

    private TurnRestrictionIndex(int size, int capacity, long[] keys, int[] vias,
                                 int[] fromEdges, int[] viaNodes, int[] toEdges) {
        this.size = size;
        this.mask = capacity - 1;
        this.keys = keys;
        this.vias = vias;
        this.fromEdges = fromEdges;
        this.viaNodes = viaNodes;
        this.toEdges = toEdges;
    }

    public static TurnRestrictionIndex empty() {
        return EMPTY;
    }

    /**
     * Builds the index from parallel triple arrays. Duplicate triples collapse to one entry.
     */
    public static TurnRestrictionIndex of(int[] fromEdges, int[] viaNodes, int[] toEdges) {
        Objects.requireNonNull(fromEdges, "fromEdges");
        Objects.requireNonNull(viaNodes, "viaNodes");
        Objects.requireNonNull(toEdges, "toEdges");
        int count = fromEdges.length;
        if (viaNodes.length != count || toEdges.length != count) {
            throw new IllegalArgumentException(
                    "turn restriction length mismatch: from=" + count
                            + ", via=" + viaNodes.length + ", to=" + toEdges.length);
        }
        if (count == 0) {
            return EMPTY;
        }

        // Target Load Factor 0.6
        int targetCapacity = (int) Math.ceil(count * 1.67);
        int capacity = 1;
        while (capacity < targetCapacity) {
            capacity <<= 1;
        }

        long[] keys = new long[capacity];
        int[] vias = new int[capacity];
        Arrays.fill(keys, EMPTY_KEY);
        int mask = capacity - 1;
        int size = 0;
        for (int i = 0; i < count; i++) {
            if (fromEdges[i] < 0 || toEdges[i] < 0) {
                throw new IllegalArgumentException(
                        "turn restriction " + i + " has negative edge id: " + fromEdges[i] + " -> " + toEdges[i]);
            }
            if (insert(keys, vias, mask, pack(fromEdges[i], toEdges[i]), viaNodes[i])) {
                size++;
            }
        }
        return new TurnRestrictionIndex(size, capacity, keys, vias,
                fromEdges.clone(), viaNodes.clone(), toEdges.clone());
    }

    /**
     * Checks whether the exact transition {@code fromEdge -> viaNode -> toEdge} is forbidden.
     */
    public boolean isRestricted(int fromEdge, int viaNode, int toEdge) {
        if (size == 0) {
            return false;
        }
        long key = pack(fromEdge, toEdge);
        int index = mix(key) & mask;
        while (true) {
            long k = keys[index];
            if (k == key) return vias[index] == viaNode;
            if (k == EMPTY_KEY) return false;
            index = (index + 1) & mask;
        }
    }

    /**
     * Number of distinct restrictions.
     */
    public int size() {
        return size;
    }

    /**
     * Number of restriction triples as supplied (duplicates included).
     */
    public int entryCount() {
        return fromEdges.length;
    }

    public int fromEdge(int entry) {
        return fromEdges[entry];
    }

    public int viaNode(int entry) {
        return viaNodes[entry];
    }

    public int toEdge(int entry) {
        return toEdges[entry];
    }

    /**
     * Materializes all supplied triples in insertion order.
     */
    public List<TurnRestriction> toList() {
        if (fromEdges.length == 0) {
            return Collections.emptyList();
        }
        List<TurnRestriction> restrictions = new ArrayList<>(fromEdges.length);
        for (int i = 0; i < fromEdges.length; i++) {
            restrictions.add(new TurnRestriction(fromEdges[i], viaNodes[i], toEdges[i]));
        }
        return Collections.unmodifiableList(restrictions);
    }

    private static long pack(int fromEdge, int toEdge) {
        return ((long) fromEdge << 32) | (toEdge & 0xFFFFFFFFL);
    }

    /**
     * Uses MurmurHash3's 64-bit finalizer mix function.
     * Package-private for testing distribution.
     */
    static int mix(long k) {
        k ^= k >>> 33;
        k *= 0xff51afd7ed558ccdL;
        k ^= k >>> 33;
        k *= 0xc4ceb9fe1a85ec53L;
        k ^= k >>> 33;
        return (int) k;
    }

    /**
     * @return true if a new key was inserted, false if an existing key was updated.
     */
    private static boolean insert(long[] keys, int[] vias, int mask, long key, int via) {
        int index = mix(key) & mask;
        while (keys[index] != EMPTY_KEY) {
            if (keys[index] == key) {
                // (from, to) fixes the via node for consistent data; last wins otherwise
                vias[index] = via;
                return false;
            }
            index = (index + 1) & mask;
        }
        keys[index] = key;
        vias[index] = via;
        return true;
    }

    @Override
    public String toString() {
        return String.format("TurnRestrictionIndex[size=%d, capacity=%d]", size, mask + 1);
    }
}
