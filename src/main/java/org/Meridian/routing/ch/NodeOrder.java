package org.Meridian.routing.ch;

import java.util.Arrays;
import java.util.Objects;

/**
 * Strict total order over node ids used as contraction rank.
 * <p>
 * Immutable bijection {@code node -> rank} with its inverse {@code rank -> node}. Rank 0 is
 * contracted first; higher ranks are more important.
 */
public final class NodeOrder {
    private final int[] rankOfNode;
    private final int[] nodeAtRank;

    private NodeOrder(int[] rankOfNode, int[] nodeAtRank) {
        this.rankOfNode = rankOfNode;
        this.nodeAtRank = nodeAtRank;
    }

    /**
     * Creates an order from {@code ranks[node]}.
     *
     * @throws IllegalArgumentException when ranks are not a permutation of {@code [0, n)}.
     */
    public static NodeOrder fromRanks(int[] ranks) {
        Objects.requireNonNull(ranks, "ranks");
        int n = ranks.length;
        int[] rankOfNode = Arrays.copyOf(ranks, n);
        int[] nodeAtRank = new int[n];
        Arrays.fill(nodeAtRank, -1);
        for (int node = 0; node < n; node++) {
            int rank = rankOfNode[node];
            if (rank < 0 || rank >= n) {
                throw new IllegalArgumentException("rank " + rank + " of node " + node + " out of bounds [0, " + n + ")");
            }
            if (nodeAtRank[rank] != -1) {
                throw new IllegalArgumentException(
                        "rank " + rank + " assigned to both node " + nodeAtRank[rank] + " and node " + node);
            }
            nodeAtRank[rank] = node;
        }
        return new NodeOrder(rankOfNode, nodeAtRank);
    }

    /**
     * Creates an order from the sequence in which nodes are contracted; {@code sequence[rank] = node}.
     *
     * @throws IllegalArgumentException when the sequence is not a permutation of {@code [0, n)}.
     */
    public static NodeOrder fromContractionSequence(int[] sequence) {
        Objects.requireNonNull(sequence, "sequence");
        int n = sequence.length;
        int[] ranks = new int[n];
        Arrays.fill(ranks, -1);
        for (int rank = 0; rank < n; rank++) {
            int node = sequence[rank];
            if (node < 0 || node >= n) {
                throw new IllegalArgumentException("node " + node + " at rank " + rank + " out of bounds [0, " + n + ")");
            }
            if (ranks[node] != -1) {
                throw new IllegalArgumentException("node " + node + " appears twice in contraction sequence");
            }
            ranks[node] = rank;
        }
        return new NodeOrder(ranks, Arrays.copyOf(sequence, n));
    }

    public int size() {
        return rankOfNode.length;
    }

    public int rank(int node) {
        return rankOfNode[node];
    }

    public int nodeAt(int rank) {
        return nodeAtRank[rank];
    }

    public int[] ranksCopy() {
        return Arrays.copyOf(rankOfNode, rankOfNode.length);
    }

    int[] rankVector() {
        return rankOfNode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeOrder)) return false;
        return Arrays.equals(rankOfNode, ((NodeOrder) o).rankOfNode);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(rankOfNode);
    }

    @Override
    public String toString() {
        return "NodeOrder{size=" + rankOfNode.length + "}";
    }
}
