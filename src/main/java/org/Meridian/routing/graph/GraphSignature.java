package org.Meridian.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Deterministic compatibility signature binding derived artifacts to one graph topology.
 */
@UtilityClass
final class GraphSignature {
    private static final long FNV64_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV64_PRIME = 0x100000001b3L;

    /**
     * Computes FNV-1a over node count, edge count and every edge's endpoints and weight.
     */
    static long compute(int nodeCount, int[] edgeSource, int[] edgeTarget, double[] edgeWeight) {
        long hash = FNV64_OFFSET_BASIS;
        hash = mixInt(hash, nodeCount);
        hash = mixInt(hash, edgeSource.length);
        for (int edgeId = 0; edgeId < edgeSource.length; edgeId++) {
            hash = mixInt(hash, edgeSource[edgeId]);
            hash = mixInt(hash, edgeTarget[edgeId]);
            long weightBits = Double.doubleToLongBits(edgeWeight[edgeId]);
            hash = mixInt(hash, (int) weightBits);
            hash = mixInt(hash, (int) (weightBits >>> 32));
        }
        return hash;
    }

    /**
     * Mixes one integer into FNV-1a state byte-by-byte in little-endian order.
     */
    private static long mixInt(long hash, int value) {
        hash ^= (value & 0xFF);
        hash *= FNV64_PRIME;
        hash ^= ((value >>> 8) & 0xFF);
        hash *= FNV64_PRIME;
        hash ^= ((value >>> 16) & 0xFF);
        hash *= FNV64_PRIME;
        hash ^= ((value >>> 24) & 0xFF);
        hash *= FNV64_PRIME;
        return hash;
    }
}
