package org.Meridian.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indexed binary min-heap over node ids with {@code double} keys.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive storage:</strong> heap slots hold node ids, keys live in a parallel array indexed by node.</li>
 * <li><strong>Decrease-Key Support:</strong> O(log n) key updates through a position tracking array.</li>
 * <li><strong>Deterministic order:</strong> equal keys are ordered by ascending node id.</li>
 * </ul>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. Each search owns its own queue.</p>
 */
public class MinNodeQueue {

    // 1-based heap of node ids
    private final int[] heap;
    // positions[node] = heap index, 0 when absent
    private final int[] positions;
    private final double[] keys;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    /**
     * @param nodeCount number of node ids the queue may hold, ids range over {@code [0, nodeCount)}.
     * @throws IllegalArgumentException if nodeCount is negative.
     */
    public MinNodeQueue(int nodeCount) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("nodeCount must be non-negative");
        }
        this.heap = new int[nodeCount + 1];
        this.positions = new int[nodeCount];
        this.keys = new double[nodeCount];
    }

    /**
     * Inserts {@code node} or lowers its key when it is already queued with a larger one.
     *
     * @return true when the queue changed.
     * @throws IllegalArgumentException if node is out of bounds.
     */
    public boolean insertOrDecrease(int node, double key) {
        if (node < 0 || node >= positions.length) {
            throw new IllegalArgumentException("node " + node + " out of bounds (max: " + (positions.length - 1) + ")");
        }
        int existing = positions[node];
        if (existing > 0) {
            if (key < keys[node]) {
                keys[node] = key;
                swim(existing);
                return true;
            }
            return false;
        }
        size++;
        heap[size] = node;
        positions[node] = size;
        keys[node] = key;
        swim(size);
        return true;
    }

    public boolean contains(int node) {
        return node >= 0 && node < positions.length && positions[node] > 0;
    }

    /**
     * Key of the minimum entry.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public double peekKey() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return keys[heap[1]];
    }

    /**
     * Removes the minimum entry and returns its node id.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public int extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heap[1];
        positions[min] = 0;
        if (size == 1) {
            size = 0;
            return min;
        }
        int last = heap[size];
        heap[1] = last;
        positions[last] = 1;
        size--;
        sink(1);
        return min;
    }

    /**
     * Key the node was last queued with. Only meaningful for nodes queued since the last {@link #clear()}.
     */
    public double key(int node) {
        return keys[node];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Empties the queue in O(size).
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heap[i]] = 0;
        }
        size = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        int cmp = Double.compare(keys[a], keys[b]);
        return cmp > 0 || (cmp == 0 && a > b);
    }

    private void swap(int i, int j) {
        int a = heap[i];
        int b = heap[j];
        heap[i] = b;
        heap[j] = a;
        positions[a] = j;
        positions[b] = i;
    }
}
