package org.Meridian.routing.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MinNodeQueue Tests")
class MinNodeQueueTest {

    @Test
    @DisplayName("Extracts in key order with id tie-break")
    void testOrdering() {
        MinNodeQueue queue = new MinNodeQueue(10);
        queue.insertOrDecrease(5, 3.0);
        queue.insertOrDecrease(2, 1.0);
        queue.insertOrDecrease(7, 1.0);
        queue.insertOrDecrease(1, 2.0);
        assertEquals(4, queue.size());
        assertEquals(1.0, queue.peekKey(), 0.0);
        assertEquals(2, queue.extractMin());
        assertEquals(7, queue.extractMin());
        assertEquals(1, queue.extractMin());
        assertEquals(5, queue.extractMin());
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Decrease-key moves an entry forward, larger keys are ignored")
    void testDecreaseKey() {
        MinNodeQueue queue = new MinNodeQueue(4);
        queue.insertOrDecrease(0, 5.0);
        queue.insertOrDecrease(1, 4.0);
        assertTrue(queue.insertOrDecrease(0, 1.0));
        assertFalse(queue.insertOrDecrease(1, 9.0));
        assertEquals(2, queue.size());
        assertEquals(0, queue.extractMin());
        assertEquals(4.0, queue.key(1), 0.0);
        assertTrue(queue.contains(1));
        assertFalse(queue.contains(0));
    }

    @Test
    @DisplayName("Empty queue and bounds are enforced")
    void testContracts() {
        MinNodeQueue queue = new MinNodeQueue(2);
        assertThrows(EmptyQueueException.class, queue::extractMin);
        assertThrows(EmptyQueueException.class, queue::peekKey);
        assertThrows(IllegalArgumentException.class, () -> queue.insertOrDecrease(2, 0.0));
        assertThrows(IllegalArgumentException.class, () -> queue.insertOrDecrease(-1, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new MinNodeQueue(-1));
        assertFalse(queue.contains(17));
    }

    @Test
    @DisplayName("Clear resets membership for reuse")
    void testClear() {
        MinNodeQueue queue = new MinNodeQueue(3);
        queue.insertOrDecrease(0, 1.0);
        queue.insertOrDecrease(2, 2.0);
        queue.clear();
        assertTrue(queue.isEmpty());
        assertFalse(queue.contains(0));
        queue.insertOrDecrease(2, 0.5);
        assertEquals(2, queue.extractMin());
    }

    @Test
    @DisplayName("Random operations agree with sorting")
    void testRandomAgainstSort() {
        Random random = new Random(3L);
        int n = 500;
        MinNodeQueue queue = new MinNodeQueue(n);
        double[] best = new double[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        for (int i = 0; i < 3_000; i++) {
            int node = random.nextInt(n);
            double key = random.nextInt(1_000);
            queue.insertOrDecrease(node, key);
            best[node] = Math.min(best[node], key);
        }
        double previous = Double.NEGATIVE_INFINITY;
        int extracted = 0;
        while (!queue.isEmpty()) {
            double key = queue.peekKey();
            int node = queue.extractMin();
            assertEquals(best[node], key, 0.0);
            assertTrue(key >= previous);
            previous = key;
            extracted++;
        }
        assertEquals(Arrays.stream(best).filter(Double::isFinite).count(), extracted);
    }
}
