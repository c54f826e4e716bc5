package org.Meridian.routing.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TurnRestrictionIndex Tests")
class TurnRestrictionIndexTest {

    @Test
    @DisplayName("Exact triple hits, via mismatch and reversed pair miss")
    void testLookup() {
        TurnRestrictionIndex index = TurnRestrictionIndex.of(new int[]{1, 4}, new int[]{10, 20}, new int[]{2, 5});
        assertTrue(index.isRestricted(1, 10, 2));
        assertTrue(index.isRestricted(4, 20, 5));
        assertFalse(index.isRestricted(1, 11, 2));
        assertFalse(index.isRestricted(2, 10, 1));
        assertFalse(index.isRestricted(7, 10, 8));
        assertEquals(2, index.size());
    }

    @Test
    @DisplayName("Empty index never restricts")
    void testEmpty() {
        TurnRestrictionIndex index = TurnRestrictionIndex.empty();
        assertEquals(0, index.size());
        assertFalse(index.isRestricted(0, 0, 0));
        assertTrue(index.toList().isEmpty());
        assertSame(TurnRestrictionIndex.empty(), TurnRestrictionIndex.of(new int[0], new int[0], new int[0]));
    }

    @Test
    @DisplayName("Duplicates collapse in lookups but are kept as supplied")
    void testDuplicates() {
        TurnRestrictionIndex index = TurnRestrictionIndex.of(new int[]{3, 3}, new int[]{9, 9}, new int[]{4, 4});
        assertEquals(1, index.size());
        assertEquals(2, index.entryCount());
        assertEquals(new TurnRestriction(3, 9, 4), index.toList().get(1));
    }

    @Test
    @DisplayName("Malformed input is rejected")
    void testMalformedInput() {
        assertThrows(IllegalArgumentException.class,
                () -> TurnRestrictionIndex.of(new int[]{1}, new int[0], new int[]{2}));
        assertThrows(IllegalArgumentException.class,
                () -> TurnRestrictionIndex.of(new int[]{-1}, new int[]{0}, new int[]{2}));
    }

    @Test
    @DisplayName("High load with colliding keys keeps every entry reachable")
    void testHighLoad() {
        int count = 5_000;
        int[] from = new int[count];
        int[] via = new int[count];
        int[] to = new int[count];
        for (int i = 0; i < count; i++) {
            from[i] = i;
            via[i] = i * 7;
            to[i] = i + 1;
        }
        TurnRestrictionIndex index = TurnRestrictionIndex.of(from, via, to);
        assertEquals(count, index.size());
        for (int i = 0; i < count; i++) {
            assertTrue(index.isRestricted(i, i * 7, i + 1), "missing restriction " + i);
            assertFalse(index.isRestricted(i, i * 7, i + 2));
        }
    }

    @Test
    @DisplayName("Concurrent readers observe identical answers")
    void testConcurrentReads() throws Exception {
        int count = 1_000;
        int[] from = new int[count];
        int[] via = new int[count];
        int[] to = new int[count];
        for (int i = 0; i < count; i++) {
            from[i] = i * 2;
            via[i] = i;
            to[i] = i * 2 + 1;
        }
        TurnRestrictionIndex index = TurnRestrictionIndex.of(from, via, to);

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                tasks.add(() -> {
                    int hits = 0;
                    for (int round = 0; round < 20; round++) {
                        for (int i = 0; i < count; i++) {
                            if (index.isRestricted(i * 2, i, i * 2 + 1)) {
                                hits++;
                            }
                        }
                    }
                    return hits;
                });
            }
            for (Future<Integer> future : executor.invokeAll(tasks)) {
                assertEquals(20 * count, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
