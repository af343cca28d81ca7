package org.Aayush.graphlab.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HashTablePriorityQueue Tests")
class HashTablePriorityQueueTest {

    @Nested
    @DisplayName("1. Distinct-priority index")
    class DistinctIndexTests {

        @Test
        @DisplayName("A key exists iff its bucket is non-empty")
        void testKeyLifecycle() {
            HashTablePriorityQueue<String, Double> queue = new HashTablePriorityQueue<>();
            queue.enqueue("a", 1.0);
            queue.enqueue("b", 1.0);
            queue.enqueue("c", 2.5);
            assertEquals(2, queue.distinctPriorityCount());

            queue.dequeue();
            assertEquals(2, queue.distinctPriorityCount(), "Bucket 1.0 still holds 'b'");
            queue.dequeue();
            assertEquals(1, queue.distinctPriorityCount(), "Emptied bucket must leave the index");
            assertEquals("c", queue.peekFirst());

            queue.dequeue();
            assertEquals(0, queue.distinctPriorityCount());
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("Reusing a drained priority starts a fresh bucket")
        void testReuseAfterDrain() {
            HashTablePriorityQueue<String, Integer> queue = new HashTablePriorityQueue<>();
            queue.enqueue("first", 1);
            queue.dequeue();
            queue.enqueue("second", 1);
            assertEquals("second", queue.peekFirst());
            assertEquals("second", queue.peekLast());
            assertEquals(1, queue.size());
        }
    }

    @Nested
    @DisplayName("2. Large buckets")
    class BucketTests {

        @Test
        @DisplayName("FIFO holds across bucket compaction")
        void testLongSinglePriorityRun() {
            HashTablePriorityQueue<Integer, Integer> queue = new HashTablePriorityQueue<>();
            for (int i = 0; i < 100; i++) {
                queue.enqueue(i, 0);
            }
            for (int i = 0; i < 60; i++) {
                assertEquals(i, queue.dequeue());
            }
            assertEquals(60, queue.peek(0));
            assertEquals(99, queue.peek(39));
            assertEquals(99, queue.peekLast());
            for (int i = 100; i < 120; i++) {
                queue.enqueue(i, 0);
            }
            for (int i = 60; i < 120; i++) {
                assertEquals(i, queue.dequeue());
            }
            assertTrue(queue.isEmpty());
        }

        @Test
        @DisplayName("Copy is independent of the original")
        void testCopyIndependence() {
            HashTablePriorityQueue<String, Integer> queue = new HashTablePriorityQueue<>();
            queue.enqueue("x", 2);
            queue.enqueue("y", 1);
            HashTablePriorityQueue<String, Integer> copy = queue.copy();

            copy.dequeue();
            copy.enqueue("z", 0);

            assertEquals(2, queue.size());
            assertEquals("y", queue.peekFirst());
            assertEquals("z", copy.peekFirst());
            assertEquals(2, copy.size());
        }
    }
}
