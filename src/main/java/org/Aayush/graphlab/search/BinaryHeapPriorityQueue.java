package org.Aayush.graphlab.search;

import java.util.Arrays;
import java.util.Objects;

/**
 * Binary-heap min-priority queue, an alternative to {@link HashTablePriorityQueue}.
 * <p>
 * Entries are ordered by priority and then by a monotonically increasing insertion
 * sequence, which makes the heap stable: equal priorities come out in FIFO order.
 * Enqueue and dequeue are O(log n). {@link #peekLast()} scans the leaves and
 * {@link #peek(int)} sorts a snapshot, so both are slower than in the hash-table variant.
 * </p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 *
 * @param <E> element type.
 * @param <P> priority type.
 */
public class BinaryHeapPriorityQueue<E, P extends Comparable<? super P>> implements MinPriorityQueue<E, P> {

    private static final int DEFAULT_CAPACITY = 16;

    // The Binary Heap (1-based indexing for easier parent/child math)
    private Entry<E, P>[] heap;
    private int size = 0;
    private long nextSequence = 0L;

    public BinaryHeapPriorityQueue() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * @param initialCapacity expected number of simultaneous entries; the heap grows past it.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    @SuppressWarnings("unchecked")
    public BinaryHeapPriorityQueue(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        // +1 for 1-based heap indexing
        this.heap = (Entry<E, P>[]) new Entry[initialCapacity + 1];
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public E peek(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds [0, " + size + ")");
        }
        if (index == 0) {
            return heap[1].item;
        }
        Entry<E, P>[] snapshot = Arrays.copyOfRange(heap, 1, size + 1);
        Arrays.sort(snapshot);
        return snapshot[index].item;
    }

    @Override
    public E peekFirst() {
        requireNotEmpty();
        return heap[1].item;
    }

    @Override
    public E peekLast() {
        requireNotEmpty();
        // The maximum of a min-heap lives among the leaves.
        Entry<E, P> max = heap[size];
        for (int i = size / 2 + 1; i <= size; i++) {
            if (heap[i].compareTo(max) > 0) {
                max = heap[i];
            }
        }
        return max.item;
    }

    @Override
    public void enqueue(E item, P priority) {
        Objects.requireNonNull(priority, "priority");
        if (size >= heap.length - 1) {
            heap = Arrays.copyOf(heap, heap.length * 2);
        }
        size++;
        heap[size] = new Entry<>(item, priority, nextSequence++);
        swim(size);
    }

    @Override
    public E dequeue() {
        requireNotEmpty();
        Entry<E, P> min = heap[1];
        heap[1] = heap[size];
        heap[size] = null;
        size--;
        if (size > 1) {
            sink(1);
        }
        return min.item;
    }

    @Override
    public BinaryHeapPriorityQueue<E, P> copy() {
        BinaryHeapPriorityQueue<E, P> copy = new BinaryHeapPriorityQueue<>(Math.max(size, 1));
        System.arraycopy(heap, 1, copy.heap, 1, size);
        copy.size = size;
        copy.nextSequence = nextSequence;
        return copy;
    }

    private void requireNotEmpty() {
        if (size == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
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
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        Entry<E, P> tmp = heap[i];
        heap[i] = heap[j];
        heap[j] = tmp;
    }

    private static final class Entry<E, P extends Comparable<? super P>> implements Comparable<Entry<E, P>> {
        final E item;
        final P priority;
        final long sequence;

        Entry(E item, P priority, long sequence) {
            this.item = item;
            this.priority = priority;
            this.sequence = sequence;
        }

        @Override
        public int compareTo(Entry<E, P> other) {
            int priorityCompare = priority.compareTo(other.priority);
            if (priorityCompare != 0) {
                return priorityCompare;
            }
            return Long.compare(sequence, other.sequence);
        }
    }
}
