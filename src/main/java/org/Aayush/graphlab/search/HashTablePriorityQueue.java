package org.Aayush.graphlab.search;

import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectRBTreeSet;

import java.util.Objects;

/**
 * Hash-table-backed min-priority queue.
 * <p>
 * <strong>Layout:</strong>
 * <ul>
 * <li><strong>Buckets:</strong> a hash table maps each priority value present to a FIFO bucket of the
 * elements enqueued with that priority. Bucket lookup is O(1) amortized.</li>
 * <li><strong>Distinct-priority index:</strong> a red-black tree over the priorities that currently own a
 * non-empty bucket. Gives O(log k) access to the smallest and largest priority, k being the number of
 * distinct priorities (k is usually much smaller than n when distances tie).</li>
 * </ul>
 * </p>
 * <p>
 * Invariant: a priority is in the index iff its bucket is non-empty, and the bucket sizes add up to
 * {@link #size()}. {@link #peek(int)} walks the index accumulating bucket sizes, so it is O(k).
 * </p>
 *
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 *
 * @param <E> element type.
 * @param <P> priority type; must have a natural order consistent with equals.
 */
public class HashTablePriorityQueue<E, P extends Comparable<? super P>> implements MinPriorityQueue<E, P> {

    private final Object2ObjectOpenHashMap<P, Bucket<E>> buckets;
    private final ObjectRBTreeSet<P> priorities;
    private int size = 0;

    public HashTablePriorityQueue() {
        this.buckets = new Object2ObjectOpenHashMap<>();
        this.priorities = new ObjectRBTreeSet<>();
    }

    private HashTablePriorityQueue(HashTablePriorityQueue<E, P> source) {
        this.buckets = new Object2ObjectOpenHashMap<>(source.buckets.size());
        for (P priority : source.priorities) {
            this.buckets.put(priority, source.buckets.get(priority).copy());
        }
        this.priorities = new ObjectRBTreeSet<>(source.priorities);
        this.size = source.size;
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
        int passed = 0;
        for (P priority : priorities) {
            Bucket<E> bucket = buckets.get(priority);
            int bucketSize = bucket.size();
            if (index < passed + bucketSize) {
                return bucket.get(index - passed);
            }
            passed += bucketSize;
        }
        // Unreachable while bucket sizes add up to size.
        throw new IllegalStateException("Bucket sizes do not add up to queue size " + size);
    }

    @Override
    public E peekFirst() {
        requireNotEmpty();
        return buckets.get(priorities.first()).front();
    }

    @Override
    public E peekLast() {
        requireNotEmpty();
        return buckets.get(priorities.last()).back();
    }

    @Override
    public void enqueue(E item, P priority) {
        Objects.requireNonNull(priority, "priority");
        Bucket<E> bucket = buckets.get(priority);
        if (bucket == null) {
            bucket = new Bucket<>();
            buckets.put(priority, bucket);
            priorities.add(priority);
        }
        bucket.append(item);
        size++;
    }

    @Override
    public E dequeue() {
        requireNotEmpty();
        P smallest = priorities.first();
        Bucket<E> bucket = buckets.get(smallest);
        E item = bucket.removeFront();
        if (bucket.isEmpty()) {
            buckets.remove(smallest);
            priorities.remove(smallest);
        }
        size--;
        return item;
    }

    @Override
    public HashTablePriorityQueue<E, P> copy() {
        return new HashTablePriorityQueue<>(this);
    }

    /**
     * @return number of distinct priorities currently present.
     */
    public int distinctPriorityCount() {
        return priorities.size();
    }

    private void requireNotEmpty() {
        if (size == 0) {
            throw new EmptyQueueException("Queue is empty");
        }
    }

    /**
     * FIFO run of elements sharing one priority.
     * Removal advances a head cursor; the consumed prefix is compacted once it
     * outgrows the live part.
     */
    private static final class Bucket<E> {
        private final ObjectArrayList<E> items;
        private int head = 0;

        Bucket() {
            this.items = new ObjectArrayList<>(4);
        }

        private Bucket(ObjectArrayList<E> items) {
            this.items = items;
        }

        int size() {
            return items.size() - head;
        }

        boolean isEmpty() {
            return head == items.size();
        }

        E get(int offset) {
            return items.get(head + offset);
        }

        E front() {
            return items.get(head);
        }

        E back() {
            return items.get(items.size() - 1);
        }

        void append(E item) {
            items.add(item);
        }

        E removeFront() {
            E item = items.set(head, null);
            head++;
            if (head > 16 && head * 2 > items.size()) {
                items.removeElements(0, head);
                head = 0;
            }
            return item;
        }

        Bucket<E> copy() {
            return new Bucket<>(new ObjectArrayList<>(items.subList(head, items.size())));
        }
    }
}
