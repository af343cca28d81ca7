package org.Aayush.graphlab.search;

/**
 * Min-priority queue contract shared by the shortest-path engines.
 * <p>
 * Smaller priority values rank higher. Elements with equal priority keep their
 * insertion order (FIFO), so dequeuing is stable. The queue is append/remove only:
 * an element that is already enqueued cannot be re-prioritized.
 * </p>
 *
 * <p><strong>Thread Safety:</strong> implementations are NOT thread-safe.</p>
 *
 * @param <E> element type, opaque to the queue.
 * @param <P> priority type.
 */
public interface MinPriorityQueue<E, P extends Comparable<? super P>> {

    /**
     * @return true when the queue holds no element.
     */
    boolean isEmpty();

    /**
     * @return number of enqueued elements, duplicates included.
     */
    int size();

    /**
     * Returns the element that would be dequeued at position {@code index}.
     *
     * @param index 0-based position in ascending-priority, then insertion, order.
     * @return element at that position.
     * @throws IndexOutOfBoundsException if {@code index < 0 || index >= size()}.
     */
    E peek(int index);

    /**
     * @return the front element of the smallest priority, without removing it.
     * @throws EmptyQueueException if the queue is empty.
     */
    E peekFirst();

    /**
     * @return the most recently enqueued element of the largest priority.
     * @throws EmptyQueueException if the queue is empty.
     */
    E peekLast();

    /**
     * Appends an element. Duplicate (item, priority) pairs are allowed.
     *
     * @param item element to enqueue.
     * @param priority non-null priority.
     */
    void enqueue(E item, P priority);

    /**
     * Removes and returns the front element of the smallest priority.
     *
     * @return removed element.
     * @throws EmptyQueueException if the queue is empty.
     */
    E dequeue();

    /**
     * @return an independent queue with the same elements in the same order.
     */
    MinPriorityQueue<E, P> copy();
}
