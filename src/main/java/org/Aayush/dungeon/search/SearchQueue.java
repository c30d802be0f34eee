package org.Aayush.dungeon.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A specialized indexed Min-Priority Queue for grid A* searches.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Zero Allocation:</strong> Items are dense int ids (grid cell indices) stored with their
 * priorities in parallel primitive arrays sized once at construction.</li>
 * <li><strong>Decrease-Key Support:</strong> O(log n) priority updates via an item-to-slot position
 * array that is rewritten on every heap swap.</li>
 * <li><strong>Strict Contracts:</strong> Enqueueing a present item, updating an absent item, or
 * dequeueing from an empty queue fail fast instead of corrupting the heap.</li>
 * </ul>
 * </p>
 * <p>Equal priorities are ordered by the lower item id, so dequeue order is fully deterministic.</p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. It is intended for single-threaded use.</p>
 */
public class SearchQueue {

    // The Binary Heap (1-based indexing for easier parent/child math)
    private final int[] heapItems;
    private final double[] heapPriorities;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // Position tracking for Decrease-Key: positions[item] = heapIndex, 0 means absent
    private final int[] positions;

    // Diagnostics
    @Getter
    private int peakSize = 0;

    /**
     * Initializes the queue with fixed capacity.
     *
     * @param capacity number of distinct item ids; valid ids are {@code [0, capacity)}.
     * @throws IllegalArgumentException if capacity is not positive.
     */
    public SearchQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        // +1 for 1-based heap indexing
        this.heapItems = new int[capacity + 1];
        this.heapPriorities = new double[capacity + 1];
        this.positions = new int[capacity];
    }

    /**
     * Inserts an item that is not yet queued.
     *
     * @param item     item id in {@code [0, capacity)}.
     * @param priority ordering key; lower is dequeued first.
     * @throws IllegalArgumentException if item is out of bounds or priority is NaN.
     * @throws IllegalStateException    if the item is already queued.
     */
    public void enqueue(int item, double priority) {
        checkItem(item);
        checkPriority(priority);
        if (positions[item] != 0) {
            throw new IllegalStateException("item " + item + " already queued; use updatePriority");
        }
        size++;
        heapItems[size] = item;
        heapPriorities[size] = priority;
        positions[item] = size;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
    }

    /**
     * Extracts the item with the minimum priority.
     *
     * @return the minimum item id.
     * @throws EmptyQueueException if queue is empty.
     */
    public int dequeue() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        int min = heapItems[1];
        int lastIndex = size;
        positions[min] = 0;

        // Single-element fast path.
        if (lastIndex == 1) {
            size = 0;
            return min;
        }

        heapItems[1] = heapItems[lastIndex];
        heapPriorities[1] = heapPriorities[lastIndex];
        positions[heapItems[1]] = 1;
        size = lastIndex - 1;

        sink(1);
        return min;
    }

    /**
     * Returns the minimum item without removing it.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public int peek() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heapItems[1];
    }

    /**
     * Returns the priority of the minimum item.
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public double peekPriority() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }
        return heapPriorities[1];
    }

    /**
     * Checks whether the item is currently queued.
     */
    public boolean contains(int item) {
        return item >= 0 && item < positions.length && positions[item] != 0;
    }

    /**
     * Returns the current priority of a queued item.
     *
     * @throws IllegalStateException if the item is not queued.
     */
    public double priorityOf(int item) {
        return heapPriorities[requirePosition(item)];
    }

    /**
     * Changes the priority of a queued item and restores heap order in either direction.
     *
     * @throws IllegalStateException if the item is not queued.
     */
    public void updatePriority(int item, double newPriority) {
        checkPriority(newPriority);
        int slot = requirePosition(item);
        double old = heapPriorities[slot];
        heapPriorities[slot] = newPriority;
        if (newPriority < old) {
            swim(slot);
        } else {
            sink(slot);
        }
    }

    /**
     * Checks if the queue is empty.
     * @return true if empty, false otherwise.
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Clears the queue for a new search. Runs in O(size).
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heapItems[i]] = 0;
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

    /**
     * Returns whether heap slot {@code i} orders after slot {@code j}.
     */
    private boolean greater(int i, int j) {
        int cmp = Double.compare(heapPriorities[i], heapPriorities[j]);
        if (cmp != 0) {
            return cmp > 0;
        }
        return heapItems[i] > heapItems[j];
    }

    /**
     * Swaps two heap entries and updates position map accordingly.
     */
    private void swap(int i, int j) {
        int itemI = heapItems[i];
        int itemJ = heapItems[j];
        double priorityI = heapPriorities[i];

        heapItems[i] = itemJ;
        heapPriorities[i] = heapPriorities[j];
        heapItems[j] = itemI;
        heapPriorities[j] = priorityI;

        positions[itemJ] = i;
        positions[itemI] = j;
    }

    private int requirePosition(int item) {
        checkItem(item);
        int slot = positions[item];
        if (slot == 0) {
            throw new IllegalStateException("item " + item + " is not queued");
        }
        return slot;
    }

    private void checkItem(int item) {
        if (item < 0 || item >= positions.length) {
            throw new IllegalArgumentException(
                    "item " + item + " out of bounds (max: " + (positions.length - 1) + ")"
            );
        }
    }

    private static void checkPriority(double priority) {
        if (Double.isNaN(priority)) {
            throw new IllegalArgumentException("priority must not be NaN");
        }
    }
}
