package com.example.resilience.monitoring;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Buffer circular de sólo-añadir: al superar la capacidad se descarta el elemento más antiguo.
 */
public class BoundedHistory<T> {

    private final int capacity;
    private final Deque<T> items;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T item) {
        if (items.size() == capacity) {
            items.pollFirst();
        }
        items.addLast(item);
    }

    /**
     * Copia en orden de inserción (más antiguo primero).
     */
    public synchronized List<T> toList() {
        return new ArrayList<>(items);
    }

    public synchronized Optional<T> latest() {
        return Optional.ofNullable(items.peekLast());
    }

    public synchronized Optional<T> oldest() {
        return Optional.ofNullable(items.peekFirst());
    }

    public synchronized int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        items.clear();
    }
}
