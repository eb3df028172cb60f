package io.kairos.core.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity buffer that overwrites its oldest element when full. Not thread-safe.
 */
final class RingBuffer<T> {
    private final Object[] slots;
    private int head;
    private int size;

    RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.slots = new Object[capacity];
    }

    void add(T value) {
        slots[(head + size) % slots.length] = value;
        if (size < slots.length) {
            size++;
        } else {
            head = (head + 1) % slots.length;
        }
    }

    int size() {
        return size;
    }

    int capacity() {
        return slots.length;
    }

    /**
     * Up to {@code limit} elements, newest first.
     */
    @SuppressWarnings("unchecked")
    List<T> newest(int limit) {
        int count = Math.min(Math.max(0, limit), size);
        List<T> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add((T) slots[(head + size - 1 - i) % slots.length]);
        }
        return result;
    }
}
