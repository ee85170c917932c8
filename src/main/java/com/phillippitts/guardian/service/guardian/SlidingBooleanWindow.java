package com.phillippitts.guardian.service.guardian;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Fixed-size window over the most recent boolean samples.
 */
final class SlidingBooleanWindow {

    private final int capacity;
    private final Deque<Boolean> samples;

    SlidingBooleanWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.samples = new ArrayDeque<>(capacity);
    }

    void add(boolean sample) {
        if (samples.size() == capacity) {
            samples.removeFirst();
        }
        samples.addLast(sample);
    }

    /** True only when the window is full and every sample in it is true. */
    boolean isSaturated() {
        return samples.size() == capacity && !samples.contains(Boolean.FALSE);
    }

    int size() {
        return samples.size();
    }

    void clear() {
        samples.clear();
    }
}
