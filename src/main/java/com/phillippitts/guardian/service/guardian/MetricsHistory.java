package com.phillippitts.guardian.service.guardian;

import com.phillippitts.guardian.domain.SystemMetrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Bounded rolling history of collected snapshots, oldest first. Owned by the control loop.
 */
final class MetricsHistory {

    private final int capacity;
    private final Deque<SystemMetrics> entries;

    MetricsHistory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    void add(SystemMetrics metrics) {
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(metrics);
    }

    Optional<SystemMetrics> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    List<SystemMetrics> snapshot() {
        return List.copyOf(entries);
    }

    int size() {
        return entries.size();
    }
}
