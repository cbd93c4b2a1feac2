package io.fullerstack.performance.core.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Bounded, time-pruned history.
 *
 * <p>Entries are kept in arrival order. Two limits apply:
 * <ul>
 *   <li><b>Capacity</b>: when full, the oldest entry is evicted on append</li>
 *   <li><b>Retention</b>: {@link #prune()} drops entries whose timestamp is strictly
 *       older than {@code now - retention}</li>
 * </ul>
 *
 * <p>All reads return copies; callers never see the live deque.
 *
 * @param <T> entry type
 */
public class RetentionBuffer<T> {

    private final Deque<T> entries = new ArrayDeque<>();
    private final int capacity;
    private final Duration retention;
    private final Function<T, Instant> timestampOf;
    private final Clock clock;

    /**
     * @param capacity    maximum number of entries kept
     * @param retention   age after which entries are pruned
     * @param timestampOf extracts an entry's timestamp
     * @param clock       time source for pruning and windows
     */
    public RetentionBuffer(int capacity, Duration retention, Function<T, Instant> timestampOf, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        this.capacity = capacity;
        this.retention = Objects.requireNonNull(retention, "retention cannot be null");
        this.timestampOf = Objects.requireNonNull(timestampOf, "timestampOf cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Appends an entry, evicting the oldest when at capacity.
     *
     * @return true if an entry was evicted to make room
     */
    public synchronized boolean add(T entry) {
        Objects.requireNonNull(entry, "entry cannot be null");
        boolean evicted = false;
        if (entries.size() >= capacity) {
            entries.removeFirst();
            evicted = true;
        }
        entries.addLast(entry);
        return evicted;
    }

    /**
     * Drops entries strictly older than the retention cutoff.
     *
     * @return number of entries removed
     */
    public synchronized int prune() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        Iterator<T> it = entries.iterator();
        while (it.hasNext()) {
            if (timestampOf.apply(it.next()).isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Entries stamped within {@code window} of now, inclusive of the boundary.
     */
    public synchronized List<T> within(Duration window) {
        Instant cutoff = clock.instant().minus(window);
        return entries.stream()
            .filter(entry -> !timestampOf.apply(entry).isBefore(cutoff))
            .toList();
    }

    public synchronized List<T> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized Optional<T> latest() {
        return Optional.ofNullable(entries.peekLast());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
