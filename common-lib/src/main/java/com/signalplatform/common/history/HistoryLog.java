package com.signalplatform.common.history;

import com.signalplatform.common.model.HistoryEntry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fixed-capacity ring buffer of past verdicts, oldest evicted first.
 *
 * <p>One writer (the refresh coordinator) and any number of readers. Appends take the write
 * lock; reads copy under the read lock, so every returned list is a consistent point-in-time
 * view that later appends cannot change.
 */
public class HistoryLog {

    public static final int DEFAULT_CAPACITY = 50;

    private final HistoryEntry[] ring;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int head;   // index of the oldest entry
    private int size;

    public HistoryLog() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be > 0, was " + capacity);
        }
        this.ring = new HistoryEntry[capacity];
    }

    /** O(1); overwrites the oldest entry when full. */
    public void append(HistoryEntry entry) {
        Objects.requireNonNull(entry, "entry");
        lock.writeLock().lock();
        try {
            if (size < ring.length) {
                ring[(head + size) % ring.length] = entry;
                size++;
            } else {
                ring[head] = entry;
                head = (head + 1) % ring.length;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** All entries, oldest first. */
    public List<HistoryEntry> snapshot() {
        lock.readLock().lock();
        try {
            List<HistoryEntry> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                copy.add(ring[(head + i) % ring.length]);
            }
            return List.copyOf(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Up to {@code limit} entries, most recent first. */
    public List<HistoryEntry> latest(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        lock.readLock().lock();
        try {
            int n = Math.min(limit, size);
            List<HistoryEntry> copy = new ArrayList<>(n);
            for (int i = size - 1; i >= size - n; i--) {
                copy.add(ring[(head + i) % ring.length]);
            }
            return List.copyOf(copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return size;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int capacity() {
        return ring.length;
    }
}
