package com.groundwave.zettelkasten.domain;

import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Holder for the currently published snapshot of one index.
 *
 * Readers run under the read lock; publishing only swaps the reference under the
 * write lock, so a reader sees either the previous or the next snapshot in full.
 *
 * @param <T> immutable snapshot type
 */
public class PublishedSnapshot<T> {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private T current;

    public void publish(T snapshot) {
        lock.writeLock().lock();
        try {
            current = snapshot;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Apply {@code reader} to the current snapshot, or return empty if nothing was published yet.
     */
    public <R> Optional<R> read(Function<T, R> reader) {
        lock.readLock().lock();
        try {
            return current == null ? Optional.empty() : Optional.ofNullable(reader.apply(current));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<T> current() {
        return read(Function.identity());
    }
}
