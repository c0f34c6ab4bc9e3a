package com.dredd.context;

import com.dredd.exception.MissingContextKeyException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe store of typed key-value pairs shared between the caller and the rules of a tree.
 * <p>
 * All values of one store have the same type. A store outlives a single run and may be
 * reused across runner invocations; it may also be read or written from outside the
 * traversal while a run is in progress. Locks are held for a single map access only,
 * so hooks are free to call back into the store.
 * <p>
 * Null keys and null values are rejected: a key is either present with a value or absent.
 *
 * @param <V> value type
 */
public class RuleContext<V> {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, V> entries;

    public RuleContext() {
        this.entries = new HashMap<>();
    }

    private RuleContext(Map<String, V> entries) {
        this.entries = entries;
    }

    /**
     * Create a store with a pre-sized backing map.
     */
    public static <V> RuleContext<V> withCapacity(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0: " + capacity);
        }
        return new RuleContext<>(new HashMap<>(capacity));
    }

    /**
     * Create a store seeded with a copy of the given entries.
     */
    public static <V> RuleContext<V> of(Map<String, ? extends V> seed) {
        RuleContext<V> context = withCapacity(seed.size());
        seed.forEach(context::set);
        return context;
    }

    /**
     * Look up a value.
     *
     * @return the value, or empty if the key is absent
     */
    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Look up a value the caller asserts must be present.
     *
     * @throws MissingContextKeyException if the key is absent
     */
    public V mustGet(String key) {
        return get(key).orElseThrow(() -> new MissingContextKeyException(key));
    }

    /**
     * Add or replace a value. Concurrent writers to the same key: last one wins.
     */
    public void set(String key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.writeLock().lock();
        try {
            entries.put(key, value);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a key. No-op if absent.
     */
    public void delete(String key) {
        Objects.requireNonNull(key, "key");
        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean exists(String key) {
        Objects.requireNonNull(key, "key");
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of the current keys, in no particular order.
     */
    public List<String> keys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Immutable copy of the current entries.
     */
    public Map<String, V> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "RuleContext{size=" + size() + '}';
    }
}
