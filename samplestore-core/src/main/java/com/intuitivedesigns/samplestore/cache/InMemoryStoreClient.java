/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.cache;

import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Local in-memory store client.
 *
 * Characteristics:
 * - Thread-safe (ConcurrentHashMap + read/write lock around batches)
 * - Non-evicting, non-persistent
 * - Batches are atomic: readers never observe half of one
 *
 * Used for single-node deployments and tests; mirrors the Redis hash/set semantics the
 * store relies on (empty sets and hashes cease to exist, type clashes are rejected).
 */
public final class InMemoryStoreClient implements StoreClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStoreClient.class);

    private static final int DEFAULT_INITIAL = 256;

    private final Map<String, Object> entries;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryStoreClient() {
        this(DEFAULT_INITIAL);
    }

    public InMemoryStoreClient(int initialCapacity) {
        this.entries = new ConcurrentHashMap<>(initialCapacity);
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        lock.readLock().lock();
        try {
            Object v = entries.get(key);
            if (v == null) return Map.of();
            return Map.copyOf(asHash(key, v));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        return entries.containsKey(key);
    }

    @Override
    public Set<String> smembers(String key) {
        lock.readLock().lock();
        try {
            Object v = entries.get(key);
            if (v == null) return Set.of();
            return Set.copyOf(asSet(key, v));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long scard(String key) {
        lock.readLock().lock();
        try {
            Object v = entries.get(key);
            return v == null ? 0 : asSet(key, v).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Set<String> scan(String pattern) {
        final Pattern regex = globToRegex(pattern);
        Set<String> out = new HashSet<>();
        for (String key : entries.keySet()) {
            if (regex.matcher(key).matches()) out.add(key);
        }
        return out;
    }

    @Override
    public void execute(StoreBatch batch) {
        if (batch.isEmpty()) return;

        lock.writeLock().lock();
        try {
            // Validate first so a type clash leaves nothing half-applied
            for (StoreBatch.Op op : batch.ops()) {
                Object current = entries.get(op.key());
                if (current == null) continue;
                if (op instanceof StoreBatch.AddMembers || op instanceof StoreBatch.RemoveMembers) {
                    asSet(op.key(), current);
                }
            }
            for (StoreBatch.Op op : batch.ops()) {
                apply(op);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void apply(StoreBatch.Op op) {
        if (op instanceof StoreBatch.PutHash put) {
            if (put.fields().isEmpty()) {
                entries.remove(put.key());
            } else {
                entries.put(put.key(), new HashMap<>(put.fields()));
            }
        } else if (op instanceof StoreBatch.AddMembers add) {
            Object current = entries.get(add.key());
            Set<String> set = (current == null) ? new HashSet<>() : asSet(add.key(), current);
            set.addAll(add.members());
            entries.put(add.key(), set);
        } else if (op instanceof StoreBatch.RemoveMembers rem) {
            Object current = entries.get(rem.key());
            if (current == null) return;
            Set<String> set = asSet(rem.key(), current);
            set.removeAll(rem.members());
            if (set.isEmpty()) entries.remove(rem.key());
        } else if (op instanceof StoreBatch.Delete del) {
            entries.remove(del.key());
        } else {
            throw new IllegalArgumentException("Unsupported batch op: " + op.getClass().getName());
        }
    }

    /**
     * Explicit clear for lifecycle control in tests.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("In-memory store cleared.");
    }

    public int size() {
        return entries.size();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> asHash(String key, Object v) {
        if (v instanceof Map) return (Map<String, String>) v;
        throw new IllegalStateException("WRONGTYPE key " + key + " does not hold a hash");
    }

    @SuppressWarnings("unchecked")
    private static Set<String> asSet(String key, Object v) {
        if (v instanceof Set) return (Set<String>) v;
        throw new IllegalStateException("WRONGTYPE key " + key + " does not hold a set");
    }

    static Pattern globToRegex(String glob) {
        final String[] parts = glob.split("\\*", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) sb.append(".*");
            sb.append(Pattern.quote(parts[i]));
        }
        return Pattern.compile(sb.toString());
    }
}
