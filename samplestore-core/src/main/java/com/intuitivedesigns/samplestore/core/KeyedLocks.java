/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One mutex per live key. Entries exist only while some thread holds or waits on them,
 * so distinct keys never share a lock and the map does not grow with the keyspace.
 */
final class KeyedLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    <T> T withLock(String key, Supplier<T> body) {
        // holders is only mutated inside compute/computeIfPresent, which serialize per key
        final Entry entry = locks.compute(key, (k, e) -> {
            Entry held = (e == null) ? new Entry() : e;
            held.holders++;
            return held;
        });

        entry.lock.lock();
        try {
            return body.get();
        } finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.holders == 0 ? null : e);
        }
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int holders;
    }
}
