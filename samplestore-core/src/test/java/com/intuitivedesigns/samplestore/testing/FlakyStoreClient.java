/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.testing;

import com.intuitivedesigns.samplestore.errors.StoreUnavailableException;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delegating client whose next {@code n} batch executions fail as if the connection dropped.
 */
public final class FlakyStoreClient implements StoreClient {

    private final StoreClient delegate;
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private final AtomicInteger executeCalls = new AtomicInteger();

    public FlakyStoreClient(StoreClient delegate) {
        this.delegate = delegate;
    }

    public void failNextExecutes(int n) {
        failuresLeft.set(n);
    }

    public int executeCalls() {
        return executeCalls.get();
    }

    @Override
    public Map<String, String> hgetAll(String key) {
        return delegate.hgetAll(key);
    }

    @Override
    public boolean exists(String key) {
        return delegate.exists(key);
    }

    @Override
    public Set<String> smembers(String key) {
        return delegate.smembers(key);
    }

    @Override
    public long scard(String key) {
        return delegate.scard(key);
    }

    @Override
    public Set<String> scan(String pattern) {
        return delegate.scan(pattern);
    }

    @Override
    public void execute(StoreBatch batch) {
        executeCalls.incrementAndGet();
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new StoreUnavailableException("connection reset by peer", null);
        }
        delegate.execute(batch);
    }
}
