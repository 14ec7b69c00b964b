/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.errors.StoreUnavailableException;

import java.util.Map;
import java.util.Set;

/**
 * Minimal hash/set key-value surface the sample store needs from its backing cache.
 *
 * <p><b>Thread-safety Contract:</b></p>
 * Implementations must tolerate concurrent callers; many request threads share one client.
 *
 * <p><b>Failure Contract:</b></p>
 * Connectivity failures and timeouts surface as {@link StoreUnavailableException}.
 */
public interface StoreClient extends AutoCloseable {

    /**
     * @return every field of the hash, or an empty map when the key does not exist
     */
    Map<String, String> hgetAll(String key);

    boolean exists(String key);

    Set<String> smembers(String key);

    long scard(String key);

    /**
     * Keys matching a glob pattern ({@code *} wildcards only). Cursor-based where the store supports it.
     */
    Set<String> scan(String pattern);

    /**
     * Applies every operation of the batch atomically, in order.
     */
    void execute(StoreBatch batch);

    /**
     * Round-trip health check.
     */
    default void ping() {
        // no-op for in-process stores
    }

    @Override
    default void close() {
        // no-op by default
    }
}
