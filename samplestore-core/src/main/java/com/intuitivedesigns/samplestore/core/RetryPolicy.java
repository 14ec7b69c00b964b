/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.errors.SampleStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for retryable store failures.
 * Only exceptions reporting {@link SampleStoreException#isRetryable()} are retried.
 */
public record RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final String KEY_MAX_ATTEMPTS = "store.retry.max.attempts";
    public static final String KEY_BACKOFF_INITIAL_MS = "store.retry.backoff.initial.ms";
    public static final String KEY_BACKOFF_MAX_MS = "store.retry.backoff.max.ms";

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("backoff must satisfy 0 <= initial <= max");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, 50L, 1_000L);
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0L, 0L);
    }

    public static RetryPolicy fromConfig(StoreConfig config) {
        Objects.requireNonNull(config, "config");
        RetryPolicy d = defaults();
        return new RetryPolicy(
                config.getInt(KEY_MAX_ATTEMPTS, d.maxAttempts()),
                config.getLong(KEY_BACKOFF_INITIAL_MS, d.initialBackoffMs()),
                config.getLong(KEY_BACKOFF_MAX_MS, d.maxBackoffMs()));
    }

    public <T> T call(String operation, Supplier<T> body) {
        long backoffMs = initialBackoffMs;
        for (int attempt = 1; ; attempt++) {
            try {
                return body.get();
            } catch (SampleStoreException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, backoffMs, e.getMessage());
                sleep(backoffMs, e);
                backoffMs = Math.min(maxBackoffMs, Math.max(1L, backoffMs * 2));
            }
        }
    }

    private static void sleep(long ms, SampleStoreException pending) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw pending;
        }
    }
}
