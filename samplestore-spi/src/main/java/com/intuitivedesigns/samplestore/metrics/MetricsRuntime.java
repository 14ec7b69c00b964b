/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.metrics;

import java.util.function.DoubleSupplier;

/**
 * The vendor-agnostic contract for observability.
 *
 * Components record through this interface only, so the store runs unchanged whether
 * metrics are backed by Micrometer or switched off.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    /**
     * Registers a gauge that reads {@code source} whenever the registry is scraped.
     */
    default void gauge(String name, DoubleSupplier source) {}

    @Override
    default void close() {
        // no-op by default
    }
}
