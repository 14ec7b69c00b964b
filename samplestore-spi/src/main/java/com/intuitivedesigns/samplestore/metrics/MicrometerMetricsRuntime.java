/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

/**
 * Metrics bridge for Micrometer.
 *
 * Features:
 * - Composite registry, so backends can be attached after construction
 * - Gauges poll a live source; the registry holds it strongly
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;

    public MicrometerMetricsRuntime() {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(new SimpleMeterRegistry());
    }

    public void addRegistry(MeterRegistry specificRegistry) {
        this.registry.add(specificRegistry);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, DoubleSupplier source) {
        // Re-registering a name keeps the first source
        Gauge.builder(name, source, DoubleSupplier::getAsDouble)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Sum of a counter, or 0 when it was never incremented.
     */
    public double count(String name) {
        var c = registry.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    /**
     * Current reading of a gauge, or NaN when none is registered under {@code name}.
     */
    public double gaugeValue(String name) {
        var g = registry.find(name).gauge();
        return g == null ? Double.NaN : g.value();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed.");
    }
}
