/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.metrics;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private static final String KEY_TYPE = "metrics.type";
    private static final String DEFAULT_TYPE = "NOOP";

    private static final MetricsRuntime NOOP = new NoopMetricsRuntime();

    private MetricsFactory() {}

    public static MetricsRuntime init(StoreConfig config) {
        Objects.requireNonNull(config, "config");

        final String type = config.getString(KEY_TYPE, DEFAULT_TYPE).toUpperCase(Locale.ROOT);
        switch (type) {
            case "MICROMETER":
                log.info("Metrics runtime initialized: MICROMETER");
                return new MicrometerMetricsRuntime();
            case "NOOP":
                return NOOP;
            default:
                log.warn("Unknown {}='{}'. Metrics disabled (NOOP active).", KEY_TYPE, type);
                return NOOP;
        }
    }

    public static MetricsRuntime noop() {
        return NOOP;
    }

    private static final class NoopMetricsRuntime implements MetricsRuntime {
        // Sentinel instead of null so "instanceof" checks downstream stay NPE-free
        private final Object sentinelRegistry = new Object();

        @Override
        public Object registry() {
            return sentinelRegistry;
        }
    }
}
