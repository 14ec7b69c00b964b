/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;

/**
 * Base contract for every ServiceLoader-discovered plugin.
 *
 * @param <T> the component the plugin builds
 */
public interface SampleStorePlugin<T> {

    /**
     * Selector matched (case-insensitively) against configuration, e.g. "REDIS", "KAFKA".
     */
    String id();

    PluginKind kind();

    T create(StoreConfig config, MetricsRuntime metrics) throws Exception;
}
