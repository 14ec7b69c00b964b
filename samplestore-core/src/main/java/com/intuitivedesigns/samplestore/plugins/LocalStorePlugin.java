/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.plugins;

import com.intuitivedesigns.samplestore.cache.InMemoryStoreClient;
import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.StoreClientPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * In-process store. Nothing survives a restart.
 * <p>
 * ID: LOCAL
 */
public final class LocalStorePlugin implements StoreClientPlugin {

    public static final String ID = "LOCAL";
    private static final Logger log = LoggerFactory.getLogger(LocalStorePlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StoreClient create(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final int initialCapacity = config.getInt("store.local.initial.capacity", 256);
        log.warn("Using LOCAL in-memory store: cache contents are lost on shutdown");
        return new InMemoryStoreClient(initialCapacity);
    }
}
