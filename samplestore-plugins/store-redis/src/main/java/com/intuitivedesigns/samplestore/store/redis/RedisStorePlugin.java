/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.store.redis;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.StoreClientPlugin;

import java.util.Objects;

/**
 * ID: REDIS
 */
public final class RedisStorePlugin implements StoreClientPlugin {

    public static final String ID = "REDIS";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public StoreClient create(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return JedisStoreClient.fromConfig(config, metrics);
    }
}
