/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;

public interface StoreClientPlugin extends SampleStorePlugin<StoreClient> {

    @Override
    default PluginKind kind() {
        return PluginKind.STORE;
    }

    @Override
    StoreClient create(StoreConfig config, MetricsRuntime metrics);
}
