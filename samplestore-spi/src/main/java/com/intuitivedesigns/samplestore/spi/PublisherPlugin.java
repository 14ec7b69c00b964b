/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;

public interface PublisherPlugin extends SampleStorePlugin<EventPublisher> {

    @Override
    default PluginKind kind() {
        return PluginKind.NOTIFIER;
    }

    @Override
    EventPublisher create(StoreConfig config, MetricsRuntime metrics);
}
