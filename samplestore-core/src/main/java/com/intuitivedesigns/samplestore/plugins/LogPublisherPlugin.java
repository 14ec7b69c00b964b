/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.plugins;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.notify.LogEventPublisher;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.spi.PublisherPlugin;

import java.util.Objects;

/**
 * ID: LOG
 */
public final class LogPublisherPlugin implements PublisherPlugin {

    public static final String ID = "LOG";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventPublisher create(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new LogEventPublisher(config.getBoolean("notifier.log.payload", false));
    }
}
