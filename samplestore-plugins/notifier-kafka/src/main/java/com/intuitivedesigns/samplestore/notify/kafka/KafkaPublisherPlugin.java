/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify.kafka;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.spi.PublisherPlugin;

import java.util.Objects;

/**
 * ID: KAFKA
 */
public final class KafkaPublisherPlugin implements PublisherPlugin {

    public static final String ID = "KAFKA";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventPublisher create(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return KafkaEventPublisher.fromConfig(config, metrics);
    }
}
