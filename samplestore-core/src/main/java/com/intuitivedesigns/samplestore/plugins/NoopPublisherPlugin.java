/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.plugins;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.spi.PublisherPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discards every sample update.
 * <p>
 * ID: NOOP
 */
public final class NoopPublisherPlugin implements PublisherPlugin {

    public static final String ID = "NOOP";
    private static final Logger log = LoggerFactory.getLogger(NoopPublisherPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public EventPublisher create(StoreConfig config, MetricsRuntime metrics) {
        log.info("Sample update notifications disabled (notifier.type=NOOP)");
        return new NoopPublisher();
    }

    private static final class NoopPublisher implements EventPublisher {

        @Override
        public void publish(String key, String payload) {
            // discarded
        }

        @Override
        public String id() {
            return ID;
        }
    }
}
