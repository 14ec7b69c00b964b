/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify;

import com.intuitivedesigns.samplestore.spi.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event to the log. For local runs without a broker.
 */
public final class LogEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LogEventPublisher.class);

    private final boolean includePayload;

    public LogEventPublisher(boolean includePayload) {
        this.includePayload = includePayload;
    }

    @Override
    public void publish(String key, String payload) {
        if (includePayload) {
            log.info("sample update key={} payload={}", key, payload);
        } else {
            log.info("sample update key={}", key);
        }
    }

    @Override
    public String id() {
        return "LOG";
    }
}
