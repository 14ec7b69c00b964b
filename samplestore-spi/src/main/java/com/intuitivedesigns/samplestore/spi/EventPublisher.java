/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

/**
 * Broker-facing end of the change notifier.
 *
 * <p><b>Contract:</b></p>
 * <ul>
 * <li>{@link #publish(String, String)} hands one keyed message to the broker and may throw on failure.</li>
 * <li>It is only ever called from the notifier's single publisher thread.</li>
 * </ul>
 */
public interface EventPublisher extends AutoCloseable {

    /**
     * @param key     sample name (routing key)
     * @param payload serialized sample
     * @throws Exception if the broker rejects the message or is unreachable
     */
    void publish(String key, String payload) throws Exception;

    default void flush() throws Exception {
        // no-op for unbuffered publishers
    }

    default String id() {
        return this.getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
