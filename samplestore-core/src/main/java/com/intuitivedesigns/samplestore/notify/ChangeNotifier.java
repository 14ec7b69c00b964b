/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify;

import com.intuitivedesigns.samplestore.model.Sample;

/**
 * Hands the post-upsert state of a sample to downstream consumers.
 * <p>
 * Implementations should log and count their own delivery failures. Anything thrown from
 * {@link #notifyUpsert} is logged by the caller and does not fail the upsert.
 */
public interface ChangeNotifier extends AutoCloseable {

    void notifyUpsert(Sample sample);

    @Override
    default void close() {
        // no-op by default
    }

    static ChangeNotifier noop() {
        return sample -> { };
    }
}
