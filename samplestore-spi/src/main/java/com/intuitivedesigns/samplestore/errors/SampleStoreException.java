/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.errors;

/**
 * Root of every failure raised by the sample store.
 */
public abstract class SampleStoreException extends RuntimeException {

    protected SampleStoreException(String message) {
        super(message);
    }

    protected SampleStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the caller may retry the same operation unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}
