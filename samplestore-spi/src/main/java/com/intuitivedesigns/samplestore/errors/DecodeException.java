/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.errors;

/**
 * A cache hash is missing a required field or holds an unparseable value.
 */
public final class DecodeException extends SampleStoreException {

    private final String key;

    public DecodeException(String key, String message) {
        super("Corrupt entry " + key + ": " + message);
        this.key = key;
    }

    public DecodeException(String key, String message, Throwable cause) {
        super("Corrupt entry " + key + ": " + message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
