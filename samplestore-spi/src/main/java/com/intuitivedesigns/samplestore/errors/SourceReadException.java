/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.errors;

/**
 * Reading the authoritative relational store failed.
 */
public final class SourceReadException extends SampleStoreException {

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
