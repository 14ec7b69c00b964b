/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.errors;

/**
 * Client input fault: malformed sample name, missing or oversized field.
 */
public final class ValidationException extends SampleStoreException {

    public ValidationException(String message) {
        super(message);
    }
}
