/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

/**
 * Sample status. Declaration order after {@link #INVALID} is the band evaluation order.
 */
public enum Status {
    INVALID("Invalid"),
    CRITICAL("Critical"),
    WARNING("Warning"),
    INFO("Info"),
    OK("OK");

    private final String label;

    Status(String label) {
        this.label = label;
    }

    /**
     * Wire and cache representation ("Invalid", "Critical", ...).
     */
    public String label() {
        return label;
    }

    public static Status fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Status label must not be null");
        }
        for (Status s : values()) {
            if (s.label.equalsIgnoreCase(label.trim())) return s;
        }
        throw new IllegalArgumentException("Unknown status: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
