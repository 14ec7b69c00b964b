/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

/**
 * Closed numeric interval of a status band. A null bound is unbounded on that side,
 * which is how an aspect expresses "greater is worse" versus "lower is worse".
 *
 * @param min inclusive lower bound, or null for -infinity
 * @param max inclusive upper bound, or null for +infinity
 */
public record Range(Double min, Double max) {

    public Range {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
        }
        if ((min != null && min.isNaN()) || (max != null && max.isNaN())) {
            throw new IllegalArgumentException("Range bounds must not be NaN");
        }
    }

    public static Range between(double min, double max) {
        return new Range(min, max);
    }

    public static Range atLeast(double min) {
        return new Range(min, null);
    }

    public static Range atMost(double max) {
        return new Range(null, max);
    }

    public boolean contains(double value) {
        if (min != null && value < min) return false;
        return max == null || value <= max;
    }
}
