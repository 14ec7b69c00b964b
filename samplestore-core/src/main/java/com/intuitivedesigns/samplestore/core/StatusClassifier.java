/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.Status;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Maps a reported value onto an aspect's status bands.
 * <p>
 * Pure function of (value, bands). The previous status of a sample is never an input.
 */
public final class StatusClassifier {

    /** Severity order in which bands are tested; first match wins. */
    static final List<Status> BAND_ORDER = List.of(Status.CRITICAL, Status.WARNING, Status.INFO, Status.OK);

    // Plain decimal notation only: no hex, no NaN/Infinity, no type suffixes
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private StatusClassifier() {}

    public static Status classify(String value, Aspect aspect) {
        final OptionalDouble parsed = parse(value);
        if (parsed.isEmpty() || aspect == null) {
            return Status.INVALID;
        }
        final double v = parsed.getAsDouble();
        for (Status status : BAND_ORDER) {
            Range band = aspect.rangeFor(status);
            if (band != null && band.contains(v)) {
                return status;
            }
        }
        return Status.INVALID;
    }

    /**
     * Numeric reading of a sample value; booleans read as 1 and 0.
     */
    static OptionalDouble parse(String value) {
        if (value == null) return OptionalDouble.empty();
        final String v = value.trim();
        if (v.isEmpty()) return OptionalDouble.empty();

        final String lower = v.toLowerCase(Locale.ROOT);
        if ("true".equals(lower)) return OptionalDouble.of(1);
        if ("false".equals(lower)) return OptionalDouble.of(0);

        if (!NUMBER.matcher(v).matches()) return OptionalDouble.empty();
        final double d = Double.parseDouble(v);
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
}
