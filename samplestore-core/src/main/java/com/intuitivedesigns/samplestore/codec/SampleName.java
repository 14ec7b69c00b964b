/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.codec;

import com.intuitivedesigns.samplestore.errors.ValidationException;

/**
 * Composite sample identity {@code subjectAbsolutePath|aspectName}.
 */
public record SampleName(String subjectPath, String aspectName) {

    public static final char DELIMITER = '|';

    public static SampleName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("sample name is required");
        }
        final int idx = name.indexOf(DELIMITER);
        if (idx < 0 || name.indexOf(DELIMITER, idx + 1) >= 0) {
            throw malformed(name);
        }
        final String subject = name.substring(0, idx).trim();
        final String aspect = name.substring(idx + 1).trim();
        if (subject.isEmpty() || aspect.isEmpty()) {
            throw malformed(name);
        }
        return new SampleName(subject, aspect);
    }

    public static String compose(String subjectPath, String aspectName) {
        return subjectPath + DELIMITER + aspectName;
    }

    public String value() {
        return compose(subjectPath, aspectName);
    }

    @Override
    public String toString() {
        return value();
    }

    private static ValidationException malformed(String name) {
        return new ValidationException("sample name '" + name + "' must look like subjectAbsolutePath|aspectName");
    }
}
