/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A telemetry reading for one (subject, aspect) pair.
 *
 * @param name            canonical-case {@code subjectAbsolutePath|aspectName}
 * @param value           raw reported value, numeric or not
 * @param status          classification of {@code value}
 * @param previousStatus  status held before the latest upsert ({@link Status#INVALID} on creation)
 * @param statusChangedAt last time {@code status} changed
 * @param updatedAt       last upsert time
 * @param createdAt       first upsert time
 * @param relatedLinks    ordered links, unique by name; never null
 * @param messageCode     optional short code, may be null
 * @param messageBody     optional free text, may be null
 * @param provider        id of the last reporting provider, may be null
 * @param user            account resolved from {@code provider}; only set on upsert results
 */
public record Sample(
        String name,
        String value,
        Status status,
        Status previousStatus,
        Instant statusChangedAt,
        Instant updatedAt,
        Instant createdAt,
        String subjectId,
        String aspectId,
        List<RelatedLink> relatedLinks,
        String messageCode,
        String messageBody,
        String provider,
        User user
) {

    public Sample {
        Objects.requireNonNull(name, "Sample name cannot be null");
        Objects.requireNonNull(status, "Sample status cannot be null");
        if (value == null) value = "";
        if (previousStatus == null) previousStatus = Status.INVALID;
        relatedLinks = (relatedLinks == null) ? List.of() : List.copyOf(relatedLinks);
    }

    public Sample(String name, String value, Status status, Status previousStatus,
                  Instant statusChangedAt, Instant updatedAt, Instant createdAt,
                  String subjectId, String aspectId, List<RelatedLink> relatedLinks,
                  String messageCode, String messageBody, String provider) {
        this(name, value, status, previousStatus, statusChangedAt, updatedAt, createdAt,
                subjectId, aspectId, relatedLinks, messageCode, messageBody, provider, null);
    }

    public Sample withUser(User newUser) {
        return new Sample(name, value, status, previousStatus, statusChangedAt, updatedAt, createdAt,
                subjectId, aspectId, relatedLinks, messageCode, messageBody, provider, newUser);
    }
}
