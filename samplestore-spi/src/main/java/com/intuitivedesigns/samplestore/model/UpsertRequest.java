/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.List;

/**
 * Sample upsert input as received from the HTTP layer.
 * <p>
 * {@code relatedLinks == null} means the field was omitted and the stored list is kept;
 * an empty list is an explicit value. The same holds for the message fields and provider.
 */
public record UpsertRequest(
        String name,
        String value,
        List<RelatedLink> relatedLinks,
        String messageCode,
        String messageBody,
        String provider
) {

    public UpsertRequest {
        if (relatedLinks != null) relatedLinks = List.copyOf(relatedLinks);
    }

    public static UpsertRequest of(String name, String value) {
        return new UpsertRequest(name, value, null, null, null, null);
    }

    public UpsertRequest withRelatedLinks(List<RelatedLink> links) {
        return new UpsertRequest(name, value, links, messageCode, messageBody, provider);
    }

    public UpsertRequest withMessage(String code, String body) {
        return new UpsertRequest(name, value, relatedLinks, code, body, provider);
    }

    public UpsertRequest withProvider(String providerId) {
        return new UpsertRequest(name, value, relatedLinks, messageCode, messageBody, providerId);
    }
}
