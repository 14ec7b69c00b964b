/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.errors;

import com.intuitivedesigns.samplestore.model.ObjectType;

/**
 * The addressed object is absent, or is hidden by the publication gate.
 */
public final class NotFoundException extends SampleStoreException {

    private final ObjectType objectType;

    public NotFoundException(ObjectType objectType, String message) {
        super(message);
        this.objectType = objectType;
    }

    /**
     * Cause family of the miss; both map to the same outward "not found".
     */
    public ObjectType objectType() {
        return objectType;
    }

    public static NotFoundException unpublishedOrMissing(ObjectType type) {
        return new NotFoundException(type,
                type.tag() + " for this sample was not found or has isPublished=false");
    }

    public static NotFoundException sample(String name) {
        return new NotFoundException(ObjectType.SAMPLE, "sample " + name + " was not found");
    }
}
