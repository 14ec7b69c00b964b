/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.Objects;

/**
 * Mirrored subject row.
 *
 * @param id          authoritative row id
 * @param absolutePath case-preserving path, unique case-insensitively
 * @param published   publication gate
 */
public record Subject(String id, String absolutePath, boolean published) implements MirroredObject {

    public Subject {
        Objects.requireNonNull(id, "Subject id cannot be null");
        Objects.requireNonNull(absolutePath, "Subject absolutePath cannot be null");
        if (absolutePath.isBlank()) {
            throw new IllegalArgumentException("Subject absolutePath cannot be blank");
        }
    }

    @Override
    public ObjectType type() {
        return ObjectType.SUBJECT;
    }

    @Override
    public String naturalName() {
        return absolutePath;
    }

    public Subject withPublished(boolean newPublished) {
        return new Subject(id, absolutePath, newPublished);
    }

    public Subject withAbsolutePath(String newPath) {
        return new Subject(id, newPath, published);
    }
}
