/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.Objects;

/**
 * Mirrored aspect row with its status bands. Any band may be absent.
 */
public record Aspect(
        String id,
        String name,
        boolean published,
        Range criticalRange,
        Range warningRange,
        Range infoRange,
        Range okRange
) implements MirroredObject {

    public Aspect {
        Objects.requireNonNull(id, "Aspect id cannot be null");
        Objects.requireNonNull(name, "Aspect name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Aspect name cannot be blank");
        }
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    @Override
    public ObjectType type() {
        return ObjectType.ASPECT;
    }

    @Override
    public String naturalName() {
        return name;
    }

    /**
     * Band configured for a status, or null. {@link Status#INVALID} never has a band.
     */
    public Range rangeFor(Status status) {
        switch (status) {
            case CRITICAL: return criticalRange;
            case WARNING: return warningRange;
            case INFO: return infoRange;
            case OK: return okRange;
            default: return null;
        }
    }

    public Aspect withPublished(boolean newPublished) {
        return new Aspect(id, name, newPublished, criticalRange, warningRange, infoRange, okRange);
    }

    public Aspect withName(String newName) {
        return new Aspect(id, newName, published, criticalRange, warningRange, infoRange, okRange);
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private boolean published = true;
        private Range critical;
        private Range warning;
        private Range info;
        private Range ok;

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder published(boolean value) {
            this.published = value;
            return this;
        }

        public Builder critical(Range range) {
            this.critical = range;
            return this;
        }

        public Builder warning(Range range) {
            this.warning = range;
            return this;
        }

        public Builder info(Range range) {
            this.info = range;
            return this;
        }

        public Builder ok(Range range) {
            this.ok = range;
            return this;
        }

        public Aspect build() {
            return new Aspect(id, name, published, critical, warning, info, ok);
        }
    }
}
