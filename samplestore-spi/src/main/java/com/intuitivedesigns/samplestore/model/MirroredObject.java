/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

/**
 * A relational row copied into the cache (Subject or Aspect).
 */
public interface MirroredObject {

    ObjectType type();

    /**
     * Canonical-case natural name (absolutePath for subjects, name for aspects).
     */
    String naturalName();

    String id();

    boolean published();
}
