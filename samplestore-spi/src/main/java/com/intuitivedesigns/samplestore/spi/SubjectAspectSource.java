/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.errors.SourceReadException;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.model.User;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the authoritative relational store.
 * Every method throws {@link SourceReadException} when the store cannot be read.
 */
public interface SubjectAspectSource extends AutoCloseable {

    /**
     * Case-insensitive lookup; published and unpublished rows alike.
     */
    Optional<Subject> findSubjectByAbsolutePath(String absolutePath);

    Optional<Aspect> findAspectByName(String name);

    List<Subject> findAllSubjects();

    List<Aspect> findAllAspects();

    /**
     * Resolves a sample provider id. Sources without user rows resolve nothing.
     */
    default Optional<User> findUserById(String id) {
        return Optional.empty();
    }

    @Override
    default void close() {
        // no-op by default
    }
}
