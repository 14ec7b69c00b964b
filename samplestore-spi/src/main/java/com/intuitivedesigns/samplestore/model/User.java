/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.Objects;

/**
 * The account behind a sample's provider id, attached to upsert responses.
 *
 * @param profile may be null when the user has no profile row
 */
public record User(String id, String name, String email, Profile profile) {

    public User {
        Objects.requireNonNull(id, "User id cannot be null");
    }

    public record Profile(String id, String name) {}
}
