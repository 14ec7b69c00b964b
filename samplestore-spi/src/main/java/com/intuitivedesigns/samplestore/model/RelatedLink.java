/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.Objects;

public record RelatedLink(String name, String url) {

    public RelatedLink {
        Objects.requireNonNull(name, "RelatedLink name cannot be null");
        Objects.requireNonNull(url, "RelatedLink url cannot be null");
    }
}
