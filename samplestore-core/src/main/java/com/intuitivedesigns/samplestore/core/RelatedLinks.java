/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.errors.ValidationException;
import com.intuitivedesigns.samplestore.model.RelatedLink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class RelatedLinks {

    private RelatedLinks() {}

    /**
     * Merges by link name: matching names take the incoming url in place, new names are appended.
     * A null {@code incoming} means the field was omitted and {@code existing} is returned unchanged.
     */
    static List<RelatedLink> merge(List<RelatedLink> existing, List<RelatedLink> incoming) {
        final List<RelatedLink> base = existing == null ? List.of() : existing;
        if (incoming == null) {
            return base;
        }

        Map<String, RelatedLink> byName = new LinkedHashMap<>();
        for (RelatedLink link : base) {
            byName.put(link.name(), link);
        }
        for (RelatedLink link : incoming) {
            if (link == null || link.name().isBlank()) {
                throw new ValidationException("relatedLinks entries need a non-blank name");
            }
            byName.put(link.name(), link);
        }
        return new ArrayList<>(byName.values());
    }
}
