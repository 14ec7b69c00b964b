/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.model;

import java.util.Locale;

/**
 * Object families held in the sample store. The tag is part of every cache key.
 */
public enum ObjectType {
    SUBJECT("subject"),
    ASPECT("aspect"),
    SAMPLE("sample");

    private final String tag;

    ObjectType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static ObjectType fromTag(String tag) {
        String t = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        for (ObjectType type : values()) {
            if (type.tag.equals(t)) return type;
        }
        throw new IllegalArgumentException("Unknown object type tag: " + tag);
    }
}
