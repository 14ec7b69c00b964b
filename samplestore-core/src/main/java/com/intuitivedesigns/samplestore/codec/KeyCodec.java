/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.codec;

import com.intuitivedesigns.samplestore.errors.ValidationException;
import com.intuitivedesigns.samplestore.model.ObjectType;

import java.util.Locale;

/**
 * Maps (object type, natural name) to cache keys and back.
 *
 * Layout:
 * <pre>
 *   samsto:subject:&lt;lowercased absolutePath&gt;   subject hash
 *   samsto:aspect:&lt;lowercased name&gt;            aspect hash
 *   samsto:sample:&lt;lowercased path|aspect&gt;     sample hash
 *   samsto:&lt;type&gt;:index                         set of keys of that type
 *   samsto:aspsubmap:&lt;lowercased aspect&gt;       set of lowercased subject paths
 *   samsto:subaspmap:&lt;lowercased path&gt;         set of lowercased aspect names
 * </pre>
 * Names are lowercased for lookup only; display casing lives inside the hashes.
 */
public final class KeyCodec {

    public static final String NAMESPACE = "samsto";
    public static final String INDEX = "index";

    private static final String SEP = ":";
    private static final String ASP_SUB_MAP = "aspsubmap";
    private static final String SUB_ASP_MAP = "subaspmap";

    private KeyCodec() {}

    public static String toKey(ObjectType type, String name) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        final String normalized = normalize(name, type.tag());
        if (INDEX.equals(normalized)) {
            throw new ValidationException("'" + name + "' is a reserved " + type.tag() + " name");
        }
        return NAMESPACE + SEP + type.tag() + SEP + normalized;
    }

    public static String indexKey(ObjectType type) {
        return NAMESPACE + SEP + type.tag() + SEP + INDEX;
    }

    public static String aspSubMapKey(String aspectName) {
        return NAMESPACE + SEP + ASP_SUB_MAP + SEP + normalize(aspectName, "aspect");
    }

    public static String subAspMapKey(String subjectPath) {
        return NAMESPACE + SEP + SUB_ASP_MAP + SEP + normalize(subjectPath, "subject");
    }

    /**
     * Glob matching every key this store owns.
     */
    public static String namespacePattern() {
        return NAMESPACE + SEP + "*";
    }

    /**
     * Splits an object key back into its type and lowercased name.
     *
     * @throws IllegalArgumentException for index keys, map keys, or keys outside the namespace
     */
    public static ParsedKey fromKey(String key) {
        if (key == null || !key.startsWith(NAMESPACE + SEP)) {
            throw new IllegalArgumentException("Not a sample store key: " + key);
        }
        final String rest = key.substring(NAMESPACE.length() + 1);
        final int idx = rest.indexOf(SEP);
        if (idx <= 0 || idx == rest.length() - 1) {
            throw new IllegalArgumentException("Malformed sample store key: " + key);
        }
        final String name = rest.substring(idx + 1);
        if (INDEX.equals(name)) {
            throw new IllegalArgumentException("Index key has no object name: " + key);
        }
        return new ParsedKey(ObjectType.fromTag(rest.substring(0, idx)), name);
    }

    public static String lower(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static String normalize(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(what + " name is required");
        }
        return lower(name);
    }

    public record ParsedKey(ObjectType type, String name) {}
}
