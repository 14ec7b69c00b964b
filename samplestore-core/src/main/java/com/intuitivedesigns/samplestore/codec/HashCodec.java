/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.samplestore.errors.DecodeException;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.RelatedLink;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.Status;
import com.intuitivedesigns.samplestore.model.Subject;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts mirrored objects and samples to flat string hashes and back.
 *
 * Encoding rules:
 * - booleans as "true"/"false"
 * - timestamps as ISO-8601 instants
 * - ranges as a JSON pair {@code [min,max]} (null for an open bound)
 * - related links as a JSON array of {@code {name,url}}
 * - null fields are omitted
 *
 * Decoding fails with {@link DecodeException} when a required field is missing or unparseable.
 */
public final class HashCodec {

    // Subject / Aspect
    static final String F_ID = "id";
    static final String F_ABSOLUTE_PATH = "absolutePath";
    static final String F_NAME = "name";
    static final String F_IS_PUBLISHED = "isPublished";
    static final String F_CRITICAL_RANGE = "criticalRange";
    static final String F_WARNING_RANGE = "warningRange";
    static final String F_INFO_RANGE = "infoRange";
    static final String F_OK_RANGE = "okRange";

    // Sample
    static final String F_VALUE = "value";
    static final String F_STATUS = "status";
    static final String F_PREVIOUS_STATUS = "previousStatus";
    static final String F_STATUS_CHANGED_AT = "statusChangedAt";
    static final String F_UPDATED_AT = "updatedAt";
    static final String F_CREATED_AT = "createdAt";
    static final String F_SUBJECT_ID = "subjectId";
    static final String F_ASPECT_ID = "aspectId";
    static final String F_RELATED_LINKS = "relatedLinks";
    static final String F_MESSAGE_CODE = "messageCode";
    static final String F_MESSAGE_BODY = "messageBody";
    static final String F_PROVIDER = "provider";

    private static final TypeReference<List<RelatedLink>> LINKS_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public HashCodec() {
        this(new ObjectMapper());
    }

    public HashCodec(ObjectMapper json) {
        this.json = json;
    }

    // --- Subject ---

    public Map<String, String> encode(Subject s) {
        Map<String, String> h = new HashMap<>();
        h.put(F_ID, s.id());
        h.put(F_ABSOLUTE_PATH, s.absolutePath());
        h.put(F_IS_PUBLISHED, Boolean.toString(s.published()));
        return h;
    }

    public Subject decodeSubject(String key, Map<String, String> h) {
        return new Subject(
                required(key, h, F_ID),
                required(key, h, F_ABSOLUTE_PATH),
                bool(key, h, F_IS_PUBLISHED));
    }

    // --- Aspect ---

    public Map<String, String> encode(Aspect a) {
        Map<String, String> h = new HashMap<>();
        h.put(F_ID, a.id());
        h.put(F_NAME, a.name());
        h.put(F_IS_PUBLISHED, Boolean.toString(a.published()));
        putRange(h, F_CRITICAL_RANGE, a.criticalRange());
        putRange(h, F_WARNING_RANGE, a.warningRange());
        putRange(h, F_INFO_RANGE, a.infoRange());
        putRange(h, F_OK_RANGE, a.okRange());
        return h;
    }

    public Aspect decodeAspect(String key, Map<String, String> h) {
        return new Aspect(
                required(key, h, F_ID),
                required(key, h, F_NAME),
                bool(key, h, F_IS_PUBLISHED),
                range(key, h, F_CRITICAL_RANGE),
                range(key, h, F_WARNING_RANGE),
                range(key, h, F_INFO_RANGE),
                range(key, h, F_OK_RANGE));
    }

    // --- Sample ---

    public Map<String, String> encode(Sample s) {
        Map<String, String> h = new HashMap<>();
        h.put(F_NAME, s.name());
        h.put(F_VALUE, s.value());
        h.put(F_STATUS, s.status().label());
        h.put(F_PREVIOUS_STATUS, s.previousStatus().label());
        putInstant(h, F_STATUS_CHANGED_AT, s.statusChangedAt());
        putInstant(h, F_UPDATED_AT, s.updatedAt());
        putInstant(h, F_CREATED_AT, s.createdAt());
        putIfPresent(h, F_SUBJECT_ID, s.subjectId());
        putIfPresent(h, F_ASPECT_ID, s.aspectId());
        h.put(F_RELATED_LINKS, write(s.relatedLinks()));
        putIfPresent(h, F_MESSAGE_CODE, s.messageCode());
        putIfPresent(h, F_MESSAGE_BODY, s.messageBody());
        putIfPresent(h, F_PROVIDER, s.provider());
        return h;
    }

    public Sample decodeSample(String key, Map<String, String> h) {
        return new Sample(
                required(key, h, F_NAME),
                h.get(F_VALUE),
                status(key, required(key, h, F_STATUS)),
                h.containsKey(F_PREVIOUS_STATUS) ? status(key, h.get(F_PREVIOUS_STATUS)) : Status.INVALID,
                instant(key, h, F_STATUS_CHANGED_AT),
                instant(key, h, F_UPDATED_AT),
                instant(key, h, F_CREATED_AT),
                h.get(F_SUBJECT_ID),
                h.get(F_ASPECT_ID),
                links(key, h.get(F_RELATED_LINKS)),
                h.get(F_MESSAGE_CODE),
                h.get(F_MESSAGE_BODY),
                h.get(F_PROVIDER));
    }

    // --- Helpers ---

    private static String required(String key, Map<String, String> h, String field) {
        String v = h.get(field);
        if (v == null) {
            throw new DecodeException(key, "missing required field '" + field + "'");
        }
        return v;
    }

    private static boolean bool(String key, Map<String, String> h, String field) {
        String v = required(key, h, field);
        if ("true".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v)) return false;
        throw new DecodeException(key, "field '" + field + "' is not a boolean: " + v);
    }

    private static Status status(String key, String label) {
        try {
            return Status.fromLabel(label);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(key, e.getMessage(), e);
        }
    }

    private static Instant instant(String key, Map<String, String> h, String field) {
        String v = h.get(field);
        if (v == null || v.isEmpty()) return null;
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException e) {
            throw new DecodeException(key, "field '" + field + "' is not an ISO-8601 instant: " + v, e);
        }
    }

    private Range range(String key, Map<String, String> h, String field) {
        String v = h.get(field);
        if (v == null || v.isEmpty()) return null;
        try {
            Double[] pair = json.readValue(v, Double[].class);
            if (pair == null || pair.length != 2) {
                throw new DecodeException(key, "field '" + field + "' is not a [min,max] pair: " + v);
            }
            return new Range(pair[0], pair[1]);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new DecodeException(key, "field '" + field + "' is not a valid range: " + v, e);
        }
    }

    private List<RelatedLink> links(String key, String v) {
        if (v == null || v.isEmpty()) return List.of();
        try {
            List<RelatedLink> out = json.readValue(v, LINKS_TYPE);
            return out == null ? List.of() : out;
        } catch (JsonProcessingException e) {
            throw new DecodeException(key, "field '" + F_RELATED_LINKS + "' is not a link array", e);
        }
    }

    private void putRange(Map<String, String> h, String field, Range r) {
        if (r != null) {
            h.put(field, write(new Double[]{r.min(), r.max()}));
        }
    }

    private static void putInstant(Map<String, String> h, String field, Instant t) {
        if (t != null) h.put(field, t.toString());
    }

    private static void putIfPresent(Map<String, String> h, String field, String v) {
        if (v != null) h.put(field, v);
    }

    private String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }
}
