/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.samplestore.model.RelatedLink;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.User;

import java.time.Instant;

/**
 * Wire representation of a sample for the change notifier.
 */
public final class SampleJson {

    private final ObjectMapper json;

    public SampleJson() {
        this(new ObjectMapper());
    }

    public SampleJson(ObjectMapper json) {
        this.json = json;
    }

    public ObjectNode toNode(Sample s) {
        ObjectNode root = json.createObjectNode();
        root.put("name", s.name());
        root.put("value", s.value());
        root.put("status", s.status().label());
        root.put("previousStatus", s.previousStatus().label());
        putInstant(root, "statusChangedAt", s.statusChangedAt());
        putInstant(root, "updatedAt", s.updatedAt());
        putInstant(root, "createdAt", s.createdAt());
        root.put("subjectId", s.subjectId());
        root.put("aspectId", s.aspectId());

        ArrayNode links = root.putArray("relatedLinks");
        for (RelatedLink link : s.relatedLinks()) {
            links.addObject().put("name", link.name()).put("url", link.url());
        }

        if (s.messageCode() != null) root.put("messageCode", s.messageCode());
        if (s.messageBody() != null) root.put("messageBody", s.messageBody());
        if (s.provider() != null) root.put("provider", s.provider());
        if (s.user() != null) putUser(root.putObject("user"), s.user());
        return root;
    }

    public String write(Sample s) throws JsonProcessingException {
        return json.writeValueAsString(toNode(s));
    }

    private static void putUser(ObjectNode node, User user) {
        node.put("id", user.id());
        node.put("name", user.name());
        node.put("email", user.email());
        if (user.profile() != null) {
            node.putObject("profile")
                    .put("id", user.profile().id())
                    .put("name", user.profile().name());
        }
    }

    private static void putInstant(ObjectNode node, String field, Instant t) {
        if (t != null) node.put(field, t.toString());
    }
}
