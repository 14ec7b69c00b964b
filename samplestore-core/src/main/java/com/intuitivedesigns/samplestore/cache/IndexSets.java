/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.cache;

import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;

import java.util.Objects;
import java.util.Set;

/**
 * Membership sets over the cache.
 * <p>
 * {@code <type>:index} holds the keys of every object of a type. {@code aspsubmap} and
 * {@code subaspmap} are derived indices over samples and move in lockstep with sample
 * creation and deletion. All writes are staged into a {@link StoreBatch} so they commit
 * together with the hash they describe; set adds and removes are idempotent.
 */
public final class IndexSets {

    private final StoreClient client;

    public IndexSets(StoreClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public Set<String> members(ObjectType type) {
        return client.smembers(KeyCodec.indexKey(type));
    }

    public long size(ObjectType type) {
        return client.scard(KeyCodec.indexKey(type));
    }

    /**
     * Lowercased subject paths that currently have a sample for the aspect.
     */
    public Set<String> subjectsForAspect(String aspectName) {
        return client.smembers(KeyCodec.aspSubMapKey(aspectName));
    }

    /**
     * Lowercased aspect names that currently have a sample under the subject.
     */
    public Set<String> aspectsForSubject(String subjectPath) {
        return client.smembers(KeyCodec.subAspMapKey(subjectPath));
    }

    void stageIndexed(StoreBatch batch, ObjectType type, String key) {
        batch.sadd(KeyCodec.indexKey(type), key);
    }

    void stageUnindexed(StoreBatch batch, ObjectType type, String key) {
        batch.srem(KeyCodec.indexKey(type), key);
    }

    public void stageSampleCreated(StoreBatch batch, String sampleKey, String subjectPath, String aspectName) {
        batch.sadd(KeyCodec.indexKey(ObjectType.SAMPLE), sampleKey)
                .sadd(KeyCodec.aspSubMapKey(aspectName), KeyCodec.lower(subjectPath))
                .sadd(KeyCodec.subAspMapKey(subjectPath), KeyCodec.lower(aspectName));
    }

    public void stageSampleRemoved(StoreBatch batch, String sampleKey, String subjectPath, String aspectName) {
        batch.srem(KeyCodec.indexKey(ObjectType.SAMPLE), sampleKey)
                .srem(KeyCodec.aspSubMapKey(aspectName), KeyCodec.lower(subjectPath))
                .srem(KeyCodec.subAspMapKey(subjectPath), KeyCodec.lower(aspectName));
    }
}
