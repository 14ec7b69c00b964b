/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.cache;

import com.intuitivedesigns.samplestore.codec.HashCodec;
import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.MirroredObject;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Cache-resident copy of relational Subject and Aspect rows.
 *
 * <p>{@code get} on a missing key is {@link Optional#empty()}, not an error, so callers can tell
 * "absent" from "present but unpublished". Each write is one single-key batch (hash plus its
 * index membership); nothing here spans keys, so a get-then-put is not atomic.</p>
 */
public final class ObjectMirror {

    private final StoreClient client;
    private final IndexSets indexes;
    private final HashCodec codec;

    public ObjectMirror(StoreClient client, IndexSets indexes, HashCodec codec) {
        this.client = Objects.requireNonNull(client, "client");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public Optional<MirroredObject> get(ObjectType type, String name) {
        switch (type) {
            case SUBJECT: return subject(name).map(MirroredObject.class::cast);
            case ASPECT: return aspect(name).map(MirroredObject.class::cast);
            default: throw new IllegalArgumentException("Object mirror does not hold " + type.tag() + " entries");
        }
    }

    public Optional<Subject> subject(String absolutePath) {
        final String key = KeyCodec.toKey(ObjectType.SUBJECT, absolutePath);
        final Map<String, String> hash = client.hgetAll(key);
        return hash.isEmpty() ? Optional.empty() : Optional.of(codec.decodeSubject(key, hash));
    }

    public Optional<Aspect> aspect(String name) {
        final String key = KeyCodec.toKey(ObjectType.ASPECT, name);
        final Map<String, String> hash = client.hgetAll(key);
        return hash.isEmpty() ? Optional.empty() : Optional.of(codec.decodeAspect(key, hash));
    }

    public void put(MirroredObject object) {
        StoreBatch batch = StoreBatch.create();
        stagePut(batch, object);
        client.execute(batch);
    }

    public void remove(ObjectType type, String name) {
        StoreBatch batch = StoreBatch.create();
        stageRemove(batch, type, name);
        client.execute(batch);
    }

    /**
     * Adds the hash replacement and index membership of {@code object} to a batch.
     *
     * @return the object's cache key
     */
    public String stagePut(StoreBatch batch, MirroredObject object) {
        Objects.requireNonNull(object, "object");
        final String key = KeyCodec.toKey(object.type(), object.naturalName());
        final Map<String, String> hash;
        if (object instanceof Subject s) {
            hash = codec.encode(s);
        } else if (object instanceof Aspect a) {
            hash = codec.encode(a);
        } else {
            throw new IllegalArgumentException("Unsupported mirrored object: " + object.getClass().getName());
        }
        batch.putHash(key, hash);
        indexes.stageIndexed(batch, object.type(), key);
        return key;
    }

    public void stageRemove(StoreBatch batch, ObjectType type, String name) {
        stageRemoveKey(batch, type, KeyCodec.toKey(type, name));
    }

    void stageRemoveKey(StoreBatch batch, ObjectType type, String key) {
        batch.delete(key);
        indexes.stageUnindexed(batch, type, key);
    }
}
