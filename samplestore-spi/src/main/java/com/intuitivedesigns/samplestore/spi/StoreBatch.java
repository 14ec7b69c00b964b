/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered list of write operations a {@link StoreClient} applies as one unit.
 * Not thread-safe; build it on the calling thread and hand it over.
 */
public final class StoreBatch {

    /** Marker for the supported write operations. */
    public interface Op {
        String key();
    }

    /** Replaces the whole hash (delete then set). */
    public record PutHash(String key, Map<String, String> fields) implements Op {
        public PutHash {
            fields = Map.copyOf(fields);
        }
    }

    public record AddMembers(String key, List<String> members) implements Op {
        public AddMembers {
            members = List.copyOf(members);
        }
    }

    public record RemoveMembers(String key, List<String> members) implements Op {
        public RemoveMembers {
            members = List.copyOf(members);
        }
    }

    public record Delete(String key) implements Op {}

    private final List<Op> ops = new ArrayList<>();

    public static StoreBatch create() {
        return new StoreBatch();
    }

    public StoreBatch putHash(String key, Map<String, String> fields) {
        ops.add(new PutHash(Objects.requireNonNull(key, "key"), fields));
        return this;
    }

    public StoreBatch sadd(String key, String... members) {
        return sadd(key, List.of(members));
    }

    public StoreBatch sadd(String key, Collection<String> members) {
        if (!members.isEmpty()) {
            ops.add(new AddMembers(Objects.requireNonNull(key, "key"), List.copyOf(members)));
        }
        return this;
    }

    public StoreBatch srem(String key, String... members) {
        return srem(key, List.of(members));
    }

    public StoreBatch srem(String key, Collection<String> members) {
        if (!members.isEmpty()) {
            ops.add(new RemoveMembers(Objects.requireNonNull(key, "key"), List.copyOf(members)));
        }
        return this;
    }

    public StoreBatch delete(String key) {
        ops.add(new Delete(Objects.requireNonNull(key, "key")));
        return this;
    }

    public StoreBatch delete(Collection<String> keys) {
        for (String k : keys) delete(k);
        return this;
    }

    public List<Op> ops() {
        return Collections.unmodifiableList(ops);
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    public int size() {
        return ops.size();
    }
}
