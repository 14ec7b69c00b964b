/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.cache;

import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.errors.SampleStoreException;
import com.intuitivedesigns.samplestore.errors.SourceReadException;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.MirroredObject;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Full-cache lifecycle: wipe and rebuild of the Subject/Aspect mirror.
 *
 * <p>Callers must quiesce upsert traffic around {@link #init()}; nothing here enforces it.</p>
 */
public final class LifecycleController {

    private static final Logger log = LoggerFactory.getLogger(LifecycleController.class);

    private final StoreClient client;
    private final ObjectMirror mirror;
    private final IndexSets indexes;
    private final SubjectAspectSource source;

    public LifecycleController(StoreClient client, ObjectMirror mirror, IndexSets indexes, SubjectAspectSource source) {
        this.client = Objects.requireNonNull(client, "client");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * Deletes every key under the store namespace. Running it on an empty cache is a no-op.
     *
     * @return number of keys deleted
     */
    public int eradicate() {
        final Set<String> keys = client.scan(KeyCodec.namespacePattern());
        if (!keys.isEmpty()) {
            client.execute(StoreBatch.create().delete(keys));
        }
        log.info("Eradicated {} cache key(s)", keys.size());
        return keys.size();
    }

    /**
     * Rebuilds the Subject and Aspect mirror from the authoritative source.
     * <p>
     * Both tables are read in full before the first write, and the mirror is replaced in a
     * single batch: a source failure leaves the cache exactly as it was. Samples and the
     * sample-side indices are not touched.
     *
     * @throws SourceReadException if the source cannot be read
     */
    public InitReport init() {
        final List<Subject> subjects;
        final List<Aspect> aspects;
        try {
            subjects = source.findAllSubjects();
            aspects = source.findAllAspects();
        } catch (SampleStoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceReadException("Failed to read subjects/aspects from source", e);
        }

        StoreBatch batch = StoreBatch.create();
        final int staleSubjects = stageReplace(batch, ObjectType.SUBJECT, subjects);
        final int staleAspects = stageReplace(batch, ObjectType.ASPECT, aspects);
        client.execute(batch);

        InitReport report = new InitReport(subjects.size(), aspects.size(), staleSubjects + staleAspects);
        log.info("Cache initialized: subjects={} aspects={} staleRemoved={}",
                report.subjects(), report.aspects(), report.staleRemoved());
        return report;
    }

    private int stageReplace(StoreBatch batch, ObjectType type, List<? extends MirroredObject> objects) {
        Set<String> written = new HashSet<>();
        for (MirroredObject o : objects) {
            if (!written.add(mirror.stagePut(batch, o))) {
                log.warn("Duplicate {} name '{}' in source; last row wins", type.tag(), o.naturalName());
            }
        }
        int stale = 0;
        for (String key : indexes.members(type)) {
            if (!written.contains(key)) {
                mirror.stageRemoveKey(batch, type, key);
                stale++;
            }
        }
        return stale;
    }

    public record InitReport(int subjects, int aspects, int staleRemoved) {}
}
