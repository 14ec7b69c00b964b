/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.cache.IndexSets;
import com.intuitivedesigns.samplestore.cache.ObjectMirror;
import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies relational Subject/Aspect mutations to the cache.
 *
 * <p>A rename moves the mirror entry; a rename, unpublish or delete also purges the samples
 * filed under the old identity so no sample outlives the visibility of its owner.</p>
 */
public final class MirrorSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(MirrorSynchronizer.class);

    private final StoreClient client;
    private final ObjectMirror mirror;
    private final IndexSets indexes;
    private final SampleUpsertResolver resolver;

    public MirrorSynchronizer(StoreClient client, ObjectMirror mirror, IndexSets indexes, SampleUpsertResolver resolver) {
        this.client = Objects.requireNonNull(client, "client");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * @param previous row state before the save, or null for an insert
     * @param current  row state after the save
     */
    public void subjectSaved(Subject previous, Subject current) {
        Objects.requireNonNull(current, "current");
        final boolean renamed = previous != null && !sameName(previous.absolutePath(), current.absolutePath());

        StoreBatch batch = StoreBatch.create();
        if (renamed) {
            mirror.stageRemove(batch, ObjectType.SUBJECT, previous.absolutePath());
        }
        mirror.stagePut(batch, current);
        client.execute(batch);

        if (renamed) {
            purgeSubjectSamples(previous.absolutePath());
        }
        if (!current.published()) {
            purgeSubjectSamples(current.absolutePath());
        }
    }

    public void subjectDeleted(Subject subject) {
        Objects.requireNonNull(subject, "subject");
        mirror.remove(ObjectType.SUBJECT, subject.absolutePath());
        purgeSubjectSamples(subject.absolutePath());
    }

    public void aspectSaved(Aspect previous, Aspect current) {
        Objects.requireNonNull(current, "current");
        final boolean renamed = previous != null && !sameName(previous.name(), current.name());

        StoreBatch batch = StoreBatch.create();
        if (renamed) {
            mirror.stageRemove(batch, ObjectType.ASPECT, previous.name());
        }
        mirror.stagePut(batch, current);
        client.execute(batch);

        if (renamed) {
            purgeAspectSamples(previous.name());
        }
        if (!current.published()) {
            purgeAspectSamples(current.name());
        }
    }

    public void aspectDeleted(Aspect aspect) {
        Objects.requireNonNull(aspect, "aspect");
        mirror.remove(ObjectType.ASPECT, aspect.name());
        purgeAspectSamples(aspect.name());
    }

    /**
     * @return number of sample hashes removed
     */
    public int purgeSubjectSamples(String absolutePath) {
        int removed = 0;
        for (String aspect : indexes.aspectsForSubject(absolutePath)) {
            if (resolver.purge(absolutePath, aspect)) removed++;
        }
        if (removed > 0) {
            log.info("Purged {} sample(s) under subject {}", removed, absolutePath);
        }
        return removed;
    }

    public int purgeAspectSamples(String aspectName) {
        int removed = 0;
        for (String subject : indexes.subjectsForAspect(aspectName)) {
            if (resolver.purge(subject, aspectName)) removed++;
        }
        if (removed > 0) {
            log.info("Purged {} sample(s) for aspect {}", removed, aspectName);
        }
        return removed;
    }

    private static boolean sameName(String a, String b) {
        return KeyCodec.lower(a).equals(KeyCodec.lower(b));
    }
}
