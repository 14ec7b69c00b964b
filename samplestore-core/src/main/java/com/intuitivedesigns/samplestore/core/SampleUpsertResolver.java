/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.cache.IndexSets;
import com.intuitivedesigns.samplestore.cache.ObjectMirror;
import com.intuitivedesigns.samplestore.codec.HashCodec;
import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.codec.SampleName;
import com.intuitivedesigns.samplestore.errors.NotFoundException;
import com.intuitivedesigns.samplestore.errors.ValidationException;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.RelatedLink;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.Status;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.model.UpsertRequest;
import com.intuitivedesigns.samplestore.spi.StoreBatch;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a sample upsert against the mirrored Subjects and Aspects and writes the merged sample.
 *
 * <p>The read-classify-merge-write sequence for one sample key runs under a per-key lock, so
 * concurrent upserts of the same name inside this process serialize. The sample hash and its
 * index memberships are committed in one store batch.</p>
 */
public final class SampleUpsertResolver {

    private static final Logger log = LoggerFactory.getLogger(SampleUpsertResolver.class);

    static final int MAX_MESSAGE_CODE = 5;
    static final int MAX_MESSAGE_BODY = 4096;

    private final StoreClient client;
    private final ObjectMirror mirror;
    private final IndexSets indexes;
    private final HashCodec codec;
    private final Clock clock;
    private final MetricsRuntime metrics;
    private final KeyedLocks locks = new KeyedLocks();

    public SampleUpsertResolver(StoreClient client,
                                ObjectMirror mirror,
                                IndexSets indexes,
                                HashCodec codec,
                                Clock clock,
                                MetricsRuntime metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.indexes = Objects.requireNonNull(indexes, "indexes");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public Sample upsert(UpsertRequest request) {
        Objects.requireNonNull(request, "request");
        validateMessage(request);

        final long start = System.nanoTime();
        final SampleName parsed = SampleName.parse(request.name());

        // Fail fast outside the lock; the check is repeated once the key is held
        final Owners early = resolveOwners(parsed);
        final String key = KeyCodec.toKey(ObjectType.SAMPLE,
                SampleName.compose(early.subject().absolutePath(), early.aspect().name()));

        final Sample result = locks.withLock(key, () -> write(key, parsed, request));
        metrics.timer("samsto.upsert.latency", (System.nanoTime() - start) / 1_000_000L);
        return result;
    }

    /**
     * Subject first: when both are missing the subject error wins.
     */
    private Owners resolveOwners(SampleName parsed) {
        final Subject subject = mirror.subject(parsed.subjectPath())
                .filter(Subject::published)
                .orElseThrow(() -> notFound(ObjectType.SUBJECT));
        final Aspect aspect = mirror.aspect(parsed.aspectName())
                .filter(Aspect::published)
                .orElseThrow(() -> notFound(ObjectType.ASPECT));
        return new Owners(subject, aspect);
    }

    private boolean stillVisible(SampleName parsed) {
        return mirror.subject(parsed.subjectPath()).filter(Subject::published).isPresent()
                && mirror.aspect(parsed.aspectName()).filter(Aspect::published).isPresent();
    }

    private Sample write(String key, SampleName parsed, UpsertRequest request) {
        final Owners owners = resolveOwners(parsed);
        final Subject subject = owners.subject();
        final Aspect aspect = owners.aspect();

        // Stored casing, never the request's
        final String canonical = SampleName.compose(subject.absolutePath(), aspect.name());
        final Optional<Sample> existing = readSample(key);
        final Instant now = clock.instant();

        final String value = request.value() == null ? "" : request.value();
        final Status status = StatusClassifier.classify(value, aspect);
        final List<RelatedLink> links = RelatedLinks.merge(
                existing.map(Sample::relatedLinks).orElse(null), request.relatedLinks());

        final Sample merged;
        if (existing.isPresent()) {
            final Sample prev = existing.get();
            final boolean changed = prev.status() != status;
            merged = new Sample(
                    canonical,
                    value,
                    status,
                    prev.status(),
                    changed || prev.statusChangedAt() == null ? now : prev.statusChangedAt(),
                    now,
                    prev.createdAt() == null ? now : prev.createdAt(),
                    subject.id(),
                    aspect.id(),
                    links,
                    request.messageCode() != null ? request.messageCode() : prev.messageCode(),
                    request.messageBody() != null ? request.messageBody() : prev.messageBody(),
                    request.provider() != null ? request.provider() : prev.provider());
        } else {
            merged = new Sample(
                    canonical,
                    value,
                    status,
                    Status.INVALID,
                    now,
                    now,
                    now,
                    subject.id(),
                    aspect.id(),
                    links,
                    request.messageCode(),
                    request.messageBody(),
                    request.provider());
        }

        StoreBatch batch = StoreBatch.create().putHash(key, codec.encode(merged));
        if (existing.isEmpty()) {
            indexes.stageSampleCreated(batch, key, subject.absolutePath(), aspect.name());
        }
        client.execute(batch);

        // An unpublish or delete that landed after the check above may have scanned the
        // index before this write; its purge would then miss the new sample
        if (!stillVisible(parsed)) {
            removeUnlocked(key, subject.absolutePath(), aspect.name());
            log.debug("Rolled back {}: owner lost visibility during upsert", canonical);
            throw notFound(mirror.subject(parsed.subjectPath()).filter(Subject::published).isPresent()
                    ? ObjectType.ASPECT : ObjectType.SUBJECT);
        }

        if (existing.isPresent()) {
            metrics.counter("samsto.upsert.updated");
        } else {
            metrics.counter("samsto.upsert.created");
            log.debug("Created sample {}", canonical);
        }
        return merged;
    }

    /**
     * Removes a sample and its index memberships.
     *
     * @return the removed sample
     * @throws NotFoundException when no sample exists under {@code name}
     */
    public Sample delete(String name) {
        final SampleName parsed = SampleName.parse(name);
        final String key = KeyCodec.toKey(ObjectType.SAMPLE, parsed.value());
        return locks.withLock(key, () -> {
            final Sample existing = readSample(key).orElseThrow(() -> NotFoundException.sample(name));
            removeUnlocked(key, parsed.subjectPath(), parsed.aspectName());
            return existing;
        });
    }

    /**
     * Drops the sample for a (subject, aspect) pair if present. Missing samples are ignored.
     *
     * @return true if a sample hash was removed
     */
    boolean purge(String subjectPath, String aspectName) {
        final String key = KeyCodec.toKey(ObjectType.SAMPLE, SampleName.compose(subjectPath, aspectName));
        return locks.withLock(key, () -> {
            final boolean present = client.exists(key);
            removeUnlocked(key, subjectPath, aspectName);
            return present;
        });
    }

    private void removeUnlocked(String key, String subjectPath, String aspectName) {
        StoreBatch batch = StoreBatch.create().delete(key);
        indexes.stageSampleRemoved(batch, key, subjectPath, aspectName);
        client.execute(batch);
    }

    Optional<Sample> readSample(String key) {
        final Map<String, String> hash = client.hgetAll(key);
        return hash.isEmpty() ? Optional.empty() : Optional.of(codec.decodeSample(key, hash));
    }

    private NotFoundException notFound(ObjectType type) {
        metrics.counter("samsto.upsert.notfound");
        return NotFoundException.unpublishedOrMissing(type);
    }

    private record Owners(Subject subject, Aspect aspect) {}

    private static void validateMessage(UpsertRequest request) {
        if (request.messageCode() != null && request.messageCode().length() > MAX_MESSAGE_CODE) {
            throw new ValidationException("messageCode exceeds " + MAX_MESSAGE_CODE + " characters");
        }
        if (request.messageBody() != null && request.messageBody().length() > MAX_MESSAGE_BODY) {
            throw new ValidationException("messageBody exceeds " + MAX_MESSAGE_BODY + " characters");
        }
    }
}
