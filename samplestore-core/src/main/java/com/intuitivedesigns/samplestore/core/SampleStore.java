/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.cache.IndexSets;
import com.intuitivedesigns.samplestore.cache.LifecycleController;
import com.intuitivedesigns.samplestore.cache.ObjectMirror;
import com.intuitivedesigns.samplestore.codec.HashCodec;
import com.intuitivedesigns.samplestore.codec.KeyCodec;
import com.intuitivedesigns.samplestore.codec.SampleName;
import com.intuitivedesigns.samplestore.errors.NotFoundException;
import com.intuitivedesigns.samplestore.metrics.MetricsFactory;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.UpsertRequest;
import com.intuitivedesigns.samplestore.model.User;
import com.intuitivedesigns.samplestore.notify.ChangeNotifier;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point used by the HTTP layer.
 *
 * <p>Sample operations retry transient store failures per the configured {@link RetryPolicy};
 * {@link #eradicate()} and {@link #init()} run once and surface failures directly.
 * A successful upsert is handed to the {@link ChangeNotifier} after the write commits;
 * notifier failures are logged and never fail the upsert.</p>
 */
public final class SampleStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SampleStore.class);

    private final StoreClient client;
    private final SubjectAspectSource source;
    private final IndexSets indexes;
    private final ObjectMirror mirror;
    private final SampleUpsertResolver resolver;
    private final LifecycleController lifecycle;
    private final MirrorSynchronizer mirrorSync;
    private final ChangeNotifier notifier;
    private final RetryPolicy retry;

    private SampleStore(Builder b) {
        this.client = Objects.requireNonNull(b.client, "client");
        this.source = Objects.requireNonNull(b.source, "source");
        final HashCodec codec = new HashCodec();
        this.indexes = new IndexSets(client);
        this.mirror = new ObjectMirror(client, indexes, codec);
        this.resolver = new SampleUpsertResolver(client, mirror, indexes, codec, b.clock, b.metrics);
        this.lifecycle = new LifecycleController(client, mirror, indexes, source);
        this.mirrorSync = new MirrorSynchronizer(client, mirror, indexes, resolver);
        this.notifier = b.notifier;
        this.retry = b.retry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates or updates a sample. When the sample names a provider, the provider's user is
     * attached to the result; an unreadable user table leaves it off.
     */
    public Sample upsert(UpsertRequest request) {
        final Sample sample = withProviderUser(retry.call("upsert", () -> resolver.upsert(request)));
        try {
            notifier.notifyUpsert(sample);
        } catch (RuntimeException e) {
            log.warn("Change notification failed for {}", sample.name(), e);
        }
        return sample;
    }

    private Sample withProviderUser(Sample sample) {
        if (sample.provider() == null) {
            return sample;
        }
        try {
            final Optional<User> user = source.findUserById(sample.provider());
            return user.map(sample::withUser).orElse(sample);
        } catch (RuntimeException e) {
            log.warn("Could not resolve provider {} for {}: {}", sample.provider(), sample.name(), e.getMessage());
            return sample;
        }
    }

    /**
     * Case-insensitive lookup by composite name.
     *
     * @throws NotFoundException when no such sample exists
     */
    public Sample read(String name) {
        final SampleName parsed = SampleName.parse(name);
        final String key = KeyCodec.toKey(ObjectType.SAMPLE, parsed.value());
        return retry.call("read", () -> resolver.readSample(key))
                .orElseThrow(() -> NotFoundException.sample(name));
    }

    public List<Sample> findAll() {
        return retry.call("findAll", () -> load(indexes.members(ObjectType.SAMPLE)));
    }

    public List<Sample> findByAspect(String aspectName) {
        return retry.call("findByAspect", () -> {
            List<String> keys = new ArrayList<>();
            for (String subject : indexes.subjectsForAspect(aspectName)) {
                keys.add(KeyCodec.toKey(ObjectType.SAMPLE, SampleName.compose(subject, aspectName)));
            }
            return load(keys);
        });
    }

    public List<Sample> findBySubject(String absolutePath) {
        return retry.call("findBySubject", () -> {
            List<String> keys = new ArrayList<>();
            for (String aspect : indexes.aspectsForSubject(absolutePath)) {
                keys.add(KeyCodec.toKey(ObjectType.SAMPLE, SampleName.compose(absolutePath, aspect)));
            }
            return load(keys);
        });
    }

    public Sample delete(String name) {
        return retry.call("delete", () -> resolver.delete(name));
    }

    public int eradicate() {
        return lifecycle.eradicate();
    }

    public LifecycleController.InitReport init() {
        return lifecycle.init();
    }

    public MirrorSynchronizer mirrorSync() {
        return mirrorSync;
    }

    public ObjectMirror mirror() {
        return mirror;
    }

    public IndexSets indexes() {
        return indexes;
    }

    private List<Sample> load(Collection<String> keys) {
        List<Sample> out = new ArrayList<>(keys.size());
        for (String key : keys) {
            // An index entry can briefly outlive its hash while a delete commits elsewhere
            Optional<Sample> s = resolver.readSample(key);
            s.ifPresent(out::add);
        }
        out.sort(Comparator.comparing(Sample::name));
        return out;
    }

    /**
     * Closes the notifier. The store client and source stay owned by the caller.
     */
    @Override
    public void close() {
        notifier.close();
    }

    public static final class Builder {
        private StoreClient client;
        private SubjectAspectSource source;
        private ChangeNotifier notifier = ChangeNotifier.noop();
        private MetricsRuntime metrics = MetricsFactory.noop();
        private Clock clock = Clock.systemUTC();
        private RetryPolicy retry = RetryPolicy.defaults();

        private Builder() {}

        public Builder client(StoreClient client) {
            this.client = client;
            return this;
        }

        public Builder source(SubjectAspectSource source) {
            this.source = source;
            return this;
        }

        public Builder notifier(ChangeNotifier notifier) {
            this.notifier = Objects.requireNonNull(notifier, "notifier");
            return this;
        }

        public Builder metrics(MetricsRuntime metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder retry(RetryPolicy retry) {
            this.retry = Objects.requireNonNull(retry, "retry");
            return this;
        }

        public SampleStore build() {
            return new SampleStore(this);
        }
    }
}
