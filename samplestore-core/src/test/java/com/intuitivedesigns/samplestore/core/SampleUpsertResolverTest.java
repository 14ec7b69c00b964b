/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.cache.InMemoryStoreClient;
import com.intuitivedesigns.samplestore.cache.IndexSets;
import com.intuitivedesigns.samplestore.cache.ObjectMirror;
import com.intuitivedesigns.samplestore.codec.HashCodec;
import com.intuitivedesigns.samplestore.errors.NotFoundException;
import com.intuitivedesigns.samplestore.errors.ValidationException;
import com.intuitivedesigns.samplestore.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.RelatedLink;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.Status;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.model.UpsertRequest;
import com.intuitivedesigns.samplestore.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SampleUpsertResolverTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private static final Subject NA_US = new Subject("s-1", "NA.US", true);
    private static final Aspect TEMP = Aspect.builder("a-1", "Temp")
            .critical(Range.atLeast(30))
            .warning(Range.between(20, 30))
            .info(Range.between(15, 20))
            .ok(Range.atMost(15))
            .build();

    private InMemoryStoreClient client;
    private ObjectMirror mirror;
    private IndexSets indexes;
    private MutableClock clock;
    private MicrometerMetricsRuntime metrics;
    private SampleUpsertResolver resolver;

    @BeforeEach
    void setUp() {
        client = new InMemoryStoreClient();
        indexes = new IndexSets(client);
        HashCodec codec = new HashCodec();
        mirror = new ObjectMirror(client, indexes, codec);
        clock = new MutableClock(T0);
        metrics = new MicrometerMetricsRuntime();
        resolver = new SampleUpsertResolver(client, mirror, indexes, codec, clock, metrics);

        mirror.put(NA_US);
        mirror.put(TEMP);
    }

    @Test
    void testCreatesSampleWithCanonicalNameAndIndices() {
        Sample s = resolver.upsert(UpsertRequest.of("NA.US|Temp", "45"));

        assertEquals("NA.US|Temp", s.name());
        assertEquals(Status.CRITICAL, s.status());
        assertEquals(Status.INVALID, s.previousStatus());
        assertEquals("s-1", s.subjectId());
        assertEquals("a-1", s.aspectId());
        assertEquals(T0, s.createdAt());
        assertEquals(T0, s.statusChangedAt());

        assertEquals(Set.of("samsto:sample:na.us|temp"), indexes.members(ObjectType.SAMPLE));
        assertEquals(Set.of("na.us"), indexes.subjectsForAspect("Temp"));
        assertEquals(Set.of("temp"), indexes.aspectsForSubject("NA.US"));
        assertEquals(1.0, metrics.count("samsto.upsert.created"));
    }

    @Test
    void testRequestCasingNeverLeaksIntoName() {
        Sample s = resolver.upsert(UpsertRequest.of("na.us|temp", "1"));
        assertEquals("NA.US|Temp", s.name());

        Sample again = resolver.upsert(UpsertRequest.of("Na.Us|TEMP", "2"));
        assertEquals("NA.US|Temp", again.name());
        assertEquals(1, indexes.size(ObjectType.SAMPLE));
    }

    @Test
    void testReupsertOverwritesInPlace() {
        resolver.upsert(UpsertRequest.of("NA.US|Temp", "1"));
        clock.advance(Duration.ofMinutes(1));
        Sample second = resolver.upsert(UpsertRequest.of("NA.US|Temp", "25"));

        assertEquals("25", second.value());
        assertEquals(Status.WARNING, second.status());
        assertEquals(Status.OK, second.previousStatus());
        assertEquals(T0, second.createdAt());
        assertEquals(T0.plus(Duration.ofMinutes(1)), second.updatedAt());
        assertEquals(1, indexes.size(ObjectType.SAMPLE));
        assertEquals(1, client.scan("samsto:sample:na.us*").size());
        assertEquals(1.0, metrics.count("samsto.upsert.updated"));
    }

    @Test
    void testStatusChangedAtMovesOnlyOnTransition() {
        resolver.upsert(UpsertRequest.of("NA.US|Temp", "1"));
        clock.advance(Duration.ofMinutes(1));
        Sample sameStatus = resolver.upsert(UpsertRequest.of("NA.US|Temp", "2"));
        assertEquals(T0, sameStatus.statusChangedAt());
        assertEquals(Status.OK, sameStatus.previousStatus());

        clock.advance(Duration.ofMinutes(1));
        Sample changed = resolver.upsert(UpsertRequest.of("NA.US|Temp", "31"));
        assertEquals(T0.plus(Duration.ofMinutes(2)), changed.statusChangedAt());
    }

    @Test
    void testMissingSubjectWinsOverMissingAspect() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> resolver.upsert(UpsertRequest.of("EU.FR|Humidity", "1")));
        assertEquals(ObjectType.SUBJECT, e.objectType());
        assertEquals("subject for this sample was not found or has isPublished=false", e.getMessage());
    }

    @Test
    void testMissingAspect() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> resolver.upsert(UpsertRequest.of("NA.US|Humidity", "1")));
        assertEquals("aspect for this sample was not found or has isPublished=false", e.getMessage());
        assertTrue(indexes.members(ObjectType.SAMPLE).isEmpty());
        assertEquals(1.0, metrics.count("samsto.upsert.notfound"));
    }

    @Test
    void testUnpublishedSubjectOrAspectIsNotFound() {
        mirror.put(new Subject("s-2", "EU.FR", false));
        mirror.put(Aspect.builder("a-2", "Humidity").published(false).build());

        NotFoundException subject = assertThrows(NotFoundException.class,
                () -> resolver.upsert(UpsertRequest.of("EU.FR|Temp", "1")));
        assertEquals(ObjectType.SUBJECT, subject.objectType());

        NotFoundException aspect = assertThrows(NotFoundException.class,
                () -> resolver.upsert(UpsertRequest.of("NA.US|Humidity", "1")));
        assertEquals(ObjectType.ASPECT, aspect.objectType());
    }

    @Test
    void testMalformedNameIsValidationError() {
        assertThrows(ValidationException.class, () -> resolver.upsert(UpsertRequest.of("NA.US", "1")));
        assertThrows(ValidationException.class, () -> resolver.upsert(UpsertRequest.of("|Temp", "1")));
    }

    @Test
    void testMessageLimits() {
        assertThrows(ValidationException.class,
                () -> resolver.upsert(UpsertRequest.of("NA.US|Temp", "1").withMessage("TOOLONG", null)));
        assertThrows(ValidationException.class,
                () -> resolver.upsert(UpsertRequest.of("NA.US|Temp", "1").withMessage(null, "x".repeat(4097))));
    }

    @Test
    void testRelatedLinksAndMessagesArePreservedWhenOmitted() {
        resolver.upsert(UpsertRequest.of("NA.US|Temp", "1")
                .withRelatedLinks(List.of(new RelatedLink("runbook", "https://wiki/runbook")))
                .withMessage("E42", "sensor drift")
                .withProvider("user-7"));

        Sample next = resolver.upsert(UpsertRequest.of("NA.US|Temp", "2"));

        assertEquals(List.of(new RelatedLink("runbook", "https://wiki/runbook")), next.relatedLinks());
        assertEquals("E42", next.messageCode());
        assertEquals("sensor drift", next.messageBody());
        assertEquals("user-7", next.provider());
    }

    @Test
    void testRelatedLinksMergeByName() {
        resolver.upsert(UpsertRequest.of("NA.US|Temp", "1")
                .withRelatedLinks(List.of(new RelatedLink("runbook", "https://old"))));
        Sample next = resolver.upsert(UpsertRequest.of("NA.US|Temp", "1")
                .withRelatedLinks(List.of(new RelatedLink("runbook", "https://new"), new RelatedLink("logs", "https://logs"))));

        assertEquals(List.of(new RelatedLink("runbook", "https://new"), new RelatedLink("logs", "https://logs")),
                next.relatedLinks());
    }

    @Test
    void testAbsentValueStoresEmptyStringAsInvalid() {
        Sample s = resolver.upsert(new UpsertRequest("NA.US|Temp", null, null, null, null, null));
        assertEquals("", s.value());
        assertEquals(Status.INVALID, s.status());
    }

    @Test
    void testStoredHashMatchesReturnedSample() {
        Sample returned = resolver.upsert(UpsertRequest.of("NA.US|Temp", "45"));
        Map<String, String> hash = client.hgetAll("samsto:sample:na.us|temp");

        assertEquals("NA.US|Temp", hash.get("name"));
        assertEquals("Critical", hash.get("status"));
        assertEquals(returned, resolver.readSample("samsto:sample:na.us|temp").orElseThrow());
    }

    @Test
    void testConcurrentUpsertsOfOneNameNeverDuplicate() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Sample>> futures = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                final String name = (i % 2 == 0) ? "NA.US|Temp" : "na.us|TEMP";
                final String value = Integer.toString(i);
                futures.add(pool.submit(() -> resolver.upsert(UpsertRequest.of(name, value))));
            }
            for (Future<Sample> f : futures) {
                assertEquals("NA.US|Temp", f.get(10, TimeUnit.SECONDS).name());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, indexes.size(ObjectType.SAMPLE));
        assertEquals(1.0, metrics.count("samsto.upsert.created"));
        assertEquals(99.0, metrics.count("samsto.upsert.updated"));
    }

    @Test
    void testDeleteRemovesHashAndAllIndexMemberships() {
        resolver.upsert(UpsertRequest.of("NA.US|Temp", "1"));

        Sample removed = resolver.delete("na.us|temp");

        assertEquals("NA.US|Temp", removed.name());
        assertFalse(client.exists("samsto:sample:na.us|temp"));
        assertTrue(indexes.members(ObjectType.SAMPLE).isEmpty());
        assertTrue(indexes.subjectsForAspect("Temp").isEmpty());
        assertTrue(indexes.aspectsForSubject("NA.US").isEmpty());
        assertThrows(NotFoundException.class, () -> resolver.delete("NA.US|Temp"));
    }
}
