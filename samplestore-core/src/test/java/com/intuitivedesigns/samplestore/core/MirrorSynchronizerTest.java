/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.core;

import com.intuitivedesigns.samplestore.cache.InMemoryStoreClient;
import com.intuitivedesigns.samplestore.errors.NotFoundException;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.Subject;
import com.intuitivedesigns.samplestore.model.UpsertRequest;
import com.intuitivedesigns.samplestore.testing.InMemorySubjectAspectSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MirrorSynchronizerTest {

    private static final Subject NA_US = new Subject("s-1", "NA.US", true);
    private static final Subject NA_CA = new Subject("s-2", "NA.CA", true);
    private static final Aspect TEMP = Aspect.builder("a-1", "Temp").ok(Range.atMost(29)).build();
    private static final Aspect HUMIDITY = Aspect.builder("a-2", "Humidity").ok(Range.atMost(89)).build();

    private InMemoryStoreClient client;
    private SampleStore store;
    private MirrorSynchronizer sync;

    @BeforeEach
    void setUp() {
        client = new InMemoryStoreClient();
        InMemorySubjectAspectSource source = new InMemorySubjectAspectSource()
                .add(NA_US).add(NA_CA).add(TEMP).add(HUMIDITY);
        store = SampleStore.builder().client(client).source(source).build();
        store.init();
        sync = store.mirrorSync();

        store.upsert(UpsertRequest.of("NA.US|Temp", "1"));
        store.upsert(UpsertRequest.of("NA.US|Humidity", "2"));
        store.upsert(UpsertRequest.of("NA.CA|Temp", "3"));
    }

    @Test
    void testSubjectInsertIsMirrored() {
        sync.subjectSaved(null, new Subject("s-3", "EU.FR", true));

        assertTrue(store.mirror().subject("eu.fr").isPresent());
        assertEquals(3, store.indexes().size(ObjectType.SUBJECT));
        assertEquals(3, store.findAll().size());
    }

    @Test
    void testSubjectRenameMovesMirrorAndPurgesOldSamples() {
        sync.subjectSaved(NA_US, NA_US.withAbsolutePath("NA.USA"));

        assertTrue(store.mirror().subject("NA.US").isEmpty());
        assertEquals("NA.USA", store.mirror().subject("na.usa").orElseThrow().absolutePath());
        assertFalse(client.exists("samsto:subject:na.us"));
        assertTrue(store.findBySubject("NA.US").isEmpty());
        assertFalse(client.exists("samsto:subaspmap:na.us"));
        assertEquals(Set.of("na.ca"), store.indexes().subjectsForAspect("Temp"));
        assertEquals(1, store.findAll().size());

        // Samples under the new path are created on demand
        assertEquals("NA.USA|Temp", store.upsert(UpsertRequest.of("na.usa|temp", "1")).name());
    }

    @Test
    void testCaseOnlyRenameKeepsSamples() {
        sync.subjectSaved(NA_US, NA_US.withAbsolutePath("na.us"));

        assertEquals("na.us", store.mirror().subject("NA.US").orElseThrow().absolutePath());
        assertEquals(3, store.findAll().size());
    }

    @Test
    void testUnpublishingSubjectPurgesItsSamples() {
        sync.subjectSaved(NA_US, NA_US.withPublished(false));

        assertFalse(store.mirror().subject("NA.US").orElseThrow().published());
        assertTrue(store.findBySubject("NA.US").isEmpty());
        assertEquals(1, store.findAll().size());
        assertThrows(NotFoundException.class, () -> store.upsert(UpsertRequest.of("NA.US|Temp", "1")));
    }

    @Test
    void testSubjectDeletePurgesSamplesAndMaps() {
        sync.subjectDeleted(NA_US);

        assertTrue(store.mirror().subject("NA.US").isEmpty());
        assertEquals(Set.of("samsto:sample:na.ca|temp"), store.indexes().members(ObjectType.SAMPLE));
        assertEquals(Set.of(), store.indexes().aspectsForSubject("NA.US"));
        assertEquals(Set.of(), store.indexes().subjectsForAspect("Humidity"));
    }

    @Test
    void testAspectRenameAndUnpublish() {
        sync.aspectSaved(TEMP, TEMP.withName("Temperature"));

        assertTrue(store.mirror().aspect("Temp").isEmpty());
        assertTrue(store.findByAspect("Temp").isEmpty());
        assertEquals(1, store.findAll().size());

        sync.aspectSaved(HUMIDITY, HUMIDITY.withPublished(false));
        assertTrue(store.findAll().isEmpty());
        assertFalse(store.mirror().aspect("humidity").orElseThrow().published());
    }

    @Test
    void testAspectDeletePurgesEverySubject() {
        sync.aspectDeleted(TEMP);

        assertTrue(store.mirror().aspect("Temp").isEmpty());
        assertEquals(Set.of("samsto:sample:na.us|humidity"), store.indexes().members(ObjectType.SAMPLE));
        assertEquals(Set.of("humidity"), store.indexes().aspectsForSubject("NA.US"));
        assertEquals(Set.of(), store.indexes().aspectsForSubject("NA.CA"));
    }

    @Test
    void testPurgeCountsRemovedSamples() {
        assertEquals(2, sync.purgeAspectSamples("TEMP"));
        assertEquals(0, sync.purgeAspectSamples("TEMP"));
        assertEquals(1, sync.purgeSubjectSamples("na.us"));
    }
}
