/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.cache;

import com.intuitivedesigns.samplestore.codec.HashCodec;
import com.intuitivedesigns.samplestore.model.Aspect;
import com.intuitivedesigns.samplestore.model.MirroredObject;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.model.Range;
import com.intuitivedesigns.samplestore.model.Subject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ObjectMirrorTest {

    private InMemoryStoreClient client;
    private IndexSets indexes;
    private ObjectMirror mirror;

    @BeforeEach
    void setUp() {
        client = new InMemoryStoreClient();
        indexes = new IndexSets(client);
        mirror = new ObjectMirror(client, indexes, new HashCodec());
    }

    @Test
    void testGetResolvesSubjectsAndAspectsCaseInsensitively() {
        Subject subject = new Subject("s-1", "NA.US", true);
        Aspect aspect = Aspect.builder("a-1", "Temp").critical(Range.atLeast(30)).build();
        mirror.put(subject);
        mirror.put(aspect);

        Optional<MirroredObject> s = mirror.get(ObjectType.SUBJECT, "na.us");
        Optional<MirroredObject> a = mirror.get(ObjectType.ASPECT, "TEMP");

        assertEquals(Optional.of(subject), s);
        assertEquals("Temp", a.orElseThrow().naturalName());
        assertEquals(Set.of("samsto:subject:na.us"), indexes.members(ObjectType.SUBJECT));
        assertEquals(Set.of("samsto:aspect:temp"), indexes.members(ObjectType.ASPECT));
    }

    @Test
    void testGetOfMissingEntryIsEmpty() {
        assertTrue(mirror.get(ObjectType.SUBJECT, "EU.FR").isEmpty());
        assertTrue(mirror.get(ObjectType.ASPECT, "Humidity").isEmpty());
    }

    @Test
    void testSamplesAreNotMirrored() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> mirror.get(ObjectType.SAMPLE, "NA.US|Temp"));
        assertTrue(e.getMessage().contains("sample"));
    }

    @Test
    void testRemoveDropsEntryAndIndexMembership() {
        mirror.put(new Subject("s-1", "NA.US", true));
        mirror.remove(ObjectType.SUBJECT, "Na.Us");

        assertTrue(mirror.subject("NA.US").isEmpty());
        assertEquals(0, indexes.size(ObjectType.SUBJECT));
    }
}
