/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.config;

import com.intuitivedesigns.samplestore.cache.InMemoryStoreClient;
import com.intuitivedesigns.samplestore.metrics.MetricsFactory;
import com.intuitivedesigns.samplestore.notify.AsyncChangeNotifier;
import com.intuitivedesigns.samplestore.notify.ChangeNotifier;
import com.intuitivedesigns.samplestore.notify.LogEventPublisher;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SampleStoreFactoryTest {

    @Test
    void testBuiltInPluginsAreDiscovered() {
        assertTrue(SampleStoreFactory.catalog().stores().availableIds().contains("LOCAL"));
        assertTrue(SampleStoreFactory.catalog().publishers().availableIds().contains("LOG"));
        assertTrue(SampleStoreFactory.catalog().publishers().availableIds().contains("NOOP"));
    }

    @Test
    void testStoreDefaultsToLocal() {
        StoreClient client = SampleStoreFactory.createStore(StoreConfig.empty(), MetricsFactory.noop());
        assertInstanceOf(InMemoryStoreClient.class, client);
    }

    @Test
    void testPublisherIdIsCaseInsensitive() {
        StoreConfig config = StoreConfig.of(Map.of(SampleStoreFactory.KEY_NOTIFIER_TYPE, " log "));
        EventPublisher publisher = SampleStoreFactory.createPublisher(config, MetricsFactory.noop());
        assertInstanceOf(LogEventPublisher.class, publisher);
    }

    @Test
    void testNotifierWrapsPublisherInQueue() {
        ChangeNotifier notifier = SampleStoreFactory.createNotifier(StoreConfig.empty(), MetricsFactory.noop());
        try {
            assertInstanceOf(AsyncChangeNotifier.class, notifier);
        } finally {
            notifier.close();
        }
    }

    @Test
    void testSourceTypeIsRequired() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SampleStoreFactory.createSource(StoreConfig.empty(), MetricsFactory.noop()));
        assertTrue(e.getMessage().contains(SampleStoreFactory.KEY_SOURCE_TYPE));
    }

    @Test
    void testUnknownPluginListsAvailableOptions() {
        StoreConfig config = StoreConfig.of(Map.of(SampleStoreFactory.KEY_STORE_TYPE, "MEMCACHED"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SampleStoreFactory.createStore(config, MetricsFactory.noop()));
        assertTrue(e.getMessage().contains("LOCAL"));
    }
}
