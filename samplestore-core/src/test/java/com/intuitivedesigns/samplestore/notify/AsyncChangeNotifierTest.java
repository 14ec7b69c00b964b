/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.model.Status;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.testing.RecordingPublisher;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AsyncChangeNotifierTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");

    private final MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();

    private static Sample sample(String name) {
        return new Sample(name, "45", Status.CRITICAL, Status.OK, T0, T0, T0, "s-1", "a-1",
                List.of(), null, null, null);
    }

    @Test
    void testDeliversInOrder() throws Exception {
        RecordingPublisher publisher = new RecordingPublisher(3);
        AsyncChangeNotifier notifier = new AsyncChangeNotifier(publisher, metrics, 16, Duration.ofSeconds(2), 1000);
        try {
            notifier.notifyUpsert(sample("NA.US|Temp"));
            notifier.notifyUpsert(sample("NA.US|Humidity"));
            notifier.notifyUpsert(sample("NA.CA|Temp"));

            assertTrue(publisher.await(2_000));
            assertEquals(List.of("NA.US|Temp", "NA.US|Humidity", "NA.CA|Temp"),
                    publisher.events().stream().map(RecordingPublisher.Event::key).toList());
        } finally {
            notifier.close();
        }
        assertEquals(3, notifier.sentTotal());
        assertEquals(3.0, metrics.count("samsto.notifier.sent"));
    }

    @Test
    void testPublisherFailuresAreCountedNotThrown() throws Exception {
        RecordingPublisher publisher = new RecordingPublisher(2);
        publisher.failing(true);
        AsyncChangeNotifier notifier = new AsyncChangeNotifier(publisher, metrics, 16, Duration.ofSeconds(2), 100);

        notifier.notifyUpsert(sample("NA.US|Temp"));
        notifier.notifyUpsert(sample("NA.CA|Temp"));
        assertTrue(publisher.await(2_000));
        notifier.close();

        assertEquals(2, notifier.failedTotal());
        assertEquals(0, notifier.sentTotal());
        assertEquals(2.0, metrics.count("samsto.notifier.failed"));
    }

    @Test
    void testFullQueueDropsInsteadOfBlocking() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        EventPublisher blocking = new EventPublisher() {
            @Override
            public void publish(String key, String payload) throws Exception {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
            }
        };
        AsyncChangeNotifier notifier = new AsyncChangeNotifier(blocking, metrics, 1, Duration.ofSeconds(2), 1000);
        try {
            notifier.notifyUpsert(sample("a|1"));
            assertTrue(entered.await(2, TimeUnit.SECONDS));

            notifier.notifyUpsert(sample("a|2"));
            notifier.notifyUpsert(sample("a|3"));

            assertEquals(1, notifier.pending());
            assertEquals(1.0, metrics.gaugeValue("samsto.notifier.queue.depth"));
            assertEquals(1, notifier.droppedTotal());
            assertEquals(1.0, metrics.count("samsto.notifier.dropped"));
        } finally {
            release.countDown();
            notifier.close();
        }
        assertEquals(2, notifier.sentTotal());
        assertEquals(0.0, metrics.gaugeValue("samsto.notifier.queue.depth"));
    }

    @Test
    void testCloseDrainsAndClosesPublisher() throws Exception {
        RecordingPublisher publisher = new RecordingPublisher(50);
        AsyncChangeNotifier notifier = new AsyncChangeNotifier(publisher, metrics, 100, Duration.ofSeconds(5), 1000);
        for (int i = 0; i < 50; i++) {
            notifier.notifyUpsert(sample("NA.US|A" + i));
        }
        notifier.close();

        assertEquals(50, publisher.events().size());
        assertTrue(publisher.closed());

        notifier.notifyUpsert(sample("NA.US|late"));
        assertEquals(1, notifier.droppedTotal());
        assertEquals(50, publisher.events().size());
    }

    @Test
    void testPayloadIsSampleJson() throws Exception {
        RecordingPublisher publisher = new RecordingPublisher(1);
        AsyncChangeNotifier notifier = AsyncChangeNotifier.fromConfig(
                StoreConfig.of(Map.of(AsyncChangeNotifier.KEY_QUEUE_CAPACITY, "8")), publisher, metrics);
        try {
            notifier.notifyUpsert(sample("NA.US|Temp"));
            assertTrue(publisher.await(2_000));
        } finally {
            notifier.close();
        }

        String payload = publisher.events().get(0).payload();
        assertTrue(payload.contains("\"name\":\"NA.US|Temp\""));
        assertTrue(payload.contains("\"previousStatus\":\"OK\""));
        assertTrue(payload.contains("\"createdAt\":\"2025-03-01T12:00:00Z\""));
        assertFalse(payload.contains("messageCode"));
    }
}
