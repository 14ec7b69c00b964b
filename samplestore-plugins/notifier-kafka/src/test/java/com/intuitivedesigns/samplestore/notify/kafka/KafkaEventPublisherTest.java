/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify.kafka;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsFactory;
import com.intuitivedesigns.samplestore.metrics.MicrometerMetricsRuntime;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaEventPublisherTest {

    @Test
    void testPublishesKeyedRecordToFixedPartition() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaEventPublisher publisher = new KafkaEventPublisher(producer, "perspectives", 0, true, MetricsFactory.noop());

        publisher.publish("NA.US|Temp", "{\"name\":\"NA.US|Temp\"}");

        assertEquals(1, producer.history().size());
        ProducerRecord<String, String> record = producer.history().get(0);
        assertEquals("perspectives", record.topic());
        assertEquals(0, record.partition());
        assertEquals("NA.US|Temp", record.key());
        assertEquals("{\"name\":\"NA.US|Temp\"}", record.value());
        assertEquals(1, publisher.sentOkTotal());
    }

    @Test
    void testNegativePartitionDefersToPartitioner() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaEventPublisher publisher = new KafkaEventPublisher(producer, "perspectives", -1, true, MetricsFactory.noop());

        publisher.publish("a|b", "{}");

        assertNull(producer.history().get(0).partition());
    }

    @Test
    void testAsyncFailureIsCountedNotThrown() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        KafkaEventPublisher publisher = new KafkaEventPublisher(producer, "perspectives", 0, false, metrics);

        publisher.publish("a|b", "{}");
        assertTrue(producer.errorNext(new RuntimeException("broker down")));

        assertEquals(1, publisher.sentFailTotal());
        assertEquals(0, publisher.sentOkTotal());
        assertEquals(1.0, metrics.count("samsto_kafka_send_fail_total"));
    }

    @Test
    void testSecurityPropertiesArePassedThrough() {
        StoreConfig config = StoreConfig.of(Map.of(
                "kafka.bootstrap.servers", "broker:9093",
                "kafka.security.protocol", "SSL",
                "kafka.ssl.keystore.location", "/etc/kafka/client.jks",
                "kafka.topic", "ignored-by-props"));

        Properties props = KafkaEventPublisher.buildProducerProps(config);

        assertEquals("broker:9093", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("SSL", props.get("security.protocol"));
        assertEquals("/etc/kafka/client.jks", props.get("ssl.keystore.location"));
        assertFalse(props.containsKey("topic"));
        assertEquals("0", props.get(ProducerConfig.LINGER_MS_CONFIG));
    }
}
