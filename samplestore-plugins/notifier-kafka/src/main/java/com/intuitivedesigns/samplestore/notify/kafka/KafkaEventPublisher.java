/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify.kafka;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Publishes post-upsert sample state to Kafka.
 *
 * Features:
 * - Record key is the sample name, value the sample JSON
 * - Fixed target partition (0 unless configured; negative lets the partitioner choose)
 * - TLS/SASL passthrough from kafka.ssl.*, kafka.security.*, kafka.sasl.*
 * - Rate-limited error logging for async sends
 * - Optional Micrometer counters
 */
public final class KafkaEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    public static final String DEFAULT_TOPIC = "perspectives";
    private static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Producer<String, String> producer;
    private final String topic;
    private final Integer partition;
    private final boolean syncSend;

    // Fast counters (always on)
    private final LongAdder sentOk = new LongAdder();
    private final LongAdder sentFail = new LongAdder();

    // Micrometer (optional)
    private final Counter okCounter;
    private final Counter failCounter;

    // Rate-limited error logging
    private final long errorLogIntervalMs;
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public KafkaEventPublisher(Producer<String, String> producer,
                               String topic,
                               int partition,
                               boolean syncSend,
                               MetricsRuntime metrics) {
        this.producer = Objects.requireNonNull(producer, "producer");
        this.topic = Objects.requireNonNull(topic, "topic");
        this.partition = partition < 0 ? null : partition;
        this.syncSend = syncSend;
        this.errorLogIntervalMs = DEFAULT_ERROR_LOG_INTERVAL_MS;

        MeterRegistry registry = (metrics != null && metrics.enabled() && metrics.registry() instanceof MeterRegistry mr)
                ? mr
                : null;

        if (registry != null) {
            this.okCounter = registry.counter("samsto_kafka_send_ok_total", "topic", topic);
            this.failCounter = registry.counter("samsto_kafka_send_fail_total", "topic", topic);
        } else {
            this.okCounter = null;
            this.failCounter = null;
        }

        log.info("Kafka publisher active. topic='{}' partition={} sync={}",
                topic, this.partition == null ? "auto" : this.partition, syncSend);
    }

    public static KafkaEventPublisher fromConfig(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        final String topic = config.getString("kafka.topic", DEFAULT_TOPIC);
        final int partition = config.getInt("kafka.topic.partition", 0);
        final boolean syncSend = config.getBoolean("kafka.producer.sync", false);

        return new KafkaEventPublisher(new KafkaProducer<>(buildProducerProps(config)), topic, partition, syncSend, metrics);
    }

    static Properties buildProducerProps(StoreConfig config) {
        final Properties props = new Properties();

        // Connectivity
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getString("kafka.bootstrap.servers", "localhost:9092"));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, config.getString("kafka.producer.client.id", "samplestore"));
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

        // Durability
        props.put(ProducerConfig.ACKS_CONFIG, config.getString("kafka.producer.acks", "1"));

        // Latency over throughput: updates go out as they happen
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(config.getInt("kafka.producer.linger.ms", 0)));

        // Security passthrough: kafka.ssl.*, kafka.security.*, kafka.sasl.* -> strip "kafka."
        copySecurityProps(config, props);

        return props;
    }

    @Override
    public void publish(String key, String payload) throws Exception {
        final ProducerRecord<String, String> record = new ProducerRecord<>(topic, partition, key, payload);

        if (syncSend) {
            try {
                producer.send(record).get();
                markOk();
            } catch (Exception e) {
                markFail(e);
                throw e;
            }
        } else {
            producer.send(record, (metadata, exception) -> {
                if (exception == null) {
                    markOk();
                } else {
                    markFail(exception);
                }
            });
        }
    }

    @Override
    public void flush() {
        producer.flush();
    }

    @Override
    public String id() {
        return "KAFKA";
    }

    private void markOk() {
        sentOk.increment();
        if (okCounter != null) okCounter.increment();
    }

    private void markFail(Throwable exception) {
        sentFail.increment();
        if (failCounter != null) failCounter.increment();
        logRateLimited("Kafka publish failed topic=" + topic, exception);
    }

    private void logRateLimited(String context, Throwable ex) {
        long now = System.currentTimeMillis();
        long last = lastErrorLogMs.get();

        if (now - last >= errorLogIntervalMs && lastErrorLogMs.compareAndSet(last, now)) {
            long suppressed = suppressedErrorLogs.sumThenReset();
            if (suppressed > 0) {
                log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.getMessage());
            } else {
                log.error("{}: {}", context, ex.getMessage());
            }
        } else {
            suppressedErrorLogs.increment();
        }
    }

    public long sentOkTotal() { return sentOk.sum(); }
    public long sentFailTotal() { return sentFail.sum(); }

    @Override
    public void close() {
        log.info("Closing Kafka publisher (topic={})...", topic);
        try {
            producer.flush();
            producer.close(Duration.ofSeconds(5));
        } catch (Exception e) {
            log.warn("Kafka publisher close failed", e);
        }
    }

    private static void copySecurityProps(StoreConfig cfg, Properties dst) {
        for (String key : cfg.keys()) {
            if (key.startsWith("kafka.ssl.") || key.startsWith("kafka.security.") || key.startsWith("kafka.sasl.")) {
                String v = cfg.getString(key, null);
                if (v == null) continue;
                dst.put(key.substring(6), v); // strip "kafka."
            }
        }
    }
}
