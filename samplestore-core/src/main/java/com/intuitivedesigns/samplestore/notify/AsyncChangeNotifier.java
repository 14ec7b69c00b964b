/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.notify;

import com.intuitivedesigns.samplestore.codec.SampleJson;
import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.model.Sample;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Fire-and-forget notifier.
 *
 * Features:
 * - Bounded hand-off queue; a full queue drops the event instead of blocking the upsert
 * - One dedicated daemon publisher thread preserves enqueue order
 * - Rate-limited error logging
 * - Drains pending events on close, bounded by a deadline
 */
public final class AsyncChangeNotifier implements ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(AsyncChangeNotifier.class);

    public static final String KEY_QUEUE_CAPACITY = "notifier.queue.capacity";
    public static final String KEY_CLOSE_TIMEOUT_MS = "notifier.close.timeout.ms";
    public static final String KEY_ERROR_LOG_INTERVAL_MS = "notifier.error.log.interval.ms";

    private static final int DEFAULT_QUEUE_CAPACITY = 10_000;
    private static final long DEFAULT_CLOSE_TIMEOUT_MS = 5_000L;
    private static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 1_000L;

    private static final long POLL_MS = 100L;

    private final EventPublisher publisher;
    private final SampleJson json;
    private final MetricsRuntime metrics;
    private final BlockingQueue<Sample> queue;
    private final Duration closeTimeout;
    private final Thread worker;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final LongAdder sent = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    // Rate-limited error logging
    private final long errorLogIntervalMs;
    private final AtomicLong lastErrorLogMs = new AtomicLong(0);
    private final LongAdder suppressedErrorLogs = new LongAdder();

    public AsyncChangeNotifier(EventPublisher publisher,
                               MetricsRuntime metrics,
                               int queueCapacity,
                               Duration closeTimeout,
                               long errorLogIntervalMs) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.json = new SampleJson();
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
        this.errorLogIntervalMs = Math.max(100L, errorLogIntervalMs);
        metrics.gauge("samsto.notifier.queue.depth", queue::size);

        this.worker = new Thread(this::runLoop, "samsto-notifier-" + publisher.id());
        this.worker.setDaemon(true);
        this.worker.start();

        log.info("Change notifier active. publisher='{}' capacity={}", publisher.id(), queueCapacity);
    }

    public static AsyncChangeNotifier fromConfig(StoreConfig config, EventPublisher publisher, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new AsyncChangeNotifier(
                publisher,
                metrics,
                config.getInt(KEY_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY),
                Duration.ofMillis(config.getLong(KEY_CLOSE_TIMEOUT_MS, DEFAULT_CLOSE_TIMEOUT_MS)),
                config.getLong(KEY_ERROR_LOG_INTERVAL_MS, DEFAULT_ERROR_LOG_INTERVAL_MS));
    }

    @Override
    public void notifyUpsert(Sample sample) {
        if (sample == null) return;
        if (!running.get() || !queue.offer(sample)) {
            dropped.increment();
            metrics.counter("samsto.notifier.dropped");
            logRateLimited("Notification dropped for " + sample.name(),
                    new IllegalStateException(running.get() ? "queue full" : "notifier closed"));
        }
    }

    private void runLoop() {
        while (running.get() || !queue.isEmpty()) {
            final Sample next;
            try {
                next = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (next != null) {
                deliver(next);
            }
        }
    }

    private void deliver(Sample sample) {
        try {
            publisher.publish(sample.name(), json.write(sample));
            sent.increment();
            metrics.counter("samsto.notifier.sent");
        } catch (Exception e) {
            failed.increment();
            metrics.counter("samsto.notifier.failed");
            logRateLimited("Notification failed for " + sample.name(), e);
        }
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

    // ---- Introspection ----

    public long sentTotal() { return sent.sum(); }
    public long failedTotal() { return failed.sum(); }
    public long droppedTotal() { return dropped.sum(); }
    public int pending() { return queue.size(); }

    // ---- Lifecycle ----

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        try {
            worker.join(closeTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) {
            log.warn("Notifier did not drain within {} ms; {} event(s) abandoned", closeTimeout.toMillis(), queue.size());
            worker.interrupt();
        }
        try {
            publisher.close();
        } catch (Exception e) {
            log.warn("Publisher close failed ({})", publisher.id(), e);
        }
        log.info("Change notifier closed. sent={} failed={} dropped={}", sentTotal(), failedTotal(), droppedTotal());
    }
}
