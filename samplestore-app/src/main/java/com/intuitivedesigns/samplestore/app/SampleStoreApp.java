/*
 * Copyright 2025 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.app;

import com.intuitivedesigns.samplestore.cache.LifecycleController;
import com.intuitivedesigns.samplestore.config.SampleStoreFactory;
import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.core.RetryPolicy;
import com.intuitivedesigns.samplestore.core.SampleStore;
import com.intuitivedesigns.samplestore.metrics.MetricsFactory;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.model.ObjectType;
import com.intuitivedesigns.samplestore.notify.ChangeNotifier;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cold-start bootstrap: wires plugins from configuration, optionally wipes the cache,
 * rebuilds the Subject/Aspect mirror and reports index sizes.
 */
public final class SampleStoreApp {

    private static final Logger log = LoggerFactory.getLogger(SampleStoreApp.class);

    // --- Config Keys ---
    static final String CFG_ERADICATE_ON_START = "app.eradicate.on.start";

    private SampleStoreApp() {}

    public static void main(String[] args) {
        log.info("=== Booting Sample Store ===");

        final StoreConfig config = StoreConfig.load();
        SampleStoreFactory.logAvailablePlugins();

        MetricsRuntime metrics = null;
        StoreClient client = null;
        SubjectAspectSource source = null;
        SampleStore store = null;

        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Metrics
            metrics = MetricsFactory.init(config);

            // 2. Components (SPI)
            client = SampleStoreFactory.createStore(config, metrics);
            source = SampleStoreFactory.createSource(config, metrics);
            final ChangeNotifier notifier = SampleStoreFactory.createNotifier(config, metrics);

            store = SampleStore.builder()
                    .client(client)
                    .source(source)
                    .notifier(notifier)
                    .metrics(metrics)
                    .retry(RetryPolicy.fromConfig(config))
                    .build();

            // 3. Shutdown Hook
            final SampleStore finalStore = store;
            final StoreClient finalClient = client;
            final SubjectAspectSource finalSource = source;
            final MetricsRuntime finalMetrics = metrics;

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (shutdownStarted.compareAndSet(false, true)) {
                    log.info("Shutdown signal received.");
                    closeQuietly(finalStore, finalSource, finalClient, finalMetrics);
                }
            }, "samsto-shutdown"));

            // 4. Bootstrap
            client.ping();
            bootstrap(store, config.getBoolean(CFG_ERADICATE_ON_START, false));
            log.info("Sample store ready.");

        } catch (Throwable t) {
            log.error("Fatal application error", t);
            if (shutdownStarted.compareAndSet(false, true)) {
                closeQuietly(store, source, client, metrics);
            }
            System.exit(1);
        }
    }

    /**
     * Runs the lifecycle sequence against an assembled store.
     */
    static LifecycleController.InitReport bootstrap(SampleStore store, boolean eradicateFirst) {
        if (eradicateFirst) {
            log.warn("{}=true: wiping every cache key before init", CFG_ERADICATE_ON_START);
            store.eradicate();
        }

        final LifecycleController.InitReport report = store.init();

        log.info("Index sizes: subjects={} aspects={} samples={}",
                store.indexes().size(ObjectType.SUBJECT),
                store.indexes().size(ObjectType.ASPECT),
                store.indexes().size(ObjectType.SAMPLE));
        return report;
    }

    private static void closeQuietly(AutoCloseable... resources) {
        for (AutoCloseable resource : resources) {
            if (resource == null) continue;
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close {}", resource.getClass().getSimpleName(), e);
            }
        }
    }
}
