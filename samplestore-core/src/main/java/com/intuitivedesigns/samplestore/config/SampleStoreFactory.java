/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.config;

import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.notify.AsyncChangeNotifier;
import com.intuitivedesigns.samplestore.notify.ChangeNotifier;
import com.intuitivedesigns.samplestore.spi.EventPublisher;
import com.intuitivedesigns.samplestore.spi.PluginCatalog;
import com.intuitivedesigns.samplestore.spi.PublisherPlugin;
import com.intuitivedesigns.samplestore.spi.SampleStorePlugin;
import com.intuitivedesigns.samplestore.spi.SourcePlugin;
import com.intuitivedesigns.samplestore.spi.StoreClient;
import com.intuitivedesigns.samplestore.spi.StoreClientPlugin;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public final class SampleStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(SampleStoreFactory.class);

    // Config keys
    public static final String KEY_STORE_TYPE = "store.type";
    public static final String KEY_NOTIFIER_TYPE = "notifier.type";
    public static final String KEY_SOURCE_TYPE = "source.type";

    // Defaults
    private static final String DEFAULT_STORE = "LOCAL";
    private static final String DEFAULT_NOTIFIER = "NOOP";

    private static final PluginCatalog CATALOG = new PluginCatalog(resolveClassLoader());

    private SampleStoreFactory() {}

    // --- FACTORY METHODS ---

    public static StoreClient createStore(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_STORE_TYPE, DEFAULT_STORE), DEFAULT_STORE);
        final StoreClientPlugin plugin = CATALOG.stores().require(id, KEY_STORE_TYPE);
        return createSafe(plugin, config, metrics, "Store");
    }

    public static EventPublisher createPublisher(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = normalizeId(config.getString(KEY_NOTIFIER_TYPE, DEFAULT_NOTIFIER), DEFAULT_NOTIFIER);
        final PublisherPlugin plugin = CATALOG.publishers().require(id, KEY_NOTIFIER_TYPE);
        return createSafe(plugin, config, metrics, "Publisher");
    }

    /**
     * Publisher selected by {@code notifier.type}, behind the asynchronous hand-off queue.
     */
    public static ChangeNotifier createNotifier(StoreConfig config, MetricsRuntime metrics) {
        return AsyncChangeNotifier.fromConfig(config, createPublisher(config, metrics), metrics);
    }

    public static SubjectAspectSource createSource(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");

        final String id = require(config, KEY_SOURCE_TYPE);
        final SourcePlugin plugin = CATALOG.sources().require(id, KEY_SOURCE_TYPE);
        return createSafe(plugin, config, metrics, "Source");
    }

    // --- UTILITIES ---

    public static void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        log.info("  Stores:     {}", CATALOG.stores().availableIds());
        log.info("  Publishers: {}", CATALOG.publishers().availableIds());
        log.info("  Sources:    {}", CATALOG.sources().availableIds());
    }

    static PluginCatalog catalog() {
        return CATALOG;
    }

    private static String require(StoreConfig config, String key) {
        final String v = config.getString(key, null);
        if (v == null) {
            throw new IllegalArgumentException("Missing required configuration key: " + key);
        }
        return v;
    }

    private static String normalizeId(String raw, String fallback) {
        if (raw == null) return fallback;
        final String s = raw.trim();
        return s.isEmpty() ? fallback : s;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : SampleStoreFactory.class.getClassLoader();
    }

    private static <T> T createSafe(SampleStorePlugin<T> plugin,
                                    StoreConfig config,
                                    MetricsRuntime metrics,
                                    String typeName) {
        Objects.requireNonNull(plugin, "plugin");
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new IllegalStateException("Failed creating " + typeName + " [" + plugin.id() + "]", e);
        }
    }
}
