/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

/**
 * Typed registries for every plugin family the store wires at startup.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<StoreClientPlugin> stores;
    private final ServicePluginRegistry<PublisherPlugin> publishers;
    private final ServicePluginRegistry<SourcePlugin> sources;

    public PluginCatalog(ClassLoader cl) {
        this.stores = new ServicePluginRegistry<>(StoreClientPlugin.class, cl);
        this.publishers = new ServicePluginRegistry<>(PublisherPlugin.class, cl);
        this.sources = new ServicePluginRegistry<>(SourcePlugin.class, cl);
    }

    public ServicePluginRegistry<StoreClientPlugin> stores() {
        return stores;
    }

    public ServicePluginRegistry<PublisherPlugin> publishers() {
        return publishers;
    }

    public ServicePluginRegistry<SourcePlugin> sources() {
        return sources;
    }
}
