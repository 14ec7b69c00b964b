/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;

public interface SourcePlugin extends SampleStorePlugin<SubjectAspectSource> {

    @Override
    default PluginKind kind() {
        return PluginKind.SOURCE;
    }

    @Override
    SubjectAspectSource create(StoreConfig config, MetricsRuntime metrics);
}
