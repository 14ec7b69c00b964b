/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.source.postgres;

import com.intuitivedesigns.samplestore.config.StoreConfig;
import com.intuitivedesigns.samplestore.metrics.MetricsRuntime;
import com.intuitivedesigns.samplestore.spi.SourcePlugin;
import com.intuitivedesigns.samplestore.spi.SubjectAspectSource;

import java.util.Objects;

/**
 * ID: POSTGRES
 */
public final class PostgresSourcePlugin implements SourcePlugin {

    public static final String ID = "POSTGRES";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public SubjectAspectSource create(StoreConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return JdbcSubjectAspectSource.fromConfig(config, metrics);
    }
}
