/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration for the sample store and its plugins.
 * <p>
 * Instances are explicit handles passed to every component; nothing reads a global.
 * {@link #load()} resolves the file from {@code -Dsamsto.config.path} or ENV {@code SAMSTO_CONFIG_PATH}.
 */
public final class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    public static final String PATH_PROPERTY = "samsto.config.path";
    public static final String PATH_ENV = "SAMSTO_CONFIG_PATH";

    private final Properties props;

    private StoreConfig(Properties props) {
        this.props = props;
    }

    public static StoreConfig of(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new StoreConfig(copy);
    }

    public static StoreConfig of(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        copy.putAll(source);
        return new StoreConfig(copy);
    }

    public static StoreConfig empty() {
        return new StoreConfig(new Properties());
    }

    /**
     * Loads configuration from the system property, falling back to the environment.
     * A missing path yields an empty config (all defaults); an unreadable file fails loudly.
     */
    public static StoreConfig load() {
        String path = System.getProperty(PATH_PROPERTY);
        if (path == null || path.isBlank()) {
            path = System.getenv(PATH_ENV);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified (-D{} or {}). Using defaults.", PATH_PROPERTY, PATH_ENV);
            return empty();
        }

        Properties loaded = new Properties();
        try (InputStream is = new FileInputStream(path)) {
            loaded.load(is);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load config file: " + path, e);
        }
        log.info("Loaded {} properties from {}", loaded.size(), path);
        return new StoreConfig(loaded);
    }

    public String getString(String key, String defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        String trimmed = val.trim();
        return trimmed.isEmpty() ? defaultValue : trimmed;
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Returns every entry whose key starts with {@code prefix}, with the prefix stripped.
     */
    public Map<String, String> withPrefix(String prefix) {
        Map<String, String> out = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix)) {
                out.put(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return out;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
