/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.samplestore.spi;

public enum PluginKind {
    STORE,
    NOTIFIER,
    SOURCE
}
