/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

public enum PluginKind {
    TRANSFORMER,
    SINK
}
