/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

/**
 * Invoked under the registry lock when the last client session is removed.
 */
@FunctionalInterface
public interface BackendShutdownCallback {

    void shutdown();
}
