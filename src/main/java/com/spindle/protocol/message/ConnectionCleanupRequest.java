/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

/**
 * Sent by a client that is shutting down gracefully; its session is released without
 * waiting for the reconnect grace period.
 */
public record ConnectionCleanupRequest() implements RequestPayload {

    @Override
    public RequestKind kind() {
        return RequestKind.CONNECTION_CLEANUP;
    }
}
