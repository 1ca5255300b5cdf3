/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

/**
 * Tells the server that every response up to and including {@code reqId} was received,
 * so their cache entries can be dropped.
 */
public record AcknowledgeRequest(int reqId) implements RequestPayload {

    @Override
    public RequestKind kind() {
        return RequestKind.ACKNOWLEDGE;
    }
}
