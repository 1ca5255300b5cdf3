/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

import com.spindle.protocol.message.RequestPayload;

/**
 * Client request on the data stream.
 *
 * @param reqId request id, unique within one client connection epoch; the cache key
 * @param payload kind-specific body, null if the client sent a kind this server does not know
 */
public record DataRequest(int reqId, RequestPayload payload) implements WireMessage {

    /**
     * @return the payload kind, or null when there is no payload
     */
    public RequestKind kind() {
        return payload != null ? payload.kind() : null;
    }
}
