/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

import com.spindle.protocol.message.ResponsePayload;

/**
 * Server response on the data stream, correlated to its request by {@code reqId}.
 */
public record DataResponse(int reqId, ResponsePayload payload) implements WireMessage {

    public static DataResponse of(ResponsePayload payload) {
        return new DataResponse(0, payload);
    }

    public DataResponse withReqId(int newReqId) {
        return newReqId == reqId ? this : new DataResponse(newReqId, payload);
    }
}
