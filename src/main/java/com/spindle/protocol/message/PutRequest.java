/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

/**
 * Store an object.
 *
 * @param data object bytes (base64 on the wire)
 * @param ownerId client that should hold the reference; defaults to the caller
 * @param clientRefId id chosen by the client so it can wait on the object before it exists;
 *                    the store generates one when absent
 */
public record PutRequest(byte[] data, String ownerId, String clientRefId) implements RequestPayload {

    public PutRequest(byte[] data, String ownerId) {
        this(data, ownerId, null);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.PUT;
    }
}
