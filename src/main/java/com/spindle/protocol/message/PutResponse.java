/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

public record PutResponse(String id, boolean valid, String error) implements ResponsePayload {

    public static PutResponse stored(String id) {
        return new PutResponse(id, true, null);
    }

    public static PutResponse failed(String error) {
        return new PutResponse(null, false, error);
    }
}
