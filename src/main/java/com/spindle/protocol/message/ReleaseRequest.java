/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

import java.util.List;

public record ReleaseRequest(List<String> ids) implements RequestPayload {

    public ReleaseRequest {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.RELEASE;
    }
}
