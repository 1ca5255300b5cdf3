/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

import java.util.List;

/**
 * Fetch one or more objects.
 *
 * @param ids object ids to fetch
 * @param timeout seconds to wait for missing objects on a synchronous get; 0 does not wait
 * @param asynchronous when true the response is delivered once every object exists
 */
public record GetRequest(List<String> ids, double timeout, boolean asynchronous) implements RequestPayload {

    public GetRequest {
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.GET;
    }
}
