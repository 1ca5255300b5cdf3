/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import java.util.List;

/**
 * @param ok one entry per requested id, in request order
 */
public record ReleaseResponse(List<Boolean> ok) implements ResponsePayload {

    public ReleaseResponse {
        ok = ok == null ? List.of() : List.copyOf(ok);
    }
}
