/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

public record ConnectionInfoRequest() implements RequestPayload {

    @Override
    public RequestKind kind() {
        return RequestKind.CONNECTION_INFO;
    }
}
