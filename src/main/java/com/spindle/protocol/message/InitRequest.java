/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

import java.util.Map;

/**
 * Session initialization.
 *
 * @param jobConfig free-form job settings recorded by the backend
 * @param reconnectGracePeriod seconds the server keeps the session after an unexpected
 *                             disconnect; 0 disables reconnection for the session
 */
public record InitRequest(Map<String, String> jobConfig, int reconnectGracePeriod) implements RequestPayload {

    public InitRequest {
        jobConfig = jobConfig == null ? Map.of() : Map.copyOf(jobConfig);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.INIT;
    }
}
