/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.spindle.protocol.RequestKind;

import java.util.Map;

public record PrepRuntimeEnvRequest(Map<String, String> runtimeEnv) implements RequestPayload {

    public PrepRuntimeEnvRequest {
        runtimeEnv = runtimeEnv == null ? Map.of() : Map.copyOf(runtimeEnv);
    }

    @Override
    public RequestKind kind() {
        return RequestKind.PREP_RUNTIME_ENV;
    }
}
