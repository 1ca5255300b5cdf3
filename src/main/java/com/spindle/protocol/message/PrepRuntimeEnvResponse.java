/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import java.util.Map;

public record PrepRuntimeEnvResponse(Map<String, String> preparedRuntimeEnv) implements ResponsePayload {
}
