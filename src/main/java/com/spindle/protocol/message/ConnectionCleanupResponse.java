/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

public record ConnectionCleanupResponse() implements ResponsePayload {
}
