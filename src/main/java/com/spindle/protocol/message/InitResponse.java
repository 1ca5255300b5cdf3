/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

public record InitResponse(boolean ok, String msg) implements ResponsePayload {
}
