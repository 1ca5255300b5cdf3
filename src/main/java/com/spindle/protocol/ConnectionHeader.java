/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

/**
 * Per-connection metadata sent by the client as the first frame.
 *
 * @param clientId opaque client identity shared by every connection of one session
 * @param reconnecting stringified boolean, {@code "True"} when resuming an existing session
 */
public record ConnectionHeader(String clientId, String reconnecting) implements WireMessage {
}
