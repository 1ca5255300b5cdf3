/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

/**
 * Last frame written on a stream before the server closes it.
 *
 * @param code final status
 * @param details human-readable reason, null on success
 */
public record StreamStatus(StatusCode code, String details) implements WireMessage {

    private static final StreamStatus OK = new StreamStatus(StatusCode.OK, null);

    public static StreamStatus ok() {
        return OK;
    }

    public static StreamStatus of(StatusCode code, String details) {
        return new StreamStatus(code, details);
    }

    public boolean succeeded() {
        return code == StatusCode.OK;
    }
}
