/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StatusException;
import com.spindle.protocol.StreamStatus;

/**
 * Maps a failure on the data stream to the status reported to the client.
 */
public final class ErrorPropagation {

    /**
     * @param status the status to close the stream with
     * @param recoverable whether the client may resume the session afterwards
     */
    public record Outcome(StreamStatus status, boolean recoverable) {
    }

    private ErrorPropagation() {}

    public static Outcome propagate(Throwable error) {
        if (error instanceof StatusException se) {
            return new Outcome(se.toStatus(), se.isRecoverable());
        }
        String details = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new Outcome(StreamStatus.of(StatusCode.FAILED_PRECONDITION, details), false);
    }
}
