/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

/**
 * Failure that carries the status code to report to the client.
 *
 * <p>Backends throw this to signal a fault whose code they know; anything else reaching
 * the dispatch loop is reported as {@link StatusCode#FAILED_PRECONDITION}.
 */
public class StatusException extends RuntimeException {

    private final StatusCode code;

    public StatusException(StatusCode code, String message) {
        super(message);
        this.code = code;
    }

    public StatusException(StatusCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public StatusCode getCode() {
        return code;
    }

    /**
     * @return true if the client may retry or resume after seeing this failure
     */
    public boolean isRecoverable() {
        return !code.isUnrecoverable();
    }

    public StreamStatus toStatus() {
        return new StreamStatus(code, getMessage());
    }
}
