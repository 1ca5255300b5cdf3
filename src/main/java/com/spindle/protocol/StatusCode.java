/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

import java.util.EnumSet;
import java.util.Set;

/**
 * Final status codes carried by the closing {@link StreamStatus} frame.
 */
public enum StatusCode {
    OK,
    CANCELLED,
    UNKNOWN,
    INVALID_ARGUMENT,
    NOT_FOUND,
    RESOURCE_EXHAUSTED,
    FAILED_PRECONDITION,
    ABORTED,
    INTERNAL,
    UNAVAILABLE;

    private static final Set<StatusCode> UNRECOVERABLE =
            EnumSet.of(INVALID_ARGUMENT, NOT_FOUND, FAILED_PRECONDITION, ABORTED);

    /**
     * A client receiving one of these codes must not try to resume its session.
     */
    public boolean isUnrecoverable() {
        return UNRECOVERABLE.contains(this);
    }
}
