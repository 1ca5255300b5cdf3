/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.unit.dataplane;

import com.spindle.dataplane.CacheException;
import com.spindle.dataplane.ErrorPropagation;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StatusException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorPropagationTest {

    @Test
    void shouldKeepCodeOfRecoverableStatusException() {
        ErrorPropagation.Outcome outcome = ErrorPropagation.propagate(
                new StatusException(StatusCode.UNAVAILABLE, "store busy"));

        assertEquals(StatusCode.UNAVAILABLE, outcome.status().code());
        assertEquals("store busy", outcome.status().details());
        assertTrue(outcome.recoverable());
    }

    @ParameterizedTest
    @EnumSource(value = StatusCode.class, names = {"INVALID_ARGUMENT", "NOT_FOUND", "FAILED_PRECONDITION", "ABORTED"})
    void shouldMarkTerminalCodesUnrecoverable(StatusCode code) {
        ErrorPropagation.Outcome outcome = ErrorPropagation.propagate(new StatusException(code, "nope"));

        assertEquals(code, outcome.status().code());
        assertFalse(outcome.recoverable());
    }

    @Test
    void shouldMapOtherFailuresToFailedPrecondition() {
        ErrorPropagation.Outcome outcome = ErrorPropagation.propagate(new CacheException("cache gone"));

        assertEquals(StatusCode.FAILED_PRECONDITION, outcome.status().code());
        assertEquals("cache gone", outcome.status().details());
        assertFalse(outcome.recoverable());
    }

    @Test
    void shouldUseClassNameWhenMessageIsMissing() {
        ErrorPropagation.Outcome outcome = ErrorPropagation.propagate(new NullPointerException());

        assertEquals("NullPointerException", outcome.status().details());
    }
}
