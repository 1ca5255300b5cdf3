/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

/**
 * The response cache can no longer answer for a request id.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
