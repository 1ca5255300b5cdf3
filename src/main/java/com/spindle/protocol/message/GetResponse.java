/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import java.util.List;

/**
 * Result of a get. A failed lookup is reported in-band with {@code valid=false}.
 */
public record GetResponse(boolean valid, List<byte[]> data, String error) implements ResponsePayload {

    public static GetResponse found(List<byte[]> data) {
        return new GetResponse(true, List.copyOf(data), null);
    }

    public static GetResponse failed(String error) {
        return new GetResponse(false, List.of(), error);
    }
}
