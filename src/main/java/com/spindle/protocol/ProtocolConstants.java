/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

/**
 * Constants shared by the server and clients of the data stream.
 */
public final class ProtocolConstants {

    /** Reported in connection-info responses so clients can check compatibility. */
    public static final String CURRENT_PROTOCOL_VERSION = "2024-06-01";

    /** Values accepted for {@link ConnectionHeader#reconnecting()}. */
    public static final String RECONNECTING_TRUE = "True";
    public static final String RECONNECTING_FALSE = "False";

    /** Width of the big-endian length prefix in front of every frame. */
    public static final int LENGTH_FIELD_BYTES = 4;

    public static final int DEFAULT_MAX_FRAME_BYTES = 64 * 1024 * 1024;

    private ProtocolConstants() {}
}
