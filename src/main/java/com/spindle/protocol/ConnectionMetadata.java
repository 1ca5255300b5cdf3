/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

import com.spindle.utils.LoggerUtil;

/**
 * Parsed connection metadata.
 *
 * @param clientId client identity, null when the client did not send one
 * @param reconnecting true when the client is resuming a previous session
 */
public record ConnectionMetadata(String clientId, boolean reconnecting) {

    public static ConnectionMetadata from(ConnectionHeader header) {
        return new ConnectionMetadata(header.clientId(), parseReconnecting(header.reconnecting()));
    }

    /**
     * Reads the stringified reconnecting flag. Only {@code "True"} and {@code "False"}
     * are valid; anything else counts as a fresh connection.
     */
    public static boolean parseReconnecting(String value) {
        if (value == null || !(value.equals(ProtocolConstants.RECONNECTING_TRUE)
                || value.equals(ProtocolConstants.RECONNECTING_FALSE))) {
            LoggerUtil.error("Client connecting with invalid value for \"reconnecting\": " + value
                    + ". This may be because you have a mismatched client and server version.");
            return false;
        }
        return value.equals(ProtocolConstants.RECONNECTING_TRUE);
    }
}
