/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataResponse;
import com.spindle.protocol.StreamStatus;

/**
 * Server-to-client half of a data stream.
 */
public interface OutboundStream {

    void send(DataResponse response);

    /**
     * Writes the final status and closes the stream. Calls after the first are ignored.
     */
    void close(StreamStatus status);
}
