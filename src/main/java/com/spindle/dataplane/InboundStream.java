/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataRequest;

/**
 * Client-to-server half of a data stream.
 */
public interface InboundStream {

    /**
     * Blocks until the next request arrives.
     *
     * @return the next request, or null once the client has finished sending
     * @throws StreamException if the transport failed
     * @throws InterruptedException if the reading thread was interrupted
     */
    DataRequest next() throws StreamException, InterruptedException;

    /**
     * Stops delivering requests. A reader blocked in {@link #next()} returns null.
     */
    void cancel();
}
