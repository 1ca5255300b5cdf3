/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataResponse;

/**
 * Receives the response of an asynchronous get once its objects are available.
 * The response must already carry the request id it answers.
 */
@FunctionalInterface
public interface AsyncResponseSink {

    void deliver(DataResponse response);
}
