/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One length-prefixed JSON frame on the data stream.
 *
 * <p>A connection starts with a client {@code hello} frame, then carries client
 * {@code request} frames and server {@code response} frames, and ends with a single
 * server {@code status} frame.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ConnectionHeader.class, name = "hello"),
        @JsonSubTypes.Type(value = DataRequest.class, name = "request"),
        @JsonSubTypes.Type(value = DataResponse.class, name = "response"),
        @JsonSubTypes.Type(value = StreamStatus.class, name = "status")
})
public sealed interface WireMessage permits ConnectionHeader, DataRequest, DataResponse, StreamStatus {
}
