/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Body of a data response, tagged on the wire by its {@code kind} property.
 * Acknowledgements have no response.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InitResponse.class, name = "init"),
        @JsonSubTypes.Type(value = GetResponse.class, name = "get"),
        @JsonSubTypes.Type(value = PutResponse.class, name = "put"),
        @JsonSubTypes.Type(value = ReleaseResponse.class, name = "release"),
        @JsonSubTypes.Type(value = ConnectionInfoResponse.class, name = "connection_info"),
        @JsonSubTypes.Type(value = PrepRuntimeEnvResponse.class, name = "prep_runtime_env"),
        @JsonSubTypes.Type(value = ConnectionCleanupResponse.class, name = "connection_cleanup")
})
public sealed interface ResponsePayload permits InitResponse, GetResponse, PutResponse, ReleaseResponse,
        ConnectionInfoResponse, PrepRuntimeEnvResponse, ConnectionCleanupResponse {
}
