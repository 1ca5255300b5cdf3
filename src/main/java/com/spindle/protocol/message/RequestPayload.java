/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.spindle.protocol.RequestKind;

/**
 * Body of a data request, tagged on the wire by its {@code kind} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InitRequest.class, name = "init"),
        @JsonSubTypes.Type(value = GetRequest.class, name = "get"),
        @JsonSubTypes.Type(value = PutRequest.class, name = "put"),
        @JsonSubTypes.Type(value = ReleaseRequest.class, name = "release"),
        @JsonSubTypes.Type(value = ConnectionInfoRequest.class, name = "connection_info"),
        @JsonSubTypes.Type(value = PrepRuntimeEnvRequest.class, name = "prep_runtime_env"),
        @JsonSubTypes.Type(value = ConnectionCleanupRequest.class, name = "connection_cleanup"),
        @JsonSubTypes.Type(value = AcknowledgeRequest.class, name = "acknowledge")
})
public sealed interface RequestPayload permits InitRequest, GetRequest, PutRequest, ReleaseRequest,
        ConnectionInfoRequest, PrepRuntimeEnvRequest, ConnectionCleanupRequest, AcknowledgeRequest {

    RequestKind kind();
}
