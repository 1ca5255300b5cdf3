/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.message.GetRequest;
import com.spindle.protocol.message.GetResponse;
import com.spindle.protocol.message.InitRequest;
import com.spindle.protocol.message.InitResponse;
import com.spindle.protocol.message.PrepRuntimeEnvRequest;
import com.spindle.protocol.message.PrepRuntimeEnvResponse;
import com.spindle.protocol.message.PutRequest;
import com.spindle.protocol.message.PutResponse;

/**
 * Request-execution capability behind the data stream.
 *
 * <p>Implementations report faults they can classify by throwing
 * {@link com.spindle.protocol.StatusException}; application-level failures such as a
 * missing object belong inside the response payload.
 */
public interface DataBackend {

    InitResponse init(InitRequest request, String clientId);

    GetResponse getObject(GetRequest request, String clientId);

    /**
     * Starts an asynchronous get.
     *
     * @param reqId id of the triggering request, echoed in the delivered response
     * @param sink where the response goes if it is not ready now
     * @return the response if every object is already available, otherwise null
     */
    GetResponse asyncGetObject(GetRequest request, String clientId, int reqId, AsyncResponseSink sink);

    PutResponse putObject(PutRequest request, String clientId);

    /**
     * Drops one reference held by the client.
     *
     * @return false if the client held no reference to the object
     */
    boolean release(String clientId, String objectId);

    /** Drops everything the client holds, including pending asynchronous gets. */
    void releaseAll(String clientId);

    PrepRuntimeEnvResponse prepRuntimeEnv(PrepRuntimeEnvRequest request);

    /** Releases process-wide backend state. */
    void shutdown();
}
