/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.ConnectionMetadata;
import com.spindle.protocol.DataRequest;
import com.spindle.protocol.DataResponse;
import com.spindle.protocol.ProtocolConstants;
import com.spindle.protocol.RequestKind;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StreamStatus;
import com.spindle.protocol.message.AcknowledgeRequest;
import com.spindle.protocol.message.ConnectionCleanupRequest;
import com.spindle.protocol.message.ConnectionCleanupResponse;
import com.spindle.protocol.message.ConnectionInfoRequest;
import com.spindle.protocol.message.ConnectionInfoResponse;
import com.spindle.protocol.message.GetRequest;
import com.spindle.protocol.message.GetResponse;
import com.spindle.protocol.message.InitRequest;
import com.spindle.protocol.message.InitResponse;
import com.spindle.protocol.message.PrepRuntimeEnvRequest;
import com.spindle.protocol.message.PutRequest;
import com.spindle.protocol.message.ReleaseRequest;
import com.spindle.protocol.message.ReleaseResponse;
import com.spindle.protocol.message.RequestPayload;
import com.spindle.protocol.message.ResponsePayload;
import com.spindle.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Serves one bidirectional data stream per call to {@link #datapath}.
 *
 * <p>Each connection runs a reader task that feeds a queue and a dispatch loop that
 * drains it on the calling thread. Responses to cacheable requests are stored in the
 * session's {@link OrderedResponseCache} so a client that reconnects within its grace
 * period can replay requests whose responses it never received.
 */
public class DataServicer {

    private final DataBackend backend;
    private final SessionRegistry registry;
    private final ExecutorService executor;
    private final long queueJoinSeconds;
    private final String serverVersion;
    private final String serverCommit;

    public DataServicer(DataBackend backend, SessionRegistry registry, ExecutorService executor,
                        long queueJoinSeconds, String serverVersion, String serverCommit) {
        this.backend = backend;
        this.registry = registry;
        this.executor = executor;
        this.queueJoinSeconds = queueJoinSeconds;
        this.serverVersion = serverVersion;
        this.serverCommit = serverCommit;
    }

    /** Mutable state of one connection, confined to the dispatch thread. */
    private static final class Connection {
        final String clientId;
        final String prefix;
        final OrderedResponseCache cache;
        final BlockingQueue<QueueItem> queue;
        boolean reconnectEnabled = true;
        boolean cleanupRequested;
        StreamStatus finalStatus = StreamStatus.ok();

        Connection(String clientId, OrderedResponseCache cache, BlockingQueue<QueueItem> queue) {
            this.clientId = clientId;
            this.prefix = LoggerUtil.clientPrefix(clientId);
            this.cache = cache;
            this.queue = queue;
        }
    }

    /**
     * Runs a data stream to completion. Blocks the calling thread until the stream ends
     * and the session's teardown has finished, which includes any grace-period wait.
     */
    public void datapath(ConnectionMetadata metadata, InboundStream inbound, OutboundStream outbound) {
        String clientId = metadata.clientId();
        if (clientId == null || clientId.isEmpty()) {
            LoggerUtil.error("Client connecting with no client_id");
            outbound.close(StreamStatus.of(StatusCode.INVALID_ARGUMENT, "Missing client_id in connection metadata"));
            inbound.cancel();
            return;
        }
        LoggerUtil.debug(() -> "New data connection from client " + clientId);

        SessionRegistry.Admission admission = registry.admit(clientId, metadata.reconnecting());
        if (!admission.accepted()) {
            outbound.close(admission.rejection());
            inbound.cancel();
            return;
        }

        Connection conn = new Connection(clientId, admission.cache(), new LinkedBlockingQueue<>());
        Future<?> intake = executor.submit(new RequestIntake(clientId, inbound, conn.queue));
        try {
            while (true) {
                QueueItem item = conn.queue.take();
                if (item instanceof QueueItem.EndOfStream) {
                    break;
                }
                if (item instanceof QueueItem.Completed completed) {
                    // async get finished; already carries its request id
                    outbound.send(completed.response());
                    continue;
                }
                DataResponse response = process(conn, ((QueueItem.Inbound) item).request());
                if (response != null) {
                    outbound.send(response);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.warn(conn.prefix + "Data connection interrupted");
            conn.cache.invalidate(e);
            conn.finalStatus = StreamStatus.of(StatusCode.UNAVAILABLE, "Server is shutting down");
            conn.cleanupRequested = true;
        } catch (Error e) {
            LoggerUtil.error(conn.prefix + "Fatal error in data channel:", e);
            conn.cache.invalidate(e);
            conn.finalStatus = StreamStatus.of(StatusCode.FAILED_PRECONDITION,
                    ErrorPropagation.propagate(e).status().details());
            conn.cleanupRequested = true;
            throw e;
        } catch (Exception e) {
            LoggerUtil.error(conn.prefix + "Error in data channel:", e);
            ErrorPropagation.Outcome outcome = ErrorPropagation.propagate(e);
            conn.finalStatus = outcome.status();
            boolean invalidCache = conn.cache.invalidate(e);
            if (!outcome.recoverable() || invalidCache) {
                conn.finalStatus = StreamStatus.of(StatusCode.FAILED_PRECONDITION, outcome.status().details());
                // not resumable, skip the grace period
                conn.cleanupRequested = true;
            }
        } finally {
            LoggerUtil.debug(() -> "Lost data connection from client " + clientId);
            outbound.close(conn.finalStatus);
            inbound.cancel();
            joinIntake(conn.prefix, intake);
            registry.teardown(clientId, admission.epoch(), conn.cleanupRequested);
        }
    }

    private DataResponse process(Connection conn, DataRequest request) throws InterruptedException {
        RequestKind kind = request.kind();
        boolean cacheable = kind != null && kind.isCacheable() && conn.reconnectEnabled;
        if (cacheable) {
            Optional<DataResponse> cached = conn.cache.checkCache(request.reqId());
            if (cached.isPresent()) {
                LoggerUtil.debug(() -> conn.prefix + "Replaying cached response for request " + request.reqId());
                return cached.get();
            }
        }

        ResponsePayload payload = dispatch(conn, request);
        if (payload == null) {
            // acknowledgement, or an async get still pending
            return null;
        }
        DataResponse response = DataResponse.of(payload).withReqId(request.reqId());
        if (cacheable) {
            conn.cache.updateCache(request.reqId(), response);
        }
        return response;
    }

    private ResponsePayload dispatch(Connection conn, DataRequest request) {
        RequestPayload payload = request.payload();
        String clientId = conn.clientId;

        if (payload instanceof InitRequest init) {
            InitResponse resp = backend.init(init, clientId);
            registry.recordGracePeriod(clientId, init.reconnectGracePeriod());
            if (init.reconnectGracePeriod() == 0) {
                conn.reconnectEnabled = false;
            }
            return resp;
        } else if (payload instanceof GetRequest get) {
            if (get.asynchronous()) {
                BlockingQueue<QueueItem> queue = conn.queue;
                GetResponse resp = backend.asyncGetObject(get, clientId, request.reqId(),
                        ready -> queue.add(new QueueItem.Completed(ready)));
                // null means the response arrives later through the queue
                return resp;
            }
            return backend.getObject(get, clientId);
        } else if (payload instanceof PutRequest put) {
            return backend.putObject(put, clientId);
        } else if (payload instanceof ReleaseRequest release) {
            List<Boolean> released = new ArrayList<>(release.ids().size());
            for (String id : release.ids()) {
                released.add(backend.release(clientId, id));
            }
            return new ReleaseResponse(released);
        } else if (payload instanceof ConnectionInfoRequest) {
            return buildConnectionInfo();
        } else if (payload instanceof PrepRuntimeEnvRequest prep) {
            return registry.callLocked(() -> backend.prepRuntimeEnv(prep));
        } else if (payload instanceof ConnectionCleanupRequest) {
            conn.cleanupRequested = true;
            return new ConnectionCleanupResponse();
        } else if (payload instanceof AcknowledgeRequest ack) {
            conn.cache.cleanup(ack.reqId());
            return null;
        }
        throw new IllegalStateException("Unreachable code: Request type " + request.kind()
                + " not handled in datapath (request " + request.reqId() + ")");
    }

    private ConnectionInfoResponse buildConnectionInfo() {
        return new ConnectionInfoResponse(registry.activeClientCount(), System.getProperty("java.version"),
                serverVersion, serverCommit, ProtocolConstants.CURRENT_PROTOCOL_VERSION);
    }

    private void joinIntake(String prefix, Future<?> intake) {
        try {
            intake.get(queueJoinSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            LoggerUtil.error(prefix + "Request reader failed to join before timeout: " + queueJoinSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            LoggerUtil.error(prefix + "Request reader failed", e.getCause());
        }
    }
}
