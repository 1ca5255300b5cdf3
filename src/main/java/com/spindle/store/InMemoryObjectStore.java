/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.store;

import com.spindle.dataplane.AsyncResponseSink;
import com.spindle.dataplane.DataBackend;
import com.spindle.protocol.DataResponse;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StatusException;
import com.spindle.protocol.message.GetRequest;
import com.spindle.protocol.message.GetResponse;
import com.spindle.protocol.message.InitRequest;
import com.spindle.protocol.message.InitResponse;
import com.spindle.protocol.message.PrepRuntimeEnvRequest;
import com.spindle.protocol.message.PrepRuntimeEnvResponse;
import com.spindle.protocol.message.PutRequest;
import com.spindle.protocol.message.PutResponse;
import com.spindle.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reference {@link DataBackend} holding objects in memory.
 *
 * <p>Objects are keyed by the client's reference id when the put names one, otherwise by a
 * generated id. They are reference counted per client; an object disappears once no client holds
 * a reference to it. Asynchronous gets for objects that do not exist yet are parked and
 * completed by the put that supplies the last missing object.
 *
 * <p>All state is guarded by the store's monitor. Async completions are delivered after
 * the monitor is released.
 */
public class InMemoryObjectStore implements DataBackend {

    public static final String ENV_VARS_PREFIX = "env_vars.";
    private static final double MAX_WAIT_SECONDS = Long.MAX_VALUE / 4e9;

    private record PendingGet(String clientId, List<String> ids, int reqId, AsyncResponseSink sink) {
    }

    private record Delivery(AsyncResponseSink sink, DataResponse response) {
    }

    private final Map<String, byte[]> objects = new HashMap<>();
    private final Map<String, Map<String, Integer>> clientRefs = new HashMap<>();
    private final Map<String, Integer> totalRefs = new HashMap<>();
    private final Map<String, Map<String, String>> jobConfigs = new HashMap<>();
    private final List<PendingGet> pendingGets = new ArrayList<>();
    private final Map<String, String> runtimeEnvDefaults;

    public InMemoryObjectStore() {
        this(Map.of());
    }

    public InMemoryObjectStore(Map<String, String> runtimeEnvDefaults) {
        this.runtimeEnvDefaults = Map.copyOf(runtimeEnvDefaults);
    }

    @Override
    public synchronized InitResponse init(InitRequest request, String clientId) {
        if (request.reconnectGracePeriod() < 0) {
            throw new StatusException(StatusCode.INVALID_ARGUMENT,
                    "Invalid reconnect grace period: " + request.reconnectGracePeriod());
        }
        jobConfigs.put(clientId, request.jobConfig());
        LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId) + "Initialized with " + request.jobConfig().size()
                + " job config entries");
        return new InitResponse(true, "");
    }

    @Override
    public synchronized GetResponse getObject(GetRequest request, String clientId) {
        long deadline = System.nanoTime() + timeoutNanos(request.timeout());
        while (true) {
            String missing = firstMissing(request.ids());
            if (missing == null) {
                return collect(request.ids(), clientId);
            }
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                return GetResponse.failed("Object " + missing + " not found");
            }
            try {
                wait(Math.max(1, remainingNanos / 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return GetResponse.failed("Interrupted while waiting for object " + missing);
            }
        }
    }

    @Override
    public synchronized GetResponse asyncGetObject(GetRequest request, String clientId, int reqId,
                                                   AsyncResponseSink sink) {
        if (firstMissing(request.ids()) == null) {
            return collect(request.ids(), clientId);
        }
        pendingGets.add(new PendingGet(clientId, request.ids(), reqId, sink));
        LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId) + "Parked async get " + reqId + " for " + request.ids());
        return null;
    }

    @Override
    public PutResponse putObject(PutRequest request, String clientId) {
        if (request.data() == null) {
            return PutResponse.failed("Put without data");
        }
        String id;
        List<Delivery> ready;
        synchronized (this) {
            id = request.clientRefId() != null ? request.clientRefId() : UUID.randomUUID().toString().replace("-", "");
            if (objects.containsKey(id)) {
                return PutResponse.failed("Object " + id + " already exists");
            }
            objects.put(id, request.data().clone());
            String owner = request.ownerId() != null ? request.ownerId() : clientId;
            addRef(owner, id);
            ready = drainReadyGets();
            notifyAll();
        }
        for (Delivery d : ready) {
            d.sink().deliver(d.response());
        }
        return PutResponse.stored(id);
    }

    @Override
    public synchronized boolean release(String clientId, String objectId) {
        Map<String, Integer> refs = clientRefs.get(clientId);
        if (refs == null || !refs.containsKey(objectId)) {
            return false;
        }
        int left = refs.get(objectId) - 1;
        if (left == 0) {
            refs.remove(objectId);
            if (refs.isEmpty()) {
                clientRefs.remove(clientId);
            }
        } else {
            refs.put(objectId, left);
        }
        dropTotalRef(objectId, 1);
        return true;
    }

    @Override
    public synchronized void releaseAll(String clientId) {
        Map<String, Integer> refs = clientRefs.remove(clientId);
        int released = 0;
        if (refs != null) {
            for (Map.Entry<String, Integer> e : refs.entrySet()) {
                dropTotalRef(e.getKey(), e.getValue());
                released += e.getValue();
            }
        }
        pendingGets.removeIf(p -> p.clientId().equals(clientId));
        jobConfigs.remove(clientId);
        int count = released;
        LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId) + "Released " + count + " references");
    }

    @Override
    public PrepRuntimeEnvResponse prepRuntimeEnv(PrepRuntimeEnvRequest request) {
        Map<String, String> prepared = new LinkedHashMap<>(runtimeEnvDefaults);
        for (Map.Entry<String, String> e : request.runtimeEnv().entrySet()) {
            if (e.getKey().startsWith(ENV_VARS_PREFIX) && e.getKey().length() == ENV_VARS_PREFIX.length()) {
                throw new StatusException(StatusCode.INVALID_ARGUMENT, "Environment variable name must not be empty");
            }
            prepared.put(e.getKey(), e.getValue());
        }
        return new PrepRuntimeEnvResponse(prepared);
    }

    @Override
    public synchronized void shutdown() {
        LoggerUtil.info("Object store shutting down, dropping " + objects.size() + " objects");
        objects.clear();
        clientRefs.clear();
        totalRefs.clear();
        jobConfigs.clear();
        pendingGets.clear();
        notifyAll();
    }

    public synchronized boolean contains(String objectId) {
        return objects.containsKey(objectId);
    }

    public synchronized int objectCount() {
        return objects.size();
    }

    public synchronized int pendingGetCount() {
        return pendingGets.size();
    }

    public synchronized Map<String, String> jobConfigOf(String clientId) {
        return jobConfigs.get(clientId);
    }

    // capped so deadline arithmetic on nanoTime cannot wrap
    private static long timeoutNanos(double timeoutSeconds) {
        double capped = Math.min(Math.max(0, timeoutSeconds), MAX_WAIT_SECONDS);
        return (long) (capped * 1_000_000_000L);
    }

    private String firstMissing(List<String> ids) {
        for (String id : ids) {
            if (!objects.containsKey(id)) {
                return id;
            }
        }
        return null;
    }

    // every id must be present; a get also gives the reader a reference
    private GetResponse collect(List<String> ids, String clientId) {
        List<byte[]> data = new ArrayList<>(ids.size());
        for (String id : ids) {
            data.add(objects.get(id).clone());
            addRef(clientId, id);
        }
        return GetResponse.found(data);
    }

    private List<Delivery> drainReadyGets() {
        List<Delivery> ready = new ArrayList<>();
        Iterator<PendingGet> it = pendingGets.iterator();
        while (it.hasNext()) {
            PendingGet p = it.next();
            if (firstMissing(p.ids()) == null) {
                it.remove();
                ready.add(new Delivery(p.sink(), new DataResponse(p.reqId(), collect(p.ids(), p.clientId()))));
            }
        }
        return ready;
    }

    private void addRef(String clientId, String objectId) {
        clientRefs.computeIfAbsent(clientId, k -> new HashMap<>()).merge(objectId, 1, Integer::sum);
        totalRefs.merge(objectId, 1, Integer::sum);
    }

    private void dropTotalRef(String objectId, int count) {
        Integer total = totalRefs.get(objectId);
        if (total == null) {
            return;
        }
        if (total <= count) {
            totalRefs.remove(objectId);
            objects.remove(objectId);
        } else {
            totalRefs.put(objectId, total - count);
        }
    }
}
