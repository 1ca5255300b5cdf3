/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataResponse;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-client cache of responses, keyed by request id, that lets a reconnecting client
 * replay requests without executing them twice.
 *
 * <p>Entries are kept in insertion order, which is the order the client issued its
 * requests. An id is reserved with an in-flight placeholder the first time it is looked
 * up, so a second connection of the same session asking for the same id waits for the
 * first to finish instead of re-executing it.
 *
 * <p>Once {@link #invalidate(Throwable) invalidated} the cache stays broken and every
 * lookup rethrows the recorded failure.
 *
 * <p>All methods synchronize on the cache; a session normally has one connection, but
 * the old and new connection can overlap briefly during a reconnect.
 */
public class OrderedResponseCache {

    private final Map<Integer, Entry> entries = new LinkedHashMap<>();

    private Throwable failure;
    private boolean acknowledgedAny;
    private int lastAcknowledged;

    /**
     * Looks up the response for a request id.
     *
     * @return the cached response, or empty if the caller should execute the request;
     *         in the latter case the id is now reserved for the caller
     * @throws CacheException if the id was already acknowledged, or the cache failed
     *         with a checked exception
     * @throws RuntimeException the recorded failure, if the cache was invalidated with one
     * @throws InterruptedException if interrupted while waiting for another connection
     */
    public synchronized Optional<DataResponse> checkCache(int reqId) throws InterruptedException {
        while (true) {
            if (failure != null) {
                throw rethrowable(failure);
            }
            Entry entry = entries.get(reqId);
            if (entry == null) {
                if (acknowledgedAny && !isNewer(reqId, lastAcknowledged)) {
                    throw new CacheException("Request " + reqId + " was already acknowledged and cleaned up");
                }
                entries.put(reqId, Entry.pending());
                return Optional.empty();
            }
            if (entry.failure != null) {
                throw rethrowable(entry.failure);
            }
            if (entry.response != null) {
                return Optional.of(entry.response);
            }
            // in flight on another connection
            wait();
        }
    }

    /**
     * Stores the response for an id unless one is already there.
     */
    public synchronized void updateCache(int reqId, DataResponse response) {
        if (failure != null) {
            return;
        }
        Entry entry = entries.get(reqId);
        if (entry != null && entry.response != null) {
            return;
        }
        entries.put(reqId, Entry.of(response));
        notifyAll();
    }

    /**
     * Drops the entry for an acknowledged id together with every entry inserted before it.
     */
    public synchronized void cleanup(int reqId) {
        if (!acknowledgedAny || isNewer(reqId, lastAcknowledged)) {
            lastAcknowledged = reqId;
            acknowledgedAny = true;
        }
        Iterator<Map.Entry<Integer, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            int key = it.next().getKey();
            if (key != reqId && !isNewer(reqId, key)) {
                break;
            }
            it.remove();
        }
        notifyAll();
    }

    /**
     * Marks the cache permanently broken.
     *
     * @param error the failure to hand back from every later lookup; the first one wins
     * @return true if the cache was already invalid or a placeholder was still in flight,
     *         meaning the session cannot be resumed
     */
    public synchronized boolean invalidate(Throwable error) {
        if (failure != null) {
            return true;
        }
        failure = error;
        boolean lostInFlight = false;
        for (Map.Entry<Integer, Entry> e : entries.entrySet()) {
            if (e.getValue().isPending()) {
                e.setValue(Entry.failed(error));
                lostInFlight = true;
            }
        }
        notifyAll();
        return lostInFlight;
    }

    public synchronized boolean isInvalid() {
        return failure != null;
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Compares request ids allowing for wrap-around of the signed 32-bit counter.
     *
     * @return true if {@code id1} was issued after {@code id2}
     */
    public static boolean isNewer(int id1, int id2) {
        long diff = Math.abs((long) id2 - id1);
        if (diff > Integer.MAX_VALUE / 2) {
            // one side has wrapped; the smaller value is the newer one
            return id1 < id2;
        }
        return id1 > id2;
    }

    private static RuntimeException rethrowable(Throwable t) {
        if (t instanceof RuntimeException re) {
            return re;
        }
        return new CacheException("Response cache is invalid: " + t.getMessage(), t);
    }

    private static final class Entry {
        final DataResponse response;
        final Throwable failure;

        private Entry(DataResponse response, Throwable failure) {
            this.response = response;
            this.failure = failure;
        }

        static Entry pending() {
            return new Entry(null, null);
        }

        static Entry of(DataResponse response) {
            return new Entry(response, null);
        }

        static Entry failed(Throwable failure) {
            return new Entry(null, failure);
        }

        boolean isPending() {
            return response == null && failure == null;
        }
    }
}
