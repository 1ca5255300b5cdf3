/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import java.time.Instant;

/**
 * Registry entry for one client id. Every field is guarded by the registry lock.
 */
public final class ClientSession {

    public enum State {
        /** At least one connection is attached. */
        ACTIVE,
        /** No connection attached; waiting out the reconnect grace period. */
        RECONNECT_WINDOW,
        /** Cleaned up. A teardown that still holds a reference must not touch it. */
        REMOVED
    }

    private final String clientId;
    private final OrderedResponseCache cache = new OrderedResponseCache();
    private Instant lastSeen;
    private long lastEpoch;
    private Integer gracePeriodSeconds;
    private int attachedConnections;
    private State state = State.ACTIVE;

    ClientSession(String clientId) {
        this.clientId = clientId;
    }

    public String getClientId() {
        return clientId;
    }

    public OrderedResponseCache getCache() {
        return cache;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public long getLastEpoch() {
        return lastEpoch;
    }

    /** @return the grace period the client asked for in init, or null if it never sent one */
    public Integer getGracePeriodSeconds() {
        return gracePeriodSeconds;
    }

    public int getAttachedConnections() {
        return attachedConnections;
    }

    public State getState() {
        return state;
    }

    void attach(long epoch, Instant now) {
        lastEpoch = epoch;
        lastSeen = now;
        attachedConnections++;
        state = State.ACTIVE;
    }

    void detach() {
        if (attachedConnections > 0) {
            attachedConnections--;
        }
        if (attachedConnections == 0 && state == State.ACTIVE) {
            state = State.RECONNECT_WINDOW;
        }
    }

    void setGracePeriodSeconds(Integer seconds) {
        this.gracePeriodSeconds = seconds;
    }

    void markRemoved() {
        state = State.REMOVED;
    }

    @Override
    public String toString() {
        return "ClientSession{" + clientId + ", epoch=" + lastEpoch + ", lastSeen=" + lastSeen + ", state=" + state
                + ", connections=" + attachedConnections + "}";
    }
}
