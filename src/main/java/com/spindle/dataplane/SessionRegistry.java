/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StreamStatus;
import com.spindle.utils.LoggerUtil;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Tracks the sessions of connected clients: admission, grace periods, and cleanup.
 *
 * <p>One lock guards the session map, the active-client count and the epoch counter.
 * Each accepted connection gets a new epoch; teardown compares its own epoch with the
 * session's latest to tell whether the client reconnected while it was waiting.
 *
 * <p><b>Thread Safety:</b><br>
 * Every public method may be called from any thread. The backend-shutdown callback is
 * only invoked while the lock is held, on the transition of the count to zero.
 */
public class SessionRegistry {

    /**
     * Outcome of {@link #admit(String, boolean)}.
     *
     * @param epoch epoch assigned to the connection, 0 when rejected
     * @param cache the session's response cache, null when rejected
     * @param rejection status to close the stream with, null when accepted
     */
    public record Admission(boolean accepted, long epoch, OrderedResponseCache cache, StreamStatus rejection) {

        static Admission accept(long epoch, OrderedResponseCache cache) {
            return new Admission(true, epoch, cache, null);
        }

        static Admission reject(StatusCode code, String details) {
            return new Admission(false, 0, null, StreamStatus.of(code, details));
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ClientSession> sessions = new HashMap<>();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final DataBackend backend;
    private final BackendShutdownCallback shutdownCallback;
    private final int maxThreads;
    private final int clientThreshold;
    private final Clock clock;

    private int numClients;
    private long nextEpoch = 1;

    public SessionRegistry(DataBackend backend, BackendShutdownCallback shutdownCallback, int maxThreads) {
        this(backend, shutdownCallback, maxThreads, Clock.systemUTC());
    }

    public SessionRegistry(DataBackend backend, BackendShutdownCallback shutdownCallback, int maxThreads, Clock clock) {
        this.backend = backend;
        this.shutdownCallback = shutdownCallback;
        this.maxThreads = maxThreads;
        this.clientThreshold = maxThreads / 2;
        this.clock = clock;
    }

    /**
     * Decides whether a new connection may attach to the client's session.
     *
     * @param clientId the client id from the connection metadata
     * @param reconnecting the client's claim that it is resuming a session
     */
    public Admission admit(String clientId, boolean reconnecting) {
        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            if (session == null && reconnecting) {
                LoggerUtil.info(LoggerUtil.clientPrefix(clientId) + "Reconnect refused, session already cleaned up");
                return Admission.reject(StatusCode.NOT_FOUND,
                        "Attempted to reconnect to a session that has already been cleaned up.");
            }
            if (session == null && numClients >= clientThreshold) {
                LoggerUtil.warn("[Data Servicer]: Num clients " + numClients + " has reached the threshold "
                        + clientThreshold + ". Rejecting client: " + clientId);
                LoggerUtil.warnOnce("client_threshold",
                        "You can configure the client connection threshold by setting server.max.threads "
                                + "or the SPINDLE_SERVER_MAX_THREADS env var (currently set to " + maxThreads + ").");
                return Admission.reject(StatusCode.RESOURCE_EXHAUSTED,
                        "Client limit of " + clientThreshold + " reached");
            }

            if (session == null) {
                session = new ClientSession(clientId);
                sessions.put(clientId, session);
                numClients++;
                LoggerUtil.debug(() -> "Accepted data connection from " + clientId + ". Total clients: " + numClients);
            } else {
                LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId) + "Client has reconnected");
            }
            long epoch = nextEpoch++;
            session.attach(epoch, clock.instant());
            return Admission.accept(epoch, session.getCache());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores the reconnect grace period the client asked for.
     */
    public void recordGracePeriod(String clientId, int seconds) {
        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            if (session != null) {
                session.setGracePeriodSeconds(seconds);
            }
        } finally {
            lock.unlock();
        }
    }

    public Integer gracePeriodOf(String clientId) {
        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            return session != null ? session.getGracePeriodSeconds() : null;
        } finally {
            lock.unlock();
        }
    }

    public int activeClientCount() {
        lock.lock();
        try {
            return numClients;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs an action while holding the registry lock. Used for backend operations that
     * must not interleave with admission or cleanup.
     */
    public <T> T callLocked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends one connection of a session, waiting out the grace period when the client
     * may still reconnect.
     *
     * @param clientId the client whose connection ended
     * @param epoch the epoch {@link #admit} assigned to that connection
     * @param cleanupRequested true to skip the grace period
     * @return true if this call removed the session
     */
    public boolean teardown(String clientId, long epoch, boolean cleanupRequested) {
        String prefix = LoggerUtil.clientPrefix(clientId);
        Integer grace;
        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            if (session != null) {
                session.detach();
            }
            grace = session != null ? session.getGracePeriodSeconds() : null;
        } finally {
            lock.unlock();
        }

        if (!cleanupRequested && grace != null) {
            LoggerUtil.debug(() -> prefix + "Cleanup wasn't requested, delaying cleanup by " + grace + " seconds");
            try {
                stopped.await(grace, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LoggerUtil.debug(() -> prefix + "Interrupted during grace period, cleaning up now");
            }
        } else {
            LoggerUtil.debug(() -> prefix + "Cleanup was requested, cleaning up immediately");
        }

        lock.lock();
        try {
            ClientSession session = sessions.get(clientId);
            if (session == null || session.getState() == ClientSession.State.REMOVED) {
                LoggerUtil.debug(() -> prefix + "Connection already cleaned up");
                return false;
            }
            if (session.getLastEpoch() > epoch) {
                LoggerUtil.debug(() -> prefix + "Client reconnected, skipping cleanup");
                return false;
            }
            session.markRemoved();
            try {
                backend.releaseAll(clientId);
            } catch (RuntimeException e) {
                LoggerUtil.error(prefix + "Failed to release client resources", e);
            }
            sessions.remove(clientId);
            numClients--;
            LoggerUtil.debug(() -> "Removed client " + clientId + ". Total clients: " + numClients);
            if (numClients == 0) {
                LoggerUtil.info("Last client disconnected, shutting down backend");
                try {
                    shutdownCallback.shutdown();
                } catch (RuntimeException e) {
                    LoggerUtil.error("Backend shutdown failed", e);
                }
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signals server shutdown. Teardowns waiting out a grace period clean up at once.
     */
    public void stop() {
        stopped.countDown();
    }

    public boolean isStopped() {
        return stopped.getCount() == 0;
    }

    /** Snapshot lookup for diagnostics and tests. */
    public ClientSession lookup(String clientId) {
        lock.lock();
        try {
            return sessions.get(clientId);
        } finally {
            lock.unlock();
        }
    }
}
