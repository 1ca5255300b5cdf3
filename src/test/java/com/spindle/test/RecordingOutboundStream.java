/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.test;

import com.spindle.dataplane.OutboundStream;
import com.spindle.protocol.DataResponse;
import com.spindle.protocol.StreamStatus;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Outbound stream that records what the servicer wrote.
 */
public class RecordingOutboundStream implements OutboundStream {

    private final List<DataResponse> responses = new CopyOnWriteArrayList<>();
    private final CountDownLatch closedLatch = new CountDownLatch(1);
    private volatile StreamStatus status;
    private volatile int closeCalls;

    @Override
    public void send(DataResponse response) {
        responses.add(response);
    }

    @Override
    public synchronized void close(StreamStatus finalStatus) {
        closeCalls++;
        if (status == null) {
            status = finalStatus;
            closedLatch.countDown();
        }
    }

    public List<DataResponse> responses() {
        return responses;
    }

    public StreamStatus status() {
        return status;
    }

    public int closeCalls() {
        return closeCalls;
    }

    public boolean awaitClose(long timeout, TimeUnit unit) throws InterruptedException {
        return closedLatch.await(timeout, unit);
    }

    /** Polls until at least {@code count} responses were written. */
    public boolean awaitResponses(int count, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (responses.size() < count) {
            if (System.currentTimeMillis() > deadline) {
                return false;
            }
            Thread.sleep(5);
        }
        return true;
    }
}
