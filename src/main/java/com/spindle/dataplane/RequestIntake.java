/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataRequest;
import com.spindle.utils.LoggerUtil;

import java.util.concurrent.BlockingQueue;

/**
 * Reader task that moves requests from the inbound stream onto the dispatch queue.
 * It always finishes by queueing {@link QueueItem.EndOfStream}.
 */
public class RequestIntake implements Runnable {

    private final String clientId;
    private final InboundStream inbound;
    private final BlockingQueue<QueueItem> queue;

    public RequestIntake(String clientId, InboundStream inbound, BlockingQueue<QueueItem> queue) {
        this.clientId = clientId;
        this.inbound = inbound;
        this.queue = queue;
    }

    @Override
    public void run() {
        try {
            DataRequest request;
            while ((request = inbound.next()) != null) {
                queue.add(new QueueItem.Inbound(request));
            }
        } catch (StreamException e) {
            LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId)
                    + "Closing request reader, error reading inbound stream: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.debug(() -> LoggerUtil.clientPrefix(clientId) + "Request reader interrupted");
        } finally {
            queue.add(QueueItem.EndOfStream.INSTANCE);
        }
    }
}
