/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.transport;

import com.spindle.dataplane.InboundStream;
import com.spindle.dataplane.StreamException;
import com.spindle.protocol.DataRequest;
import com.spindle.utils.LoggerUtil;
import io.netty.channel.Channel;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Inbound half of a data stream backed by a Netty channel.
 *
 * <p>The event loop {@link #offer offers} decoded requests without blocking; the
 * dispatch side drains them with {@link #next()}. When the backlog passes the high-water
 * mark, auto-read is switched off until the reader has drained it to the low-water mark.
 */
public class ChannelInboundStream implements InboundStream {

    private sealed interface Item permits Request, End, Failure {
    }

    private record Request(DataRequest request) implements Item {
    }

    private record Failure(Throwable cause) implements Item {
    }

    private static final class End implements Item {
        static final End INSTANCE = new End();
    }

    private final Channel channel;
    private final BlockingQueue<Item> items = new LinkedBlockingQueue<>();
    private final int highWater;
    private final int lowWater;
    private volatile boolean finished;

    public ChannelInboundStream(Channel channel, int highWater, int lowWater) {
        if (lowWater < 0 || highWater <= lowWater) {
            throw new IllegalArgumentException("Invalid water marks: high=" + highWater + " low=" + lowWater);
        }
        this.channel = channel;
        this.highWater = highWater;
        this.lowWater = lowWater;
    }

    /**
     * Queues a request. Called on the event loop.
     */
    public void offer(DataRequest request) {
        if (finished) {
            return;
        }
        items.add(new Request(request));
        if (items.size() >= highWater && channel.config().isAutoRead()) {
            LoggerUtil.debug(() -> "Inbound backlog reached " + highWater + ", pausing reads on " + channel);
            channel.config().setAutoRead(false);
        }
    }

    /** The client finished sending. */
    public void complete() {
        finish(End.INSTANCE);
    }

    /** The transport failed; the reader sees a {@link StreamException}. */
    public void fail(Throwable cause) {
        finish(new Failure(cause));
    }

    @Override
    public void cancel() {
        finish(End.INSTANCE);
    }

    @Override
    public DataRequest next() throws StreamException, InterruptedException {
        Item item = items.take();
        if (items.size() <= lowWater && !channel.config().isAutoRead() && channel.isActive()) {
            channel.config().setAutoRead(true);
        }
        if (item instanceof Request r) {
            return r.request();
        }
        // keep the terminal item so that later calls end the same way
        items.add(item);
        if (item instanceof Failure f) {
            throw new StreamException("Inbound stream failed: " + f.cause().getMessage(), f.cause());
        }
        return null;
    }

    private void finish(Item terminal) {
        if (finished) {
            return;
        }
        finished = true;
        items.add(terminal);
    }
}
