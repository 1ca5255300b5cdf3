/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.transport;

import com.spindle.dataplane.OutboundStream;
import com.spindle.protocol.DataResponse;
import com.spindle.protocol.StreamStatus;
import com.spindle.utils.LoggerUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound half of a data stream: writes responses to the channel and ends the stream
 * with a status frame.
 */
public class ChannelOutboundStream implements OutboundStream {

    private final Channel channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ChannelOutboundStream(Channel channel) {
        this.channel = channel;
    }

    @Override
    public void send(DataResponse response) {
        if (closed.get() || !channel.isActive()) {
            LoggerUtil.debug(() -> "Dropping response " + response.reqId() + ", channel closed");
            return;
        }
        channel.writeAndFlush(response).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                LoggerUtil.warn("Failed to write response " + response.reqId() + ": " + f.cause());
            }
        });
    }

    @Override
    public void close(StreamStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!channel.isActive()) {
            return;
        }
        channel.writeAndFlush(status).addListener(ChannelFutureListener.CLOSE);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
