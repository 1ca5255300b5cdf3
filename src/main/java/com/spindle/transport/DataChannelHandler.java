/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.transport;

import com.spindle.dataplane.DataServicer;
import com.spindle.protocol.ConnectionHeader;
import com.spindle.protocol.ConnectionMetadata;
import com.spindle.protocol.DataRequest;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StreamStatus;
import com.spindle.protocol.WireMessage;
import com.spindle.utils.LoggerUtil;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Per-connection handler that binds a Netty channel to one {@link DataServicer#datapath} call.
 *
 * <p>The first frame must be a {@code hello} carrying the connection metadata. After that
 * only requests are accepted; they are handed to the inbound stream without blocking the
 * event loop. The data path itself runs on the dataplane executor.
 */
public class DataChannelHandler extends SimpleChannelInboundHandler<WireMessage> {

    private final DataServicer servicer;
    private final Executor executor;
    private final int inboundHighWater;
    private final int inboundLowWater;

    private ChannelInboundStream inbound;
    private ChannelOutboundStream outbound;
    private String clientId;

    public DataChannelHandler(DataServicer servicer, Executor executor, int inboundHighWater, int inboundLowWater) {
        this.servicer = servicer;
        this.executor = executor;
        this.inboundHighWater = inboundHighWater;
        this.inboundLowWater = inboundLowWater;
    }

    private String prefix() {
        return clientId != null ? LoggerUtil.clientPrefix(clientId) : "[client ?] ";
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        LoggerUtil.debug(() -> "Data connection ESTABLISHED | remote=" + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WireMessage msg) {
        if (msg instanceof ConnectionHeader header) {
            if (inbound != null) {
                reject(ctx, "Duplicate hello frame");
                return;
            }
            startStream(ctx, header);
        } else if (msg instanceof DataRequest request) {
            if (inbound == null) {
                reject(ctx, "Request received before hello frame");
                return;
            }
            inbound.offer(request);
        } else {
            reject(ctx, "Unexpected frame from client: " + msg.getClass().getSimpleName());
        }
    }

    private void startStream(ChannelHandlerContext ctx, ConnectionHeader header) {
        ConnectionMetadata metadata = ConnectionMetadata.from(header);
        clientId = metadata.clientId();
        inbound = new ChannelInboundStream(ctx.channel(), inboundHighWater, inboundLowWater);
        outbound = new ChannelOutboundStream(ctx.channel());
        ChannelInboundStream in = inbound;
        ChannelOutboundStream out = outbound;
        try {
            executor.execute(() -> servicer.datapath(metadata, in, out));
        } catch (RejectedExecutionException e) {
            LoggerUtil.warn(prefix() + "Dataplane executor rejected connection: " + e.getMessage());
            out.close(StreamStatus.of(StatusCode.UNAVAILABLE, "Server is shutting down"));
        }
    }

    private void reject(ChannelHandlerContext ctx, String reason) {
        LoggerUtil.warn(prefix() + reason + ", closing connection");
        StreamStatus status = StreamStatus.of(StatusCode.INVALID_ARGUMENT, reason);
        if (outbound == null) {
            ctx.writeAndFlush(status).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        // the running data path closes the same stream; only the first status goes out
        outbound.close(status);
        inbound.fail(new IllegalStateException(reason));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        LoggerUtil.debug(() -> prefix() + "Data connection CLOSED");
        if (inbound != null) {
            inbound.complete();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LoggerUtil.error(prefix() + "Pipeline error: " + cause);
        if (inbound != null) {
            inbound.fail(cause);
        }
        ctx.close();
    }
}
