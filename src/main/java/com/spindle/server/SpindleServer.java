/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.server;

import com.spindle.dataplane.DataBackend;
import com.spindle.dataplane.DataServicer;
import com.spindle.dataplane.SessionRegistry;
import com.spindle.protocol.ProtocolConstants;
import com.spindle.protocol.codec.WireMessageCodec;
import com.spindle.transport.DataChannelHandler;
import com.spindle.utils.LoggerUtil;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class SpindleServer {

    private final ServerConfig config;
    private final DataBackend backend;

    private ExecutorService dataplaneExecutor;
    private SessionRegistry registry;
    private DataServicer servicer;

    private NioEventLoopGroup bossGroup;
    private NioEventLoopGroup workerGroup;
    private Channel serverChannel;

    public SpindleServer(ServerConfig config, DataBackend backend) {
        this.config = config;
        this.backend = backend;
    }

    public void start() throws InterruptedException {
        dataplaneExecutor = Executors.newCachedThreadPool(namedThreads("spindle-dataplane"));
        registry = new SessionRegistry(backend, backend::shutdown, config.maxThreads());
        servicer = new DataServicer(backend, registry, dataplaneExecutor, config.queueJoinSeconds(),
                config.serverVersion(), config.serverCommit());

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            WireMessageCodec codec = new WireMessageCodec();
            ServerBootstrap sb = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<Channel>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            ch.pipeline().addLast("frame-decoder", new LengthFieldBasedFrameDecoder(
                                    config.maxFrameBytes(), 0, ProtocolConstants.LENGTH_FIELD_BYTES,
                                    0, ProtocolConstants.LENGTH_FIELD_BYTES));
                            ch.pipeline().addLast("frame-prepender",
                                    new LengthFieldPrepender(ProtocolConstants.LENGTH_FIELD_BYTES));
                            ch.pipeline().addLast("logger", new LoggingHandler("DATAPLANE", LogLevel.DEBUG));
                            ch.pipeline().addLast("codec", codec);
                            ch.pipeline().addLast("handler", new DataChannelHandler(servicer, dataplaneExecutor,
                                    config.inboundHighWater(), config.inboundLowWater()));
                        }
                    })
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(32 * 1024, 64 * 1024));

            LoggerUtil.info("Binding " + config.bindAddress() + ":" + config.port() + " ...");
            ChannelFuture bindFuture = sb.bind(config.bindAddress(), config.port()).sync();
            serverChannel = bindFuture.channel();
            LoggerUtil.info("Data-plane server ready on " + config.bindAddress() + ":" + boundPort()
                    + " (client threshold " + config.clientThreshold() + ")");
        } catch (Exception e) {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            dataplaneExecutor.shutdownNow();
            throw e;
        }
    }

    /** The port actually bound, useful when configured with port 0. */
    public int boundPort() {
        if (serverChannel == null) {
            return -1;
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public SessionRegistry getRegistry() {
        return registry;
    }

    public void stop() {
        try {
            if (registry != null) registry.stop();
            if (serverChannel != null && serverChannel.isOpen()) serverChannel.close().sync();
            if (bossGroup != null) bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
            if (workerGroup != null) workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
            if (dataplaneExecutor != null) {
                dataplaneExecutor.shutdown();
                if (!dataplaneExecutor.awaitTermination(config.queueJoinSeconds(), TimeUnit.SECONDS)) {
                    LoggerUtil.warn("Dataplane threads still running after " + config.queueJoinSeconds()
                            + "s, interrupting");
                    dataplaneExecutor.shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LoggerUtil.error("Interrupted while stopping server");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
