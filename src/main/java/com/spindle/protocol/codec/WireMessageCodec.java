/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.codec;

import com.spindle.protocol.WireMessage;
import com.spindle.utils.JacksonConfig;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.MessageToMessageCodec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;

/**
 * Converts between length-delimited JSON frames and {@link WireMessage} objects.
 *
 * <p>Expects whole frames: it sits behind a {@code LengthFieldBasedFrameDecoder} on the way
 * in and in front of a {@code LengthFieldPrepender} on the way out.
 */
@ChannelHandler.Sharable
public class WireMessageCodec extends MessageToMessageCodec<ByteBuf, WireMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, WireMessage msg, List<Object> out) throws IOException {
        ByteBuf buf = ctx.alloc().buffer();
        try (OutputStream os = new ByteBufOutputStream(buf)) {
            JacksonConfig.wireWriter().writeValue(os, msg);
        } catch (IOException | RuntimeException e) {
            buf.release();
            throw e;
        }
        out.add(buf);
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        try (InputStream in = new ByteBufInputStream(frame)) {
            WireMessage message = JacksonConfig.wireReader().readValue(in);
            if (message == null) {
                throw new DecoderException("Empty frame");
            }
            out.add(message);
        } catch (IOException e) {
            throw new DecoderException("Malformed frame: " + e.getMessage(), e);
        }
    }
}
