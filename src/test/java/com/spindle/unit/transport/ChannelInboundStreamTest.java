/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.unit.transport;

import com.spindle.dataplane.StreamException;
import com.spindle.protocol.DataRequest;
import com.spindle.protocol.message.ConnectionInfoRequest;
import com.spindle.transport.ChannelInboundStream;
import com.spindle.utils.LoggerUtil;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ChannelInboundStream")
class ChannelInboundStreamTest {

    private EmbeddedChannel channel;
    private ChannelInboundStream stream;

    @BeforeEach
    void setUp() {
        LoggerUtil.setSilent(true);
        channel = new EmbeddedChannel();
        stream = new ChannelInboundStream(channel, 3, 1);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
        LoggerUtil.setSilent(false);
    }

    private static DataRequest request(int reqId) {
        return new DataRequest(reqId, new ConnectionInfoRequest());
    }

    @Test
    @DisplayName("should hand out requests in arrival order")
    void shouldPreserveOrder() throws Exception {
        stream.offer(request(1));
        stream.offer(request(2));

        assertEquals(1, stream.next().reqId());
        assertEquals(2, stream.next().reqId());
    }

    @Test
    @DisplayName("should pause reads at the high-water mark and resume at the low-water mark")
    void shouldApplyBackpressure() throws Exception {
        stream.offer(request(1));
        stream.offer(request(2));
        assertTrue(channel.config().isAutoRead());

        stream.offer(request(3));
        assertFalse(channel.config().isAutoRead());

        stream.next();
        assertFalse(channel.config().isAutoRead());
        stream.next();
        assertTrue(channel.config().isAutoRead());
    }

    @Test
    @DisplayName("should return null after completion, on every call")
    void shouldEndAfterComplete() throws Exception {
        stream.offer(request(1));
        stream.complete();

        assertNotNull(stream.next());
        assertNull(stream.next());
        assertNull(stream.next());
    }

    @Test
    @DisplayName("should raise StreamException after a transport failure")
    void shouldFailAfterTransportError() {
        stream.fail(new IOException("connection reset"));

        StreamException e = assertThrows(StreamException.class, stream::next);
        assertInstanceOf(IOException.class, e.getCause());
        assertThrows(StreamException.class, stream::next);
    }

    @Test
    @DisplayName("should drop requests offered after cancel")
    void shouldIgnoreOffersAfterCancel() throws Exception {
        stream.cancel();
        stream.offer(request(1));

        assertNull(stream.next());
    }

    @Test
    @DisplayName("should keep the first terminal state")
    void shouldKeepFirstTerminalState() throws Exception {
        stream.complete();
        stream.fail(new IOException("late"));

        assertNull(stream.next());
    }

    @Test
    @DisplayName("should reject inverted water marks")
    void shouldRejectInvalidWaterMarks() {
        assertThrows(IllegalArgumentException.class, () -> new ChannelInboundStream(channel, 2, 2));
    }
}
