/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.unit.protocol;

import com.spindle.protocol.ConnectionHeader;
import com.spindle.protocol.DataRequest;
import com.spindle.protocol.DataResponse;
import com.spindle.protocol.RequestKind;
import com.spindle.protocol.StatusCode;
import com.spindle.protocol.StreamStatus;
import com.spindle.protocol.codec.WireMessageCodec;
import com.spindle.protocol.message.GetRequest;
import com.spindle.protocol.message.GetResponse;
import com.spindle.protocol.message.InitRequest;
import com.spindle.protocol.message.PutRequest;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WireMessageCodec")
class WireMessageCodecTest {

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new WireMessageCodec());
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ByteBuf json(String text) {
        return Unpooled.copiedBuffer(text, StandardCharsets.UTF_8);
    }

    private String writeAndRead(Object msg) {
        assertTrue(channel.writeOutbound(msg));
        ByteBuf out = channel.readOutbound();
        try {
            return out.toString(StandardCharsets.UTF_8);
        } finally {
            out.release();
        }
    }

    @Nested
    @DisplayName("decode")
    class Decode {

        @Test
        @DisplayName("should decode the hello frame")
        void shouldDecodeHello() {
            channel.writeInbound(json("{\"type\":\"hello\",\"clientId\":\"c1\",\"reconnecting\":\"False\"}"));

            ConnectionHeader header = channel.readInbound();
            assertEquals("c1", header.clientId());
            assertEquals("False", header.reconnecting());
        }

        @Test
        @DisplayName("should decode a request with its payload kind")
        void shouldDecodeRequest() {
            channel.writeInbound(json("{\"type\":\"request\",\"reqId\":7,"
                    + "\"payload\":{\"kind\":\"get\",\"ids\":[\"a\",\"b\"],\"timeout\":1.5,\"asynchronous\":true}}"));

            DataRequest request = channel.readInbound();
            assertEquals(7, request.reqId());
            assertEquals(RequestKind.GET, request.kind());
            GetRequest get = (GetRequest) request.payload();
            assertEquals(List.of("a", "b"), get.ids());
            assertTrue(get.asynchronous());
        }

        @Test
        @DisplayName("should decode base64 put data")
        void shouldDecodePutData() {
            channel.writeInbound(json("{\"type\":\"request\",\"reqId\":1,"
                    + "\"payload\":{\"kind\":\"put\",\"data\":\"aGVsbG8=\"}}"));

            DataRequest request = channel.readInbound();
            assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), ((PutRequest) request.payload()).data());
        }

        @Test
        @DisplayName("should leave the payload empty for an unknown kind")
        void shouldNullifyUnknownKind() {
            channel.writeInbound(json("{\"type\":\"request\",\"reqId\":3,\"payload\":{\"kind\":\"teleport\"}}"));

            DataRequest request = channel.readInbound();
            assertEquals(3, request.reqId());
            assertNull(request.payload());
            assertNull(request.kind());
        }

        @Test
        @DisplayName("should reject malformed JSON")
        void shouldRejectMalformedJson() {
            assertThrows(DecoderException.class, () -> channel.writeInbound(json("{not json")));
        }

        @Test
        @DisplayName("should reject an unknown frame type")
        void shouldRejectUnknownFrameType() {
            assertThrows(DecoderException.class, () -> channel.writeInbound(json("{\"type\":\"bogus\"}")));
        }
    }

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("should tag responses with type and kind")
        void shouldEncodeResponse() {
            String text = writeAndRead(new DataResponse(5, GetResponse.found(List.of(new byte[]{1, 2, 3}))));

            assertTrue(text.contains("\"type\":\"response\""));
            assertTrue(text.contains("\"reqId\":5"));
            assertTrue(text.contains("\"kind\":\"get\""));
            assertTrue(text.contains("\"AQID\""));
        }

        @Test
        @DisplayName("should encode the final status without null details")
        void shouldEncodeStatus() {
            String text = writeAndRead(StreamStatus.ok());

            assertTrue(text.contains("\"type\":\"status\""));
            assertTrue(text.contains("\"code\":\"OK\""));
            assertFalse(text.contains("details"));
        }

        @Test
        @DisplayName("should produce frames the decoder reads back")
        void shouldDecodeWhatItEncodes() {
            String text = writeAndRead(new DataRequest(9, new InitRequest(Map.of("ns", "prod"), 30)));
            channel.writeInbound(json(text));

            DataRequest decoded = channel.readInbound();
            InitRequest init = (InitRequest) decoded.payload();
            assertEquals(30, init.reconnectGracePeriod());
            assertEquals("prod", init.jobConfig().get("ns"));
        }

        @Test
        @DisplayName("should carry error details in a status frame")
        void shouldEncodeErrorStatus() {
            String text = writeAndRead(StreamStatus.of(StatusCode.NOT_FOUND, "session gone"));

            assertTrue(text.contains("\"code\":\"NOT_FOUND\""));
            assertTrue(text.contains("\"details\":\"session gone\""));
        }
    }
}
