/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.utils;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.spindle.protocol.WireMessage;

/**
 * Shared ObjectMapper instances. ObjectMapper is thread-safe after configuration,
 * so a single instance serves every connection.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            // an unknown request kind decodes to a null payload and is rejected by the dispatcher
            .disable(DeserializationFeature.FAIL_ON_INVALID_SUBTYPE)
            // payloads such as connection_cleanup carry only their kind
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private static final ObjectReader WIRE_READER = INSTANCE.readerFor(WireMessage.class);
    private static final ObjectWriter WIRE_WRITER = INSTANCE.writerFor(WireMessage.class);

    private JacksonConfig() {}

    /** Standard ObjectMapper for general JSON serialization/deserialization. */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }

    /** Reader that resolves the {@code type} discriminator of a wire frame. */
    public static ObjectReader wireReader() {
        return WIRE_READER;
    }

    /** Writer that always emits the {@code type} discriminator, whatever the concrete frame class. */
    public static ObjectWriter wireWriter() {
        return WIRE_WRITER;
    }
}
