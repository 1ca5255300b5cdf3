/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.server;

import com.spindle.protocol.ProtocolConstants;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Validated server settings.
 *
 * <p>Read from {@code application.properties}; the {@code SPINDLE_SERVER_MAX_THREADS} and
 * {@code SPINDLE_SERVER_PORT} environment variables override the file.
 */
public record ServerConfig(int port,
                           String bindAddress,
                           int maxThreads,
                           long queueJoinSeconds,
                           int maxFrameBytes,
                           int inboundHighWater,
                           int inboundLowWater,
                           String serverVersion,
                           String serverCommit,
                           boolean debugLogging,
                           Map<String, String> runtimeEnvDefaults) {

    public static final String ENV_MAX_THREADS = "SPINDLE_SERVER_MAX_THREADS";
    public static final String ENV_PORT = "SPINDLE_SERVER_PORT";
    public static final String RUNTIME_ENV_PREFIX = "dataplane.runtime.env.";

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("server.port out of range: " + port);
        }
        if (maxThreads < 1) {
            throw new IllegalArgumentException("server.max.threads must be positive: " + maxThreads);
        }
        if (queueJoinSeconds < 0) {
            throw new IllegalArgumentException("dataplane.queue.join.seconds must not be negative: " + queueJoinSeconds);
        }
        if (maxFrameBytes < 1) {
            throw new IllegalArgumentException("dataplane.max.frame.bytes must be positive: " + maxFrameBytes);
        }
        if (inboundLowWater < 0 || inboundHighWater <= inboundLowWater) {
            throw new IllegalArgumentException("dataplane.inbound.high.water (" + inboundHighWater
                    + ") must exceed dataplane.inbound.low.water (" + inboundLowWater + ")");
        }
        runtimeEnvDefaults = runtimeEnvDefaults == null ? Map.of() : Map.copyOf(runtimeEnvDefaults);
    }

    public static ServerConfig fromProperties(Properties props) {
        return fromProperties(props, System.getenv());
    }

    public static ServerConfig fromProperties(Properties props, Map<String, String> env) {
        String portValue = env.getOrDefault(ENV_PORT, props.getProperty("server.port", "50051"));
        String maxThreadsValue = env.getOrDefault(ENV_MAX_THREADS, props.getProperty("server.max.threads", "100"));

        Map<String, String> runtimeEnv = new LinkedHashMap<>();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            if (key.startsWith(RUNTIME_ENV_PREFIX)) {
                runtimeEnv.put(key.substring(RUNTIME_ENV_PREFIX.length()), props.getProperty(key).trim());
            }
        }

        return new ServerConfig(
                parseInt("server.port", portValue),
                props.getProperty("bind.address", "0.0.0.0").trim(),
                parseInt("server.max.threads", maxThreadsValue),
                parseInt("dataplane.queue.join.seconds", props.getProperty("dataplane.queue.join.seconds", "10")),
                parseInt("dataplane.max.frame.bytes", props.getProperty("dataplane.max.frame.bytes",
                        String.valueOf(ProtocolConstants.DEFAULT_MAX_FRAME_BYTES))),
                parseInt("dataplane.inbound.high.water", props.getProperty("dataplane.inbound.high.water", "1024")),
                parseInt("dataplane.inbound.low.water", props.getProperty("dataplane.inbound.low.water", "256")),
                props.getProperty("server.version", "unknown").trim(),
                props.getProperty("server.commit", "unknown").trim(),
                Boolean.parseBoolean(props.getProperty("log.debug", "false").trim()),
                runtimeEnv);
    }

    /** Fresh clients are refused once this many sessions are active. */
    public int clientThreshold() {
        return maxThreads / 2;
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(newPort, bindAddress, maxThreads, queueJoinSeconds, maxFrameBytes,
                inboundHighWater, inboundLowWater, serverVersion, serverCommit, debugLogging, runtimeEnvDefaults);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }
}
