/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle;

import com.spindle.server.ServerConfig;
import com.spindle.server.SpindleServer;
import com.spindle.store.InMemoryObjectStore;
import com.spindle.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher for the data-plane server backed by the in-memory object store.
 */
public class SpindleApplication {

    private static SpindleServer server;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties properties = loadConfiguration();
            ServerConfig config = validateConfiguration(properties);
            LoggerUtil.setDebugEnabled(config.debugLogging());

            LoggerUtil.info("Starting Spindle data plane " + config.serverVersion()
                    + " on " + config.bindAddress() + ":" + config.port());
            server = new SpindleServer(config, new InMemoryObjectStore(config.runtimeEnvDefaults()));
            server.start();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down Spindle data plane...");
                shutdown();
            }));

            LoggerUtil.info("Spindle data plane started");
            shutdownLatch.await();
        } catch (Exception e) {
            LoggerUtil.error("Failed to start Spindle data plane: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Loads configuration from application.properties: classpath defaults first, then
     * {@code resources/application.properties} from the working directory as overrides.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        LoggerUtil.info("Loading default configuration from classpath resource");
        try (InputStream inputStream = SpindleApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {
            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }
            config.load(inputStream);
        }

        Path externalConfigPath = Paths.get("resources", "application.properties");
        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from external file: " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                LoggerUtil.info("Loaded external configuration overrides (" + externalConfig.size() + " properties)");
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load external configuration overrides: " + e.getMessage());
            }
        } else {
            LoggerUtil.info("No external configuration file found, using classpath defaults only");
        }
        return config;
    }

    static ServerConfig validateConfiguration(Properties properties) {
        LoggerUtil.info("Validating configuration...");
        ServerConfig config = ServerConfig.fromProperties(properties);
        LoggerUtil.info("Configuration validation passed (max threads " + config.maxThreads()
                + ", client threshold " + config.clientThreshold() + ")");
        return config;
    }

    private static void shutdown() {
        try {
            if (server != null) {
                server.stop();
            }
            LoggerUtil.info("Spindle data plane shutdown complete");
        } finally {
            shutdownLatch.countDown();
        }
    }
}
