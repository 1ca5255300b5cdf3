/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.utils;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide console logger.
 *
 * <p>Lines are written to stdout as {@code [timestamp][LEVEL] message}. Debug output is
 * off unless enabled from configuration ({@code log.debug=true}).
 */
public final class LoggerUtil {
    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");
    private static volatile boolean silent = false;
    private static volatile boolean debugEnabled = false;

    /** Keys already emitted through {@link #warnOnce(String, String)}. */
    private static final Set<String> onceKeys = ConcurrentHashMap.newKeySet();

    public static void log(String level, String msg) {
        if (silent) return;
        String line = "[" + TS.format(LocalDateTime.now()) + "][" + level + "][" + Thread.currentThread().getName() + "] " + msg;
        System.out.println(line);
    }

    public static void info(String msg) { log("INFO", msg); }
    public static void warn(String msg) { log("WARN", msg); }
    public static void error(String msg) { log("ERROR", msg); }
    public static void debug(String msg) { if (debugEnabled) log("DEBUG", msg); }
    public static void debug(Supplier<String> msgSupplier) {
        if (debugEnabled && !silent) {
            log("DEBUG", msgSupplier.get());
        }
    }

    /**
     * Logs an error together with the stack trace of its cause.
     *
     * @param msg description of what failed
     * @param cause the exception that caused the failure (may be null)
     */
    public static void error(String msg, Throwable cause) {
        if (cause == null) {
            error(msg);
            return;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        log("ERROR", msg + System.lineSeparator() + trace.toString().stripTrailing());
    }

    /**
     * Logs a warning the first time a key is seen and ignores it afterwards.
     *
     * @param key deduplication key
     * @param msg warning text
     * @return true if the warning was emitted by this call
     */
    public static boolean warnOnce(String key, String msg) {
        if (!onceKeys.add(key)) {
            return false;
        }
        warn(msg);
        return true;
    }

    /**
     * Builds the standard per-client log prefix, e.g. {@code [client c1] }.
     */
    public static String clientPrefix(String clientId) {
        return "[client " + clientId + "] ";
    }

    public static boolean isDebugEnabled() { return debugEnabled && !silent; }
    public static void setDebugEnabled(boolean enabled) { debugEnabled = enabled; }

    public static void setSilent(boolean silent) { LoggerUtil.silent = silent; }

    /** Forgets which {@link #warnOnce} keys were emitted. Used by tests. */
    public static void resetOnceKeys() {
        onceKeys.clear();
    }

    private LoggerUtil() {}
}
