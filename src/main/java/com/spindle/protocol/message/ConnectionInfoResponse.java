/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol.message;

/**
 * Server facts a client checks for compatibility after connecting.
 *
 * @param numClients sessions currently counted against the admission threshold
 * @param javaVersion runtime version of the server JVM
 * @param serverVersion server build version
 * @param serverCommit server build commit
 * @param protocolVersion wire protocol revision
 */
public record ConnectionInfoResponse(int numClients,
                                     String javaVersion,
                                     String serverVersion,
                                     String serverCommit,
                                     String protocolVersion) implements ResponsePayload {
}
