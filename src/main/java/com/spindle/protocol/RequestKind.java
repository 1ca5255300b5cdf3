/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.protocol;

/**
 * Discriminator of a {@link DataRequest} payload.
 */
public enum RequestKind {
    INIT(true),
    GET(false),
    PUT(true),
    RELEASE(true),
    CONNECTION_INFO(true),
    PREP_RUNTIME_ENV(true),
    CONNECTION_CLEANUP(false),
    ACKNOWLEDGE(false);

    private final boolean cacheable;

    RequestKind(boolean cacheable) {
        this.cacheable = cacheable;
    }

    /**
     * Whether the response to this kind is kept for replay after a reconnect.
     *
     * <p>Gets are idempotent and their payloads can be large; acknowledgements and
     * cleanup requests are idempotent too. Everything else is cached.
     */
    public boolean isCacheable() {
        return cacheable;
    }
}
