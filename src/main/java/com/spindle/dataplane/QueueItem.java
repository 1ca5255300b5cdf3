/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.spindle.dataplane;

import com.spindle.protocol.DataRequest;
import com.spindle.protocol.DataResponse;

/**
 * Item on a connection's dispatch queue.
 *
 * <p>The intake reader puts {@link Inbound} requests and a final {@link EndOfStream};
 * asynchronous gets put {@link Completed} responses on the same queue so that the
 * dispatch loop wakes up without a second notification channel.
 */
public sealed interface QueueItem permits QueueItem.Inbound, QueueItem.Completed, QueueItem.EndOfStream {

    record Inbound(DataRequest request) implements QueueItem {
    }

    record Completed(DataResponse response) implements QueueItem {
    }

    final class EndOfStream implements QueueItem {
        public static final EndOfStream INSTANCE = new EndOfStream();

        private EndOfStream() {}

        @Override
        public String toString() {
            return "EndOfStream";
        }
    }
}
