package me.golemcore.relay.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.relay.domain.model.DeliveredMessage;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to a chat platform thread. Implementations own the platform
 * wire payloads, authentication and rate limits; the relay only posts, edits
 * and recalls markdown bodies.
 */
public interface ChatTransportPort {

    /**
     * Returns the transport type identifier (e.g., "telegram", "dingtalk").
     */
    String getTransportType();

    /**
     * Posts a new markdown message into the thread.
     */
    CompletableFuture<DeliveredMessage> post(String threadId, String content);

    /**
     * Whether {@link #edit} is natively supported. Transports that return false
     * get edits emulated by sending a replacement and recalling the old message.
     */
    default boolean supportsEdit() {
        return false;
    }

    /**
     * Replaces the content of a previously posted message. Default
     * implementation fails with {@link UnsupportedOperationException}.
     */
    default CompletableFuture<DeliveredMessage> edit(String threadId, String messageId, String content) {
        return CompletableFuture.failedFuture(
                new UnsupportedOperationException(getTransportType() + " does not support message edits"));
    }

    /**
     * Retracts a message by its recall handle. Best effort: the returned future
     * completes exceptionally when the platform refuses.
     */
    CompletableFuture<Void> recall(String threadId, String recallHandle);
}
