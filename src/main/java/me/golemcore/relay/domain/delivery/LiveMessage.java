package me.golemcore.relay.domain.delivery;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveredMessage;
import me.golemcore.relay.port.outbound.ChatTransportPort;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The single progress message of a turn, replaced in place as the turn
 * advances.
 *
 * <p>
 * Transports with native edit get their edits chained so that at most one is
 * in flight and they land in order. Other transports go through the
 * {@link EditEmulator}. A transport that rejects an edit with
 * {@link UnsupportedOperationException} is switched to emulation for the rest
 * of the turn.
 */
@Slf4j
public class LiveMessage {

    private final ChatTransportPort transport;
    private final EditEmulator emulator;
    private final String threadId;

    private DeliveredMessage current;
    private String lastContent;
    private boolean emulated;
    private CompletableFuture<DeliveredMessage> tail;

    public LiveMessage(ChatTransportPort transport, EditEmulator emulator, String threadId,
            DeliveredMessage initial) {
        this.transport = transport;
        this.emulator = emulator;
        this.threadId = threadId;
        this.current = Objects.requireNonNull(initial, "initial");
        this.tail = CompletableFuture.completedFuture(initial);
        if (!transport.supportsEdit()) {
            switchToEmulation();
        }
    }

    /**
     * Replaces the content of the message. Identical consecutive content is not
     * sent again.
     */
    public synchronized CompletableFuture<DeliveredMessage> update(String content) {
        if (content.equals(lastContent)) {
            return tail;
        }
        lastContent = content;
        if (emulated) {
            return emulator.queueEdit(threadId, content).thenApply(this::remember);
        }
        tail = tail.handle((ignored, error) -> null).thenCompose(ignored -> deliver(content, false));
        return tail;
    }

    /**
     * Delivers the final content of the message, bypassing any debounce.
     */
    public synchronized CompletableFuture<DeliveredMessage> finish(String content) {
        lastContent = content;
        if (emulated) {
            return emulator.flushNow(threadId, content).thenApply(this::remember);
        }
        tail = tail.handle((ignored, error) -> null).thenCompose(ignored -> deliver(content, true));
        return tail;
    }

    public synchronized DeliveredMessage current() {
        return current;
    }

    public synchronized boolean isEmulated() {
        return emulated;
    }

    private CompletableFuture<DeliveredMessage> deliver(String content, boolean last) {
        String messageId;
        synchronized (this) {
            if (emulated) {
                return emulate(content, last);
            }
            messageId = current.messageId();
        }
        CompletableFuture<DeliveredMessage> edit;
        try {
            edit = transport.edit(threadId, messageId, content);
        } catch (UnsupportedOperationException e) {
            edit = CompletableFuture.failedFuture(e);
        }
        return edit.handle((delivered, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(remember(delivered));
            }
            Throwable cause = EditEmulator.unwrap(error);
            if (cause instanceof UnsupportedOperationException) {
                log.info("[LiveMessage] {} rejected edit, emulating: thread={}", transport.getTransportType(),
                        threadId);
                synchronized (this) {
                    switchToEmulation();
                }
                return emulate(content, last);
            }
            return CompletableFuture.<DeliveredMessage>failedFuture(cause);
        }).thenCompose(future -> future);
    }

    private CompletableFuture<DeliveredMessage> emulate(String content, boolean last) {
        CompletableFuture<DeliveredMessage> result = last
                ? emulator.flushNow(threadId, content)
                : emulator.queueEdit(threadId, content);
        return result.thenApply(this::remember);
    }

    private void switchToEmulation() {
        if (!emulated) {
            emulated = true;
            emulator.trackMessage(threadId, current.recallHandle());
        }
    }

    private synchronized DeliveredMessage remember(DeliveredMessage delivered) {
        if (delivered != null) {
            current = delivered;
        }
        return current;
    }
}
