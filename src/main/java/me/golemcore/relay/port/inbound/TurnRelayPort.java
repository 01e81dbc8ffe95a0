package me.golemcore.relay.port.inbound;

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

import me.golemcore.relay.domain.model.TurnRequest;
import me.golemcore.relay.port.outbound.ChatTransportPort;

import java.util.concurrent.CompletableFuture;

/**
 * Inbound port used by chat channels to hand a user message to the agent.
 */
public interface TurnRelayPort {

    /**
     * Runs one agent turn for the message and streams its progress and answer
     * into the thread through {@code transport}. Turns of the same thread run
     * one after another.
     *
     * @return completes when the turn's last message has been delivered;
     *         completes exceptionally only when even the error message could not
     *         be delivered
     */
    CompletableFuture<Void> relay(ChatTransportPort transport, TurnRequest request);

    /**
     * Whether a turn for the thread of this transport is running or queued.
     */
    boolean isBusy(ChatTransportPort transport, String threadId);
}
