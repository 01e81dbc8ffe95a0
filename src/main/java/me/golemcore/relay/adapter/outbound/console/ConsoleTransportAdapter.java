package me.golemcore.relay.adapter.outbound.console;

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
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prints the thread to a terminal. The console cannot rewrite what it
 * printed, so edits are emulated: every replacement is printed as a new
 * message and the superseded one is marked as recalled.
 */
@Component
@Slf4j
public class ConsoleTransportAdapter implements ChatTransportPort {

    static final String TRANSPORT_TYPE = "console";

    private final PrintStream out;
    private final AtomicLong nextId = new AtomicLong(1);

    public ConsoleTransportAdapter() {
        this(System.out);
    }

    ConsoleTransportAdapter(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getTransportType() {
        return TRANSPORT_TYPE;
    }

    @Override
    public CompletableFuture<DeliveredMessage> post(String threadId, String content) {
        String id = TRANSPORT_TYPE + "-" + nextId.getAndIncrement();
        synchronized (out) {
            out.println("--- [" + threadId + "] " + id);
            out.println(content);
            out.flush();
        }
        return CompletableFuture.completedFuture(new DeliveredMessage(id, id));
    }

    @Override
    public CompletableFuture<Void> recall(String threadId, String recallHandle) {
        synchronized (out) {
            out.println("--- [" + threadId + "] " + recallHandle + " recalled");
            out.flush();
        }
        return CompletableFuture.completedFuture(null);
    }
}
