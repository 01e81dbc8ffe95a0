package me.golemcore.relay.adapter.inbound.console;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.adapter.outbound.console.ConsoleTransportAdapter;
import me.golemcore.relay.domain.model.TurnRequest;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.TurnRelayPort;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;

/**
 * Local development channel: every line typed on stdin is one user message in
 * a single console thread. Enabled with {@code relay.console.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "relay.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleChannel implements ApplicationRunner {

    private static final String AUTHOR = "console";

    private final TurnRelayPort turnRelay;
    private final ConsoleTransportAdapter transport;
    private final RelayProperties properties;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        log.info("[Console] reading messages from stdin, one per line");
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        int turns = process(reader);
        log.info("[Console] stdin closed after {} turns", turns);
    }

    int process(BufferedReader reader) throws IOException {
        String threadId = properties.getConsole().getThreadId();
        int turns = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            TurnRequest request = TurnRequest.builder()
                    .threadId(threadId)
                    .sessionKey(threadId)
                    .prompt(line)
                    .authorName(AUTHOR)
                    .build();
            try {
                turnRelay.relay(transport, request).join();
                turns++;
            } catch (CompletionException e) {
                log.error("[Console] turn failed: {}", e.getCause() != null ? e.getCause().getMessage()
                        : e.getMessage());
            }
        }
        return turns;
    }
}
