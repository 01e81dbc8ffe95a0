package me.golemcore.relay.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.port.outbound.AgentRunnerPort;
import me.golemcore.relay.port.outbound.ChatTransportPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration of the relay: shared infrastructure beans and startup
 * logging.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RelayConfiguration {

    private final RelayProperties properties;
    private final AgentRunnerPort agentRunner;
    private final List<ChatTransportPort> transports;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Executor running agent turns. Each turn blocks one thread while the agent
     * process runs.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService relayTurnExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getTurn().getExecutorThreads()), r -> {
            Thread t = new Thread(r, "relay-turn-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Relay starting...");
        log.info("Agent: {} (command: {}, model: {})", agentRunner.getEngine(), properties.getAgent().getCommand(),
                properties.getAgent().getModel() != null ? properties.getAgent().getModel() : "default");
        log.info("Reply mode: {}", properties.getReplyMode());
        log.info("Transports: {}", transports.stream()
                .map(t -> t.getTransportType() + (t.supportsEdit() ? "" : " (emulated edit)"))
                .toList());
    }
}
