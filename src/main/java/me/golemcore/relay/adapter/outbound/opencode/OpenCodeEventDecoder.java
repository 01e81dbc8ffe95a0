package me.golemcore.relay.adapter.outbound.opencode;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.RawAgentEvent;

import java.util.Optional;

/**
 * Decodes one JSONL line of {@code opencode run --format json}. Lines that
 * are not a JSON object with a string {@code type} are skipped with a warning.
 */
@Slf4j
class OpenCodeEventDecoder {

    private static final int PREVIEW_CHARS = 100;

    private final ObjectMapper objectMapper;

    OpenCodeEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    Optional<RawAgentEvent> decode(String line) {
        try {
            RawAgentEvent event = objectMapper.readValue(line, RawAgentEvent.class);
            if (event == null || event.type() == null || event.type().isBlank()) {
                throw new IllegalArgumentException("missing event type");
            }
            return Optional.of(event);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[OpenCode] invalid JSONL line: {}", preview(line));
            log.debug("[OpenCode] decode failure", e);
            return Optional.empty();
        }
    }

    static String preview(String line) {
        return line.length() > PREVIEW_CHARS ? line.substring(0, PREVIEW_CHARS) : line;
    }
}
