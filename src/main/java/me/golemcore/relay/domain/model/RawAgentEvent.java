package me.golemcore.relay.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * One JSON-decoded line of the agent's output stream.
 *
 * <p>
 * The {@code type} discriminator is one of {@code step_start},
 * {@code step_finish}, {@code tool_use}, {@code text} or {@code error};
 * unknown types are tolerated and ignored by the translator. The shape of
 * {@code part} depends on the type. {@code error} and {@code message} are only
 * populated for error events.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawAgentEvent(
        String type,
        @JsonProperty("sessionID") String sessionId,
        Number timestamp,
        Map<String, Object> part,
        Object error,
        Object message) {

    public static final String STEP_START = "step_start";
    public static final String STEP_FINISH = "step_finish";
    public static final String TOOL_USE = "tool_use";
    public static final String TEXT = "text";
    public static final String ERROR = "error";

    public Map<String, Object> partOrEmpty() {
        return part != null ? part : Map.of();
    }
}
