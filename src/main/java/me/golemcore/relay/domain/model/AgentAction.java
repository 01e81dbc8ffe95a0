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

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single tool call of the agent, identified by the agent's call id.
 *
 * <p>
 * The {@code detail} map carries kind-specific data: {@code name},
 * {@code input}, {@code callID}, {@code changes} for file changes and, once
 * the call has finished, {@code output_preview}, {@code exit_code} and
 * {@code error}.
 */
@Builder
public record AgentAction(String id, ActionKind kind, String title, Map<String, Object> detail) {

    public static final String DETAIL_NAME = "name";
    public static final String DETAIL_INPUT = "input";
    public static final String DETAIL_CALL_ID = "callID";
    public static final String DETAIL_CHANGES = "changes";
    public static final String DETAIL_OUTPUT_PREVIEW = "output_preview";
    public static final String DETAIL_EXIT_CODE = "exit_code";
    public static final String DETAIL_ERROR = "error";

    public AgentAction {
        detail = detail != null ? Collections.unmodifiableMap(new LinkedHashMap<>(detail)) : Map.of();
    }

    /**
     * Returns a copy with the given entries merged into the detail map.
     */
    public AgentAction withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(detail);
        merged.putAll(extra);
        return new AgentAction(id, kind, title, merged);
    }

    public String toolName() {
        Object name = detail.get(DETAIL_NAME);
        return name instanceof String value ? value : null;
    }

    public Integer exitCode() {
        Object exit = detail.get(DETAIL_EXIT_CODE);
        return exit instanceof Number number ? number.intValue() : null;
    }
}
