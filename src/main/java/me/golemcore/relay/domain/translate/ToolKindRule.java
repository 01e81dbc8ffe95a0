package me.golemcore.relay.domain.translate;

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

import java.util.Map;
import java.util.Optional;

/**
 * One predicate-to-classification rule over a tool call. Rules are evaluated
 * in order and the first non-empty result wins, so a new tool kind is added by
 * appending a rule.
 */
@FunctionalInterface
public interface ToolKindRule {

    /**
     * @param toolName
     *            tool name reported by the agent, never null
     * @param input
     *            tool input payload, never null
     */
    Optional<ToolClassification> classify(String toolName, Map<String, Object> input);
}
