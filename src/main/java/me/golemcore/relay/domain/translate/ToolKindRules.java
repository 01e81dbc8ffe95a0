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

import me.golemcore.relay.domain.model.ActionKind;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default ordered rule set for classifying agent tool calls.
 *
 * <ol>
 * <li>a path-bearing input: write/edit/create tools are file changes, anything
 * else is a plain tool titled with the path</li>
 * <li>a {@code command} input is a shell command, titled with a bounded
 * preview</li>
 * <li>search/web tools are web searches</li>
 * <li>task/agent tools are subagents</li>
 * </ol>
 *
 * Calls no rule matches are classified as a plain {@link ActionKind#TOOL}.
 */
public final class ToolKindRules {

    static final List<String> PATH_KEYS = List.of("file_path", "filePath", "path");
    private static final String ELLIPSIS = "...";

    private ToolKindRules() {
    }

    public static List<ToolKindRule> defaults(int commandTitleMaxLength) {
        return List.of(
                pathRule(),
                commandRule(commandTitleMaxLength),
                nameRule(ActionKind.WEB_SEARCH, "search", "web"),
                nameRule(ActionKind.SUBAGENT, "task", "agent"));
    }

    public static ToolClassification classify(List<ToolKindRule> rules, String toolName, Map<String, Object> input) {
        for (ToolKindRule rule : rules) {
            Optional<ToolClassification> match = rule.classify(toolName, input);
            if (match.isPresent()) {
                return match.get();
            }
        }
        return ToolClassification.of(ActionKind.TOOL, toolName);
    }

    static ToolKindRule pathRule() {
        return (toolName, input) -> {
            for (String key : PATH_KEYS) {
                if (input.get(key) instanceof String path && !path.isEmpty()) {
                    ActionKind kind = nameContains(toolName, "write", "edit", "create")
                            ? ActionKind.FILE_CHANGE
                            : ActionKind.TOOL;
                    return Optional.of(new ToolClassification(kind, path, path));
                }
            }
            return Optional.empty();
        };
    }

    static ToolKindRule commandRule(int maxLength) {
        return (toolName, input) -> {
            if (input.get("command") instanceof String command && !command.isEmpty()) {
                return Optional.of(ToolClassification.of(ActionKind.COMMAND, shortenCommand(command, maxLength)));
            }
            return Optional.empty();
        };
    }

    static ToolKindRule nameRule(ActionKind kind, String... fragments) {
        return (toolName, input) -> nameContains(toolName, fragments)
                ? Optional.of(ToolClassification.of(kind, toolName))
                : Optional.empty();
    }

    static String shortenCommand(String command, int maxLength) {
        if (command.length() <= maxLength) {
            return command;
        }
        int keep = Math.max(0, maxLength - ELLIPSIS.length());
        return command.substring(0, keep) + ELLIPSIS;
    }

    private static boolean nameContains(String toolName, String... fragments) {
        String normalized = toolName.toLowerCase(Locale.ROOT);
        for (String fragment : fragments) {
            if (normalized.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
