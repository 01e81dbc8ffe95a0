package me.golemcore.relay.domain.render;

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
import me.golemcore.relay.domain.model.ActionEvent;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionPhase;
import me.golemcore.relay.domain.model.AgentAction;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Formats agent actions as single progress lines.
 *
 * <p>
 * Compact lines look like {@code ▸ `ls -la`} while running and
 * {@code ✗ `make` (exit 2)} once finished. The detailed form shows the tool
 * name in bold followed by a fenced preview of its input or output.
 */
@Component
public class ActionLineFormatter {

    static final String STATUS_RUNNING = "▸";
    static final String STATUS_DONE = "✓";
    static final String STATUS_FAIL = "✗";

    private static final int MAX_LISTED_CHANGES = 3;
    private static final int INPUT_PREVIEW_CHARS = 200;
    private static final int OUTPUT_PREVIEW_CHARS = 300;

    private final ObjectMapper objectMapper;
    private final int commandWidth;
    private final boolean detailed;

    public ActionLineFormatter(RelayProperties properties, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.commandWidth = properties.getRender().getCommandWidth();
        this.detailed = properties.getRender().isDetailedActions();
    }

    public String formatLine(ActionEvent event) {
        AgentAction action = event.action();
        if (detailed) {
            return event.phase() == ActionPhase.STARTED
                    ? formatDetailedStart(action)
                    : formatDetailedCompletion(action, event.ok());
        }
        if (event.phase() == ActionPhase.STARTED) {
            return STATUS_RUNNING + " " + formatTitle(action);
        }
        Integer exitCode = action.exitCode();
        return status(event.ok(), exitCode) + " " + formatTitle(action) + suffix(exitCode);
    }

    public String formatTitle(AgentAction action) {
        String title = action.title() != null ? action.title() : "";
        String toolName = action.toolName();
        return switch (action.kind()) {
            case COMMAND -> "`" + shorten(title, commandWidth) + "`";
            case TOOL -> namedTitle(toolName, title, "tool: ");
            case WEB_SEARCH -> namedTitle(toolName, title, "searched: ");
            case SUBAGENT -> namedTitle(toolName, title, "subagent: ");
            case FILE_CHANGE -> fileChangeTitle(action, title);
        };
    }

    static String shorten(String text, int width) {
        if (width <= 0) {
            return "";
        }
        if (text.length() <= width) {
            return text;
        }
        return text.substring(0, width - 1) + "…";
    }

    private String namedTitle(String toolName, String title, String fallbackPrefix) {
        if (toolName != null && !title.isEmpty() && !toolName.equals(title)) {
            return toolName + " · " + shorten(title, commandWidth);
        }
        return toolName != null ? toolName : fallbackPrefix + shorten(title, commandWidth);
    }

    private String fileChangeTitle(AgentAction action, String title) {
        List<String> rendered = new ArrayList<>();
        if (action.detail().get(AgentAction.DETAIL_CHANGES) instanceof List<?> changes) {
            for (Object raw : changes) {
                if (raw instanceof Map<?, ?> change && change.get("path") instanceof String path && !path.isEmpty()) {
                    Object kind = change.get("kind");
                    String verb = kind instanceof String verbText && !verbText.isEmpty() ? verbText : "update";
                    rendered.add(verb + " `" + path + "`");
                }
            }
        }
        if (rendered.isEmpty()) {
            return "files: " + shorten(title, commandWidth);
        }
        if (rendered.size() > MAX_LISTED_CHANGES) {
            int remaining = rendered.size() - MAX_LISTED_CHANGES;
            String listed = String.join(", ", rendered.subList(0, MAX_LISTED_CHANGES));
            return "files: " + shorten(listed + ", …(" + remaining + " more)", commandWidth);
        }
        return "files: " + shorten(String.join(", ", rendered), commandWidth);
    }

    private String formatDetailedStart(AgentAction action) {
        String toolName = action.toolName() != null ? action.toolName() : "tool";
        if (action.kind() == ActionKind.FILE_CHANGE) {
            return "🔧 **" + toolName + "**";
        }
        String preview = jsonPreview(action.detail().get(AgentAction.DETAIL_INPUT), INPUT_PREVIEW_CHARS);
        return "🔧 **" + toolName + "**\n```\n" + preview + "\n```";
    }

    private String formatDetailedCompletion(AgentAction action, Boolean ok) {
        String toolName = action.toolName() != null ? action.toolName() : "tool";
        Integer exitCode = action.exitCode();
        boolean success = !Boolean.FALSE.equals(ok) && (exitCode == null || exitCode == 0);
        String icon = success ? "✅" : "❌";
        Object output = action.detail().get(AgentAction.DETAIL_OUTPUT_PREVIEW);
        if (output == null) {
            output = action.detail().get(AgentAction.DETAIL_ERROR);
        }
        if (action.kind() == ActionKind.FILE_CHANGE || output == null) {
            return icon + " **" + toolName + "**";
        }
        return icon + " **" + toolName + "**:\n```\n" + jsonPreview(output, OUTPUT_PREVIEW_CHARS) + "\n```";
    }

    private String jsonPreview(Object data, int maxLength) {
        String json;
        if (data instanceof String text) {
            json = text;
        } else {
            try {
                json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
            } catch (JsonProcessingException e) {
                json = String.valueOf(data);
            }
        }
        return json.length() > maxLength ? json.substring(0, maxLength) + "..." : json;
    }

    private static String status(Boolean ok, Integer exitCode) {
        if (ok != null) {
            return ok ? STATUS_DONE : STATUS_FAIL;
        }
        return exitCode != null && exitCode != 0 ? STATUS_FAIL : STATUS_DONE;
    }

    private static String suffix(Integer exitCode) {
        return exitCode != null && exitCode != 0 ? " (exit " + exitCode + ")" : "";
    }
}
