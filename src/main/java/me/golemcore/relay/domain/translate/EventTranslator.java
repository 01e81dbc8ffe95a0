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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.ActionEvent;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.AgentAction;
import me.golemcore.relay.domain.model.CompletedEvent;
import me.golemcore.relay.domain.model.RawAgentEvent;
import me.golemcore.relay.domain.model.StartedEvent;
import me.golemcore.relay.domain.model.StreamState;
import me.golemcore.relay.domain.model.TextDeltaEvent;
import me.golemcore.relay.domain.model.TextFinishedEvent;
import me.golemcore.relay.domain.model.TurnEvent;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates raw OpenCode JSONL events into engine-agnostic
 * {@link TurnEvent}s.
 *
 * <p>
 * Pure state machine: the only side effect is the mutation of the
 * {@link StreamState} passed in. Per turn it produces at most one
 * {@link StartedEvent} and at most one {@link CompletedEvent}, and nothing
 * after the {@link CompletedEvent}.
 *
 * <p>
 * Rules:
 * <ul>
 * <li>{@code step_start} - emits {@code Started} once, as soon as a session
 * id is known</li>
 * <li>{@code tool_use} - emits an action start/completion; calls without an
 * id are dropped</li>
 * <li>{@code text} - appends a non-empty delta to the step's text</li>
 * <li>{@code step_finish} - {@code tool-calls} closes the step's text,
 * {@code stop} completes the turn</li>
 * <li>{@code error} - completes the turn as failed</li>
 * </ul>
 */
@Component
@Slf4j
public class EventTranslator {

    public static final String ENGINE = "opencode";
    static final String DEFAULT_ERROR_MESSAGE = "opencode error";

    private static final String STATUS_COMPLETED = "completed";
    private static final String STATUS_ERROR = "error";
    private static final String REASON_TOOL_CALLS = "tool-calls";
    private static final String REASON_STOP = "stop";

    private final String engine;
    private final List<ToolKindRule> rules;
    private final int outputPreviewMaxLength;

    public EventTranslator(RelayProperties properties) {
        this.engine = ENGINE;
        this.rules = ToolKindRules.defaults(properties.getTranslate().getCommandTitleMaxLength());
        this.outputPreviewMaxLength = properties.getTranslate().getOutputPreviewMaxLength();
    }

    public String getEngine() {
        return engine;
    }

    public List<TurnEvent> translate(RawAgentEvent event, StreamState state) {
        if (event == null || event.type() == null || state.isTerminated()) {
            return List.of();
        }
        state.rememberSessionId(event.sessionId());

        List<TurnEvent> events = switch (event.type()) {
            case RawAgentEvent.STEP_START -> onStepStart(state);
            case RawAgentEvent.TOOL_USE -> onToolUse(event, state);
            case RawAgentEvent.TEXT -> onText(event, state);
            case RawAgentEvent.STEP_FINISH -> onStepFinish(event, state);
            case RawAgentEvent.ERROR -> onError(event, state);
            default -> {
                log.debug("[EventTranslator] ignoring unknown event type: {}", event.type());
                yield List.of();
            }
        };

        if (events.stream().anyMatch(TurnEvent::isTerminal)) {
            state.markTerminated();
        }
        return events;
    }

    private List<TurnEvent> onStepStart(StreamState state) {
        state.nextNoteSeq();
        if (state.isStartedEmitted() || state.getSessionId() == null) {
            return List.of();
        }
        state.markStartedEmitted();
        return List.of(new StartedEvent(engine, state.resumeToken(engine), state.getTitle(), state.getModel()));
    }

    private List<TurnEvent> onToolUse(RawAgentEvent event, StreamState state) {
        Map<String, Object> part = event.partOrEmpty();
        Map<String, Object> toolState = asMap(part.get("state"));
        AgentAction action = extractAction(part, toolState);
        if (action == null) {
            log.debug("[EventTranslator] tool_use without call id, skipped");
            return List.of();
        }

        String status = asString(toolState.get("status"));
        if (STATUS_COMPLETED.equals(status)) {
            Integer exitCode = exitCode(toolState);
            Map<String, Object> detail = new LinkedHashMap<>();
            Object output = toolState.get("output");
            if (output != null) {
                detail.put(AgentAction.DETAIL_OUTPUT_PREVIEW, truncate(String.valueOf(output)));
            }
            detail.put(AgentAction.DETAIL_EXIT_CODE, exitCode);
            state.getPendingActions().remove(action.id());
            boolean ok = exitCode == null || exitCode == 0;
            return List.of(ActionEvent.completed(engine, action.withDetails(detail), ok, null));
        }

        if (STATUS_ERROR.equals(status)) {
            Object error = toolState.get("error");
            Map<String, Object> detail = new LinkedHashMap<>();
            if (error != null) {
                detail.put(AgentAction.DETAIL_ERROR, error);
            }
            detail.put(AgentAction.DETAIL_EXIT_CODE, exitCode(toolState));
            state.getPendingActions().remove(action.id());
            String message = error != null ? String.valueOf(error) : null;
            return List.of(ActionEvent.completed(engine, action.withDetails(detail), false, message));
        }

        state.getPendingActions().put(action.id(), action);
        return List.of(ActionEvent.started(engine, action));
    }

    private List<TurnEvent> onText(RawAgentEvent event, StreamState state) {
        if (!(event.partOrEmpty().get("text") instanceof String delta) || delta.isEmpty()) {
            return List.of();
        }
        String accumulated = state.appendText(delta);
        return List.of(new TextDeltaEvent(engine, delta, accumulated));
    }

    private List<TurnEvent> onStepFinish(RawAgentEvent event, StreamState state) {
        state.markStepFinishSeen();
        String reason = asString(event.partOrEmpty().get("reason"));

        if (REASON_TOOL_CALLS.equals(reason)) {
            String text = state.accumulatedTextOrEmpty();
            state.resetText();
            return text.isEmpty() ? List.of() : List.of(new TextFinishedEvent(engine, text));
        }
        if (REASON_STOP.equals(reason)) {
            return List.of(CompletedEvent.success(engine, state.accumulatedTextOrEmpty(), state.resumeToken(engine)));
        }
        return List.of();
    }

    private List<TurnEvent> onError(RawAgentEvent event, StreamState state) {
        Object raw = event.message() != null ? event.message() : event.error();
        String message = extractErrorMessage(raw);
        return List.of(CompletedEvent.failure(engine, state.accumulatedTextOrEmpty(), state.resumeToken(engine),
                message));
    }

    private AgentAction extractAction(Map<String, Object> part, Map<String, Object> toolState) {
        String callId = asString(part.get("callID"));
        if (callId == null || callId.isEmpty()) {
            callId = asString(part.get("id"));
        }
        if (callId == null || callId.isEmpty()) {
            return null;
        }

        String toolName = asString(part.get("tool"));
        if (toolName == null) {
            toolName = "tool";
        }
        Map<String, Object> input = asMap(toolState.get("input"));
        ToolClassification classification = ToolKindRules.classify(rules, toolName, input);

        String title = classification.title();
        if (toolState.get("title") instanceof String stateTitle && !stateTitle.isEmpty()) {
            title = stateTitle;
        }

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(AgentAction.DETAIL_NAME, toolName);
        detail.put(AgentAction.DETAIL_INPUT, input);
        detail.put(AgentAction.DETAIL_CALL_ID, callId);
        if (classification.kind() == ActionKind.FILE_CHANGE && classification.path() != null) {
            detail.put(AgentAction.DETAIL_CHANGES, List.of(Map.of("path", classification.path(), "kind", "update")));
        }

        return new AgentAction(callId, classification.kind(), title, detail);
    }

    static String extractErrorMessage(Object raw) {
        if (raw == null) {
            return DEFAULT_ERROR_MESSAGE;
        }
        if (!(raw instanceof Map<?, ?> payload)) {
            return String.valueOf(raw);
        }
        if (payload.get("data") instanceof Map<?, ?> data && data.get("message") instanceof String dataMessage) {
            return dataMessage;
        }
        if (payload.get("message") instanceof String message) {
            return message;
        }
        if (payload.get("name") instanceof String name) {
            return name;
        }
        return DEFAULT_ERROR_MESSAGE;
    }

    private Integer exitCode(Map<String, Object> toolState) {
        Object exit = asMap(toolState.get("metadata")).get("exit");
        return exit instanceof Number number ? number.intValue() : null;
    }

    private String truncate(String output) {
        return output.length() > outputPreviewMaxLength ? output.substring(0, outputPreviewMaxLength) : output;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    private static String asString(Object value) {
        return value instanceof String string ? string : null;
    }
}
