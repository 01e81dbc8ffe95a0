package me.golemcore.relay.domain.translate;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.ActionEvent;
import me.golemcore.relay.domain.model.ActionKind;
import me.golemcore.relay.domain.model.ActionPhase;
import me.golemcore.relay.domain.model.AgentAction;
import me.golemcore.relay.domain.model.CompletedEvent;
import me.golemcore.relay.domain.model.RawAgentEvent;
import me.golemcore.relay.domain.model.ResumeToken;
import me.golemcore.relay.domain.model.StartedEvent;
import me.golemcore.relay.domain.model.StreamState;
import me.golemcore.relay.domain.model.TextDeltaEvent;
import me.golemcore.relay.domain.model.TextFinishedEvent;
import me.golemcore.relay.domain.model.TurnEvent;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventTranslatorTest {

    private static final String SESSION = "ses_abc123";
    private static final ResumeToken RESUME = new ResumeToken("opencode", SESSION);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EventTranslator translator;
    private StreamState state;

    @BeforeEach
    void setUp() {
        translator = new EventTranslator(new RelayProperties());
        state = new StreamState("opencode", "gpt-test");
    }

    private RawAgentEvent raw(String json) {
        try {
            return objectMapper.readValue(json, RawAgentEvent.class);
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
    }

    private List<TurnEvent> feed(String... lines) {
        List<TurnEvent> events = new ArrayList<>();
        for (String line : lines) {
            events.addAll(translator.translate(raw(line), state));
        }
        return events;
    }

    @Test
    void shouldTranslateCommandTurnIntoLifecycleEvents() {
        List<TurnEvent> events = feed(
                "{\"type\":\"step_start\",\"sessionID\":\"ses_abc123\",\"part\":{}}",
                "{\"type\":\"tool_use\",\"sessionID\":\"ses_abc123\",\"part\":{\"callID\":\"call_1\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"pending\",\"input\":{\"command\":\"ls\"}}}}",
                "{\"type\":\"tool_use\",\"sessionID\":\"ses_abc123\",\"part\":{\"callID\":\"call_1\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"completed\",\"input\":{\"command\":\"ls\"},\"output\":\"a b\","
                        + "\"metadata\":{\"exit\":0}}}}",
                "{\"type\":\"text\",\"sessionID\":\"ses_abc123\",\"part\":{\"text\":\"Done\"}}",
                "{\"type\":\"step_finish\",\"sessionID\":\"ses_abc123\",\"part\":{\"reason\":\"stop\"}}");

        assertEquals(5, events.size());

        StartedEvent started = assertInstanceOf(StartedEvent.class, events.get(0));
        assertEquals(RESUME, started.resume());
        assertEquals("opencode", started.title());
        assertEquals("gpt-test", started.model());

        ActionEvent actionStarted = assertInstanceOf(ActionEvent.class, events.get(1));
        assertEquals(ActionPhase.STARTED, actionStarted.phase());
        assertEquals(ActionKind.COMMAND, actionStarted.action().kind());
        assertEquals("ls", actionStarted.action().title());
        assertEquals("call_1", actionStarted.action().id());

        ActionEvent actionCompleted = assertInstanceOf(ActionEvent.class, events.get(2));
        assertEquals(ActionPhase.COMPLETED, actionCompleted.phase());
        assertEquals(Boolean.TRUE, actionCompleted.ok());
        assertEquals("a b", actionCompleted.action().detail().get(AgentAction.DETAIL_OUTPUT_PREVIEW));
        assertEquals(0, actionCompleted.action().exitCode());
        assertTrue(state.getPendingActions().isEmpty());

        TextDeltaEvent text = assertInstanceOf(TextDeltaEvent.class, events.get(3));
        assertEquals("Done", text.delta());
        assertEquals("Done", text.accumulated());

        CompletedEvent completed = assertInstanceOf(CompletedEvent.class, events.get(4));
        assertTrue(completed.ok());
        assertEquals("Done", completed.answer());
        assertEquals(RESUME, completed.resume());
    }

    @Test
    void shouldNormalizeErrorWithoutSessionIntoFailedCompletion() {
        List<TurnEvent> events = feed("{\"type\":\"error\",\"message\":{\"data\":{\"message\":\"rate limited\"}}}");

        assertEquals(1, events.size());
        CompletedEvent completed = assertInstanceOf(CompletedEvent.class, events.get(0));
        assertFalse(completed.ok());
        assertEquals("rate limited", completed.error());
        assertNull(completed.resume());
        assertEquals("", completed.answer());
    }

    @Test
    void shouldEmitStartedOnlyOnceAcrossSteps() {
        List<TurnEvent> events = feed(
                "{\"type\":\"step_start\",\"sessionID\":\"ses_abc123\"}",
                "{\"type\":\"step_finish\",\"part\":{\"reason\":\"tool-calls\"}}",
                "{\"type\":\"step_start\",\"sessionID\":\"ses_abc123\"}");

        assertEquals(1, events.stream().filter(StartedEvent.class::isInstance).count());
        assertEquals(2, state.getNoteSeq());
        assertTrue(state.isStepFinishSeen());
    }

    @Test
    void shouldWaitForSessionIdBeforeStarted() {
        assertTrue(feed("{\"type\":\"step_start\"}").isEmpty());

        List<TurnEvent> events = feed("{\"type\":\"step_start\",\"sessionID\":\"ses_late\"}");

        StartedEvent started = assertInstanceOf(StartedEvent.class, events.get(0));
        assertEquals("ses_late", started.resume().value());
    }

    @Test
    void shouldKeepFirstSessionId() {
        feed("{\"type\":\"step_start\",\"sessionID\":\"ses_first\"}",
                "{\"type\":\"text\",\"sessionID\":\"ses_second\",\"part\":{\"text\":\"x\"}}");

        assertEquals("ses_first", state.getSessionId());
    }

    @Test
    void shouldFinishTextBeforeToolCalls() {
        List<TurnEvent> events = feed(
                "{\"type\":\"text\",\"part\":{\"text\":\"Let me \"}}",
                "{\"type\":\"text\",\"part\":{\"text\":\"check.\"}}",
                "{\"type\":\"step_finish\",\"part\":{\"reason\":\"tool-calls\"}}");

        TextDeltaEvent second = assertInstanceOf(TextDeltaEvent.class, events.get(1));
        assertEquals("Let me check.", second.accumulated());
        TextFinishedEvent finished = assertInstanceOf(TextFinishedEvent.class, events.get(2));
        assertEquals("Let me check.", finished.text());
        assertNull(state.getAccumulatedText());
    }

    @Test
    void shouldNotFinishEmptyText() {
        List<TurnEvent> events = feed("{\"type\":\"step_finish\",\"part\":{\"reason\":\"tool-calls\"}}");

        assertTrue(events.isEmpty());
    }

    @Test
    void shouldAnswerWithTextOfLastStepOnly() {
        List<TurnEvent> events = feed(
                "{\"type\":\"text\",\"part\":{\"text\":\"thinking\"}}",
                "{\"type\":\"step_finish\",\"part\":{\"reason\":\"tool-calls\"}}",
                "{\"type\":\"text\",\"part\":{\"text\":\"final\"}}",
                "{\"type\":\"step_finish\",\"part\":{\"reason\":\"stop\"}}");

        CompletedEvent completed = assertInstanceOf(CompletedEvent.class, events.get(events.size() - 1));
        assertEquals("final", completed.answer());
    }

    @Test
    void shouldIgnoreEverythingAfterCompletion() {
        List<TurnEvent> events = feed(
                "{\"type\":\"step_start\",\"sessionID\":\"ses_abc123\"}",
                "{\"type\":\"step_finish\",\"part\":{\"reason\":\"stop\"}}",
                "{\"type\":\"error\",\"error\":\"late failure\"}",
                "{\"type\":\"text\",\"part\":{\"text\":\"late\"}}");

        assertEquals(2, events.size());
        assertTrue(events.get(1).isTerminal());
        assertTrue(state.isTerminated());
    }

    @Test
    void shouldSkipToolUseWithoutCallId() {
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"tool\":\"bash\",\"state\":{\"input\":{\"command\":\"ls\"}}}}");

        assertTrue(events.isEmpty());
    }

    @Test
    void shouldFallBackToPartIdAsCallId() {
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"id\":\"prt_9\",\"tool\":\"read\","
                        + "\"state\":{\"status\":\"running\",\"input\":{\"filePath\":\"src/App.java\"}}}}");

        ActionEvent action = assertInstanceOf(ActionEvent.class, events.get(0));
        assertEquals("prt_9", action.action().id());
        assertEquals(ActionKind.TOOL, action.action().kind());
        assertEquals("src/App.java", action.action().title());
        assertTrue(state.getPendingActions().containsKey("prt_9"));
    }

    @Test
    void shouldSkipEmptyTextDelta() {
        assertTrue(feed("{\"type\":\"text\",\"part\":{\"text\":\"\"}}").isEmpty());
        assertTrue(feed("{\"type\":\"text\",\"part\":{}}").isEmpty());
        assertNull(state.getAccumulatedText());
    }

    @Test
    void shouldReportFileChangesWithPath() {
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"callID\":\"c2\",\"tool\":\"write\","
                        + "\"state\":{\"status\":\"pending\",\"input\":{\"file_path\":\"README.md\"}}}}");

        AgentAction action = assertInstanceOf(ActionEvent.class, events.get(0)).action();
        assertEquals(ActionKind.FILE_CHANGE, action.kind());
        assertEquals("README.md", action.title());
        assertEquals(List.of(Map.of("path", "README.md", "kind", "update")),
                action.detail().get(AgentAction.DETAIL_CHANGES));
        assertEquals("write", action.toolName());
    }

    @Test
    void shouldPreferStateTitle() {
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"callID\":\"c3\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"running\",\"title\":\"List files\",\"input\":{\"command\":\"ls\"}}}}");

        assertEquals("List files", assertInstanceOf(ActionEvent.class, events.get(0)).action().title());
    }

    @Test
    void shouldFailActionOnNonZeroExit() {
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"callID\":\"c4\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"completed\",\"input\":{\"command\":\"make\"},\"output\":\"oops\","
                        + "\"metadata\":{\"exit\":2}}}}");

        ActionEvent action = assertInstanceOf(ActionEvent.class, events.get(0));
        assertEquals(Boolean.FALSE, action.ok());
        assertEquals(2, action.action().exitCode());
    }

    @Test
    void shouldFailActionOnErrorStatus() {
        feed("{\"type\":\"tool_use\",\"part\":{\"callID\":\"c5\",\"tool\":\"bash\","
                + "\"state\":{\"status\":\"running\",\"input\":{\"command\":\"rm x\"}}}}");
        List<TurnEvent> events = feed(
                "{\"type\":\"tool_use\",\"part\":{\"callID\":\"c5\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"error\",\"input\":{\"command\":\"rm x\"},\"error\":\"denied\"}}}");

        ActionEvent action = assertInstanceOf(ActionEvent.class, events.get(0));
        assertEquals(ActionPhase.COMPLETED, action.phase());
        assertEquals(Boolean.FALSE, action.ok());
        assertEquals("denied", action.message());
        assertEquals("denied", action.action().detail().get(AgentAction.DETAIL_ERROR));
        assertTrue(state.getPendingActions().isEmpty());
    }

    @Test
    void shouldTruncateOutputPreview() {
        RelayProperties properties = new RelayProperties();
        properties.getTranslate().setOutputPreviewMaxLength(5);
        EventTranslator shortPreview = new EventTranslator(properties);

        List<TurnEvent> events = shortPreview.translate(raw(
                "{\"type\":\"tool_use\",\"part\":{\"callID\":\"c6\",\"tool\":\"bash\","
                        + "\"state\":{\"status\":\"completed\",\"input\":{\"command\":\"cat\"},"
                        + "\"output\":\"0123456789\"}}}"),
                state);

        ActionEvent action = assertInstanceOf(ActionEvent.class, events.get(0));
        assertEquals("01234", action.action().detail().get(AgentAction.DETAIL_OUTPUT_PREVIEW));
        assertEquals(Boolean.TRUE, action.ok());
        assertNull(action.action().exitCode());
    }

    @Test
    void shouldIgnoreUnknownEventTypes() {
        assertTrue(feed("{\"type\":\"reasoning\",\"part\":{\"text\":\"hmm\"}}").isEmpty());
    }

    @Test
    void shouldExtractErrorMessagesFromPayloadShapes() {
        assertEquals("from data", EventTranslator.extractErrorMessage(Map.of("data", Map.of("message", "from data"))));
        assertEquals("plain", EventTranslator.extractErrorMessage(Map.of("message", "plain")));
        assertEquals("ProviderAuthError", EventTranslator.extractErrorMessage(Map.of("name", "ProviderAuthError")));
        assertEquals("opencode error", EventTranslator.extractErrorMessage(Map.of("code", 42)));
        assertEquals("opencode error", EventTranslator.extractErrorMessage(null));
        assertEquals("boom", EventTranslator.extractErrorMessage("boom"));
        assertEquals("42", EventTranslator.extractErrorMessage(42));
    }

    @Test
    void shouldPreferMessageOverErrorPayload() {
        List<TurnEvent> events = feed("{\"type\":\"error\",\"sessionID\":\"ses_abc123\","
                + "\"error\":{\"name\":\"Ignored\"},\"message\":\"visible\"}");

        CompletedEvent completed = assertInstanceOf(CompletedEvent.class, events.get(0));
        assertEquals("visible", completed.error());
        assertEquals(RESUME, completed.resume());
    }
}
