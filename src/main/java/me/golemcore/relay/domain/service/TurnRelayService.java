package me.golemcore.relay.domain.service;

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
import me.golemcore.relay.domain.delivery.DelayScheduler;
import me.golemcore.relay.domain.delivery.DeliveryThrottle;
import me.golemcore.relay.domain.delivery.EditEmulator;
import me.golemcore.relay.domain.delivery.LiveMessage;
import me.golemcore.relay.domain.delivery.ThreadSerializer;
import me.golemcore.relay.domain.model.ActionEvent;
import me.golemcore.relay.domain.model.ActionPhase;
import me.golemcore.relay.domain.model.AgentRunRequest;
import me.golemcore.relay.domain.model.CompletedEvent;
import me.golemcore.relay.domain.model.DeliveredMessage;
import me.golemcore.relay.domain.model.ResumeToken;
import me.golemcore.relay.domain.model.StartedEvent;
import me.golemcore.relay.domain.model.TextDeltaEvent;
import me.golemcore.relay.domain.model.TextFinishedEvent;
import me.golemcore.relay.domain.model.TurnEvent;
import me.golemcore.relay.domain.model.TurnRequest;
import me.golemcore.relay.domain.render.ActionLineFormatter;
import me.golemcore.relay.domain.render.MessageRenderer;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.inbound.TurnRelayPort;
import me.golemcore.relay.port.outbound.AgentRunnerPort;
import me.golemcore.relay.port.outbound.ChatTransportPort;
import me.golemcore.relay.port.outbound.ResumeTokenStorePort;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Relays one user message through the agent and streams the turn into the
 * chat thread.
 *
 * <p>
 * Turns are serialized per thread and run on the turn executor. Each turn:
 * <ol>
 * <li>Resolves the resume token: an explicit resume command in the prompt, else
 * the stored session of the conversation.</li>
 * <li>Runs the agent, feeding every translated event into the turn's
 * renderer.</li>
 * <li>In {@link RelayProperties.ReplyMode#EDIT} mode keeps one live progress
 * message updated through the {@link DeliveryThrottle} and replaces it with the
 * final answer; in {@link RelayProperties.ReplyMode#INCREMENTAL} mode posts
 * intermediate texts and tool call batches as separate messages.</li>
 * <li>Stores the session of the agent for the next turn.</li>
 * </ol>
 * Any failure ends the turn with a visible error message.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnRelayService implements TurnRelayPort {

    static final String TOOL_CALLS_HEADER = "🔧 tool calls";

    private final RelayProperties properties;
    private final AgentRunnerPort agentRunner;
    private final ResumeTokenStorePort resumeTokenStore;
    private final MessageRenderer renderer;
    private final ActionLineFormatter actionLineFormatter;
    private final DelayScheduler delayScheduler;
    private final Clock clock;
    private final ExecutorService relayTurnExecutor;

    private final ThreadSerializer turnSerializer = new ThreadSerializer();
    private final Map<ChatTransportPort, EditEmulator> emulators = new IdentityHashMap<>();

    @Override
    public CompletableFuture<Void> relay(ChatTransportPort transport, TurnRequest request) {
        String prompt = request.getPrompt();
        if (prompt == null || prompt.isBlank()) {
            log.debug("[Relay] ignoring blank message: thread={}", request.getThreadId());
            return CompletableFuture.completedFuture(null);
        }
        String turnKey = turnKey(transport, request.getThreadId());
        if (turnSerializer.isBusy(turnKey)) {
            log.info("[Relay] turn queued behind running turn: thread={}", turnKey);
        }
        return turnSerializer.withLock(turnKey,
                () -> CompletableFuture.runAsync(() -> runTurn(transport, request), relayTurnExecutor));
    }

    @Override
    public boolean isBusy(ChatTransportPort transport, String threadId) {
        return turnSerializer.isBusy(turnKey(transport, threadId));
    }

    static String turnKey(ChatTransportPort transport, String threadId) {
        return transport.getTransportType() + ":" + threadId;
    }

    /**
     * Edit emulation state belongs to one transport instance: recall handles
     * are only valid on the instance that posted the message.
     */
    EditEmulator emulatorFor(ChatTransportPort transport) {
        synchronized (emulators) {
            return emulators.computeIfAbsent(transport, key -> new EditEmulator(transport, delayScheduler, clock,
                    properties.getEdit().getDebounce(), properties.getEdit().getMaxWait()));
        }
    }

    private void runTurn(ChatTransportPort transport, TurnRequest request) {
        String threadId = request.getThreadId();
        EditEmulator emulator = emulatorFor(transport);
        Turn turn = new Turn(transport, emulator, request);
        try {
            AgentRunRequest runRequest = buildRunRequest(request);
            log.info("[Relay] turn started: thread={}, author={}, resume={}", threadId, request.getAuthorName(),
                    runRequest.getResume() != null ? runRequest.getResume().value() : "new");
            turn.open();
            agentRunner.run(runRequest, turn::onEvent);
            turn.awaitDelivery();
            log.info("[Relay] turn finished: thread={}, elapsed={}", threadId,
                    MessageRenderer.formatElapsed(turn.elapsed()));
        } catch (RuntimeException e) { // NOSONAR - every failure becomes a visible error message
            log.error("[Relay] turn failed: thread={}", threadId, e);
            turn.fail(e);
        } finally {
            emulator.cleanup(threadId);
        }
    }

    AgentRunRequest buildRunRequest(TurnRequest request) {
        String model = request.getModel() != null ? request.getModel() : properties.getAgent().getModel();
        return AgentRunRequest.builder()
                .prompt(request.getPrompt())
                .resume(resolveResume(request))
                .model(model)
                .systemPrompt(buildSystemPrompt(request))
                .workingDirectory(resolveWorkingDirectory(request))
                .build();
    }

    private ResumeToken resolveResume(TurnRequest request) {
        ResumeToken explicit = agentRunner.extractResume(request.getPrompt());
        if (explicit != null) {
            return explicit;
        }
        if (request.getSessionKey() == null) {
            return null;
        }
        return resumeTokenStore.get(request.getSessionKey(), agentRunner.getEngine()).orElse(null);
    }

    String buildSystemPrompt(TurnRequest request) {
        List<String> parts = new ArrayList<>(2);
        String configured = properties.getAgent().getSystemPrompt();
        if (configured != null && !configured.isBlank()) {
            parts.add(configured.strip());
        }
        if (request.getAuthorName() != null && !request.getAuthorName().isBlank()) {
            parts.add("You are replying in a chat thread. The current message is from "
                    + request.getAuthorName() + ".");
        }
        return parts.isEmpty() ? null : String.join("\n\n", parts);
    }

    private Path resolveWorkingDirectory(TurnRequest request) {
        if (request.getWorkingDirectory() != null) {
            return request.getWorkingDirectory();
        }
        String configured = properties.getAgent().getWorkingDirectory();
        return configured != null && !configured.isBlank() ? Path.of(configured) : null;
    }

    private void storeResume(TurnRequest request, ResumeToken resume) {
        if (resume != null && request.getSessionKey() != null) {
            resumeTokenStore.set(request.getSessionKey(), resume);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    /**
     * State of one running turn. Event handling runs on the turn thread, throttled
     * flushes on the scheduler thread; shared fields are guarded by this object's
     * monitor.
     */
    private final class Turn {

        private final ChatTransportPort transport;
        private final EditEmulator emulator;
        private final TurnRequest request;
        private final String threadId;
        private final boolean editMode;
        private final Instant startedAt;
        private final Map<String, String> actionLines = new LinkedHashMap<>();
        private final List<String> toolCallBatch = new ArrayList<>();

        private DeliveryThrottle throttle;
        private LiveMessage liveMessage;
        private String streamingText;
        private String model;
        private CompletableFuture<Void> posts = CompletableFuture.completedFuture(null);
        private CompletableFuture<Void> finalDelivery;

        private Turn(ChatTransportPort transport, EditEmulator emulator, TurnRequest request) {
            this.transport = transport;
            this.emulator = emulator;
            this.request = request;
            this.threadId = request.getThreadId();
            this.editMode = properties.getReplyMode() == RelayProperties.ReplyMode.EDIT;
            this.startedAt = clock.instant();
            this.model = request.getModel() != null ? request.getModel() : properties.getAgent().getModel();
        }

        void open() {
            if (!editMode) {
                return;
            }
            DeliveredMessage placeholder = transport.post(threadId, properties.getRender().getPlaceholder()).join();
            LiveMessage message = new LiveMessage(transport, emulator, threadId, placeholder);
            DeliveryThrottle created = new DeliveryThrottle(clock, delayScheduler, this::currentInterval,
                    this::flushProgress);
            synchronized (this) {
                liveMessage = message;
                throttle = created;
            }
        }

        void onEvent(TurnEvent event) {
            if (event instanceof StartedEvent started) {
                onStarted(started);
            } else if (event instanceof ActionEvent action) {
                onAction(action);
            } else if (event instanceof TextDeltaEvent delta) {
                synchronized (this) {
                    streamingText = delta.accumulated();
                }
                requestFlush();
            } else if (event instanceof TextFinishedEvent finished) {
                onTextFinished(finished);
            } else if (event instanceof CompletedEvent completed) {
                onCompleted(completed);
            }
        }

        private void onStarted(StartedEvent event) {
            storeResume(request, event.resume());
            synchronized (this) {
                if (event.model() != null) {
                    model = event.model();
                }
            }
            log.info("[Relay] agent session: thread={}, session={}", threadId,
                    event.resume() != null ? event.resume().value() : null);
            if (throttle != null) {
                throttle.onStarted();
            }
        }

        private void onAction(ActionEvent event) {
            if (!properties.getRender().isShowActions()) {
                return;
            }
            String line = actionLineFormatter.formatLine(event);
            synchronized (this) {
                actionLines.put(event.action().id(), line);
                if (!editMode && event.phase() == ActionPhase.COMPLETED) {
                    toolCallBatch.add("- " + line);
                }
            }
            requestFlush();
        }

        private void onTextFinished(TextFinishedEvent event) {
            synchronized (this) {
                streamingText = null;
            }
            if (editMode) {
                requestFlush();
                return;
            }
            flushToolCallBatch();
            enqueuePost(event.text());
        }

        private void onCompleted(CompletedEvent event) {
            storeResume(request, event.resume());
            if (!event.ok()) {
                log.warn("[Relay] agent reported failure: thread={}, error={}", threadId, event.error());
            }
            if (throttle != null) {
                throttle.complete(() -> deliverFinal(event));
            } else {
                deliverFinal(event);
            }
        }

        private void requestFlush() {
            if (throttle != null) {
                throttle.requestFlush(false);
            }
        }

        private Duration currentInterval() {
            synchronized (this) {
                return streamingText != null && !streamingText.isEmpty()
                        ? properties.getThrottle().getTextInterval()
                        : properties.getThrottle().getActionInterval();
            }
        }

        private void flushProgress() {
            String body;
            synchronized (this) {
                body = renderer.renderProgress(elapsed(), new ArrayList<>(actionLines.values()), streamingText);
            }
            liveMessage.update(body).whenComplete((delivered, error) -> {
                if (error == null) {
                    return;
                }
                Throwable cause = unwrap(error);
                if (cause instanceof CancellationException) {
                    log.debug("[Relay] progress update superseded: thread={}", threadId);
                } else {
                    log.warn("[Relay] progress update failed: thread={}: {}", threadId, cause.getMessage());
                }
            });
        }

        private void deliverFinal(CompletedEvent event) {
            List<String> messages = renderFinal(event);
            CompletableFuture<Void> delivery;
            if (liveMessage != null) {
                delivery = liveMessage.finish(messages.get(0)).thenCompose(ignored -> {
                    CompletableFuture<Void> rest = CompletableFuture.completedFuture(null);
                    for (String message : messages.subList(1, messages.size())) {
                        rest = rest.thenCompose(done -> postMessage(message));
                    }
                    return rest;
                });
            } else {
                flushToolCallBatch();
                for (String message : messages) {
                    enqueuePost(message);
                }
                delivery = posts;
            }
            synchronized (this) {
                finalDelivery = delivery;
            }
        }

        private List<String> renderFinal(CompletedEvent event) {
            String currentModel;
            synchronized (this) {
                currentModel = model;
            }
            if (event.ok()) {
                return renderer.renderFinal(true, event.answer(), elapsed(), currentModel);
            }
            String error = event.error() != null && !event.error().isBlank()
                    ? event.error()
                    : agentRunner.getEngine() + " error";
            String body = event.answer().isBlank() ? error : event.answer() + "\n\n" + error;
            return renderer.renderFinal(false, body, elapsed(), currentModel);
        }

        private void flushToolCallBatch() {
            List<String> batch;
            synchronized (this) {
                if (toolCallBatch.isEmpty()) {
                    return;
                }
                batch = new ArrayList<>(toolCallBatch);
                toolCallBatch.clear();
            }
            enqueuePost(TOOL_CALLS_HEADER + "\n\n" + String.join("\n", batch));
        }

        private void enqueuePost(String content) {
            if (content == null || content.isBlank()) {
                return;
            }
            synchronized (this) {
                posts = posts.thenCompose(done -> postMessage(content));
            }
        }

        void awaitDelivery() {
            CompletableFuture<Void> delivery;
            synchronized (this) {
                delivery = finalDelivery;
            }
            if (delivery == null) {
                throw new AgentRunException(agentRunner.getEngine() + " finished without a result");
            }
            delivery.join();
        }

        void fail(RuntimeException error) {
            if (throttle != null) {
                throttle.complete(() -> {
                });
            }
            String body = renderer.renderError(describe(error));
            LiveMessage message;
            synchronized (this) {
                message = liveMessage;
            }
            if (message != null) {
                try {
                    message.finish(body).join();
                    return;
                } catch (RuntimeException e) { // NOSONAR - fall back to a plain post
                    log.warn("[Relay] could not replace progress message with error: thread={}: {}", threadId,
                            describe(e));
                }
            }
            try {
                transport.post(threadId, body).join();
            } catch (RuntimeException e) {
                log.error("[Relay] could not deliver error message: thread={}", threadId, e);
                throw e;
            }
        }

        private CompletableFuture<Void> postMessage(String content) {
            return transport.post(threadId, content).thenAccept(sent -> log.debug(
                    "[Relay] posted message: thread={}, id={}", threadId, sent != null ? sent.messageId() : null));
        }

        Duration elapsed() {
            return Duration.between(startedAt, clock.instant());
        }
    }
}
