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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.AgentRunRequest;
import me.golemcore.relay.domain.model.CompletedEvent;
import me.golemcore.relay.domain.model.RawAgentEvent;
import me.golemcore.relay.domain.model.ResumeToken;
import me.golemcore.relay.domain.model.StreamState;
import me.golemcore.relay.domain.model.TurnEvent;
import me.golemcore.relay.domain.service.AgentRunException;
import me.golemcore.relay.domain.translate.EventTranslator;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.AgentRunnerPort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs the OpenCode CLI as a subprocess and translates its JSONL output.
 *
 * <p>
 * Command line: {@code <command> run --format json [--session id] [--model m]
 * -- <prompt>}. The system prompt is prepended to the prompt of new sessions
 * only. Stdin is closed right away and stderr is collected on a separate
 * thread.
 *
 * <p>
 * A process that exits without reporting a result still ends the turn with a
 * failed {@link CompletedEvent}: the stderr text (or the exit code) for a
 * non-zero exit, a fixed message otherwise.
 */
@Component
@Slf4j
public class OpenCodeRunnerAdapter implements AgentRunnerPort {

    static final String SYSTEM_PROMPT_SEPARATOR = "\n\n---\n\n";
    private static final long STDERR_JOIN_MILLIS = 5000;
    private static final long KILL_WAIT_MILLIS = 5000;

    private final RelayProperties properties;
    private final EventTranslator translator;
    private final OpenCodeEventDecoder decoder;
    private final OpenCodeResumeCodec resumeCodec;

    public OpenCodeRunnerAdapter(RelayProperties properties, EventTranslator translator, ObjectMapper objectMapper) {
        this.properties = properties;
        this.translator = translator;
        this.decoder = new OpenCodeEventDecoder(objectMapper);
        this.resumeCodec = new OpenCodeResumeCodec(translator.getEngine());
    }

    @Override
    public String getEngine() {
        return translator.getEngine();
    }

    @Override
    public void run(AgentRunRequest request, Consumer<TurnEvent> listener) {
        List<String> command = buildCommand(request);
        log.info("[OpenCode] spawning: {} {} ...", command.get(0), String.join(" ", command.subList(1, 4)));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (request.getWorkingDirectory() != null) {
            builder.directory(request.getWorkingDirectory().toFile());
            log.info("[OpenCode] cwd: {}", request.getWorkingDirectory());
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new AgentRunException("failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }
        closeStdin(process);

        StderrCollector stderr = new StderrCollector(process.getErrorStream());
        Thread stderrThread = new Thread(stderr, "opencode-stderr-" + process.pid());
        stderrThread.setDaemon(true);
        stderrThread.start();

        StreamState state = new StreamState(properties.getAgent().getSessionTitle(), request.getModel());
        boolean completed;
        int exitCode;
        try {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                completed = consume(reader, state, listener);
            }
            exitCode = awaitExit(process);
        } catch (IOException e) {
            kill(process);
            throw new AgentRunException("failed to read " + getEngine() + " output: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.warn("[OpenCode] turn aborted, killing agent: pid={}", process.pid());
            kill(process);
            throw e;
        }

        String stderrText = stderr.await(stderrThread);
        log.debug("[OpenCode] exited: rc={}, completed={}", exitCode, completed);
        if (!completed) {
            listener.accept(synthesizeCompletion(state, exitCode, stderrText));
        }
    }

    @Override
    public String formatResume(ResumeToken token) {
        return resumeCodec.format(token);
    }

    @Override
    public ResumeToken extractResume(String text) {
        return resumeCodec.extract(text);
    }

    @Override
    public boolean isResumeLine(String line) {
        return resumeCodec.isResumeLine(line);
    }

    List<String> buildCommand(AgentRunRequest request) {
        List<String> command = new ArrayList<>();
        command.add(properties.getAgent().getCommand());
        command.add("run");
        command.add("--format");
        command.add("json");
        ResumeToken resume = request.getResume();
        if (resume != null) {
            command.add("--session");
            command.add(resume.value());
        }
        String model = request.getModel() != null ? request.getModel() : properties.getAgent().getModel();
        if (model != null && !model.isBlank()) {
            command.add("--model");
            command.add(model);
        }
        String prompt = request.getPrompt();
        String systemPrompt = request.getSystemPrompt();
        if (resume == null && systemPrompt != null && !systemPrompt.isBlank()) {
            prompt = systemPrompt + SYSTEM_PROMPT_SEPARATOR + prompt;
        }
        command.add("--");
        command.add(prompt);
        return command;
    }

    /**
     * Feeds every line of the agent output through the translator.
     *
     * @return whether a terminal event was delivered
     */
    boolean consume(BufferedReader reader, StreamState state, Consumer<TurnEvent> listener) throws IOException {
        boolean completed = false;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Optional<RawAgentEvent> event = decoder.decode(trimmed);
            if (event.isEmpty()) {
                continue;
            }
            for (TurnEvent translated : translator.translate(event.get(), state)) {
                listener.accept(translated);
                completed = completed || translated.isTerminal();
            }
        }
        return completed;
    }

    CompletedEvent synthesizeCompletion(StreamState state, int exitCode, String stderrText) {
        String error;
        if (exitCode != 0) {
            error = stderrText != null && !stderrText.isBlank()
                    ? stderrText.trim()
                    : getEngine() + " failed (rc=" + exitCode + ")";
        } else {
            error = getEngine() + " finished without a result event";
        }
        return CompletedEvent.failure(getEngine(), state.accumulatedTextOrEmpty(), state.resumeToken(getEngine()),
                error);
    }

    private int awaitExit(Process process) {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AgentRunException(getEngine() + " run interrupted", e);
        }
    }

    private static void kill(Process process) {
        process.destroyForcibly();
        try {
            if (!process.waitFor(KILL_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("[OpenCode] agent did not exit after kill: pid={}", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeStdin(Process process) {
        try {
            OutputStream stdin = process.getOutputStream();
            stdin.close();
        } catch (IOException e) {
            log.debug("[OpenCode] could not close stdin: {}", e.getMessage());
        }
    }

    /**
     * Collects stderr so the process never blocks on a full pipe.
     */
    private static final class StderrCollector implements Runnable {

        private final InputStream stream;
        private final StringBuilder text = new StringBuilder();

        private StderrCollector(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    log.debug("[OpenCode] stderr: {}", line);
                    synchronized (text) {
                        text.append(line).append('\n');
                    }
                }
            } catch (IOException e) {
                log.debug("[OpenCode] stderr drain ended: {}", e.getMessage());
            }
        }

        String await(Thread thread) {
            try {
                thread.join(STDERR_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            synchronized (text) {
                return text.toString();
            }
        }
    }
}
