package me.golemcore.relay.port.outbound;

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

import me.golemcore.relay.domain.model.AgentRunRequest;
import me.golemcore.relay.domain.model.ResumeToken;
import me.golemcore.relay.domain.model.TurnEvent;

import java.util.function.Consumer;

/**
 * Outbound port to a coding-agent engine.
 */
public interface AgentRunnerPort {

    /**
     * Engine identifier stored in resume tokens (e.g., "opencode").
     */
    String getEngine();

    /**
     * Runs one agent turn, blocking until the agent exits. Every translated
     * event is handed to {@code listener} in order; the last event is always a
     * {@link me.golemcore.relay.domain.model.CompletedEvent}.
     *
     * @throws me.golemcore.relay.domain.service.AgentRunException
     *             if the agent process cannot be started or read
     */
    void run(AgentRunRequest request, Consumer<TurnEvent> listener);

    /**
     * Formats a resume token as the command line a user could paste.
     */
    String formatResume(ResumeToken token);

    /**
     * Extracts the last resume token mentioned in {@code text}, or null.
     */
    ResumeToken extractResume(String text);

    /**
     * Whether the line is a resume command line.
     */
    boolean isResumeLine(String line);
}
