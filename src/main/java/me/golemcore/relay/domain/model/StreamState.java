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

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable translation state of a single agent turn. Owned by one turn and
 * never shared.
 *
 * <p>
 * The session id is sticky: the first non-blank id seen wins and is never
 * replaced. Once a terminal event has been produced the state is frozen and
 * every further raw event is ignored.
 */
@Getter
public class StreamState {

    private final String title;
    private final String model;
    private final Map<String, AgentAction> pendingActions = new LinkedHashMap<>();
    private String accumulatedText;
    private int noteSeq;
    private String sessionId;
    private boolean startedEmitted;
    private boolean stepFinishSeen;
    private boolean terminated;

    public StreamState() {
        this(null, null);
    }

    public StreamState(String title, String model) {
        this.title = title;
        this.model = model;
    }

    public void rememberSessionId(String candidate) {
        if (sessionId == null && candidate != null && !candidate.isBlank()) {
            sessionId = candidate;
        }
    }

    public ResumeToken resumeToken(String engine) {
        return sessionId != null ? new ResumeToken(engine, sessionId) : null;
    }

    public String appendText(String delta) {
        accumulatedText = accumulatedText == null ? delta : accumulatedText + delta;
        return accumulatedText;
    }

    public String accumulatedTextOrEmpty() {
        return accumulatedText != null ? accumulatedText : "";
    }

    public void resetText() {
        accumulatedText = null;
    }

    public int nextNoteSeq() {
        noteSeq++;
        return noteSeq;
    }

    public void markStartedEmitted() {
        startedEmitted = true;
    }

    public void markStepFinishSeen() {
        stepFinishSeen = true;
    }

    public void markTerminated() {
        terminated = true;
    }
}
