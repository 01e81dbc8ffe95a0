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

/**
 * Terminal event of a turn. Exactly one is produced per turn, synthesized by
 * the runner when the agent never reports one.
 *
 * @param ok
 *            whether the agent finished normally
 * @param answer
 *            final answer text (text of the last step), never null
 * @param resume
 *            resume token, absent when no session id was ever seen
 * @param error
 *            error message when {@code ok} is false
 */
public record CompletedEvent(String engine, boolean ok, String answer, ResumeToken resume, String error)
        implements TurnEvent {

    public CompletedEvent {
        answer = answer != null ? answer : "";
    }

    public static CompletedEvent success(String engine, String answer, ResumeToken resume) {
        return new CompletedEvent(engine, true, answer, resume, null);
    }

    public static CompletedEvent failure(String engine, String answer, ResumeToken resume, String error) {
        return new CompletedEvent(engine, false, answer, resume, error);
    }

    @Override
    public boolean isTerminal() {
        return true;
    }
}
