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
 * Best-effort result of retracting a superseded message. A failed recall never
 * fails the edit that replaced the message.
 */
public record RecallOutcome(Status status, String recallHandle, String reason) {

    public enum Status {
        RECALLED, SKIPPED, FAILED
    }

    public static RecallOutcome recalled(String recallHandle) {
        return new RecallOutcome(Status.RECALLED, recallHandle, null);
    }

    public static RecallOutcome skipped() {
        return new RecallOutcome(Status.SKIPPED, null, null);
    }

    public static RecallOutcome failed(String recallHandle, String reason) {
        return new RecallOutcome(Status.FAILED, recallHandle, reason);
    }
}
