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

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * One user message that should be answered by an agent turn.
 */
@Value
@Builder
public class TurnRequest {

    /** Transport-level conversation thread id; turns are serialized per thread. */
    String threadId;

    /** Key under which the resume token of this conversation is stored. */
    String sessionKey;

    String prompt;

    /** Display name of the author, used for the chat-context system prompt. */
    String authorName;

    /** Optional model override for this turn. */
    String model;

    /** Optional working directory for the agent process. */
    Path workingDirectory;
}
