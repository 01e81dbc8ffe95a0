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

import me.golemcore.relay.domain.model.ResumeToken;

import java.util.Optional;

/**
 * Session store collaborator: remembers the agent session of each
 * conversation so the next turn can resume it.
 */
public interface ResumeTokenStorePort {

    Optional<ResumeToken> get(String sessionKey, String engine);

    void set(String sessionKey, ResumeToken token);

    void clear(String sessionKey);
}
