package me.golemcore.relay.adapter.outbound.session;

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
import me.golemcore.relay.domain.model.ResumeToken;
import me.golemcore.relay.port.outbound.ResumeTokenStorePort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the agent session of each conversation in memory, one token per
 * engine. Sessions are lost on restart.
 */
@Component
@Slf4j
public class InMemoryResumeTokenStore implements ResumeTokenStorePort {

    private final Map<String, Map<String, ResumeToken>> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<ResumeToken> get(String sessionKey, String engine) {
        Map<String, ResumeToken> byEngine = tokens.get(sessionKey);
        return byEngine != null ? Optional.ofNullable(byEngine.get(engine)) : Optional.empty();
    }

    @Override
    public void set(String sessionKey, ResumeToken token) {
        ResumeToken previous = tokens.computeIfAbsent(sessionKey, key -> new ConcurrentHashMap<>())
                .put(token.engine(), token);
        if (previous == null || !previous.value().equals(token.value())) {
            log.debug("[Sessions] {} -> {}:{}", sessionKey, token.engine(), token.value());
        }
    }

    @Override
    public void clear(String sessionKey) {
        if (tokens.remove(sessionKey) != null) {
            log.debug("[Sessions] cleared {}", sessionKey);
        }
    }
}
