package me.golemcore.relay.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties for the relay, bound from
 * application.properties.
 *
 * <p>
 * All relay configuration is organized under the {@code relay.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - agent subprocess command and session
 * defaults</li>
 * <li>{@link TranslateProperties} - event translation limits</li>
 * <li>{@link RenderProperties} - markdown rendering limits</li>
 * <li>{@link ThrottleProperties} - progress delivery intervals</li>
 * <li>{@link EditProperties} - edit emulation debounce</li>
 * <li>{@link TurnProperties} - turn execution</li>
 * <li>{@link ConsoleProperties} - local console channel</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "relay")
@Data
public class RelayProperties {

    private ReplyMode replyMode = ReplyMode.EDIT;
    private AgentProperties agent = new AgentProperties();
    private TranslateProperties translate = new TranslateProperties();
    private RenderProperties render = new RenderProperties();
    private ThrottleProperties throttle = new ThrottleProperties();
    private EditProperties edit = new EditProperties();
    private TurnProperties turn = new TurnProperties();
    private ConsoleProperties console = new ConsoleProperties();

    /**
     * How a turn is presented in the chat thread.
     */
    public enum ReplyMode {
        /** One live progress message, edited in place and replaced by the answer. */
        EDIT,
        /** Intermediate texts and tool call batches posted as separate messages. */
        INCREMENTAL
    }

    @Data
    public static class AgentProperties {
        private String command = "opencode";
        private String sessionTitle = "opencode";
        private String model;
        private String systemPrompt;
        private String workingDirectory;
    }

    @Data
    public static class TranslateProperties {
        private int commandTitleMaxLength = 60;
        private int outputPreviewMaxLength = 500;
    }

    @Data
    public static class RenderProperties {
        private int maxBodyChars = 3500;
        private int maxStreamingChars = 2000;
        private int commandWidth = 300;
        private boolean showActions = true;
        private boolean detailedActions = false;
        private String placeholder = "_Thinking..._";
    }

    @Data
    public static class ThrottleProperties {
        private Duration textInterval = Duration.ofMillis(800);
        private Duration actionInterval = Duration.ofMillis(1200);
    }

    @Data
    public static class EditProperties {
        private Duration debounce = Duration.ofMillis(300);
        private Duration maxWait = Duration.ofMillis(2000);
    }

    @Data
    public static class TurnProperties {
        private int executorThreads = 4;
    }

    @Data
    public static class ConsoleProperties {
        private boolean enabled = false;
        private String threadId = "console";
    }
}
