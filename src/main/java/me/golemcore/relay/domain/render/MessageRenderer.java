package me.golemcore.relay.domain.render;

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

import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders the accumulated state of a turn into markdown message bodies.
 *
 * <p>
 * Progress renders show the tail of the streaming text followed by a cursor,
 * the action lines and a footer with the elapsed time. Final renders carry the
 * answer and a status footer and are split into as many messages as the
 * platform limit requires.
 */
@Component
public class MessageRenderer {

    static final String CURSOR = " ▍";
    static final String SEPARATOR = " · ";
    static final String PROGRESS_LABEL = "▸";
    static final String OK_LABEL = "✓";
    static final String FAIL_LABEL = "✗";

    private final int maxBodyChars;
    private final int maxStreamingChars;

    public MessageRenderer(RelayProperties properties) {
        this.maxBodyChars = properties.getRender().getMaxBodyChars();
        this.maxStreamingChars = properties.getRender().getMaxStreamingChars();
    }

    /**
     * Renders an in-progress turn.
     *
     * @param streamingText
     *            text of the current step, null when nothing is streaming
     */
    public String renderProgress(Duration elapsed, List<String> actionLines, String streamingText) {
        List<String> sections = new ArrayList<>();
        if (streamingText != null && !streamingText.isEmpty()) {
            sections.add(streamingPreview(streamingText));
        }
        if (actionLines != null && !actionLines.isEmpty()) {
            sections.add(String.join("\n", actionLines));
        }
        sections.add(formatFooter(elapsed, PROGRESS_LABEL, null));
        return String.join("\n\n", sections);
    }

    /**
     * Renders the final answer of a turn as one or more messages.
     */
    public List<String> renderFinal(boolean ok, String answer, Duration elapsed, String model) {
        String footer = formatFooter(elapsed, ok ? OK_LABEL : FAIL_LABEL, model);
        return prepareMultiMessage(new MarkdownParts(null, answer, footer));
    }

    public String renderError(String message) {
        return message + "\n\n" + FAIL_LABEL + SEPARATOR + "error";
    }

    /**
     * Splits the body into chunks and assembles one message per chunk. Messages
     * after the first get a {@code continued (i/N)} marker appended to their
     * header. A blank body yields a single message without body.
     */
    public List<String> prepareMultiMessage(MarkdownParts parts) {
        List<String> bodyChunks = new ArrayList<>(MarkdownSplitter.split(parts.body(), maxBodyChars));
        if (bodyChunks.isEmpty()) {
            bodyChunks.add("");
        }

        int total = bodyChunks.size();
        List<String> messages = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            String header = parts.header();
            if (i > 0) {
                String marker = "continued (" + (i + 1) + "/" + total + ")";
                header = header != null && !header.isEmpty() ? header + SEPARATOR + marker : marker;
            }
            messages.add(new MarkdownParts(header, bodyChunks.get(i), parts.footer()).assemble());
        }
        return messages;
    }

    String streamingPreview(String text) {
        String tail = text.length() > maxStreamingChars ? text.substring(text.length() - maxStreamingChars) : text;
        return tail + CURSOR;
    }

    public static String formatFooter(Duration elapsed, String label, String model) {
        List<String> parts = new ArrayList<>(3);
        if (label != null && !label.isEmpty()) {
            parts.add(label);
        }
        parts.add(formatElapsed(elapsed));
        if (model != null && !model.isEmpty()) {
            parts.add(model);
        }
        return String.join(SEPARATOR, parts);
    }

    public static String formatElapsed(Duration elapsed) {
        long total = elapsed == null || elapsed.isNegative() ? 0 : elapsed.getSeconds();
        long seconds = total % 60;
        long totalMinutes = total / 60;
        long minutes = totalMinutes % 60;
        long hours = totalMinutes / 60;
        if (hours > 0) {
            return String.format("%dh %02dm", hours, minutes);
        }
        if (minutes > 0) {
            return String.format("%dm %02ds", minutes, seconds);
        }
        return seconds + "s";
    }
}
