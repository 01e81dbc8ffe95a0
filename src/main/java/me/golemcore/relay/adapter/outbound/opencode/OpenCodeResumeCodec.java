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

import me.golemcore.relay.domain.model.ResumeToken;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code opencode --session ses_...} command lines users
 * paste to continue a session.
 */
final class OpenCodeResumeCodec {

    private static final Pattern RESUME_LINE = Pattern.compile(
            "(?:^|\\n)\\s*`?opencode(?:\\s+run)?\\s+(?:--session|-s)\\s+(ses_[A-Za-z0-9]+)`?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern RESUME_ANYWHERE = Pattern.compile(
            "`?opencode(?:\\s+run)?\\s+(?:--session|-s)\\s+(ses_[A-Za-z0-9]+)`?");

    private final String engine;

    OpenCodeResumeCodec(String engine) {
        this.engine = engine;
    }

    String format(ResumeToken token) {
        if (!engine.equals(token.engine())) {
            throw new IllegalArgumentException("resume token is for engine " + token.engine());
        }
        return "`opencode --session " + token.value() + "`";
    }

    /**
     * Returns the last session mentioned in the text, or null.
     */
    ResumeToken extract(String text) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Matcher matcher = RESUME_ANYWHERE.matcher(text);
        String found = null;
        while (matcher.find()) {
            found = matcher.group(1);
        }
        return found != null ? new ResumeToken(engine, found) : null;
    }

    boolean isResumeLine(String line) {
        return line != null && RESUME_LINE.matcher(line).find();
    }
}
