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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits markdown bodies into chunks that fit a platform's message limit.
 *
 * <p>
 * Paragraph boundaries (two or more newlines) are preferred split points,
 * then line boundaries; a single line longer than the limit is hard-split as a
 * last resort. A fenced code block that straddles a split is closed at the end
 * of one chunk and reopened with the same fence line at the start of the next,
 * so a chunk may exceed the limit by the fence overhead: the reopened fence
 * line plus the closing fence line.
 */
public final class MarkdownSplitter {

    private static final Pattern PARAGRAPH_SEPARATOR = Pattern.compile("\n{2,}");
    private static final Pattern FENCE = Pattern.compile("^([ \\t]*)([`~]{3,})(.*)$");

    private MarkdownSplitter() {
    }

    /**
     * Splits {@code body} into an ordered list of chunks of at most
     * {@code maxChars} characters plus fence overhead. A blank body yields an
     * empty list; a body that already fits yields exactly one chunk, the trimmed
     * body.
     */
    public static List<String> split(String body, int maxChars) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        int max = Math.max(1, maxChars);
        String text = body.trim();
        if (text.length() <= max) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        FenceState fence = null;

        for (String block : paragraphBlocks(text)) {
            for (String piece : splitBlock(block, max)) {
                if (current.length() == 0) {
                    current.append(piece);
                    fence = scanFenceState(piece, fence);
                    continue;
                }
                if (current.length() + piece.length() <= max) {
                    current.append(piece);
                    fence = scanFenceState(piece, fence);
                    continue;
                }
                if (fence != null) {
                    closeFence(current, fence);
                }
                chunks.add(current.toString());
                current.setLength(0);
                if (fence != null) {
                    current.append(fence.header()).append('\n');
                }
                current.append(piece);
                fence = scanFenceState(piece, fence);
            }
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }

        List<String> result = new ArrayList<>(chunks.size());
        for (String chunk : chunks) {
            String stripped = chunk.stripTrailing();
            if (!stripped.isBlank()) {
                result.add(stripped);
            }
        }
        return result;
    }

    static List<String> paragraphBlocks(String text) {
        List<String> blocks = new ArrayList<>();
        Matcher matcher = PARAGRAPH_SEPARATOR.matcher(text);
        int start = 0;
        while (matcher.find()) {
            blocks.add(text.substring(start, matcher.end()));
            start = matcher.end();
        }
        if (start < text.length()) {
            blocks.add(text.substring(start));
        }
        return blocks;
    }

    static List<String> splitBlock(String block, int max) {
        if (block.length() <= max) {
            return List.of(block);
        }
        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : block.split("(?<=\n)")) {
            if (line.isEmpty()) {
                continue;
            }
            for (int offset = 0; offset < line.length(); offset += max) {
                String segment = line.substring(offset, Math.min(line.length(), offset + max));
                if (current.length() > 0 && current.length() + segment.length() > max) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
                current.append(segment);
                if (current.length() >= max) {
                    pieces.add(current.toString());
                    current.setLength(0);
                }
            }
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    static FenceState scanFenceState(String text, FenceState state) {
        FenceState result = state;
        for (String line : text.split("\n", -1)) {
            result = updateFenceState(line, result);
        }
        return result;
    }

    private static FenceState updateFenceState(String line, FenceState state) {
        Matcher matcher = FENCE.matcher(line);
        if (!matcher.matches()) {
            return state;
        }
        String indent = matcher.group(1);
        String fence = matcher.group(2);
        if (state == null) {
            return new FenceState(fence, indent, line);
        }
        if (fence.charAt(0) == state.fence().charAt(0) && fence.length() >= state.fence().length()
                && matcher.group(3).isBlank()) {
            return null;
        }
        return state;
    }

    private static void closeFence(StringBuilder chunk, FenceState fence) {
        if (chunk.charAt(chunk.length() - 1) != '\n') {
            chunk.append('\n');
        }
        chunk.append(fence.indent()).append(fence.fence()).append('\n');
    }

    /**
     * Open code fence: its marker, indentation and the full opening line
     * (including the language tag) used to reopen it.
     */
    record FenceState(String fence, String indent, String header) {
    }
}
