package me.golemcore.relay.domain.render;

import java.util.ArrayList;
import java.util.List;

/**
 * Header, body and footer of one rendered message. Blank parts are omitted
 * when assembled; present parts are separated by a blank line.
 */
public record MarkdownParts(String header, String body, String footer) {

    public String assemble() {
        List<String> parts = new ArrayList<>(3);
        for (String part : new String[] { header, body, footer }) {
            if (part != null && !part.isEmpty()) {
                parts.add(part);
            }
        }
        return String.join("\n\n", parts);
    }
}
