package me.golemcore.relay.domain.translate;

import me.golemcore.relay.domain.model.ActionKind;

/**
 * Outcome of classifying a tool call: its kind, a human-readable title and,
 * for path-bearing calls, the path the call touches.
 */
public record ToolClassification(ActionKind kind, String title, String path) {

    public static ToolClassification of(ActionKind kind, String title) {
        return new ToolClassification(kind, title, null);
    }
}
