package me.golemcore.relay.domain.model;

import java.util.Objects;

/**
 * Opaque (engine, session) pair that lets a later turn continue the same
 * agent session.
 */
public record ResumeToken(String engine, String value) {

    public ResumeToken {
        Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(value, "value");
    }
}
