package me.golemcore.relay.domain.model;

/**
 * Streaming text delta plus the full text accumulated in the current step.
 */
public record TextDeltaEvent(String engine, String delta, String accumulated) implements TurnEvent {
}
