package me.golemcore.relay.domain.model;

/**
 * First event of a turn that knows its agent session.
 */
public record StartedEvent(String engine, ResumeToken resume, String title, String model) implements TurnEvent {
}
