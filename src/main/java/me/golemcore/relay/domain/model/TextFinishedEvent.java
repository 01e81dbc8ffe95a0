package me.golemcore.relay.domain.model;

/**
 * Complete text of a step that ended because the agent is about to call a
 * tool.
 */
public record TextFinishedEvent(String engine, String text) implements TurnEvent {
}
