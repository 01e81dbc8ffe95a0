package me.golemcore.relay.domain.model;

/**
 * Lifecycle phase of an agent action.
 */
public enum ActionPhase {
    STARTED, COMPLETED
}
