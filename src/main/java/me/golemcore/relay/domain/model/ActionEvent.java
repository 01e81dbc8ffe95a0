package me.golemcore.relay.domain.model;

/**
 * Tool call lifecycle change. {@code ok} is null while the action runs.
 */
public record ActionEvent(String engine, AgentAction action, ActionPhase phase, Boolean ok, String message)
        implements TurnEvent {

    public static ActionEvent started(String engine, AgentAction action) {
        return new ActionEvent(engine, action, ActionPhase.STARTED, null, null);
    }

    public static ActionEvent completed(String engine, AgentAction action, boolean ok, String message) {
        return new ActionEvent(engine, action, ActionPhase.COMPLETED, ok, message);
    }
}
