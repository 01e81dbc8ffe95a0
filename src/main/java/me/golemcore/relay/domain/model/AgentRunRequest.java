package me.golemcore.relay.domain.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Parameters of a single agent process run.
 */
@Value
@Builder
public class AgentRunRequest {

    String prompt;

    /** Session to continue; null starts a new session. */
    ResumeToken resume;

    String model;

    /** Only applied to new sessions. */
    String systemPrompt;

    Path workingDirectory;
}
