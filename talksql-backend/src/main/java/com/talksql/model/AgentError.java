package com.talksql.model;

/**
 * Fatal failure of a run.
 *
 * @param kind error class
 * @param stage stage the run was in when it failed
 * @param message descriptive message for the caller
 */
public record AgentError(Kind kind, AgentStage stage, String message) {

    public enum Kind {
        CONNECTION,
        SCHEMA_RESOLUTION,
        GENERATION,
        EXECUTION,
        ANSWER,
        STUCK
    }
}
