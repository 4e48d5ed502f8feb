package com.talksql.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the question-answering state machine.
 *
 * <p>{@link #ANSWERED} and {@link #ERROR} are terminal. The only backward transition is
 * {@code EXECUTED -> QUERY_GENERATED}, taken after a failed execution.
 */
public enum AgentStage {
    IDLE,
    SCHEMA_RESOLVED,
    QUERY_GENERATED,
    QUERY_VALIDATED,
    EXECUTED,
    ANSWERED,
    ERROR;

    /**
     * Successors a stage may legally move to.
     *
     * @return allowed next stages, empty for terminal stages
     */
    public Set<AgentStage> allowedNext() {
        switch (this) {
            case IDLE:
                return EnumSet.of(SCHEMA_RESOLVED, ERROR);
            case SCHEMA_RESOLVED:
                return EnumSet.of(QUERY_GENERATED, ERROR);
            case QUERY_GENERATED:
                return EnumSet.of(QUERY_VALIDATED, ERROR);
            case QUERY_VALIDATED:
                return EnumSet.of(EXECUTED, ERROR);
            case EXECUTED:
                return EnumSet.of(ANSWERED, QUERY_GENERATED, ERROR);
            default:
                return EnumSet.noneOf(AgentStage.class);
        }
    }

    public boolean isTerminal() {
        return this == ANSWERED || this == ERROR;
    }
}
