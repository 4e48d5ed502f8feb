package com.talksql.model;

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-turn aggregate of one orchestration run.
 *
 * <p>Owned exclusively by the run that created it; never shared between concurrent questions,
 * even within one session.
 */
@Data
public class AgentState {
    private final String sessionId;
    private final String question;
    private AgentStage stage = AgentStage.IDLE;
    private final List<AgentMessage> messages = new ArrayList<>();
    private SchemaSnapshot schemaSnapshot;
    private GeneratedQuery generatedQuery;
    private ValidationResult validationResult;
    private boolean validationCorrectionApplied;
    private ExecutionResult executionResult;
    private FinalAnswer finalAnswer;
    private AgentError error;
    private int retryCount;
    private int executionAttempts;

    public AgentState(String sessionId, String question) {
        this.sessionId = sessionId;
        this.question = question;
    }

    public void addMessage(String content) {
        messages.add(new AgentMessage(stage, content, Instant.now()));
    }

    public boolean isAnswered() {
        return stage == AgentStage.ANSWERED && finalAnswer != null;
    }

    /**
     * Last execution error, fed back to generation on the retry edge.
     *
     * @return error text or null
     */
    public String lastExecutionError() {
        if (executionResult == null || executionResult.isSuccess()) {
            return null;
        }
        return executionResult.getErrorMessage();
    }
}
