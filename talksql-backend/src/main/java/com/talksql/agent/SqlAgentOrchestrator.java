package com.talksql.agent;

import com.talksql.dialect.DialectAdapter;
import com.talksql.llm.CompletionException;
import com.talksql.model.AgentError;
import com.talksql.model.AgentStage;
import com.talksql.model.AgentState;
import com.talksql.model.ExecutionResult;
import com.talksql.model.FinalAnswer;
import com.talksql.model.GeneratedQuery;
import com.talksql.model.SchemaSnapshot;
import com.talksql.model.ValidationResult;
import com.talksql.schema.SchemaResolutionException;
import com.talksql.schema.SchemaResolver;
import com.talksql.service.ConnectionException;
import com.talksql.service.DatabaseConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Runs one question through schema resolution, generation, validation, execution and answering.
 *
 * <p>Every stage decides its successor explicitly and the decision is checked against
 * {@link AgentStage#allowedNext()}. A failed execution loops back to generation, carrying the database
 * error, until {@link AgentSettings#maxRetries()} is exhausted. Failures never escape {@link #run};
 * they end the run in {@link AgentStage#ERROR} with {@link AgentState#getError()} set.
 */
@Slf4j
@Service
public class SqlAgentOrchestrator {
    private final SchemaResolver schemaResolver;
    private final QueryGenerator queryGenerator;
    private final QueryValidator queryValidator;
    private final AnswerSynthesizer answerSynthesizer;
    private final AgentSettings settings;

    @Autowired
    public SqlAgentOrchestrator(
            SchemaResolver schemaResolver,
            QueryGenerator queryGenerator,
            QueryValidator queryValidator,
            AnswerSynthesizer answerSynthesizer,
            Environment environment
    ) {
        this(schemaResolver, queryGenerator, queryValidator, answerSynthesizer, AgentSettings.fromEnvironment(environment));
    }

    public SqlAgentOrchestrator(
            SchemaResolver schemaResolver,
            QueryGenerator queryGenerator,
            QueryValidator queryValidator,
            AnswerSynthesizer answerSynthesizer,
            AgentSettings settings
    ) {
        this.schemaResolver = schemaResolver;
        this.queryGenerator = queryGenerator;
        this.queryValidator = queryValidator;
        this.answerSynthesizer = answerSynthesizer;
        this.settings = settings;
    }

    /**
     * Answer a question against a session's database.
     *
     * @param sessionId session id, also selects the table search corpus
     * @param question question text
     * @param connection the session's live connection
     * @return final state, either {@link AgentStage#ANSWERED} or {@link AgentStage#ERROR}
     */
    public AgentState run(String sessionId, String question, DatabaseConnection connection) {
        AgentState state = new AgentState(sessionId, question);
        state.addMessage("Question received: " + question);

        int steps = 0;
        while (!state.getStage().isTerminal()) {
            if (++steps > settings.maxSteps()) {
                fail(state, AgentError.Kind.STUCK, "Run exceeded " + settings.maxSteps() + " steps");
                break;
            }
            AgentStage current = state.getStage();
            AgentStage next;
            try {
                next = step(state, connection);
            } catch (RuntimeException e) {
                log.error("Session {}: unexpected failure in stage {}", sessionId, current, e);
                next = fail(state, AgentError.Kind.STUCK, "Unexpected failure after " + current + ": " + e.getMessage());
            }

            if (next == null || !current.allowedNext().contains(next)) {
                fail(state, AgentError.Kind.STUCK, "No valid transition from " + current + " to " + next);
                break;
            }
            if (next != AgentStage.ERROR) {
                state.setStage(next);
                log.info("Session {}: {} -> {}", sessionId, current, next);
            }
        }
        return state;
    }

    private AgentStage step(AgentState state, DatabaseConnection connection) {
        switch (state.getStage()) {
            case IDLE:
                return resolveSchema(state, connection);
            case SCHEMA_RESOLVED:
                return generate(state);
            case QUERY_GENERATED:
                return validate(state);
            case QUERY_VALIDATED:
                return execute(state, connection);
            case EXECUTED:
                return state.getExecutionResult() != null && state.getExecutionResult().isSuccess()
                        ? answer(state)
                        : retryOrFail(state);
            default:
                return null;
        }
    }

    private AgentStage resolveSchema(AgentState state, DatabaseConnection connection) {
        if (state.getQuestion() == null || state.getQuestion().isBlank()) {
            return fail(state, AgentError.Kind.STUCK, "No question to answer");
        }
        if (connection == null || connection.isClosed()) {
            return fail(state, AgentError.Kind.CONNECTION, "Database connection is not available");
        }
        try {
            SchemaSnapshot snapshot = schemaResolver.resolve(state.getQuestion(), connection,
                    SchemaResolver.corpusIdFor(state.getSessionId()), settings.topK());
            state.setSchemaSnapshot(snapshot);
            state.addMessage("Schema resolved: " + String.join(", ", snapshot.relevantTables()));
            return AgentStage.SCHEMA_RESOLVED;
        } catch (SchemaResolutionException e) {
            AgentError.Kind kind = e.getCause() instanceof ConnectionException
                    ? AgentError.Kind.CONNECTION
                    : AgentError.Kind.SCHEMA_RESOLUTION;
            return fail(state, kind, e.getMessage());
        } catch (ConnectionException e) {
            return fail(state, AgentError.Kind.CONNECTION, e.getMessage());
        }
    }

    private AgentStage generate(AgentState state) {
        try {
            GeneratedQuery query = queryGenerator.generate(state.getQuestion(), state.getSchemaSnapshot());
            state.setGeneratedQuery(query);
            state.addMessage("Generated query: " + query.sql());
            return AgentStage.QUERY_GENERATED;
        } catch (GenerationException e) {
            return fail(state, AgentError.Kind.GENERATION, e.getMessage());
        }
    }

    private AgentStage validate(AgentState state) {
        GeneratedQuery query = state.getGeneratedQuery();
        if (query == null) {
            return fail(state, AgentError.Kind.STUCK, "No generated query to validate");
        }
        ValidationResult result = queryValidator.validate(query.sql(), state.getSchemaSnapshot(),
                state.getSchemaSnapshot().dialect());
        state.setValidationResult(result);

        if (!result.valid() && result.correction().isPresent() && !state.isValidationCorrectionApplied()) {
            state.setGeneratedQuery(query.withSql(result.correction().get()));
            state.setValidationCorrectionApplied(true);
            state.addMessage("Validation replaced the query: " + result.correction().get());
        } else if (!result.valid()) {
            state.addMessage("Validation issues: " + String.join(" ", result.issues()));
        } else {
            state.addMessage("Query validated");
        }
        return AgentStage.QUERY_VALIDATED;
    }

    private AgentStage execute(AgentState state, DatabaseConnection connection) {
        GeneratedQuery query = state.getGeneratedQuery();
        if (query == null) {
            return fail(state, AgentError.Kind.STUCK, "No query to execute");
        }
        String sql = DialectAdapter.adapt(query.sql(), state.getSchemaSnapshot().dialect());
        ExecutionResult result = connection.execute(sql, settings.rowLimit(), settings.queryTimeoutSeconds());
        state.setExecutionAttempts(state.getExecutionAttempts() + 1);
        state.setExecutionResult(result);
        if (result.isSuccess()) {
            state.addMessage("Query executed in " + result.getDurationMs() + " ms");
        } else {
            state.addMessage("Query failed: " + result.getErrorMessage());
        }
        return AgentStage.EXECUTED;
    }

    private AgentStage retryOrFail(AgentState state) {
        String error = state.lastExecutionError();
        if (state.getRetryCount() >= settings.maxRetries()) {
            return fail(state, AgentError.Kind.EXECUTION,
                    "Query failed after " + state.getExecutionAttempts() + " attempt(s): " + error);
        }
        state.setRetryCount(state.getRetryCount() + 1);
        log.info("Session {}: retry {}/{} after execution error: {}",
                state.getSessionId(), state.getRetryCount(), settings.maxRetries(), error);
        try {
            GeneratedQuery query = queryGenerator.fix(state.getQuestion(), state.getSchemaSnapshot(),
                    state.getGeneratedQuery().sql(), error);
            state.setGeneratedQuery(query);
            state.addMessage("Regenerated query: " + query.sql());
            return AgentStage.QUERY_GENERATED;
        } catch (GenerationException e) {
            return fail(state, AgentError.Kind.GENERATION, e.getMessage());
        }
    }

    private AgentStage answer(AgentState state) {
        try {
            FinalAnswer answer = answerSynthesizer.answer(state.getQuestion(), state.getExecutionResult());
            state.setFinalAnswer(answer);
            state.addMessage(answer.answer() != null ? answer.answer() : "Chart generated");
            return AgentStage.ANSWERED;
        } catch (CompletionException e) {
            return fail(state, AgentError.Kind.ANSWER, "Answer generation failed: " + e.getMessage());
        }
    }

    private AgentStage fail(AgentState state, AgentError.Kind kind, String message) {
        AgentStage from = state.getStage();
        state.setError(new AgentError(kind, from, message));
        state.setStage(AgentStage.ERROR);
        state.addMessage("Error: " + message);
        log.warn("Session {}: {} -> ERROR ({}): {}", state.getSessionId(), from, kind, message);
        return AgentStage.ERROR;
    }
}
