package com.talksql.controller;

import com.talksql.agent.QueryFailedException;
import com.talksql.agent.SqlAgentOrchestrator;
import com.talksql.api.ConnectionRequest;
import com.talksql.api.ConnectionResponse;
import com.talksql.api.DisconnectRequest;
import com.talksql.api.DisconnectResponse;
import com.talksql.api.QueryRequest;
import com.talksql.api.QueryResponse;
import com.talksql.api.SessionValidationResponse;
import com.talksql.model.AgentError;
import com.talksql.model.AgentState;
import com.talksql.model.ExecutionResult;
import com.talksql.model.Session;
import com.talksql.schema.SchemaResolver;
import com.talksql.service.ConnectionFactory;
import com.talksql.service.DatabaseConnection;
import com.talksql.service.RegistryConflictException;
import com.talksql.service.SessionNotFoundException;
import com.talksql.service.SessionRegistry;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
public class QueryController {

    private static final Logger log = LoggerFactory.getLogger(QueryController.class);

    private final SessionRegistry sessionRegistry;
    private final ConnectionFactory connectionFactory;
    private final SchemaResolver schemaResolver;
    private final SqlAgentOrchestrator orchestrator;
    private final Duration sessionTtl;

    public QueryController(
            SessionRegistry sessionRegistry,
            ConnectionFactory connectionFactory,
            SchemaResolver schemaResolver,
            SqlAgentOrchestrator orchestrator,
            @Value("${talksql.session.ttl-seconds:3600}") long sessionTtlSeconds
    ) {
        this.sessionRegistry = sessionRegistry;
        this.connectionFactory = connectionFactory;
        this.schemaResolver = schemaResolver;
        this.orchestrator = orchestrator;
        this.sessionTtl = Duration.ofSeconds(sessionTtlSeconds);
        sessionRegistry.onRemoval(id -> schemaResolver.dropIndex(SchemaResolver.corpusIdFor(id)));
    }

    /**
     * Open a database connection and bind it to a session. When a question is included it is answered
     * right away.
     *
     * POST /api/v1/connection
     */
    @PostMapping("/connection")
    public ResponseEntity<ConnectionResponse> connect(@Valid @RequestBody ConnectionRequest request) {
        String sessionId = request.getSessionId();
        if (sessionId != null && !sessionId.isBlank()) {
            if (sessionRegistry.get(sessionId).isPresent()) {
                throw new RegistryConflictException(sessionId);
            }
        } else {
            sessionId = UUID.randomUUID().toString();
        }

        log.info("Connect requested: session_id={}, params={}", sessionId, request.getConnectionParams());
        DatabaseConnection connection = connectionFactory.open(request.getConnectionParams());
        Optional<Session> stored = sessionRegistry.storeIfAbsent(sessionId, connection, sessionTtl);
        if (stored.isEmpty()) {
            // another connect for the same id finished first
            connection.close();
            throw new RegistryConflictException(sessionId);
        }
        Session session = stored.get();
        schemaResolver.indexSchema(connection, SchemaResolver.corpusIdFor(sessionId));

        ConnectionResponse.ConnectionResponseBuilder response = ConnectionResponse.builder()
                .sessionId(sessionId)
                .expiresAt(session.getExpiresAt())
                .statusCode(200)
                .message("Connection established");

        String question = request.getQuestion();
        if (question != null && !question.isBlank()) {
            AgentState state = orchestrator.run(sessionId, question, connection);
            if (state.isAnswered()) {
                response.data(state.getExecutionResult().payload())
                        .chartData(state.getFinalAnswer().chartData())
                        .answer(state.getFinalAnswer().answer());
            } else {
                response.message("Connection established, but the question could not be answered: "
                        + describe(state).message());
            }
        }
        return ResponseEntity.ok(response.build());
    }

    /**
     * Answer a question against a connected session.
     *
     * POST /api/v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        String sessionId = request.getSessionId();
        DatabaseConnection connection = sessionRegistry.get(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));

        AgentState state = orchestrator.run(sessionId, request.getQuestion(), connection);
        if (!state.isAnswered()) {
            throw new QueryFailedException(describe(state));
        }

        ExecutionResult result = state.getExecutionResult();
        return ResponseEntity.ok(QueryResponse.builder()
                .data(result.payload())
                .chartData(state.getFinalAnswer().chartData())
                .answer(state.getFinalAnswer().answer())
                .sql(result.getExecutedSql())
                .truncated(result.isTruncated())
                .statusCode(200)
                .build());
    }

    /**
     * Close a session's connection and forget the session.
     *
     * POST /api/v1/disconnect
     */
    @PostMapping("/disconnect")
    public ResponseEntity<DisconnectResponse> disconnect(@Valid @RequestBody DisconnectRequest request) {
        String sessionId = request.getSessionId();
        if (sessionRegistry.get(sessionId).isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        sessionRegistry.remove(sessionId);
        log.info("Disconnect completed: session_id={}", sessionId);
        return ResponseEntity.ok(DisconnectResponse.builder()
                .sessionId(sessionId)
                .message("Disconnected")
                .statusCode(200)
                .build());
    }

    /**
     * Check whether a session is still live.
     *
     * GET /api/v1/sessions/validate?session_id=...
     */
    @GetMapping("/sessions/validate")
    public ResponseEntity<SessionValidationResponse> validateSession(@RequestParam("session_id") String sessionId) {
        Session session = sessionRegistry.find(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return ResponseEntity.ok(SessionValidationResponse.builder()
                .sessionId(sessionId)
                .valid(true)
                .expiresAt(session.getExpiresAt())
                .build());
    }

    private static AgentError describe(AgentState state) {
        if (state.getError() != null) {
            return state.getError();
        }
        return new AgentError(AgentError.Kind.STUCK, state.getStage(), "Run ended without an answer");
    }
}
