package com.talksql.web;

import com.talksql.agent.QueryFailedException;
import com.talksql.api.ErrorResponse;
import com.talksql.service.ConnectionException;
import com.talksql.service.RegistryConflictException;
import com.talksql.service.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request could not be read", ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException ex) {
        return build(HttpStatus.BAD_REQUEST, "SESSION_NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(RegistryConflictException.class)
    public ResponseEntity<ErrorResponse> handleRegistryConflict(RegistryConflictException ex) {
        return build(HttpStatus.BAD_REQUEST, "SESSION_EXISTS", ex.getMessage(), null);
    }

    @ExceptionHandler(ConnectionException.class)
    public ResponseEntity<ErrorResponse> handleConnectionException(ConnectionException ex) {
        return build(HttpStatus.BAD_REQUEST, "CONNECTION_FAILED", "Could not connect to the database", ex.getMessage());
    }

    @ExceptionHandler(QueryFailedException.class)
    public ResponseEntity<ErrorResponse> handleQueryFailed(QueryFailedException ex) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "QUERY_FAILED", ex.getMessage(),
                ex.getError().kind() + " at " + ex.getError().stage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return build(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .statusCode(status.value())
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
