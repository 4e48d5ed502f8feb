package com.talksql.service;

/**
 * Raised when a session id is already bound to a live connection and the caller asked for a new one.
 */
public class RegistryConflictException extends RuntimeException {
    public RegistryConflictException(String sessionId) {
        super("Session already exists: " + sessionId);
    }
}
