package com.talksql.agent;

/**
 * Raised when no usable SQL could be generated for a question.
 */
public class GenerationException extends RuntimeException {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
