package com.talksql.llm;

/**
 * Raised when the language model cannot produce a completion.
 */
public class CompletionException extends RuntimeException {
    public CompletionException(String message) {
        super(message);
    }

    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
