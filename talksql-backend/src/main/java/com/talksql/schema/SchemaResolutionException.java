package com.talksql.schema;

/**
 * Raised when the schema of a connected database cannot be read or formatted.
 */
public class SchemaResolutionException extends RuntimeException {
    public SchemaResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
