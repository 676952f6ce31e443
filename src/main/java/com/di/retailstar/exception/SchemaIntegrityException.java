package com.di.retailstar.exception;

/**
 * Thrown by the schema assembler when a built table breaks a key invariant
 * (surrogate keys not dense, not unique, or a foreign key resolving to several rows).
 */
public class SchemaIntegrityException extends RuntimeException {

    public SchemaIntegrityException(String message) {
        super(message);
    }
}
