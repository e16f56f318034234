package com.careu.reasoning.exception;

/**
 * The fact source is malformed or inconsistent. Nothing from it is loaded.
 */
public class FactStoreLoadException extends DiagnosticException {

    public FactStoreLoadException(String message) {
        super(message, null, null, null);
    }

    public FactStoreLoadException(String message, Throwable cause) {
        super(message, null, null, cause);
    }

    public FactStoreLoadException(String message, String identifier, String relation) {
        super(message, identifier, relation, null);
    }
}
