package com.careu.reasoning.exception;

import lombok.Getter;

/**
 * Base of the engine's error taxonomy. Carries the offending identifier and
 * relation, when known, so callers can surface a precise message.
 */
@Getter
public abstract class DiagnosticException extends RuntimeException {

    private final String identifier;
    private final String relation;

    protected DiagnosticException(String message, String identifier, String relation, Throwable cause) {
        super(message, cause);
        this.identifier = identifier;
        this.relation = relation;
    }
}
