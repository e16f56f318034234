package com.careu.reasoning.exception;

import lombok.Getter;

/**
 * The caller passed an empty, malformed or unknown identifier. Recoverable by
 * fixing the input.
 */
@Getter
public class InvalidQueryException extends DiagnosticException {

    private final boolean unknownIdentifier;

    public InvalidQueryException(String message, String identifier) {
        this(message, identifier, false);
    }

    private InvalidQueryException(String message, String identifier, boolean unknownIdentifier) {
        super(message, identifier, null, null);
        this.unknownIdentifier = unknownIdentifier;
    }

    public static InvalidQueryException unknown(String kind, String identifier) {
        return new InvalidQueryException("Unknown " + kind + ": " + identifier, identifier, true);
    }
}
