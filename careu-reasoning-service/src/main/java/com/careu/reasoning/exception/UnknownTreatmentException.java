package com.careu.reasoning.exception;

/**
 * A treatment was asked about that the fact store does not declare. Never
 * answered with an empty, safe-looking result.
 */
public class UnknownTreatmentException extends DiagnosticException {

    public UnknownTreatmentException(String treatmentId) {
        super("Unknown treatment: " + treatmentId, treatmentId, null, null);
    }
}
