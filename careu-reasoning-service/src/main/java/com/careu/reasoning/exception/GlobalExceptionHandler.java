package com.careu.reasoning.exception;

import com.careu.reasoning.dto.DiagnosticDtos.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException e) {
        log.warn("Invalid query: {}", e.getMessage());
        HttpStatus status = e.isUnknownIdentifier() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return respond(status, "invalid-query", e);
    }

    @ExceptionHandler(UnknownTreatmentException.class)
    public ResponseEntity<ErrorResponse> handleUnknownTreatment(UnknownTreatmentException e) {
        log.warn("Unknown treatment: {}", e.getIdentifier());
        return respond(HttpStatus.NOT_FOUND, "unknown-treatment", e);
    }

    @ExceptionHandler(FactStoreLoadException.class)
    public ResponseEntity<ErrorResponse> handleLoadFailure(FactStoreLoadException e) {
        log.error("Knowledge base unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "load-error", e);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("invalid-query", "Request body is missing or malformed", null, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unhandled exception: ", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("internal", "An unexpected error occurred: " + e.getMessage(), null, null));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, DiagnosticException e) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(error, e.getMessage(), e.getIdentifier(), e.getRelation()));
    }
}
