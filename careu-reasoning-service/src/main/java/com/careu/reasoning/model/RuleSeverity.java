package com.careu.reasoning.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Severity of a safety rule, declared in ordering priority: findings are listed
 * ABSOLUTE first, MINOR last.
 */
public enum RuleSeverity {

    ABSOLUTE("absolute"),
    MAJOR("major"),
    CAUTION("caution"),
    MINOR("minor");

    private final String token;

    RuleSeverity(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static Optional<RuleSeverity> fromToken(String token) {
        return Arrays.stream(values())
                .filter(s -> s.token.equals(token))
                .findFirst();
    }
}
