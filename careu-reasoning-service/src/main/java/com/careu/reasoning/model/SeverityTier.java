package com.careu.reasoning.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum SeverityTier {

    CRITICAL("critical", 3),
    URGENT("urgent", 2),
    COMMON("common", 1);

    private final String token;
    private final int rank;

    SeverityTier(String token, int rank) {
        this.token = token;
        this.rank = rank;
    }

    @JsonValue
    public String token() {
        return token;
    }

    /** Higher is more severe. */
    public int rank() {
        return rank;
    }

    public static Optional<SeverityTier> fromToken(String token) {
        return Arrays.stream(values())
                .filter(t -> t.token.equals(token))
                .findFirst();
    }
}
