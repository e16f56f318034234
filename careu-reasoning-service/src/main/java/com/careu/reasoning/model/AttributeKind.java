package com.careu.reasoning.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum AttributeKind {

    ALLERGY("allergy"),
    CONDITION("condition"),
    AGE_BAND("age-band"),
    PREGNANCY("pregnancy"),
    RENAL("renal"),
    HEPATIC("hepatic");

    private final String token;

    AttributeKind(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static Optional<AttributeKind> fromToken(String token) {
        return Arrays.stream(values())
                .filter(k -> k.token.equals(token))
                .findFirst();
    }
}
