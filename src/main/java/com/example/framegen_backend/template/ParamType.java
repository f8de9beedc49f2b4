package com.example.framegen_backend.template;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Placeholder types understood by the template DSL, keyed by their wire token.
 */
public enum ParamType {
    TEXT("text"),
    NUMBER("number"),
    COLOR("color"),
    BOOL("bool");

    private final String token;

    ParamType(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public static Optional<ParamType> fromToken(String token) {
        if (token == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.token.equals(token)).findFirst();
    }
}
