package com.arbiter.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    USER,
    ASSISTANT,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) throw new IllegalArgumentException("role must not be null");
        return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
