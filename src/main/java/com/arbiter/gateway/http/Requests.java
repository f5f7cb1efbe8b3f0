package com.arbiter.gateway.http;

import java.util.Collection;

final class Requests {

    private Requests() {}

    static String requireText(String value, String what) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException(what + " is required");
        return value;
    }

    static <T extends Collection<?>> T requireNonEmpty(T values, String what) {
        if (values == null || values.isEmpty()) throw new IllegalArgumentException(what + " is required");
        return values;
    }
}
