package com.arbiter.ranking;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RankingMode {
    SINGLE, ALL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
