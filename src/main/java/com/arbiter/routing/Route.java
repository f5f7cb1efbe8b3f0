package com.arbiter.routing;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Route {
    ULTRA_FAST("ultra-fast", "Ultra-Fast Path"),
    FAST("fast", "Balanced Path"),
    PREMIUM("premium", "Premium Path"),
    CODE("code", "Code Path");

    private final String wireName;
    private final String label;

    Route(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }
}
