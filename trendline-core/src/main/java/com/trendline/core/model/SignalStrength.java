package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalStrength {
    WEAK("weak"),
    MODERATE("moderate"),
    STRONG("strong");

    private final String value;

    SignalStrength(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
