package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PositionSide {
    LONG("long");

    private final String value;

    PositionSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
