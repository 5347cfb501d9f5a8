package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignalDirection {
    BUY("buy"),
    SELL("sell");

    private final String value;

    SignalDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public SignalDirection opposite() {
        return this == BUY ? SELL : BUY;
    }
}
