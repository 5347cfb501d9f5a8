package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExitReason {
    SIGNAL("signal"),
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT("take_profit"),
    END_OF_DATA("end_of_data");

    private final String value;

    ExitReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
