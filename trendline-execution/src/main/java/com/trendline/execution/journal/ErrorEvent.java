package com.trendline.execution.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * An order the execution adapter failed to place.
 */
public class ErrorEvent extends JournalEvent {
    private final String action;
    private final String message;

    @JsonCreator
    public ErrorEvent(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("symbol") String symbol,
            @JsonProperty("action") String action,
            @JsonProperty("message") String message) {
        super(timestamp, symbol);
        this.action = action;
        this.message = message;
    }

    public String getAction() { return action; }
    public String getMessage() { return message; }

    @Override
    public String getEventType() {
        return "error";
    }

    @Override
    public String getSummary() {
        return getSymbol() + " " + action + " failed: " + message;
    }
}
