package com.trendline.execution.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Base event type for signal journal entries.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SignalEvent.class, name = "signal"),
    @JsonSubTypes.Type(value = FillEvent.class, name = "fill"),
    @JsonSubTypes.Type(value = TradeEvent.class, name = "trade"),
    @JsonSubTypes.Type(value = ErrorEvent.class, name = "error")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class JournalEvent {
    private final Instant timestamp;
    private final String symbol;

    protected JournalEvent(Instant timestamp, String symbol) {
        this.timestamp = timestamp;
        this.symbol = symbol;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSymbol() {
        return symbol;
    }

    @JsonIgnore
    public abstract String getEventType();

    public abstract String getSummary();
}
