package com.trendline.execution.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendline.core.model.Signal;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * A crossover signal and what the risk gate decided about it.
 */
public class SignalEvent extends JournalEvent {
    private final Signal signal;
    private final String action;
    private final List<String> rejections;

    @JsonCreator
    public SignalEvent(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("symbol") String symbol,
            @JsonProperty("signal") Signal signal,
            @JsonProperty("action") String action,
            @JsonProperty("rejections") List<String> rejections) {
        super(timestamp, symbol);
        this.signal = signal;
        this.action = action;
        this.rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public Signal getSignal() { return signal; }
    public String getAction() { return action; }
    public List<String> getRejections() { return rejections; }

    @Override
    public String getEventType() {
        return "signal";
    }

    @Override
    public String getSummary() {
        String outcome = rejections.isEmpty() ? action : "rejected: " + String.join("; ", rejections);
        return String.format(Locale.ROOT, "%s %s %s (%.0f) -> %s", getSymbol(),
            signal.strength().value(), signal.direction().value(), signal.confidence(), outcome);
    }
}
