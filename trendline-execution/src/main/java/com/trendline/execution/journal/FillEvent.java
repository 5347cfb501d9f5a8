package com.trendline.execution.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendline.execution.adapter.Fill;

import java.time.Instant;
import java.util.Locale;

public class FillEvent extends JournalEvent {
    private final Fill fill;

    @JsonCreator
    public FillEvent(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("symbol") String symbol,
            @JsonProperty("fill") Fill fill) {
        super(timestamp, symbol);
        this.fill = fill;
    }

    public Fill getFill() { return fill; }

    @Override
    public String getEventType() {
        return "fill";
    }

    @Override
    public String getSummary() {
        return String.format(Locale.ROOT, "%s %s %.8f @ %.2f (fee %.4f %s)", getSymbol(),
            fill.direction().value(), fill.quantity(), fill.price(), fill.fee(), fill.feeAsset());
    }
}
