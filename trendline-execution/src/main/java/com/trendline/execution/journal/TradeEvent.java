package com.trendline.execution.journal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trendline.core.model.Trade;

import java.time.Instant;
import java.util.Locale;

public class TradeEvent extends JournalEvent {
    private final Trade trade;

    @JsonCreator
    public TradeEvent(
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("symbol") String symbol,
            @JsonProperty("trade") Trade trade) {
        super(timestamp, symbol);
        this.trade = trade;
    }

    public Trade getTrade() { return trade; }

    @Override
    public String getEventType() {
        return "trade";
    }

    @Override
    public String getSummary() {
        return String.format(Locale.ROOT, "%s closed %.2f -> %.2f (%s) %+.2f%%", getSymbol(),
            trade.entryPrice(), trade.exitPrice(), trade.exitReason().value(), trade.profitPercent());
    }
}
