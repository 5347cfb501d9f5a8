package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A closed position.
 *
 * @param profit        realized profit in quote currency, net of commission
 * @param profitPercent profit relative to the entry notional, in percent
 * @param commission    total commission paid on entry and exit
 */
public record Trade(
    long entryTime,
    double entryPrice,
    double quantity,
    PositionSide side,
    double stopLossPrice,
    double takeProfitPrice,
    long exitTime,
    double exitPrice,
    ExitReason exitReason,
    double profit,
    double profitPercent,
    double commission
) {
    /**
     * Close a position at the given price.
     *
     * @param exitCommission commission charged on the exit fill
     */
    public static Trade close(Position position, long exitTime, double exitPrice,
                              ExitReason reason, double exitCommission) {
        double gross = (exitPrice - position.entryPrice()) * position.quantity();
        double commission = position.entryCommission() + exitCommission;
        double profit = gross - commission;
        double entryValue = position.entryValue();
        double profitPercent = entryValue > 0 ? profit / entryValue * 100 : 0;

        return new Trade(
            position.openTime(),
            position.entryPrice(),
            position.quantity(),
            position.side(),
            position.stopLossPrice(),
            position.takeProfitPrice(),
            exitTime,
            exitPrice,
            reason,
            profit,
            profitPercent,
            commission
        );
    }

    @JsonIgnore
    public boolean isWin() {
        return profit > 0;
    }

}
