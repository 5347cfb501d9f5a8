package com.trendline.engine;

import com.trendline.core.model.Candle;
import com.trendline.core.model.ExitReason;
import com.trendline.core.model.Position;

import java.util.Optional;

/**
 * Intrabar stop-loss / take-profit checks for an open position.
 * When one bar reaches both levels the stop-loss is taken, since the
 * order of the high and low within the bar is unknown.
 */
public final class ExitRules {

    private ExitRules() {}

    public record Exit(ExitReason reason, double price) {}

    public static Optional<Exit> check(Position position, Candle candle) {
        if (position.stopLossHit(candle)) {
            return Optional.of(new Exit(ExitReason.STOP_LOSS, position.stopLossFillPrice(candle)));
        }
        if (position.takeProfitHit(candle)) {
            return Optional.of(new Exit(ExitReason.TAKE_PROFIT, position.takeProfitFillPrice(candle)));
        }
        return Optional.empty();
    }
}
