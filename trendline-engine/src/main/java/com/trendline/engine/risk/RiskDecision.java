package com.trendline.engine.risk;

import com.trendline.core.model.Signal;

import java.util.List;

/**
 * Outcome of passing a signal through the risk gate.
 *
 * @param quantity        units to buy for {@link Action#OPEN_LONG}, units to sell for {@link Action#CLOSE_LONG}
 * @param stopLossPrice   protective stop for a new position, NaN otherwise
 * @param takeProfitPrice profit target for a new position, NaN otherwise
 * @param rejections      why the signal was rejected (empty = accepted)
 */
public record RiskDecision(
    Action action,
    Signal signal,
    double quantity,
    double stopLossPrice,
    double takeProfitPrice,
    List<String> rejections
) {
    public enum Action {
        OPEN_LONG,
        CLOSE_LONG,
        NONE
    }

    public RiskDecision {
        rejections = List.copyOf(rejections);
    }

    public static RiskDecision openLong(Signal signal, double quantity, double stopLossPrice, double takeProfitPrice) {
        return new RiskDecision(Action.OPEN_LONG, signal, quantity, stopLossPrice, takeProfitPrice, List.of());
    }

    public static RiskDecision closeLong(Signal signal, double quantity) {
        return new RiskDecision(Action.CLOSE_LONG, signal, quantity, Double.NaN, Double.NaN, List.of());
    }

    public static RiskDecision rejected(Signal signal, List<String> rejections) {
        return new RiskDecision(Action.NONE, signal, 0, Double.NaN, Double.NaN, rejections);
    }

    public boolean isAccepted() {
        return action != Action.NONE;
    }
}
