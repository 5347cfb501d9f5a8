package com.trendline.execution;

import com.trendline.core.exception.TradeExecutionException;
import com.trendline.core.model.Signal;
import com.trendline.core.model.Trade;
import com.trendline.engine.risk.RiskDecision;
import com.trendline.execution.adapter.Fill;

/**
 * Callbacks from a {@link LiveStrategyRunner}. Invoked on the thread that delivers bars.
 */
public interface LiveListener {

    default void onSignal(Signal signal, RiskDecision decision) {}

    default void onFill(Fill fill) {}

    default void onTradeClosed(Trade trade) {}

    /**
     * An order for an accepted action could not be placed. Evaluation continues with the next bar.
     */
    default void onExecutionError(RiskDecision.Action action, TradeExecutionException error) {}
}
