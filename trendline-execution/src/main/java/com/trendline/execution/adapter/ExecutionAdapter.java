package com.trendline.execution.adapter;

import com.trendline.core.exception.TradeExecutionException;
import com.trendline.core.model.SignalDirection;

import java.util.Map;

/**
 * Order placement for one market in live mode. Implementations own any
 * retry policy; callers surface failures and never retry.
 */
public interface ExecutionAdapter {

    /**
     * Short name of the venue (e.g. "paper").
     */
    String getVenueName();

    /**
     * Asset that prices are quoted in and entries are paid with.
     */
    String getQuoteAsset();

    /**
     * Place a market order.
     *
     * @param direction buy to enter, sell to exit
     * @param quantity  units of the base asset
     * @param price     reference price of the order
     * @throws TradeExecutionException if the order is rejected or fails
     */
    Fill placeOrder(SignalDirection direction, double quantity, double price) throws TradeExecutionException;

    /**
     * Fee charged on the notional of every fill, as a fraction (0.001 = 0.1%).
     */
    double getFeeRate();

    /**
     * Free balance per asset.
     */
    Map<String, Double> getBalances();

    default double getBalance(String asset) {
        return getBalances().getOrDefault(asset, 0.0);
    }
}
