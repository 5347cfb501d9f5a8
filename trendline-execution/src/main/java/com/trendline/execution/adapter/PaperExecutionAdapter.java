package com.trendline.execution.adapter;

import com.trendline.core.exception.TradeExecutionException;
import com.trendline.core.model.SignalDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated spot account for paper trading.
 * Fills market orders immediately at the requested price and charges a fee in
 * the quote asset. Does not simulate slippage or partial fills.
 */
public class PaperExecutionAdapter implements ExecutionAdapter {

    private static final Logger log = LoggerFactory.getLogger(PaperExecutionAdapter.class);

    /** Flat exchange fee of 0.1% */
    public static final double DEFAULT_FEE_RATE = 0.001;

    private final String baseAsset;
    private final String quoteAsset;
    private final double feeRate;
    private final Clock clock;
    private final Map<String, Double> balances = new LinkedHashMap<>();
    private final List<Fill> fillHistory = new ArrayList<>();
    private final AtomicLong orderIdSeq = new AtomicLong(1);

    public PaperExecutionAdapter(String baseAsset, String quoteAsset, double initialQuoteBalance,
                                 double feeRate, Clock clock) {
        if (feeRate < 0 || feeRate >= 1) {
            throw new IllegalArgumentException("feeRate must be in [0, 1): " + feeRate);
        }
        this.baseAsset = baseAsset;
        this.quoteAsset = quoteAsset;
        this.feeRate = feeRate;
        this.clock = clock;
        balances.put(baseAsset, 0.0);
        balances.put(quoteAsset, initialQuoteBalance);
    }

    public PaperExecutionAdapter(String baseAsset, String quoteAsset, double initialQuoteBalance) {
        this(baseAsset, quoteAsset, initialQuoteBalance, DEFAULT_FEE_RATE, Clock.systemUTC());
    }

    @Override
    public String getVenueName() {
        return "paper";
    }

    @Override
    public String getQuoteAsset() {
        return quoteAsset;
    }

    public String getBaseAsset() {
        return baseAsset;
    }

    @Override
    public synchronized Fill placeOrder(SignalDirection direction, double quantity, double price)
            throws TradeExecutionException {
        if (!(quantity > 0)) {
            throw new TradeExecutionException("Order quantity must be positive: " + quantity);
        }
        if (!(price > 0)) {
            throw new TradeExecutionException("Market order requires a positive reference price in paper mode");
        }

        String orderId = "paper-" + orderIdSeq.getAndIncrement();
        double notional = price * quantity;
        double fee = notional * feeRate;
        // Balance checks tolerate rounding from fee-capped sizing and earlier fills

        if (direction == SignalDirection.BUY) {
            double cost = notional + fee;
            double available = balances.get(quoteAsset);
            if (cost > available * (1 + 1e-9)) {
                throw new TradeExecutionException(String.format(Locale.ROOT,
                    "Insufficient %s balance: need %.2f, have %.2f", quoteAsset, cost, available));
            }
            balances.put(quoteAsset, Math.max(0, available - cost));
            balances.merge(baseAsset, quantity, Double::sum);
        } else {
            double held = balances.get(baseAsset);
            if (quantity > held * (1 + 1e-9)) {
                throw new TradeExecutionException(String.format(Locale.ROOT,
                    "Insufficient %s balance: need %.8f, have %.8f", baseAsset, quantity, held));
            }
            balances.put(baseAsset, Math.max(0, held - quantity));
            balances.merge(quoteAsset, notional - fee, Double::sum);
        }

        Fill fill = new Fill(orderId, direction, price, quantity, fee, quoteAsset, clock.millis());
        fillHistory.add(fill);
        log.info("Paper {} {} {} @ {} (fee {} {})",
            direction.value(), quantity, baseAsset, price, fee, quoteAsset);
        return fill;
    }

    @Override
    public synchronized Map<String, Double> getBalances() {
        return Map.copyOf(balances);
    }

    public synchronized List<Fill> getFillHistory() {
        return Collections.unmodifiableList(new ArrayList<>(fillHistory));
    }

    @Override
    public double getFeeRate() {
        return feeRate;
    }
}
