package com.trendline.engine.risk;

import com.trendline.core.model.Position;
import com.trendline.core.model.Signal;
import com.trendline.core.model.StrategyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Gate between the signal generator and order placement.
 *
 * Checks confidence, the cooldown since the last accepted action and the
 * long-only position rules, then sizes new entries. One instance per strategy
 * instance; it remembers the timestamp of the last accepted action only.
 */
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final StrategyConfig config;
    private Long lastTradeTimestamp;

    public RiskManager(StrategyConfig config) {
        this.config = config;
    }

    /**
     * Evaluate a signal and, if accepted, advance the cooldown clock to the signal's timestamp.
     *
     * @param openPosition the open position, or null when flat
     * @param balance      cash available for a new entry
     */
    public RiskDecision evaluate(Signal signal, Position openPosition, double balance) {
        RiskDecision decision = check(signal, openPosition, balance);
        if (decision.isAccepted()) {
            commit(signal);
        }
        return decision;
    }

    /**
     * Evaluate a signal against the current cooldown without recording it.
     * Callers that act on an accepted decision asynchronously, e.g. by placing
     * an order, call {@link #commit(Signal)} once the action has happened.
     */
    public RiskDecision check(Signal signal, Position openPosition, double balance) {
        RiskDecision decision = assess(signal, config, lastTradeTimestamp, openPosition, balance);
        if (!decision.isAccepted()) {
            log.debug("Rejected {} signal at {}: {}", signal.direction().value(), signal.timestamp(), decision.rejections());
        }
        return decision;
    }

    /**
     * Record an action taken on the signal; the cooldown runs from its timestamp.
     */
    public void commit(Signal signal) {
        lastTradeTimestamp = signal.timestamp();
        log.debug("Committed {} signal at {}", signal.direction().value(), signal.timestamp());
    }

    /**
     * Pure form of the gate. Collects every rejection reason.
     *
     * @param lastTradeTimestamp timestamp of the last accepted action, null if none yet
     * @param openPosition       the open position, or null when flat
     * @param balance            cash available for a new entry
     */
    public static RiskDecision assess(Signal signal, StrategyConfig config, Long lastTradeTimestamp,
                                      Position openPosition, double balance) {
        List<String> rejections = new ArrayList<>();

        if (signal.confidence() < config.minConfidence()) {
            rejections.add(String.format(Locale.ROOT, "Confidence %.1f below minimum %.1f",
                signal.confidence(), config.minConfidence()));
        }

        if (lastTradeTimestamp != null) {
            long elapsed = signal.timestamp() - lastTradeTimestamp;
            if (elapsed < config.minTimeBetweenTradesMillis()) {
                rejections.add(String.format(Locale.ROOT, "Cooldown: %ds since last trade, minimum %ds",
                    elapsed / 1000, config.minTimeBetweenTrades()));
            }
        }

        if (signal.isBuy() && openPosition != null) {
            rejections.add("Position already open");
        }
        if (signal.isSell() && openPosition == null) {
            rejections.add("No open position to close (long-only)");
        }

        double quantity = 0;
        if (signal.isBuy() && openPosition == null) {
            double amount = entryAmount(config, balance);
            if (!(amount > 0) || !(signal.referencePrice() > 0)) {
                rejections.add(String.format(Locale.ROOT, "Insufficient balance: %.2f available", balance));
            } else {
                quantity = amount / signal.referencePrice();
            }
        }

        if (!rejections.isEmpty()) {
            return RiskDecision.rejected(signal, rejections);
        }

        if (signal.isSell()) {
            return RiskDecision.closeLong(signal, openPosition.quantity());
        }

        double entry = signal.referencePrice();
        return RiskDecision.openLong(
            signal,
            quantity,
            entry * (1 - config.stopLossPercent() / 100.0),
            entry * (1 + config.takeProfitPercent() / 100.0)
        );
    }

    /**
     * Quote amount for a new entry: a percentage of the balance, capped by maxTradeAmount.
     */
    private static double entryAmount(StrategyConfig config, double balance) {
        double amount = balance * (config.tradeAmountPercent() / 100.0);
        if (config.maxTradeAmount() != null) {
            amount = Math.min(amount, config.maxTradeAmount());
        }
        return amount;
    }

    public Long getLastTradeTimestamp() {
        return lastTradeTimestamp;
    }
}
