package com.trendline.core.signal;

import com.trendline.core.model.IndicatorPoint;
import com.trendline.core.model.Signal;
import com.trendline.core.model.SignalDirection;
import com.trendline.core.model.SignalStrength;
import com.trendline.core.model.StrategyConfig;

import java.util.Locale;
import java.util.Optional;

/**
 * Event-driven EMA crossover detector with RSI confirmation.
 *
 * A buy fires on the bar where emaShort moves from &lt;= emaLong to &gt; emaLong,
 * a sell on the mirror transition. Bars without a crossover emit nothing.
 * Keeps only the previous indicator point, so one instance serves one
 * strategy instance and must be fed points in bar order.
 */
public class SignalGenerator {

    /** Base confidence of any crossover */
    static final double BASE_CONFIDENCE = 50;
    /** Bonus when RSI is beyond its threshold in the confirming direction */
    static final double STRONG_BONUS = 30;
    /** Bonus when RSI is within {@link #MODERATE_BAND} points of the threshold */
    static final double MODERATE_BONUS = 15;
    /** Distance from the RSI threshold that still counts as moderate confirmation */
    static final double MODERATE_BAND = 10;
    /** Points per unit of relative EMA spread */
    static final double SPREAD_WEIGHT = 200;
    /** Cap on the EMA spread contribution */
    static final double MAX_SPREAD_POINTS = 20;

    private final StrategyConfig config;
    private IndicatorPoint previous;

    public SignalGenerator(StrategyConfig config) {
        this.config = config;
    }

    /**
     * Feed the next indicator point.
     *
     * @param referencePrice close of the bar the point belongs to
     * @return a signal if this bar is a crossover
     */
    public Optional<Signal> onPoint(IndicatorPoint point, double referencePrice) {
        IndicatorPoint prior = previous;
        previous = point;
        if (prior == null) {
            return Optional.empty();
        }
        return detectCrossover(prior, point)
            .map(direction -> createSignal(direction, point, referencePrice));
    }

    /**
     * Forget the previous point, e.g. after a gap in the feed.
     */
    public void reset() {
        previous = null;
    }

    Signal createSignal(SignalDirection direction, IndicatorPoint point, double referencePrice) {
        SignalStrength strength = classify(direction, point.rsi(), config);
        double confidence = confidence(strength, point);
        String message = describe(direction, strength, point, config);
        return new Signal(point.timestamp(), direction, strength, confidence, referencePrice, point, message);
    }

    /**
     * Crossover between two consecutive points, if any.
     */
    public static Optional<SignalDirection> detectCrossover(IndicatorPoint previous, IndicatorPoint current) {
        if (previous.emaShort() <= previous.emaLong() && current.emaShort() > current.emaLong()) {
            return Optional.of(SignalDirection.BUY);
        }
        if (previous.emaShort() >= previous.emaLong() && current.emaShort() < current.emaLong()) {
            return Optional.of(SignalDirection.SELL);
        }
        return Optional.empty();
    }

    /**
     * Strength of a crossover given the RSI on the crossover bar.
     */
    public static SignalStrength classify(SignalDirection direction, double rsi, StrategyConfig config) {
        if (direction == SignalDirection.BUY) {
            if (rsi <= config.rsiOversold()) {
                return SignalStrength.STRONG;
            }
            if (rsi <= config.rsiOversold() + MODERATE_BAND) {
                return SignalStrength.MODERATE;
            }
        } else {
            if (rsi >= config.rsiOverbought()) {
                return SignalStrength.STRONG;
            }
            if (rsi >= config.rsiOverbought() - MODERATE_BAND) {
                return SignalStrength.MODERATE;
            }
        }
        return SignalStrength.WEAK;
    }

    /**
     * Confidence score in [0, 100]: base, RSI confirmation bonus and capped EMA spread term.
     */
    public static double confidence(SignalStrength strength, IndicatorPoint point) {
        double score = BASE_CONFIDENCE;
        switch (strength) {
            case STRONG -> score += STRONG_BONUS;
            case MODERATE -> score += MODERATE_BONUS;
            case WEAK -> { }
        }
        score += Math.min(point.emaSpread() * SPREAD_WEIGHT, MAX_SPREAD_POINTS);
        return Math.max(0, Math.min(100, score));
    }

    static String describe(SignalDirection direction, SignalStrength strength,
                           IndicatorPoint point, StrategyConfig config) {
        String cross = direction == SignalDirection.BUY
            ? String.format(Locale.ROOT, "EMA Golden Cross (%.2f > %.2f)", point.emaShort(), point.emaLong())
            : String.format(Locale.ROOT, "EMA Death Cross (%.2f < %.2f)", point.emaShort(), point.emaLong());

        String rsi = switch (strength) {
            case STRONG -> direction == SignalDirection.BUY
                ? String.format(Locale.ROOT, "RSI Oversold (%.1f <= %.1f)", point.rsi(), config.rsiOversold())
                : String.format(Locale.ROOT, "RSI Overbought (%.1f >= %.1f)", point.rsi(), config.rsiOverbought());
            case MODERATE -> direction == SignalDirection.BUY
                ? String.format(Locale.ROOT, "RSI Near Oversold (%.1f)", point.rsi())
                : String.format(Locale.ROOT, "RSI Near Overbought (%.1f)", point.rsi());
            case WEAK -> String.format(Locale.ROOT, "RSI Unconfirmed (%.1f)", point.rsi());
        };

        return String.format(Locale.ROOT, "%s %s: %s + %s",
            capitalize(strength.value()), direction.value(), cross, rsi);
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
