package com.trendline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.trendline.core.exception.InvalidConfigException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated EMA-crossover / RSI strategy parameters.
 * Construction fails with {@link InvalidConfigException} when any constraint is violated,
 * so an instance is always safe to hand to the engine.
 *
 * @param minTimeBetweenTrades cooldown between accepted actions, in seconds
 * @param maxTradeAmount       optional cap on the notional of one entry (quote currency)
 * @param autoTradingEnabled   live mode only: place orders for accepted signals
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = StrategyConfig.Builder.class)
public record StrategyConfig(
    int emaShortPeriod,
    int emaLongPeriod,
    int rsiPeriod,
    double rsiOverbought,
    double rsiOversold,
    double minConfidence,
    double tradeAmountPercent,
    double stopLossPercent,
    double takeProfitPercent,
    long minTimeBetweenTrades,
    Double maxTradeAmount,
    boolean autoTradingEnabled
) {
    public StrategyConfig {
        List<String> violations = new ArrayList<>();

        if (emaShortPeriod < 2) {
            violations.add("emaShortPeriod must be >= 2 (was " + emaShortPeriod + ")");
        }
        if (emaLongPeriod < 2) {
            violations.add("emaLongPeriod must be >= 2 (was " + emaLongPeriod + ")");
        }
        if (emaShortPeriod >= emaLongPeriod) {
            violations.add("emaShortPeriod (" + emaShortPeriod + ") must be less than emaLongPeriod (" + emaLongPeriod + ")");
        }
        if (rsiPeriod < 2) {
            violations.add("rsiPeriod must be >= 2 (was " + rsiPeriod + ")");
        }
        if (!inRange(rsiOversold, 0, 100) || !inRange(rsiOverbought, 0, 100)) {
            violations.add("RSI thresholds must be within [0, 100]");
        } else if (rsiOverbought <= rsiOversold) {
            violations.add("rsiOverbought (" + rsiOverbought + ") must be greater than rsiOversold (" + rsiOversold + ")");
        }
        if (!inRange(minConfidence, 0, 100)) {
            violations.add("minConfidence must be within [0, 100] (was " + minConfidence + ")");
        }
        if (!(tradeAmountPercent > 0 && tradeAmountPercent <= 100)) {
            violations.add("tradeAmountPercent must be in (0, 100] (was " + tradeAmountPercent + ")");
        }
        if (!(stopLossPercent > 0 && stopLossPercent < 100)) {
            violations.add("stopLossPercent must be in (0, 100) (was " + stopLossPercent + ")");
        }
        if (!(takeProfitPercent > 0) || Double.isInfinite(takeProfitPercent)) {
            violations.add("takeProfitPercent must be > 0 (was " + takeProfitPercent + ")");
        }
        if (minTimeBetweenTrades < 0) {
            violations.add("minTimeBetweenTrades must be >= 0 (was " + minTimeBetweenTrades + ")");
        }
        if (maxTradeAmount != null && !(maxTradeAmount > 0)) {
            violations.add("maxTradeAmount must be > 0 when set (was " + maxTradeAmount + ")");
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigException(violations);
        }
    }

    private static boolean inRange(double value, double min, double max) {
        return value >= min && value <= max;
    }

    /**
     * Bars needed before the first IndicatorPoint: the long EMA needs {@code emaLongPeriod}
     * closes and RSI needs {@code rsiPeriod} price changes.
     */
    @JsonIgnore
    public int warmupBars() {
        return Math.max(emaLongPeriod, rsiPeriod + 1);
    }

    /**
     * Cooldown in milliseconds, comparable with bar timestamps.
     */
    @JsonIgnore
    public long minTimeBetweenTradesMillis() {
        return minTimeBetweenTrades * 1000L;
    }

    /**
     * Defaults from the original trading settings: 12/26 EMA, 14 RSI at 70/30.
     */
    public static StrategyConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .emaShortPeriod(emaShortPeriod)
            .emaLongPeriod(emaLongPeriod)
            .rsiPeriod(rsiPeriod)
            .rsiOverbought(rsiOverbought)
            .rsiOversold(rsiOversold)
            .minConfidence(minConfidence)
            .tradeAmountPercent(tradeAmountPercent)
            .stopLossPercent(stopLossPercent)
            .takeProfitPercent(takeProfitPercent)
            .minTimeBetweenTrades(minTimeBetweenTrades)
            .maxTradeAmount(maxTradeAmount)
            .autoTradingEnabled(autoTradingEnabled);
    }

    /**
     * Load a strategy config from a YAML file. Missing keys take their defaults.
     */
    public static StrategyConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return defaults();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            return mapper.readValue(path.toFile(), StrategyConfig.class);
        } catch (JsonMappingException e) {
            throw unwrapConfigError(e, path);
        }
    }

    /**
     * Jackson wraps exceptions thrown while building the value; surface the
     * constraint violation itself when that is what failed.
     */
    private static IOException unwrapConfigError(JsonMappingException e, Path path) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof InvalidConfigException ice) {
                throw ice;
            }
            cause = cause.getCause();
        }
        return new IOException("Failed to read strategy config " + path + ": " + e.getOriginalMessage(), e);
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private int emaShortPeriod = 12;
        private int emaLongPeriod = 26;
        private int rsiPeriod = 14;
        private double rsiOverbought = 70.0;
        private double rsiOversold = 30.0;
        private double minConfidence = 60.0;
        private double tradeAmountPercent = 10.0;
        private double stopLossPercent = 2.0;
        private double takeProfitPercent = 4.0;
        private long minTimeBetweenTrades = 300;
        private Double maxTradeAmount;
        private boolean autoTradingEnabled;

        public Builder emaShortPeriod(int v) { this.emaShortPeriod = v; return this; }
        public Builder emaLongPeriod(int v) { this.emaLongPeriod = v; return this; }
        public Builder rsiPeriod(int v) { this.rsiPeriod = v; return this; }
        public Builder rsiOverbought(double v) { this.rsiOverbought = v; return this; }
        public Builder rsiOversold(double v) { this.rsiOversold = v; return this; }
        public Builder minConfidence(double v) { this.minConfidence = v; return this; }
        public Builder tradeAmountPercent(double v) { this.tradeAmountPercent = v; return this; }
        public Builder stopLossPercent(double v) { this.stopLossPercent = v; return this; }
        public Builder takeProfitPercent(double v) { this.takeProfitPercent = v; return this; }
        public Builder minTimeBetweenTrades(long v) { this.minTimeBetweenTrades = v; return this; }
        public Builder maxTradeAmount(Double v) { this.maxTradeAmount = v; return this; }
        public Builder autoTradingEnabled(boolean v) { this.autoTradingEnabled = v; return this; }

        public StrategyConfig build() {
            return new StrategyConfig(
                emaShortPeriod, emaLongPeriod, rsiPeriod,
                rsiOverbought, rsiOversold, minConfidence,
                tradeAmountPercent, stopLossPercent, takeProfitPercent,
                minTimeBetweenTrades, maxTradeAmount, autoTradingEnabled
            );
        }
    }
}
