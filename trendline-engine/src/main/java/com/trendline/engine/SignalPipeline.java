package com.trendline.engine;

import com.trendline.core.indicators.IndicatorCalculator;
import com.trendline.core.model.Candle;
import com.trendline.core.model.IndicatorPoint;
import com.trendline.core.model.Signal;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.signal.SignalGenerator;

import java.util.Optional;

/**
 * Per-bar indicator update followed by crossover detection. Shared by the
 * backtest replay and live mode so both see the same signals for the same bars.
 */
public class SignalPipeline {

    private final IndicatorCalculator calculator;
    private final SignalGenerator generator;

    public SignalPipeline(StrategyConfig config) {
        this.calculator = new IndicatorCalculator(config);
        this.generator = new SignalGenerator(config);
    }

    /**
     * Append a closed bar.
     *
     * @return the signal fired on this bar, if any
     */
    public Optional<Signal> onBar(Candle candle) {
        Optional<IndicatorPoint> point = calculator.append(candle);
        if (point.isEmpty()) {
            return Optional.empty();
        }
        return generator.onPoint(point.get(), candle.close());
    }

}
