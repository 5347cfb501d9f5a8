package com.trendline.engine;

import com.trendline.core.data.MarketDataProvider;
import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.exception.InsufficientDataException;
import com.trendline.core.exception.InvalidConfigException;
import com.trendline.core.exception.InvalidRangeException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.BacktestResult;
import com.trendline.core.model.Candle;
import com.trendline.core.model.EquityPoint;
import com.trendline.core.model.ExitReason;
import com.trendline.core.model.PerformanceStats;
import com.trendline.core.model.Position;
import com.trendline.core.model.PositionSide;
import com.trendline.core.model.Signal;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.model.Trade;
import com.trendline.engine.risk.RiskDecision;
import com.trendline.engine.risk.RiskManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Replays historical bars through one strategy instance.
 *
 * Each bar: update the indicators, check the open position's stop-loss and
 * take-profit, otherwise route any crossover signal through the risk gate,
 * then record equity. Any position still open on the last bar is closed at
 * its close with {@link ExitReason#END_OF_DATA}.
 *
 * A runner holds no state between runs and can be shared across threads;
 * every run builds its own indicator, signal and risk state.
 */
public class BacktestRunner {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private static final BooleanSupplier NEVER = () -> false;

    /**
     * Fetch the requested range and replay it.
     *
     * @throws InvalidRangeException    if {@code startDate >= endDate}; raised before any data is fetched
     * @throws DataUnavailableException if the provider cannot serve the range
     */
    public BacktestResult run(BacktestRequest request, MarketDataProvider provider) throws DataUnavailableException {
        return run(request, provider, null, NEVER);
    }

    public BacktestResult run(
            BacktestRequest request,
            MarketDataProvider provider,
            Consumer<Progress> onProgress,
            BooleanSupplier cancelled
    ) throws DataUnavailableException {
        validate(request);
        List<Candle> candles = provider.getBars(
            request.symbol(), request.timeframe(), request.startDate(), request.endDate());
        return run(request, candles, onProgress, cancelled);
    }

    public BacktestResult run(BacktestRequest request, List<Candle> candles) {
        return run(request, candles, null, NEVER);
    }

    /**
     * Replay already loaded bars. Bars outside {@code [startDate, endDate)} are ignored.
     *
     * @param onProgress progress callback, may be null
     * @param cancelled  polled before every bar, together with the thread's interrupt flag
     * @throws InvalidRangeException      on a malformed range or non-increasing timestamps
     * @throws InsufficientDataException  if fewer bars than the strategy's warm-up remain
     * @throws BacktestCancelledException if cancelled before the last bar was processed
     */
    public BacktestResult run(
            BacktestRequest request,
            List<Candle> candles,
            Consumer<Progress> onProgress,
            BooleanSupplier cancelled
    ) {
        validate(request);
        List<Candle> bars = inRange(candles, request);
        requireIncreasing(bars);

        StrategyConfig config = request.strategy();
        if (bars.size() < config.warmupBars()) {
            throw new InsufficientDataException(config.warmupBars(), bars.size());
        }

        log.info("Backtest {} {}: {} bars, initial balance {}",
            request.symbol(), request.timeframe(), bars.size(), request.initialBalance());

        Replay replay = new Replay(request);
        int total = bars.size();
        int progressStep = Math.max(1, total / 100);
        BooleanSupplier isCancelled = cancelled != null ? cancelled : NEVER;

        for (int i = 0; i < total; i++) {
            if (isCancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                log.info("Backtest {} {} cancelled at bar {}/{}", request.symbol(), request.timeframe(), i, total);
                throw new BacktestCancelledException(i, total);
            }

            replay.onBar(bars.get(i), i == total - 1);

            if (onProgress != null && ((i + 1) % progressStep == 0 || i == total - 1)) {
                int pct = (int) ((i + 1) * 100L / total);
                onProgress.accept(new Progress(i + 1, total, pct, "Processing bar " + (i + 1) + "/" + total));
            }
        }

        PerformanceStats stats = PerformanceAnalyzer.analyze(
            request.initialBalance(), replay.equityCurve, replay.trades, request.timeframe());
        BacktestResult result = new BacktestResult(
            request, replay.trades, replay.equityCurve, replay.signals, stats, total);

        log.info("Backtest complete: {}", result.getSummary());
        return result;
    }

    /**
     * Validate the request before any computation.
     */
    static void validate(BacktestRequest request) {
        if (request.startDate() >= request.endDate()) {
            throw new InvalidRangeException(String.format(Locale.ROOT,
                "startDate (%d) must be before endDate (%d)", request.startDate(), request.endDate()));
        }
        List<String> violations = new ArrayList<>();
        if (!(request.initialBalance() > 0) || Double.isInfinite(request.initialBalance())) {
            violations.add("initialBalance must be > 0 (was " + request.initialBalance() + ")");
        }
        if (!(request.commissionPercent() >= 0 && request.commissionPercent() < 100)) {
            violations.add("commissionPercent must be in [0, 100) (was " + request.commissionPercent() + ")");
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigException(violations);
        }
    }

    private static List<Candle> inRange(List<Candle> candles, BacktestRequest request) {
        List<Candle> bars = new ArrayList<>(candles.size());
        for (Candle c : candles) {
            if (c.timestamp() >= request.startDate() && c.timestamp() < request.endDate()) {
                bars.add(c);
            }
        }
        return bars;
    }

    private static void requireIncreasing(List<Candle> bars) {
        for (int i = 1; i < bars.size(); i++) {
            long prev = bars.get(i - 1).timestamp();
            long cur = bars.get(i).timestamp();
            if (cur <= prev) {
                throw new InvalidRangeException(String.format(Locale.ROOT,
                    "Bar timestamps must be strictly increasing: %d at index %d after %d", cur, i, prev));
            }
        }
    }

    /**
     * Mutable state of a single replay.
     */
    private static final class Replay {
        private final BacktestRequest request;
        private final double commissionRate;
        private final SignalPipeline pipeline;
        private final RiskManager riskManager;

        private final List<Trade> trades = new ArrayList<>();
        private final List<EquityPoint> equityCurve = new ArrayList<>();
        private final List<Signal> signals = new ArrayList<>();

        private StrategyState state = StrategyState.flat();
        private double cash;

        Replay(BacktestRequest request) {
            this.request = request;
            this.commissionRate = request.commissionRate();
            this.pipeline = new SignalPipeline(request.strategy());
            this.riskManager = new RiskManager(request.strategy());
            this.cash = request.initialBalance();
        }

        void onBar(Candle candle, boolean lastBar) {
            Optional<Signal> signal = pipeline.onBar(candle);
            signal.ifPresent(signals::add);

            if (state instanceof StrategyState.InPosition in) {
                Optional<ExitRules.Exit> exit = ExitRules.check(in.position(), candle);
                if (exit.isPresent()) {
                    close(in, candle.timestamp(), exit.get().price(), exit.get().reason());
                } else if (signal.isPresent()) {
                    RiskDecision decision = riskManager.evaluate(signal.get(), in.position(), cash);
                    if (decision.action() == RiskDecision.Action.CLOSE_LONG) {
                        close(in, candle.timestamp(), candle.close(), ExitReason.SIGNAL);
                    }
                }
            } else if (state instanceof StrategyState.Flat flat && signal.isPresent()) {
                RiskDecision decision = riskManager.evaluate(signal.get(), null, cash);
                if (decision.action() == RiskDecision.Action.OPEN_LONG) {
                    open(flat, decision, candle);
                }
            }

            if (lastBar && state instanceof StrategyState.InPosition in) {
                close(in, candle.timestamp(), candle.close(), ExitReason.END_OF_DATA);
            }

            double held = state.currentPosition().map(p -> p.marketValue(candle.close())).orElse(0.0);
            equityCurve.add(new EquityPoint(candle.timestamp(), cash + held));
        }

        private void open(StrategyState.Flat flat, RiskDecision decision, Candle candle) {
            double price = candle.close();
            // Entry value plus its commission may not exceed cash
            double quantity = Math.min(decision.quantity(), cash / (price * (1 + commissionRate)));
            double commission = quantity * price * commissionRate;
            cash -= quantity * price + commission;

            Position position = new Position(
                candle.timestamp(), price, quantity, PositionSide.LONG,
                decision.stopLossPrice(), decision.takeProfitPrice(), commission);
            state = flat.open(position);
            log.debug("{} opened long {} @ {} (SL {}, TP {})",
                request.symbol(), quantity, price, position.stopLossPrice(), position.takeProfitPrice());
        }

        private void close(StrategyState.InPosition in, long timestamp, double price, ExitReason reason) {
            Position position = in.position();
            double exitValue = position.quantity() * price;
            double commission = exitValue * commissionRate;
            cash += exitValue - commission;

            Trade trade = Trade.close(position, timestamp, price, reason, commission);
            trades.add(trade);
            state = in.close();
            log.debug("{} closed long @ {} ({}), profit {}", request.symbol(), price, reason.value(), trade.profit());
        }
    }

    /**
     * Progress information for callbacks.
     */
    public record Progress(int current, int total, int percentage, String message) {}
}
