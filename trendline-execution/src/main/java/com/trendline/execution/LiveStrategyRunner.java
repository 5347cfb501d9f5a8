package com.trendline.execution;

import com.trendline.core.exception.TradeExecutionException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.ExitReason;
import com.trendline.core.model.Position;
import com.trendline.core.model.PositionSide;
import com.trendline.core.model.Signal;
import com.trendline.core.model.SignalDirection;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.model.Trade;
import com.trendline.engine.ExitRules;
import com.trendline.engine.SignalPipeline;
import com.trendline.engine.StrategyState;
import com.trendline.engine.risk.RiskDecision;
import com.trendline.engine.risk.RiskManager;
import com.trendline.execution.adapter.ExecutionAdapter;
import com.trendline.execution.adapter.Fill;
import com.trendline.execution.journal.ErrorEvent;
import com.trendline.execution.journal.FillEvent;
import com.trendline.execution.journal.SignalEvent;
import com.trendline.execution.journal.SignalJournal;
import com.trendline.execution.journal.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Live counterpart of the backtest replay for one symbol: the same indicator,
 * signal, stop-loss / take-profit and risk rules per closed bar, with accepted
 * actions sent to an {@link ExecutionAdapter}.
 *
 * A failed order leaves the position state unchanged; it is logged, journaled
 * and reported to listeners, and the next bar is evaluated normally. It does
 * not start the risk cooldown.
 */
public class LiveStrategyRunner implements Consumer<Candle> {

    private static final Logger log = LoggerFactory.getLogger(LiveStrategyRunner.class);

    private final String symbol;
    private final StrategyConfig config;
    private final ExecutionAdapter adapter;
    private final SignalJournal journal;
    private final SignalPipeline pipeline;
    private final RiskManager riskManager;
    private final List<LiveListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Trade> closedTrades = new ArrayList<>();

    private StrategyState state = StrategyState.flat();

    /**
     * @param journal where events are recorded, may be null
     */
    public LiveStrategyRunner(String symbol, StrategyConfig config, ExecutionAdapter adapter, SignalJournal journal) {
        this.symbol = symbol;
        this.config = config;
        this.adapter = adapter;
        this.journal = journal;
        this.pipeline = new SignalPipeline(config);
        this.riskManager = new RiskManager(config);
    }

    public void addListener(LiveListener listener) {
        listeners.add(listener);
    }

    @Override
    public void accept(Candle candle) {
        onBar(candle);
    }

    /**
     * Evaluate one closed bar.
     */
    public synchronized void onBar(Candle candle) {
        Optional<Signal> signal = pipeline.onBar(candle);

        if (state instanceof StrategyState.InPosition in) {
            Optional<ExitRules.Exit> exit = ExitRules.check(in.position(), candle);
            if (exit.isPresent()) {
                signal.ifPresent(s -> recordSignal(s, null));
                exitPosition(in, candle.timestamp(), exit.get().price(), exit.get().reason());
                return;
            }
            if (signal.isPresent()) {
                RiskDecision decision = riskManager.check(signal.get(), in.position(), quoteBalance());
                recordSignal(signal.get(), decision);
                if (decision.action() == RiskDecision.Action.CLOSE_LONG) {
                    boolean done = !tradingEnabled(decision)
                        || exitPosition(in, candle.timestamp(), candle.close(), ExitReason.SIGNAL);
                    if (done) {
                        riskManager.commit(signal.get());
                    }
                }
            }
        } else if (state instanceof StrategyState.Flat flat && signal.isPresent()) {
            RiskDecision decision = riskManager.check(signal.get(), null, quoteBalance());
            recordSignal(signal.get(), decision);
            if (decision.action() == RiskDecision.Action.OPEN_LONG) {
                boolean done = !tradingEnabled(decision) || enterPosition(flat, decision, candle);
                if (done) {
                    riskManager.commit(signal.get());
                }
            }
        }
    }

    private boolean tradingEnabled(RiskDecision decision) {
        if (!config.autoTradingEnabled()) {
            log.info("{} {} accepted but auto trading is disabled; no order placed", symbol, decision.action());
            return false;
        }
        return true;
    }

    /**
     * @return true if the entry was filled
     */
    private boolean enterPosition(StrategyState.Flat flat, RiskDecision decision, Candle candle) {
        double price = candle.close();
        // Notional plus the venue fee may not exceed the quote balance
        double affordable = quoteBalance() / (price * (1 + adapter.getFeeRate()));
        double quantity = Math.min(decision.quantity(), affordable);
        Fill fill;
        try {
            fill = adapter.placeOrder(SignalDirection.BUY, quantity, price);
        } catch (TradeExecutionException e) {
            executionFailed(decision.action(), candle.timestamp(), e);
            return false;
        }
        recordFill(fill);

        double fillPrice = fill.price();
        Position position = new Position(
            candle.timestamp(),
            fillPrice,
            fill.quantity(),
            PositionSide.LONG,
            fillPrice * (1 - config.stopLossPercent() / 100.0),
            fillPrice * (1 + config.takeProfitPercent() / 100.0),
            fill.fee()
        );
        state = flat.open(position);
        log.info("{} entered long {} @ {} (SL {}, TP {})", symbol, position.quantity(), fillPrice,
            position.stopLossPrice(), position.takeProfitPrice());
        return true;
    }

    /**
     * @return true if the exit was filled
     */
    private boolean exitPosition(StrategyState.InPosition in, long timestamp, double price, ExitReason reason) {
        Position position = in.position();
        Fill fill;
        try {
            fill = adapter.placeOrder(SignalDirection.SELL, position.quantity(), price);
        } catch (TradeExecutionException e) {
            executionFailed(RiskDecision.Action.CLOSE_LONG, timestamp, e);
            return false;
        }
        recordFill(fill);

        Trade trade = Trade.close(position, timestamp, fill.price(), reason, fill.fee());
        closedTrades.add(trade);
        state = in.close();
        log.info("{} exited long @ {} ({}), profit {}", symbol, fill.price(), reason.value(), trade.profit());

        if (journal != null) {
            journal.log(new TradeEvent(Instant.ofEpochMilli(timestamp), symbol, trade));
        }
        notifyListeners(l -> l.onTradeClosed(trade));
        return true;
    }

    private void recordSignal(Signal signal, RiskDecision decision) {
        log.info("{} signal: {}", symbol, signal.message());
        if (journal != null) {
            journal.log(new SignalEvent(
                Instant.ofEpochMilli(signal.timestamp()),
                symbol,
                signal,
                decision != null ? decision.action().name() : null,
                decision != null ? decision.rejections() : List.of()));
        }
        notifyListeners(l -> l.onSignal(signal, decision));
    }

    private void recordFill(Fill fill) {
        if (journal != null) {
            journal.log(new FillEvent(Instant.ofEpochMilli(fill.timestamp()), symbol, fill));
        }
        notifyListeners(l -> l.onFill(fill));
    }

    private void executionFailed(RiskDecision.Action action, long timestamp, TradeExecutionException e) {
        log.warn("{} {} order failed on {}: {}", symbol, action, adapter.getVenueName(), e.getMessage());
        if (journal != null) {
            journal.log(new ErrorEvent(Instant.ofEpochMilli(timestamp), symbol, action.name(), e.getMessage()));
        }
        notifyListeners(l -> l.onExecutionError(action, e));
    }

    private double quoteBalance() {
        return adapter.getBalance(adapter.getQuoteAsset());
    }

    private void notifyListeners(Consumer<LiveListener> call) {
        for (LiveListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.warn("Live listener error", e);
            }
        }
    }

    public synchronized StrategyState getState() {
        return state;
    }

    public synchronized List<Trade> getClosedTrades() {
        return Collections.unmodifiableList(new ArrayList<>(closedTrades));
    }
}
