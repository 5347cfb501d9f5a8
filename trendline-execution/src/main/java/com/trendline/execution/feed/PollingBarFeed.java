package com.trendline.execution.feed;

import com.trendline.core.data.MarketDataProvider;
import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Polls a market data provider and delivers each closed bar exactly once, in
 * timestamp order, to a single consumer. A bar is closed once its open time
 * plus the timeframe duration has passed.
 */
public class PollingBarFeed implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PollingBarFeed.class);

    private final MarketDataProvider provider;
    private final String symbol;
    private final Timeframe timeframe;
    private final Consumer<Candle> consumer;
    private final Clock clock;
    private final Duration pollInterval;

    private ScheduledExecutorService scheduler;
    private long nextStart;
    private long lastDelivered = Long.MIN_VALUE;

    /**
     * @param startTime open time of the first bar to deliver, epoch millis; earlier bars seed nothing
     */
    public PollingBarFeed(MarketDataProvider provider, String symbol, Timeframe timeframe,
                          Consumer<Candle> consumer, Clock clock, Duration pollInterval, long startTime) {
        this.provider = provider;
        this.symbol = symbol;
        this.timeframe = timeframe;
        this.consumer = consumer;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.nextStart = startTime;
    }

    public synchronized void start() {
        if (scheduler != null) {
            log.warn("Bar feed for {} {} already started", symbol, timeframe);
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "BarFeed-" + symbol + "-" + timeframe.code());
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::pollSafely, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Polling {} {} every {}", symbol, timeframe, pollInterval);
    }

    /**
     * Fetch and deliver newly closed bars once.
     *
     * @return number of bars delivered
     * @throws DataUnavailableException if the provider cannot serve the range
     */
    public synchronized int poll() throws DataUnavailableException {
        long now = clock.millis();
        if (nextStart >= now) {
            return 0;
        }

        List<Candle> candles = provider.getBars(symbol, timeframe, nextStart, now);
        int delivered = 0;
        for (Candle candle : candles) {
            if (candle.timestamp() <= lastDelivered) {
                continue;
            }
            if (candle.timestamp() + timeframe.millis() > now) {
                break;
            }
            lastDelivered = candle.timestamp();
            nextStart = candle.timestamp() + 1;
            delivered++;
            consumer.accept(candle);
        }
        if (delivered > 0) {
            log.debug("Delivered {} {} {} bars, last {}", delivered, symbol, timeframe, lastDelivered);
        }
        return delivered;
    }

    private void pollSafely() {
        try {
            poll();
        } catch (DataUnavailableException e) {
            log.warn("No data for {} {}, retrying in {}: {}", symbol, timeframe, pollInterval, e.getMessage());
        } catch (RuntimeException e) {
            // An escaping exception would cancel the schedule
            log.error("Bar feed for {} {} failed; retrying in {}", symbol, timeframe, pollInterval, e);
        }
    }

    public synchronized long getLastDelivered() {
        return lastDelivered;
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
