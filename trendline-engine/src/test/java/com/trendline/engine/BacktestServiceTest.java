package com.trendline.engine;

import com.trendline.core.data.InMemoryMarketDataProvider;
import com.trendline.core.data.MarketDataProvider;
import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.BacktestResult;
import com.trendline.core.model.Candle;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.model.Timeframe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.trendline.engine.TestBars.*;
import static org.junit.jupiter.api.Assertions.*;

class BacktestServiceTest {

    private List<Candle> candles;
    private StrategyConfig config;
    private InMemoryMarketDataProvider provider;
    private BacktestService service;

    @BeforeEach
    void setUp() {
        candles = wave(400);
        config = StrategyConfig.defaults().toBuilder().minConfidence(0).minTimeBetweenTrades(0).build();
        provider = new InMemoryMarketDataProvider()
            .put("BTCUSDT", Timeframe.H1, candles)
            .put("ETHUSDT", Timeframe.H1, candles.subList(0, 200));
    }

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.close();
        }
    }

    private BacktestRequest request(String symbol) {
        return new BacktestRequest(symbol, Timeframe.H1, T0, T0 + 400 * HOUR, 10_000, config);
    }

    @Test
    @DisplayName("Parallel runs match sequential runs, in request order")
    void parallelMatchesSequential() throws Exception {
        service = new BacktestService(provider, 4);
        List<BacktestRequest> requests = List.of(request("BTCUSDT"), request("ETHUSDT"), request("BTCUSDT"));

        List<BacktestResult> results = service.runAll(requests);

        BacktestRunner runner = new BacktestRunner();
        for (int i = 0; i < requests.size(); i++) {
            assertEquals(runner.run(requests.get(i), provider), results.get(i));
        }
    }

    @Test
    @DisplayName("A failing run does not affect the others")
    void failureIsolated() throws Exception {
        service = new BacktestService(provider, 2);

        BacktestService.Job missing = service.submit(request("SOLUSDT"));
        BacktestService.Job ok = service.submit(request("BTCUSDT"));

        ExecutionException e = assertThrows(ExecutionException.class, () -> missing.result().get(10, TimeUnit.SECONDS));
        assertInstanceOf(DataUnavailableException.class, e.getCause());
        assertEquals(400, ok.result().get(10, TimeUnit.SECONDS).barsProcessed());
    }

    @Test
    @DisplayName("A queued job cancelled before it starts completes with BacktestCancelledException")
    void cancelQueued() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        MarketDataProvider blocking = (symbol, timeframe, start, end) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return provider.getBars(symbol, timeframe, start, end);
        };
        service = new BacktestService(blocking, 1);

        BacktestService.Job first = service.submit(request("BTCUSDT"));
        BacktestService.Job queued = service.submit(request("BTCUSDT"));
        queued.cancel();
        release.countDown();

        ExecutionException e = assertThrows(ExecutionException.class, () -> queued.result().get(10, TimeUnit.SECONDS));
        assertInstanceOf(BacktestCancelledException.class, e.getCause());
        assertTrue(queued.isCancelled());
        assertNotNull(first.result().get(10, TimeUnit.SECONDS));
    }
}
