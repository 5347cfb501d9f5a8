package com.trendline.runner;

import com.trendline.core.data.CsvMarketDataProvider;
import com.trendline.core.model.BacktestResult;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;
import com.trendline.engine.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrendlineRunnerAppTest {

    private static final long T0 = 1_704_067_200_000L; // 2024-01-01T00:00Z

    @TempDir
    Path tempDir;

    private Path dataDir;
    private Path resultsDir;

    @BeforeEach
    void setUp() throws Exception {
        dataDir = tempDir.resolve("data");
        resultsDir = tempDir.resolve("results");
        CsvMarketDataProvider csv = new CsvMarketDataProvider(dataDir);
        csv.write("BTCUSDT", Timeframe.H1, hourlyWave(400, 100));
        csv.write("ETHUSDT", Timeframe.H1, hourlyWave(400, 50));
    }

    private static List<Candle> hourlyWave(int count, double base) {
        List<Candle> candles = new ArrayList<>();
        double previous = base;
        for (int i = 0; i < count; i++) {
            double close = base + 10 * Math.sin(i / 6.0) + 4 * Math.sin(i / 2.3);
            candles.add(new Candle(T0 + i * 3_600_000L, previous,
                Math.max(previous, close) + 0.5, Math.min(previous, close) - 0.5, close, 1000));
            previous = close;
        }
        return candles;
    }

    private Path settings(String symbols) throws Exception {
        Path file = tempDir.resolve("trendline.yaml");
        Files.writeString(file, String.join("\n",
            "dataDir: " + dataDir,
            "resultsDir: " + resultsDir,
            "symbols: " + symbols,
            "timeframe: 1h",
            "startDate: \"2024-01-01\"",
            "endDate: \"2024-01-16\"",
            "workers: 2",
            "strategy:",
            "  minConfidence: 0",
            "  minTimeBetweenTrades: 0",
            ""));
        return file;
    }

    @Test
    @DisplayName("backtest replays the configured symbol and saves its result")
    void backtestSingleSymbol() throws Exception {
        Path file = settings("[BTCUSDT]");

        assertEquals(TrendlineRunnerApp.EXIT_OK, TrendlineRunnerApp.run(new String[]{"backtest", file.toString()}));

        Path result = resultsDir.resolve("BTCUSDT_1h").resolve("result.json");
        assertTrue(Files.exists(result));
        BacktestResult loaded = new ResultStore(resultsDir).read(result);
        assertEquals(360, loaded.barsProcessed());
        assertEquals(360, loaded.equityCurve().size());
        assertFalse(loaded.signals().isEmpty());
    }

    @Test
    @DisplayName("Several symbols are run in parallel and each is saved")
    void backtestSeveralSymbols() throws Exception {
        Path file = settings("[BTCUSDT, ETHUSDT]");

        assertEquals(TrendlineRunnerApp.EXIT_OK, TrendlineRunnerApp.run(new String[]{"backtest", file.toString()}));

        assertTrue(Files.exists(resultsDir.resolve("BTCUSDT_1h").resolve("result.json")));
        assertTrue(Files.exists(resultsDir.resolve("ETHUSDT_1h").resolve("result.json")));
    }

    @Test
    @DisplayName("Missing market data fails the run without saving anything")
    void missingData() throws Exception {
        Path file = settings("[SOLUSDT]");

        assertEquals(TrendlineRunnerApp.EXIT_FAILED, TrendlineRunnerApp.run(new String[]{"backtest", file.toString()}));
        assertFalse(Files.exists(resultsDir.resolve("SOLUSDT_1h")));
    }

    @Test
    @DisplayName("Invalid settings fail before any backtest runs")
    void invalidSettings() throws Exception {
        Path file = tempDir.resolve("bad.yaml");
        Files.writeString(file, "strategy:\n  stopLossPercent: 150\n");

        assertEquals(TrendlineRunnerApp.EXIT_FAILED, TrendlineRunnerApp.run(new String[]{"backtest", file.toString()}));
    }

    @Test
    @DisplayName("Unknown command is a usage error")
    void unknownCommand() throws Exception {
        Path file = settings("[BTCUSDT]");

        assertEquals(TrendlineRunnerApp.EXIT_USAGE, TrendlineRunnerApp.run(new String[]{"optimize", file.toString()}));
    }
}
