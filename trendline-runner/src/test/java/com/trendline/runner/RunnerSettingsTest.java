package com.trendline.runner;

import com.trendline.core.exception.InvalidConfigException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunnerSettingsTest {

    @TempDir
    Path tempDir;

    private Path yaml(String content) throws Exception {
        Path file = tempDir.resolve("trendline.yaml");
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("Nested strategy and timeframe code are read from YAML")
        void readsYaml() throws Exception {
            Path file = yaml("""
                symbols: [ETHUSDT, SOLUSDT]
                timeframe: 4h
                startDate: "2024-02-01"
                endDate: "2024-03-01"
                initialBalance: 5000
                commissionPercent: 0.075
                strategy:
                  emaShortPeriod: 9
                  emaLongPeriod: 21
                  minConfidence: 70
                paper:
                  pollIntervalSeconds: 5
                someFutureSetting: true
                """);

            RunnerSettings settings = RunnerSettings.load(file);

            assertEquals(List.of("ETHUSDT", "SOLUSDT"), settings.getSymbols());
            assertEquals(Timeframe.H4, settings.getTimeframe());
            assertEquals(9, settings.getStrategy().emaShortPeriod());
            assertEquals(21, settings.getStrategy().emaLongPeriod());
            assertEquals(70, settings.getStrategy().minConfidence());
            // Unset strategy keys keep their defaults
            assertEquals(14, settings.getStrategy().rsiPeriod());
            assertEquals(5, settings.getPaper().getPollIntervalSeconds());
            assertEquals("USDT", settings.getPaper().getQuoteAsset());
        }

        @Test
        @DisplayName("Missing file yields defaults")
        void missingFile() throws Exception {
            RunnerSettings settings = RunnerSettings.load(tempDir.resolve("absent.yaml"));

            assertEquals(List.of("BTCUSDT"), settings.getSymbols());
            assertEquals(Timeframe.H1, settings.getTimeframe());
            assertEquals(12, settings.getStrategy().emaShortPeriod());
        }

        @Test
        @DisplayName("An invalid strategy surfaces as InvalidConfigException")
        void invalidStrategy() throws Exception {
            Path file = yaml("""
                strategy:
                  emaShortPeriod: 30
                  emaLongPeriod: 10
                """);

            InvalidConfigException e = assertThrows(InvalidConfigException.class, () -> RunnerSettings.load(file));
            assertTrue(e.getMessage().contains("emaShortPeriod"), e.getMessage());
        }

        @Test
        @DisplayName("Saved settings load back unchanged")
        void saveAndLoad() throws Exception {
            RunnerSettings settings = new RunnerSettings();
            settings.setSymbols(List.of("BNBUSDT"));
            settings.setTimeframe(Timeframe.D1);
            settings.setDataDir(tempDir.resolve("data").toString());
            Path file = tempDir.resolve("nested").resolve("trendline.yaml");

            settings.save(file);
            RunnerSettings loaded = RunnerSettings.load(file);

            assertEquals(List.of("BNBUSDT"), loaded.getSymbols());
            assertEquals(Timeframe.D1, loaded.getTimeframe());
            assertEquals(settings.getDataPath(), loaded.getDataPath());
            assertEquals(settings.getStrategy(), loaded.getStrategy());
        }
    }

    @Nested
    @DisplayName("Backtest requests")
    class Requests {

        @Test
        @DisplayName("One request per symbol with UTC day boundaries")
        void toRequests() {
            RunnerSettings settings = new RunnerSettings();
            settings.setSymbols(List.of("BTCUSDT", "ETHUSDT"));
            settings.setStartDate("2024-01-01");
            settings.setEndDate("2024-01-02");

            List<BacktestRequest> requests = settings.toRequests();

            assertEquals(2, requests.size());
            assertEquals("ETHUSDT", requests.get(1).symbol());
            assertEquals(1_704_067_200_000L, requests.get(0).startDate());
            assertEquals(1_704_067_200_000L + 86_400_000L, requests.get(0).endDate());
            assertEquals(0.1, requests.get(0).commissionPercent());
        }

        @Test
        @DisplayName("A malformed date is a configuration error")
        void badDate() {
            RunnerSettings settings = new RunnerSettings();
            settings.setStartDate("01/02/2024");

            InvalidConfigException e = assertThrows(InvalidConfigException.class, settings::toRequests);
            assertTrue(e.getMessage().contains("startDate"), e.getMessage());
        }
    }
}
