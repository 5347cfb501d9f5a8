package com.trendline.core.data;

import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvMarketDataProviderTest {

    private static final long HOUR = 3_600_000L;
    private static final long T0 = 1_704_067_200_000L; // 2024-01-01T00:00Z

    @TempDir
    Path dataDir;

    private CsvMarketDataProvider provider;
    private List<Candle> candles;

    @BeforeEach
    void setUp() throws IOException {
        provider = new CsvMarketDataProvider(dataDir);
        candles = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            candles.add(new Candle(T0 + i * HOUR, 100 + i, 101 + i, 99 + i, 100.5 + i, 1000));
        }
        provider.write("BTCUSDT", Timeframe.H1, candles);
    }

    @Nested
    @DisplayName("Reading ranges")
    class ReadingRanges {

        @Test
        @DisplayName("Files live at <dataDir>/<SYMBOL>/<timeframe>.csv")
        void layout() {
            assertTrue(Files.exists(dataDir.resolve("BTCUSDT").resolve("1h.csv")));
        }

        @Test
        @DisplayName("Start is inclusive and end is exclusive")
        void halfOpenRange() throws DataUnavailableException {
            List<Candle> bars = provider.getBars("BTCUSDT", Timeframe.H1, T0 + 2 * HOUR, T0 + 5 * HOUR);

            assertEquals(3, bars.size());
            assertEquals(T0 + 2 * HOUR, bars.get(0).timestamp());
            assertEquals(T0 + 4 * HOUR, bars.get(2).timestamp());
            assertEquals(candles.get(2), bars.get(0));
        }

        @Test
        @DisplayName("A range past the last bar is empty, not unavailable")
        void emptyRange() throws DataUnavailableException {
            assertTrue(provider.getBars("BTCUSDT", Timeframe.H1, T0 + 100 * HOUR, T0 + 200 * HOUR).isEmpty());
        }

        @Test
        @DisplayName("Symbols are matched case-insensitively")
        void symbolCase() throws DataUnavailableException {
            assertEquals(10, provider.getBars("btcusdt", Timeframe.H1, T0, T0 + 10 * HOUR).size());
        }
    }

    @Nested
    @DisplayName("Unavailable data")
    class UnavailableData {

        @Test
        @DisplayName("No file for the timeframe")
        void missingFile() {
            assertThrows(DataUnavailableException.class,
                () -> provider.getBars("BTCUSDT", Timeframe.D1, T0, T0 + 10 * HOUR));
        }

        @Test
        @DisplayName("Malformed line reports its line number")
        void malformedLine() throws IOException {
            Path file = provider.fileFor("ETHUSDT", Timeframe.H1);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "timestamp,open,high,low,close,volume\n" + T0 + ",1,2,0.5,1.5,10\nbroken\n");

            DataUnavailableException e = assertThrows(DataUnavailableException.class,
                () -> provider.getBars("ETHUSDT", Timeframe.H1, T0, T0 + 10 * HOUR));
            assertTrue(e.getMessage().contains("line 3"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("In-memory provider")
    class InMemory {

        @Test
        @DisplayName("Serves registered series by half-open range")
        void servesRegisteredSeries() throws DataUnavailableException {
            InMemoryMarketDataProvider memory = new InMemoryMarketDataProvider()
                .put("BTCUSDT", Timeframe.H1, candles);

            assertEquals(candles.subList(0, 4), memory.getBars("BTCUSDT", Timeframe.H1, T0, T0 + 4 * HOUR));
            assertThrows(DataUnavailableException.class,
                () -> memory.getBars("ETHUSDT", Timeframe.H1, T0, T0 + 4 * HOUR));
        }

        @Test
        @DisplayName("Agrees with the CSV provider on an empty range")
        void emptyRange() throws DataUnavailableException {
            InMemoryMarketDataProvider memory = new InMemoryMarketDataProvider()
                .put("BTCUSDT", Timeframe.H1, candles);

            assertEquals(provider.getBars("BTCUSDT", Timeframe.H1, T0 + 100 * HOUR, T0 + 200 * HOUR),
                memory.getBars("BTCUSDT", Timeframe.H1, T0 + 100 * HOUR, T0 + 200 * HOUR));
        }

        @Test
        @DisplayName("Serves bars in registration order without sorting them")
        void keepsOrder() throws DataUnavailableException {
            List<Candle> shuffled = List.of(candles.get(2), candles.get(0), candles.get(1));
            InMemoryMarketDataProvider memory = new InMemoryMarketDataProvider()
                .put("BTCUSDT", Timeframe.H1, shuffled);

            assertEquals(shuffled, memory.getBars("BTCUSDT", Timeframe.H1, T0, T0 + 10 * HOUR));
        }

        @Test
        @DisplayName("Appended bars become visible")
        void append() throws DataUnavailableException {
            InMemoryMarketDataProvider memory = new InMemoryMarketDataProvider()
                .put("BTCUSDT", Timeframe.H1, candles.subList(0, 2));

            memory.append("BTCUSDT", Timeframe.H1, candles.get(2));

            assertEquals(3, memory.getBars("BTCUSDT", Timeframe.H1, T0, T0 + 10 * HOUR).size());
        }
    }
}
