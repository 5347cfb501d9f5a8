package com.trendline.core.data;

import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.Candle;
import com.trendline.core.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads bars from CSV files laid out as {@code <dataDir>/<SYMBOL>/<timeframe>.csv}.
 * Lines are {@code timestamp,open,high,low,close,volume}; blank lines and lines
 * starting with '#' or a header beginning with "timestamp" are skipped.
 */
public class CsvMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(CsvMarketDataProvider.class);

    private final Path dataDir;

    public CsvMarketDataProvider(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path fileFor(String symbol, Timeframe timeframe) {
        return dataDir.resolve(sanitize(symbol)).resolve(timeframe.code() + ".csv");
    }

    @Override
    public List<Candle> getBars(String symbol, Timeframe timeframe, long start, long end) throws DataUnavailableException {
        Path file = fileFor(symbol, timeframe);
        if (!Files.exists(file)) {
            throw new DataUnavailableException("No data file for " + symbol + " " + timeframe + ": " + file);
        }

        List<Candle> candles = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith("timestamp")) {
                    continue;
                }
                Candle candle = Candle.fromCsv(trimmed);
                if (candle.timestamp() >= start && candle.timestamp() < end) {
                    candles.add(candle);
                }
            }
        } catch (IOException e) {
            throw new DataUnavailableException("Failed to read " + file, e);
        } catch (IllegalArgumentException e) {
            throw new DataUnavailableException("Malformed data in " + file + " at line " + lineNumber, e);
        }

        log.debug("Loaded {} {} {} bars from {}", candles.size(), symbol, timeframe, file);
        return candles;
    }

    /**
     * Write bars to the file for a symbol and timeframe, replacing existing content.
     */
    public void write(String symbol, Timeframe timeframe, List<Candle> candles) throws IOException {
        Path file = fileFor(symbol, timeframe);
        Files.createDirectories(file.getParent());
        List<String> lines = new ArrayList<>(candles.size() + 1);
        lines.add("timestamp,open,high,low,close,volume");
        for (Candle candle : candles) {
            lines.add(candle.toCsv());
        }
        Files.write(file, lines, StandardCharsets.UTF_8);
    }

    private static String sanitize(String symbol) {
        return symbol.toUpperCase().replace("/", "");
    }
}
