package com.trendline.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.BacktestResult;
import com.trendline.core.model.Trade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Stores backtest results as JSON files.
 *
 * Layout under the base directory:
 * - {SYMBOL}_{timeframe}/result.json (full result)
 * - {SYMBOL}_{timeframe}/trades/0001_WIN_+2.50%_take_profit.json
 *
 * Serialization contains no wall-clock data, so identical runs produce identical files.
 */
public class ResultStore {

    private static final Logger log = LoggerFactory.getLogger(ResultStore.class);

    private final Path baseDir;
    private final ObjectMapper mapper;

    public ResultStore(Path baseDir) {
        this.baseDir = baseDir;
        this.mapper = createMapper();
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Directory holding the results of a request's symbol and timeframe.
     */
    public Path directoryFor(BacktestRequest request) {
        return baseDir.resolve(request.symbol().toUpperCase().replace("/", "") + "_" + request.timeframe().code());
    }

    /**
     * Save the full result and one file per trade, replacing earlier trade files.
     *
     * @return path of the written result file
     */
    public Path save(BacktestResult result) throws IOException {
        Path dir = directoryFor(result.request());
        Path tradesDir = dir.resolve("trades");
        Files.createDirectories(tradesDir);

        clearTrades(tradesDir);
        List<Trade> trades = result.trades();
        for (int i = 0; i < trades.size(); i++) {
            Trade trade = trades.get(i);
            mapper.writeValue(tradesDir.resolve(tradeFileName(i + 1, trade)).toFile(), trade);
        }

        Path file = dir.resolve("result.json");
        mapper.writeValue(file.toFile(), result);
        log.info("Saved {} trades and result to {}", trades.size(), file);
        return file;
    }

    /**
     * Load the result saved for a request's symbol and timeframe, if any.
     */
    public BacktestResult load(BacktestRequest request) throws IOException {
        Path file = directoryFor(request).resolve("result.json");
        if (!Files.exists(file)) {
            return null;
        }
        return read(file);
    }

    public BacktestResult read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), BacktestResult.class);
    }

    public String toJson(BacktestResult result) {
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize backtest result", e);
        }
    }

    /**
     * Format: {seq}_{WIN|LOSS}_{profit%}_{exitReason}.json
     */
    static String tradeFileName(int seq, Trade trade) {
        return String.format(Locale.ROOT, "%04d_%s_%+.2f%%_%s.json",
            seq, trade.isWin() ? "WIN" : "LOSS", trade.profitPercent(), trade.exitReason().value());
    }

    private static void clearTrades(Path tradesDir) throws IOException {
        try (Stream<Path> files = Files.list(tradesDir)) {
            for (Path f : files.filter(p -> p.toString().endsWith(".json")).toList()) {
                Files.delete(f);
            }
        }
    }
}
