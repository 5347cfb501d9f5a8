package com.trendline.runner;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.trendline.core.exception.InvalidConfigException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.StrategyConfig;
import com.trendline.core.model.Timeframe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Runner settings, read from ~/.trendline/trendline.yaml by default.
 * Dates are ISO days in UTC; the end date is exclusive.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunnerSettings {

    private String dataDir = home().resolve("data").toString();
    private String resultsDir = home().resolve("results").toString();
    private String journalDir = home().toString();
    private List<String> symbols = List.of("BTCUSDT");
    private Timeframe timeframe = Timeframe.H1;
    private String startDate = "2024-01-01";
    private String endDate = "2024-07-01";
    private double initialBalance = 10000;
    private double commissionPercent = 0.1;
    private int workers = Runtime.getRuntime().availableProcessors();
    private StrategyConfig strategy = StrategyConfig.defaults();
    private PaperConfig paper = new PaperConfig();

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }

    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }

    public String getJournalDir() { return journalDir; }
    public void setJournalDir(String journalDir) { this.journalDir = journalDir; }

    public List<String> getSymbols() { return symbols; }
    public void setSymbols(List<String> symbols) { this.symbols = symbols; }

    public Timeframe getTimeframe() { return timeframe; }
    public void setTimeframe(Timeframe timeframe) { this.timeframe = timeframe; }

    public String getStartDate() { return startDate; }
    public void setStartDate(String startDate) { this.startDate = startDate; }

    public String getEndDate() { return endDate; }
    public void setEndDate(String endDate) { this.endDate = endDate; }

    public double getInitialBalance() { return initialBalance; }
    public void setInitialBalance(double initialBalance) { this.initialBalance = initialBalance; }

    public double getCommissionPercent() { return commissionPercent; }
    public void setCommissionPercent(double commissionPercent) { this.commissionPercent = commissionPercent; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public PaperConfig getPaper() { return paper; }
    public void setPaper(PaperConfig paper) { this.paper = paper; }

    /**
     * One backtest request per configured symbol.
     */
    public List<BacktestRequest> toRequests() {
        long start = toEpochMillis("startDate", startDate);
        long end = toEpochMillis("endDate", endDate);
        return symbols.stream()
            .map(symbol -> new BacktestRequest(symbol, timeframe, start, end,
                initialBalance, commissionPercent, strategy))
            .toList();
    }

    private static long toEpochMillis(String field, String date) {
        try {
            return LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            throw new InvalidConfigException(field + " must be an ISO date (yyyy-MM-dd), was " + date, e);
        }
    }

    @JsonIgnore
    public Path getDataPath() {
        return Path.of(dataDir);
    }

    @JsonIgnore
    public Path getResultsPath() {
        return Path.of(resultsDir);
    }

    @JsonIgnore
    public Path getJournalPath() {
        return Path.of(journalDir);
    }

    public static RunnerSettings load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return new RunnerSettings();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try {
            return mapper.readValue(path.toFile(), RunnerSettings.class);
        } catch (JsonMappingException e) {
            for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof InvalidConfigException ice) {
                    throw ice;
                }
            }
            throw e;
        }
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.writeValue(path.toFile(), this);
    }

    public static Path defaultPath() {
        return home().resolve("trendline.yaml");
    }

    private static Path home() {
        return Path.of(System.getProperty("user.home"), ".trendline");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PaperConfig {
        private String baseAsset = "BTC";
        private String quoteAsset = "USDT";
        private double initialBalance = 10000;
        private double feeRate = 0.001;
        private int pollIntervalSeconds = 30;

        public String getBaseAsset() { return baseAsset; }
        public void setBaseAsset(String v) { this.baseAsset = v; }

        public String getQuoteAsset() { return quoteAsset; }
        public void setQuoteAsset(String v) { this.quoteAsset = v; }

        public double getInitialBalance() { return initialBalance; }
        public void setInitialBalance(double v) { this.initialBalance = v; }

        public double getFeeRate() { return feeRate; }
        public void setFeeRate(double v) { this.feeRate = v; }

        public int getPollIntervalSeconds() { return pollIntervalSeconds; }
        public void setPollIntervalSeconds(int v) { this.pollIntervalSeconds = v; }
    }
}
