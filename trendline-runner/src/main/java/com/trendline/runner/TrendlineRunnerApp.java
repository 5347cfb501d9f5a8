package com.trendline.runner;

import com.trendline.core.data.CsvMarketDataProvider;
import com.trendline.core.data.MarketDataProvider;
import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.exception.TrendlineException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.BacktestResult;
import com.trendline.core.model.StrategyConfig;
import com.trendline.engine.BacktestRunner;
import com.trendline.engine.BacktestService;
import com.trendline.engine.ResultStore;
import com.trendline.execution.LiveStrategyRunner;
import com.trendline.execution.adapter.PaperExecutionAdapter;
import com.trendline.execution.feed.PollingBarFeed;
import com.trendline.execution.journal.SignalJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;

/**
 * Trendline Runner - command-line entry point.
 *
 * Usage: {@code trendline-runner [backtest|live] [settings.yaml]}
 * <ul>
 *   <li>backtest: replays the configured range for every symbol and saves the results</li>
 *   <li>live: paper trades the first symbol on closed bars polled from the data directory</li>
 * </ul>
 */
public class TrendlineRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(TrendlineRunnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILED = 1;

    private final RunnerSettings settings;
    private final MarketDataProvider provider;

    public TrendlineRunnerApp(RunnerSettings settings, MarketDataProvider provider) {
        this.settings = settings;
        this.provider = provider;
    }

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        String command = args.length > 0 ? args[0] : "backtest";
        Path settingsPath = args.length > 1 ? Path.of(args[1]) : RunnerSettings.defaultPath();

        RunnerSettings settings;
        try {
            settings = RunnerSettings.load(settingsPath);
        } catch (IOException e) {
            LOG.error("Failed to read settings {}: {}", settingsPath, e.getMessage());
            return EXIT_FAILED;
        } catch (TrendlineException e) {
            LOG.error("Invalid settings {}: {}", settingsPath, e.getMessage());
            return EXIT_FAILED;
        }

        TrendlineRunnerApp app = new TrendlineRunnerApp(settings, new CsvMarketDataProvider(settings.getDataPath()));
        switch (command) {
            case "backtest":
                return app.backtest();
            case "live":
                return app.live();
            default:
                LOG.error("Unknown command '{}'. Usage: trendline-runner [backtest|live] [settings.yaml]", command);
                return EXIT_USAGE;
        }
    }

    /**
     * Run the configured backtests and save each result.
     */
    int backtest() {
        List<BacktestRequest> requests;
        try {
            requests = settings.toRequests();
        } catch (TrendlineException e) {
            LOG.error("Invalid backtest settings: {}", e.getMessage());
            return EXIT_FAILED;
        }
        LOG.info("Trendline backtest: {} symbol(s), {} {} to {}", requests.size(),
            settings.getTimeframe(), settings.getStartDate(), settings.getEndDate());

        List<BacktestResult> results = new ArrayList<>();
        try {
            if (requests.size() == 1) {
                results.add(new BacktestRunner().run(requests.get(0), provider,
                    p -> LOG.debug("{}% {}", p.percentage(), p.message()), () -> false));
            } else {
                try (BacktestService service = new BacktestService(provider, settings.getWorkers())) {
                    results.addAll(service.runAll(requests));
                }
            }
        } catch (DataUnavailableException | TrendlineException e) {
            LOG.error("Backtest failed: {}", e.getMessage());
            return EXIT_FAILED;
        } catch (CompletionException e) {
            LOG.error("Backtest failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return EXIT_FAILED;
        }

        ResultStore store = new ResultStore(settings.getResultsPath());
        for (BacktestResult result : results) {
            LOG.info(result.getSummary());
            try {
                store.save(result);
            } catch (IOException e) {
                LOG.error("Failed to save result for {}: {}", result.request().symbol(), e.getMessage());
                return EXIT_FAILED;
            }
        }
        return EXIT_OK;
    }

    /**
     * Paper trade until the process is stopped.
     */
    int live() {
        String symbol = settings.getSymbols().get(0);
        StrategyConfig strategy = settings.getStrategy();
        RunnerSettings.PaperConfig paper = settings.getPaper();

        PaperExecutionAdapter adapter = new PaperExecutionAdapter(paper.getBaseAsset(), paper.getQuoteAsset(),
            paper.getInitialBalance(), paper.getFeeRate(), Clock.systemUTC());
        SignalJournal journal = new SignalJournal(settings.getJournalPath());
        LiveStrategyRunner runner = new LiveStrategyRunner(symbol, strategy, adapter, journal);

        // Start far enough back to warm the indicators on already closed bars
        long warmupMillis = (strategy.warmupBars() + 1L) * settings.getTimeframe().millis();
        long start = System.currentTimeMillis() - warmupMillis;
        PollingBarFeed feed = new PollingBarFeed(provider, symbol, settings.getTimeframe(), runner,
            Clock.systemUTC(), Duration.ofSeconds(paper.getPollIntervalSeconds()), start);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Stopping live session for {}", symbol);
            feed.close();
            journal.close();
            stopped.countDown();
        }, "TrendlineShutdown"));

        LOG.info("Paper trading {} {} (auto trading {})", symbol, settings.getTimeframe(),
            strategy.autoTradingEnabled() ? "enabled" : "disabled");
        feed.start();
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            feed.close();
            journal.close();
        }
        LOG.info("Live session ended with {} closed trade(s), balances {}",
            runner.getClosedTrades().size(), adapter.getBalances());
        return EXIT_OK;
    }
}
