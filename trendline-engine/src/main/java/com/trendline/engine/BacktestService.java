package com.trendline.engine;

import com.trendline.core.data.MarketDataProvider;
import com.trendline.core.exception.DataUnavailableException;
import com.trendline.core.model.BacktestRequest;
import com.trendline.core.model.BacktestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs independent backtests in parallel on a fixed pool of worker threads.
 * Each job replays one request on its own state; the market data provider is
 * the only thing the jobs share, read-only. A failing job completes its own
 * future exceptionally and leaves the others running.
 */
public class BacktestService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final MarketDataProvider provider;
    private final BacktestRunner runner;
    private final ExecutorService executor;

    public BacktestService(MarketDataProvider provider, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1: " + workers);
        }
        this.provider = provider;
        this.runner = new BacktestRunner();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, r -> {
            Thread t = new Thread(r, "Backtest-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public BacktestService(MarketDataProvider provider) {
        this(provider, Runtime.getRuntime().availableProcessors());
    }

    public Job submit(BacktestRequest request) {
        return submit(request, null);
    }

    /**
     * Queue a backtest.
     *
     * @param onProgress progress callback, invoked on the worker thread; may be null
     */
    public Job submit(BacktestRequest request, Consumer<BacktestRunner.Progress> onProgress) {
        AtomicBoolean cancelled = new AtomicBoolean();
        CompletableFuture<BacktestResult> future = new CompletableFuture<>();

        Future<?> task = executor.submit(() -> {
            try {
                future.complete(runner.run(request, provider, onProgress, cancelled::get));
            } catch (DataUnavailableException | RuntimeException e) {
                log.warn("Backtest {} {} failed: {}", request.symbol(), request.timeframe(), e.getMessage());
                future.completeExceptionally(e);
            }
        });
        return new Job(request, future, cancelled, task);
    }

    /**
     * Run all requests and wait for them. Results are in request order.
     *
     * @throws CompletionException wrapping the first failure
     */
    public List<BacktestResult> runAll(List<BacktestRequest> requests) {
        List<Job> jobs = requests.stream().map(this::submit).toList();
        return jobs.stream().map(job -> job.result().join()).toList();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Backtest workers did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handle on a submitted backtest.
     */
    public static final class Job {
        private final BacktestRequest request;
        private final CompletableFuture<BacktestResult> result;
        private final AtomicBoolean cancelled;
        private final Future<?> task;

        Job(BacktestRequest request, CompletableFuture<BacktestResult> result,
            AtomicBoolean cancelled, Future<?> task) {
            this.request = request;
            this.result = result;
            this.cancelled = cancelled;
            this.task = task;
        }

        public BacktestRequest request() {
            return request;
        }

        public CompletableFuture<BacktestResult> result() {
            return result;
        }

        /**
         * Stop the backtest at the next bar boundary. A job that has not started yet
         * never runs; in both cases the result completes with {@link BacktestCancelledException}.
         */
        public void cancel() {
            cancelled.set(true);
            if (task.cancel(false)) {
                result.completeExceptionally(new BacktestCancelledException(0, 0));
            }
        }

        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
