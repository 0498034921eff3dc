package com.updownbacktest.backtester.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest run metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsStartedCounter;
    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter marketsProcessedCounter;
    private final Counter marketsSkippedCounter;
    private final Timer runTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsStartedCounter = Counter.builder("backtest.runs.started")
                .description("Total number of backtest runs started")
                .register(meterRegistry);

        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs that failed")
                .register(meterRegistry);

        this.marketsProcessedCounter = Counter.builder("backtest.markets.processed")
                .description("Markets simulated across all runs")
                .register(meterRegistry);

        this.marketsSkippedCounter = Counter.builder("backtest.markets.skipped")
                .description("Markets skipped for missing data or warm-up")
                .register(meterRegistry);

        this.runTimer = Timer.builder("backtest.run.time")
                .description("Backtest run execution time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    public void recordRunStarted() {
        runsStartedCounter.increment();
    }

    /**
     * Record a successful run with its market counts and execution time.
     */
    public void recordRunCompleted(int marketsProcessed, int marketsSkipped, long executionTimeMs) {
        runsCompletedCounter.increment();
        marketsProcessedCounter.increment(marketsProcessed);
        marketsSkippedCounter.increment(marketsSkipped);
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Started=%d, Completed=%d, Failed=%d, Markets=%d, AvgRunTime=%.2fs",
                (long) runsStartedCounter.count(),
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) marketsProcessedCounter.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
