package com.updownbacktest.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for the I/O-bound setup phase of a run (indicator cache lookups).
 * The simulation loop itself stays on the request thread.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtest.indicator.thread-count:4}")
    private int indicatorThreadCount;

    @Bean(name = "indicatorExecutor")
    public ThreadPoolTaskExecutor indicatorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(indicatorThreadCount);
        executor.setMaxPoolSize(indicatorThreadCount * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("Indicator-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
