package com.stockanalysis.config;

import com.stockanalysis.batch.BatchConfig;
import com.stockanalysis.fetch.FetchSchedulerConfig;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools and the shared clock.
 *
 * <p>The fetch pool aborts on overflow instead of running the task on the caller: the
 * caller is the scheduler's coordinating thread, which must never block on a network call.
 * The fetch scheduler never submits more than {@code workerPoolSize} tasks at once anyway.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "fetchWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService fetchWorkerPool(FetchSchedulerConfig fetchSchedulerConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(fetchSchedulerConfig.getWorkerPoolSize());
        executor.setMaxPoolSize(fetchSchedulerConfig.getWorkerPoolSize());
        executor.setThreadNamePrefix("fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor.getThreadPoolExecutor();
    }

    @Bean(name = "analysisPool", destroyMethod = "shutdown")
    public ExecutorService analysisPool(BatchConfig batchConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchConfig.getComputeParallelism());
        executor.setMaxPoolSize(batchConfig.getComputeParallelism());
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor.getThreadPoolExecutor();
    }
}
