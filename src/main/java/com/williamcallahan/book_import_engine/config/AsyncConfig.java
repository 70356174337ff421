/**
 * Configuration for background import execution
 *
 * Features:
 * - Dedicated thread pool so each import job runs on its own detached task
 * - Bounded queue with caller-runs fallback when saturated
 * - Custom thread naming for easier debugging
 * - Logs uncaught failures from @Async methods
 */

package com.williamcallahan.book_import_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.reflect.Method;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    /**
     * Executor that runs import jobs, one task per job
     *
     * Features:
     * - Core pool of 4 threads, burst up to 16 concurrent imports
     * - Queue capacity of 100 jobs
     * - Waits for running imports on shutdown
     */
    @Bean("importJobExecutor")
    public AsyncTaskExecutor importJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("import-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Unqualified @Async methods share the import pool.
     */
    @Override
    public Executor getAsyncExecutor() {
        return importJobExecutor();
    }

    @Bean
    public Clock importClock() {
        return Clock.systemUTC();
    }

    /**
     * Handles uncaught exceptions thrown from @Async void methods
     */
    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return new AsyncUncaughtExceptionHandler() {
            @Override
            public void handleUncaughtException(@NonNull Throwable ex, @NonNull Method method, @NonNull Object... params) {
                logger.error("Uncaught async exception in method {} with params {}", method.getName(), params, ex);
            }
        };
    }
}
