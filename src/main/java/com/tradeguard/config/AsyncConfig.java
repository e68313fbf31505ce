package com.tradeguard.config;

import java.lang.reflect.Method;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for asynchronous work.
 *
 * <ul>
 *   <li>{@code eventExecutor}: {@code @Async} event listeners (kill-switch cancellation fan-out)</li>
 *   <li>{@code laneExecutor}: worker pool behind the per-symbol lanes of the intent pipeline</li>
 * </ul>
 *
 * <p>The lane pool never uses caller-runs: a saturated pool must not execute a lane's task on a
 * producer thread, which would break per-symbol ordering.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${tradeguard.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${tradeguard.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${tradeguard.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("laneExecutor")
    public ThreadPoolTaskExecutor laneExecutor(PipelineProperties pipelineProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipelineProperties.getWorkerThreads());
        executor.setMaxPoolSize(pipelineProperties.getWorkerThreads());
        executor.setThreadNamePrefix("lane-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return eventExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable throwable, Method method, Object... params) -> {
            Logger logger = LoggerFactory.getLogger(method.getDeclaringClass());
            logger.error("Async error in method {}: {}", method.getName(), throwable.getMessage(), throwable);
        };
    }
}
