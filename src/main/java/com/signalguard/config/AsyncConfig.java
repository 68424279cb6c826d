package com.signalguard.config;

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
 * Executors for async event delivery and for exchange I/O.
 *
 * <p>{@code eventExecutor} runs notification listeners. {@code exchangeIoExecutor} runs every
 * exchange call under a timeout, so a slow call holds an I/O thread rather than a scheduler thread.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Value("${signalguard.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${signalguard.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${signalguard.async.queue-capacity:500}")
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

    @Bean("exchangeIoExecutor")
    public ThreadPoolTaskExecutor exchangeIoExecutor(ExchangeConfig exchangeConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(exchangeConfig.getIoPoolSize());
        executor.setMaxPoolSize(exchangeConfig.getIoPoolSize() * 2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("exchange-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
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
