package com.signalguard.config;

import com.signalguard.exception.TransientExchangeException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j primitives shared by every exchange call.
 *
 * <ul>
 *   <li>Rate limiter: {@code limit-per-second} permits refreshed every second</li>
 *   <li>Retry: exponential backoff with jitter, {@code min(cap, base * multiplier^attempt)},
 *       only for transient failures and rate-limit waits</li>
 *   <li>Time limiters: one for regular calls, a shorter one for capability probes</li>
 * </ul>
 */
@Configuration
public class ExchangeCallConfig {

    public static final String EXCHANGE = "exchange";
    public static final String PROBE = "exchange-probe";

    @Bean
    public RateLimiter exchangeRateLimiter(ExchangeConfig exchangeConfig) {
        return rateLimiter(exchangeConfig);
    }

    @Bean
    public Retry exchangeRetry(ExchangeConfig exchangeConfig) {
        return retry(exchangeConfig);
    }

    @Bean
    public TimeLimiter exchangeTimeLimiter(ExchangeConfig exchangeConfig) {
        return timeLimiter(EXCHANGE, exchangeConfig.getCallTimeoutMs());
    }

    @Bean
    public TimeLimiter probeTimeLimiter(ExchangeConfig exchangeConfig) {
        return timeLimiter(PROBE, exchangeConfig.getProbeTimeoutMs());
    }

    public static RateLimiter rateLimiter(ExchangeConfig exchangeConfig) {
        ExchangeConfig.RateLimit rateLimit = exchangeConfig.getRateLimit();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(rateLimit.getLimitPerSecond())
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(Duration.ofMillis(rateLimit.getAcquireTimeoutMs()))
                .build();
        return RateLimiter.of(EXCHANGE, config);
    }

    public static Retry retry(ExchangeConfig exchangeConfig) {
        ExchangeConfig.Retry retry = exchangeConfig.getRetry();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        retry.getBackoffBaseMs(),
                        retry.getBackoffMultiplier(),
                        retry.getJitterFactor(),
                        retry.getBackoffMaxMs()))
                .retryOnException(e -> e instanceof TransientExchangeException || e instanceof RequestNotPermitted)
                .build();
        return Retry.of(EXCHANGE, config);
    }

    public static TimeLimiter timeLimiter(String name, long timeoutMs) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of(name, config);
    }
}
