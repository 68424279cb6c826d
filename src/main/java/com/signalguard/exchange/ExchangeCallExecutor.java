package com.signalguard.exchange;

import com.signalguard.exception.ExchangeCallExhaustedException;
import com.signalguard.exception.TransientExchangeException;
import com.signalguard.observability.SafetyMetricsService;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Single shared gate in front of the {@link ExchangeGateway}.
 *
 * <p>Every call is decorated, outermost first, with:
 * <ol>
 *   <li>Retry: exponential backoff with jitter on transient failures, bounded attempts</li>
 *   <li>Rate limiter: shared permits per second across all workers</li>
 *   <li>Time limiter: the call runs on the exchange I/O pool and is abandoned after the timeout</li>
 * </ol>
 *
 * <p>Exhausted retries surface as {@link ExchangeCallExhaustedException}; permanent exchange
 * refusals pass through untouched on the first attempt. Both count towards the API error window
 * read by the safety supervisor.
 *
 * <p>{@link #callPriority} skips the rate limiter so a panic-close sweep never waits behind
 * routine polling.
 */
@Component
public class ExchangeCallExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExchangeCallExecutor.class);

    private static final Duration FAILURE_RETENTION = Duration.ofHours(1);

    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final TimeLimiter callTimeLimiter;
    private final TimeLimiter probeTimeLimiter;
    private final Executor ioExecutor;
    private final SafetyMetricsService safetyMetricsService;
    private final Clock clock;

    private final Deque<Instant> failureTimes = new ConcurrentLinkedDeque<>();

    public ExchangeCallExecutor(
            RateLimiter exchangeRateLimiter,
            Retry exchangeRetry,
            @Qualifier("exchangeTimeLimiter") TimeLimiter exchangeTimeLimiter,
            @Qualifier("probeTimeLimiter") TimeLimiter probeTimeLimiter,
            @Qualifier("exchangeIoExecutor") Executor exchangeIoExecutor,
            SafetyMetricsService safetyMetricsService,
            Clock clock) {
        this.rateLimiter = exchangeRateLimiter;
        this.retry = exchangeRetry;
        this.callTimeLimiter = exchangeTimeLimiter;
        this.probeTimeLimiter = probeTimeLimiter;
        this.ioExecutor = exchangeIoExecutor;
        this.safetyMetricsService = safetyMetricsService;
        this.clock = clock;
    }

    // ========================
    // CALLS
    // ========================

    public <T> T call(String operation, Supplier<T> call) {
        return execute(operation, call, true);
    }

    public void run(String operation, Runnable call) {
        execute(
                operation,
                () -> {
                    call.run();
                    return null;
                },
                true);
    }

    /** Same retry and timeout discipline, without waiting for a rate-limit permit. */
    public <T> T callPriority(String operation, Supplier<T> call) {
        return execute(operation, call, false);
    }

    public void runPriority(String operation, Runnable call) {
        execute(
                operation,
                () -> {
                    call.run();
                    return null;
                },
                false);
    }

    /**
     * Single rate-limited attempt under the probe timeout. Probes are not retried here: an
     * inconclusive probe is cached as UNKNOWN and re-probed after its short TTL.
     *
     * @throws TransientExchangeException on timeout, network failure or rate limiting
     */
    public <T> T probe(String operation, Supplier<T> call) {
        try {
            RateLimiter.waitForPermission(rateLimiter);
        } catch (RequestNotPermitted e) {
            throw new TransientExchangeException(operation + " rate limited", e);
        }
        return withTimeout(operation, call, probeTimeLimiter);
    }

    // ========================
    // ERROR WINDOW
    // ========================

    /** Number of failed calls (after retries) inside the given window. */
    public int failuresWithin(Duration window) {
        Instant now = clock.instant();
        pruneFailures(now);
        Instant from = now.minus(window);
        return (int) failureTimes.stream().filter(t -> !t.isBefore(from)).count();
    }

    // ========================
    // INTERNALS
    // ========================

    private <T> T execute(String operation, Supplier<T> call, boolean rateLimited) {
        Supplier<T> timed = () -> withTimeout(operation, call, callTimeLimiter);
        Supplier<T> limited = rateLimited ? RateLimiter.decorateSupplier(rateLimiter, timed) : timed;
        Supplier<T> retrying = Retry.decorateSupplier(retry, limited);

        long start = System.nanoTime();
        try {
            T result = retrying.get();
            safetyMetricsService.recordExchangeCall(operation, System.nanoTime() - start, true);
            return result;
        } catch (TransientExchangeException | RequestNotPermitted e) {
            recordFailure(operation, start, e);
            throw new ExchangeCallExhaustedException(operation, retry.getRetryConfig().getMaxAttempts(), e);
        } catch (RuntimeException e) {
            recordFailure(operation, start, e);
            throw e;
        }
    }

    private <T> T withTimeout(String operation, Supplier<T> call, TimeLimiter timeLimiter) {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, ioExecutor));
        } catch (TimeoutException e) {
            throw new TransientExchangeException(
                    operation + " timed out after "
                            + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + "ms",
                    e);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExchangeException(operation + " interrupted", e);
        } catch (Exception e) {
            throw new TransientExchangeException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private void recordFailure(String operation, long start, RuntimeException e) {
        safetyMetricsService.recordExchangeCall(operation, System.nanoTime() - start, false);
        Instant now = clock.instant();
        failureTimes.addLast(now);
        pruneFailures(now);
        log.warn("Exchange call {} failed: {}", operation, e.getMessage());
    }

    private void pruneFailures(Instant now) {
        Instant cutoff = now.minus(FAILURE_RETENTION);
        while (!failureTimes.isEmpty() && failureTimes.peekFirst().isBefore(cutoff)) {
            failureTimes.pollFirst();
        }
    }
}
