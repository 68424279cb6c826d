package com.signalguard.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signalguard.config.ExchangeCallConfig;
import com.signalguard.config.ExchangeConfig;
import com.signalguard.exception.ExchangeCallExhaustedException;
import com.signalguard.exception.ExchangeRejectedException;
import com.signalguard.exception.TransientExchangeException;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.observability.SafetyMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExchangeCallExecutor covering retry on transient failures, exhaustion,
 * permanent rejections, timeouts and the API error window.
 */
class ExchangeCallExecutorTest {

    private ExecutorService ioPool;
    private SimpleMeterRegistry meterRegistry;
    private ExchangeCallExecutor exchangeCallExecutor;

    @BeforeEach
    void setUp() {
        ExchangeConfig exchangeConfig = new ExchangeConfig();
        exchangeConfig.getRetry().setMaxAttempts(3);
        exchangeConfig.getRetry().setBackoffBaseMs(1);
        exchangeConfig.getRetry().setBackoffMaxMs(5);
        exchangeConfig.getRateLimit().setLimitPerSecond(1000);
        exchangeConfig.setCallTimeoutMs(200);
        exchangeConfig.setProbeTimeoutMs(50);

        ioPool = Executors.newCachedThreadPool();
        meterRegistry = new SimpleMeterRegistry();
        exchangeCallExecutor = new ExchangeCallExecutor(
                ExchangeCallConfig.rateLimiter(exchangeConfig),
                ExchangeCallConfig.retry(exchangeConfig),
                ExchangeCallConfig.timeLimiter(ExchangeCallConfig.EXCHANGE, exchangeConfig.getCallTimeoutMs()),
                ExchangeCallConfig.timeLimiter(ExchangeCallConfig.PROBE, exchangeConfig.getProbeTimeoutMs()),
                ioPool,
                new SafetyMetricsService(meterRegistry),
                Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        ioPool.shutdownNow();
    }

    // ==============================
    // RETRY
    // ==============================

    @Nested
    @DisplayName("Retry")
    class RetryBehaviour {

        @Test
        @DisplayName("Transient failure is retried until the call succeeds")
        void retriesTransient() {
            AtomicInteger attempts = new AtomicInteger();

            String result = exchangeCallExecutor.call("getBalance", () -> {
                if (attempts.incrementAndGet() < 3) {
                    throw new TransientExchangeException("connection reset");
                }
                return "ok";
            });

            assertThat(result).isEqualTo("ok");
            assertThat(attempts.get()).isEqualTo(3);
            assertThat(exchangeCallExecutor.failuresWithin(Duration.ofMinutes(1))).isZero();
        }

        @Test
        @DisplayName("Exhausted retries surface as a typed failure and count in the error window")
        void exhaustion() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> exchangeCallExecutor.call("placeOrder", () -> {
                        attempts.incrementAndGet();
                        throw new TransientExchangeException("503");
                    }))
                    .isInstanceOf(ExchangeCallExhaustedException.class)
                    .hasMessageContaining("placeOrder")
                    .hasMessageContaining("3 attempts");

            assertThat(attempts.get()).isEqualTo(3);
            assertThat(exchangeCallExecutor.failuresWithin(Duration.ofMinutes(1))).isEqualTo(1);
        }

        @Test
        @DisplayName("Permanent rejections are not retried")
        void rejectionNotRetried() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> exchangeCallExecutor.call("placeOrder", () -> {
                        attempts.incrementAndGet();
                        throw new ExchangeRejectedException("40762", "insufficient margin");
                    }))
                    .isInstanceOf(ExchangeRejectedException.class);

            assertThat(attempts.get()).isEqualTo(1);
            assertThat(exchangeCallExecutor.failuresWithin(Duration.ofMinutes(1))).isEqualTo(1);
        }
    }

    // ==============================
    // TIMEOUTS
    // ==============================

    @Nested
    @DisplayName("Timeouts")
    class Timeouts {

        @Test
        @DisplayName("A hung call times out and is retried as transient")
        void callTimeout() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> exchangeCallExecutor.call("getPositions", () -> {
                        attempts.incrementAndGet();
                        sleep(2_000);
                        return "late";
                    }))
                    .isInstanceOf(ExchangeCallExhaustedException.class)
                    .hasRootCauseInstanceOf(java.util.concurrent.TimeoutException.class);

            assertThat(attempts.get()).isEqualTo(3);
        }

        @Test
        @DisplayName("A hung probe fails once with a transient error, without retries")
        void probeTimeout() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> exchangeCallExecutor.probe("probePlanOrders", () -> {
                        attempts.incrementAndGet();
                        sleep(2_000);
                        return true;
                    }))
                    .isInstanceOf(TransientExchangeException.class)
                    .hasMessageContaining("timed out");

            assertThat(attempts.get()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Priority calls run with the same retry discipline")
    void priorityCall() {
        AtomicInteger attempts = new AtomicInteger();

        exchangeCallExecutor.runPriority("cancelAll", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TransientExchangeException("timeout");
            }
        });

        assertThat(attempts.get()).isEqualTo(2);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
