package com.signalguard.config;

import com.signalguard.domain.enums.AccountMode;
import com.signalguard.domain.enums.ExchangeMode;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange access settings: adapter, account mode, call discipline, capability cache and
 * price feed.
 *
 * <pre>
 * signalguard.exchange.mode=PAPER
 * signalguard.exchange.account-mode=ONE_WAY
 * signalguard.exchange.rate-limit.limit-per-second=10
 * signalguard.exchange.retry.max-attempts=5
 * signalguard.exchange.capability.long-ttl-seconds=300
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "signalguard.exchange")
public class ExchangeConfig {

    private ExchangeMode mode = ExchangeMode.PAPER;

    private AccountMode accountMode = AccountMode.ONE_WAY;

    /** Timeout applied to every exchange call. */
    private long callTimeoutMs = 10_000;

    /** Timeout applied to capability probes. A timed-out probe yields UNKNOWN. */
    private long probeTimeoutMs = 5_000;

    /** Threads that run exchange I/O so one slow call never stalls other workers. */
    private int ioPoolSize = 8;

    private long accountPollIntervalMs = 5_000;
    private long symbolRulesTtlSeconds = 3_600;

    private RateLimit rateLimit = new RateLimit();
    private Retry retry = new Retry();
    private Capability capability = new Capability();
    private PriceFeed priceFeed = new PriceFeed();
    private Paper paper = new Paper();

    @Data
    public static class RateLimit {

        private int limitPerSecond = 10;

        /** How long a caller waits for a permit before the attempt counts as rate limited. */
        private long acquireTimeoutMs = 5_000;
    }

    @Data
    public static class Retry {

        private int maxAttempts = 5;
        private long backoffBaseMs = 250;
        private double backoffMultiplier = 2.0;
        private long backoffMaxMs = 8_000;

        /** Randomization factor for jitter, in [0, 1). */
        private double jitterFactor = 0.5;
    }

    @Data
    public static class Capability {

        private long longTtlSeconds = 300;
        private long unknownTtlSeconds = 30;
        private boolean probeOnStartup = true;
        private boolean safeModeOnProbeFailure = false;
        private long refreshIntervalMs = 30_000;
    }

    @Data
    public static class PriceFeed {

        private long refreshIntervalMs = 1_000;
        private long staleAfterSeconds = 10;
    }

    /** In-memory simulated exchange used when {@code mode=PAPER}. */
    @Data
    public static class Paper {

        private BigDecimal initialEquity = new BigDecimal("1000");
        private boolean planOrdersSupported = true;
        private boolean streaming = true;
        private BigDecimal qtyStep = new BigDecimal("0.001");
        private BigDecimal priceStep = new BigDecimal("0.01");
        private BigDecimal minQty = new BigDecimal("0.001");
        private BigDecimal quoteVolume24h = new BigDecimal("100000000");
    }
}
