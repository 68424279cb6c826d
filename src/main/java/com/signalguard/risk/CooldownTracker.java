package com.signalguard.risk;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-symbol entry cooldown and the account-wide consecutive stop-loss breaker.
 *
 * <p>After {@code consecutive-stoploss-limit} stop-outs in a row, entries are blocked for
 * {@code stoploss-cooldown-seconds}. Any close that was not a stop-out resets the streak.
 */
@Component
public class CooldownTracker {

    private static final Logger log = LoggerFactory.getLogger(CooldownTracker.class);

    private final RiskPolicyConfig riskPolicyConfig;
    private final Clock clock;

    private final Map<String, Instant> lastEntryBySymbol = new ConcurrentHashMap<>();

    private int consecutiveStopLosses;
    private Instant breakerUntil;

    public CooldownTracker(RiskPolicyConfig riskPolicyConfig, Clock clock) {
        this.riskPolicyConfig = riskPolicyConfig;
        this.clock = clock;
    }

    // ---- Symbol cooldown ----

    public void recordEntry(String symbol) {
        lastEntryBySymbol.put(RiskPolicyConfig.normalize(symbol), clock.instant());
    }

    public boolean isCoolingDown(String symbol, long cooldownSeconds) {
        if (cooldownSeconds <= 0) {
            return false;
        }
        Instant last = lastEntryBySymbol.get(RiskPolicyConfig.normalize(symbol));
        return last != null && Duration.between(last, clock.instant()).getSeconds() < cooldownSeconds;
    }

    // ---- Stop-loss breaker ----

    public synchronized void recordStopOut(String symbol) {
        consecutiveStopLosses++;
        log.info("Stop-out on {} ({} in a row)", symbol, consecutiveStopLosses);
        if (consecutiveStopLosses >= riskPolicyConfig.getConsecutiveStoplossLimit()) {
            breakerUntil = clock.instant().plusSeconds(riskPolicyConfig.getStoplossCooldownSeconds());
            log.warn(
                    "Consecutive stop-loss breaker active until {} after {} stop-outs",
                    breakerUntil,
                    consecutiveStopLosses);
        }
    }

    public synchronized void recordNonStopClose() {
        consecutiveStopLosses = 0;
    }

    public synchronized boolean isBreakerActive() {
        if (breakerUntil == null) {
            return false;
        }
        if (clock.instant().isBefore(breakerUntil)) {
            return true;
        }
        breakerUntil = null;
        consecutiveStopLosses = 0;
        return false;
    }

    public synchronized Instant getBreakerUntil() {
        return breakerUntil;
    }

    public synchronized int getConsecutiveStopLosses() {
        return consecutiveStopLosses;
    }
}
