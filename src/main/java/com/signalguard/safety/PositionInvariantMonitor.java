package com.signalguard.safety;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PriceTick;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.exchange.PriceFeedService;
import com.signalguard.oms.LifecycleConfig;
import com.signalguard.oms.PositionLockRegistry;
import com.signalguard.oms.ProtectiveCloser;
import com.signalguard.oms.StopLossManager;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Per-position invariants checked on a fixed schedule:
 *
 * <ul>
 *   <li>Liquidation distance: {@code |liq - mark| / mark <= max-liquidation-distance-pct} closes
 *       the position.</li>
 *   <li>Stop must exist: an unprotected position gets a repair attempt. If the stop is still
 *       missing past {@code max-time-without-stop-seconds}, the position is closed and the
 *       supervisor moves to SAFE_MODE.</li>
 *   <li>Feed degraded: a local guard on a polled feed is reported when configured to.</li>
 * </ul>
 *
 * <p>Does nothing during PANIC_CLOSE; the sweep owns the exposure then.
 */
@Component
public class PositionInvariantMonitor {

    private static final Logger log = LoggerFactory.getLogger(PositionInvariantMonitor.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final PositionLockRegistry positionLockRegistry;
    private final StopLossManager stopLossManager;
    private final ProtectiveCloser protectiveCloser;
    private final PriceFeedService priceFeedService;
    private final SafetySupervisor safetySupervisor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final SafetyConfig safetyConfig;
    private final LifecycleConfig lifecycleConfig;
    private final Clock clock;

    public PositionInvariantMonitor(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            PositionLockRegistry positionLockRegistry,
            StopLossManager stopLossManager,
            ProtectiveCloser protectiveCloser,
            PriceFeedService priceFeedService,
            SafetySupervisor safetySupervisor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            SafetyConfig safetyConfig,
            LifecycleConfig lifecycleConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.positionLockRegistry = positionLockRegistry;
        this.stopLossManager = stopLossManager;
        this.protectiveCloser = protectiveCloser;
        this.priceFeedService = priceFeedService;
        this.safetySupervisor = safetySupervisor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.safetyConfig = safetyConfig;
        this.lifecycleConfig = lifecycleConfig;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${signalguard.safety.evaluation-interval-ms:2000}")
    public void check() {
        if (safetySupervisor.isPanic()) {
            return;
        }
        List<ExchangePosition> positions;
        try {
            positions = exchangeCallExecutor.call("getPositions", exchangeGateway::getPositions);
        } catch (RuntimeException e) {
            log.warn("Invariant check skipped, positions unavailable: {}", e.getMessage());
            return;
        }

        for (ExchangePosition exchangePosition : positions) {
            if (safetySupervisor.isPanic()) {
                return;
            }
            try {
                checkLiquidationDistance(exchangePosition);
            } catch (RuntimeException e) {
                log.error("Liquidation check failed for {}: {}", exchangePosition.getSymbol(), e.getMessage(), e);
            }
        }

        for (ManagedPosition position : managedPositionRedisRepository.findOpen()) {
            if (safetySupervisor.isPanic()) {
                return;
            }
            try {
                checkStopExists(position);
                checkFeed(position);
            } catch (RuntimeException e) {
                log.error("Invariant check failed for {}: {}", position.getSymbol(), e.getMessage(), e);
            }
        }
    }

    // ========================
    // LIQUIDATION DISTANCE
    // ========================

    /** @return true when the position was closed */
    public boolean checkLiquidationDistance(ExchangePosition exchangePosition) {
        if (!isLiquidationTooClose(
                exchangePosition.getLiquidationPrice(),
                exchangePosition.getMarkPrice(),
                safetyConfig.getMaxLiquidationDistancePct())) {
            return false;
        }

        String reason = "liquidation distance too close: liq " + exchangePosition.getLiquidationPrice()
                + " vs mark " + exchangePosition.getMarkPrice();
        log.error("{} {} {}", exchangePosition.getSide(), exchangePosition.getSymbol(), reason);
        eventPublisherHelper.publishAnomaly(
                this,
                "LIQUIDATION_DISTANCE",
                AlertSeverity.CRITICAL,
                exchangePosition.getSymbol(),
                reason,
                LedgerService.payload("size", exchangePosition.getSize(), "side", exchangePosition.getSide()));

        Optional<ManagedPosition> tracked = findTracked(exchangePosition);
        if (tracked.isPresent()) {
            protectiveCloser.closePosition(tracked.get(), reason, false);
        } else {
            protectiveCloser.closeExchangeExposure(
                    exchangePosition.getSymbol(), exchangePosition.getSide(), exchangePosition.getSize(), reason);
        }
        return true;
    }

    public static boolean isLiquidationTooClose(BigDecimal liquidation, BigDecimal mark, BigDecimal maxDistance) {
        if (liquidation == null || mark == null || mark.signum() <= 0) {
            return false;
        }
        BigDecimal distance = liquidation.subtract(mark).abs().divide(mark, 12, RoundingMode.HALF_UP);
        return distance.compareTo(maxDistance) <= 0;
    }

    // ========================
    // STOP MUST EXIST
    // ========================

    /**
     * Repairs a missing stop and enforces the missing-stop deadline.
     *
     * @return true when the deadline expired and the position was closed
     */
    public boolean checkStopExists(ManagedPosition position) {
        if (!safetyConfig.isStopMustExist() || !position.hasExposure() || position.getStopPrice() == null) {
            return false;
        }
        if (position.isProtected() && position.getStopMissingSince() == null) {
            return false;
        }

        return positionLockRegistry.withLock(position.getSymbol(), () -> {
            ManagedPosition current = managedPositionRedisRepository.findById(position.getPositionId()).orElse(position);
            if (!current.isOpen()) {
                return false;
            }

            log.warn("Stop missing for {} {}; attempting repair", current.getSide(), current.getSymbol());
            ledgerService.recordProtection(current, "STOP_MISSING", "repair attempt by invariant monitor");
            stopLossManager.ensureProtection(current, current.getStopPrice(), current.getFilledQuantity());

            Instant missingSince = current.getStopMissingSince();
            if (missingSince == null) {
                return false;
            }
            Duration missing = Duration.between(missingSince, clock.instant());
            if (missing.getSeconds() < safetyConfig.getMaxTimeWithoutStopSeconds()
                    || !safetyConfig.isEmergencyCloseIfStopFails()) {
                return false;
            }

            String reason = "stop missing for " + missing.getSeconds() + "s after repair attempts";
            log.error("Emergency close of {} {}: {}", current.getSide(), current.getSymbol(), reason);
            protectiveCloser.closePosition(current, reason, false);
            safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, current.getSymbol() + " " + reason);
            return true;
        });
    }

    // ========================
    // FEED
    // ========================

    void checkFeed(ManagedPosition position) {
        if (!position.isLocalGuardArmed()
                || !lifecycleConfig.isRequireStreamingForLocalGuard()
                || !safetyConfig.isSafeModeOnFeedDegraded()) {
            return;
        }
        Optional<PriceTick> tick = priceFeedService.latest(position.getSymbol());
        if (tick.isPresent() && priceFeedService.isPolling(position.getSymbol())) {
            safetySupervisor.reportFinding(
                    SafetyTrigger.FEED_DEGRADED, "local guard on " + position.getSymbol() + " runs on a polled price feed");
        }
    }

    private Optional<ManagedPosition> findTracked(ExchangePosition exchangePosition) {
        String symbol = RiskPolicyConfig.normalize(exchangePosition.getSymbol());
        return managedPositionRedisRepository.findOpen().stream()
                .filter(p -> p.getSide() == exchangePosition.getSide()
                        && RiskPolicyConfig.normalize(p.getSymbol()).equals(symbol))
                .findFirst();
    }
}
