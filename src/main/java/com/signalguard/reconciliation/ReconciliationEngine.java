package com.signalguard.reconciliation;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.MismatchType;
import com.signalguard.domain.enums.OrphanPolicy;
import com.signalguard.domain.enums.ResolutionStrategy;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.model.CapabilityRecord;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PositionMismatch;
import com.signalguard.domain.model.ProtectionResult;
import com.signalguard.domain.model.ReconciliationResult;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exchange.CapabilityService;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.exchange.SymbolRulesService;
import com.signalguard.oms.LifecycleConfig;
import com.signalguard.oms.OrderLifecycleManager;
import com.signalguard.oms.PositionLockRegistry;
import com.signalguard.oms.ProtectiveCloser;
import com.signalguard.oms.StopLossManager;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.CooldownTracker;
import com.signalguard.risk.QuantityRounding;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps local managed positions in line with exchange truth.
 *
 * <p>Runs on a fixed delay, on startup and on manual trigger. Each pass reads exchange positions
 * once to find the symbols to visit, then re-reads positions and open orders under each symbol's
 * lock and diffs against that fresh view:
 * <ul>
 *   <li>MISSING_PROTECTION → AUTO_REPAIR (stop sized to the live position)</li>
 *   <li>PROTECTION_SIZE_MISMATCH → AUTO_REPAIR</li>
 *   <li>ENTRY_FILL_PROGRESS → AUTO_REPAIR (fed into the lifecycle manager)</li>
 *   <li>CLOSED_EXTERNALLY → AUTO_REPAIR (mark closed, cancel leftovers)</li>
 *   <li>CLOSE_INCOMPLETE → AUTO_REPAIR (guard kept armed, close retried)</li>
 *   <li>ORPHAN_POSITION → ALERT_ONLY, or ADOPT under {@code ADOPT_AND_PROTECT}</li>
 *   <li>DUPLICATE_LOCAL → ALERT_ONLY</li>
 *   <li>PROVISIONAL_GUARD_UPGRADE → AUTO_REPAIR (trigger stop replaces the guard)</li>
 * </ul>
 *
 * <p>A pass without drift makes no mutating exchange calls. A pass stops between symbols once
 * PANIC_CLOSE is observed. Every pass publishes a {@link com.signalguard.event.ReconciliationEvent}.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final PositionLockRegistry positionLockRegistry;
    private final OrderLifecycleManager orderLifecycleManager;
    private final StopLossManager stopLossManager;
    private final ProtectiveCloser protectiveCloser;
    private final CapabilityService capabilityService;
    private final SymbolRulesService symbolRulesService;
    private final CooldownTracker cooldownTracker;
    private final SafetySupervisor safetySupervisor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final ReconciliationConfig reconciliationConfig;
    private final LifecycleConfig lifecycleConfig;
    private final RiskPolicyConfig riskPolicyConfig;
    private final Clock clock;

    /** Consecutive failed repairs per position id. */
    private final Map<String, Integer> repairFailures = new ConcurrentHashMap<>();

    public ReconciliationEngine(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            PositionLockRegistry positionLockRegistry,
            OrderLifecycleManager orderLifecycleManager,
            StopLossManager stopLossManager,
            ProtectiveCloser protectiveCloser,
            CapabilityService capabilityService,
            SymbolRulesService symbolRulesService,
            CooldownTracker cooldownTracker,
            SafetySupervisor safetySupervisor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            ReconciliationConfig reconciliationConfig,
            LifecycleConfig lifecycleConfig,
            RiskPolicyConfig riskPolicyConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.positionLockRegistry = positionLockRegistry;
        this.orderLifecycleManager = orderLifecycleManager;
        this.stopLossManager = stopLossManager;
        this.protectiveCloser = protectiveCloser;
        this.capabilityService = capabilityService;
        this.symbolRulesService = symbolRulesService;
        this.cooldownTracker = cooldownTracker;
        this.safetySupervisor = safetySupervisor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.reconciliationConfig = reconciliationConfig;
        this.lifecycleConfig = lifecycleConfig;
        this.riskPolicyConfig = riskPolicyConfig;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${signalguard.reconciliation.interval-ms:15000}",
            initialDelayString = "${signalguard.reconciliation.interval-ms:15000}")
    public void scheduledReconciliation() {
        if (!reconciliationConfig.isEnabled()) {
            return;
        }
        reconcile("SCHEDULED");
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (reconciliationConfig.isEnabled()) {
            reconcile("STARTUP");
        }
    }

    public ReconciliationResult manualReconcile() {
        return reconcile("MANUAL");
    }

    /**
     * One reconciliation pass: read exchange state, diff per symbol, repair, publish.
     */
    public ReconciliationResult reconcile(String trigger) {
        Instant started = clock.instant();
        ReconciliationResult result = ReconciliationResult.builder()
                .timestamp(started)
                .trigger(trigger)
                .build();

        if (safetySupervisor.isPanic()) {
            result.setAborted(true);
            return finish(result, started, trigger);
        }

        List<ExchangePosition> exchangePositions;
        try {
            exchangePositions = readPositions();
        } catch (RuntimeException e) {
            log.error("Reconciliation {} could not read exchange state: {}", trigger, e.getMessage());
            result.setAlertsRaised(1);
            return finish(result, started, trigger);
        }

        List<ManagedPosition> localPositions = managedPositionRedisRepository.findOpen();
        result.setExchangePositionCount(exchangePositions.size());
        result.setLocalPositionCount(localPositions.size());

        TreeSet<String> symbols = exchangePositions.stream()
                .map(p -> RiskPolicyConfig.normalize(p.getSymbol()))
                .collect(Collectors.toCollection(TreeSet::new));
        localPositions.forEach(p -> symbols.add(RiskPolicyConfig.normalize(p.getSymbol())));

        for (String symbol : symbols) {
            if (safetySupervisor.isPanic()) {
                log.warn("Reconciliation {} aborted: panic close in progress", trigger);
                result.setAborted(true);
                break;
            }
            try {
                positionLockRegistry.withLock(symbol, () -> reconcileSymbol(symbol, result));
            } catch (RuntimeException e) {
                log.error("Reconciliation of {} failed: {}", symbol, e.getMessage(), e);
                result.setRepairFailures(result.getRepairFailures() + 1);
            }
        }

        return finish(result, started, trigger);
    }

    // ========================
    // PER SYMBOL
    // ========================

    private void reconcileSymbol(String symbol, ReconciliationResult result) {
        // Lifecycle work for this symbol is excluded from here on, so this view cannot go stale
        List<ExchangePosition> onExchange = readPositions().stream()
                .filter(p -> RiskPolicyConfig.normalize(p.getSymbol()).equals(symbol))
                .toList();
        List<ExchangeOrder> openOrders = exchangeCallExecutor.call("getOpenOrders", exchangeGateway::getOpenOrders).stream()
                .filter(o -> RiskPolicyConfig.normalize(o.getSymbol()).equals(symbol))
                .toList();
        List<ManagedPosition> locals = managedPositionRedisRepository.findOpenBySymbol(symbol);

        if (locals.size() > 1) {
            PositionMismatch mismatch = mismatch(symbol, null, MismatchType.DUPLICATE_LOCAL, ResolutionStrategy.ALERT_ONLY)
                    .detail(locals.size() + " active records: "
                            + locals.stream().map(ManagedPosition::getPositionId).collect(Collectors.joining(",")))
                    .build();
            alert(mismatch, result);
            return;
        }

        ManagedPosition local = locals.isEmpty() ? null : locals.get(0);
        for (ExchangePosition exchangePosition : onExchange) {
            if (local == null || local.getSide() != exchangePosition.getSide()) {
                handleOrphan(exchangePosition, result);
            }
        }
        if (local == null) {
            return;
        }

        Optional<ExchangePosition> live = onExchange.stream()
                .filter(p -> p.getSide() == local.getSide())
                .findFirst();
        if (live.isEmpty()) {
            handleMissingOnExchange(local, openOrders, result);
            return;
        }
        handleLivePosition(local, live.get(), openOrders, result);
    }

    private void handleMissingOnExchange(ManagedPosition local, List<ExchangeOrder> openOrders, ReconciliationResult result) {
        if (!local.hasExposure() && local.getState() == LifecycleState.PENDING_ENTRY && entryResting(local, openOrders)) {
            return;
        }

        boolean stopFired = local.getStopOrderId() != null && !isListed(local.getStopOrderId(), openOrders);
        boolean stopOut = stopFired && local.getState() != LifecycleState.CLOSING;
        String detail = !local.hasExposure()
                ? "entry no longer working and nothing filled"
                : stopOut ? "stop " + local.getStopOrderId() + " executed on exchange" : "position closed on exchange";

        PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.CLOSED_EXTERNALLY, ResolutionStrategy.AUTO_REPAIR)
                .localQuantity(local.getFilledQuantity())
                .exchangeQuantity(BigDecimal.ZERO)
                .detail(detail)
                .build();

        for (ExchangeOrder order : openOrders) {
            if (order.isClosing()
                    && RiskPolicyConfig.normalize(order.getSymbol()).equals(RiskPolicyConfig.normalize(local.getSymbol()))
                    && order.getSide() == local.getSide().closeSide()) {
                protectiveCloser.cancelQuietly(order.getSymbol(), order.getOrderId(), false);
            }
        }
        if (local.getEntryOrderId() != null && isListed(local.getEntryOrderId(), openOrders)) {
            protectiveCloser.cancelQuietly(local.getSymbol(), local.getEntryOrderId(), false);
        }
        for (String orderId : local.getScaleInOrderIds()) {
            if (isListed(orderId, openOrders)) {
                protectiveCloser.cancelQuietly(local.getSymbol(), orderId, false);
            }
        }
        local.getScaleInOrderIds().clear();
        local.setBreakEvenReduceOrderId(null);
        if (local.getState() != LifecycleState.CLOSING) {
            local.transitionTo(LifecycleState.CLOSING, clock.instant());
        }
        local.setStopOrderId(null);
        local.getTakeProfitOrderIds().clear();
        protectiveCloser.markClosed(local, "closed externally: " + detail);
        if (local.hasExposure()) {
            if (stopOut) {
                cooldownTracker.recordStopOut(local.getSymbol());
            } else {
                cooldownTracker.recordNonStopClose();
            }
        }
        repaired(mismatch, result);
    }

    private void handleLivePosition(
            ManagedPosition local, ExchangePosition live, List<ExchangeOrder> openOrders, ReconciliationResult result) {
        BigDecimal liveSize = live.getSize();
        boolean entryIncomplete = local.getState() == LifecycleState.PENDING_ENTRY
                || local.getState() == LifecycleState.PARTIALLY_FILLED;

        if (liveSize.compareTo(local.getFilledQuantity()) != 0) {
            if (entryIncomplete && liveSize.compareTo(local.getFilledQuantity()) > 0) {
                PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.ENTRY_FILL_PROGRESS, ResolutionStrategy.AUTO_REPAIR)
                        .localQuantity(local.getFilledQuantity())
                        .exchangeQuantity(liveSize)
                        .detail("entry filled " + liveSize + " of " + local.getIntendedQuantity())
                        .build();
                try {
                    ManagedPosition updated = orderLifecycleManager.onEntryFill(local.getPositionId(), liveSize, live.getEntryPrice());
                    if (updated.isProtected()) {
                        repaired(mismatch, result);
                    } else {
                        failed(mismatch, result, "position still unprotected after fill update");
                    }
                } catch (RuntimeException e) {
                    failed(mismatch, result, e.getMessage());
                }
                return;
            }
            // Size changed outside the lifecycle (manual partial close); exchange wins
            local.setFilledQuantity(liveSize);
            managedPositionRedisRepository.save(local);
        }

        if (local.getState() == LifecycleState.CLOSING) {
            retryClose(local, liveSize, openOrders, result);
            return;
        }
        if (!local.hasExposure()) {
            return;
        }

        ExchangeOrder stopOrder = findListed(local.getStopOrderId(), openOrders);
        if (local.isProtectionPending() || (stopOrder == null && !local.isLocalGuardArmed())) {
            String detail = local.isProtectionPending()
                    ? "replace left pending"
                    : local.getStopOrderId() != null ? "stop " + local.getStopOrderId() + " not listed" : "no stop and no guard";
            PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.MISSING_PROTECTION, ResolutionStrategy.AUTO_REPAIR)
                    .localQuantity(local.getFilledQuantity())
                    .exchangeQuantity(liveSize)
                    .detail(detail)
                    .build();
            local.setProtectionPending(false);
            if (stopOrder == null) {
                local.setStopOrderId(null);
            }
            repairProtection(local, liveSize, mismatch, result);
            return;
        }

        if (stopOrder != null
                && !StopLossManager.sizeWithinTolerance(stopOrder.getQuantity(), liveSize, lifecycleConfig.getSizeTolerance())) {
            PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.PROTECTION_SIZE_MISMATCH, ResolutionStrategy.AUTO_REPAIR)
                    .localQuantity(stopOrder.getQuantity())
                    .exchangeQuantity(liveSize)
                    .detail("stop sized " + stopOrder.getQuantity() + " for live " + liveSize)
                    .build();
            repairProtection(local, liveSize, mismatch, result);
            return;
        }

        if (local.isLocalGuardArmed() && local.isProvisionalGuard() && planOrdersConfirmed()) {
            PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.PROVISIONAL_GUARD_UPGRADE, ResolutionStrategy.AUTO_REPAIR)
                    .localQuantity(local.getFilledQuantity())
                    .exchangeQuantity(liveSize)
                    .detail("plan orders now supported")
                    .build();
            repairProtection(local, liveSize, mismatch, result);
        }
    }

    private void repairProtection(ManagedPosition local, BigDecimal liveSize, PositionMismatch mismatch, ReconciliationResult result) {
        BigDecimal stopPrice = local.getStopPrice() != null
                ? local.getStopPrice()
                : defaultStop(local.getSymbol(), local.getSide(), local.getAverageEntry());
        try {
            ProtectionResult protection = stopLossManager.ensureProtection(local, stopPrice, liveSize);
            boolean upgraded = mismatch.getType() != MismatchType.PROVISIONAL_GUARD_UPGRADE
                    || protection.getMode() == StopLossMode.TRIGGER;
            if (protection.isProtected() && upgraded) {
                repaired(mismatch, result);
            } else {
                failed(mismatch, result, protection.getOutcome() + ": " + protection.getMessage());
            }
        } catch (RuntimeException e) {
            failed(mismatch, result, e.getMessage());
        }
    }

    /**
     * A CLOSING position that still has live exposure: the close was refused or only partly
     * filled. The position keeps a guard while the close is retried.
     */
    private void retryClose(ManagedPosition local, BigDecimal liveSize, List<ExchangeOrder> openOrders, ReconciliationResult result) {
        PositionMismatch mismatch = mismatch(local.getSymbol(), local.getPositionId(), MismatchType.CLOSE_INCOMPLETE, ResolutionStrategy.AUTO_REPAIR)
                .localQuantity(BigDecimal.ZERO)
                .exchangeQuantity(liveSize)
                .detail("close left " + liveSize + " open")
                .build();
        try {
            if (findListed(local.getStopOrderId(), openOrders) == null && !local.isLocalGuardArmed()) {
                BigDecimal stopPrice = local.getStopPrice() != null
                        ? local.getStopPrice()
                        : defaultStop(local.getSymbol(), local.getSide(), local.getAverageEntry());
                local.setStopOrderId(null);
                stopLossManager.armLocalGuard(local, stopPrice, liveSize, false, "close incomplete");
            }
            if (protectiveCloser.closePosition(local, "close retried by reconciliation", false)) {
                repaired(mismatch, result);
            } else {
                failed(mismatch, result, "exposure still open after retry");
            }
        } catch (RuntimeException e) {
            failed(mismatch, result, e.getMessage());
        }
    }

    // ========================
    // ORPHANS
    // ========================

    private void handleOrphan(ExchangePosition exchangePosition, ReconciliationResult result) {
        if (reconciliationConfig.getOrphanPolicy() != OrphanPolicy.ADOPT_AND_PROTECT) {
            PositionMismatch mismatch = mismatch(exchangePosition.getSymbol(), null, MismatchType.ORPHAN_POSITION, ResolutionStrategy.ALERT_ONLY)
                    .exchangeQuantity(exchangePosition.getSize())
                    .localQuantity(BigDecimal.ZERO)
                    .detail(exchangePosition.getSide() + " position with no local record")
                    .build();
            alert(mismatch, result);
            return;
        }

        Instant now = clock.instant();
        BigDecimal entry = exchangePosition.getEntryPrice() != null ? exchangePosition.getEntryPrice() : exchangePosition.getMarkPrice();
        ManagedPosition adopted = ManagedPosition.builder()
                .positionId(UUID.randomUUID().toString())
                .symbol(exchangePosition.getSymbol())
                .side(exchangePosition.getSide())
                .intendedQuantity(exchangePosition.getSize())
                .filledQuantity(exchangePosition.getSize())
                .averageEntry(entry)
                .plannedEntryPrice(entry)
                .leverage(1)
                .stopPrice(defaultStop(exchangePosition.getSymbol(), exchangePosition.getSide(), entry))
                .state(LifecycleState.MANAGING)
                .openedAt(now)
                .updatedAt(now)
                .build();
        managedPositionRedisRepository.save(adopted);

        PositionMismatch mismatch = mismatch(exchangePosition.getSymbol(), adopted.getPositionId(), MismatchType.ORPHAN_POSITION, ResolutionStrategy.ADOPT)
                .exchangeQuantity(exchangePosition.getSize())
                .localQuantity(BigDecimal.ZERO)
                .detail("adopted with default stop " + adopted.getStopPrice())
                .build();
        log.warn("Adopting orphan {} {} size={}", exchangePosition.getSide(), exchangePosition.getSymbol(), exchangePosition.getSize());
        repairProtection(adopted, exchangePosition.getSize(), mismatch, result);
    }

    // ========================
    // HELPERS
    // ========================

    private boolean planOrdersConfirmed() {
        if (riskPolicyConfig.getStopLossMode() == StopLossMode.LOCAL_GUARD || capabilityService.isSessionFallback()) {
            return false;
        }
        CapabilityRecord record = capabilityService.current(CapabilityKind.PLAN_ORDERS);
        return record != null && record.getStatus() == CapabilityStatus.SUPPORTED && record.isFresh(clock.instant());
    }

    private BigDecimal defaultStop(String symbol, Side side, BigDecimal entry) {
        BigDecimal distance = riskPolicyConfig.getDefaultStopLossPct();
        BigDecimal factor = side == Side.LONG ? BigDecimal.ONE.subtract(distance) : BigDecimal.ONE.add(distance);
        return QuantityRounding.floorToStep(entry.multiply(factor), symbolRulesService.get(symbol).getPriceStep());
    }

    private List<ExchangePosition> readPositions() {
        return exchangeCallExecutor.call("getPositions", exchangeGateway::getPositions).stream()
                .filter(p -> p.getSize() != null && p.getSize().signum() > 0)
                .toList();
    }

    private static boolean entryResting(ManagedPosition local, List<ExchangeOrder> openOrders) {
        return isListed(local.getEntryOrderId(), openOrders)
                || local.getScaleInOrderIds().stream().anyMatch(id -> isListed(id, openOrders));
    }

    private static boolean isListed(String orderId, List<ExchangeOrder> openOrders) {
        return findListed(orderId, openOrders) != null;
    }

    private static ExchangeOrder findListed(String orderId, List<ExchangeOrder> openOrders) {
        if (orderId == null) {
            return null;
        }
        return openOrders.stream().filter(o -> Objects.equals(o.getOrderId(), orderId)).findFirst().orElse(null);
    }

    private static PositionMismatch.PositionMismatchBuilder mismatch(
            String symbol, String positionId, MismatchType type, ResolutionStrategy resolution) {
        return PositionMismatch.builder()
                .symbol(symbol)
                .positionId(positionId)
                .type(type)
                .resolution(resolution);
    }

    private void repaired(PositionMismatch mismatch, ReconciliationResult result) {
        mismatch.setResolved(true);
        if (mismatch.getPositionId() != null) {
            repairFailures.remove(mismatch.getPositionId());
        }
        result.getMismatches().add(mismatch);
        result.setRepairsApplied(result.getRepairsApplied() + 1);
        ledgerService.recordReconciliation(mismatch);
        log.warn("Reconciliation repaired {} on {}: {}", mismatch.getType(), mismatch.getSymbol(), mismatch.getDetail());
    }

    private void failed(PositionMismatch mismatch, ReconciliationResult result, String error) {
        mismatch.setResolved(false);
        mismatch.setDetail(mismatch.getDetail() + "; repair failed: " + error);
        result.getMismatches().add(mismatch);
        result.setRepairFailures(result.getRepairFailures() + 1);
        ledgerService.recordReconciliation(mismatch);
        log.error("Reconciliation repair of {} on {} failed: {}", mismatch.getType(), mismatch.getSymbol(), error);

        String key = mismatch.getPositionId() != null ? mismatch.getPositionId() : mismatch.getSymbol();
        int failures = repairFailures.merge(key, 1, Integer::sum);
        if (failures >= reconciliationConfig.getMaxRepairFailures()) {
            safetySupervisor.reportFinding(
                    SafetyTrigger.RECONCILIATION,
                    failures + " consecutive failed repairs of " + mismatch.getType() + " on " + mismatch.getSymbol());
        }
    }

    private void alert(PositionMismatch mismatch, ReconciliationResult result) {
        mismatch.setResolved(false);
        result.getMismatches().add(mismatch);
        result.setAlertsRaised(result.getAlertsRaised() + 1);
        ledgerService.recordReconciliation(mismatch);
        eventPublisherHelper.publishAnomaly(
                this,
                mismatch.getType().name(),
                AlertSeverity.WARNING,
                mismatch.getSymbol(),
                mismatch.getDetail(),
                LedgerService.payload("exchangeQuantity", mismatch.getExchangeQuantity()));
        log.warn("Reconciliation flagged {} on {}: {}", mismatch.getType(), mismatch.getSymbol(), mismatch.getDetail());
    }

    private ReconciliationResult finish(ReconciliationResult result, Instant started, String trigger) {
        result.setDurationMs(clock.millis() - started.toEpochMilli());
        eventPublisherHelper.publishReconciliation(this, result, "MANUAL".equals(trigger));
        if (result.hasMismatches()) {
            log.warn(
                    "Reconciliation {} complete: {} mismatches, repaired={}, failed={}, alerts={}",
                    trigger,
                    result.getTotalMismatches(),
                    result.getRepairsApplied(),
                    result.getRepairFailures(),
                    result.getAlertsRaised());
        } else {
            log.debug("Reconciliation {} complete: no drift, duration={}ms", trigger, result.getDurationMs());
        }
        return result;
    }
}
