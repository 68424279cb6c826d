package com.signalguard.oms;

import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.ProtectionOutcome;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.model.CapabilityRecord;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.OrderResult;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.ProtectionResult;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.event.PositionEventType;
import com.signalguard.exchange.CapabilityService;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.exchange.SymbolRulesService;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.QuantityRounding;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the protective stop of every managed position.
 *
 * <p><b>Mode selection:</b> a configured LOCAL_GUARD is always honoured. A configured TRIGGER
 * consults the capability cache: SUPPORTED places a native trigger order; UNSUPPORTED (or the
 * startup session fallback) arms a local guard and records a plan-order fallback; UNKNOWN arms a
 * provisional local guard that reconciliation upgrades once support is confirmed. No placement is
 * attempted against an unconfirmed capability.
 *
 * <p><b>Two-phase replace:</b>
 * <ol>
 *   <li>Persist {@code protectionPending=true}</li>
 *   <li>Cancel the stale stop</li>
 *   <li>Place the new stop and verify it is listed among open orders</li>
 *   <li>Clear the pending marker</li>
 * </ol>
 * A crash between steps leaves the marker set, which reconciliation reads as a protection gap.
 * When placement keeps failing, a local guard is armed as emergency protection and a
 * PROTECTION_FAILURE finding puts the supervisor into SAFE_MODE.
 *
 * <p>Callers hold the symbol lock.
 */
@Service
public class StopLossManager {

    private static final Logger log = LoggerFactory.getLogger(StopLossManager.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final CloseInstructionFactory closeInstructionFactory;
    private final CapabilityService capabilityService;
    private final SymbolRulesService symbolRulesService;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final ProtectiveCloser protectiveCloser;
    private final SafetySupervisor safetySupervisor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final LifecycleConfig lifecycleConfig;
    private final RiskPolicyConfig riskPolicyConfig;
    private final Clock clock;

    public StopLossManager(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            CloseInstructionFactory closeInstructionFactory,
            CapabilityService capabilityService,
            SymbolRulesService symbolRulesService,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            ProtectiveCloser protectiveCloser,
            SafetySupervisor safetySupervisor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            LifecycleConfig lifecycleConfig,
            RiskPolicyConfig riskPolicyConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.closeInstructionFactory = closeInstructionFactory;
        this.capabilityService = capabilityService;
        this.symbolRulesService = symbolRulesService;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.protectiveCloser = protectiveCloser;
        this.safetySupervisor = safetySupervisor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.lifecycleConfig = lifecycleConfig;
        this.riskPolicyConfig = riskPolicyConfig;
        this.clock = clock;
    }

    // ========================
    // MODE SELECTION
    // ========================

    /** Effective stop mode for new protection; {@code provisional} marks an unconfirmed capability. */
    public record ModeDecision(StopLossMode mode, boolean provisional, boolean fallback, String detail) {}

    public ModeDecision resolveMode() {
        if (riskPolicyConfig.getStopLossMode() == StopLossMode.LOCAL_GUARD) {
            return new ModeDecision(StopLossMode.LOCAL_GUARD, false, false, "configured");
        }
        if (capabilityService.isSessionFallback()) {
            CapabilityRecord record = capabilityService.current(CapabilityKind.PLAN_ORDERS);
            boolean provisional = record == null || record.getStatus() != CapabilityStatus.UNSUPPORTED;
            return new ModeDecision(StopLossMode.LOCAL_GUARD, provisional, true, "startup probe fallback");
        }
        CapabilityStatus status = capabilityService.resolve(CapabilityKind.PLAN_ORDERS);
        return switch (status) {
            case SUPPORTED -> new ModeDecision(StopLossMode.TRIGGER, false, false, "plan orders supported");
            case UNSUPPORTED -> new ModeDecision(StopLossMode.LOCAL_GUARD, false, true, "plan orders unsupported");
            case UNKNOWN -> new ModeDecision(StopLossMode.LOCAL_GUARD, true, true, "plan-order capability unknown");
        };
    }

    // ========================
    // PROTECTION
    // ========================

    /**
     * Makes sure the position is protected by a stop at {@code stopPrice} sized to {@code quantity}.
     * Keeps an acceptable existing stop, otherwise replaces it with the two-phase protocol.
     */
    public ProtectionResult ensureProtection(ManagedPosition position, BigDecimal stopPrice, BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0) {
            return ProtectionResult.notEligible("no filled quantity to protect");
        }

        if (position.getStopOrderId() != null && !position.isProtectionPending()) {
            ExchangeOrder existing = lookupExistingStop(position);
            if (existing != null && isAcceptable(existing, position.getSide(), stopPrice, quantity)) {
                position.setStopQuantity(existing.getQuantity());
                position.setStopMissingSince(null);
                managedPositionRedisRepository.save(position);
                return ProtectionResult.builder()
                        .outcome(ProtectionOutcome.ALREADY_PROTECTED)
                        .mode(StopLossMode.TRIGGER)
                        .orderId(existing.getOrderId())
                        .stopPrice(existing.getTriggerPrice())
                        .quantity(existing.getQuantity())
                        .build();
            }
        }

        ModeDecision decision = resolveMode();
        if (decision.mode() == StopLossMode.LOCAL_GUARD) {
            if (decision.fallback() && !position.isLocalGuardArmed()) {
                recordPlanOrderFallback(position, decision);
            }
            if (position.getStopOrderId() != null) {
                protectiveCloser.cancelQuietly(position.getSymbol(), position.getStopOrderId(), false);
                position.setStopOrderId(null);
            }
            return armLocalGuard(position, stopPrice, quantity, decision.provisional(), decision.detail());
        }

        return replaceTriggerStop(position, stopPrice, quantity);
    }

    private ProtectionResult replaceTriggerStop(ManagedPosition position, BigDecimal stopPrice, BigDecimal quantity) {
        // Phase 1: mark pending before touching the exchange
        position.setProtectionPending(true);
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);

        String staleOrderId = position.getStopOrderId();
        String lastError = null;
        int attempts = Math.max(1, lifecycleConfig.getMaxSubmitRetries());

        for (int attempt = 1; attempt <= attempts; attempt++) {
            String placedOrderId = null;
            try {
                if (staleOrderId != null) {
                    protectiveCloser.cancelQuietly(position.getSymbol(), staleOrderId, false);
                    staleOrderId = null;
                    position.setStopOrderId(null);
                    managedPositionRedisRepository.save(position);
                }

                OrderSpec spec = closeInstructionFactory.stopLoss(position.getSymbol(), position.getSide(), quantity, stopPrice);
                ledgerService.recordOrderAttempt(position, spec);
                OrderResult result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
                placedOrderId = result.getOrderId();
                ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);

                if (lifecycleConfig.isVerifyPlacement() && findOpenOrder(result.getOrderId()) == null) {
                    lastError = "stop " + result.getOrderId() + " not listed among open orders";
                    log.warn("Stop placement for {} unverified (attempt {}/{}): {}", position.getSymbol(), attempt, attempts, lastError);
                    staleOrderId = result.getOrderId();
                    pause();
                    continue;
                }

                // Phase 2: commit the new reference and clear the marker
                position.setStopOrderId(result.getOrderId());
                position.setStopPrice(stopPrice);
                position.setStopQuantity(quantity);
                position.setStopMode(StopLossMode.TRIGGER);
                position.setLocalGuardArmed(false);
                position.setProvisionalGuard(false);
                position.setProtectionPending(false);
                position.setStopMissingSince(null);
                position.setProtectionFailures(0);
                position.setUpdatedAt(clock.instant());
                managedPositionRedisRepository.save(position);
                ledgerService.recordProtection(position, ProtectionOutcome.TRIGGER_PLACED.name(), "trigger stop placed");
                eventPublisherHelper.publishPosition(this, position, PositionEventType.PROTECTED, "trigger stop at " + stopPrice);
                log.info(
                        "Stop placed for {} {}: trigger={} qty={} order={}",
                        position.getSide(),
                        position.getSymbol(),
                        stopPrice,
                        quantity,
                        result.getOrderId());
                return ProtectionResult.builder()
                        .outcome(ProtectionOutcome.TRIGGER_PLACED)
                        .mode(StopLossMode.TRIGGER)
                        .orderId(result.getOrderId())
                        .stopPrice(stopPrice)
                        .quantity(quantity)
                        .build();
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("Stop placement for {} failed (attempt {}/{}): {}", position.getSymbol(), attempt, attempts, lastError);
                if (placedOrderId != null) {
                    staleOrderId = placedOrderId;
                }
                if (attempt < attempts) {
                    pause();
                }
            }
        }

        discardUnverifiedStop(position, staleOrderId);
        return escalate(position, stopPrice, quantity, lastError);
    }

    /**
     * An unverified stop left over from the last attempt may still rest on the exchange. It is
     * cancelled before the emergency guard takes over, so a later trigger cannot open an opposite
     * position once the guard has flattened the exposure.
     */
    private void discardUnverifiedStop(ManagedPosition position, String orderId) {
        if (orderId == null) {
            return;
        }
        try {
            protectiveCloser.cancelQuietly(position.getSymbol(), orderId, false);
        } catch (RuntimeException e) {
            log.error("Unverified stop {} for {} could not be cancelled: {}", orderId, position.getSymbol(), e.getMessage());
            return;
        }
        if (Objects.equals(position.getStopOrderId(), orderId)) {
            position.setStopOrderId(null);
        }
    }

    /**
     * Placement retries are spent: arm a local guard as emergency protection and report a
     * protection failure, which moves the supervisor to SAFE_MODE.
     */
    private ProtectionResult escalate(ManagedPosition position, BigDecimal stopPrice, BigDecimal quantity, String error) {
        position.setProtectionFailures(position.getProtectionFailures() + 1);
        position.setProtectionPending(false);
        if (position.getStopMissingSince() == null) {
            position.setStopMissingSince(clock.instant());
        }
        armLocalGuard(position, stopPrice, quantity, false, "emergency after failed stop placement");

        String message = "Stop placement for " + position.getSymbol() + " failed after "
                + lifecycleConfig.getMaxSubmitRetries() + " attempts: " + error;
        log.error(message);
        ledgerService.recordProtection(position, ProtectionOutcome.FAILED.name(), message);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.PROTECTION_FAILED, message);
        safetySupervisor.reportFinding(SafetyTrigger.PROTECTION_FAILURE, message);
        return ProtectionResult.builder()
                .outcome(ProtectionOutcome.FAILED)
                .mode(StopLossMode.LOCAL_GUARD)
                .stopPrice(stopPrice)
                .quantity(quantity)
                .message(message)
                .build();
    }

    /** Arms (or re-arms) the local guard watch for the position. */
    public ProtectionResult armLocalGuard(
            ManagedPosition position, BigDecimal stopPrice, BigDecimal quantity, boolean provisional, String reason) {
        boolean newlyArmed = !position.isLocalGuardArmed();
        position.setLocalGuardArmed(true);
        position.setProvisionalGuard(provisional);
        position.setStopMode(StopLossMode.LOCAL_GUARD);
        position.setStopPrice(stopPrice);
        position.setStopQuantity(quantity);
        position.setProtectionPending(false);
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);

        if (newlyArmed) {
            String message = "Local guard armed for " + position.getSide() + " " + position.getSymbol()
                    + " at " + stopPrice + " (" + reason + ")";
            log.warn(message);
            ledgerService.recordFallback(FallbackType.LOCAL_GUARD_ARMED, position.getSymbol(), position.getPositionId(), message);
            ledgerService.recordProtection(position, ProtectionOutcome.LOCAL_GUARD_ARMED.name(), message);
            eventPublisherHelper.publishFallback(
                    this,
                    FallbackType.LOCAL_GUARD_ARMED,
                    position.getSymbol(),
                    message,
                    LedgerService.payload("positionId", position.getPositionId(), "provisional", provisional));
            eventPublisherHelper.publishPosition(this, position, PositionEventType.PROTECTED, message);
        }
        return ProtectionResult.builder()
                .outcome(ProtectionOutcome.LOCAL_GUARD_ARMED)
                .mode(StopLossMode.LOCAL_GUARD)
                .stopPrice(stopPrice)
                .quantity(quantity)
                .message(reason)
                .build();
    }

    // ========================
    // BREAK-EVEN
    // ========================

    /**
     * Moves the stop to entry plus a small buffer once the position is far enough in profit.
     *
     * @return NOT_ELIGIBLE below the profit threshold, otherwise the protection outcome
     */
    public ProtectionResult moveToBreakEven(ManagedPosition position, BigDecimal markPrice) {
        BigDecimal entry = position.getAverageEntry();
        if (entry == null || entry.signum() <= 0 || !position.hasExposure()) {
            return ProtectionResult.notEligible("position has no filled entry");
        }
        if (markPrice == null || markPrice.signum() <= 0) {
            return ProtectionResult.notEligible("no mark price");
        }

        BigDecimal move = markPrice.subtract(entry).divide(entry, 12, RoundingMode.HALF_UP);
        BigDecimal profit = position.getSide() == Side.LONG ? move : move.negate();
        if (profit.compareTo(lifecycleConfig.getBreakEvenTriggerPct()) < 0) {
            return ProtectionResult.notEligible(
                    "profit " + profit.setScale(6, RoundingMode.HALF_UP) + " below break-even trigger "
                            + lifecycleConfig.getBreakEvenTriggerPct());
        }

        BigDecimal buffer = lifecycleConfig.getBreakEvenBufferPct();
        BigDecimal factor = position.getSide() == Side.LONG ? BigDecimal.ONE.add(buffer) : BigDecimal.ONE.subtract(buffer);
        BigDecimal priceStep = symbolRulesService.get(position.getSymbol()).getPriceStep();
        BigDecimal newStop = QuantityRounding.floorToStep(entry.multiply(factor), priceStep);

        if (position.getStopPrice() != null && !improves(position.getSide(), position.getStopPrice(), newStop)) {
            return ProtectionResult.builder()
                    .outcome(ProtectionOutcome.ALREADY_PROTECTED)
                    .mode(position.getStopMode())
                    .orderId(position.getStopOrderId())
                    .stopPrice(position.getStopPrice())
                    .quantity(position.getStopQuantity())
                    .message("stop already at or beyond break-even")
                    .build();
        }

        ProtectionResult result = ensureProtection(position, newStop, position.getFilledQuantity());
        if (result.isProtected() && result.getOutcome() != ProtectionOutcome.ALREADY_PROTECTED) {
            position.setBreakEvenApplied(true);
            managedPositionRedisRepository.save(position);
            eventPublisherHelper.publishPosition(this, position, PositionEventType.BREAK_EVEN_MOVED, "stop moved to " + newStop);
        }
        return result;
    }

    // ========================
    // CANCEL
    // ========================

    /** Cancels the trigger stop and disarms the local guard. */
    public void cancelProtection(ManagedPosition position) {
        protectiveCloser.cancelQuietly(position.getSymbol(), position.getStopOrderId(), false);
        position.setStopOrderId(null);
        position.setLocalGuardArmed(false);
        position.setProvisionalGuard(false);
        position.setProtectionPending(false);
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);
    }

    // ========================
    // HELPERS
    // ========================

    /**
     * An existing stop is kept when it closes the right side, is a closing order, has a positive
     * trigger at the wanted price, and its size is within tolerance of the wanted size.
     */
    boolean isAcceptable(ExchangeOrder order, Side side, BigDecimal stopPrice, BigDecimal quantity) {
        if (order.getSide() != side.closeSide() || !order.isClosing()) {
            return false;
        }
        if (order.getTriggerPrice() == null || order.getTriggerPrice().signum() <= 0) {
            return false;
        }
        if (stopPrice != null && order.getTriggerPrice().compareTo(stopPrice) != 0) {
            return false;
        }
        return sizeWithinTolerance(order.getQuantity(), quantity, lifecycleConfig.getSizeTolerance());
    }

    /** |stopQty - positionQty| / positionQty &lt;= tolerance. */
    public static boolean sizeWithinTolerance(BigDecimal stopQty, BigDecimal positionQty, BigDecimal tolerance) {
        if (stopQty == null || positionQty == null || positionQty.signum() <= 0) {
            return false;
        }
        BigDecimal ratio = stopQty.subtract(positionQty).abs().divide(positionQty, 12, RoundingMode.HALF_UP);
        return ratio.compareTo(tolerance) <= 0;
    }

    /** The listed stop for the position, or null when it is gone or the lookup itself failed. */
    private ExchangeOrder lookupExistingStop(ManagedPosition position) {
        try {
            return findOpenOrder(position.getStopOrderId());
        } catch (RuntimeException e) {
            log.warn(
                    "Could not look up stop {} for {}, replacing it: {}",
                    position.getStopOrderId(),
                    position.getSymbol(),
                    e.getMessage());
            return null;
        }
    }

    private ExchangeOrder findOpenOrder(String orderId) {
        if (orderId == null) {
            return null;
        }
        List<ExchangeOrder> open = exchangeCallExecutor.call("getOpenOrders", exchangeGateway::getOpenOrders);
        return open.stream().filter(o -> Objects.equals(o.getOrderId(), orderId)).findFirst().orElse(null);
    }

    private static boolean improves(Side side, BigDecimal current, BigDecimal candidate) {
        return side == Side.LONG ? candidate.compareTo(current) > 0 : candidate.compareTo(current) < 0;
    }

    private void recordPlanOrderFallback(ManagedPosition position, ModeDecision decision) {
        String message = "Stop for " + position.getSymbol() + " falls back to local guard: " + decision.detail();
        ledgerService.recordFallback(FallbackType.PLAN_ORDER_FALLBACK, position.getSymbol(), position.getPositionId(), message);
        eventPublisherHelper.publishFallback(
                this,
                FallbackType.PLAN_ORDER_FALLBACK,
                position.getSymbol(),
                message,
                Map.of("positionId", position.getPositionId(), "provisional", decision.provisional()));
    }

    private void pause() {
        long delay = lifecycleConfig.getRetryDelayMs();
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
