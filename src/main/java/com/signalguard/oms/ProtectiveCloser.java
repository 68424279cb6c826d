package com.signalguard.oms;

import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.OrderResult;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.event.PositionEventType;
import com.signalguard.exception.BaseException;
import com.signalguard.exception.ExchangeRejectedException;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.CooldownTracker;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Flattens a position immediately through the priority lane of the call gate.
 *
 * <p>Used wherever waiting is worse than acting: a crossed local guard, a liquidation-distance
 * breach, an expired missing-stop deadline and the panic sweep. It works from exchange truth:
 * the close order is sized to the live exchange position, and the position's resting
 * protective orders are cancelled afterwards.
 *
 * <p>Talks to the gateway directly and never calls {@link OrderLifecycleManager}.
 */
@Component
public class ProtectiveCloser {

    private static final Logger log = LoggerFactory.getLogger(ProtectiveCloser.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final CloseInstructionFactory closeInstructionFactory;
    private final PositionLockRegistry positionLockRegistry;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final CooldownTracker cooldownTracker;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ProtectiveCloser(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            CloseInstructionFactory closeInstructionFactory,
            PositionLockRegistry positionLockRegistry,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            CooldownTracker cooldownTracker,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.closeInstructionFactory = closeInstructionFactory;
        this.positionLockRegistry = positionLockRegistry;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.cooldownTracker = cooldownTracker;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Closes the managed position's exchange exposure with a market order and marks it CLOSED.
     *
     * <p>The stop, the take-profits and the local guard stay in place until the exchange reports
     * the side flat. A close that leaves exposure behind keeps the position CLOSING for
     * reconciliation to retry; a close that throws leaves it the same way and rethrows.
     *
     * @param stopOut true when the close is the stop being hit, which feeds the stop-loss breaker
     * @return true once the exchange reports no exposure for the position, false while some remains
     */
    public boolean closePosition(ManagedPosition position, String reason, boolean stopOut) {
        return positionLockRegistry.withLock(position.getSymbol(), () -> {
            ManagedPosition current = managedPositionRedisRepository
                    .findById(position.getPositionId())
                    .orElse(position);
            if (!current.isOpen()) {
                return true;
            }

            boolean entryResting = current.getState() == LifecycleState.PENDING_ENTRY
                    || current.getState() == LifecycleState.PARTIALLY_FILLED;
            current.transitionTo(LifecycleState.CLOSING, clock.instant());
            managedPositionRedisRepository.save(current);

            // The entry must not fill after the exposure is measured
            if (entryResting) {
                cancelQuietly(current.getSymbol(), current.getEntryOrderId(), true);
                for (String orderId : current.getScaleInOrderIds()) {
                    cancelQuietly(current.getSymbol(), orderId, true);
                }
                current.getScaleInOrderIds().clear();
            }

            BigDecimal live = liveSize(current.getSymbol(), current.getSide());
            if (live.signum() > 0) {
                closeExposure(current, live, reason);
                BigDecimal remaining = liveSize(current.getSymbol(), current.getSide());
                if (remaining.signum() > 0) {
                    reportIncompleteClose(current, live, remaining, reason);
                    return false;
                }
            }

            cancelProtectiveOrders(current);
            markClosed(current, reason);
            if (stopOut) {
                cooldownTracker.recordStopOut(current.getSymbol());
            } else {
                cooldownTracker.recordNonStopClose();
            }
            return true;
        });
    }

    /**
     * Places a priority market close for {@code size} on the exchange. Used for tracked positions
     * and for exchange positions with no local record during a panic sweep.
     */
    public OrderResult closeExchangeExposure(String symbol, Side side, BigDecimal size, String reason) {
        OrderSpec spec = closeInstructionFactory.close(symbol, side, size);
        log.warn("Protective close {} {} qty={}: {}", side, symbol, size, reason);
        return exchangeCallExecutor.callPriority("placeOrder", () -> exchangeGateway.placeOrder(spec));
    }

    /** Cancels an order, treating "already gone" as success. */
    public boolean cancelQuietly(String symbol, String orderId, boolean priority) {
        if (orderId == null) {
            return false;
        }
        try {
            if (priority) {
                exchangeCallExecutor.runPriority("cancelOrder", () -> exchangeGateway.cancelOrder(symbol, orderId));
            } else {
                exchangeCallExecutor.run("cancelOrder", () -> exchangeGateway.cancelOrder(symbol, orderId));
            }
            return true;
        } catch (ExchangeRejectedException e) {
            log.debug("Cancel of {} on {} rejected, treating as gone: {}", orderId, symbol, e.getMessage());
            return false;
        }
    }

    /** Marks the position CLOSED locally, clears its protection references and ledgers the close. */
    public ManagedPosition markClosed(ManagedPosition position, String reason) {
        position.setLocalGuardArmed(false);
        position.setProvisionalGuard(false);
        position.setProtectionPending(false);
        position.setStopMissingSince(null);
        position.setCloseReason(reason);
        position.transitionTo(LifecycleState.CLOSED, clock.instant());
        managedPositionRedisRepository.save(position);
        ledgerService.recordFill(position, "CLOSED", LedgerService.payload("reason", reason));
        eventPublisherHelper.publishPosition(this, position, PositionEventType.CLOSED, reason);
        log.info("Position {} {} closed: {}", position.getPositionId(), position.getSymbol(), reason);
        return position;
    }

    private void closeExposure(ManagedPosition position, BigDecimal size, String reason) {
        OrderSpec spec = closeInstructionFactory.close(position.getSymbol(), position.getSide(), size);
        ledgerService.recordOrderAttempt(position, spec);
        OrderResult result;
        try {
            result = exchangeCallExecutor.callPriority("placeOrder", () -> exchangeGateway.placeOrder(spec));
        } catch (RuntimeException e) {
            log.error(
                    "Protective close {} {} qty={} failed, protection kept: {}",
                    position.getSide(),
                    position.getSymbol(),
                    size,
                    e.getMessage());
            ledgerService.recordOrderResult(position, spec, null, BaseException.reasonCodeOf(e), e.getMessage());
            throw e;
        }
        ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), reason);
        log.warn(
                "Protective close {} {} qty={} filled={}: {}",
                position.getSide(),
                position.getSymbol(),
                size,
                result.getFilledQuantity(),
                reason);
    }

    private void reportIncompleteClose(ManagedPosition position, BigDecimal size, BigDecimal remaining, String reason) {
        String message = "Close of " + position.getSide() + " " + position.getSymbol() + " left " + remaining
                + " of " + size + " open; stop and guard kept (" + reason + ")";
        log.error(message);
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.CLOSE_INCOMPLETE, message);
    }

    private void cancelProtectiveOrders(ManagedPosition position) {
        cancelQuietly(position.getSymbol(), position.getStopOrderId(), true);
        for (String orderId : position.getTakeProfitOrderIds()) {
            cancelQuietly(position.getSymbol(), orderId, true);
        }
        cancelQuietly(position.getSymbol(), position.getBreakEvenReduceOrderId(), true);
        position.setBreakEvenReduceOrderId(null);
        // Closing orders the exchange still lists for this side, e.g. from a crashed replace
        List<ExchangeOrder> open = exchangeCallExecutor.callPriority("getOpenOrders", exchangeGateway::getOpenOrders);
        String symbol = RiskPolicyConfig.normalize(position.getSymbol());
        for (ExchangeOrder order : open) {
            if (order.isClosing()
                    && RiskPolicyConfig.normalize(order.getSymbol()).equals(symbol)
                    && order.getSide() == position.getSide().closeSide()) {
                cancelQuietly(order.getSymbol(), order.getOrderId(), true);
            }
        }
        position.setStopOrderId(null);
        position.getTakeProfitOrderIds().clear();
    }

    private BigDecimal liveSize(String symbol, Side side) {
        List<ExchangePosition> positions = exchangeCallExecutor.callPriority("getPositions", exchangeGateway::getPositions);
        String normalized = RiskPolicyConfig.normalize(symbol);
        Optional<ExchangePosition> match = positions.stream()
                .filter(p -> RiskPolicyConfig.normalize(p.getSymbol()).equals(normalized) && p.getSide() == side)
                .findFirst();
        return match.map(ExchangePosition::getSize).orElse(BigDecimal.ZERO);
    }
}
