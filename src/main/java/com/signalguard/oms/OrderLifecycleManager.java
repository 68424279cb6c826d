package com.signalguard.oms;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.RejectReason;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.OrderPlan;
import com.signalguard.domain.model.OrderPlanSnapshot;
import com.signalguard.domain.model.OrderResult;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.ProtectionResult;
import com.signalguard.domain.model.SymbolRules;
import com.signalguard.domain.model.TakeProfitLevel;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.event.PositionEventType;
import com.signalguard.exception.BaseException;
import com.signalguard.exception.PositionNotFoundException;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.exchange.PriceFeedService;
import com.signalguard.exchange.SymbolRulesService;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.CooldownTracker;
import com.signalguard.risk.QuantityRounding;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives a managed position from accepted plan to closed exposure.
 *
 * <pre>
 * PENDING_ENTRY → PARTIALLY_FILLED → FILLED_PROTECTED → (MANAGING) → CLOSING → CLOSED
 * </pre>
 *
 * <p>Every mutation runs under the symbol lock. The protective stop is always sized to the
 * filled quantity, never to the intended one; each later fill triggers a size correction. The
 * take-profit ladder is placed once the entry is complete. A split entry rests its further legs
 * next to the first one and may add a break-even reduce order once two legs have filled.
 */
@Service
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final CloseInstructionFactory closeInstructionFactory;
    private final PositionLockRegistry positionLockRegistry;
    private final StopLossManager stopLossManager;
    private final ProtectiveCloser protectiveCloser;
    private final SymbolRulesService symbolRulesService;
    private final PriceFeedService priceFeedService;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final CooldownTracker cooldownTracker;
    private final SafetySupervisor safetySupervisor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final LifecycleConfig lifecycleConfig;
    private final Clock clock;

    public OrderLifecycleManager(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            CloseInstructionFactory closeInstructionFactory,
            PositionLockRegistry positionLockRegistry,
            StopLossManager stopLossManager,
            ProtectiveCloser protectiveCloser,
            SymbolRulesService symbolRulesService,
            PriceFeedService priceFeedService,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            CooldownTracker cooldownTracker,
            SafetySupervisor safetySupervisor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            LifecycleConfig lifecycleConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.closeInstructionFactory = closeInstructionFactory;
        this.positionLockRegistry = positionLockRegistry;
        this.stopLossManager = stopLossManager;
        this.protectiveCloser = protectiveCloser;
        this.symbolRulesService = symbolRulesService;
        this.priceFeedService = priceFeedService;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.cooldownTracker = cooldownTracker;
        this.safetySupervisor = safetySupervisor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.lifecycleConfig = lifecycleConfig;
        this.clock = clock;
    }

    // ========================
    // ENTRY
    // ========================

    /**
     * Opens a position for an accepted plan.
     *
     * @return the managed position; REJECTED (with the reason in {@code closeReason}) when a
     *     position is already active on the symbol or the exchange refused the entry
     */
    public ManagedPosition open(OrderPlan plan) {
        return positionLockRegistry.withLock(plan.getSymbol(), () -> {
            ManagedPosition position = newPosition(plan, LifecycleState.PENDING_ENTRY);
            if (!managedPositionRedisRepository.findOpenBySymbol(plan.getSymbol()).isEmpty()) {
                return reject(position, RejectReason.DUPLICATE_POSITION, "a position is already active on " + plan.getSymbol());
            }
            managedPositionRedisRepository.save(position);
            return placeEntry(position, plan.getEntry(), plan.getScaleInEntries());
        });
    }

    /** Stores a plan held for operator confirmation; nothing is sent to the exchange. */
    public ManagedPosition recordPending(OrderPlan plan) {
        ManagedPosition position = newPosition(plan, LifecycleState.PENDING_CONFIRMATION);
        List<OrderPlanSnapshot.EntryLeg> legs = new ArrayList<>();
        for (OrderSpec leg : plan.getScaleInEntries()) {
            legs.add(new OrderPlanSnapshot.EntryLeg(leg.getPrice(), leg.getQuantity()));
        }
        position.setPendingPlan(OrderPlanSnapshot.builder()
                .entryType(plan.getEntry().getKind() == OrderKind.LIMIT ? EntryType.LIMIT : EntryType.MARKET)
                .entryPrice(plan.getEntry().getPrice() != null ? plan.getEntry().getPrice() : plan.getEntryPrice())
                .quantity(plan.getEntry().getQuantity())
                .stopPrice(plan.getStopLoss().getTriggerPrice())
                .stopMode(plan.getStopLoss().getMode())
                .scaleInLegs(legs)
                .build());
        managedPositionRedisRepository.save(position);
        log.info("Plan {} for {} held for confirmation as {}", plan.getPlanId(), plan.getSymbol(), position.getPositionId());
        return position;
    }

    /** Places the entry of a plan that was held for confirmation. */
    public ManagedPosition confirmPending(String positionId) {
        ManagedPosition held = load(positionId);
        return positionLockRegistry.withLock(held.getSymbol(), () -> {
            ManagedPosition position = load(positionId);
            if (position.getState() != LifecycleState.PENDING_CONFIRMATION || position.getPendingPlan() == null) {
                throw new IllegalStateException("Position " + positionId + " is not waiting for confirmation");
            }
            if (!safetySupervisor.current().allowsNewEntries()) {
                return reject(position, RejectReason.SAFETY_GATE, "safety level is " + safetySupervisor.current().getLevel());
            }
            if (!managedPositionRedisRepository.findOpenBySymbol(position.getSymbol()).isEmpty()) {
                return reject(position, RejectReason.DUPLICATE_POSITION, "a position is already active on " + position.getSymbol());
            }

            OrderPlanSnapshot snapshot = position.getPendingPlan();
            boolean limit = snapshot.getEntryType() == EntryType.LIMIT;
            String entryId = "sg-" + position.getPlanId().substring(0, 8) + "-entry";
            OrderSpec entry = entryLeg(
                    position, entryId, limit, snapshot.getQuantity(), limit ? snapshot.getEntryPrice() : null);
            List<OrderSpec> scaleIns = new ArrayList<>();
            List<OrderPlanSnapshot.EntryLeg> legs = snapshot.getScaleInLegs() != null ? snapshot.getScaleInLegs() : List.of();
            for (int i = 0; i < legs.size(); i++) {
                scaleIns.add(entryLeg(position, entryId + "-" + (i + 2), true, legs.get(i).getQuantity(), legs.get(i).getPrice()));
            }
            position.transitionTo(LifecycleState.PENDING_ENTRY, clock.instant());
            position.setPendingPlan(null);
            managedPositionRedisRepository.save(position);
            return placeEntry(position, entry, scaleIns);
        });
    }

    /** Drops a plan held for confirmation. */
    public ManagedPosition rejectPending(String positionId, String reason) {
        ManagedPosition position = load(positionId);
        if (position.getState() != LifecycleState.PENDING_CONFIRMATION) {
            throw new IllegalStateException("Position " + positionId + " is not waiting for confirmation");
        }
        position.setPendingPlan(null);
        position.setCloseReason(reason);
        position.transitionTo(LifecycleState.REJECTED, clock.instant());
        managedPositionRedisRepository.save(position);
        return position;
    }

    private ManagedPosition placeEntry(ManagedPosition position, OrderSpec base, List<OrderSpec> scaleIns) {
        cooldownTracker.recordEntry(position.getSymbol());
        OrderSpec spec = closeInstructionFactory.entry(base, position.getSide());
        ledgerService.recordOrderAttempt(position, spec);

        OrderResult result;
        try {
            result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
        } catch (RuntimeException e) {
            ledgerService.recordOrderResult(position, spec, null, BaseException.reasonCodeOf(e), e.getMessage());
            log.warn("Entry for {} {} refused: {}", position.getSide(), position.getSymbol(), e.getMessage());
            return reject(position, RejectReason.EXCHANGE_REJECTED, e.getMessage());
        }

        ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);
        position.setEntryOrderId(result.getOrderId());
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);
        placeScaleIns(position, scaleIns);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.OPENED, "entry " + result.getOrderId());
        log.info(
                "Entry placed for {} {} qty={} order={} status={}",
                position.getSide(),
                position.getSymbol(),
                spec.getQuantity(),
                result.getOrderId(),
                result.getStatus());

        if (result.getFilledQuantity() != null && result.getFilledQuantity().signum() > 0) {
            return onEntryFill(position.getPositionId(), result.getFilledQuantity(), result.getAveragePrice());
        }
        return position;
    }

    /**
     * Places the further legs of a split entry. A leg the exchange refuses is dropped from the
     * intended size; the legs already resting stay.
     */
    private void placeScaleIns(ManagedPosition position, List<OrderSpec> scaleIns) {
        if (scaleIns == null || scaleIns.isEmpty()) {
            return;
        }
        for (OrderSpec leg : scaleIns) {
            OrderSpec spec = closeInstructionFactory.entry(leg, position.getSide());
            ledgerService.recordOrderAttempt(position, spec);
            try {
                OrderResult result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
                position.getScaleInOrderIds().add(result.getOrderId());
                ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);
            } catch (RuntimeException e) {
                ledgerService.recordOrderResult(position, spec, null, BaseException.reasonCodeOf(e), e.getMessage());
                position.setIntendedQuantity(position.getIntendedQuantity().subtract(spec.getQuantity()));
                if (position.getScaleInOrderIds().isEmpty()) {
                    // second leg missing: the two-leg break-even point is never reached
                    position.setBreakEvenReduceAt(null);
                }
                log.warn("Entry leg at {} for {} refused: {}", spec.getPrice(), position.getSymbol(), e.getMessage());
            }
        }
        position.setUpdatedAt(clock.instant());
        managedPositionRedisRepository.save(position);
        log.info(
                "Split entry for {} {}: {} of {} further legs resting",
                position.getSide(),
                position.getSymbol(),
                position.getScaleInOrderIds().size(),
                scaleIns.size());
    }

    // ========================
    // FILLS
    // ========================

    /**
     * Applies a cumulative entry fill: updates the filled size, re-sizes the stop to it and,
     * once the entry is complete and protected, places the take-profit ladder. Fills that do not
     * increase the cumulative quantity are ignored.
     */
    public ManagedPosition onEntryFill(String positionId, BigDecimal cumulativeFilled, BigDecimal averagePrice) {
        ManagedPosition held = load(positionId);
        return positionLockRegistry.withLock(held.getSymbol(), () -> {
            ManagedPosition position = load(positionId);
            if (!position.isOpen() || position.getState() == LifecycleState.CLOSING) {
                return position;
            }
            if (cumulativeFilled == null || cumulativeFilled.compareTo(position.getFilledQuantity()) <= 0) {
                return position;
            }
            boolean wasComplete = isComplete(position);

            position.setFilledQuantity(cumulativeFilled);
            position.setAverageEntry(averagePrice != null ? averagePrice : position.getPlannedEntryPrice());
            position.setUpdatedAt(clock.instant());
            ledgerService.recordFill(
                    position,
                    "ENTRY_FILL",
                    LedgerService.payload(
                            "filled", cumulativeFilled,
                            "intended", position.getIntendedQuantity(),
                            "averagePrice", position.getAverageEntry()));

            boolean complete = isComplete(position);
            if (!complete) {
                position.transitionTo(LifecycleState.PARTIALLY_FILLED, clock.instant());
            }
            managedPositionRedisRepository.save(position);

            ProtectionResult protection = stopLossManager.ensureProtection(position, position.getStopPrice(), cumulativeFilled);
            log.info(
                    "Entry fill {} {}: {}/{} protection={}",
                    position.getSide(),
                    position.getSymbol(),
                    cumulativeFilled,
                    position.getIntendedQuantity(),
                    protection.getOutcome());

            if (complete && position.isProtected()) {
                if (position.getState() == LifecycleState.PENDING_ENTRY
                        || position.getState() == LifecycleState.PARTIALLY_FILLED) {
                    position.transitionTo(LifecycleState.FILLED_PROTECTED, clock.instant());
                }
                managedPositionRedisRepository.save(position);
                if (!wasComplete) {
                    placeTakeProfits(position);
                }
            }
            maybePlaceBreakEvenReduce(position);
            eventPublisherHelper.publishPosition(this, position, PositionEventType.FILLED, "filled " + cumulativeFilled);
            return position;
        });
    }

    /**
     * Once the first two legs of a split entry have filled, rests a reduce-only order at the
     * average entry for {@code breakEvenReducePct} of the filled size. Placed at most once and
     * only while the position is protected.
     */
    private void maybePlaceBreakEvenReduce(ManagedPosition position) {
        if (!lifecycleConfig.isBreakEvenReduceOnTwoEntries()
                || position.getBreakEvenReduceAt() == null
                || position.getBreakEvenReduceOrderId() != null
                || !position.isProtected()
                || position.getAverageEntry() == null
                || position.getFilledQuantity().compareTo(position.getBreakEvenReduceAt()) < 0) {
            return;
        }
        SymbolRules rules = symbolRulesService.get(position.getSymbol());
        BigDecimal quantity = QuantityRounding.floorToStep(
                position.getFilledQuantity().multiply(lifecycleConfig.getBreakEvenReducePct()).movePointLeft(2),
                rules.getQtyStep());
        if (quantity.signum() <= 0 || (rules.getMinQty() != null && quantity.compareTo(rules.getMinQty()) < 0)) {
            log.info("Break-even reduce for {} skipped: {} below minimum", position.getSymbol(), quantity);
            return;
        }
        BigDecimal price = QuantityRounding.floorToStep(position.getAverageEntry(), rules.getPriceStep());
        OrderSpec spec = closeInstructionFactory.breakEvenReduce(position.getSymbol(), position.getSide(), quantity, price);
        ledgerService.recordOrderAttempt(position, spec);
        try {
            OrderResult result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
            position.setBreakEvenReduceOrderId(result.getOrderId());
            ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);
            managedPositionRedisRepository.save(position);
            log.info("Break-even reduce for {} placed: {} at {}", position.getSymbol(), quantity, price);
        } catch (RuntimeException e) {
            ledgerService.recordOrderResult(position, spec, null, BaseException.reasonCodeOf(e), e.getMessage());
            log.warn("Break-even reduce for {} failed: {}", position.getSymbol(), e.getMessage());
        }
    }

    private void placeTakeProfits(ManagedPosition position) {
        if (position.getTakeProfits() == null || position.getTakeProfits().isEmpty()) {
            return;
        }
        SymbolRules rules = symbolRulesService.get(position.getSymbol());
        List<QuantityRounding.LadderSlice> slices = QuantityRounding.splitLadder(
                position.getFilledQuantity(), position.getTakeProfits(), rules.getQtyStep(), rules.getMinQty());
        for (QuantityRounding.LadderSlice slice : slices) {
            placeTakeProfit(position, slice.price(), slice.quantity());
        }
        managedPositionRedisRepository.save(position);
    }

    private void placeTakeProfit(ManagedPosition position, BigDecimal price, BigDecimal quantity) {
        OrderSpec spec = closeInstructionFactory.takeProfit(position.getSymbol(), position.getSide(), quantity, price);
        ledgerService.recordOrderAttempt(position, spec);
        try {
            OrderResult result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
            position.getTakeProfitOrderIds().add(result.getOrderId());
            ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);
        } catch (RuntimeException e) {
            log.warn("Take-profit at {} for {} failed: {}", price, position.getSymbol(), e.getMessage());
            ledgerService.recordOrderResult(position, spec, null, BaseException.reasonCodeOf(e), e.getMessage());
        }
    }

    // ========================
    // MANAGE
    // ========================

    /** Moves the stop to break-even when the profit threshold is reached against the mark price. */
    public ProtectionResult moveStopToBreakEven(String symbol) {
        return positionLockRegistry.withLock(symbol, () -> {
            ManagedPosition position = activeFor(symbol);
            BigDecimal mark = priceFeedService.current(symbol).getPrice();
            ProtectionResult result = stopLossManager.moveToBreakEven(position, mark);
            if (result.isProtected() && position.getState() == LifecycleState.FILLED_PROTECTED) {
                position.transitionTo(LifecycleState.MANAGING, clock.instant());
                managedPositionRedisRepository.save(position);
            }
            return result;
        });
    }

    /**
     * Closes {@code fraction} of the filled quantity (partial take-profit) and re-sizes the stop
     * to what is left. A remainder below the exchange minimum closes the whole position.
     *
     * @param fraction in (0, 1]
     */
    public ManagedPosition reduce(String symbol, BigDecimal fraction) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Reduce fraction must be in (0, 1]: " + fraction);
        }
        return positionLockRegistry.withLock(symbol, () -> {
            ManagedPosition position = activeFor(symbol);
            if (!position.hasExposure()) {
                throw new IllegalStateException("Position " + position.getPositionId() + " has no filled quantity");
            }
            SymbolRules rules = symbolRulesService.get(symbol);
            BigDecimal filled = position.getFilledQuantity();
            BigDecimal quantity = QuantityRounding.floorToStep(filled.multiply(fraction), rules.getQtyStep());
            BigDecimal remainder = filled.subtract(quantity);

            if (remainder.signum() <= 0 || (rules.getMinQty() != null && remainder.compareTo(rules.getMinQty()) < 0)) {
                log.info("Reduce of {} leaves {} below minimum; closing the whole position", symbol, remainder);
                return closeLocked(position, "reduce " + fraction + " leaves remainder below minimum");
            }
            if (quantity.signum() <= 0 || (rules.getMinQty() != null && quantity.compareTo(rules.getMinQty()) < 0)) {
                throw new IllegalArgumentException("Reduce quantity " + quantity + " is below the exchange minimum");
            }

            OrderSpec spec = closeInstructionFactory.reduce(symbol, position.getSide(), quantity);
            ledgerService.recordOrderAttempt(position, spec);
            OrderResult result = exchangeCallExecutor.call("placeOrder", () -> exchangeGateway.placeOrder(spec));
            ledgerService.recordOrderResult(position, spec, result.getOrderId(), result.getStatus().name(), null);

            BigDecimal closed = result.getFilledQuantity() != null ? result.getFilledQuantity() : BigDecimal.ZERO;
            position.setFilledQuantity(filled.subtract(closed));
            position.setIntendedQuantity(position.getIntendedQuantity().subtract(closed).max(position.getFilledQuantity()));
            position.transitionTo(LifecycleState.MANAGING, clock.instant());
            managedPositionRedisRepository.save(position);

            stopLossManager.ensureProtection(position, position.getStopPrice(), position.getFilledQuantity());
            eventPublisherHelper.publishPosition(this, position, PositionEventType.REDUCED, "reduced by " + closed);
            log.info("Reduced {} {} by {}; {} left", position.getSide(), symbol, closed, position.getFilledQuantity());
            return position;
        });
    }

    /** Replaces the take-profit orders with a single target for the full filled quantity. */
    public ManagedPosition updateTakeProfit(String symbol, BigDecimal price) {
        return positionLockRegistry.withLock(symbol, () -> {
            ManagedPosition position = activeFor(symbol);
            boolean beyondEntry = position.getAverageEntry() == null
                    || (position.getSide() == Side.LONG
                            ? price.compareTo(position.getAverageEntry()) > 0
                            : price.compareTo(position.getAverageEntry()) < 0);
            if (!beyondEntry) {
                throw new IllegalArgumentException("Take-profit " + price + " is not beyond entry " + position.getAverageEntry());
            }
            for (String orderId : new ArrayList<>(position.getTakeProfitOrderIds())) {
                protectiveCloser.cancelQuietly(symbol, orderId, false);
            }
            position.getTakeProfitOrderIds().clear();
            BigDecimal priceStep = symbolRulesService.get(symbol).getPriceStep();
            BigDecimal target = QuantityRounding.floorToStep(price, priceStep);
            position.setTakeProfits(new ArrayList<>(List.of(new TakeProfitLevel(target, BigDecimal.ONE))));
            if (position.hasExposure()) {
                placeTakeProfit(position, target, position.getFilledQuantity());
            }
            if (position.getState() == LifecycleState.FILLED_PROTECTED) {
                position.transitionTo(LifecycleState.MANAGING, clock.instant());
            }
            managedPositionRedisRepository.save(position);
            return position;
        });
    }

    /** CLOSING, close order, cancel stop and take-profits, CLOSED. */
    public ManagedPosition close(String symbol, String reason) {
        return positionLockRegistry.withLock(symbol, () -> closeLocked(activeFor(symbol), reason));
    }

    private ManagedPosition closeLocked(ManagedPosition position, String reason) {
        protectiveCloser.closePosition(position, reason, false);
        return load(position.getPositionId());
    }

    // ========================
    // LOOKUP
    // ========================

    public Optional<ManagedPosition> findActive(String symbol) {
        return managedPositionRedisRepository.findOpenBySymbol(symbol).stream().findFirst();
    }

    private ManagedPosition activeFor(String symbol) {
        return findActive(symbol).orElseThrow(() -> new PositionNotFoundException("No active position for " + symbol));
    }

    private ManagedPosition load(String positionId) {
        return managedPositionRedisRepository
                .findById(positionId)
                .orElseThrow(() -> new PositionNotFoundException("Position not found: " + positionId));
    }

    // ========================
    // HELPERS
    // ========================

    private ManagedPosition newPosition(OrderPlan plan, LifecycleState state) {
        Instant now = clock.instant();
        BigDecimal breakEvenReduceAt = plan.getScaleInEntries().isEmpty()
                ? null
                : plan.getEntry().getQuantity().add(plan.getScaleInEntries().get(0).getQuantity());
        return ManagedPosition.builder()
                .positionId(UUID.randomUUID().toString())
                .planId(plan.getPlanId())
                .signalId(plan.getSignalId())
                .symbol(plan.getSymbol())
                .side(plan.getSide())
                .intendedQuantity(plan.getQuantity())
                .plannedEntryPrice(plan.getEntryPrice())
                .leverage(plan.getLeverage())
                .stopPrice(plan.getStopLoss().getTriggerPrice())
                .takeProfits(new ArrayList<>(plan.getTakeProfits()))
                .breakEvenReduceAt(breakEvenReduceAt)
                .state(state)
                .openedAt(now)
                .updatedAt(now)
                .build();
    }

    private OrderSpec entryLeg(ManagedPosition position, String clientOrderId, boolean limit, BigDecimal quantity, BigDecimal price) {
        return OrderSpec.builder()
                .clientOrderId(clientOrderId)
                .symbol(position.getSymbol())
                .side(position.getSide().entrySide())
                .kind(limit ? OrderKind.LIMIT : OrderKind.MARKET)
                .quantity(quantity)
                .price(price)
                .leverage(position.getLeverage())
                .purpose(OrderPurpose.ENTRY)
                .build();
    }

    private ManagedPosition reject(ManagedPosition position, RejectReason reason, String detail) {
        position.setCloseReason(reason.name() + ": " + detail);
        position.transitionTo(LifecycleState.REJECTED, clock.instant());
        managedPositionRedisRepository.save(position);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.REJECTED, position.getCloseReason());
        log.warn("Position {} for {} rejected: {}", position.getPositionId(), position.getSymbol(), position.getCloseReason());
        return position;
    }

    private static boolean isComplete(ManagedPosition position) {
        return position.getFilledQuantity() != null
                && position.getIntendedQuantity() != null
                && position.getFilledQuantity().compareTo(position.getIntendedQuantity()) >= 0;
    }
}
