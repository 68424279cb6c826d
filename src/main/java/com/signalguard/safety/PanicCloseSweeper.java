package com.signalguard.safety;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PanicSweepResult;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.exchange.ExchangeGateway;
import com.signalguard.oms.ProtectiveCloser;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.service.LedgerService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One-time flatten of the whole account when the supervisor enters PANIC_CLOSE.
 *
 * <p>Execution order:
 * <ol>
 *   <li>Cancel every opening order the exchange lists (parallel), so no entry can add exposure</li>
 *   <li>Close every exchange position with a market order (parallel); tracked positions are also
 *       marked CLOSED locally</li>
 *   <li>Mark local open positions with no exchange exposure CLOSED</li>
 *   <li>Cancel the closing orders left on sides that are now flat</li>
 * </ol>
 *
 * <p>Stops and take-profits stay on the exchange until their side is confirmed flat. A close
 * that fails leaves the position with its stop (or guard) and is reported as an error.
 *
 * <p>All exchange calls use the priority lane. Failures on single orders or positions do not
 * abort the sweep; they are collected into the {@link PanicSweepResult}. A second call returns
 * {@link PanicSweepResult#alreadyRan()} until {@link #reset()}.
 */
@Component
public class PanicCloseSweeper {

    private static final Logger log = LoggerFactory.getLogger(PanicCloseSweeper.class);

    private static final String REASON_PREFIX = "panic close: ";

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final ProtectiveCloser protectiveCloser;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final SafetyConfig safetyConfig;

    private final AtomicBoolean swept = new AtomicBoolean(false);

    public PanicCloseSweeper(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            ProtectiveCloser protectiveCloser,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            SafetyConfig safetyConfig) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.protectiveCloser = protectiveCloser;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.safetyConfig = safetyConfig;
    }

    public PanicSweepResult sweep(String reason) {
        if (swept.getAndSet(true)) {
            log.warn("Panic sweep already ran, ignoring: {}", reason);
            return PanicSweepResult.alreadyRan();
        }

        log.error("PANIC CLOSE SWEEP STARTED: {}", reason);
        List<String> errors = new ArrayList<>();

        int ordersCancelled = cancelOpeningOrdersParallel(errors);
        int positionsClosed = closeAllPositionsParallel(reason, errors);
        ordersCancelled += cancelFlatSideClosingOrders(errors);

        boolean success = errors.isEmpty();
        if (success) {
            log.error("Panic sweep complete: {} orders cancelled, {} positions closed", ordersCancelled, positionsClosed);
        } else {
            log.error("Panic sweep completed with {} errors: {}", errors.size(), errors);
        }
        eventPublisherHelper.publishAnomaly(
                this,
                "PANIC_SWEEP",
                AlertSeverity.CRITICAL,
                null,
                "Panic sweep " + (success ? "complete" : "completed with errors") + ": " + reason,
                LedgerService.payload(
                        "ordersCancelled", ordersCancelled,
                        "positionsClosed", positionsClosed,
                        "errors", List.copyOf(errors)));

        return PanicSweepResult.builder()
                .success(success)
                .ordersCancelled(ordersCancelled)
                .positionsClosed(positionsClosed)
                .errors(errors)
                .build();
    }

    public boolean hasRun() {
        return swept.get();
    }

    /** Re-arms the sweep after an operator has cleared panic. */
    public void reset() {
        swept.set(false);
    }

    // ========================
    // ORDERS
    // ========================

    private int cancelOpeningOrdersParallel(List<String> errors) {
        List<ExchangeOrder> open;
        try {
            open = exchangeCallExecutor.callPriority("getOpenOrders", exchangeGateway::getOpenOrders);
        } catch (RuntimeException e) {
            addError(errors, "list open orders: " + e.getMessage());
            return 0;
        }
        return cancelParallel(open.stream().filter(o -> !o.isClosing()).toList(), "entry cancellation", errors);
    }

    /** Closing orders are only dropped once the exchange shows no exposure on their side. */
    private int cancelFlatSideClosingOrders(List<String> errors) {
        List<ExchangeOrder> open;
        Set<String> exposed = new HashSet<>();
        try {
            for (ExchangePosition position : exchangeCallExecutor.callPriority("getPositions", exchangeGateway::getPositions)) {
                if (position.getSize() != null && position.getSize().signum() > 0) {
                    exposed.add(key(position.getSymbol(), position.getSide()));
                }
            }
            open = exchangeCallExecutor.callPriority("getOpenOrders", exchangeGateway::getOpenOrders);
        } catch (RuntimeException e) {
            addError(errors, "list leftover orders: " + e.getMessage());
            return 0;
        }
        List<ExchangeOrder> leftovers = open.stream()
                .filter(ExchangeOrder::isClosing)
                .filter(o -> !exposed.contains(key(o.getSymbol(), closedSide(o))))
                .toList();
        return cancelParallel(leftovers, "leftover cancellation", errors);
    }

    private int cancelParallel(List<ExchangeOrder> orders, String stage, List<String> errors) {
        if (orders.isEmpty()) {
            return 0;
        }
        AtomicInteger cancelled = new AtomicInteger(0);
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (ExchangeOrder order : orders) {
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    exchangeCallExecutor.runPriority(
                            "cancelOrder", () -> exchangeGateway.cancelOrder(order.getSymbol(), order.getOrderId()));
                    cancelled.incrementAndGet();
                } catch (RuntimeException e) {
                    addError(errors, "cancel " + order.getOrderId() + " on " + order.getSymbol() + ": " + e.getMessage());
                }
            }));
        }
        awaitAll(futures, stage, errors);
        return cancelled.get();
    }

    // ========================
    // POSITIONS
    // ========================

    private int closeAllPositionsParallel(String reason, List<String> errors) {
        List<ExchangePosition> positions;
        try {
            positions = exchangeCallExecutor.callPriority("getPositions", exchangeGateway::getPositions);
        } catch (RuntimeException e) {
            addError(errors, "list positions: " + e.getMessage());
            positions = List.of();
        }

        List<ManagedPosition> local = managedPositionRedisRepository.findOpen();
        Set<String> handled = new HashSet<>();
        AtomicInteger closed = new AtomicInteger(0);
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (ExchangePosition exchangePosition : positions) {
            if (exchangePosition.getSize() == null || exchangePosition.getSize().signum() <= 0) {
                continue;
            }
            Optional<ManagedPosition> tracked = local.stream()
                    .filter(p -> matches(p, exchangePosition))
                    .findFirst();
            tracked.ifPresent(p -> handled.add(p.getPositionId()));

            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    if (tracked.isPresent()) {
                        if (!protectiveCloser.closePosition(tracked.get(), REASON_PREFIX + reason, false)) {
                            addError(errors, "close " + exchangePosition.getSide() + " " + exchangePosition.getSymbol()
                                    + ": exposure left open, protection kept");
                            return;
                        }
                    } else {
                        protectiveCloser.closeExchangeExposure(
                                exchangePosition.getSymbol(),
                                exchangePosition.getSide(),
                                exchangePosition.getSize(),
                                REASON_PREFIX + reason);
                    }
                    closed.incrementAndGet();
                } catch (RuntimeException e) {
                    addError(errors, "close " + exchangePosition.getSide() + " " + exchangePosition.getSymbol() + ": " + e.getMessage());
                }
            }));
        }
        awaitAll(futures, "position close", errors);

        // Pending entries and records whose exposure is already gone
        for (ManagedPosition position : local) {
            if (handled.contains(position.getPositionId())) {
                continue;
            }
            try {
                if (!protectiveCloser.closePosition(position, REASON_PREFIX + reason, false)) {
                    addError(errors, "close local " + position.getPositionId() + ": exposure left open, protection kept");
                }
            } catch (RuntimeException e) {
                addError(errors, "close local " + position.getPositionId() + ": " + e.getMessage());
            }
        }
        return closed.get();
    }

    private void awaitAll(List<CompletableFuture<Void>> futures, String stage, List<String> errors) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(safetyConfig.getSweepTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            addError(errors, stage + " timed out after " + safetyConfig.getSweepTimeoutSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            addError(errors, stage + " interrupted");
        } catch (ExecutionException e) {
            addError(errors, stage + " failed: " + e.getMessage());
        }
    }

    private static boolean matches(ManagedPosition position, ExchangePosition exchangePosition) {
        return position.getSide() == exchangePosition.getSide()
                && RiskPolicyConfig.normalize(position.getSymbol())
                        .equals(RiskPolicyConfig.normalize(exchangePosition.getSymbol()));
    }

    private static String key(String symbol, Side side) {
        return RiskPolicyConfig.normalize(symbol) + ":" + side;
    }

    /** Position side a closing order works against. */
    private static Side closedSide(ExchangeOrder order) {
        if (order.getHoldSide() != null) {
            return order.getHoldSide();
        }
        return order.getSide() == OrderSide.SELL ? Side.LONG : Side.SHORT;
    }

    private static void addError(List<String> errors, String error) {
        log.error("Panic sweep: {}", error);
        synchronized (errors) {
            errors.add(error);
        }
    }
}
