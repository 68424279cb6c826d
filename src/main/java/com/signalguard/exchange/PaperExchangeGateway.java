package com.signalguard.exchange;

import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderSide;
import com.signalguard.domain.enums.OrderStatus;
import com.signalguard.domain.enums.PriceSource;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.OrderResult;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.PriceTick;
import com.signalguard.domain.model.SymbolRules;
import com.signalguard.exception.ExchangeRejectedException;
import com.signalguard.exception.TransientExchangeException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * In-memory simulated exchange for paper trading.
 *
 * <p>Keeps a book of resting LIMIT and TRIGGER orders and matches them whenever a price is set.
 * MARKET orders fill immediately at the last price.
 *
 * <p>Matching:
 * <ul>
 *   <li>LIMIT BUY fills when last &lt;= limit, LIMIT SELL when last &gt;= limit (at the limit)</li>
 *   <li>TRIGGER BUY fires when last &gt;= trigger, TRIGGER SELL when last &lt;= trigger (at last)</li>
 * </ul>
 *
 * <p>Positions are netted per symbol and side. A closing order (reduce-only or close trade-side)
 * never opens exposure: it is capped at the open size and cancelled when nothing is left.
 * When a position goes flat, its remaining closing orders are cancelled the way a real
 * exchange drops orphaned reduce-only orders.
 */
@Component
@ConditionalOnProperty(prefix = "signalguard.exchange", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperExchangeGateway implements ExchangeGateway {

    private static final Logger log = LoggerFactory.getLogger(PaperExchangeGateway.class);

    private final ExchangeConfig.Paper paperConfig;
    private final Clock clock;

    private final Map<String, BigDecimal> lastPrices = new HashMap<>();
    private final Map<String, SymbolRules> rules = new HashMap<>();

    /** Resting orders in placement order. */
    private final Map<String, ExchangeOrder> openOrders = new LinkedHashMap<>();

    /** Positions keyed by {@code symbol:side}. */
    private final Map<String, ExchangePosition> positions = new LinkedHashMap<>();

    private final Map<String, Integer> leverageBySymbol = new HashMap<>();

    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private boolean planOrdersSupported;
    private boolean streaming;
    private long probeDelayMs;
    private final AtomicInteger transientFailuresToInject = new AtomicInteger();

    /** Resting orders left out of open-order listings while listing lag is on. */
    private final Set<String> unlistedOrderIds = new HashSet<>();
    private boolean listingLag;
    private boolean rejectClosingMarketOrders;
    private Runnable afterPositionsRead;

    public PaperExchangeGateway(ExchangeConfig exchangeConfig, Clock clock) {
        this.paperConfig = exchangeConfig.getPaper();
        this.clock = clock;
        this.planOrdersSupported = paperConfig.isPlanOrdersSupported();
        this.streaming = paperConfig.isStreaming();
    }

    // ========================
    // GATEWAY
    // ========================

    @Override
    public synchronized AccountSnapshot getBalance() {
        maybeFail("getBalance");
        BigDecimal unrealized = BigDecimal.ZERO;
        BigDecimal margin = BigDecimal.ZERO;
        for (ExchangePosition position : positions.values()) {
            BigDecimal mark = lastPrices.getOrDefault(position.getSymbol(), position.getEntryPrice());
            unrealized = unrealized.add(pnl(position.getSide(), position.getEntryPrice(), mark, position.getSize()));
            int leverage = leverageBySymbol.getOrDefault(position.getSymbol(), 1);
            margin = margin.add(position.getSize()
                    .multiply(position.getEntryPrice())
                    .divide(BigDecimal.valueOf(leverage), 8, RoundingMode.HALF_UP));
        }
        BigDecimal equity = paperConfig.getInitialEquity().add(realizedPnl).add(unrealized);
        return AccountSnapshot.builder()
                .equity(equity)
                .available(equity.subtract(margin))
                .marginUsed(margin)
                .unrealizedPnl(unrealized)
                .capturedAt(clock.instant())
                .build();
    }

    @Override
    public synchronized List<ExchangePosition> getPositions() {
        maybeFail("getPositions");
        List<ExchangePosition> result = new ArrayList<>();
        for (ExchangePosition position : positions.values()) {
            result.add(position.toBuilder()
                    .markPrice(lastPrices.get(position.getSymbol()))
                    .build());
        }
        Runnable action = afterPositionsRead;
        if (action != null) {
            afterPositionsRead = null;
            action.run();
        }
        return result;
    }

    @Override
    public synchronized List<ExchangeOrder> getOpenOrders() {
        maybeFail("getOpenOrders");
        List<ExchangeOrder> result = new ArrayList<>();
        for (ExchangeOrder order : openOrders.values()) {
            if (!unlistedOrderIds.contains(order.getOrderId())) {
                result.add(order);
            }
        }
        return result;
    }

    @Override
    public synchronized OrderResult placeOrder(OrderSpec spec) {
        maybeFail("placeOrder");
        if (spec.getKind() == OrderKind.TRIGGER && !planOrdersSupported) {
            throw new ExchangeRejectedException("40017", "Plan orders are not enabled for this account");
        }
        if (rejectClosingMarketOrders && spec.getKind() == OrderKind.MARKET && spec.isClosing()) {
            throw new ExchangeRejectedException("22002", "No position to close");
        }
        if (spec.getLeverage() != null) {
            leverageBySymbol.put(spec.getSymbol(), spec.getLeverage());
        }

        String orderId = "PAPER-" + UUID.randomUUID().toString().substring(0, 8);
        ExchangeOrder order = ExchangeOrder.builder()
                .orderId(orderId)
                .clientOrderId(spec.getClientOrderId())
                .symbol(spec.getSymbol())
                .side(spec.getSide())
                .kind(spec.getKind())
                .quantity(spec.getQuantity())
                .price(spec.getPrice())
                .triggerPrice(spec.getTriggerPrice())
                .reduceOnly(spec.isReduceOnly())
                .tradeSide(spec.getTradeSide())
                .holdSide(spec.getHoldSide())
                .purpose(spec.getPurpose())
                .status(OrderStatus.OPEN)
                .build();

        if (spec.getKind() == OrderKind.MARKET) {
            BigDecimal last = lastPrices.get(spec.getSymbol());
            if (last == null) {
                throw new TransientExchangeException("No price available for " + spec.getSymbol());
            }
            BigDecimal filled = fill(order, order.getQuantity(), last);
            log.debug("Paper MARKET {} {} qty={} filled={} @ {}", orderId, spec.getSide(), spec.getQuantity(), filled, last);
            return OrderResult.builder()
                    .orderId(orderId)
                    .clientOrderId(spec.getClientOrderId())
                    .status(filled.signum() > 0 ? OrderStatus.FILLED : OrderStatus.CANCELLED)
                    .filledQuantity(filled)
                    .averagePrice(filled.signum() > 0 ? last : null)
                    .build();
        }

        openOrders.put(orderId, order);
        if (listingLag) {
            unlistedOrderIds.add(orderId);
        }
        log.debug(
                "Paper order resting: {} {} {} qty={} price={} trigger={}",
                orderId,
                spec.getSide(),
                spec.getKind(),
                spec.getQuantity(),
                spec.getPrice(),
                spec.getTriggerPrice());
        matchSymbol(spec.getSymbol());

        ExchangeOrder after = openOrders.get(orderId);
        if (after == null) {
            return OrderResult.builder()
                    .orderId(orderId)
                    .clientOrderId(spec.getClientOrderId())
                    .status(OrderStatus.FILLED)
                    .filledQuantity(spec.getQuantity())
                    .averagePrice(spec.getKind() == OrderKind.LIMIT ? spec.getPrice() : lastPrices.get(spec.getSymbol()))
                    .build();
        }
        return OrderResult.builder()
                .orderId(orderId)
                .clientOrderId(spec.getClientOrderId())
                .status(OrderStatus.OPEN)
                .build();
    }

    @Override
    public synchronized void cancelOrder(String symbol, String orderId) {
        maybeFail("cancelOrder");
        ExchangeOrder removed = openOrders.remove(orderId);
        if (removed == null) {
            throw new ExchangeRejectedException("43001", "Order does not exist: " + orderId);
        }
        log.debug("Paper order cancelled: {}", orderId);
    }

    @Override
    public synchronized SymbolRules getSymbolRules(String symbol) {
        maybeFail("getSymbolRules");
        return rules.computeIfAbsent(symbol, s -> SymbolRules.builder()
                .symbol(s)
                .qtyStep(paperConfig.getQtyStep())
                .priceStep(paperConfig.getPriceStep())
                .minQty(paperConfig.getMinQty())
                .tradable(true)
                .quoteVolume24h(paperConfig.getQuoteVolume24h())
                .build());
    }

    @Override
    public CapabilityStatus probeCapability(CapabilityKind kind) {
        if (probeDelayMs > 0) {
            try {
                Thread.sleep(probeDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientExchangeException("Capability probe interrupted", e);
            }
        }
        synchronized (this) {
            maybeFail("probeCapability");
            return planOrdersSupported ? CapabilityStatus.SUPPORTED : CapabilityStatus.UNSUPPORTED;
        }
    }

    @Override
    public synchronized PriceTick streamOrPollPrice(String symbol) {
        maybeFail("streamOrPollPrice");
        BigDecimal last = lastPrices.get(symbol);
        if (last == null) {
            throw new TransientExchangeException("No price available for " + symbol);
        }
        return PriceTick.builder()
                .symbol(symbol)
                .price(last)
                .source(streaming ? PriceSource.STREAM : PriceSource.POLL)
                .at(clock.instant())
                .build();
    }

    // ========================
    // SIMULATION CONTROLS
    // ========================

    /** Sets the last price and matches resting orders against it. */
    public synchronized void setPrice(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
        matchSymbol(symbol);
    }

    /** Fills part of a resting order at its limit price, or at the last price for triggers. */
    public synchronized void fillPartially(String orderId, BigDecimal quantity) {
        ExchangeOrder order = openOrders.get(orderId);
        if (order == null) {
            throw new IllegalArgumentException("No resting order " + orderId);
        }
        BigDecimal price = order.getPrice() != null ? order.getPrice() : lastPrices.get(order.getSymbol());
        BigDecimal remaining = order.getQuantity().subtract(order.getFilledQuantity());
        BigDecimal qty = quantity.min(remaining);
        BigDecimal filled = applyFill(order, qty, price);
        BigDecimal total = order.getFilledQuantity().add(filled);
        if (total.compareTo(order.getQuantity()) >= 0) {
            openOrders.remove(orderId);
        } else {
            openOrders.put(orderId, order.toBuilder()
                    .filledQuantity(total)
                    .status(OrderStatus.PARTIALLY_FILLED)
                    .build());
        }
    }

    public synchronized void setRules(SymbolRules symbolRules) {
        rules.put(symbolRules.getSymbol(), symbolRules);
    }

    public synchronized void setPlanOrdersSupported(boolean supported) {
        this.planOrdersSupported = supported;
    }

    public synchronized void setStreaming(boolean streaming) {
        this.streaming = streaming;
    }

    /** Delays capability probes so probe timeouts can be exercised. */
    public void setProbeDelayMs(long probeDelayMs) {
        this.probeDelayMs = probeDelayMs;
    }

    /** Makes the next {@code count} calls fail with a transient error. */
    public void failNextCalls(int count) {
        transientFailuresToInject.set(count);
    }

    /**
     * While on, newly resting orders are accepted and matched but left out of
     * {@link #getOpenOrders()}. Turning it off lists them again.
     */
    public synchronized void setListingLag(boolean lag) {
        this.listingLag = lag;
        if (!lag) {
            unlistedOrderIds.clear();
        }
    }

    /** While on, closing MARKET orders are refused with an exchange rejection. */
    public synchronized void setRejectClosingMarketOrders(boolean reject) {
        this.rejectClosingMarketOrders = reject;
    }

    /**
     * Runs {@code action} once, right after the next {@link #getPositions()} call has taken its
     * snapshot, so the caller holds a list that the action has already made stale.
     */
    public synchronized void afterNextPositionsRead(Runnable action) {
        this.afterPositionsRead = action;
    }

    /** Opens a position directly, as if it had been opened outside this process. */
    public synchronized void seedPosition(String symbol, Side side, BigDecimal size, BigDecimal entryPrice) {
        positions.put(key(symbol, side), ExchangePosition.builder()
                .symbol(symbol)
                .side(side)
                .size(size)
                .entryPrice(entryPrice)
                .build());
    }

    /** Places a resting order directly, bypassing the call gate. */
    public synchronized String seedOrder(ExchangeOrder order) {
        String orderId = order.getOrderId() != null
                ? order.getOrderId()
                : "PAPER-" + UUID.randomUUID().toString().substring(0, 8);
        openOrders.put(orderId, order.toBuilder().orderId(orderId).status(OrderStatus.OPEN).build());
        return orderId;
    }

    public synchronized void reset() {
        lastPrices.clear();
        rules.clear();
        openOrders.clear();
        positions.clear();
        leverageBySymbol.clear();
        realizedPnl = BigDecimal.ZERO;
        transientFailuresToInject.set(0);
        unlistedOrderIds.clear();
        listingLag = false;
        rejectClosingMarketOrders = false;
        afterPositionsRead = null;
    }

    // ========================
    // MATCHING
    // ========================

    private void matchSymbol(String symbol) {
        BigDecimal last = lastPrices.get(symbol);
        if (last == null) {
            return;
        }
        for (ExchangeOrder order : new ArrayList<>(openOrders.values())) {
            if (!symbol.equals(order.getSymbol()) || !openOrders.containsKey(order.getOrderId())) {
                continue;
            }
            BigDecimal fillPrice = tryMatch(order, last);
            if (fillPrice != null) {
                openOrders.remove(order.getOrderId());
                BigDecimal remaining = order.getQuantity().subtract(order.getFilledQuantity());
                fill(order, remaining, fillPrice);
            }
        }
    }

    private BigDecimal tryMatch(ExchangeOrder order, BigDecimal last) {
        return switch (order.getKind()) {
            case LIMIT -> matchLimit(order, last);
            case TRIGGER -> matchTrigger(order, last);
            case MARKET -> last;
        };
    }

    private BigDecimal matchLimit(ExchangeOrder order, BigDecimal last) {
        if (order.getSide() == OrderSide.BUY && last.compareTo(order.getPrice()) <= 0) {
            return order.getPrice();
        }
        if (order.getSide() == OrderSide.SELL && last.compareTo(order.getPrice()) >= 0) {
            return order.getPrice();
        }
        return null;
    }

    private BigDecimal matchTrigger(ExchangeOrder order, BigDecimal last) {
        if (order.getSide() == OrderSide.BUY && last.compareTo(order.getTriggerPrice()) >= 0) {
            return last;
        }
        if (order.getSide() == OrderSide.SELL && last.compareTo(order.getTriggerPrice()) <= 0) {
            return last;
        }
        return null;
    }

    /** Applies a fill and cleans up closing orders left behind by a flat position. */
    private BigDecimal fill(ExchangeOrder order, BigDecimal quantity, BigDecimal price) {
        BigDecimal filled = applyFill(order, quantity, price);
        cancelOrphanedClosingOrders();
        return filled;
    }

    private BigDecimal applyFill(ExchangeOrder order, BigDecimal quantity, BigDecimal price) {
        Side positionSide = positionSide(order);
        String key = key(order.getSymbol(), positionSide);
        ExchangePosition current = positions.get(key);

        if (order.isClosing()) {
            if (current == null) {
                log.debug("Paper closing order {} cancelled: no {} position", order.getOrderId(), key);
                return BigDecimal.ZERO;
            }
            BigDecimal qty = quantity.min(current.getSize());
            realizedPnl = realizedPnl.add(pnl(positionSide, current.getEntryPrice(), price, qty));
            BigDecimal left = current.getSize().subtract(qty);
            if (left.signum() <= 0) {
                positions.remove(key);
            } else {
                positions.put(key, current.toBuilder().size(left).build());
            }
            return qty;
        }

        if (current == null) {
            positions.put(key, ExchangePosition.builder()
                    .symbol(order.getSymbol())
                    .side(positionSide)
                    .size(quantity)
                    .entryPrice(price)
                    .build());
        } else {
            BigDecimal size = current.getSize().add(quantity);
            BigDecimal avg = current.getEntryPrice()
                    .multiply(current.getSize())
                    .add(price.multiply(quantity))
                    .divide(size, 8, RoundingMode.HALF_UP);
            positions.put(key, current.toBuilder().size(size).entryPrice(avg).build());
        }
        return quantity;
    }

    private void cancelOrphanedClosingOrders() {
        openOrders.values().removeIf(order -> order.isClosing()
                && !positions.containsKey(key(order.getSymbol(), positionSide(order))));
    }

    private Side positionSide(ExchangeOrder order) {
        if (order.getHoldSide() != null) {
            return order.getHoldSide();
        }
        if (order.isClosing()) {
            return order.getSide() == OrderSide.SELL ? Side.LONG : Side.SHORT;
        }
        return order.getSide() == OrderSide.BUY ? Side.LONG : Side.SHORT;
    }

    private static BigDecimal pnl(Side side, BigDecimal entry, BigDecimal exit, BigDecimal qty) {
        BigDecimal diff = exit.subtract(entry).multiply(qty);
        return side == Side.LONG ? diff : diff.negate();
    }

    private static String key(String symbol, Side side) {
        return symbol + ":" + side;
    }

    private void maybeFail(String operation) {
        if (transientFailuresToInject.get() > 0 && transientFailuresToInject.getAndDecrement() > 0) {
            throw new TransientExchangeException("Simulated network failure on " + operation);
        }
    }
}
