package com.signalguard.risk;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.OrderKind;
import com.signalguard.domain.enums.OrderPurpose;
import com.signalguard.domain.enums.OverLimitPolicy;
import com.signalguard.domain.enums.RejectReason;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.SymbolPolicy;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.MarketSnapshot;
import com.signalguard.domain.model.OrderPlan;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SignalIntent;
import com.signalguard.domain.model.StopLossSpec;
import com.signalguard.domain.model.SymbolRules;
import com.signalguard.domain.model.TakeProfitLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether an entry signal may become a position, and how large.
 *
 * <p>Checks run in a fixed order and stop at the first failure, each failure mapping to its own
 * {@link RejectReason}:
 * <ol>
 *   <li>Safety gate</li>
 *   <li>Signal age</li>
 *   <li>Symbol policy: blacklist, allowlist, tradability, 24h liquidity, allowed sides</li>
 *   <li>Signal quality</li>
 *   <li>Symbol cooldown and the consecutive stop-loss breaker</li>
 *   <li>Leverage cap (CAP clamps with a warning, REJECT rejects)</li>
 *   <li>Stop-loss presence and side</li>
 *   <li>Entry slippage against the current price</li>
 *   <li>Max concurrent positions</li>
 *   <li>Risk-based size, rounded down, never below the exchange minimum</li>
 *   <li>Max notional per trade (CAP or REJECT)</li>
 *   <li>Split of a LIMIT entry over its entry points by the configured ratio; a leg below the
 *       exchange minimum drops the split</li>
 *   <li>Confirmation for low-confidence signals</li>
 * </ol>
 *
 * <p>The engine is pure with respect to its inputs: it reads the cooldown tracker but never
 * records anything. The caller ledgers every decision.
 */
@Service
public class RiskSizingEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskSizingEngine.class);

    private static final int SCALE = 12;

    private final CooldownTracker cooldownTracker;
    private final Clock clock;

    public RiskSizingEngine(CooldownTracker cooldownTracker, Clock clock) {
        this.cooldownTracker = cooldownTracker;
        this.clock = clock;
    }

    public RiskDecision evaluate(
            SignalIntent signal,
            AccountSnapshot account,
            MarketSnapshot market,
            SafetySnapshot safety,
            RiskPolicyConfig policy) {
        String symbol = RiskPolicyConfig.normalize(signal.getSymbol());
        List<String> warnings = new ArrayList<>();

        // 1. Safety gate
        if (!safety.allowsNewEntries()) {
            return reject(RejectReason.SAFETY_GATE, "safety level is " + safety.getLevel());
        }

        // 2. Signal age
        if (signal.getReceivedAt() != null) {
            long ageSeconds = Duration.between(signal.getReceivedAt(), clock.instant()).getSeconds();
            if (ageSeconds > policy.getMaxSignalAgeSeconds()) {
                return reject(RejectReason.STALE_SIGNAL, "signal is " + ageSeconds + "s old");
            }
        }

        // 3. Symbol policy
        RiskDecision symbolRejection = checkSymbol(signal, symbol, market, policy);
        if (symbolRejection != null) {
            return symbolRejection;
        }

        // 4. Quality
        if (signal.getQuality() < policy.getMinSignalQuality()) {
            return reject(
                    RejectReason.LOW_QUALITY,
                    "quality " + signal.getQuality() + " below " + policy.getMinSignalQuality());
        }

        // 5. Cooldowns
        if (cooldownTracker.isCoolingDown(symbol, policy.getCooldownSeconds())) {
            return reject(RejectReason.COOLDOWN_ACTIVE, "entry on " + symbol + " within " + policy.getCooldownSeconds() + "s");
        }
        if (cooldownTracker.isBreakerActive()) {
            return reject(
                    RejectReason.STOPLOSS_BREAKER_ACTIVE,
                    "consecutive stop-loss breaker active until " + cooldownTracker.getBreakerUntil());
        }

        // 6. Leverage
        int leverage = signal.getLeverage() != null ? signal.getLeverage() : 1;
        if (leverage > policy.getMaxLeverage()) {
            if (policy.getLeveragePolicy() == OverLimitPolicy.REJECT) {
                return reject(
                        RejectReason.LEVERAGE_EXCEEDS_CAP,
                        "leverage " + leverage + " exceeds max " + policy.getMaxLeverage());
            }
            warnings.add("leverage capped from " + leverage + " to " + policy.getMaxLeverage());
            leverage = policy.getMaxLeverage();
        }

        // Entry price needs a usable market price for MARKET entries and slippage
        BigDecimal currentPrice = market.getCurrentPrice();
        if (currentPrice == null || currentPrice.signum() <= 0) {
            return reject(RejectReason.INVALID_MARKET_PRICE, "no usable market price for " + symbol);
        }
        SymbolRules rules = market.getRules();
        List<BigDecimal> legPrices = entryLegPrices(signal, policy, rules);
        BigDecimal entryPrice = legPrices.isEmpty()
                ? QuantityRounding.floorToStep(pickEntryPrice(signal, currentPrice, policy), rules.getPriceStep())
                : QuantityRounding.floorToStep(
                        weightedAverage(legPrices, splitRatios(policy, legPrices.size())), rules.getPriceStep());

        // 7. Stop loss
        BigDecimal stopPrice;
        boolean derived = false;
        if (signal.getStopLoss() != null) {
            stopPrice = QuantityRounding.floorToStep(signal.getStopLoss(), rules.getPriceStep());
            if (!isProtectiveSide(signal.getSide(), entryPrice, stopPrice)) {
                return reject(
                        RejectReason.INVALID_STOP_LOSS,
                        "stop " + stopPrice + " is on the wrong side of entry " + entryPrice + " for " + signal.getSide());
            }
        } else if (policy.getDefaultStopLossPct() != null && policy.getDefaultStopLossPct().signum() > 0) {
            stopPrice = QuantityRounding.floorToStep(
                    deriveStop(signal.getSide(), entryPrice, policy.getDefaultStopLossPct()), rules.getPriceStep());
            derived = true;
            warnings.add("stop loss derived from default distance " + policy.getDefaultStopLossPct());
            if (!isProtectiveSide(signal.getSide(), entryPrice, stopPrice)) {
                return reject(RejectReason.INVALID_STOP_LOSS, "derived stop " + stopPrice + " collapses onto entry");
            }
        } else if (policy.isHardStopLossRequired()) {
            return reject(RejectReason.MISSING_STOP_LOSS, "signal has no stop loss and no default is configured");
        } else {
            return reject(RejectReason.STOP_LOSS_UNAVAILABLE, "no stop distance available for sizing");
        }
        for (BigDecimal legPrice : legPrices) {
            if (!isProtectiveSide(signal.getSide(), legPrice, stopPrice)) {
                return reject(
                        RejectReason.INVALID_STOP_LOSS,
                        "stop " + stopPrice + " is on the wrong side of entry leg " + legPrice + " for " + signal.getSide());
            }
        }

        // 8. Entry slippage
        BigDecimal deviation = deviationFromRange(signal, currentPrice);
        if (policy.getMaxEntrySlippagePct() != null && deviation.compareTo(policy.getMaxEntrySlippagePct()) > 0) {
            return reject(
                    RejectReason.ENTRY_SLIPPAGE,
                    "price " + currentPrice + " deviates " + deviation.setScale(6, RoundingMode.HALF_UP)
                            + " from entry range");
        }

        // 9. Concurrent positions
        if (account.getOpenPositionCount() >= policy.getMaxOpenPositions()) {
            return reject(
                    RejectReason.MAX_OPEN_POSITIONS,
                    account.getOpenPositionCount() + "/" + policy.getMaxOpenPositions() + " positions open");
        }

        // 10. Sizing
        BigDecimal stopDistance = entryPrice.subtract(stopPrice).abs();
        BigDecimal riskBudget = account.getEquity().multiply(policy.getAccountRiskPerTrade());
        BigDecimal quantity = QuantityRounding.floorToStep(
                riskBudget.divide(stopDistance, SCALE, RoundingMode.DOWN), rules.getQtyStep());
        if (isBelowMinimum(quantity, rules)) {
            return reject(
                    RejectReason.SIZE_BELOW_MINIMUM,
                    "size " + quantity + " below minimum " + rules.getMinQty());
        }

        // 11. Notional
        BigDecimal notional = quantity.multiply(entryPrice);
        if (policy.getMaxNotionalPerTrade() != null && notional.compareTo(policy.getMaxNotionalPerTrade()) > 0) {
            if (policy.getNotionalPolicy() == OverLimitPolicy.REJECT) {
                return reject(
                        RejectReason.NOTIONAL_EXCEEDS_CAP,
                        "notional " + notional + " exceeds max " + policy.getMaxNotionalPerTrade());
            }
            BigDecimal capped = QuantityRounding.floorToStep(
                    policy.getMaxNotionalPerTrade().divide(entryPrice, SCALE, RoundingMode.DOWN), rules.getQtyStep());
            warnings.add("size capped from " + quantity + " to " + capped + " by max notional");
            quantity = capped;
            if (isBelowMinimum(quantity, rules)) {
                return reject(
                        RejectReason.SIZE_BELOW_MINIMUM,
                        "notional-capped size " + quantity + " below minimum " + rules.getMinQty());
            }
            notional = quantity.multiply(entryPrice);
        }

        // Split entry legs
        List<BigDecimal> legQuantities = List.of();
        if (!legPrices.isEmpty()) {
            legQuantities = splitQuantity(quantity, splitRatios(policy, legPrices.size()), rules);
            if (legQuantities.isEmpty()) {
                warnings.add("entry split dropped: a leg of " + quantity + " would fall below minimum " + rules.getMinQty());
                legPrices = List.of();
            } else {
                quantity = legQuantities.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
                notional = quantity.multiply(entryPrice);
            }
        }

        OrderPlan plan = buildPlan(
                signal, symbol, quantity, leverage, entryPrice, legPrices, legQuantities, stopPrice, derived,
                stopDistance, notional, rules, policy, warnings);

        // 12. Confirmation
        if (policy.isRequireConfirmation() && signal.getConfidence() < policy.getConfirmationThreshold()) {
            log.info(
                    "Signal {} held for confirmation: confidence {} below {}",
                    signal.getSignalId(),
                    signal.getConfidence(),
                    policy.getConfirmationThreshold());
            return RiskDecision.pendingConfirmation(
                    plan, "confidence " + signal.getConfidence() + " below " + policy.getConfirmationThreshold());
        }

        log.debug(
                "Signal {} accepted: {} {} qty={} entry={} stop={} leverage={}",
                signal.getSignalId(),
                signal.getSide(),
                symbol,
                quantity,
                entryPrice,
                stopPrice,
                leverage);
        return RiskDecision.accepted(plan);
    }

    // ========================
    // CHECKS
    // ========================

    private RiskDecision checkSymbol(SignalIntent signal, String symbol, MarketSnapshot market, RiskPolicyConfig policy) {
        if (policy.isBlacklisted(symbol)) {
            return reject(RejectReason.SYMBOL_BLACKLISTED, symbol + " is blacklisted");
        }
        if (policy.getSymbolPolicy() == SymbolPolicy.ALLOWLIST && !policy.isAllowlisted(symbol)) {
            return reject(RejectReason.SYMBOL_NOT_ALLOWED, symbol + " is not on the allowlist");
        }
        SymbolRules rules = market.getRules();
        if (rules == null || (policy.isRequireExchangeSymbol() && !rules.isTradable())) {
            return reject(RejectReason.SYMBOL_NOT_TRADABLE, symbol + " is not tradable on the exchange");
        }
        BigDecimal minVolume = policy.getMinQuoteVolume24h();
        if (minVolume != null) {
            BigDecimal volume = rules.getQuoteVolume24h();
            if (volume == null || volume.compareTo(minVolume) < 0) {
                return reject(
                        RejectReason.INSUFFICIENT_LIQUIDITY,
                        "24h volume " + volume + " below " + minVolume + " for " + symbol);
            }
        }
        if (!policy.getAllowedSides().contains(signal.getSide())) {
            return reject(RejectReason.SIDE_NOT_ALLOWED, signal.getSide() + " entries are not allowed");
        }
        return null;
    }

    private static BigDecimal pickEntryPrice(SignalIntent signal, BigDecimal currentPrice, RiskPolicyConfig policy) {
        if (signal.getEntryType() == EntryType.MARKET) {
            return currentPrice;
        }
        return switch (policy.getLimitPriceStrategy()) {
            case LOW -> signal.getEntryLow();
            case HIGH -> signal.getEntryHigh();
            case MID -> signal.getEntryLow()
                    .add(signal.getEntryHigh())
                    .divide(BigDecimal.valueOf(2), SCALE, RoundingMode.HALF_UP);
        };
    }

    /**
     * Leg prices of a split LIMIT entry, first leg nearest the market; empty when the entry is
     * not split. Without explicit entry points the range edges are used.
     */
    private static List<BigDecimal> entryLegPrices(SignalIntent signal, RiskPolicyConfig policy, SymbolRules rules) {
        List<BigDecimal> ratios = policy.getEntrySplitRatio();
        if (signal.getEntryType() != EntryType.LIMIT || ratios == null || ratios.size() < 2) {
            return List.of();
        }
        if (ratios.stream().anyMatch(r -> r == null || r.signum() <= 0)) {
            log.warn("Ignoring entry split ratio {}: every ratio must be positive", ratios);
            return List.of();
        }
        List<BigDecimal> points = signal.getEntryPoints();
        if (points == null || points.isEmpty()) {
            if (signal.getEntryLow() == null || signal.getEntryLow().compareTo(signal.getEntryHigh()) == 0) {
                return List.of();
            }
            points = signal.getSide() == Side.LONG
                    ? List.of(signal.getEntryHigh(), signal.getEntryLow())
                    : List.of(signal.getEntryLow(), signal.getEntryHigh());
        }
        int legs = Math.min(ratios.size(), points.size());
        if (legs < 2) {
            return List.of();
        }
        List<BigDecimal> prices = new ArrayList<>();
        for (int i = 0; i < legs; i++) {
            prices.add(QuantityRounding.floorToStep(points.get(i), rules.getPriceStep()));
        }
        return prices;
    }

    private static List<BigDecimal> splitRatios(RiskPolicyConfig policy, int legs) {
        return policy.getEntrySplitRatio().subList(0, legs);
    }

    private static BigDecimal weightedAverage(List<BigDecimal> prices, List<BigDecimal> weights) {
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal weightSum = BigDecimal.ZERO;
        for (int i = 0; i < prices.size(); i++) {
            total = total.add(prices.get(i).multiply(weights.get(i)));
            weightSum = weightSum.add(weights.get(i));
        }
        return total.divide(weightSum, SCALE, RoundingMode.DOWN);
    }

    /** Leg sizes rounded down to the step; empty when any leg would be below the minimum. */
    private static List<BigDecimal> splitQuantity(BigDecimal quantity, List<BigDecimal> ratios, SymbolRules rules) {
        BigDecimal ratioSum = ratios.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        List<BigDecimal> legs = new ArrayList<>();
        for (BigDecimal ratio : ratios) {
            BigDecimal leg = QuantityRounding.floorToStep(
                    quantity.multiply(ratio).divide(ratioSum, SCALE, RoundingMode.DOWN), rules.getQtyStep());
            if (isBelowMinimum(leg, rules)) {
                return List.of();
            }
            legs.add(leg);
        }
        return legs;
    }

    private static boolean isProtectiveSide(Side side, BigDecimal entry, BigDecimal stop) {
        if (stop == null || stop.signum() <= 0) {
            return false;
        }
        return side == Side.LONG ? stop.compareTo(entry) < 0 : stop.compareTo(entry) > 0;
    }

    private static BigDecimal deriveStop(Side side, BigDecimal entry, BigDecimal distancePct) {
        BigDecimal factor = side == Side.LONG ? BigDecimal.ONE.subtract(distancePct) : BigDecimal.ONE.add(distancePct);
        return entry.multiply(factor);
    }

    /** Relative distance of the current price outside the signal's entry range; zero inside it. */
    private static BigDecimal deviationFromRange(SignalIntent signal, BigDecimal currentPrice) {
        BigDecimal low = signal.getEntryLow();
        BigDecimal high = signal.getEntryHigh();
        if (low == null || high == null) {
            return BigDecimal.ZERO;
        }
        if (currentPrice.compareTo(low) < 0) {
            return low.subtract(currentPrice).divide(low, SCALE, RoundingMode.HALF_UP);
        }
        if (currentPrice.compareTo(high) > 0) {
            return currentPrice.subtract(high).divide(high, SCALE, RoundingMode.HALF_UP);
        }
        return BigDecimal.ZERO;
    }

    private static boolean isBelowMinimum(BigDecimal quantity, SymbolRules rules) {
        return quantity.signum() <= 0 || (rules.getMinQty() != null && quantity.compareTo(rules.getMinQty()) < 0);
    }

    // ========================
    // PLAN
    // ========================

    private OrderPlan buildPlan(
            SignalIntent signal,
            String symbol,
            BigDecimal quantity,
            int leverage,
            BigDecimal entryPrice,
            List<BigDecimal> legPrices,
            List<BigDecimal> legQuantities,
            BigDecimal stopPrice,
            boolean derivedStop,
            BigDecimal stopDistance,
            BigDecimal notional,
            SymbolRules rules,
            RiskPolicyConfig policy,
            List<String> warnings) {
        String planId = UUID.randomUUID().toString();
        boolean limit = signal.getEntryType() == EntryType.LIMIT;

        String entryId = "sg-" + planId.substring(0, 8) + "-entry";
        OrderSpec entry;
        List<OrderSpec> scaleIns = new ArrayList<>();
        if (legPrices.isEmpty()) {
            entry = entryLeg(entryId, symbol, signal.getSide(), limit, quantity, limit ? entryPrice : null, leverage);
        } else {
            entry = entryLeg(entryId, symbol, signal.getSide(), true, legQuantities.get(0), legPrices.get(0), leverage);
            for (int i = 1; i < legPrices.size(); i++) {
                scaleIns.add(entryLeg(
                        entryId + "-" + (i + 1), symbol, signal.getSide(), true, legQuantities.get(i), legPrices.get(i), leverage));
            }
        }

        return OrderPlan.builder()
                .planId(planId)
                .signalId(signal.getSignalId())
                .symbol(symbol)
                .side(signal.getSide())
                .quantity(quantity)
                .leverage(leverage)
                .entryPrice(entryPrice)
                .entry(entry)
                .scaleInEntries(List.copyOf(scaleIns))
                .stopLoss(StopLossSpec.builder()
                        .triggerPrice(stopPrice)
                        .mode(policy.getStopLossMode())
                        .derived(derivedStop)
                        .build())
                .takeProfits(buildLadder(signal, entryPrice, rules, warnings))
                .riskAmount(quantity.multiply(stopDistance))
                .notional(notional)
                .warnings(List.copyOf(warnings))
                .build();
    }

    private static OrderSpec entryLeg(
            String clientOrderId, String symbol, Side side, boolean limit, BigDecimal quantity, BigDecimal price, int leverage) {
        return OrderSpec.builder()
                .clientOrderId(clientOrderId)
                .symbol(symbol)
                .side(side.entrySide())
                .kind(limit ? OrderKind.LIMIT : OrderKind.MARKET)
                .quantity(quantity)
                .price(price)
                .leverage(leverage)
                .purpose(OrderPurpose.ENTRY)
                .build();
    }

    /** Equal-fraction ladder over the signal's targets, skipping targets on the losing side. */
    private static List<TakeProfitLevel> buildLadder(
            SignalIntent signal, BigDecimal entryPrice, SymbolRules rules, List<String> warnings) {
        List<BigDecimal> targets = new ArrayList<>();
        for (BigDecimal target : signal.getTakeProfits()) {
            boolean profitable = signal.getSide() == Side.LONG
                    ? target.compareTo(entryPrice) > 0
                    : target.compareTo(entryPrice) < 0;
            if (profitable) {
                targets.add(QuantityRounding.floorToStep(target, rules.getPriceStep()));
            } else {
                warnings.add("take profit " + target + " ignored: not beyond entry");
            }
        }
        if (targets.isEmpty()) {
            return List.of();
        }
        BigDecimal fraction = BigDecimal.ONE.divide(BigDecimal.valueOf(targets.size()), 8, RoundingMode.DOWN);
        List<TakeProfitLevel> ladder = new ArrayList<>();
        for (BigDecimal target : targets) {
            ladder.add(new TakeProfitLevel(target, fraction));
        }
        return ladder;
    }

    private static RiskDecision reject(RejectReason reason, String detail) {
        log.debug("Risk rejection {}: {}", reason, detail);
        return RiskDecision.rejected(reason, detail);
    }
}
