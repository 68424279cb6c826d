package com.signalguard.risk;

import com.signalguard.domain.enums.LimitPriceStrategy;
import com.signalguard.domain.enums.OverLimitPolicy;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.StopLossMode;
import com.signalguard.domain.enums.SymbolPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Risk and sizing policy read by {@link RiskSizingEngine}.
 *
 * <p>All {@code *Pct} values are ratios: {@code 0.01} means 1%.
 *
 * <pre>
 * signalguard.risk.account-risk-per-trade=0.005
 * signalguard.risk.max-leverage=10
 * signalguard.risk.leverage-policy=CAP
 * signalguard.risk.hard-stop-loss-required=true
 * signalguard.risk.default-stop-loss-pct=0.01
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "signalguard.risk")
public class RiskPolicyConfig {

    // ---- Symbol policy ----

    private SymbolPolicy symbolPolicy = SymbolPolicy.ALLOWLIST;
    private List<String> symbolAllowlist = new ArrayList<>();
    private List<String> symbolBlacklist = new ArrayList<>();

    /** Reject symbols the exchange does not list as tradable. */
    private boolean requireExchangeSymbol = true;

    /** Minimum 24h quote volume; null disables the liquidity filter. */
    private BigDecimal minQuoteVolume24h;

    private List<Side> allowedSides = new ArrayList<>(List.of(Side.LONG, Side.SHORT));

    // ---- Signal filters ----

    private long maxSignalAgeSeconds = 20;
    private double minSignalQuality = 0.0;
    private boolean requireConfirmation = true;
    private double confirmationThreshold = 0.75;

    // ---- Cooldowns ----

    private long cooldownSeconds = 300;
    private int consecutiveStoplossLimit = 3;
    private long stoplossCooldownSeconds = 1_800;

    // ---- Leverage and size ----

    @Min(1)
    private int maxLeverage = 10;

    @NotNull
    private OverLimitPolicy leveragePolicy = OverLimitPolicy.CAP;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("0.1")
    private BigDecimal accountRiskPerTrade = new BigDecimal("0.005");

    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxNotionalPerTrade = new BigDecimal("200");

    @NotNull
    private OverLimitPolicy notionalPolicy = OverLimitPolicy.CAP;

    @Min(1)
    private int maxOpenPositions = 3;

    // ---- Stop loss and entry ----

    private boolean hardStopLossRequired = true;

    /** Stop distance used when a signal carries none; null disables derivation. */
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax(value = "1", inclusive = false)
    private BigDecimal defaultStopLossPct = new BigDecimal("0.01");

    @NotNull
    private StopLossMode stopLossMode = StopLossMode.TRIGGER;
    private BigDecimal maxEntrySlippagePct = new BigDecimal("0.003");
    private LimitPriceStrategy limitPriceStrategy = LimitPriceStrategy.MID;

    /**
     * Relative sizes of the legs of a LIMIT entry, e.g. {@code [1, 2]}. Fewer than two ratios
     * places a single entry.
     */
    private List<BigDecimal> entrySplitRatio = new ArrayList<>();

    public boolean isBlacklisted(String symbol) {
        return containsSymbol(symbolBlacklist, symbol);
    }

    public boolean isAllowlisted(String symbol) {
        return containsSymbol(symbolAllowlist, symbol);
    }

    private static boolean containsSymbol(List<String> symbols, String symbol) {
        String normalized = normalize(symbol);
        return symbols.stream().map(RiskPolicyConfig::normalize).anyMatch(normalized::equals);
    }

    /** Upper-case and strip separators: {@code btc/usdt} and {@code BTCUSDT} are the same symbol. */
    public static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase(Locale.ROOT).replace("/", "");
    }
}
