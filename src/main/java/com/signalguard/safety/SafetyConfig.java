package com.signalguard.safety;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Safety supervisor settings: kill switch sources, circuit breakers and invariant deadlines.
 *
 * <pre>
 * signalguard.safety.kill-switch-file=./KILL_SWITCH
 * signalguard.safety.kill-switch-env-key=SIGNALGUARD_KILL_SWITCH
 * signalguard.safety.max-account-drawdown-pct=0.15
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "signalguard.safety")
public class SafetyConfig {

    private long evaluationIntervalMs = 2_000;

    // ---- Kill switch ----

    private String killSwitchFile = "./KILL_SWITCH";
    private String killSwitchEnvKey = "SIGNALGUARD_KILL_SWITCH";

    // ---- Circuit breakers ----

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxAccountDrawdownPct = new BigDecimal("0.15");

    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxTotalMarginUsedPct = new BigDecimal("0.8");

    @Min(1)
    private int apiErrorBurst = 5;
    private long apiErrorWindowSeconds = 60;

    // ---- Position invariants ----

    /** Close the position when |liquidation - mark| / mark falls to or below this. */
    private BigDecimal maxLiquidationDistancePct = new BigDecimal("0.02");

    private boolean stopMustExist = true;
    private long maxTimeWithoutStopSeconds = 30;
    private boolean emergencyCloseIfStopFails = true;

    /** Enter safe mode when a local guard runs on a polled feed and streaming is required. */
    private boolean safeModeOnFeedDegraded = false;

    private long sweepTimeoutSeconds = 30;
}
