package com.signalguard.safety;

import com.signalguard.domain.enums.KillSwitchAction;
import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.PanicSweepResult;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SafetyTransition;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exception.FatalSafetyTriggerException;
import com.signalguard.exchange.AccountStateService;
import com.signalguard.exchange.ExchangeCallExecutor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Owns the process-wide safety state: {@code NORMAL ⇄ SAFE_MODE → PANIC_CLOSE}.
 *
 * <p>The state is an immutable {@link SafetySnapshot} behind an {@link AtomicReference}; readers
 * never block. Every change is recorded as a {@link SafetyTransition}, ledgered and published.
 *
 * <p>Sources evaluated on each pass:
 * <ul>
 *   <li>External kill switch ({@link KillSwitchReader})</li>
 *   <li>API error burst from the exchange call gate</li>
 *   <li>Drawdown from peak equity (fatal: only the operator clears it)</li>
 *   <li>Used margin relative to equity</li>
 * </ul>
 *
 * <p>Other components report findings through {@link #reportFinding}. SAFE_MODE entered only
 * because of the kill switch returns to NORMAL once the switch is removed; any other cause, and
 * PANIC_CLOSE always, needs {@link #clearToNormal(String)}.
 */
@Service
public class SafetySupervisor {

    private static final Logger log = LoggerFactory.getLogger(SafetySupervisor.class);

    private final KillSwitchReader killSwitchReader;
    private final PanicCloseSweeper panicCloseSweeper;
    private final AccountStateService accountStateService;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final SafetyConfig safetyConfig;
    private final Clock clock;

    private final AtomicReference<SafetySnapshot> state;
    private final AtomicReference<BigDecimal> peakEquity = new AtomicReference<>();
    private final List<SafetyTransition> history = new CopyOnWriteArrayList<>();

    public SafetySupervisor(
            KillSwitchReader killSwitchReader,
            PanicCloseSweeper panicCloseSweeper,
            AccountStateService accountStateService,
            ExchangeCallExecutor exchangeCallExecutor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            SafetyConfig safetyConfig,
            Clock clock) {
        this.killSwitchReader = killSwitchReader;
        this.panicCloseSweeper = panicCloseSweeper;
        this.accountStateService = accountStateService;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.safetyConfig = safetyConfig;
        this.clock = clock;
        this.state = new AtomicReference<>(SafetySnapshot.initial(clock.instant()));
    }

    // ========================
    // READ
    // ========================

    public SafetySnapshot current() {
        return state.get();
    }

    public boolean isPanic() {
        return state.get().isPanic();
    }

    public List<SafetyTransition> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public BigDecimal getPeakEquity() {
        return peakEquity.get();
    }

    // ========================
    // TRANSITIONS
    // ========================

    public SafetySnapshot enterSafeMode(SafetyTrigger trigger, String reason) {
        return transition(SafetyLevel.SAFE_MODE, trigger, reason);
    }

    /** Moves to PANIC_CLOSE and runs the one-time sweep. */
    public SafetySnapshot enterPanic(SafetyTrigger trigger, String reason) {
        SafetySnapshot snapshot = transition(SafetyLevel.PANIC_CLOSE, trigger, reason);
        PanicSweepResult result = panicCloseSweeper.sweep(reason);
        if (!result.isAlreadyRan() && !result.isSuccess()) {
            log.error("Panic sweep left {} errors; operator attention required", result.getErrors().size());
        }
        return snapshot;
    }

    /** A component observed a condition that blocks new entries. */
    public SafetySnapshot reportFinding(SafetyTrigger trigger, String message) {
        log.warn("Safety finding {}: {}", trigger, message);
        return enterSafeMode(trigger, message);
    }

    /** Operator reset. The only way out of PANIC_CLOSE and out of non-kill-switch SAFE_MODE. */
    public SafetySnapshot clearToNormal(String operator) {
        SafetySnapshot snapshot = transition(SafetyLevel.NORMAL, SafetyTrigger.OPERATOR, "cleared by " + operator);
        AccountSnapshot account = accountStateService.cached();
        peakEquity.set(account != null ? account.getEquity() : null);
        panicCloseSweeper.reset();
        return snapshot;
    }

    private synchronized SafetySnapshot transition(SafetyLevel target, SafetyTrigger trigger, String reason) {
        SafetySnapshot current = state.get();
        SafetyLevel from = current.getLevel();

        // Panic is left only by an operator reset
        if (from == SafetyLevel.PANIC_CLOSE
                && target != SafetyLevel.PANIC_CLOSE
                && !(target == SafetyLevel.NORMAL && trigger == SafetyTrigger.OPERATOR)) {
            return current;
        }
        if (from == target && (target == SafetyLevel.NORMAL || current.getTriggers().contains(trigger))) {
            return current;
        }

        Set<SafetyTrigger> triggers;
        if (target == SafetyLevel.NORMAL) {
            triggers = Set.of();
        } else {
            EnumSet<SafetyTrigger> merged = EnumSet.of(trigger);
            if (from != SafetyLevel.NORMAL) {
                merged.addAll(current.getTriggers());
            }
            triggers = Collections.unmodifiableSet(merged);
        }

        SafetySnapshot next = SafetySnapshot.builder()
                .level(target)
                .triggers(triggers)
                .reason(reason)
                .enteredAt(from == target ? current.getEnteredAt() : clock.instant())
                .version(current.getVersion() + 1)
                .build();
        state.set(next);

        SafetyTransition transition = SafetyTransition.builder()
                .from(from)
                .to(target)
                .trigger(trigger)
                .reason(reason)
                .at(clock.instant())
                .version(next.getVersion())
                .build();
        history.add(transition);
        ledgerService.recordSafetyTransition(transition);
        eventPublisherHelper.publishSafetyChange(this, transition, next);

        if (target == SafetyLevel.PANIC_CLOSE) {
            log.error("SAFETY {} -> PANIC_CLOSE ({}): {}", from, trigger, reason);
        } else if (target == SafetyLevel.SAFE_MODE) {
            log.warn("SAFETY {} -> SAFE_MODE ({}): {}", from, trigger, reason);
        } else {
            log.info("SAFETY {} -> NORMAL ({}): {}", from, trigger, reason);
        }
        return next;
    }

    // ========================
    // EVALUATION
    // ========================

    @Scheduled(fixedDelayString = "${signalguard.safety.evaluation-interval-ms:2000}")
    public void evaluate() {
        applyKillSwitch();
        if (isPanic()) {
            return;
        }
        checkApiErrorBurst();

        AccountSnapshot account = accountStateService.cached();
        if (account == null) {
            return;
        }
        try {
            checkDrawdown(account);
        } catch (FatalSafetyTriggerException e) {
            log.error("Fatal safety trigger {}: {} {}", e.getTrigger(), e.getMessage(), e.getDetails());
            enterSafeMode(e.getTrigger(), e.getMessage());
        }
        checkMarginUsage(account);
    }

    void applyKillSwitch() {
        KillSwitchAction action;
        try {
            action = killSwitchReader.read();
        } catch (RuntimeException e) {
            log.warn("Kill switch read failed: {}", e.getMessage());
            return;
        }

        switch (action) {
            case PANIC_CLOSE -> {
                if (!isPanic()) {
                    enterPanic(SafetyTrigger.KILL_SWITCH, "kill switch PANIC_CLOSE");
                }
            }
            case SAFE_MODE -> enterSafeMode(SafetyTrigger.KILL_SWITCH, "kill switch SAFE_MODE");
            case NONE -> {
                SafetySnapshot current = state.get();
                if (current.getLevel() == SafetyLevel.SAFE_MODE
                        && current.getTriggers().equals(Set.of(SafetyTrigger.KILL_SWITCH))) {
                    transition(SafetyLevel.NORMAL, SafetyTrigger.KILL_SWITCH, "kill switch removed");
                }
            }
        }
    }

    void checkApiErrorBurst() {
        Duration window = Duration.ofSeconds(safetyConfig.getApiErrorWindowSeconds());
        int failures = exchangeCallExecutor.failuresWithin(window);
        if (failures >= safetyConfig.getApiErrorBurst()) {
            enterSafeMode(
                    SafetyTrigger.API_ERROR_BURST,
                    failures + " failed exchange calls within " + window.toSeconds() + "s");
        }
    }

    /**
     * Tracks peak equity and raises when the drawdown from it exceeds the configured limit.
     *
     * @throws FatalSafetyTriggerException on a drawdown breach
     */
    void checkDrawdown(AccountSnapshot account) {
        BigDecimal equity = account.getEquity();
        if (equity == null) {
            return;
        }
        BigDecimal peak = peakEquity.accumulateAndGet(equity, (prev, next) -> prev == null || next.compareTo(prev) > 0 ? next : prev);
        if (peak.signum() <= 0) {
            return;
        }
        BigDecimal drawdown = peak.subtract(equity).divide(peak, 12, RoundingMode.HALF_UP);
        if (drawdown.compareTo(safetyConfig.getMaxAccountDrawdownPct()) > 0) {
            throw new FatalSafetyTriggerException(
                    SafetyTrigger.DRAWDOWN,
                    "drawdown " + drawdown.setScale(4, RoundingMode.HALF_UP) + " exceeds "
                            + safetyConfig.getMaxAccountDrawdownPct(),
                    LedgerService.payload("peakEquity", peak, "equity", equity));
        }
    }

    void checkMarginUsage(AccountSnapshot account) {
        BigDecimal equity = account.getEquity();
        if (equity == null || equity.signum() <= 0 || account.getMarginUsed() == null) {
            return;
        }
        BigDecimal ratio = account.getMarginUsed().max(BigDecimal.ZERO).divide(equity, 12, RoundingMode.HALF_UP);
        if (ratio.compareTo(safetyConfig.getMaxTotalMarginUsedPct()) > 0) {
            enterSafeMode(
                    SafetyTrigger.MARGIN_USAGE,
                    "margin used ratio " + ratio.setScale(4, RoundingMode.HALF_UP) + " above "
                            + safetyConfig.getMaxTotalMarginUsedPct());
        }
    }
}
