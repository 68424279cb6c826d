package com.signalguard.oms;

import com.signalguard.domain.enums.IntakeStatus;
import com.signalguard.domain.enums.LifecycleState;
import com.signalguard.domain.enums.RejectReason;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.IntakeResult;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.MarketSnapshot;
import com.signalguard.domain.model.ProtectionResult;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.domain.model.SignalIntent;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exception.SignalValidationException;
import com.signalguard.exchange.AccountStateService;
import com.signalguard.exchange.PriceFeedService;
import com.signalguard.exchange.SymbolRulesService;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.risk.RiskSizingEngine;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Core entry point for normalized signals.
 *
 * <p>Flow per signal:
 * <ol>
 *   <li>Idempotency: a signal id that already has a decision record is a no-op</li>
 *   <li>Shape validation ({@link SignalIntentValidator})</li>
 *   <li>Edited source messages are recorded as EDIT_IGNORED unless configured otherwise</li>
 *   <li>Entries: risk evaluation, then open or hold for confirmation</li>
 *   <li>Manage actions: reduce, break-even move, take-profit update</li>
 * </ol>
 *
 * <p>Every path ends in exactly one SIGNAL_DECISION ledger record.
 */
@Service
public class SignalIntakeService {

    private static final Logger log = LoggerFactory.getLogger(SignalIntakeService.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final SignalIntentValidator signalIntentValidator;
    private final LedgerService ledgerService;
    private final RiskSizingEngine riskSizingEngine;
    private final AccountStateService accountStateService;
    private final SymbolRulesService symbolRulesService;
    private final PriceFeedService priceFeedService;
    private final SafetySupervisor safetySupervisor;
    private final OrderLifecycleManager orderLifecycleManager;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final RiskPolicyConfig riskPolicyConfig;
    private final LifecycleConfig lifecycleConfig;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public SignalIntakeService(
            SignalIntentValidator signalIntentValidator,
            LedgerService ledgerService,
            RiskSizingEngine riskSizingEngine,
            AccountStateService accountStateService,
            SymbolRulesService symbolRulesService,
            PriceFeedService priceFeedService,
            SafetySupervisor safetySupervisor,
            OrderLifecycleManager orderLifecycleManager,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            EventPublisherHelper eventPublisherHelper,
            RiskPolicyConfig riskPolicyConfig,
            LifecycleConfig lifecycleConfig) {
        this.signalIntentValidator = signalIntentValidator;
        this.ledgerService = ledgerService;
        this.riskSizingEngine = riskSizingEngine;
        this.accountStateService = accountStateService;
        this.symbolRulesService = symbolRulesService;
        this.priceFeedService = priceFeedService;
        this.safetySupervisor = safetySupervisor;
        this.orderLifecycleManager = orderLifecycleManager;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.riskPolicyConfig = riskPolicyConfig;
        this.lifecycleConfig = lifecycleConfig;
    }

    public IntakeResult submit(SignalIntent signal) {
        String signalId = signal != null ? signal.getSignalId() : null;
        if (signalId == null || signalId.isBlank()) {
            log.warn("Signal without id dropped");
            return result(IntakeStatus.INVALID, signalId, null, null, "signalId is required");
        }
        if (!inFlight.add(signalId)) {
            return result(IntakeStatus.DUPLICATE, signalId, null, null, "signal already being processed");
        }
        String versionKey = sourceVersionKey(signal);
        if (versionKey != null && !inFlight.add(versionKey)) {
            inFlight.remove(signalId);
            return result(IntakeStatus.DUPLICATE, signalId, null, null, "source message version already being processed");
        }
        try {
            return process(signal);
        } finally {
            inFlight.remove(signalId);
            if (versionKey != null) {
                inFlight.remove(versionKey);
            }
        }
    }

    /** One decision per source message version, whatever signal id the parser assigned. */
    private static String sourceVersionKey(SignalIntent signal) {
        return signal.getSourceMessageId() == null
                ? null
                : "msg:" + signal.getSourceMessageId() + ":v" + signal.getSourceVersion();
    }

    private IntakeResult process(SignalIntent signal) {
        String signalId = signal.getSignalId();
        if (ledgerService.hasDecisionFor(signalId)) {
            log.debug("Duplicate signal {} ignored", signalId);
            return result(IntakeStatus.DUPLICATE, signalId, null, null, "decision already recorded");
        }
        if (ledgerService.hasDecisionForSourceMessage(signal.getSourceMessageId(), signal.getSourceVersion())) {
            log.info(
                    "Signal {} ignored: source message {} v{} already decided",
                    signalId,
                    signal.getSourceMessageId(),
                    signal.getSourceVersion());
            return result(IntakeStatus.DUPLICATE, signalId, null, null, "source message version already decided");
        }

        try {
            signalIntentValidator.validate(signal);
        } catch (SignalValidationException e) {
            log.warn("Signal {} invalid: {}", signalId, e.getMessage());
            ledgerService.recordDecision(signal, RejectReason.INVALID_SIGNAL.name(), e.getMessage(), null);
            return result(IntakeStatus.INVALID, signalId, null, null, e.getMessage());
        }

        ledgerService.recordSignalReceived(signal);

        if (signal.getSourceVersion() > 1 && !lifecycleConfig.isExecuteEditedSignals()) {
            String message = "edited source message " + signal.getSourceMessageId() + " v" + signal.getSourceVersion();
            ledgerService.recordDecision(signal, IntakeStatus.EDIT_IGNORED.name(), message, null);
            log.info("Signal {} ignored: {}", signalId, message);
            return result(IntakeStatus.EDIT_IGNORED, signalId, null, null, message);
        }

        return switch (signal.getKind()) {
            case ENTRY_SIGNAL -> handleEntry(signal);
            case MANAGE_ACTION -> handleManage(signal);
            case NON_SIGNAL -> {
                ledgerService.recordDecision(signal, IntakeStatus.RECORDED.name(), "non-signal message", null);
                yield result(IntakeStatus.RECORDED, signalId, null, null, "nothing executable");
            }
        };
    }

    // ========================
    // ENTRY
    // ========================

    private IntakeResult handleEntry(SignalIntent signal) {
        SafetySnapshot safety = safetySupervisor.current();
        RiskDecision decision;
        if (!safety.allowsNewEntries()) {
            decision = RiskDecision.rejected(RejectReason.SAFETY_GATE, "safety level is " + safety.getLevel());
        } else {
            try {
                AccountSnapshot account = accountStateService.latest()
                        .withOpenPositionCount(managedPositionRedisRepository.findOpen().size());
                MarketSnapshot market = MarketSnapshot.builder()
                        .symbol(signal.getSymbol())
                        .currentPrice(priceFeedService.current(signal.getSymbol()).getPrice())
                        .rules(symbolRulesService.get(signal.getSymbol()))
                        .build();
                decision = riskSizingEngine.evaluate(signal, account, market, safety, riskPolicyConfig);
            } catch (RuntimeException e) {
                log.warn("Market data for {} unavailable: {}", signal.getSymbol(), e.getMessage());
                decision = RiskDecision.rejected(RejectReason.INVALID_MARKET_PRICE, "market data unavailable: " + e.getMessage());
            }
        }

        ledgerService.recordRiskDecision(signal, decision);
        eventPublisherHelper.publishDecision(this, signal, decision);

        switch (decision.getOutcome()) {
            case REJECTED -> {
                log.warn("Signal {} {} {} rejected: {} {}", signal.getSignalId(), signal.getSide(), signal.getSymbol(),
                        decision.getReason(), decision.getDetail());
                return result(IntakeStatus.REJECTED, signal.getSignalId(), decision, null, decision.getDetail());
            }
            case PENDING_CONFIRMATION -> {
                ManagedPosition pending = orderLifecycleManager.recordPending(decision.getPlan());
                log.info("Signal {} held for confirmation: {}", signal.getSignalId(), decision.getDetail());
                return result(IntakeStatus.PENDING_CONFIRMATION, signal.getSignalId(), decision, pending.getPositionId(), decision.getDetail());
            }
            default -> {
                ManagedPosition position = orderLifecycleManager.open(decision.getPlan());
                if (position.getState() == LifecycleState.REJECTED) {
                    return result(IntakeStatus.REJECTED, signal.getSignalId(), decision, position.getPositionId(), position.getCloseReason());
                }
                return result(IntakeStatus.OPENED, signal.getSignalId(), decision, position.getPositionId(), "state " + position.getState());
            }
        }
    }

    // ========================
    // MANAGE
    // ========================

    /** Manage actions reduce risk and are allowed in SAFE_MODE, but not during a panic sweep. */
    private IntakeResult handleManage(SignalIntent signal) {
        String symbol = RiskPolicyConfig.normalize(signal.getSymbol());
        if (safetySupervisor.isPanic()) {
            String message = "panic close in progress";
            ledgerService.recordDecision(signal, RejectReason.SAFETY_GATE.name(), message, null);
            return result(IntakeStatus.REJECTED, signal.getSignalId(), null, null, message);
        }

        List<String> applied = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        String positionId = orderLifecycleManager.findActive(symbol).map(ManagedPosition::getPositionId).orElse(null);

        if (signal.isMoveStopToBreakEven()) {
            runAction(signal, "BREAK_EVEN", applied, failed, () -> {
                ProtectionResult result = orderLifecycleManager.moveStopToBreakEven(symbol);
                return result.getOutcome() + (result.getMessage() != null ? " " + result.getMessage() : "");
            });
        }
        if (signal.getTakeProfitPrice() != null) {
            runAction(signal, "TAKE_PROFIT_UPDATE", applied, failed, () -> {
                orderLifecycleManager.updateTakeProfit(symbol, signal.getTakeProfitPrice());
                return "take-profit set to " + signal.getTakeProfitPrice();
            });
        }
        if (signal.getReducePct() != null) {
            BigDecimal fraction = signal.getReducePct().divide(HUNDRED, 8, RoundingMode.HALF_UP);
            runAction(signal, "REDUCE", applied, failed, () -> {
                ManagedPosition position = orderLifecycleManager.reduce(symbol, fraction);
                return "reduced to " + position.getFilledQuantity() + " (" + position.getState() + ")";
            });
        }

        String message = "applied=" + applied + " failed=" + failed;
        IntakeStatus status = applied.isEmpty() ? IntakeStatus.REJECTED : IntakeStatus.MANAGED;
        ledgerService.recordDecision(signal, status.name(), message, null);
        return result(status, signal.getSignalId(), null, positionId, message);
    }

    private interface ManageAction {
        String apply();
    }

    private void runAction(SignalIntent signal, String code, List<String> applied, List<String> failed, ManageAction action) {
        try {
            String outcome = action.apply();
            ledgerService.recordManageAction(signal, code, outcome);
            applied.add(code);
            log.info("Manage {} on {}: {}", code, signal.getSymbol(), outcome);
        } catch (RuntimeException e) {
            ledgerService.recordManageAction(signal, code + "_FAILED", e.getMessage());
            failed.add(code);
            log.warn("Manage {} on {} failed: {}", code, signal.getSymbol(), e.getMessage());
        }
    }

    private static IntakeResult result(
            IntakeStatus status, String signalId, RiskDecision decision, String positionId, String detail) {
        return IntakeResult.builder()
                .status(status)
                .signalId(signalId)
                .decision(decision)
                .positionId(positionId)
                .detail(detail)
                .build();
    }
}
