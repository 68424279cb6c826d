package com.signalguard.service;

import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.LedgerEntryType;
import com.signalguard.domain.model.LedgerEntry;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.PositionMismatch;
import com.signalguard.domain.model.RiskDecision;
import com.signalguard.domain.model.SafetyTransition;
import com.signalguard.domain.model.SignalIntent;
import com.signalguard.entity.LedgerEntryEntity;
import com.signalguard.mapper.LedgerEntryMapper;
import com.signalguard.repository.jpa.LedgerEntryJpaRepository;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Append-only durable ledger shared by every component.
 *
 * <p>Writes are synchronous: a decision or order attempt is on disk before the caller acts on it,
 * so the idempotency lookup ({@link #hasDecisionFor(String)}) stays correct across restarts.
 * Entries are never updated or deleted.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private static final int MAX_MESSAGE_LENGTH = 1000;

    private final LedgerEntryJpaRepository ledgerEntryJpaRepository;
    private final LedgerEntryMapper ledgerEntryMapper = Mappers.getMapper(LedgerEntryMapper.class);
    private final Clock clock;

    public LedgerService(LedgerEntryJpaRepository ledgerEntryJpaRepository, Clock clock) {
        this.ledgerEntryJpaRepository = ledgerEntryJpaRepository;
        this.clock = clock;
    }

    // ========================
    // WRITE
    // ========================

    public LedgerEntry record(LedgerEntry entry) {
        if (entry.getRecordedAt() == null) {
            entry.setRecordedAt(clock.instant());
        }
        entry.setId(null);
        if (entry.getMessage() != null && entry.getMessage().length() > MAX_MESSAGE_LENGTH) {
            entry.setMessage(entry.getMessage().substring(0, MAX_MESSAGE_LENGTH));
        }
        LedgerEntryEntity saved = ledgerEntryJpaRepository.save(ledgerEntryMapper.toEntity(entry));
        log.debug("Ledger {} {} {}", entry.getEntryType(), entry.getReasonCode(), entry.getSymbol());
        return ledgerEntryMapper.toDomain(saved);
    }

    public void recordSignalReceived(SignalIntent signal) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.SIGNAL_RECEIVED)
                .signalId(signal.getSignalId())
                .sourceMessageId(signal.getSourceMessageId())
                .sourceVersion(signal.getSourceVersion())
                .symbol(signal.getSymbol())
                .reasonCode(signal.getKind() != null ? signal.getKind().name() : null)
                .payload(payload(
                        "version", signal.getSourceVersion(),
                        "side", signal.getSide(),
                        "entryLow", signal.getEntryLow(),
                        "entryHigh", signal.getEntryHigh(),
                        "entryPoints", signal.getEntryPoints() == null || signal.getEntryPoints().isEmpty() ? null : signal.getEntryPoints(),
                        "stopLoss", signal.getStopLoss(),
                        "leverage", signal.getLeverage(),
                        "quality", signal.getQuality(),
                        "confidence", signal.getConfidence()))
                .build());
    }

    /** The single execution-decision record for a signal. */
    public void recordDecision(SignalIntent signal, String reasonCode, String message, Map<String, Object> payload) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.SIGNAL_DECISION)
                .signalId(signal.getSignalId())
                .sourceMessageId(signal.getSourceMessageId())
                .sourceVersion(signal.getSourceVersion())
                .symbol(signal.getSymbol())
                .reasonCode(reasonCode)
                .message(message)
                .payload(payload)
                .build());
    }

    public void recordRiskDecision(SignalIntent signal, RiskDecision decision) {
        Map<String, Object> payload = decision.getPlan() == null
                ? null
                : payload(
                        "planId", decision.getPlan().getPlanId(),
                        "quantity", decision.getPlan().getQuantity(),
                        "entryPrice", decision.getPlan().getEntryPrice(),
                        "stopLoss", decision.getPlan().getStopLoss().getTriggerPrice(),
                        "leverage", decision.getPlan().getLeverage(),
                        "notional", decision.getPlan().getNotional(),
                        "warnings", decision.getPlan().getWarnings());
        recordDecision(signal, decision.getReasonCode(), decision.getDetail(), payload);
    }

    public void recordManageAction(SignalIntent signal, String reasonCode, String message) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.MANAGE_ACTION)
                .signalId(signal.getSignalId())
                .sourceMessageId(signal.getSourceMessageId())
                .sourceVersion(signal.getSourceVersion())
                .symbol(signal.getSymbol())
                .reasonCode(reasonCode)
                .message(message)
                .build());
    }

    public void recordOrderAttempt(ManagedPosition position, OrderSpec spec) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.ORDER_ATTEMPT)
                .signalId(position.getSignalId())
                .symbol(spec.getSymbol())
                .positionId(position.getPositionId())
                .reasonCode(spec.getPurpose().name())
                .payload(orderPayload(spec))
                .build());
    }

    public void recordOrderResult(ManagedPosition position, OrderSpec spec, String orderId, String reasonCode, String message) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.ORDER_RESULT)
                .signalId(position.getSignalId())
                .symbol(spec.getSymbol())
                .positionId(position.getPositionId())
                .orderId(orderId)
                .reasonCode(reasonCode)
                .message(message)
                .payload(orderPayload(spec))
                .build());
    }

    public void recordFill(ManagedPosition position, String reasonCode, Map<String, Object> payload) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.FILL)
                .signalId(position.getSignalId())
                .symbol(position.getSymbol())
                .positionId(position.getPositionId())
                .orderId(position.getEntryOrderId())
                .reasonCode(reasonCode)
                .payload(payload)
                .build());
    }

    public void recordProtection(ManagedPosition position, String reasonCode, String message) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.PROTECTION)
                .signalId(position.getSignalId())
                .symbol(position.getSymbol())
                .positionId(position.getPositionId())
                .orderId(position.getStopOrderId())
                .reasonCode(reasonCode)
                .message(message)
                .payload(payload(
                        "mode", position.getStopMode(),
                        "stopPrice", position.getStopPrice(),
                        "stopQuantity", position.getStopQuantity(),
                        "localGuard", position.isLocalGuardArmed(),
                        "pending", position.isProtectionPending()))
                .build());
    }

    public void recordFallback(FallbackType type, String symbol, String positionId, String message) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.FALLBACK)
                .symbol(symbol)
                .positionId(positionId)
                .reasonCode(type.name())
                .message(message)
                .build());
    }

    public void recordReconciliation(PositionMismatch mismatch) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.RECONCILIATION)
                .symbol(mismatch.getSymbol())
                .positionId(mismatch.getPositionId())
                .reasonCode(mismatch.getType().name())
                .message(mismatch.getDetail())
                .payload(payload(
                        "resolution", mismatch.getResolution(),
                        "resolved", mismatch.isResolved(),
                        "localQuantity", mismatch.getLocalQuantity(),
                        "exchangeQuantity", mismatch.getExchangeQuantity()))
                .build());
    }

    public void recordSafetyTransition(SafetyTransition transition) {
        record(LedgerEntry.builder()
                .entryType(LedgerEntryType.SAFETY_TRANSITION)
                .reasonCode(transition.getTrigger().name())
                .message(transition.getReason())
                .payload(payload(
                        "from", transition.getFrom(),
                        "to", transition.getTo(),
                        "version", transition.getVersion()))
                .recordedAt(transition.getAt())
                .build());
    }

    // ========================
    // READ
    // ========================

    /** True once the signal has produced its execution-decision record. */
    public boolean hasDecisionFor(String signalId) {
        return ledgerEntryJpaRepository.existsBySignalIdAndEntryType(signalId, LedgerEntryType.SIGNAL_DECISION);
    }

    /** True when this edit version of the source message already produced a decision. */
    public boolean hasDecisionForSourceMessage(String sourceMessageId, int sourceVersion) {
        return sourceMessageId != null
                && ledgerEntryJpaRepository.existsBySourceMessageIdAndSourceVersionAndEntryType(
                        sourceMessageId, sourceVersion, LedgerEntryType.SIGNAL_DECISION);
    }

    public boolean hasProtectionRecord(String positionId) {
        return ledgerEntryJpaRepository.existsByPositionIdAndEntryType(positionId, LedgerEntryType.PROTECTION);
    }

    public List<LedgerEntry> findBySignalId(String signalId) {
        return ledgerEntryMapper.toDomainList(ledgerEntryJpaRepository.findBySignalIdOrderByIdAsc(signalId));
    }

    public List<LedgerEntry> findBySourceMessageId(String sourceMessageId) {
        return ledgerEntryMapper.toDomainList(
                ledgerEntryJpaRepository.findBySourceMessageIdOrderByIdAsc(sourceMessageId));
    }

    public List<LedgerEntry> findByPositionId(String positionId) {
        return ledgerEntryMapper.toDomainList(ledgerEntryJpaRepository.findByPositionIdOrderByIdAsc(positionId));
    }

    public List<LedgerEntry> findSafetyTransitions() {
        return ledgerEntryMapper.toDomainList(
                ledgerEntryJpaRepository.findByEntryTypeOrderByIdAsc(LedgerEntryType.SAFETY_TRANSITION));
    }

    // ========================
    // HELPERS
    // ========================

    private Map<String, Object> orderPayload(OrderSpec spec) {
        return payload(
                "clientOrderId", spec.getClientOrderId(),
                "side", spec.getSide(),
                "kind", spec.getKind(),
                "quantity", spec.getQuantity(),
                "price", spec.getPrice(),
                "triggerPrice", spec.getTriggerPrice(),
                "reduceOnly", spec.isReduceOnly(),
                "tradeSide", spec.getTradeSide(),
                "holdSide", spec.getHoldSide());
    }

    /** Builds an ordered payload map from key/value pairs, skipping null values. */
    public static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value != null) {
                map.put(String.valueOf(keyValues[i]), value instanceof Enum<?> e ? e.name() : value);
            }
        }
        return map;
    }
}
