package com.signalguard.domain.model;

import com.signalguard.domain.enums.EntryType;
import com.signalguard.domain.enums.Side;
import com.signalguard.domain.enums.SignalKind;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Normalized trade signal delivered by the ingestion collaborator. Immutable once received.
 *
 * <p>A closed tagged variant keyed by {@link SignalKind}. Required fields per variant are
 * checked once at the boundary by {@code SignalIntentValidator}:
 * <ul>
 *   <li>ENTRY_SIGNAL: symbol, side, entryType, entryLow/entryHigh</li>
 *   <li>MANAGE_ACTION: symbol plus at least one of reducePct, moveStopToBreakEven, takeProfitPrice</li>
 *   <li>NON_SIGNAL: nothing executable</li>
 * </ul>
 *
 * <p>One intent exists per source-message version. {@code sourceVersion} starts at 1 and is
 * incremented when the source message is edited.
 */
@Value
@Builder(toBuilder = true)
public class SignalIntent {

    String signalId;
    String sourceMessageId;

    @Builder.Default
    int sourceVersion = 1;

    SignalKind kind;

    String symbol;
    Side side;
    EntryType entryType;
    BigDecimal entryLow;
    BigDecimal entryHigh;

    /**
     * Explicit entry prices in placement order, first one nearest the market. Empty when the
     * signal only gives a range.
     */
    @Builder.Default
    List<BigDecimal> entryPoints = List.of();

    /** Optional; derived from the default stop distance when absent. */
    BigDecimal stopLoss;

    @Builder.Default
    List<BigDecimal> takeProfits = List.of();

    /** Optional requested leverage. */
    Integer leverage;

    /** Rule/parser quality score in [0, 1]. */
    @Builder.Default
    double quality = 1.0;

    /** Extraction confidence in [0, 1]; low values may require confirmation. */
    @Builder.Default
    double confidence = 1.0;

    Instant receivedAt;

    // Manage-action fields
    BigDecimal reducePct;
    boolean moveStopToBreakEven;
    BigDecimal takeProfitPrice;

    String rawText;

    public boolean isEntry() {
        return kind == SignalKind.ENTRY_SIGNAL;
    }

    public boolean isManage() {
        return kind == SignalKind.MANAGE_ACTION;
    }
}
