package com.signalguard.domain.model;

import com.signalguard.domain.enums.LedgerEntryType;
import java.time.Instant;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Append-only audit record. Written once and never updated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntry {

    private Long id;
    private LedgerEntryType entryType;
    private String signalId;
    private String sourceMessageId;

    /** Edit version of the source message; null for entries not tied to a signal. */
    private Integer sourceVersion;
    private String symbol;
    private String positionId;
    private String orderId;

    /** Stable machine-parseable code (reject reason, fallback type, mismatch type, action). */
    private String reasonCode;

    private String message;
    private Map<String, Object> payload;
    private Instant recordedAt;
}
