package com.signalguard.entity;

import com.signalguard.domain.enums.LedgerEntryType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ledger_entries table.
 * Append-only audit trail of signals, decisions, order attempts, fills, protection changes,
 * reconciliation actions and safety transitions. Rows are inserted and never updated.
 * The signal_id index backs the idempotency lookup done before every risk evaluation.
 */
@Entity
@Table(
        name = "ledger_entries",
        indexes = {
            @Index(name = "idx_ledger_signal", columnList = "signal_id"),
            @Index(name = "idx_ledger_source_message", columnList = "source_message_id, source_version"),
            @Index(name = "idx_ledger_position", columnList = "position_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LedgerEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", length = 30, nullable = false)
    private LedgerEntryType entryType;

    @Column(name = "signal_id", length = 64)
    private String signalId;

    @Column(name = "source_message_id", length = 128)
    private String sourceMessageId;

    @Column(name = "source_version")
    private Integer sourceVersion;

    @Column(length = 32)
    private String symbol;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "reason_code", length = 50)
    private String reasonCode;

    @Column(length = 1000)
    private String message;

    @Column(name = "payload_json", length = 4000)
    private String payload;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;
}
