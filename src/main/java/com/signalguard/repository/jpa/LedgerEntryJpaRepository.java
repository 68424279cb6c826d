package com.signalguard.repository.jpa;

import com.signalguard.domain.enums.LedgerEntryType;
import com.signalguard.entity.LedgerEntryEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the ledger_entries table. Only inserts and reads; the ledger is append-only.
 */
@Repository
public interface LedgerEntryJpaRepository extends JpaRepository<LedgerEntryEntity, Long> {

    boolean existsBySignalIdAndEntryType(String signalId, LedgerEntryType entryType);

    boolean existsBySourceMessageIdAndSourceVersionAndEntryType(
            String sourceMessageId, Integer sourceVersion, LedgerEntryType entryType);

    boolean existsByPositionIdAndEntryType(String positionId, LedgerEntryType entryType);

    long countBySignalIdAndEntryType(String signalId, LedgerEntryType entryType);

    List<LedgerEntryEntity> findBySignalIdOrderByIdAsc(String signalId);

    List<LedgerEntryEntity> findBySourceMessageIdOrderByIdAsc(String sourceMessageId);

    List<LedgerEntryEntity> findByPositionIdOrderByIdAsc(String positionId);

    List<LedgerEntryEntity> findByEntryTypeOrderByIdAsc(LedgerEntryType entryType);

    @Query("SELECT l FROM LedgerEntryEntity l WHERE l.recordedAt BETWEEN :from AND :to ORDER BY l.id ASC")
    List<LedgerEntryEntity> findByDateRange(@Param("from") Instant from, @Param("to") Instant to);
}
