package com.signalguard.exchange;

import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.model.CapabilityRecord;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.exception.CapabilityUnknownException;
import com.signalguard.safety.SafetySupervisor;
import com.signalguard.service.LedgerService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Tri-state TTL cache of account capabilities.
 *
 * <p>SUPPORTED and UNSUPPORTED answers are cached for the long TTL, UNKNOWN for the short retry
 * TTL. A timed-out or failed probe is always UNKNOWN. An expired record is re-probed before it
 * is returned, so no trigger-mode decision runs on a stale answer.
 *
 * <p>When the startup probe does not return SUPPORTED, the session falls back to local guards
 * until a later probe confirms support.
 */
@Service
public class CapabilityService {

    private static final Logger log = LoggerFactory.getLogger(CapabilityService.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final LedgerService ledgerService;
    private final EventPublisherHelper eventPublisherHelper;
    private final SafetySupervisor safetySupervisor;
    private final ExchangeConfig exchangeConfig;
    private final Clock clock;

    private final Map<CapabilityKind, CapabilityRecord> records = new ConcurrentHashMap<>();
    private volatile boolean sessionFallback;

    public CapabilityService(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            LedgerService ledgerService,
            EventPublisherHelper eventPublisherHelper,
            SafetySupervisor safetySupervisor,
            ExchangeConfig exchangeConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.ledgerService = ledgerService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.safetySupervisor = safetySupervisor;
        this.exchangeConfig = exchangeConfig;
        this.clock = clock;
    }

    // ========================
    // LOOKUP
    // ========================

    /** Cached record, fresh or not; null if never probed. */
    public CapabilityRecord current(CapabilityKind kind) {
        return records.get(kind);
    }

    /** Fresh status, re-probing when the cached record is missing or expired. */
    public CapabilityStatus resolve(CapabilityKind kind) {
        CapabilityRecord record = records.get(kind);
        if (record == null || !record.isFresh(clock.instant())) {
            record = probe(kind);
        }
        return record.getStatus();
    }

    /** True while the startup probe's fallback to local guards is in force. */
    public boolean isSessionFallback() {
        return sessionFallback;
    }

    public Map<CapabilityKind, CapabilityRecord> snapshot() {
        Map<CapabilityKind, CapabilityRecord> copy = new EnumMap<>(CapabilityKind.class);
        copy.putAll(records);
        return copy;
    }

    // ========================
    // PROBING
    // ========================

    /** Probes now and caches the answer. Never throws: an inconclusive probe yields UNKNOWN. */
    public CapabilityRecord probe(CapabilityKind kind) {
        Instant now = clock.instant();
        CapabilityRecord record;
        try {
            CapabilityStatus status = probeOrThrow(kind);
            record = CapabilityRecord.builder()
                    .kind(kind)
                    .status(status)
                    .probedAt(now)
                    .expiresAt(now.plus(Duration.ofSeconds(exchangeConfig.getCapability().getLongTtlSeconds())))
                    .detail("probe answered " + status)
                    .build();
        } catch (CapabilityUnknownException e) {
            log.warn("Capability probe for {} inconclusive: {}", kind, e.getMessage());
            record = CapabilityRecord.builder()
                    .kind(kind)
                    .status(CapabilityStatus.UNKNOWN)
                    .probedAt(now)
                    .expiresAt(now.plus(Duration.ofSeconds(exchangeConfig.getCapability().getUnknownTtlSeconds())))
                    .detail(e.getMessage())
                    .build();
        }

        CapabilityRecord previous = records.put(kind, record);
        if (record.getStatus() == CapabilityStatus.SUPPORTED && sessionFallback) {
            sessionFallback = false;
            log.info("Capability {} confirmed SUPPORTED; session fallback lifted", kind);
        }
        if (previous == null || previous.getStatus() != record.getStatus()) {
            log.info("Capability {} is now {}", kind, record.getStatus());
        }
        return record;
    }

    private CapabilityStatus probeOrThrow(CapabilityKind kind) {
        try {
            CapabilityStatus status =
                    exchangeCallExecutor.probe("probeCapability", () -> exchangeGateway.probeCapability(kind));
            if (status == null || status == CapabilityStatus.UNKNOWN) {
                throw new CapabilityUnknownException(kind, "Probe returned no definite answer", null);
            }
            return status;
        } catch (CapabilityUnknownException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CapabilityUnknownException(kind, "Probe failed: " + e.getMessage(), e);
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (exchangeConfig.getCapability().isProbeOnStartup()) {
            probeAtStartup(CapabilityKind.PLAN_ORDERS);
        }
    }

    /**
     * Startup probe. Anything but SUPPORTED puts the session on local guards and, when configured,
     * enters SAFE_MODE.
     */
    public CapabilityRecord probeAtStartup(CapabilityKind kind) {
        CapabilityRecord record = probe(kind);
        if (record.getStatus() == CapabilityStatus.SUPPORTED) {
            return record;
        }

        sessionFallback = true;
        String message = "Startup probe for " + kind + " returned " + record.getStatus()
                + "; stop-losses fall back to local guards";
        log.warn(message);
        ledgerService.recordFallback(FallbackType.PLAN_ORDER_FALLBACK, null, null, message);
        eventPublisherHelper.publishFallback(
                this,
                FallbackType.PLAN_ORDER_FALLBACK,
                null,
                message,
                Map.of("capability", kind.name(), "status", record.getStatus().name()));

        if (exchangeConfig.getCapability().isSafeModeOnProbeFailure()) {
            safetySupervisor.enterSafeMode(SafetyTrigger.CAPABILITY_PROBE, message);
        }
        return record;
    }

    /** Re-probes expired records so readiness and upgrades see current answers. */
    @Scheduled(fixedDelayString = "${signalguard.exchange.capability.refresh-interval-ms:30000}")
    public void refresh() {
        Instant now = clock.instant();
        for (CapabilityRecord record : records.values()) {
            if (!record.isFresh(now)) {
                probe(record.getKind());
            }
        }
    }
}
