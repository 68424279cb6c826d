package com.signalguard.unit.exchange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.SafetyTrigger;
import com.signalguard.domain.model.CapabilityRecord;
import com.signalguard.exchange.CapabilityService;
import com.signalguard.unit.support.PaperHarness;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for CapabilityService probing, TTL caching and the startup fallback. */
class CapabilityServiceTest {

    private static final CapabilityKind PLAN = CapabilityKind.PLAN_ORDERS;

    private PaperHarness harness;
    private CapabilityService capabilityService;

    @BeforeEach
    void setUp() {
        harness = new PaperHarness();
        capabilityService = harness.capabilityService;
    }

    // ========================
    // PROBE AND CACHE
    // ========================

    @Nested
    @DisplayName("Probe and cache")
    class ProbeAndCache {

        @Test
        @DisplayName("Definite answer is cached for the long TTL")
        void definiteAnswer() {
            CapabilityRecord record = capabilityService.probe(PLAN);

            assertThat(record.getStatus()).isEqualTo(CapabilityStatus.SUPPORTED);
            assertThat(record.getExpiresAt()).isEqualTo(PaperHarness.START.plusSeconds(
                    harness.exchangeConfig.getCapability().getLongTtlSeconds()));
            assertThat(capabilityService.current(PLAN)).isSameAs(record);
        }

        @Test
        @DisplayName("Failed probe yields UNKNOWN with the short TTL instead of throwing")
        void inconclusive() {
            harness.paper.failNextCalls(1);

            CapabilityRecord record = capabilityService.probe(PLAN);

            assertThat(record.getStatus()).isEqualTo(CapabilityStatus.UNKNOWN);
            assertThat(record.getExpiresAt()).isEqualTo(PaperHarness.START.plusSeconds(
                    harness.exchangeConfig.getCapability().getUnknownTtlSeconds()));
            assertThat(record.getDetail()).startsWith("Probe failed");
        }

        @Test
        @DisplayName("Resolve uses the cache until it expires")
        void resolveHonoursTtl() {
            capabilityService.resolve(PLAN);
            harness.paper.setPlanOrdersSupported(false);

            assertThat(capabilityService.resolve(PLAN)).isEqualTo(CapabilityStatus.SUPPORTED);

            harness.clock.advance(Duration.ofSeconds(harness.exchangeConfig.getCapability().getLongTtlSeconds()));
            assertThat(capabilityService.resolve(PLAN)).isEqualTo(CapabilityStatus.UNSUPPORTED);
        }

        @Test
        @DisplayName("Refresh re-probes only expired records")
        void refresh() {
            harness.paper.failNextCalls(1);
            capabilityService.probe(PLAN);

            capabilityService.refresh();
            assertThat(capabilityService.current(PLAN).getStatus()).isEqualTo(CapabilityStatus.UNKNOWN);

            harness.clock.advance(Duration.ofSeconds(harness.exchangeConfig.getCapability().getUnknownTtlSeconds()));
            capabilityService.refresh();
            assertThat(capabilityService.current(PLAN).getStatus()).isEqualTo(CapabilityStatus.SUPPORTED);
        }
    }

    // ========================
    // STARTUP
    // ========================

    @Nested
    @DisplayName("Startup probe")
    class Startup {

        @Test
        @DisplayName("SUPPORTED leaves the session on native stops")
        void supported() {
            capabilityService.probeAtStartup(PLAN);

            assertThat(capabilityService.isSessionFallback()).isFalse();
            verify(harness.ledgerService, never()).recordFallback(any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("UNSUPPORTED falls back to local guards and is ledgered")
        void unsupported() {
            harness.paper.setPlanOrdersSupported(false);

            capabilityService.probeAtStartup(PLAN);

            assertThat(capabilityService.isSessionFallback()).isTrue();
            verify(harness.ledgerService).recordFallback(eq(FallbackType.PLAN_ORDER_FALLBACK), isNull(), isNull(), anyString());
            verify(harness.eventPublisherHelper).publishFallback(
                    eq(capabilityService), eq(FallbackType.PLAN_ORDER_FALLBACK), isNull(), anyString(), anyMap());
            verify(harness.safetySupervisor, never()).enterSafeMode(any(), anyString());
        }

        @Test
        @DisplayName("Configured probe failure enters SAFE_MODE")
        void safeModeOnFailure() {
            harness.exchangeConfig.getCapability().setSafeModeOnProbeFailure(true);
            harness.paper.failNextCalls(1);

            capabilityService.probeAtStartup(PLAN);

            verify(harness.safetySupervisor).enterSafeMode(eq(SafetyTrigger.CAPABILITY_PROBE), anyString());
        }

        @Test
        @DisplayName("Later SUPPORTED probe lifts the session fallback")
        void fallbackLifted() {
            harness.paper.setPlanOrdersSupported(false);
            capabilityService.probeAtStartup(PLAN);
            harness.paper.setPlanOrdersSupported(true);

            capabilityService.probe(PLAN);

            assertThat(capabilityService.isSessionFallback()).isFalse();
        }
    }
}
