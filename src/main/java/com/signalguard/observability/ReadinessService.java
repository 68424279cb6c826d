package com.signalguard.observability;

import com.signalguard.domain.enums.SafetyLevel;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.ReadinessSnapshot;
import com.signalguard.domain.model.SafetySnapshot;
import com.signalguard.exchange.CapabilityService;
import com.signalguard.exchange.PriceFeedService;
import com.signalguard.oms.LifecycleConfig;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.safety.SafetySupervisor;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Read-only readiness view for a health reporting layer.
 *
 * <p>Ready means NORMAL safety with no degradation. Degradations:
 * <ul>
 *   <li>a local guard runs on a polled feed while streaming is required for local guards</li>
 *   <li>the price of a guarded symbol is stale</li>
 *   <li>the session fell back to local guards after a failed capability probe</li>
 * </ul>
 */
@Service
public class ReadinessService {

    private final SafetySupervisor safetySupervisor;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final CapabilityService capabilityService;
    private final PriceFeedService priceFeedService;
    private final LifecycleConfig lifecycleConfig;

    public ReadinessService(
            SafetySupervisor safetySupervisor,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            CapabilityService capabilityService,
            PriceFeedService priceFeedService,
            LifecycleConfig lifecycleConfig) {
        this.safetySupervisor = safetySupervisor;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.capabilityService = capabilityService;
        this.priceFeedService = priceFeedService;
        this.lifecycleConfig = lifecycleConfig;
    }

    public ReadinessSnapshot snapshot() {
        SafetySnapshot safety = safetySupervisor.current();
        List<ManagedPosition> open = managedPositionRedisRepository.findOpen();
        List<String> degradations = new ArrayList<>();

        int localGuards = 0;
        for (ManagedPosition position : open) {
            if (!position.isLocalGuardArmed()) {
                continue;
            }
            localGuards++;
            String symbol = position.getSymbol();
            if (lifecycleConfig.isRequireStreamingForLocalGuard() && priceFeedService.isPolling(symbol)) {
                degradations.add("local guard on " + symbol + " runs on a polled price feed");
            }
            if (priceFeedService.isStale(symbol)) {
                degradations.add("price for guarded symbol " + symbol + " is stale");
            }
        }
        if (capabilityService.isSessionFallback()) {
            degradations.add("plan orders unavailable for this session; stops run as local guards");
        }

        return ReadinessSnapshot.builder()
                .ready(safety.getLevel() == SafetyLevel.NORMAL && degradations.isEmpty())
                .safety(safety)
                .openPositionCount(open.size())
                .capabilities(capabilityService.snapshot())
                .prices(priceFeedService.snapshot())
                .localGuardCount(localGuards)
                .degradations(List.copyOf(degradations))
                .build();
    }
}
