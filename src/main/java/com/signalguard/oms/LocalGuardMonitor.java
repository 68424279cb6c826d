package com.signalguard.oms;

import com.signalguard.domain.enums.Side;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PriceTick;
import com.signalguard.exchange.PriceFeedService;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Synthetic stop-loss for positions without a native trigger order.
 *
 * <p>Armed watches are the positions flagged {@code localGuardArmed}. Each pass reads the latest
 * price and, when it crosses the guard (at or below for a long, at or above for a short),
 * market-closes the position through {@link ProtectiveCloser}.
 */
@Component
public class LocalGuardMonitor {

    private static final Logger log = LoggerFactory.getLogger(LocalGuardMonitor.class);

    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final PriceFeedService priceFeedService;
    private final ProtectiveCloser protectiveCloser;

    public LocalGuardMonitor(
            ManagedPositionRedisRepository managedPositionRedisRepository,
            PriceFeedService priceFeedService,
            ProtectiveCloser protectiveCloser) {
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.priceFeedService = priceFeedService;
        this.protectiveCloser = protectiveCloser;
    }

    @Scheduled(fixedDelayString = "${signalguard.lifecycle.local-guard-interval-ms:1000}")
    public void check() {
        for (ManagedPosition position : armedPositions()) {
            try {
                checkPosition(position);
            } catch (RuntimeException e) {
                log.error("Local guard check failed for {}: {}", position.getSymbol(), e.getMessage(), e);
            }
        }
    }

    /**
     * Checks one guarded position against the latest price.
     *
     * @return true when the guard fired and the position was closed
     */
    public boolean checkPosition(ManagedPosition position) {
        if (!position.isLocalGuardArmed() || position.getStopPrice() == null) {
            return false;
        }
        PriceTick tick = priceFeedService.current(position.getSymbol());
        if (!isCrossed(position.getSide(), tick.getPrice(), position.getStopPrice())) {
            return false;
        }

        String reason = "local guard crossed: price " + tick.getPrice() + " vs stop " + position.getStopPrice()
                + " (" + tick.getSource() + ")";
        log.warn("{} {} {}", position.getSide(), position.getSymbol(), reason);
        return protectiveCloser.closePosition(position, reason, true);
    }

    public List<ManagedPosition> armedPositions() {
        return managedPositionRedisRepository.findOpen().stream()
                .filter(ManagedPosition::isLocalGuardArmed)
                .toList();
    }

    static boolean isCrossed(Side side, BigDecimal price, BigDecimal stop) {
        return side == Side.LONG ? price.compareTo(stop) <= 0 : price.compareTo(stop) >= 0;
    }
}
