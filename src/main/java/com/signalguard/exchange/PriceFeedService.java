package com.signalguard.exchange;

import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.enums.FallbackType;
import com.signalguard.domain.enums.PriceSource;
import com.signalguard.domain.model.ManagedPosition;
import com.signalguard.domain.model.PriceTick;
import com.signalguard.event.EventPublisherHelper;
import com.signalguard.repository.redis.ManagedPositionRedisRepository;
import com.signalguard.risk.RiskPolicyConfig;
import com.signalguard.service.LedgerService;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Latest price per symbol for the local guard, break-even checks and slippage checks.
 *
 * <p>Each tick says whether it came from a stream or a poll. The first time a symbol drops from
 * STREAM to POLL a {@code PRICE_FEED_FALLBACK} is published and ledgered; the readiness snapshot
 * reports guards that run on a polled feed.
 */
@Service
public class PriceFeedService {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedService.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;
    private final ManagedPositionRedisRepository managedPositionRedisRepository;
    private final EventPublisherHelper eventPublisherHelper;
    private final LedgerService ledgerService;
    private final ExchangeConfig exchangeConfig;
    private final Clock clock;

    private final Map<String, PriceTick> ticks = new ConcurrentHashMap<>();

    public PriceFeedService(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            ManagedPositionRedisRepository managedPositionRedisRepository,
            EventPublisherHelper eventPublisherHelper,
            LedgerService ledgerService,
            ExchangeConfig exchangeConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        this.managedPositionRedisRepository = managedPositionRedisRepository;
        this.eventPublisherHelper = eventPublisherHelper;
        this.ledgerService = ledgerService;
        this.exchangeConfig = exchangeConfig;
        this.clock = clock;
    }

    /** Refreshes prices for every symbol with an open managed position. */
    @Scheduled(fixedDelayString = "${signalguard.exchange.price-feed.refresh-interval-ms:1000}")
    public void refreshWatched() {
        Set<String> symbols = managedPositionRedisRepository.findOpen().stream()
                .map(ManagedPosition::getSymbol)
                .collect(Collectors.toSet());
        for (String symbol : symbols) {
            try {
                refresh(symbol);
            } catch (RuntimeException e) {
                log.warn("Price refresh failed for {}: {}", symbol, e.getMessage());
            }
        }
    }

    /** Fetches a fresh tick through the call gate and records any stream-to-poll drop. */
    public PriceTick refresh(String symbol) {
        PriceTick tick = exchangeCallExecutor.call("streamOrPollPrice", () -> exchangeGateway.streamOrPollPrice(symbol));
        PriceTick previous = ticks.put(key(symbol), tick);

        boolean wasStreaming = previous == null || previous.getSource() == PriceSource.STREAM;
        if (tick.getSource() == PriceSource.POLL && wasStreaming) {
            String message = "Price feed for " + symbol + " fell back to polling";
            log.warn(message);
            ledgerService.recordFallback(FallbackType.PRICE_FEED_FALLBACK, symbol, null, message);
            eventPublisherHelper.publishFallback(
                    this, FallbackType.PRICE_FEED_FALLBACK, symbol, message, Map.of("source", PriceSource.POLL.name()));
        } else if (tick.getSource() == PriceSource.STREAM && previous != null && previous.getSource() == PriceSource.POLL) {
            log.info("Price feed for {} back on stream", symbol);
        }
        return tick;
    }

    /** Cached tick if present and fresh, otherwise a new fetch. */
    public PriceTick current(String symbol) {
        PriceTick tick = ticks.get(key(symbol));
        if (tick == null || isStale(tick)) {
            return refresh(symbol);
        }
        return tick;
    }

    public Optional<PriceTick> latest(String symbol) {
        return Optional.ofNullable(ticks.get(key(symbol)));
    }

    /** Copy of every cached tick keyed by normalized symbol. */
    public Map<String, PriceTick> snapshot() {
        return Map.copyOf(ticks);
    }

    public boolean isStale(String symbol) {
        PriceTick tick = ticks.get(key(symbol));
        return tick == null || isStale(tick);
    }

    public boolean isPolling(String symbol) {
        PriceTick tick = ticks.get(key(symbol));
        return tick != null && tick.getSource() == PriceSource.POLL;
    }

    private boolean isStale(PriceTick tick) {
        Duration age = Duration.between(tick.getAt(), clock.instant());
        return age.getSeconds() >= exchangeConfig.getPriceFeed().getStaleAfterSeconds();
    }

    private static String key(String symbol) {
        return RiskPolicyConfig.normalize(symbol);
    }
}
