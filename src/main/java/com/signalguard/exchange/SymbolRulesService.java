package com.signalguard.exchange;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.signalguard.config.ExchangeConfig;
import com.signalguard.domain.model.SymbolRules;
import com.signalguard.risk.RiskPolicyConfig;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Caches exchange precision rules per symbol. Rules rarely change, so a long TTL keeps them off
 * the rate-limited path.
 */
@Service
public class SymbolRulesService {

    private static final Logger log = LoggerFactory.getLogger(SymbolRulesService.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;

    /** Caffeine cache: key = normalized symbol, expires after the configured rules TTL. */
    private final Cache<String, SymbolRules> rulesCache;

    public SymbolRulesService(
            ExchangeGateway exchangeGateway,
            ExchangeCallExecutor exchangeCallExecutor,
            ExchangeConfig exchangeConfig,
            Clock clock) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
        // Ticker reads the injected clock
        this.rulesCache = Caffeine.newBuilder()
                .expireAfterWrite(exchangeConfig.getSymbolRulesTtlSeconds(), TimeUnit.SECONDS)
                .maximumSize(500)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public SymbolRules get(String symbol) {
        String key = RiskPolicyConfig.normalize(symbol);
        SymbolRules cached = rulesCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        SymbolRules rules = exchangeCallExecutor.call("getSymbolRules", () -> exchangeGateway.getSymbolRules(symbol));
        rulesCache.put(key, rules);
        log.debug("Symbol rules loaded for {}: qtyStep={} minQty={}", key, rules.getQtyStep(), rules.getMinQty());
        return rules;
    }

    public void invalidate(String symbol) {
        rulesCache.invalidate(RiskPolicyConfig.normalize(symbol));
    }
}
