package com.signalguard.exchange;

import com.signalguard.domain.model.AccountSnapshot;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Polls the account balance on its own schedule and keeps the latest snapshot for the risk
 * gate and the safety breakers.
 */
@Service
public class AccountStateService {

    private static final Logger log = LoggerFactory.getLogger(AccountStateService.class);

    private final ExchangeGateway exchangeGateway;
    private final ExchangeCallExecutor exchangeCallExecutor;

    private final AtomicReference<AccountSnapshot> latest = new AtomicReference<>();

    public AccountStateService(ExchangeGateway exchangeGateway, ExchangeCallExecutor exchangeCallExecutor) {
        this.exchangeGateway = exchangeGateway;
        this.exchangeCallExecutor = exchangeCallExecutor;
    }

    @Scheduled(fixedDelayString = "${signalguard.exchange.account-poll-interval-ms:5000}")
    public void poll() {
        try {
            refresh();
        } catch (RuntimeException e) {
            log.warn("Account poll failed: {}", e.getMessage());
        }
    }

    /** Fetches a fresh balance and caches it. */
    public AccountSnapshot refresh() {
        AccountSnapshot snapshot = exchangeCallExecutor.call("getBalance", exchangeGateway::getBalance);
        latest.set(snapshot);
        return snapshot;
    }

    /** Latest polled snapshot, fetching one if none has been polled yet. */
    public AccountSnapshot latest() {
        AccountSnapshot snapshot = latest.get();
        return snapshot != null ? snapshot : refresh();
    }

    /** Latest polled snapshot, or null before the first successful poll. */
    public AccountSnapshot cached() {
        return latest.get();
    }
}
