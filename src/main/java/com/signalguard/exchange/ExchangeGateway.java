package com.signalguard.exchange;

import com.signalguard.domain.enums.CapabilityKind;
import com.signalguard.domain.enums.CapabilityStatus;
import com.signalguard.domain.model.AccountSnapshot;
import com.signalguard.domain.model.ExchangePosition;
import com.signalguard.domain.model.ExchangeOrder;
import com.signalguard.domain.model.OrderResult;
import com.signalguard.domain.model.OrderSpec;
import com.signalguard.domain.model.PriceTick;
import com.signalguard.domain.model.SymbolRules;
import java.util.List;

/**
 * Authenticated access to a derivatives exchange.
 *
 * <p>Implementations raise {@link com.signalguard.exception.TransientExchangeException} for network,
 * timeout and rate-limit failures and {@link com.signalguard.exception.ExchangeRejectedException}
 * for permanent refusals. Callers never invoke a gateway directly; every call goes through
 * {@link ExchangeCallExecutor}.
 */
public interface ExchangeGateway {

    /**
     * Returns equity (including unrealized P&L), available balance and used margin.
     */
    AccountSnapshot getBalance();

    /**
     * Returns all non-zero positions.
     */
    List<ExchangePosition> getPositions();

    /**
     * Returns all open orders, including resting trigger (plan) orders.
     */
    List<ExchangeOrder> getOpenOrders();

    /**
     * Places an order.
     *
     * @param spec the order instruction; closing orders carry reduce-only or a close trade-side
     * @return the exchange order id and any immediate fill
     */
    OrderResult placeOrder(OrderSpec spec);

    /**
     * Cancels an open order.
     */
    void cancelOrder(String symbol, String orderId);

    /**
     * Returns quantity/price precision, minimum size and tradability for a contract.
     */
    SymbolRules getSymbolRules(String symbol);

    /**
     * Probes whether the account supports a capability.
     *
     * @return SUPPORTED or UNSUPPORTED when the exchange answered; an inconclusive probe throws
     *     a transient exception instead of guessing
     */
    CapabilityStatus probeCapability(CapabilityKind kind);

    /**
     * Returns the latest price, reporting whether it came from a stream or a poll.
     */
    PriceTick streamOrPollPrice(String symbol);
}
