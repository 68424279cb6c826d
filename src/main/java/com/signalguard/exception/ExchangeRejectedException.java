package com.signalguard.exception;

import lombok.Getter;

/**
 * Permanent refusal by the exchange (bad parameters, insufficient margin, unknown order).
 * Never retried.
 */
@Getter
public class ExchangeRejectedException extends ExchangeException {

    private final String exchangeCode;

    public ExchangeRejectedException(String exchangeCode, String message) {
        super(ErrorCode.EXCHANGE_REJECTED, message);
        this.exchangeCode = exchangeCode;
    }

    /** {@code EXCHANGE_REJECTED:<venue code>}, so refusals of different kinds stay apart in the ledger. */
    @Override
    public String getReasonCode() {
        return exchangeCode == null ? super.getReasonCode() : super.getReasonCode() + ":" + exchangeCode;
    }
}
