package com.signalguard.oms;

import com.signalguard.domain.model.SignalIntent;
import com.signalguard.exception.SignalValidationException;
import java.math.BigDecimal;
import org.springframework.stereotype.Component;

/**
 * Checks the required fields of each {@link SignalIntent} variant at the ingestion boundary.
 * Downstream components never re-validate shape.
 */
@Component
public class SignalIntentValidator {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    /**
     * @throws SignalValidationException naming the first missing or malformed field
     */
    public void validate(SignalIntent signal) {
        if (signal == null) {
            throw new SignalValidationException(null, "signal is null");
        }
        String id = signal.getSignalId();
        require(id != null && !id.isBlank(), id, "signalId is required");
        require(signal.getKind() != null, id, "kind is required");
        require(signal.getSourceVersion() >= 1, id, "sourceVersion must be >= 1");
        require(inUnitRange(signal.getQuality()), id, "quality must be in [0, 1]");
        require(inUnitRange(signal.getConfidence()), id, "confidence must be in [0, 1]");

        switch (signal.getKind()) {
            case ENTRY_SIGNAL -> validateEntry(signal);
            case MANAGE_ACTION -> validateManage(signal);
            case NON_SIGNAL -> {
                // recorded only
            }
        }
    }

    private void validateEntry(SignalIntent signal) {
        String id = signal.getSignalId();
        require(hasText(signal.getSymbol()), id, "symbol is required for an entry");
        require(signal.getSide() != null, id, "side is required for an entry");
        require(signal.getEntryType() != null, id, "entryType is required for an entry");
        require(signal.getEntryLow() != null && signal.getEntryHigh() != null, id, "entryLow and entryHigh are required");
        require(signal.getEntryLow().signum() > 0 && signal.getEntryHigh().signum() > 0, id, "entry prices must be positive");
        require(signal.getEntryLow().compareTo(signal.getEntryHigh()) <= 0, id, "entryLow must not exceed entryHigh");
        if (signal.getEntryPoints() != null) {
            for (BigDecimal point : signal.getEntryPoints()) {
                require(point != null && point.signum() > 0, id, "entry points must be positive");
            }
        }
        require(signal.getStopLoss() == null || signal.getStopLoss().signum() > 0, id, "stopLoss must be positive");
        require(signal.getLeverage() == null || signal.getLeverage() >= 1, id, "leverage must be >= 1");
        if (signal.getTakeProfits() != null) {
            for (BigDecimal target : signal.getTakeProfits()) {
                require(target != null && target.signum() > 0, id, "take-profit targets must be positive");
            }
        }
    }

    private void validateManage(SignalIntent signal) {
        String id = signal.getSignalId();
        require(hasText(signal.getSymbol()), id, "symbol is required for a manage action");
        boolean hasReduce = signal.getReducePct() != null;
        boolean hasTakeProfit = signal.getTakeProfitPrice() != null;
        require(hasReduce || hasTakeProfit || signal.isMoveStopToBreakEven(), id, "manage action carries no action");
        if (hasReduce) {
            require(
                    signal.getReducePct().signum() > 0 && signal.getReducePct().compareTo(HUNDRED) <= 0,
                    id,
                    "reducePct must be in (0, 100]");
        }
        if (hasTakeProfit) {
            require(signal.getTakeProfitPrice().signum() > 0, id, "takeProfitPrice must be positive");
        }
    }

    private static void require(boolean condition, String signalId, String message) {
        if (!condition) {
            throw new SignalValidationException(signalId, message);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean inUnitRange(double value) {
        return value >= 0.0 && value <= 1.0;
    }
}
