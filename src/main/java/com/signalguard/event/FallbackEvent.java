package com.signalguard.event;

import com.signalguard.domain.enums.FallbackType;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the system degrades to a weaker mode: plan orders replaced by a local guard,
 * or the price feed dropping from streaming to polling.
 */
public class FallbackEvent extends ApplicationEvent {

    private final FallbackType fallbackType;
    private final String symbol;
    private final String message;
    private final Map<String, Object> details;

    public FallbackEvent(
            Object source, FallbackType fallbackType, String symbol, String message, Map<String, Object> details) {
        super(source);
        this.fallbackType = fallbackType;
        this.symbol = symbol;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public FallbackType getFallbackType() {
        return fallbackType;
    }

    /** Null for account-wide fallbacks. */
    public String getSymbol() {
        return symbol;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
