package com.signalguard.event;

import com.signalguard.domain.enums.AlertSeverity;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Notify-only finding that needs operator attention but has no automatic resolution:
 * orphan positions, duplicate local records, invariant violations.
 */
public class AnomalyEvent extends ApplicationEvent {

    private final String code;
    private final AlertSeverity severity;
    private final String symbol;
    private final String message;
    private final Map<String, Object> details;

    public AnomalyEvent(
            Object source,
            String code,
            AlertSeverity severity,
            String symbol,
            String message,
            Map<String, Object> details) {
        super(source);
        this.code = code;
        this.severity = severity;
        this.symbol = symbol;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getCode() {
        return code;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

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
