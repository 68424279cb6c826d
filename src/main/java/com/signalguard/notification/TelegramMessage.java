package com.signalguard.notification;

import com.signalguard.domain.enums.AlertSeverity;
import lombok.Builder;
import lombok.Data;

/** Queued outbound message; the queue orders by severity, then age. */
@Data
@Builder
public class TelegramMessage {

    private String text;
    private AlertSeverity severity;
    private long timestamp;
}
