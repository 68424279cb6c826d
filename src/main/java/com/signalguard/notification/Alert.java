package com.signalguard.notification;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.domain.enums.AlertType;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An operator alert built from an application event and handed to the delivery channel.
 */
@Data
@Builder
public class Alert {

    private AlertType type;
    private AlertSeverity severity;
    private String title;
    private String message;
    private String symbol;

    @Builder.Default
    private Instant timestamp = Instant.now();
}
