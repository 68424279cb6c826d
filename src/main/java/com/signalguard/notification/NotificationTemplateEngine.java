package com.signalguard.notification;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Renders alerts as Telegram HTML ({@code <b>bold</b>}) messages, one template per alert type.
 */
@Component
public class NotificationTemplateEngine {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    public String render(Alert alert) {
        return switch (alert.getType()) {
            case PENDING_CONFIRMATION -> renderConfirmation(alert);
            case SAFETY -> renderSafety(alert);
            case PROTECTION_FAILURE -> renderWithAction(
                    "PROTECTION FAILURE", alert, "Check the position on the exchange");
            case RECONCILIATION -> renderWithAction("RECONCILIATION", alert, null);
            case SIGNAL_REJECTED -> renderWithAction("SIGNAL REJECTED", alert, null);
            case FALLBACK -> renderWithAction("FALLBACK", alert, null);
            case POSITION, ANOMALY -> renderWithAction(alert.getTitle(), alert, null);
        };
    }

    private String renderConfirmation(Alert alert) {
        return String.format(
                "<b>CONFIRMATION NEEDED</b>\n<b>Symbol:</b> %s\n%s\n<b>Time:</b> %s",
                escape(alert.getSymbol()), escape(alert.getMessage()), TIME_FORMAT.format(alert.getTimestamp()));
    }

    private String renderSafety(Alert alert) {
        return String.format(
                "<b>SAFETY %s</b>\n%s\n<b>Time:</b> %s",
                escape(alert.getTitle()), escape(alert.getMessage()), TIME_FORMAT.format(alert.getTimestamp()));
    }

    private String renderWithAction(String heading, Alert alert, String action) {
        StringBuilder text = new StringBuilder()
                .append("<b>").append(escape(heading)).append("</b>\n");
        if (alert.getSymbol() != null) {
            text.append("<b>Symbol:</b> ").append(escape(alert.getSymbol())).append('\n');
        }
        text.append(escape(alert.getMessage())).append('\n');
        if (action != null) {
            text.append("<b>Action:</b> ").append(action).append('\n');
        }
        return text.append("<b>Time:</b> ").append(TIME_FORMAT.format(alert.getTimestamp())).toString();
    }

    /** Telegram HTML mode rejects unescaped angle brackets and ampersands. */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
