package com.signalguard.notification;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API delivery settings.
 *
 * <pre>
 * signalguard.telegram.enabled=false
 * signalguard.telegram.bot-token=${TELEGRAM_BOT_TOKEN:}
 * signalguard.telegram.chat-id=${TELEGRAM_CHAT_ID:}
 * signalguard.telegram.max-messages-per-minute=20
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "signalguard.telegram")
public class TelegramConfig {

    private boolean enabled = false;
    private String botToken;
    private String chatId;
    private int maxMessagesPerMinute = 20;
}
