package com.signalguard.notification;

import com.signalguard.domain.enums.AlertSeverity;
import java.time.Clock;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends alerts through the Telegram Bot API.
 *
 * <p>Outbound messages are limited to {@code max-messages-per-minute}. Messages over the limit
 * wait in a priority queue, CRITICAL first. CRITICAL messages skip the limiter entirely so a
 * panic close or a failed stop is never held back behind routine notices.
 *
 * <p>Delivery failures are logged and dropped; nothing here throws into the caller.
 */
@Component
public class TelegramNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotifier.class);

    private static final String TELEGRAM_API_URL = "https://api.telegram.org/bot%s/sendMessage";
    private static final int QUEUE_CAPACITY = 200;

    private final TelegramConfig telegramConfig;
    private final RestTemplate restTemplate;
    private final Clock clock;
    private final Semaphore rateLimiter;
    private final long permitReleaseMillis;

    private final BlockingQueue<TelegramMessage> messageQueue = new PriorityBlockingQueue<>(
            QUEUE_CAPACITY,
            Comparator.comparingInt((TelegramMessage m) -> severityRank(m.getSeverity()))
                    .thenComparingLong(TelegramMessage::getTimestamp));

    @Autowired
    public TelegramNotifier(TelegramConfig telegramConfig, Clock clock) {
        this(telegramConfig, new RestTemplate(), clock);
    }

    public TelegramNotifier(TelegramConfig telegramConfig, RestTemplate restTemplate, Clock clock) {
        this.telegramConfig = telegramConfig;
        this.restTemplate = restTemplate;
        this.clock = clock;
        int perMinute = Math.max(1, telegramConfig.getMaxMessagesPerMinute());
        this.rateLimiter = new Semaphore(perMinute);
        this.permitReleaseMillis = TimeUnit.MINUTES.toMillis(1) / perMinute;
    }

    public void send(String text, AlertSeverity severity) {
        if (!telegramConfig.isEnabled()) {
            log.debug("Telegram disabled, dropping: {}", text);
            return;
        }
        if (telegramConfig.getBotToken() == null || telegramConfig.getBotToken().isBlank()) {
            log.warn("Telegram enabled without bot token; message not sent");
            return;
        }

        TelegramMessage message = TelegramMessage.builder()
                .text(text)
                .severity(severity)
                .timestamp(clock.millis())
                .build();

        if (severity == AlertSeverity.CRITICAL) {
            deliver(message);
            return;
        }
        if (rateLimiter.tryAcquire()) {
            deliver(message);
            scheduleRelease();
        } else if (messageQueue.size() < QUEUE_CAPACITY) {
            messageQueue.offer(message);
            log.warn("Telegram rate limit reached, message queued. Queue size: {}", messageQueue.size());
        } else {
            log.error("Telegram queue full, dropping {} message", severity);
        }
    }

    @Scheduled(fixedRate = 1000)
    public void processQueue() {
        while (!messageQueue.isEmpty() && rateLimiter.tryAcquire()) {
            TelegramMessage message = messageQueue.poll();
            if (message == null) {
                rateLimiter.release();
                return;
            }
            deliver(message);
            scheduleRelease();
        }
    }

    private void deliver(TelegramMessage message) {
        String url = String.format(TELEGRAM_API_URL, telegramConfig.getBotToken());
        Map<String, Object> payload = Map.of(
                "chat_id", telegramConfig.getChatId() != null ? telegramConfig.getChatId() : "",
                "text", severityPrefix(message.getSeverity()) + " " + message.getText(),
                "parse_mode", "HTML",
                "disable_web_page_preview", true);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(payload, headers), String.class);
            log.debug("Telegram {} message delivered", message.getSeverity());
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message: {}", e.getMessage());
        }
    }

    private void scheduleRelease() {
        CompletableFuture.delayedExecutor(permitReleaseMillis, TimeUnit.MILLISECONDS).execute(rateLimiter::release);
    }

    private static String severityPrefix(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "\u26A0\uFE0F";
            case WARNING -> "\u26A1";
            case INFO -> "\u2139\uFE0F";
        };
    }

    private static int severityRank(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> 0;
            case WARNING -> 1;
            case INFO -> 2;
        };
    }

    /** Visible for testing. */
    public int getQueueSize() {
        return messageQueue.size();
    }

    public int getAvailablePermits() {
        return rateLimiter.availablePermits();
    }

    /** Visible for testing: the next non-critical send is queued. */
    public void drainPermits() {
        rateLimiter.drainPermits();
    }
}
