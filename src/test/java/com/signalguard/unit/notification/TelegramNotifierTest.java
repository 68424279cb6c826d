package com.signalguard.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalguard.domain.enums.AlertSeverity;
import com.signalguard.notification.TelegramConfig;
import com.signalguard.notification.TelegramNotifier;
import com.signalguard.unit.support.MutableClock;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Tests for TelegramNotifier: disabled mode, CRITICAL bypassing the limiter, queueing once the
 * per-minute budget is spent, and swallowing delivery failures.
 */
class TelegramNotifierTest {

    private TelegramConfig telegramConfig;
    private RestTemplate restTemplate;
    private TelegramNotifier telegramNotifier;

    @BeforeEach
    void setUp() {
        telegramConfig = new TelegramConfig();
        restTemplate = mock(RestTemplate.class);
        telegramNotifier = new TelegramNotifier(
                telegramConfig, restTemplate, new MutableClock(Instant.parse("2026-03-02T10:00:00Z")));
    }

    private void enable() {
        telegramConfig.setEnabled(true);
        telegramConfig.setBotToken("test-token");
        telegramConfig.setChatId("12345");
    }

    @Test
    void send_disabled_doesNothing() {
        telegramNotifier.send("test message", AlertSeverity.INFO);

        assertThat(telegramNotifier.getQueueSize()).isZero();
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
    }

    @Test
    void send_enabledWithoutToken_doesNothing() {
        telegramConfig.setEnabled(true);

        telegramNotifier.send("test message", AlertSeverity.CRITICAL);

        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
    }

    @Test
    @SuppressWarnings("unchecked")
    void send_enabled_postsHtmlToBotApi() {
        enable();

        telegramNotifier.send("<b>SAFETY</b>", AlertSeverity.WARNING);

        ArgumentCaptor<HttpEntity<Map<String, Object>>> captor = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).postForEntity(
                eq("https://api.telegram.org/bottest-token/sendMessage"), captor.capture(), eq(String.class));
        Map<String, Object> payload = captor.getValue().getBody();
        assertThat(payload).containsEntry("chat_id", "12345").containsEntry("parse_mode", "HTML");
        assertThat((String) payload.get("text")).endsWith("<b>SAFETY</b>");
    }

    @Test
    void send_critical_bypassesRateLimiter() {
        enable();
        int permitsBefore = telegramNotifier.getAvailablePermits();

        telegramNotifier.send("panic close", AlertSeverity.CRITICAL);

        assertThat(telegramNotifier.getAvailablePermits()).isEqualTo(permitsBefore);
        assertThat(telegramNotifier.getQueueSize()).isZero();
    }

    @Test
    void send_info_consumesPermit() {
        enable();
        int permitsBefore = telegramNotifier.getAvailablePermits();

        telegramNotifier.send("position closed", AlertSeverity.INFO);

        assertThat(telegramNotifier.getAvailablePermits()).isEqualTo(permitsBefore - 1);
    }

    @Test
    void rateLimiter_exhausted_queuesMessage() {
        enable();
        telegramNotifier.drainPermits();

        telegramNotifier.send("queued msg", AlertSeverity.INFO);

        assertThat(telegramNotifier.getQueueSize()).isEqualTo(1);
        verify(restTemplate, never()).postForEntity(anyString(), any(), eq(String.class));
    }

    @Test
    void rateLimiter_exhausted_criticalStillDelivered() {
        enable();
        telegramNotifier.drainPermits();

        telegramNotifier.send("stop failed", AlertSeverity.CRITICAL);

        assertThat(telegramNotifier.getQueueSize()).isZero();
        verify(restTemplate, times(1)).postForEntity(anyString(), any(), eq(String.class));
    }

    @Test
    void deliveryFailure_isSwallowed() {
        enable();
        when(restTemplate.postForEntity(anyString(), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("connection refused"));

        assertThatCode(() -> telegramNotifier.send("reconciliation", AlertSeverity.WARNING))
                .doesNotThrowAnyException();
    }
}
