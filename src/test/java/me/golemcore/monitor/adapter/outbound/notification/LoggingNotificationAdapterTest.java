package me.golemcore.monitor.adapter.outbound.notification;

import me.golemcore.monitor.domain.model.UsageAlert;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoggingNotificationAdapterTest {

    private final LoggingNotificationAdapter adapter = new LoggingNotificationAdapter();

    @Test
    void shouldFormatRatioAsWholePercent() {
        assertEquals("80", LoggingNotificationAdapter.format(0.8));
        assertEquals("96", LoggingNotificationAdapter.format(0.956));
        assertEquals("0", LoggingNotificationAdapter.format(0.0));
    }

    @Test
    void shouldAcceptAlertsWithAndWithoutResetTime() {
        assertDoesNotThrow(() -> adapter.notify(new UsageAlert("five_hour", "Current session", 0.8, 0.85,
                Instant.parse("2026-02-01T15:00:00Z"))));
        assertDoesNotThrow(() -> adapter.notify(new UsageAlert("seven_day", "All models", 0.95, 0.99, null)));
    }
}
