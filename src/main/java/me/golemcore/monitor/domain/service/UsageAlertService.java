package me.golemcore.monitor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.monitor.domain.model.UsageAlert;
import me.golemcore.monitor.domain.model.UsageBucket;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raises an alert when a bucket's utilization crosses a configured threshold
 * upward.
 *
 * <p>
 * Each bucket remembers the highest threshold already reported. It re-arms
 * when the bucket's reset time changes (a new window started) or when
 * utilization drops below the lowest threshold.
 */
@Service
@Slf4j
public class UsageAlertService {

    private final NotificationPort notificationPort;
    private final boolean enabled;
    private final List<Double> thresholds;
    private final Map<String, Notified> notified = new HashMap<>();

    public UsageAlertService(NotificationPort notificationPort, MonitorProperties properties) {
        this.notificationPort = notificationPort;
        this.enabled = properties.getAlerts().isEnabled();
        this.thresholds = properties.getAlerts().getThresholds().stream()
                .filter(Objects::nonNull)
                .filter(threshold -> threshold > 0.0 && threshold <= 1.0)
                .sorted()
                .distinct()
                .toList();
    }

    /**
     * Evaluate a freshly fetched snapshot and deliver any new alerts.
     *
     * @return the alerts that were raised
     */
    public synchronized List<UsageAlert> evaluate(UsageSnapshot snapshot) {
        if (!enabled || thresholds.isEmpty() || snapshot == null) {
            return List.of();
        }

        double lowest = thresholds.get(0);
        List<UsageAlert> raised = new ArrayList<>();
        for (UsageBucket bucket : snapshot.getBuckets()) {
            Notified previous = notified.get(bucket.getId());
            if (previous != null && (!Objects.equals(previous.resetAt(), bucket.getResetAt())
                    || bucket.getUtilizationRatio() < lowest)) {
                notified.remove(bucket.getId());
                previous = null;
            }

            Double crossed = highestCrossed(bucket.getUtilizationRatio());
            if (crossed == null || (previous != null && crossed <= previous.threshold())) {
                continue;
            }

            notified.put(bucket.getId(), new Notified(crossed, bucket.getResetAt()));
            UsageAlert alert = new UsageAlert(bucket.getId(), bucket.getTitle(), crossed,
                    bucket.getUtilizationRatio(), bucket.getResetAt());
            raised.add(alert);
            deliver(alert);
        }
        return raised;
    }

    private Double highestCrossed(double ratio) {
        Double crossed = null;
        for (Double threshold : thresholds) {
            if (ratio >= threshold) {
                crossed = threshold;
            }
        }
        return crossed;
    }

    private void deliver(UsageAlert alert) {
        try {
            notificationPort.notify(alert);
        } catch (RuntimeException e) {
            log.warn("[Alerts] Failed to deliver alert for {}: {}", alert.bucketId(), e.getMessage());
        }
    }

    private record Notified(double threshold, Instant resetAt) {
    }
}
