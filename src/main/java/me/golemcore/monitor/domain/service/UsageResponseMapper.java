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

import me.golemcore.monitor.domain.exception.UsageDecodingException;
import me.golemcore.monitor.domain.model.UsageBucket;
import me.golemcore.monitor.domain.model.UsageBucketType;
import me.golemcore.monitor.domain.model.UsageResponse;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Maps the raw usage payload to an ordered {@link UsageSnapshot}.
 *
 * <p>
 * Buckets appear in {@link UsageBucketType} declaration order. Buckets that are
 * not always shown are dropped when their utilization is zero and the payload
 * carries no reset time at all; a malformed reset time still keeps the bucket.
 */
@Component
@Slf4j
public class UsageResponseMapper {

    private static final double PERCENT = 100.0;

    public UsageSnapshot map(UsageResponse response, Instant fetchedAt) {
        UsageSnapshot.UsageSnapshotBuilder snapshot = UsageSnapshot.builder().fetchedAt(fetchedAt);

        for (UsageBucketType type : UsageBucketType.values()) {
            UsageResponse.Bucket raw = response.bucketFor(type);
            if (raw == null) {
                continue;
            }
            if (raw.getUtilization() == null) {
                throw new UsageDecodingException("Missing utilization for bucket " + type.getId());
            }

            double ratio = toRatio(raw.getUtilization());
            Instant resetAt = parseResetAt(type, raw.getResetsAt());
            if (!type.isAlwaysShown() && ratio <= 0.0 && raw.getResetsAt() == null) {
                continue;
            }

            snapshot.bucket(UsageBucket.builder()
                    .id(type.getId())
                    .title(type.getTitle())
                    .utilizationRatio(ratio)
                    .resetAt(resetAt)
                    .build());
        }
        return snapshot.build();
    }

    private static double toRatio(double percent) {
        if (Double.isNaN(percent)) {
            throw new UsageDecodingException("Utilization is not a number");
        }
        return Math.max(0.0, Math.min(1.0, percent / PERCENT));
    }

    /**
     * Accepts ISO-8601 with or without fractional seconds. Malformed values are
     * treated as unknown.
     */
    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim(), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant parseResetAt(UsageBucketType type, String value) {
        Instant parsed = parseDate(value);
        if (parsed == null && value != null && !value.isBlank()) {
            log.debug("[UsageApi] Ignoring malformed resets_at for {}: {}", type.getId(), value);
        }
        return parsed;
    }
}
