package me.golemcore.monitor.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered buckets produced by one successful fetch.
 */
@Value
@Builder
public class UsageSnapshot {

    private static final UsageSnapshot EMPTY = UsageSnapshot.builder().build();

    @Singular
    List<UsageBucket> buckets;

    /** Fetch time, {@code null} for the empty snapshot. */
    Instant fetchedAt;

    public static UsageSnapshot empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public Optional<UsageBucket> findBucket(String id) {
        return buckets.stream()
                .filter(bucket -> bucket.getId().equals(id))
                .findFirst();
    }
}
