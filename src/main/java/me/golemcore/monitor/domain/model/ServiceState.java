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
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable snapshot of everything the monitor knows. Exactly one value is
 * current at any time; subscribers only ever receive complete values.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ServiceState {

    /** True until the first credential check has completed. */
    boolean initializing;

    @NonNull
    @Builder.Default
    UsageSnapshot snapshot = UsageSnapshot.empty();

    /** Time of the last successful fetch, {@code null} if none is retained. */
    Instant lastUpdated;

    ServiceError lastError;

    /** Source of the credential used by the most recent resolution. */
    Provenance activeProvenance;

    /** Whether the most recent resolution found a credential. */
    boolean credentialAvailable;

    @NonNull
    Provenance preferredProvenance;

    public static ServiceState initial(Provenance preferredProvenance) {
        return ServiceState.builder()
                .initializing(true)
                .preferredProvenance(preferredProvenance)
                .build();
    }
}
