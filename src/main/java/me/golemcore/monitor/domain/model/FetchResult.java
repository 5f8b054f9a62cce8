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
import lombok.Value;

/**
 * Outcome of one pipeline run, including the retry if one happened.
 *
 * <p>
 * Factory methods {@link #success(Provenance, UsageSnapshot)},
 * {@link #failure(Provenance, ServiceError)} and
 * {@link #noCredential(ServiceError)} cover the three terminal shapes.
 */
@Value
@Builder
public class FetchResult {

    /** Source of the credential that was sent, {@code null} if none resolved. */
    Provenance provenance;

    UsageSnapshot snapshot;

    ServiceError error;

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isCredentialResolved() {
        return provenance != null;
    }

    public static FetchResult success(Provenance provenance, UsageSnapshot snapshot) {
        return FetchResult.builder()
                .provenance(provenance)
                .snapshot(snapshot)
                .build();
    }

    public static FetchResult failure(Provenance provenance, ServiceError error) {
        return FetchResult.builder()
                .provenance(provenance)
                .error(error)
                .build();
    }

    public static FetchResult noCredential(ServiceError error) {
        return FetchResult.builder()
                .error(error)
                .build();
    }
}
