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

import java.util.Locale;
import java.util.Optional;

/**
 * The source a credential was read from.
 *
 * <p>
 * The monitor knows exactly two sources:
 * <ul>
 * <li>{@link #PRIMARY} - the credential written by the CLI into its own
 * credentials entry (read-only for this application)</li>
 * <li>{@link #MANUAL} - a token entered by the user and owned by this
 * application</li>
 * </ul>
 *
 * @since 1.0
 */
public enum Provenance {

    PRIMARY("primary"), MANUAL("manual");

    private final String secretName;

    Provenance(String secretName) {
        this.secretName = secretName;
    }

    /**
     * Name of the secret in the credential store, also used as the persisted
     * preference value.
     */
    public String getSecretName() {
        return secretName;
    }

    public static Optional<Provenance> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Provenance provenance : values()) {
            if (provenance.secretName.equals(normalized)) {
                return Optional.of(provenance);
            }
        }
        return Optional.empty();
    }
}
