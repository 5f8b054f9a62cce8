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

import java.util.Objects;

/**
 * A resolved access token together with the source it came from. The token is
 * never rendered by {@link #toString()}.
 */
public record Credential(String token, Provenance provenance) {

    public Credential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(provenance, "provenance");
    }

    @Override
    public String toString() {
        return "Credential[provenance=" + provenance + ", token=***]";
    }
}
