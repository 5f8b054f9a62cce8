package me.golemcore.monitor.port.outbound;

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

import me.golemcore.monitor.domain.exception.CredentialStoreException;

import java.util.Optional;

/**
 * Port for reading and writing named secrets.
 *
 * <p>
 * Two names are used by the monitor: {@code primary}, written by the CLI and
 * only ever read here, and {@code manual}, owned by this application.
 * Implementations report store-level failures as
 * {@link CredentialStoreException}.
 */
public interface CredentialStorePort {

    /**
     * Read the raw secret bytes.
     *
     * @return the secret, or empty if no entry exists under {@code name}
     */
    Optional<byte[]> read(String name);

    /**
     * Store a secret, replacing any existing entry.
     */
    void write(String name, byte[] secret);

    /**
     * Delete a secret. Deleting an absent entry is not an error.
     */
    void delete(String name);
}
