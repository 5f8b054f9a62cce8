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

import me.golemcore.monitor.domain.exception.CredentialStoreException;
import me.golemcore.monitor.domain.model.Credential;
import me.golemcore.monitor.domain.model.ErrorKind;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceError;
import me.golemcore.monitor.infrastructure.config.MonitorProperties;
import me.golemcore.monitor.port.outbound.CredentialStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves the access token for a requested {@link Provenance}.
 *
 * <p>
 * Each provenance has its own cache entry. A missing entry means "not loaded";
 * a loaded entry may hold a token or record that no usable token was found, so
 * repeated lookups of an absent secret do not hit the store again. Absent
 * entries expire after {@code monitor.credentials.absent-retry-interval}.
 *
 * <p>
 * {@link #resolve(Provenance)} only ever looks at the requested provenance;
 * there is no fallback to the other source.
 *
 * <p>
 * All methods are synchronized on this instance, which makes cache reads,
 * invalidation and manual token writes mutually exclusive.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class TokenResolver {

    private final CredentialStorePort credentialStore;
    private final Clock clock;
    private final Duration absentRetryInterval;
    private final Map<Provenance, Function<byte[], String>> readers = new EnumMap<>(Provenance.class);
    private final Map<Provenance, CacheEntry> cache = new EnumMap<>(Provenance.class);

    private Provenance lastSuccessfulProvenance;

    public TokenResolver(CredentialStorePort credentialStore, PrimaryCredentialParser primaryParser,
            MonitorProperties properties, Clock clock) {
        this.credentialStore = credentialStore;
        this.clock = clock;
        this.absentRetryInterval = properties.getCredentials().getAbsentRetryInterval();
        readers.put(Provenance.PRIMARY, primaryParser::parse);
        readers.put(Provenance.MANUAL, TokenResolver::readManual);
    }

    public synchronized Optional<Credential> resolve(Provenance preferred) {
        CacheEntry entry = entryFor(preferred);
        if (entry.token() == null) {
            return Optional.empty();
        }
        return Optional.of(new Credential(entry.token(), preferred));
    }

    /**
     * Forget every cached entry; the next lookup re-reads the store.
     */
    public synchronized void invalidate() {
        cache.clear();
        log.debug("[TokenResolver] Cache invalidated");
    }

    public synchronized boolean isAvailable(Provenance provenance) {
        return entryFor(provenance).token() != null;
    }

    /**
     * Why the last load of {@code provenance} produced no token, if it failed
     * for a reason other than the secret being absent.
     */
    public synchronized Optional<ServiceError> lastFailure(Provenance provenance) {
        CacheEntry entry = cache.get(provenance);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.failure());
    }

    /**
     * Store a manual token, replacing any existing one.
     *
     * @throws CredentialStoreException
     *             if the store rejects the write
     */
    public synchronized void saveManualToken(String token) {
        credentialStore.write(Provenance.MANUAL.getSecretName(), token.getBytes(StandardCharsets.UTF_8));
        cache.put(Provenance.MANUAL, CacheEntry.present(token, clock.instant()));
        log.info("[TokenResolver] Manual token saved");
    }

    /**
     * Remove the manual token. Removing an absent token is not an error.
     */
    public synchronized void deleteManualToken() {
        credentialStore.delete(Provenance.MANUAL.getSecretName());
        cache.put(Provenance.MANUAL, CacheEntry.absent(null, clock.instant()));
        if (lastSuccessfulProvenance == Provenance.MANUAL) {
            lastSuccessfulProvenance = null;
        }
        log.info("[TokenResolver] Manual token deleted");
    }

    public synchronized void recordSuccess(Provenance provenance) {
        lastSuccessfulProvenance = provenance;
    }

    public synchronized Optional<Provenance> getLastSuccessfulProvenance() {
        return Optional.ofNullable(lastSuccessfulProvenance);
    }

    private CacheEntry entryFor(Provenance provenance) {
        CacheEntry entry = cache.get(provenance);
        Instant now = clock.instant();
        if (entry == null || entry.isExpired(now, absentRetryInterval)) {
            entry = load(provenance, now);
            cache.put(provenance, entry);
        }
        return entry;
    }

    private CacheEntry load(Provenance provenance, Instant now) {
        try {
            Optional<byte[]> secret = credentialStore.read(provenance.getSecretName());
            if (secret.isEmpty()) {
                log.debug("[TokenResolver] No {} credential in store", provenance.getSecretName());
                return CacheEntry.absent(null, now);
            }
            String token = readers.get(provenance).apply(secret.get());
            if (token == null || token.isBlank()) {
                return CacheEntry.absent(null, now);
            }
            log.debug("[TokenResolver] Loaded {} credential", provenance.getSecretName());
            return CacheEntry.present(token, now);
        } catch (CredentialStoreException e) {
            log.warn("[TokenResolver] Failed to read {} credential: {}", provenance.getSecretName(), e.getMessage());
            return CacheEntry.absent(ServiceError.of(e.getKind(), e.getMessage()), now);
        } catch (RuntimeException e) {
            log.warn("[TokenResolver] Failed to read {} credential: {}", provenance.getSecretName(), e.getMessage());
            return CacheEntry.absent(ServiceError.of(ErrorKind.UNEXPECTED_STATUS, e.getMessage()), now);
        }
    }

    private static String readManual(byte[] secret) {
        return new String(secret, StandardCharsets.UTF_8).trim();
    }

    private record CacheEntry(String token, ServiceError failure, Instant loadedAt) {

        static CacheEntry present(String token, Instant loadedAt) {
            return new CacheEntry(token, null, loadedAt);
        }

        static CacheEntry absent(ServiceError failure, Instant loadedAt) {
            return new CacheEntry(null, failure, loadedAt);
        }

        boolean isExpired(Instant now, Duration absentRetryInterval) {
            return token == null && !now.isBefore(loadedAt.plus(absentRetryInterval));
        }
    }
}
