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
import me.golemcore.monitor.domain.model.FetchResult;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceError;
import me.golemcore.monitor.domain.model.ServiceState;
import me.golemcore.monitor.domain.model.TokenValidationResult;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import me.golemcore.monitor.port.outbound.PreferencesPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The only writer of {@link ServiceState}.
 *
 * <p>
 * Every mutation happens under one lock and ends with a publication through
 * {@link StateBroadcaster}, so subscribers only ever observe complete values in
 * the order they were produced. The network call of a refresh runs outside the
 * lock. If the credential context changed in the meantime (preference switch,
 * manual token saved or cleared), the outcome is discarded and the fetch is
 * repeated with the current context.
 *
 * <p>
 * The previous snapshot survives failed refreshes. Only clearing the manual
 * token while it is in use empties it.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class UsageStateService {

    static final String PREFERRED_SOURCE_KEY = "preferredSource";
    static final int MAX_FETCH_ATTEMPTS = 3;

    private final ReentrantLock writeLock = new ReentrantLock();
    private final TokenResolver tokenResolver;
    private final UsageFetchPipeline fetchPipeline;
    private final StateBroadcaster broadcaster;
    private final PreferencesPort preferencesPort;
    private final UsageAlertService alertService;

    private ServiceState state;
    private long credentialEpoch;
    private long appliedEpoch = -1;

    public UsageStateService(TokenResolver tokenResolver, UsageFetchPipeline fetchPipeline,
            StateBroadcaster broadcaster, PreferencesPort preferencesPort, UsageAlertService alertService) {
        this.tokenResolver = tokenResolver;
        this.fetchPipeline = fetchPipeline;
        this.broadcaster = broadcaster;
        this.preferencesPort = preferencesPort;
        this.alertService = alertService;
        this.state = ServiceState.initial(loadPreferredSource());
        broadcaster.publish(state);
    }

    public ServiceState getState() {
        writeLock.lock();
        try {
            return state;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * First credential check. Leaves the initializing phase exactly once;
     * later calls do nothing.
     */
    public void initialize() {
        writeLock.lock();
        try {
            if (!state.isInitializing()) {
                return;
            }
            Provenance preferred = state.getPreferredProvenance();
            boolean available = tokenResolver.isAvailable(preferred);
            state = state.toBuilder()
                    .initializing(false)
                    .credentialAvailable(available)
                    .activeProvenance(available ? preferred : null)
                    .build();
            broadcaster.publish(state);
            log.info("[State] Initialized: preferred source {}, credential {}", preferred.getSecretName(),
                    available ? "available" : "missing");
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Fetch with the current preference and publish the outcome. A fetch whose
     * credential context changed while it was in flight is discarded and
     * repeated, up to {@value #MAX_FETCH_ATTEMPTS} attempts in total.
     *
     * @return {@code true} if an outcome was published
     */
    public boolean refreshNow() {
        for (int attempt = 1; attempt <= MAX_FETCH_ATTEMPTS; attempt++) {
            Provenance preferred;
            long epoch;
            writeLock.lock();
            try {
                preferred = state.getPreferredProvenance();
                epoch = credentialEpoch;
            } finally {
                writeLock.unlock();
            }

            FetchResult result = fetchPipeline.fetch(preferred);

            writeLock.lock();
            try {
                if (epoch != credentialEpoch) {
                    log.info("[State] Credential context changed during fetch, discarding result (attempt {}/{})",
                            attempt, MAX_FETCH_ATTEMPTS);
                    continue;
                }
                state = apply(state, result);
                appliedEpoch = epoch;
                broadcaster.publish(state);
            } finally {
                writeLock.unlock();
            }

            if (result.isSuccess()) {
                alertService.evaluate(result.getSnapshot());
            }
            return true;
        }
        log.warn("[State] Credential context kept changing, no refresh result published");
        return false;
    }

    /**
     * Whether the credential context changed since the last published fetch
     * outcome, or no outcome was published yet.
     */
    public boolean isCredentialContextStale() {
        writeLock.lock();
        try {
            return appliedEpoch != credentialEpoch;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Persist and apply a new preferred source. A fetch already in flight for
     * the old source is not published; it is repeated with the new one.
     *
     * @throws IllegalStateException
     *             if the preference could not be persisted
     */
    public void updatePreferredSource(Provenance provenance) {
        writeLock.lock();
        try {
            preferencesPort.put(PREFERRED_SOURCE_KEY, provenance.getSecretName());
            credentialEpoch++;
            boolean available = tokenResolver.isAvailable(provenance);
            state = state.toBuilder()
                    .preferredProvenance(provenance)
                    .credentialAvailable(available)
                    .activeProvenance(available ? provenance : null)
                    .build();
            broadcaster.publish(state);
            log.info("[State] Preferred source set to {}", provenance.getSecretName());
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * @throws IllegalArgumentException
     *             if the token is blank
     * @throws CredentialStoreException
     *             if the store rejects the write; the failure is also recorded
     *             as the last error
     */
    public void saveManualToken(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Token must not be blank");
        }
        writeLock.lock();
        try {
            storeManualToken(token.trim());
            if (state.getPreferredProvenance() == Provenance.MANUAL) {
                credentialEpoch++;
                state = state.toBuilder()
                        .credentialAvailable(true)
                        .activeProvenance(Provenance.MANUAL)
                        .build();
                broadcaster.publish(state);
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Delete the manual token. If it was in use, the snapshot and last update
     * time are cleared immediately.
     *
     * @throws CredentialStoreException
     *             if the store rejects the delete; the failure is also recorded
     *             as the last error
     */
    public void clearManualToken() {
        writeLock.lock();
        try {
            deleteManualToken();
            Provenance preferred = state.getPreferredProvenance();
            boolean manualInUse = preferred == Provenance.MANUAL
                    || state.getActiveProvenance() == Provenance.MANUAL;
            if (!manualInUse) {
                return;
            }
            credentialEpoch++;
            boolean available = tokenResolver.isAvailable(preferred);
            state = state.toBuilder()
                    .snapshot(UsageSnapshot.empty())
                    .lastUpdated(null)
                    .lastError(null)
                    .credentialAvailable(available)
                    .activeProvenance(available ? preferred : null)
                    .build();
            broadcaster.publish(state);
            log.info("[State] Manual token cleared, usage data reset");
        } finally {
            writeLock.unlock();
        }
    }

    public TokenValidationResult validateToken(String token) {
        if (token == null || token.isBlank()) {
            return TokenValidationResult.INVALID;
        }
        return fetchPipeline.validate(token.trim());
    }

    private void storeManualToken(String token) {
        try {
            tokenResolver.saveManualToken(token);
        } catch (CredentialStoreException e) {
            recordStoreFailure("save", e);
            throw e;
        }
    }

    private void deleteManualToken() {
        try {
            tokenResolver.deleteManualToken();
        } catch (CredentialStoreException e) {
            recordStoreFailure("delete", e);
            throw e;
        }
    }

    private void recordStoreFailure(String action, CredentialStoreException e) {
        log.warn("[State] Failed to {} manual token: {}", action, e.getMessage());
        state = state.toBuilder()
                .lastError(ServiceError.of(e.getKind(), e.getMessage()))
                .build();
        broadcaster.publish(state);
    }

    private static ServiceState apply(ServiceState current, FetchResult result) {
        ServiceState.ServiceStateBuilder next = current.toBuilder().initializing(false);
        if (!result.isCredentialResolved()) {
            return next.credentialAvailable(false)
                    .activeProvenance(null)
                    .lastError(result.getError())
                    .build();
        }
        next.credentialAvailable(true).activeProvenance(result.getProvenance());
        if (!result.isSuccess()) {
            return next.lastError(result.getError()).build();
        }
        return next.snapshot(result.getSnapshot())
                .lastUpdated(result.getSnapshot().getFetchedAt())
                .lastError(null)
                .build();
    }

    private Provenance loadPreferredSource() {
        try {
            return preferencesPort.get(PREFERRED_SOURCE_KEY)
                    .flatMap(Provenance::fromValue)
                    .orElse(Provenance.PRIMARY);
        } catch (RuntimeException e) {
            log.warn("[State] Failed to load preferred source, using primary: {}", e.getMessage());
            return Provenance.PRIMARY;
        }
    }
}
