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

import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceState;
import me.golemcore.monitor.domain.model.TokenValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Entry point for consumers of the usage monitor: lifecycle, user actions and
 * the state stream.
 *
 * <p>
 * State is only readable through {@link StateBroadcaster}; user actions go
 * through the single writer and, where they change which credential is used,
 * trigger a refresh.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageMonitorService {

    private final UsageStateService stateService;
    private final RefreshScheduler refreshScheduler;
    private final StateBroadcaster broadcaster;
    private final TokenResolver tokenResolver;

    public void start() {
        log.info("[Monitor] Starting usage monitor");
        refreshScheduler.start();
    }

    public void shutdown() {
        refreshScheduler.shutdown();
    }

    /**
     * @return {@code false} if a refresh was already in flight or its outcome
     *         could not be published
     */
    public boolean refresh() {
        return refreshScheduler.refresh();
    }

    public void setPreferredSource(Provenance provenance) {
        stateService.updatePreferredSource(provenance);
        refreshScheduler.refresh();
    }

    public void saveManualToken(String token) {
        stateService.saveManualToken(token);
        refreshScheduler.refresh();
    }

    public void clearManualToken() {
        stateService.clearManualToken();
    }

    public TokenValidationResult validateToken(String token) {
        return stateService.validateToken(token);
    }

    public ServiceState getCurrentState() {
        return broadcaster.current();
    }

    public Flux<ServiceState> states() {
        return broadcaster.states();
    }

    public Disposable subscribe(Consumer<ServiceState> subscriber) {
        return broadcaster.subscribe(subscriber);
    }

    public void unsubscribe(Disposable handle) {
        broadcaster.unsubscribe(handle);
    }

    public Map<Provenance, Boolean> getSourceAvailability() {
        Map<Provenance, Boolean> availability = new EnumMap<>(Provenance.class);
        for (Provenance provenance : Provenance.values()) {
            availability.put(provenance, tokenResolver.isAvailable(provenance));
        }
        return availability;
    }
}
