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
import me.golemcore.monitor.domain.model.Credential;
import me.golemcore.monitor.domain.model.FetchResult;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceError;
import me.golemcore.monitor.domain.model.TokenValidationResult;
import me.golemcore.monitor.domain.model.UsageResponse;
import me.golemcore.monitor.domain.model.UsageSnapshot;
import me.golemcore.monitor.port.outbound.UsageTransportPort;
import me.golemcore.monitor.port.outbound.UsageTransportPort.TransportResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Optional;

/**
 * Turns the preferred credential into a usage snapshot.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>Resolve the credential; without one the transport is not called</li>
 * <li>Send the request</li>
 * <li>On 401 from the first attempt, invalidate the resolver cache and run the
 * whole flow once more; the outcome of that second run is final</li>
 * <li>Decode and map the 2xx payload</li>
 * </ol>
 *
 * <p>
 * Never throws: every failure is returned as a {@link FetchResult} carrying a
 * {@link ServiceError}.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UsageFetchPipeline {

    private static final int HTTP_UNAUTHORIZED = 401;

    private final TokenResolver tokenResolver;
    private final UsageTransportPort transport;
    private final UsageResponseMapper mapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FetchResult fetch(Provenance preferred) {
        return fetch(preferred, true);
    }

    /**
     * Check a candidate token with one request. Caches and state are untouched.
     */
    public TokenValidationResult validate(String token) {
        try {
            TransportResponse response = transport.request(token);
            log.debug("[UsageApi] Token validation returned HTTP {}", response.status());
            return response.isSuccessful() ? TokenValidationResult.VALID : TokenValidationResult.INVALID;
        } catch (IOException | RuntimeException e) {
            log.debug("[UsageApi] Token validation failed: {}", e.getMessage());
            return TokenValidationResult.INVALID;
        }
    }

    private FetchResult fetch(Provenance preferred, boolean retryOnAuthFailure) {
        Optional<Credential> credential = tokenResolver.resolve(preferred);
        if (credential.isEmpty()) {
            String detail = tokenResolver.lastFailure(preferred)
                    .map(ServiceError::getDetail)
                    .orElse("No " + preferred.getSecretName() + " credential found");
            log.debug("[UsageApi] No credential for {}", preferred.getSecretName());
            return FetchResult.noCredential(ServiceError.noCredential(detail));
        }

        Provenance provenance = credential.get().provenance();
        TransportResponse response;
        try {
            response = transport.request(credential.get().token());
        } catch (IOException | RuntimeException e) {
            log.warn("[UsageApi] Request failed: {}", e.getMessage());
            return FetchResult.failure(provenance, ServiceError.network(e));
        }

        if (!response.isSuccessful()) {
            if (response.status() == HTTP_UNAUTHORIZED && retryOnAuthFailure) {
                log.info("[UsageApi] Unauthorized, reloading credential and retrying once");
                tokenResolver.invalidate();
                return fetch(preferred, false);
            }
            log.warn("[UsageApi] Request rejected with HTTP {}", response.status());
            return FetchResult.failure(provenance, ServiceError.http(response.status(), response.body()));
        }

        UsageSnapshot snapshot;
        try {
            UsageResponse payload = objectMapper.readValue(response.body(), UsageResponse.class);
            if (payload == null) {
                throw new UsageDecodingException("Empty usage payload");
            }
            snapshot = mapper.map(payload, clock.instant());
        } catch (JsonProcessingException | UsageDecodingException e) {
            log.warn("[UsageApi] Failed to decode usage payload: {}", e.getMessage());
            return FetchResult.failure(provenance, ServiceError.decoding(e));
        }

        tokenResolver.recordSuccess(provenance);
        log.debug("[UsageApi] Fetched {} buckets using {} credential", snapshot.getBuckets().size(),
                provenance.getSecretName());
        return FetchResult.success(provenance, snapshot);
    }
}
