package me.golemcore.monitor.adapter.inbound.web.dto;

import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.ServiceState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the monitor state as served over REST and WebSocket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceStateResponse {
    private boolean initializing;
    private List<UsageBucketDto> buckets;
    private Instant fetchedAt;
    private Instant lastUpdated;
    private ServiceErrorDto lastError;
    private String activeSource;
    private boolean hasCredential;
    private String preferredSource;

    public static ServiceStateResponse from(ServiceState state) {
        return ServiceStateResponse.builder()
                .initializing(state.isInitializing())
                .buckets(state.getSnapshot().getBuckets().stream()
                        .map(UsageBucketDto::from)
                        .toList())
                .fetchedAt(state.getSnapshot().getFetchedAt())
                .lastUpdated(state.getLastUpdated())
                .lastError(ServiceErrorDto.from(state.getLastError()))
                .activeSource(sourceName(state.getActiveProvenance()))
                .hasCredential(state.isCredentialAvailable())
                .preferredSource(sourceName(state.getPreferredProvenance()))
                .build();
    }

    private static String sourceName(Provenance provenance) {
        return provenance != null ? provenance.getSecretName() : null;
    }
}
