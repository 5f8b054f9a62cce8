package me.golemcore.monitor.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.monitor.adapter.inbound.web.dto.ManualTokenRequest;
import me.golemcore.monitor.adapter.inbound.web.dto.PreferredSourceRequest;
import me.golemcore.monitor.adapter.inbound.web.dto.RefreshResponse;
import me.golemcore.monitor.adapter.inbound.web.dto.ServiceStateResponse;
import me.golemcore.monitor.adapter.inbound.web.dto.SourcesResponse;
import me.golemcore.monitor.adapter.inbound.web.dto.TokenValidationResponse;
import me.golemcore.monitor.domain.model.Provenance;
import me.golemcore.monitor.domain.model.TokenValidationResult;
import me.golemcore.monitor.domain.service.UsageMonitorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Plan usage state and credential settings endpoints.
 *
 * <p>
 * Actions that touch the credential store or the network run on the
 * bounded-elastic scheduler.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageMonitorService usageMonitorService;

    @GetMapping("/state")
    public Mono<ResponseEntity<ServiceStateResponse>> getState() {
        return Mono.just(ResponseEntity.ok(currentState()));
    }

    @GetMapping("/sources")
    public Mono<ResponseEntity<SourcesResponse>> getSources() {
        return blocking(() -> {
            Map<String, Boolean> available = new LinkedHashMap<>();
            usageMonitorService.getSourceAvailability()
                    .forEach((provenance, isAvailable) -> available.put(provenance.getSecretName(), isAvailable));
            SourcesResponse response = SourcesResponse.builder()
                    .preferredSource(usageMonitorService.getCurrentState().getPreferredProvenance().getSecretName())
                    .available(available)
                    .build();
            return ResponseEntity.ok(response);
        });
    }

    @PostMapping("/refresh")
    public Mono<ResponseEntity<RefreshResponse>> refresh() {
        return blocking(() -> ResponseEntity.ok(new RefreshResponse(usageMonitorService.refresh())));
    }

    @PutMapping("/preferred-source")
    public Mono<ResponseEntity<ServiceStateResponse>> setPreferredSource(
            @RequestBody PreferredSourceRequest request) {
        Provenance provenance = Provenance.fromValue(request.getSource())
                .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + request.getSource()));
        return blocking(() -> {
            usageMonitorService.setPreferredSource(provenance);
            return ResponseEntity.ok(currentState());
        });
    }

    @PutMapping("/manual-token")
    public Mono<ResponseEntity<ServiceStateResponse>> saveManualToken(@RequestBody ManualTokenRequest request) {
        return blocking(() -> {
            usageMonitorService.saveManualToken(request.getToken());
            return ResponseEntity.ok(currentState());
        });
    }

    @DeleteMapping("/manual-token")
    public Mono<ResponseEntity<ServiceStateResponse>> clearManualToken() {
        return blocking(() -> {
            usageMonitorService.clearManualToken();
            return ResponseEntity.ok(currentState());
        });
    }

    @PostMapping("/manual-token/validate")
    public Mono<ResponseEntity<TokenValidationResponse>> validateToken(@RequestBody ManualTokenRequest request) {
        return blocking(() -> {
            TokenValidationResult result = usageMonitorService.validateToken(request.getToken());
            return ResponseEntity.ok(new TokenValidationResponse(result == TokenValidationResult.VALID));
        });
    }

    private ServiceStateResponse currentState() {
        return ServiceStateResponse.from(usageMonitorService.getCurrentState());
    }

    private static <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(Schedulers.boundedElastic());
    }
}
