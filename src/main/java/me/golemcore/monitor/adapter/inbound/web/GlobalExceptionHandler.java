package me.golemcore.monitor.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.monitor.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.monitor.domain.exception.CredentialStoreException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for usage API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.monitor.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(CredentialStoreException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCredentialStore(CredentialStoreException ex) {
        log.warn("[API] Credential store failure ({}): {}", ex.getKind(), ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getKind().getFailureReason(),
                ex.getKind().getRecoverySuggestion());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message,
            String recoverySuggestion) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .recoverySuggestion(recoverySuggestion)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
