package me.golemcore.monitor.adapter.inbound.web;

import me.golemcore.monitor.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.monitor.domain.exception.CredentialStoreException;
import me.golemcore.monitor.domain.model.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Unknown source: x")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertEquals(400, body.getStatus());
                    assertEquals("Unknown source: x", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapCredentialStoreFailureWithRecoverySuggestion() {
        CredentialStoreException exception = new CredentialStoreException(ErrorKind.DUPLICATE_ITEM, "exists");

        StepVerifier.create(handler.handleCredentialStore(exception))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals(ErrorKind.DUPLICATE_ITEM.getFailureReason(), response.getBody().getMessage());
                    assertEquals(ErrorKind.DUPLICATE_ITEM.getRecoverySuggestion(),
                            response.getBody().getRecoverySuggestion());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Failed to persist preferences")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldMapResponseStatusException() {
        StepVerifier.create(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND, "nope")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
                    assertEquals("nope", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                    assertNull(response.getBody().getRecoverySuggestion());
                })
                .verifyComplete();
    }
}
