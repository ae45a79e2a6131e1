package me.golemcore.gurgeh.adapter.inbound.web;

import me.golemcore.gurgeh.adapter.inbound.web.dto.ApiErrorResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldHandleResponseStatusException() {
        ResponseStatusException ex = new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Both 'from' and 'message' are required");

        StepVerifier.create(handler.handleResponseStatus(ex))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(400, body.getStatus());
                    assertEquals("Both 'from' and 'message' are required", body.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("An awakening is already in progress")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
                    assertEquals(409, response.getBody().getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("bad cron")))
                .assertNext(response -> assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret stack detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
