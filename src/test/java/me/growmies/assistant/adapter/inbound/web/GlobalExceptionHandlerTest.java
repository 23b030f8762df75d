package me.growmies.assistant.adapter.inbound.web;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void illegalArgumentIsBadRequest() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Unknown category: x.")))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.BAD_REQUEST, entity.getStatusCode());
                    assertEquals(400, entity.getBody().getStatus());
                    assertEquals("Unknown category: x.", entity.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void illegalStateIsConflict() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("save failed")))
                .assertNext(entity -> assertEquals(HttpStatus.CONFLICT, entity.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void responseStatusKeepsStatus() {
        StepVerifier.create(handler.handleResponseStatus(new ResponseStatusException(HttpStatus.NOT_FOUND, "gone")))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.NOT_FOUND, entity.getStatusCode());
                    assertEquals("gone", entity.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void unexpectedErrorsHideDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret")))
                .assertNext(entity -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, entity.getStatusCode());
                    assertEquals("Internal server error", entity.getBody().getMessage());
                })
                .verifyComplete();
    }
}
