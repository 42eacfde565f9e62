package com.jreinhal.cafefinder.exception;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Should pass plain messages through")
    void shouldKeepPlainMessages() {
        assertEquals("Query rejected", GlobalExceptionHandler.sanitizeExceptionMessage("Query rejected"));
    }

    @Test
    @DisplayName("Should hide paths, class names and stack fragments")
    void shouldHideInternals() {
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("Cannot read /etc/corpus/people.json"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("bad value for com.jreinhal.cafefinder.Foo"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("NumberFormatException: x"));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage("x".repeat(201)));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(null));
        assertEquals("Invalid request", GlobalExceptionHandler.sanitizeExceptionMessage(" "));
    }

    @Test
    @DisplayName("Should shape error bodies with an error and a timestamp")
    void shouldShapeErrorBody() {
        ResponseEntity<Map<String, Object>> response = handler.handleBadRequest(new IllegalArgumentException("Bad limit"));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Bad limit", response.getBody().get("error"));
        assertEquals(2, response.getBody().size());
    }

    @Test
    @DisplayName("Should not leak the cause of an index failure")
    void shouldHideIndexFailureCause() {
        ResponseEntity<Map<String, Object>> response = handler.handleIndexFailure(
                new IndexInitializationException("Failed to build search indexes", new IllegalStateException("disk full")));

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("Search index unavailable", response.getBody().get("error"));
    }
}
